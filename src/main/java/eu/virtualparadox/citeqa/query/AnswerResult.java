package eu.virtualparadox.citeqa.query;

import eu.virtualparadox.citeqa.query.citation.SourceRecord;
import eu.virtualparadox.citeqa.rag.answer.format.FormatDecision;
import eu.virtualparadox.citeqa.rag.llm.TokenUsage;
import lombok.Builder;

import java.util.List;

/**
 * Outcome of one pass through the answer pipeline. Always well formed, also on degraded paths.
 *
 * @param answer               answer body without the citation trailer
 * @param fullAnswer           complete answer with document labels replaced by titles
 * @param citations            distinct citations in order of appearance
 * @param sources              sources actually cited by the answer
 * @param contextSources       every source that contributed to the prompt
 * @param modelUsed            model that produced the answer, {@code fallback-none} if none did
 * @param estimatedPromptTokens prompt size estimate, characters per token
 */
@Builder
public record AnswerResult(String query,
                           List<String> queryVariants,
                           String answer,
                           String fullAnswer,
                           List<String> citations,
                           List<SourceRecord> sources,
                           List<SourceRecord> contextSources,
                           int summariesUsed,
                           int excerptsUsed,
                           String modelUsed,
                           FormatDecision format,
                           double temperature,
                           TokenUsage usage,
                           int estimatedPromptTokens,
                           boolean queryExpanded,
                           boolean reranked,
                           boolean deduplicated,
                           boolean contextTruncated) {
}
