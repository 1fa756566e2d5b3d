package eu.virtualparadox.citeqa.query;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.application.executor.QuestionExecutor;
import eu.virtualparadox.citeqa.query.citation.CitationExtractor;
import eu.virtualparadox.citeqa.query.citation.CitedSourceFilter;
import eu.virtualparadox.citeqa.query.citation.ExtractedCitations;
import eu.virtualparadox.citeqa.query.citation.SourceAttribution;
import eu.virtualparadox.citeqa.query.citation.SourceAttributionService;
import eu.virtualparadox.citeqa.query.citation.SourceRecord;
import eu.virtualparadox.citeqa.query.history.ConversationHistoryProvider;
import eu.virtualparadox.citeqa.query.history.ConversationTurn;
import eu.virtualparadox.citeqa.query.question.EQuestionStatus;
import eu.virtualparadox.citeqa.query.question.QuestionJob;
import eu.virtualparadox.citeqa.query.question.QuestionRegistry;
import eu.virtualparadox.citeqa.rag.answer.context.BudgetedContext;
import eu.virtualparadox.citeqa.rag.answer.context.ContextBudgeter;
import eu.virtualparadox.citeqa.rag.answer.context.TokenEstimator;
import eu.virtualparadox.citeqa.rag.answer.format.FormatClassifier;
import eu.virtualparadox.citeqa.rag.answer.format.FormatDecision;
import eu.virtualparadox.citeqa.rag.answer.generation.AnswerService;
import eu.virtualparadox.citeqa.rag.answer.generation.GeneratedAnswer;
import eu.virtualparadox.citeqa.rag.answer.prompt.PromptAssembler;
import eu.virtualparadox.citeqa.rag.expand.QueryExpander;
import eu.virtualparadox.citeqa.rag.rerank.service.RerankService;
import eu.virtualparadox.citeqa.rag.retriever.analysis.AdaptiveLimitPolicy;
import eu.virtualparadox.citeqa.rag.retriever.analysis.FilterHint;
import eu.virtualparadox.citeqa.rag.retriever.analysis.MetadataFilterBuilder;
import eu.virtualparadox.citeqa.rag.retriever.analysis.QueryAnalyzer;
import eu.virtualparadox.citeqa.rag.retriever.analysis.QueryCharacteristics;
import eu.virtualparadox.citeqa.rag.retriever.analysis.SearchStrategy;
import eu.virtualparadox.citeqa.rag.retriever.analysis.SearchStrategySelector;
import eu.virtualparadox.citeqa.rag.retriever.fusion.FusedRetrieval;
import eu.virtualparadox.citeqa.rag.retriever.fusion.ResultFusionService;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievalLimits;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import eu.virtualparadox.citeqa.rag.retriever.model.TwoTierRetrieval;
import eu.virtualparadox.citeqa.rag.retriever.service.TwoTierRetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static eu.virtualparadox.citeqa.query.question.EQuestionStatus.*;

/**
 * Runs a question through the whole pipeline: expansion, two-tier retrieval, fusion, reranking,
 * context budgeting, format inference, generation and citation handling.
 * <p>
 * Every stage degrades on its own, so {@link #answer(AnswerRequest)} always returns a complete
 * {@link AnswerResult}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryManager {

    private final QueryAnalyzer queryAnalyzer;
    private final AdaptiveLimitPolicy limitPolicy;
    private final MetadataFilterBuilder filterBuilder;
    private final SearchStrategySelector strategySelector;
    private final QueryExpander queryExpander;
    private final TwoTierRetrieverService retrieverService;
    private final ResultFusionService fusionService;
    private final RerankService rerankService;
    private final ContextBudgeter contextBudgeter;
    private final FormatClassifier formatClassifier;
    private final PromptAssembler promptAssembler;
    private final AnswerService answerService;
    private final SourceAttributionService attributionService;
    private final CitationExtractor citationExtractor;
    private final CitedSourceFilter citedSourceFilter;
    private final ConversationHistoryProvider historyProvider;
    private final QuestionRegistry registry;
    private final QuestionExecutor questionExecutor;
    private final ApplicationConfig props;

    public AnswerResult answer(final AnswerRequest request) {
        return run(request, status -> { });
    }

    public QuestionJob submitQuery(final AnswerRequest request) {
        final QuestionJob job = registry.createJob(request);
        questionExecutor.submit(() -> process(job));
        return job;
    }

    public Optional<QuestionJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }

    private void process(final QuestionJob job) {
        try {
            final AnswerResult result = run(job.getRequest(), status -> registry.updateStatus(job.getId(), status));
            registry.complete(job.getId(), result);
        } catch (Exception ex) {
            log.error("Job {} failed", job.getId(), ex);
            registry.fail(job.getId(), ex.getMessage());
        }
    }

    private AnswerResult run(final AnswerRequest request, final Consumer<EQuestionStatus> progress) {
        final String query = request.query();
        final ApplicationConfig.Retriever retrieverProps = props.getRetriever();

        final QueryCharacteristics characteristics = queryAnalyzer.analyze(query);
        log.info("Query analysis: type={}, complexity={}, scope={}, words={}",
                characteristics.type(), characteristics.complexity(), characteristics.scope(), characteristics.wordCount());

        final SearchStrategy strategy = strategySelector.select(characteristics);

        progress.accept(EXPANDING);
        final List<String> variants = strategy.queryExpansion()
                ? queryExpander.expand(query)
                : List.of(query);

        progress.accept(RETRIEVING);
        final RetrievalLimits limits = strategy.restrict(limitPolicy.limitsFor(characteristics));
        final String filter = resolveFilter(request, characteristics);
        final TwoTierRetrieval retrieval = retrieverService.retrieve(variants, limits, filter);
        final FusedRetrieval fused = fusionService.fuse(retrieval);
        printDebugRetrieved(fused);

        progress.accept(RERANKING);
        final List<SummaryItem> summaries = rankTier(query, fused.summaries(), limits.maxSummaries());
        final List<ExcerptItem> excerpts = rankTier(query, fused.excerpts(), limits.maxExcerpts());

        progress.accept(ANSWERING);
        final BudgetedContext context = contextBudgeter.fit(summaries, excerpts);
        final FormatDecision format = resolveFormat(query);
        final List<ConversationTurn> history = request.history().isEmpty()
                ? historyProvider.history(request.sessionId())
                : request.history();

        final String prompt = promptAssembler.assemble(query, format, context, history);
        final int estimatedPromptTokens = TokenEstimator.estimate(prompt, props.getSynthesizer().getCharsPerToken());
        log.debug(" !!! Prompt ({} estimated tokens):\n{}", estimatedPromptTokens, prompt);

        final GeneratedAnswer generated = answerService.generate(
                query, prompt, format, context.summaries().size(), request.sessionId());

        final SourceAttribution attribution = attributionService.attribute(context.summaries(), context.excerpts());
        final ExtractedCitations extracted = citationExtractor.extract(generated.text(), attribution);
        final List<SourceRecord> citedSources = citedSourceFilter.filter(attribution.sources(), extracted.citations());
        log.info(" !!! Answer by {} with {} citations over {} cited sources",
                generated.modelUsed(), extracted.citations().size(), citedSources.size());

        return AnswerResult.builder()
                .query(query)
                .queryVariants(variants)
                .answer(extracted.mainAnswer())
                .fullAnswer(extracted.fullAnswer())
                .citations(extracted.citations())
                .sources(citedSources)
                .contextSources(attribution.sources())
                .summariesUsed(context.summaries().size())
                .excerptsUsed(context.excerpts().size())
                .modelUsed(generated.modelUsed())
                .format(format)
                .temperature(format.temperature())
                .usage(generated.usage())
                .estimatedPromptTokens(estimatedPromptTokens)
                .queryExpanded(variants.size() > 1)
                .reranked(retrieverProps.isRerankingEnabled())
                .deduplicated(retrieverProps.isDeduplicationEnabled())
                .contextTruncated(context.truncated())
                .build();
    }

    private String resolveFilter(final AnswerRequest request, final QueryCharacteristics characteristics) {
        if (StringUtils.isNotBlank(request.filter())) {
            return request.filter();
        }

        final List<FilterHint> hints;
        if (!request.filterHints().isEmpty()) {
            hints = request.filterHints();
        } else if (props.getRetriever().isAutoFilterEnabled()) {
            hints = characteristics.filterHints();
        } else {
            return null;
        }

        final String filter = filterBuilder.build(hints, props.getRetriever().getFilterLogic());
        log.info("Applying metadata filter: {}", filter);
        return filter;
    }

    private <T extends RetrievedItem> List<T> rankTier(final String query, final List<T> items, final int tierLimit) {
        final ApplicationConfig.Retriever retrieverProps = props.getRetriever();
        if (!retrieverProps.isRerankingEnabled()) {
            return items.size() <= tierLimit ? items : items.subList(0, tierLimit);
        }
        final Integer topK = retrieverProps.getRerankTopK() != null ? retrieverProps.getRerankTopK() : tierLimit;
        return rerankService.rerank(query, items, topK);
    }

    private FormatDecision resolveFormat(final String query) {
        final FormatDecision format = formatClassifier.classify(query);
        final ApplicationConfig.Synthesizer synthesizer = props.getSynthesizer();
        log.info("Detected format: {} (temperature {})", format.formatType(), format.temperature());
        if (synthesizer.isAdaptiveTemperatureEnabled()) {
            return format;
        }
        return format.withTemperature(synthesizer.getDefaultTemperature());
    }

    private void printDebugRetrieved(final FusedRetrieval fused) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final SummaryItem s : fused.summaries()) {
            sb.append(" - [summary ").append(s.score()).append("] ").append(s.title()).append("\n");
        }
        for (final ExcerptItem e : fused.excerpts()) {
            sb.append(" - [excerpt ").append(e.score()).append("] ")
                    .append(StringUtils.abbreviate(e.content(), 120)).append("\n");
        }
        log.debug(" !!! Fused items:\n{}", sb);
    }
}
