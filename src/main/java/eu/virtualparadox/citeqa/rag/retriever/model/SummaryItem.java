package eu.virtualparadox.citeqa.rag.retriever.model;

import java.util.List;
import java.util.Map;

/**
 * @param id           Identifier of the summary in the summary tier.
 * @param sourceId     Identifier of the summarized source document.
 * @param title        Title of the source, may be {@code null}.
 * @param filename     Original filename of the source, may be {@code null}.
 * @param summaryText  Document-level summary.
 * @param score        Relevance score as returned by the tier.
 * @param author       Author, may be {@code null}.
 * @param organization Authoring organization, may be {@code null}.
 * @param date         Publication date as stored (ISO), may be {@code null}.
 * @param tags         Topic tags, never {@code null}.
 * @param metadata     Raw stored fields of the hit.
 */
public record SummaryItem(String id,
                          String sourceId,
                          String title,
                          String filename,
                          String summaryText,
                          float score,
                          String author,
                          String organization,
                          String date,
                          List<String> tags,
                          Map<String, Object> metadata) implements RetrievedItem {

    public SummaryItem {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String text() {
        return summaryText == null ? "" : summaryText;
    }

    public SummaryItem withText(final String text) {
        return new SummaryItem(id, sourceId, title, filename, text, score, author, organization, date, tags, metadata);
    }

    @Override
    public String identityKey() {
        if (sourceId == null || sourceId.isBlank()) {
            return "summary:" + id;
        }
        return sourceId;
    }

    @Override
    public ETier tier() {
        return ETier.SUMMARY;
    }
}
