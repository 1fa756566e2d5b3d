package eu.virtualparadox.citeqa.rag.retriever.model;

import java.util.Map;

/**
 * @param id        Identifier of the excerpt in the excerpt tier.
 * @param sourceId  Identifier of the parent source document.
 * @param title     Title of the parent source, may be {@code null}.
 * @param filename  Original filename of the parent source, may be {@code null}.
 * @param content   The excerpt text.
 * @param score     Relevance score as returned by the tier (higher = better).
 * @param page      Page anchor, {@code null} for time-based sources.
 * @param startSec  Start of the time anchor in seconds, {@code null} for paged sources.
 * @param endSec    End of the time anchor in seconds, may be {@code null}.
 * @param metadata  Raw stored fields of the hit.
 */
public record ExcerptItem(String id,
                          String sourceId,
                          String title,
                          String filename,
                          String content,
                          float score,
                          Integer page,
                          Double startSec,
                          Double endSec,
                          Map<String, Object> metadata) implements RetrievedItem {

    public ExcerptItem {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean hasPage() {
        return page != null;
    }

    public boolean hasTimeRange() {
        return startSec != null;
    }

    @Override
    public String text() {
        return content == null ? "" : content;
    }

    /**
     * @return a copy of this item carrying the given text
     */
    public ExcerptItem withText(final String text) {
        return new ExcerptItem(id, sourceId, title, filename, text, score, page, startSec, endSec, metadata);
    }

    /**
     * Source plus location. Excerpts without a source or without any anchor fall back to their id.
     */
    @Override
    public String identityKey() {
        if (sourceId == null || sourceId.isBlank() || (page == null && startSec == null)) {
            return "excerpt:" + id;
        }
        return sourceId + ":" + (page == null ? "" : page) + ":" + (startSec == null ? "" : startSec);
    }

    @Override
    public ETier tier() {
        return ETier.EXCERPT;
    }
}
