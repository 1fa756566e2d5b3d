package eu.virtualparadox.citeqa.query.citation;

import eu.virtualparadox.citeqa.query.citation.pageinterval.PageRangeFormatter;
import eu.virtualparadox.citeqa.rag.retriever.model.ETier;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Attribution of one source document: where it lives and which parts of it were used.
 * <p>
 * Filled while the context items are walked, then {@link #finish() finished} once: pages are
 * sorted and the page range is formatted. A finished record rejects further changes.
 */
@Getter
public class SourceRecord {

    private final String sourceId;
    private final String title;
    private final String filename;
    /** Tier of the first item that referenced the source. */
    private final ETier type;
    private String sourceUri;
    private String url;
    private final List<Integer> pages = new ArrayList<>();
    private final List<TimeRange> timestamps = new ArrayList<>();
    private String pageRange;
    @Getter(AccessLevel.NONE)
    private boolean finished;

    public SourceRecord(final String sourceId,
                        final String title,
                        final String filename,
                        final ETier type,
                        final String sourceUri,
                        final String url) {
        this.sourceId = sourceId;
        this.title = title;
        this.filename = filename;
        this.type = type;
        this.sourceUri = sourceUri;
        this.url = url;
    }

    public List<Integer> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public List<TimeRange> getTimestamps() {
        return Collections.unmodifiableList(timestamps);
    }

    void addPage(final int page) {
        ensureOpen();
        if (!pages.contains(page)) {
            pages.add(page);
        }
    }

    void addTimeRange(final TimeRange range) {
        ensureOpen();
        if (!timestamps.contains(range)) {
            timestamps.add(range);
        }
    }

    /**
     * Sets the location only if none is known yet.
     */
    void offerLocation(final String newSourceUri, final String newUrl) {
        ensureOpen();
        if (url == null && newUrl != null) {
            this.sourceUri = sourceUri == null ? newSourceUri : sourceUri;
            this.url = newUrl;
        }
    }

    void finish() {
        ensureOpen();
        Collections.sort(pages);
        pageRange = pages.isEmpty() ? null : PageRangeFormatter.format(pages);
        finished = true;
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Source record " + sourceId + " is already finished");
        }
    }
}
