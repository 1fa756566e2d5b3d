package eu.virtualparadox.citeqa.query.citation;

import eu.virtualparadox.citeqa.rag.retriever.model.ETier;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import eu.virtualparadox.citeqa.util.TimestampFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds one {@link SourceRecord} per source referenced by the context of an answer.
 * The process:
 * <ol>
 *   <li>Walk the summaries, then the excerpts, in prompt order.</li>
 *   <li>Resolve each item's title: item title, manifest title, filename, source id, then
 *       {@code Document n} / {@code Chunk n}. These titles also label the prompt entries.</li>
 *   <li>Create the source's record on first sight, with its storage location and browser link.</li>
 *   <li>Collect pages and time ranges of the excerpts per source.</li>
 *   <li>Finish every record: sort the pages and format the page range.</li>
 * </ol>
 *
 * <p><strong>Ordering:</strong> records come in the order their source is first encountered.</p>
 *
 * <p>Manifest lookups are cached for the duration of one call; a failing lookup counts as
 * "not found".</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SourceAttributionService {

    private final SourceManifest sourceManifest;
    private final SourceUrlResolver sourceUrlResolver;

    public SourceAttribution attribute(final List<SummaryItem> summaries, final List<ExcerptItem> excerpts) {
        Objects.requireNonNull(summaries, "summaries must not be null");
        Objects.requireNonNull(excerpts, "excerpts must not be null");

        final Map<String, Optional<ManifestEntry>> manifestCache = new HashMap<>();
        final Map<String, SourceRecord> recordsBySourceId = new LinkedHashMap<>();
        final Map<Integer, String> documentLabels = new HashMap<>();
        final Map<Integer, String> chunkLabels = new HashMap<>();

        for (int i = 0; i < summaries.size(); i++) {
            final SummaryItem summary = summaries.get(i);
            final ManifestEntry manifestEntry = lookup(summary.sourceId(), manifestCache);
            final String title = resolveTitle(summary, manifestEntry, "Document " + (i + 1));
            documentLabels.put(i + 1, title);

            if (StringUtils.isNotBlank(summary.sourceId())) {
                recordsBySourceId.computeIfAbsent(summary.sourceId(),
                        id -> newRecord(summary, manifestEntry, title));
            }
        }

        for (int i = 0; i < excerpts.size(); i++) {
            final ExcerptItem excerpt = excerpts.get(i);
            final ManifestEntry manifestEntry = lookup(excerpt.sourceId(), manifestCache);
            final String title = resolveTitle(excerpt, manifestEntry, "Chunk " + (i + 1));
            chunkLabels.put(i + 1, title);

            if (StringUtils.isBlank(excerpt.sourceId())) {
                continue;
            }

            SourceRecord record = recordsBySourceId.get(excerpt.sourceId());
            if (record == null) {
                record = newRecord(excerpt, manifestEntry, title);
                recordsBySourceId.put(excerpt.sourceId(), record);
            } else {
                final String sourceUri = sourceUrlResolver.resolveSourceUri(manifestEntry, excerpt);
                record.offerLocation(sourceUri, sourceUrlResolver.toBrowserUrl(sourceUri));
            }

            if (excerpt.hasPage()) {
                record.addPage(excerpt.page());
            }
            if (excerpt.hasTimeRange()) {
                final double end = excerpt.endSec() == null ? excerpt.startSec() : excerpt.endSec();
                record.addTimeRange(new TimeRange(
                        TimestampFormatter.format(excerpt.startSec()), TimestampFormatter.format(end)));
            }
        }

        final List<SourceRecord> sources = new ArrayList<>(recordsBySourceId.values());
        for (final SourceRecord record : sources) {
            record.finish();
        }

        log.debug("Attributed {} sources from {} summaries and {} excerpts", sources.size(), summaries.size(), excerpts.size());
        return new SourceAttribution(sources, documentLabels, chunkLabels);
    }

    private SourceRecord newRecord(final RetrievedItem item, final ManifestEntry manifestEntry, final String title) {
        final String sourceUri = sourceUrlResolver.resolveSourceUri(manifestEntry, item);
        final String filename = StringUtils.firstNonBlank(
                item.filename(),
                manifestEntry == null ? null : manifestEntry.filename(),
                item.sourceId());
        final ETier type = item.tier();
        return new SourceRecord(item.sourceId(), title, filename, type, sourceUri, sourceUrlResolver.toBrowserUrl(sourceUri));
    }

    private static String resolveTitle(final RetrievedItem item, final ManifestEntry manifestEntry, final String positional) {
        final String title = StringUtils.firstNonBlank(
                item.title(),
                manifestEntry == null ? null : manifestEntry.title(),
                item.filename(),
                item.sourceId());
        return title == null ? positional : title;
    }

    private ManifestEntry lookup(final String sourceId, final Map<String, Optional<ManifestEntry>> cache) {
        if (StringUtils.isBlank(sourceId)) {
            return null;
        }
        return cache.computeIfAbsent(sourceId, this::lookupQuietly).orElse(null);
    }

    private Optional<ManifestEntry> lookupQuietly(final String sourceId) {
        try {
            return sourceManifest.lookup(sourceId);
        } catch (RuntimeException e) {
            log.warn("Manifest lookup failed for source {}: {}", sourceId, e.getMessage());
            return Optional.empty();
        }
    }
}
