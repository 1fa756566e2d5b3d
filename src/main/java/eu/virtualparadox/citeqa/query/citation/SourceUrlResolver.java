package eu.virtualparadox.citeqa.query.citation;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.ItemMetadata;
import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds where a source lives and turns that into a link a browser can open.
 * <p>
 * The storage location is, in order: the manifest URI, the {@code sourceUri} metadata of the
 * item, or {@code gs://<bucket>/<prefix><filename>} when a bucket is configured.
 * {@code gs://} locations become storage browser links; any other URI is used as is.
 */
@Component
@RequiredArgsConstructor
public class SourceUrlResolver {

    private static final String GS_SCHEME = "gs://";

    private final ApplicationConfig props;

    /**
     * @return the storage location, or {@code null} if none can be derived
     */
    public String resolveSourceUri(final ManifestEntry manifestEntry, final RetrievedItem item) {
        if (manifestEntry != null && StringUtils.isNotBlank(manifestEntry.canonicalUri())) {
            return manifestEntry.canonicalUri();
        }

        final Object metadataUri = item.metadata().get(ItemMetadata.SOURCE_URI);
        if (metadataUri != null && StringUtils.isNotBlank(metadataUri.toString())) {
            return metadataUri.toString();
        }

        final String filename = StringUtils.firstNonBlank(
                item.filename(), manifestEntry == null ? null : manifestEntry.filename());
        final ApplicationConfig.Sources sources = props.getSources();
        if (StringUtils.isBlank(sources.getBucket()) || filename == null) {
            return null;
        }
        return GS_SCHEME + sources.getBucket() + "/" + StringUtils.defaultString(sources.getPrefix()) + filename;
    }

    /**
     * @return a browsable URL, or {@code null} for a blank URI
     */
    public String toBrowserUrl(final String sourceUri) {
        if (StringUtils.isBlank(sourceUri)) {
            return null;
        }
        if (!sourceUri.startsWith(GS_SCHEME)) {
            return sourceUri;
        }

        final String path = sourceUri.substring(GS_SCHEME.length());
        final List<String> segments = new ArrayList<>();
        for (final String segment : path.split("/", -1)) {
            segments.add(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        final String base = props.getSources().getBrowserBaseUrl();
        return StringUtils.appendIfMissing(base, "/") + String.join("/", segments);
    }
}
