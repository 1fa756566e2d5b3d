package eu.virtualparadox.citeqa.query.citation;

/**
 * What the catalog knows about a source.
 *
 * @param title        display title, may be {@code null}
 * @param filename     original filename, may be {@code null}
 * @param canonicalUri storage location, may be {@code null}
 */
public record ManifestEntry(String title, String filename, String canonicalUri) {
}
