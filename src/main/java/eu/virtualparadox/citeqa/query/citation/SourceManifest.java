package eu.virtualparadox.citeqa.query.citation;

import java.util.Optional;

/**
 * Source metadata lookup.
 */
public interface SourceManifest {

    Optional<ManifestEntry> lookup(String sourceId);
}
