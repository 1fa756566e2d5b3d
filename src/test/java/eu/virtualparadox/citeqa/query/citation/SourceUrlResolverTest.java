package eu.virtualparadox.citeqa.query.citation;

import eu.virtualparadox.citeqa.application.config.ApplicationConfig;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SourceUrlResolver}.
 */
class SourceUrlResolverTest {

    private ApplicationConfig props;
    private SourceUrlResolver resolver;

    private final ExcerptItem item = new ExcerptItem("e1", "doc1", "AML Handbook", "AML Handbook 2023.pdf",
            "text", 1f, 3, null, null, Map.of());

    @BeforeEach
    void setUp() {
        props = new ApplicationConfig();
        resolver = new SourceUrlResolver(props);
    }

    @Test
    @DisplayName("Manifest location wins")
    void testManifestFirst() {
        final ManifestEntry entry = new ManifestEntry("AML Handbook", "aml.pdf", "https://example.org/aml.pdf");
        assertEquals("https://example.org/aml.pdf", resolver.resolveSourceUri(entry, item));
    }

    @Test
    @DisplayName("Item metadata is used without a manifest location")
    void testMetadataSecond() {
        final ExcerptItem withUri = new ExcerptItem("e1", "doc1", "T", "f.pdf", "text", 1f, 3, null, null,
                Map.of("sourceUri", "gs://archive/docs/f.pdf"));
        assertEquals("gs://archive/docs/f.pdf", resolver.resolveSourceUri(new ManifestEntry("T", null, " "), withUri));
    }

    @Test
    @DisplayName("Bucket convention builds the location from the filename")
    void testBucketConvention() {
        assertNull(resolver.resolveSourceUri(null, item));

        props.getSources().setBucket("kb-bucket");
        assertEquals("gs://kb-bucket/sources/AML Handbook 2023.pdf", resolver.resolveSourceUri(null, item));
    }

    @Test
    @DisplayName("Storage locations become encoded browser links")
    void testBrowserUrl() {
        assertEquals("https://storage.cloud.google.com/kb-bucket/sources/AML%20Handbook%202023.pdf",
                resolver.toBrowserUrl("gs://kb-bucket/sources/AML Handbook 2023.pdf"));
        assertEquals("https://example.org/a.pdf", resolver.toBrowserUrl("https://example.org/a.pdf"));
        assertNull(resolver.toBrowserUrl(null));
        assertNull(resolver.toBrowserUrl(" "));
    }
}
