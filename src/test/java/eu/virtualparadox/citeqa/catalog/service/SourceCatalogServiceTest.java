package eu.virtualparadox.citeqa.catalog.service;

import eu.virtualparadox.citeqa.catalog.entity.SourceEntity;
import eu.virtualparadox.citeqa.catalog.repo.SourceRepository;
import eu.virtualparadox.citeqa.query.citation.ManifestEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link SourceCatalogService}.
 */
class SourceCatalogServiceTest {

    private SourceRepository repository;
    private SourceCatalogService service;

    @BeforeEach
    void setUp() {
        repository = mock(SourceRepository.class);
        when(repository.save(any(SourceEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        service = new SourceCatalogService(repository);
    }

    @Test
    void registersNewSourceWithTrimmedFields() {
        when(repository.findById("doc1")).thenReturn(Optional.empty());

        final SourceEntity saved = service.register("doc1", "  AML Handbook ", " ", "gs://kb/sources/aml.pdf");

        assertThat(saved.getTitle()).isEqualTo("AML Handbook");
        assertThat(saved.getFilename()).isNull();
        assertThat(saved.getCanonicalUri()).isEqualTo("gs://kb/sources/aml.pdf");
        assertThat(saved.getAddedAt()).isNotNull();
    }

    @Test
    void reRegistrationKeepsOriginalTimestamp() {
        final Instant addedAt = Instant.parse("2024-01-15T10:00:00Z");
        when(repository.findById("doc1")).thenReturn(Optional.of(
                new SourceEntity("doc1", "Old title", "old.pdf", null, addedAt)));

        final SourceEntity saved = service.register("doc1", "New title", "new.pdf", null);

        assertThat(saved.getTitle()).isEqualTo("New title");
        assertThat(saved.getAddedAt()).isEqualTo(addedAt);
    }

    @Test
    void rejectsBlankId() {
        assertThrows(IllegalArgumentException.class, () -> service.register(" ", "t", "f", null));
        verify(repository, never()).save(any());
    }

    @Test
    void lookupMapsEntityToManifestEntry() {
        when(repository.findById("doc1")).thenReturn(Optional.of(
                new SourceEntity("doc1", "AML Handbook", "aml.pdf", "https://example.org/aml.pdf", Instant.now())));

        final Optional<ManifestEntry> entry = service.lookup("doc1");

        assertThat(entry).contains(new ManifestEntry("AML Handbook", "aml.pdf", "https://example.org/aml.pdf"));
        assertThat(service.lookup("")).isEmpty();
        assertThat(service.lookup(null)).isEmpty();
    }
}
