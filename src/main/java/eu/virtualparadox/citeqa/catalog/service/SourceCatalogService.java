package eu.virtualparadox.citeqa.catalog.service;

import eu.virtualparadox.citeqa.catalog.entity.SourceEntity;
import eu.virtualparadox.citeqa.catalog.repo.SourceRepository;
import eu.virtualparadox.citeqa.query.citation.ManifestEntry;
import eu.virtualparadox.citeqa.query.citation.SourceManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of the sources known to the search tiers.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Registering a source id with its display title, filename and canonical location</li>
 *     <li>Listing and looking up catalog records</li>
 *     <li>Serving as the {@link SourceManifest} used during source attribution</li>
 * </ul>
 *
 * <p>The source id is the link between a catalog record and the items stored in both tiers.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SourceCatalogService implements SourceManifest {

    private final SourceRepository repository;

    /**
     * Creates or replaces the catalog record of a source.
     *
     * @param id           the source identifier used by the search tiers
     * @param title        display title, may be {@code null}
     * @param filename     original filename, may be {@code null}
     * @param canonicalUri storage location, may be {@code null}
     * @return the persisted {@link SourceEntity}
     */
    @Transactional
    public SourceEntity register(final String id,
                                 final String title,
                                 final String filename,
                                 final String canonicalUri) {
        if (StringUtils.isBlank(id)) {
            throw new IllegalArgumentException("Source id must not be blank");
        }

        final Instant addedAt = repository.findById(id)
                .map(SourceEntity::getAddedAt)
                .orElseGet(Instant::now);

        final SourceEntity entity = SourceEntity.builder()
                .id(id)
                .title(StringUtils.trimToNull(title))
                .filename(StringUtils.trimToNull(filename))
                .canonicalUri(StringUtils.trimToNull(canonicalUri))
                .addedAt(addedAt)
                .build();

        log.info("Registered source {} ({})", id, entity.getTitle());
        return repository.save(entity);
    }

    @Transactional(readOnly = true)
    public List<SourceEntity> listAll() {
        return repository.findAllByOrderByAddedAtDesc();
    }

    @Transactional(readOnly = true)
    public Optional<SourceEntity> findById(final String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ManifestEntry> lookup(final String sourceId) {
        if (StringUtils.isBlank(sourceId)) {
            return Optional.empty();
        }
        return repository.findById(sourceId)
                .map(e -> new ManifestEntry(e.getTitle(), e.getFilename(), e.getCanonicalUri()));
    }
}
