package eu.virtualparadox.citeqa.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "sources")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceEntity {

    @Id
    @Column(length = 128, nullable = false)
    private String id;

    @Column(length = 512)
    private String title;

    @Column(length = 512)
    private String filename;

    @Column(name = "canonical_uri", length = 2048)
    private String canonicalUri;

    @Column(name = "added_at", nullable = false)
    private Instant addedAt;

    @PrePersist
    void prePersist() {
        if (addedAt == null) {
            addedAt = Instant.now();
        }
    }
}
