package eu.virtualparadox.citeqa.catalog.repo;

import eu.virtualparadox.citeqa.catalog.entity.SourceEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SourceRepository extends JpaRepository<SourceEntity, String> {

    List<SourceEntity> findAllByOrderByAddedAtDesc();
}
