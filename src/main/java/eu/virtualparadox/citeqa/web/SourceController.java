package eu.virtualparadox.citeqa.web;

import eu.virtualparadox.citeqa.catalog.entity.SourceEntity;
import eu.virtualparadox.citeqa.catalog.service.SourceCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sources")
@RequiredArgsConstructor
public class SourceController {

    private final SourceCatalogService catalogService;

    public record SourceRegistration(String title, String filename, String canonicalUri) {
    }

    @GetMapping
    public List<SourceEntity> list() {
        return catalogService.listAll();
    }

    @GetMapping("/{id}")
    public ResponseEntity<SourceEntity> get(@PathVariable("id") final String id) {
        return catalogService.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public SourceEntity register(@PathVariable("id") final String id, @RequestBody final SourceRegistration registration) {
        return catalogService.register(id, registration.title(), registration.filename(), registration.canonicalUri());
    }
}
