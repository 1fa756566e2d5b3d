package eu.virtualparadox.citeqa.web;

import eu.virtualparadox.citeqa.catalog.entity.SourceEntity;
import eu.virtualparadox.citeqa.catalog.service.SourceCatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link SourceController}.
 */
class SourceControllerTest {

    private SourceCatalogService catalogService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        catalogService = mock(SourceCatalogService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SourceController(catalogService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void registersSource() throws Exception {
        when(catalogService.register("doc1", "AML Handbook", "aml.pdf", null))
                .thenReturn(new SourceEntity("doc1", "AML Handbook", "aml.pdf", null, Instant.now()));

        mockMvc.perform(put("/api/sources/doc1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"AML Handbook\",\"filename\":\"aml.pdf\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("doc1"))
                .andExpect(jsonPath("$.title").value("AML Handbook"));
    }

    @Test
    void unknownSourceIsNotFound() throws Exception {
        when(catalogService.findById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sources/missing"))
                .andExpect(status().isNotFound());
    }
}
