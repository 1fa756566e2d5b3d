package eu.virtualparadox.citeqa.application.config;

import eu.virtualparadox.citeqa.rag.index.LuceneExcerptSearchTier;
import eu.virtualparadox.citeqa.rag.index.LuceneSummarySearchTier;
import eu.virtualparadox.citeqa.rag.index.LuceneTierIndex;
import eu.virtualparadox.citeqa.util.LuceneConstants;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.analysis.miscellaneous.PerFieldAnalyzerWrapper;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Creates and manages the Lucene resources of both search tiers.
 * <p>Each tier has its own on-disk index ({@code citeqa.index.excerpts}, {@code citeqa.index.summaries});
 * all resources are closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private LuceneTierIndex excerptIndex;
    private LuceneTierIndex summaryIndex;
    private Analyzer analyzer;

    /**
     * Provides the shared analyzer: standard analysis for the text field,
     * verbatim terms for the keyword fields so filters match exactly.
     *
     * @return per-field {@link Analyzer}
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = tierAnalyzer();
        return this.analyzer;
    }

    @Bean
    public LuceneExcerptSearchTier excerptSearchTier(final ApplicationConfig props,
                                                     final Analyzer analyzer) throws IOException {
        this.excerptIndex = openIndex("excerpt", props.getIndex().getExcerpts(), analyzer);
        return new LuceneExcerptSearchTier(excerptIndex, analyzer);
    }

    @Bean
    public LuceneSummarySearchTier summarySearchTier(final ApplicationConfig props,
                                                     final Analyzer analyzer) throws IOException {
        this.summaryIndex = openIndex("summary", props.getIndex().getSummaries(), analyzer);
        return new LuceneSummarySearchTier(summaryIndex, analyzer);
    }

    /**
     * Analyzer used by both writers and query parsers.
     */
    public static Analyzer tierAnalyzer() {
        final Map<String, Analyzer> perField = new HashMap<>();
        for (final String field : LuceneConstants.KEYWORD_FIELDS) {
            perField.put(field, new KeywordAnalyzer());
        }
        return new PerFieldAnalyzerWrapper(new StandardAnalyzer(), perField);
    }

    private LuceneTierIndex openIndex(final String name, final Path path, final Analyzer analyzer) throws IOException {
        if (path == null) {
            throw new IllegalStateException("No index path configured for the " + name + " tier");
        }
        Files.createDirectories(path);
        return LuceneTierIndex.open(name, FSDirectory.open(path), analyzer);
    }

    /**
     * Ensures Lucene resources are closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        if (excerptIndex != null) excerptIndex.close();
        if (summaryIndex != null) summaryIndex.close();

        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
