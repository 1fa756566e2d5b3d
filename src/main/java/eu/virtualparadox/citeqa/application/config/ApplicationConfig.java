package eu.virtualparadox.citeqa.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "citeqa")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path db;
    private Index index = new Index();
    private Retriever retriever = new Retriever();
    private Synthesizer synthesizer = new Synthesizer();
    private Generation generation = new Generation();
    private Sources sources = new Sources();
    private Tracking tracking = new Tracking();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index.excerpts != null) Files.createDirectories(index.excerpts);
        if (index.summaries != null) Files.createDirectories(index.summaries);
        if (db != null) {
            Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
        if (tracking.file != null) {
            Path trackingDir = tracking.file.getParent();
            if (trackingDir != null) Files.createDirectories(trackingDir);
        }
    }

    @Getter @Setter
    public static class Index {
        private Path excerpts;
        private Path summaries;
    }

    @Getter @Setter
    public static class Retriever {
        /** Choose expansion and tiers per query; off means expand always and search both tiers. */
        private boolean adaptiveStrategyEnabled = true;
        /** Forces expansion on or off; {@code null} leaves it to the search strategy. */
        private Boolean queryExpansionEnabled;
        private boolean excerptSearchEnabled = true;
        private boolean summarySearchEnabled = true;
        private String expansionModel;
        private boolean rerankingEnabled = true;
        private String rerankingModel;
        /** Cap applied after reranking; {@code null} means "use the tier's retrieval cap". */
        private Integer rerankTopK;
        private boolean deduplicationEnabled = true;
        private EAdaptiveLimits adaptiveLimits = EAdaptiveLimits.WORD_COUNT;
        private int defaultMaxExcerpts = 10;
        private int defaultMaxSummaries = 5;
        private int rrfK = 60;
        private boolean autoFilterEnabled = false;
        private EFilterLogic filterLogic = EFilterLogic.OR;
        private int snippetPreviewLength = 300;
    }

    @Getter @Setter
    public static class Synthesizer {
        private boolean contextTruncationEnabled = true;
        private int maxContextTokens = 24_000;
        private int reservedOverheadTokens = 2_000;
        private double summaryShare = 0.2;
        private int charsPerToken = 4;
        private boolean adaptiveTemperatureEnabled = true;
        private double defaultTemperature = 0.2;
        private boolean citationsPrioritized = true;
    }

    @Getter @Setter
    public static class Generation {
        private String primaryModel;
        private List<String> fallbackModels = new ArrayList<>();
    }

    @Getter @Setter
    public static class Sources {
        private String bucket;
        private String prefix = "sources/";
        private String browserBaseUrl = "https://storage.cloud.google.com/";
    }

    @Getter @Setter
    public static class Tracking {
        private boolean enabled = true;
        private Path file;
    }

    public enum EAdaptiveLimits {
        /** Always use the configured defaults. */
        NONE,
        /** Word-count tiers: &lt;5, &lt;15, otherwise. */
        WORD_COUNT,
        /** Query type, complexity and scope. */
        CHARACTERISTICS
    }

    public enum EFilterLogic {
        OR,
        AND
    }
}
