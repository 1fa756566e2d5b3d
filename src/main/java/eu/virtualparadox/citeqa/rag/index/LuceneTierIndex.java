package eu.virtualparadox.citeqa.rag.index;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;

import java.io.Closeable;
import java.io.IOException;

/**
 * Writer and near-real-time searcher over one tier's {@link Directory}.
 */
@Slf4j
public final class LuceneTierIndex implements Closeable {

    private final String name;
    private final Directory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    private LuceneTierIndex(final String name,
                            final Directory directory,
                            final IndexWriter writer,
                            final SearcherManager searcherManager) {
        this.name = name;
        this.directory = directory;
        this.writer = writer;
        this.searcherManager = searcherManager;
    }

    /**
     * Opens the index in create-or-append mode.
     *
     * @param name      tier name, for logging
     * @param directory index directory; owned by the returned instance
     * @param analyzer  analyzer for indexing
     * @throws IOException on writer creation error
     */
    public static LuceneTierIndex open(final String name,
                                       final Directory directory,
                                       final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        final IndexWriter writer = new IndexWriter(directory, cfg);
        // make the index readable even before the first document is written
        writer.commit();
        final SearcherManager searcherManager = new SearcherManager(writer, null);
        log.info("Opened {} index with {} documents", name, writer.getDocStats().numDocs);
        return new LuceneTierIndex(name, directory, writer, searcherManager);
    }

    public String getName() {
        return name;
    }

    public IndexWriter getWriter() {
        return writer;
    }

    public SearcherManager getSearcherManager() {
        return searcherManager;
    }

    @Override
    public void close() {
        try { searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager of {}", name, e);
        }

        try { writer.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter of {}", name, e);
        }

        try { directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory of {}", name, e);
        }
    }
}
