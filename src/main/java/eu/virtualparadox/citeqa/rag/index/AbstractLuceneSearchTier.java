package eu.virtualparadox.citeqa.rag.index;

import eu.virtualparadox.citeqa.rag.retriever.model.RetrievedItem;
import eu.virtualparadox.citeqa.rag.retriever.service.SearchTier;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.util.QueryBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.citeqa.util.LuceneConstants.FIELD_ID;
import static eu.virtualparadox.citeqa.util.LuceneConstants.FIELD_TEXT;

/**
 * Lucene-backed {@link SearchTier}.
 * <p>
 * Steps of a search:
 * <ol>
 *   <li>Analyze the query text into a disjunction of terms on the text field, scored with BM25;
 *       the text is never read as query syntax</li>
 *   <li>Parse the optional filter expression and add it as a non-scoring filter clause</li>
 *   <li>Load the stored fields of the top hits and map them to items</li>
 * </ol>
 *
 * @param <T> item type of the tier
 */
@Slf4j
public abstract class AbstractLuceneSearchTier<T extends RetrievedItem> implements SearchTier<T> {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final Analyzer analyzer;

    protected AbstractLuceneSearchTier(final LuceneTierIndex index, final Analyzer analyzer) {
        this.writer = index.getWriter();
        this.searcherManager = index.getSearcherManager();
        this.analyzer = analyzer;
    }

    @Override
    public List<T> search(final String query, final int limit, final String filter) throws IOException {
        if (query == null || query.isBlank() || limit <= 0) {
            return new ArrayList<>();
        }

        final Query textQuery = new QueryBuilder(analyzer).createBooleanQuery(FIELD_TEXT, query);
        if (textQuery == null) {
            log.debug("{} tier: no searchable terms in '{}'", tier(), query);
            return new ArrayList<>();
        }

        final Query luceneQuery = buildQuery(textQuery, filter);
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(luceneQuery, limit);
            final StoredFields storedFields = searcher.storedFields();

            final List<T> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                results.add(toItem(storedFields.document(sd.doc), sd.score));
            }
            log.debug("{} tier returned {} hits for '{}' (filter: {})", tier(), results.size(), query, filter);
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Adds or replaces the given items (matched by id), then commits and refreshes the searcher.
     *
     * @param items items to index
     * @throws IOException if writing to the index fails
     */
    public void index(final List<T> items) throws IOException {
        if (items == null || items.isEmpty()) {
            return;
        }
        for (final T item : items) {
            writer.updateDocument(new Term(FIELD_ID, item.id()), toDocument(item));
        }
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Indexed {} items into the {} tier", items.size(), tier());
    }

    protected abstract Document toDocument(T item);

    protected abstract T toItem(Document document, float score);

    private Query buildQuery(final Query textQuery, final String filter) throws IOException {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(textQuery, BooleanClause.Occur.MUST);
        if (filter != null && !filter.isBlank()) {
            try {
                builder.add(new QueryParser(FIELD_TEXT, analyzer).parse(filter), BooleanClause.Occur.FILTER);
            } catch (ParseException e) {
                throw new IOException("Unable to parse filter '" + filter + "'", e);
            }
        }
        return builder.build();
    }
}
