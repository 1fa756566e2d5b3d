package eu.virtualparadox.citeqa.rag.index;

import eu.virtualparadox.citeqa.rag.retriever.model.ETier;
import eu.virtualparadox.citeqa.rag.retriever.model.ExcerptItem;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;

/**
 * Excerpt tier: fine-grained passages anchored to a page or a time range.
 */
public final class LuceneExcerptSearchTier extends AbstractLuceneSearchTier<ExcerptItem> {

    public LuceneExcerptSearchTier(final LuceneTierIndex index, final Analyzer analyzer) {
        super(index, analyzer);
    }

    @Override
    public ETier tier() {
        return ETier.EXCERPT;
    }

    @Override
    protected Document toDocument(final ExcerptItem item) {
        return LuceneTierDocuments.toDocument(item);
    }

    @Override
    protected ExcerptItem toItem(final Document document, final float score) {
        return LuceneTierDocuments.toExcerpt(document, score);
    }
}
