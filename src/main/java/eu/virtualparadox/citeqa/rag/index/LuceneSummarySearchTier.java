package eu.virtualparadox.citeqa.rag.index;

import eu.virtualparadox.citeqa.rag.retriever.model.ETier;
import eu.virtualparadox.citeqa.rag.retriever.model.SummaryItem;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;

/**
 * Summary tier: one description per source document.
 */
public final class LuceneSummarySearchTier extends AbstractLuceneSearchTier<SummaryItem> {

    public LuceneSummarySearchTier(final LuceneTierIndex index, final Analyzer analyzer) {
        super(index, analyzer);
    }

    @Override
    public ETier tier() {
        return ETier.SUMMARY;
    }

    @Override
    protected Document toDocument(final SummaryItem item) {
        return LuceneTierDocuments.toDocument(item);
    }

    @Override
    protected SummaryItem toItem(final Document document, final float score) {
        return LuceneTierDocuments.toSummary(document, score);
    }
}
