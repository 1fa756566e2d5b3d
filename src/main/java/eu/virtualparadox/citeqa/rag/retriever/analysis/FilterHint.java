package eu.virtualparadox.citeqa.rag.retriever.analysis;

import java.util.Objects;

public record FilterHint(EFilterHintKind kind, String value) {

    public FilterHint {
        Objects.requireNonNull(kind, "kind must not be null");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Filter hint value must not be blank");
        }
    }
}
