package eu.virtualparadox.citeqa.query.citation.pageinterval;

/**
 * Inclusive run of consecutive pages.
 */
public record PageInterval(int fromPage, int toPage) {

    public PageInterval {
        if (fromPage > toPage) {
            throw new IllegalArgumentException(
                    "Invalid interval: fromPage (" + fromPage + ") cannot be greater than toPage (" + toPage + ")");
        }
    }

    public String asString() {
        if (fromPage == toPage) {
            return String.valueOf(fromPage);
        } else {
            return fromPage + "-" + toPage;
        }
    }
}
