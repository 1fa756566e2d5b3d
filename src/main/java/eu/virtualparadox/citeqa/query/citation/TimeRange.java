package eu.virtualparadox.citeqa.query.citation;

/**
 * Formatted time segment of an audio or video source, e.g. {@code 01:05} to {@code 02:10}.
 */
public record TimeRange(String start, String end) {
}
