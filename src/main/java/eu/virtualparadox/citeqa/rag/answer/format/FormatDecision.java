package eu.virtualparadox.citeqa.rag.answer.format;

/**
 * Output shape chosen for one query; computed once and read by the prompt assembler and the
 * answer generator.
 */
public record FormatDecision(EFormatType formatType,
                             ELengthClass length,
                             EStructureStyle structure,
                             double temperature,
                             int maxOutputTokens,
                             String style) {

    public static FormatDecision of(final EFormatType formatType) {
        return new FormatDecision(
                formatType,
                formatType.length(),
                formatType.structure(),
                formatType.temperature(),
                formatType.maxOutputTokens(),
                formatType.style());
    }

    /**
     * Same decision with another temperature.
     */
    public FormatDecision withTemperature(final double newTemperature) {
        return new FormatDecision(formatType, length, structure, newTemperature, maxOutputTokens, style);
    }

    public int minCitations() {
        return length.minCitations();
    }
}
