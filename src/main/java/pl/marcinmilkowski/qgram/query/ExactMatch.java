package pl.marcinmilkowski.qgram.query;

/**
 * An ungapped exact match between pattern and text.
 *
 * Both intervals are half-open and of equal length. A run of k adjacent
 * q-gram hits on one diagonal yields a match of length q + k - 1.
 */
public record ExactMatch(
    int patternStart,
    int patternStop,
    int textStart,
    int textStop
) {

    public ExactMatch {
        if (patternStop - patternStart != textStop - textStart) {
            throw new IllegalArgumentException(String.format(
                "Pattern [%d, %d) and text [%d, %d) differ in length",
                patternStart, patternStop, textStart, textStop));
        }
    }

    /**
     * Number of matched symbols.
     */
    public int length() {
        return patternStop - patternStart;
    }

    /**
     * Offset of the text interval relative to the pattern interval.
     */
    public int diagonal() {
        return textStart - patternStart;
    }

    @Override
    public String toString() {
        return String.format("ExactMatch[pattern=[%d, %d) text=[%d, %d)]",
            patternStart, patternStop, textStart, textStop);
    }
}
