package pl.marcinmilkowski.qgram.query;

/**
 * One bin of a diagonal histogram: how many shared q-grams agree on an
 * alignment offset between pattern and text.
 *
 * Sorted by count descending, ties by offset ascending.
 */
public record Diagonal(
    int offset,     // text position - pattern position
    int count       // q-gram hits on this diagonal
) implements Comparable<Diagonal> {

    @Override
    public int compareTo(Diagonal other) {
        int c = Integer.compare(other.count, this.count);
        return c != 0 ? c : Integer.compare(this.offset, other.offset);
    }

    @Override
    public String toString() {
        return String.format("Diagonal[offset=%d count=%d]", offset, count);
    }
}
