package pl.marcinmilkowski.qgram.alphabet;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;

/**
 * An immutable, finite set of byte symbols.
 *
 * Symbols are stored as a 256-bit membership set, so lookups are O(1)
 * and the alphabet carries no ordering other than the natural unsigned
 * order of its bytes.
 */
public final class Alphabet {

    private final BitSet symbols;

    private Alphabet(BitSet symbols) {
        this.symbols = symbols;
    }

    /**
     * Create an alphabet from the given symbols. Duplicates are ignored.
     *
     * @param symbols the symbols, e.g. {@code "ACGT"}
     * @return the alphabet
     * @throws IllegalArgumentException if no symbol is given, or a character does not fit in one byte
     */
    public static Alphabet of(CharSequence symbols) {
        for (int i = 0; i < symbols.length(); i++) {
            char c = symbols.charAt(i);
            if (c > 0xff) {
                throw new IllegalArgumentException(String.format(
                    "Symbol '%c' (U+%04X) at index %d is not a single-byte symbol", c, (int) c, i));
            }
        }
        return of(symbols.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Create an alphabet from the given symbol bytes. Duplicates are ignored.
     *
     * @param symbols the symbols
     * @return the alphabet
     * @throws IllegalArgumentException if no symbol is given
     */
    public static Alphabet of(byte[] symbols) {
        if (symbols == null || symbols.length == 0) {
            throw new IllegalArgumentException("Alphabet must contain at least one symbol");
        }
        BitSet set = new BitSet(256);
        for (byte b : symbols) {
            set.set(b & 0xff);
        }
        return new Alphabet(set);
    }

    /**
     * Number of distinct symbols.
     */
    public int len() {
        return symbols.cardinality();
    }

    public boolean contains(byte symbol) {
        return symbols.get(symbol & 0xff);
    }

    /**
     * Check whether every byte of the text is a symbol of this alphabet.
     */
    public boolean isWord(byte[] text) {
        for (byte b : text) {
            if (!contains(b)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The symbols in ascending unsigned byte order.
     */
    public byte[] symbols() {
        byte[] out = new byte[len()];
        int n = 0;
        for (int s = symbols.nextSetBit(0); s >= 0; s = symbols.nextSetBit(s + 1)) {
            out[n++] = (byte) s;
        }
        return out;
    }

    /**
     * Alphabet containing the symbols of both alphabets.
     */
    public Alphabet union(Alphabet other) {
        BitSet set = (BitSet) symbols.clone();
        set.or(other.symbols);
        return new Alphabet(set);
    }

    /**
     * Alphabet that additionally contains the other case of every ASCII letter.
     */
    public Alphabet caseInsensitive() {
        BitSet set = (BitSet) symbols.clone();
        for (int s = symbols.nextSetBit(0); s >= 0; s = symbols.nextSetBit(s + 1)) {
            if (s >= 'A' && s <= 'Z') {
                set.set(s + ('a' - 'A'));
            } else if (s >= 'a' && s <= 'z') {
                set.set(s - ('a' - 'A'));
            }
        }
        return new Alphabet(set);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet)) return false;
        return symbols.equals(((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "Alphabet[" + new String(symbols(), StandardCharsets.ISO_8859_1) + "]";
    }
}
