package pl.marcinmilkowski.qgram.alphabet;

import pl.marcinmilkowski.qgram.QGramIndexException;

import java.util.Arrays;

/**
 * Maps every symbol of an alphabet to a dense rank in {@code [0, len)}.
 *
 * Ranks follow the ascending byte order of the symbols, so the same
 * alphabet always yields the same ranks. Lookup goes through a 256-entry
 * table, -1 marking bytes outside the alphabet.
 */
public final class RankTransform {

    private final Alphabet alphabet;
    private final int[] ranks = new int[256];
    private final byte[] symbols;
    private final int bits;

    public RankTransform(Alphabet alphabet) {
        this.alphabet = alphabet;
        this.symbols = alphabet.symbols();
        Arrays.fill(ranks, -1);
        for (int r = 0; r < symbols.length; r++) {
            ranks[symbols[r] & 0xff] = r;
        }
        this.bits = bitsFor(symbols.length);
    }

    /**
     * Bits needed to store one rank: {@code ceil(log2(size))}, 0 for a single symbol.
     */
    static int bitsFor(int size) {
        return size <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(size - 1);
    }

    /**
     * Rank of a symbol.
     *
     * @throws QGramIndexException with reason UNKNOWN_SYMBOL if the symbol is not in the alphabet
     */
    public int get(byte symbol) {
        int r = ranks[symbol & 0xff];
        if (r < 0) {
            throw QGramIndexException.unknownSymbol(symbol, -1);
        }
        return r;
    }

    /** Rank of a symbol, or -1 when it is not in the alphabet. */
    int rankOf(byte symbol) {
        return ranks[symbol & 0xff];
    }

    /**
     * Ranks of every symbol of the text.
     *
     * @throws QGramIndexException with reason UNKNOWN_SYMBOL naming the first offending position
     */
    public int[] transform(byte[] text) {
        int[] out = new int[text.length];
        for (int i = 0; i < text.length; i++) {
            int r = ranks[text[i] & 0xff];
            if (r < 0) {
                throw QGramIndexException.unknownSymbol(text[i], i);
            }
            out[i] = r;
        }
        return out;
    }

    /**
     * Fail on the first symbol of the text outside the alphabet.
     */
    public void validate(byte[] text) {
        for (int i = 0; i < text.length; i++) {
            if (ranks[text[i] & 0xff] < 0) {
                throw QGramIndexException.unknownSymbol(text[i], i);
            }
        }
    }

    /**
     * Symbol with the given rank.
     */
    public byte symbol(int rank) {
        if (rank < 0 || rank >= symbols.length) {
            throw new IllegalArgumentException("Rank out of range: " + rank);
        }
        return symbols[rank];
    }

    /**
     * Lazy q-gram encoder over the text. A fresh encoder is needed per pass.
     */
    public QGrams qgrams(int q, byte[] text) {
        return new QGrams(q, text, this);
    }

    /**
     * Encode a single window; its length is taken as q.
     */
    public int qgram(byte[] window) {
        if (window.length == 0) {
            throw new IllegalArgumentException("Empty q-gram window");
        }
        QGrams.checkWidth(window.length, bits);
        int g = 0;
        for (int i = 0; i < window.length; i++) {
            int r = ranks[window[i] & 0xff];
            if (r < 0) {
                throw QGramIndexException.unknownSymbol(window[i], i);
            }
            g = (g << bits) | r;
        }
        return g;
    }

    /**
     * Symbols of an encoded q-gram, oldest first.
     */
    public byte[] decode(int qgram, int q) {
        QGrams.checkWidth(q, bits);
        byte[] out = new byte[q];
        int rankMask = (1 << bits) - 1;
        for (int i = q - 1; i >= 0; i--) {
            out[i] = symbol(qgram & rankMask);
            qgram >>>= bits;
        }
        return out;
    }

    public int bits() {
        return bits;
    }

    public int rankCount() {
        return symbols.length;
    }

    public Alphabet alphabet() {
        return alphabet;
    }
}
