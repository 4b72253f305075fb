package pl.marcinmilkowski.qgram.alphabet;

import it.unimi.dsi.fastutil.ints.IntIterator;
import pl.marcinmilkowski.qgram.QGramIndexException;

import java.util.NoSuchElementException;

/**
 * Forward-only encoder of the overlapping q-grams of a text.
 *
 * Emits one value per window end position: the ranks of the last q symbols
 * packed {@code bits} apiece, most recent symbol in the low bits. The
 * register is updated by shift-or-mask, so each step is O(1). The first
 * {@code q - 1} symbols only prime the register. A text shorter than q
 * yields nothing.
 *
 * Not restartable: create a new instance for every pass.
 */
public final class QGrams implements IntIterator {

    /** Widest q-gram that stays a non-negative int. */
    public static final int MAX_BITS = Integer.SIZE - 1;

    private final byte[] text;
    private final RankTransform ranks;
    private final int bits;
    private final int mask;

    private int next;
    private int qgram;

    QGrams(int q, byte[] text, RankTransform ranks) {
        if (q < 1) {
            throw QGramIndexException.invalidQ("q must be at least 1, got " + q);
        }
        checkWidth(q, ranks.bits());
        this.text = text;
        this.ranks = ranks;
        this.bits = ranks.bits();
        this.mask = (int) ((1L << (q * bits)) - 1);

        int prime = Math.min(q - 1, text.length);
        for (int i = 0; i < prime; i++) {
            push(i);
        }
        this.next = prime;
    }

    /**
     * Reject q-grams wider than {@link #MAX_BITS}.
     */
    public static void checkWidth(int q, int bits) {
        if ((long) q * bits > MAX_BITS) {
            throw QGramIndexException.invalidQ(String.format(
                "q=%d needs %d bits per q-gram (%d per symbol), at most %d supported",
                q, (long) q * bits, bits, MAX_BITS));
        }
    }

    private void push(int i) {
        int r = ranks.rankOf(text[i]);
        if (r < 0) {
            throw QGramIndexException.unknownSymbol(text[i], i);
        }
        qgram = ((qgram << bits) | r) & mask;
    }

    @Override
    public boolean hasNext() {
        return next < text.length;
    }

    @Override
    public int nextInt() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        push(next++);
        return qgram;
    }
}
