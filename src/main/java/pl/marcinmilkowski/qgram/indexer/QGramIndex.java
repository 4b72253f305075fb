package pl.marcinmilkowski.qgram.indexer;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.FixedBitSet;
import org.apache.lucene.util.RamUsageEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.qgram.QGramIndexException;
import pl.marcinmilkowski.qgram.alphabet.Alphabet;
import pl.marcinmilkowski.qgram.alphabet.QGrams;
import pl.marcinmilkowski.qgram.alphabet.RankTransform;
import pl.marcinmilkowski.qgram.query.Diagonal;
import pl.marcinmilkowski.qgram.query.ExactMatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Index of the positions of every q-gram of a text.
 *
 * Positions are bucketed by q-gram value in compressed sparse row layout:
 * {@code address[g]} is the offset of bucket g in {@code pos}, and
 * {@code pos[address[g] .. address[g + 1])} holds the start positions of
 * q-gram g in ascending order. Both are built by a two-pass counting sort
 * and never change afterwards, so a built index can be queried from any
 * number of threads without locking.
 *
 * Q-grams occurring more than {@code maxCount} times are masked: their
 * bucket is left empty and looks exactly like a q-gram absent from the text.
 *
 * <pre>
 * QGramIndex index = QGramIndex.build(11, reference, Alphabet.of("ACGT"), 500);
 * for (ExactMatch m : index.exactMatches(read)) { ... }
 * </pre>
 */
public final class QGramIndex implements Accountable {

    private static final Logger log = LoggerFactory.getLogger(QGramIndex.class);

    private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(QGramIndex.class);

    /** Cap that never masks anything. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int q;
    private final RankTransform ranks;
    private final int textLength;
    private final int maxCount;

    private final int[] address;
    private final int[] pos;
    private final IntList posView;

    private final FixedBitSet masked;  // null when nothing was masked
    private final int maskedCount;

    private QGramIndex(int q, RankTransform ranks, int textLength, int maxCount,
                       int[] address, int[] pos, FixedBitSet masked, int maskedCount) {
        this.q = q;
        this.ranks = ranks;
        this.textLength = textLength;
        this.maxCount = maxCount;
        this.address = address;
        this.pos = pos;
        this.posView = IntLists.unmodifiable(IntArrayList.wrap(pos));
        this.masked = masked;
        this.maskedCount = maskedCount;
    }

    /**
     * Index every q-gram of the text.
     *
     * @see #build(int, byte[], Alphabet, int)
     */
    public static QGramIndex build(int q, byte[] text, Alphabet alphabet) {
        return build(q, text, alphabet, UNBOUNDED);
    }

    /**
     * Index the q-grams of the text, masking those that occur more than
     * {@code maxCount} times.
     *
     * @param q        q-gram length
     * @param text     the text; only read during construction
     * @param alphabet symbols allowed in the text and in later patterns
     * @param maxCount highest occurrence count a q-gram may have and still be indexed
     * @return the built index
     * @throws QGramIndexException INVALID_Q if q is below 1 or its q-grams do not fit an int,
     *         EMPTY_TEXT if the text is shorter than q, UNKNOWN_SYMBOL if the text
     *         holds a symbol outside the alphabet
     * @throws IllegalArgumentException if maxCount is below 1
     */
    public static QGramIndex build(int q, byte[] text, Alphabet alphabet, int maxCount) {
        if (q < 1) {
            throw QGramIndexException.invalidQ("q must be at least 1, got " + q);
        }
        if (maxCount < 1) {
            throw new IllegalArgumentException("maxCount must be at least 1, got " + maxCount);
        }
        RankTransform ranks = new RankTransform(alphabet);
        QGrams.checkWidth(q, ranks.bits());
        long space = 1L << (q * ranks.bits());
        if (space + 1 > ArrayUtil.MAX_ARRAY_LENGTH) {
            throw QGramIndexException.invalidQ(String.format(
                "q=%d over %d symbols gives %d q-grams, too many to address", q, alphabet.len(), space));
        }
        if (text.length < q) {
            throw QGramIndexException.emptyText(text.length, q);
        }
        ranks.validate(text);

        return construct(q, text, ranks, (int) space, maxCount);
    }

    private static QGramIndex construct(int q, byte[] text, RankTransform ranks, int space, int maxCount) {
        long start = System.nanoTime();

        // Count pass: bucket sizes shifted up by one for the prefix sum
        int[] address = new int[space + 1];
        for (QGrams it = ranks.qgrams(q, text); it.hasNext(); ) {
            address[it.nextInt() + 1]++;
        }

        // Mask over-represented q-grams
        FixedBitSet masked = null;
        int maskedCount = 0;
        if (maxCount != UNBOUNDED) {
            for (int g = 1; g <= space; g++) {
                if (address[g] > maxCount) {
                    address[g] = 0;
                    if (masked == null) {
                        masked = new FixedBitSet(space);
                    }
                    masked.set(g - 1);
                    maskedCount++;
                }
            }
        }

        for (int g = 1; g <= space; g++) {
            address[g] += address[g - 1];
        }

        long counted = System.nanoTime();

        // Fill pass
        int[] pos = new int[address[space]];
        int[] fill = Arrays.copyOf(address, space);
        int i = 0;
        for (QGrams it = ranks.qgrams(q, text); it.hasNext(); i++) {
            int g = it.nextInt();
            if (address[g + 1] != address[g]) {
                pos[fill[g]++] = i;
            }
        }

        long filled = System.nanoTime();

        QGramIndex index = new QGramIndex(q, ranks, text.length, maxCount, address, pos, masked, maskedCount);

        log.info("Built q-gram index: q={}, {} symbols, {} buckets, {} positions, {} masked q-grams, {}",
            q, text.length, space, pos.length, maskedCount,
            RamUsageEstimator.humanReadableUnits(index.ramBytesUsed()));
        log.debug("  Count pass {} ms, fill pass {} ms",
            (counted - start) / 1_000_000, (filled - counted) / 1_000_000);
        return index;
    }

    /**
     * Text positions of a q-gram, ascending.
     * Empty for q-grams absent from the text and for masked q-grams alike.
     *
     * @param qgram encoded q-gram, as produced by {@link RankTransform#qgrams}
     * @return unmodifiable view into the index
     */
    public IntList matches(int qgram) {
        checkQGram(qgram);
        return posView.subList(address[qgram], address[qgram + 1]);
    }

    /**
     * Text positions of the q-gram spelled by the window.
     *
     * @param window exactly q symbols
     */
    public IntList matches(byte[] window) {
        if (window.length != q) {
            throw new IllegalArgumentException("Window length " + window.length + " differs from q=" + q);
        }
        return matches(ranks.qgram(window));
    }

    /**
     * Diagonal histogram of a pattern: for every pattern q-gram i and every
     * text position p it occurs at, diagonal p - i is counted once.
     *
     * Each diagonal starts at 1 on its first hit and grows by one per
     * further hit. Every diagonal with a hit is reported; callers apply
     * their own threshold.
     *
     * @param pattern symbols of the index's alphabet; shorter than q yields no diagonal
     * @return one entry per diagonal, in no particular order
     */
    public List<Diagonal> diagonals(byte[] pattern) {
        Int2IntOpenHashMap counts = tally(pattern);
        List<Diagonal> result = new ArrayList<>(counts.size());
        for (Int2IntMap.Entry e : counts.int2IntEntrySet()) {
            result.add(new Diagonal(e.getIntKey(), e.getIntValue()));
        }
        return result;
    }

    /**
     * Diagonals with at least {@code minCount} hits, most hits first.
     *
     * @param pattern symbols of the index's alphabet; shorter than q yields no diagonal
     * @param minCount smallest hit count kept, at least 1
     * @return the kept diagonals, by count descending then offset ascending
     * @throws IllegalArgumentException if minCount is below 1
     */
    public List<Diagonal> bestDiagonals(byte[] pattern, int minCount) {
        if (minCount < 1) {
            throw new IllegalArgumentException("minCount must be at least 1, got " + minCount);
        }
        List<Diagonal> result = new ArrayList<>();
        for (Diagonal d : diagonals(pattern)) {
            if (d.count() >= minCount) {
                result.add(d);
            }
        }
        result.sort(null);
        return result;
    }

    private Int2IntOpenHashMap tally(byte[] pattern) {
        ranks.validate(pattern);
        Int2IntOpenHashMap counts = new Int2IntOpenHashMap();
        int i = 0;
        for (QGrams it = ranks.qgrams(q, pattern); it.hasNext(); i++) {
            int g = it.nextInt();
            for (int k = address[g], end = address[g + 1]; k < end; k++) {
                counts.addTo(pos[k] - i, 1);
            }
        }
        return counts;
    }

    /**
     * Maximal ungapped matches between pattern and text.
     *
     * One interval is kept open per diagonal. A hit at pattern q-gram i
     * extends it when the interval ends at {@code i + q - 1}, i.e. its
     * last q-gram starts at i - 1. Any other hit on the diagonal closes the
     * interval and opens a new one. Intervals still open after the scan are
     * reported last, in the order their diagonals were first seen.
     *
     * @param pattern symbols of the index's alphabet; shorter than q yields no match
     * @return matches in order of discovery
     */
    public List<ExactMatch> exactMatches(byte[] pattern) {
        ranks.validate(pattern);
        Int2ObjectLinkedOpenHashMap<OpenInterval> open = new Int2ObjectLinkedOpenHashMap<>();
        List<ExactMatch> result = new ArrayList<>();
        int i = 0;
        for (QGrams it = ranks.qgrams(q, pattern); it.hasNext(); i++) {
            int g = it.nextInt();
            for (int k = address[g], end = address[g + 1]; k < end; k++) {
                int p = pos[k];
                int diagonal = p - i;
                OpenInterval interval = open.get(diagonal);
                if (interval == null) {
                    open.put(diagonal, new OpenInterval(i, p, q));
                } else if (interval.patternStop == i + q - 1) {
                    interval.patternStop = i + q;
                    interval.textStop = p + q;
                } else {
                    // mismatch or indel
                    result.add(interval.toExactMatch());
                    interval.restart(i, p, q);
                }
            }
        }
        for (OpenInterval interval : open.values()) {
            result.add(interval.toExactMatch());
        }
        log.debug("Pattern of {} symbols: {} exact matches on {} diagonals", pattern.length, result.size(), open.size());
        return result;
    }

    private void checkQGram(int qgram) {
        if (qgram < 0 || qgram >= address.length - 1) {
            throw new IllegalArgumentException(
                "q-gram " + qgram + " outside [0, " + (address.length - 1) + ")");
        }
    }

    /**
     * Number of indexed positions of a q-gram; 0 when absent or masked.
     */
    public int count(int qgram) {
        checkQGram(qgram);
        return address[qgram + 1] - address[qgram];
    }

    /**
     * Whether the q-gram was dropped for occurring more than {@link #maxCount()} times.
     */
    public boolean isMasked(int qgram) {
        checkQGram(qgram);
        return masked != null && masked.get(qgram);
    }

    public int q() {
        return q;
    }

    public Alphabet alphabet() {
        return ranks.alphabet();
    }

    public RankTransform rankTransform() {
        return ranks;
    }

    public int textLength() {
        return textLength;
    }

    public int maxCount() {
        return maxCount;
    }

    /**
     * Number of distinct q-gram values, i.e. buckets.
     */
    public int qgramSpace() {
        return address.length - 1;
    }

    /**
     * Total number of indexed positions over all unmasked q-grams.
     */
    public int positionCount() {
        return pos.length;
    }

    public int maskedCount() {
        return maskedCount;
    }

    @Override
    public long ramBytesUsed() {
        return BASE_RAM_BYTES_USED
            + RamUsageEstimator.sizeOf(address)
            + RamUsageEstimator.sizeOf(pos)
            + (masked == null ? 0 : masked.ramBytesUsed());
    }

    @Override
    public String toString() {
        return String.format("QGramIndex[q=%d, text=%d, positions=%d, masked=%d]",
            q, textLength, pos.length, maskedCount);
    }

    /** Exact match still growing along one diagonal. */
    private static final class OpenInterval {
        int patternStart;
        int patternStop;
        int textStart;
        int textStop;

        OpenInterval(int i, int p, int q) {
            restart(i, p, q);
        }

        void restart(int i, int p, int q) {
            patternStart = i;
            patternStop = i + q;
            textStart = p;
            textStop = p + q;
        }

        ExactMatch toExactMatch() {
            return new ExactMatch(patternStart, patternStop, textStart, textStop);
        }
    }
}
