package pl.marcinmilkowski.qgram;

/**
 * Precondition failure detected before any index or query work begins.
 *
 * These are programmer errors: they are never retried and no partially
 * built index is ever returned alongside them.
 */
public class QGramIndexException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * What was wrong with the input.
     */
    public enum Reason {
        /** q is zero/negative, or q-grams of this length do not fit the encoding */
        INVALID_Q,

        /** A text or pattern symbol has no rank under the alphabet */
        UNKNOWN_SYMBOL,

        /** The text is shorter than q, so it has no q-gram to index */
        EMPTY_TEXT
    }

    private final Reason reason;

    public QGramIndexException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static QGramIndexException invalidQ(String message) {
        return new QGramIndexException(Reason.INVALID_Q, message);
    }

    public static QGramIndexException emptyText(int textLength, int q) {
        return new QGramIndexException(Reason.EMPTY_TEXT,
            "Text of length " + textLength + " is shorter than q=" + q);
    }

    /**
     * Unknown symbol at the given position of a text or pattern, or -1 if
     * the symbol was looked up on its own.
     */
    public static QGramIndexException unknownSymbol(byte symbol, int position) {
        String where = position >= 0 ? " at position " + position : "";
        return new QGramIndexException(Reason.UNKNOWN_SYMBOL,
            String.format("Symbol '%s' (0x%02x)%s is not in the alphabet",
                (char) (symbol & 0xff), symbol & 0xff, where));
    }
}
