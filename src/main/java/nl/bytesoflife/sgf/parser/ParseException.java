package nl.bytesoflife.sgf.parser;

/**
 * Thrown by a parser in strict mode when the input is not well-formed SGF.
 * The position is an offset into the text the throwing parser was given.
 */
public class ParseException extends RuntimeException {

    private final String reason;
    private final int position;

    public ParseException(String reason, int position) {
        this(reason, position, null);
    }

    private ParseException(String reason, int position, ParseException cause) {
        super(reason + " at position " + position, cause);
        this.reason = reason;
        this.position = position;
    }

    public String getReason() {
        return reason;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Same failure at {@code position} of an enclosing text, e.g. the branch or document the
     * failing node text was cut from.
     */
    ParseException relocate(int position) {
        return new ParseException(reason, position, this);
    }
}
