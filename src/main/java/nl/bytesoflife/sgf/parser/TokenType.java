package nl.bytesoflife.sgf.parser;

public enum TokenType {
    /** Property code, the text outside brackets. */
    KEY,
    /** Text between {@code [} and {@code ]}, a value of the preceding key. */
    VALUE
}
