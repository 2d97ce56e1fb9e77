package nl.bytesoflife.sgf.parser;

/**
 * A token of SGF node text.
 *
 * @param type     key or bracketed value
 * @param text     key text, or the value without its brackets
 * @param position offset of the token in the node text
 */
public record Token(TokenType type, String text, int position) {

    public boolean isValue() {
        return type == TokenType.VALUE;
    }

    @Override
    public String toString() {
        return type == TokenType.VALUE ? "[" + text + "]" : text;
    }
}
