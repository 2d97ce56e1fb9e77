package nl.bytesoflife.sgf.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text of a single SGF node ({@code B[dd]AB[aa][bb]}) into key and value tokens.
 * <p>
 * Values end at the first {@code ]}; escaped brackets are not supported. A {@code [} inside a
 * value is kept as part of the value.
 */
public class SgfTokenizer {

    private static final Logger log = LoggerFactory.getLogger(SgfTokenizer.class);

    private boolean strict;

    /**
     * In strict mode a stray {@code ]} or an unterminated value throws {@link ParseException}.
     * Otherwise the stray bracket ends the current key and the unterminated value is dropped.
     */
    public SgfTokenizer withStrictMode(boolean strict) {
        this.strict = strict;
        return this;
    }

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inValue = false;
        int start = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inValue) {
                if (c == ']') {
                    tokens.add(new Token(TokenType.VALUE, current.toString(), start));
                    current.setLength(0);
                    inValue = false;
                    start = i + 1;
                } else {
                    current.append(c);
                }
            } else if (c == '[') {
                addKey(tokens, current, start);
                inValue = true;
                start = i;
            } else if (c == ']') {
                if (strict) {
                    throw new ParseException("Unexpected ']' in '" + text + "'", i);
                }
                addKey(tokens, current, start);
                start = i + 1;
            } else {
                current.append(c);
            }
        }

        if (inValue) {
            if (strict) {
                throw new ParseException("Unterminated property value in '" + text + "'", start);
            }
            log.warn("Dropping unterminated property value at position {} in '{}'", start, text);
        } else {
            addKey(tokens, current, start);
        }

        return tokens;
    }

    // Blank text between two value groups continues the previous key
    private void addKey(List<Token> tokens, StringBuilder current, int start) {
        String key = current.toString().trim();
        if (!key.isEmpty()) {
            tokens.add(new Token(TokenType.KEY, key, start));
        }
        current.setLength(0);
    }
}
