package nl.bytesoflife.sgf.parser;

import nl.bytesoflife.sgf.model.SgfProperties;

import java.util.List;

/**
 * Builds the {@link SgfProperties} of one node from its text.
 * A key takes every value that follows it up to the next key.
 */
public class SgfPropertyParser {

    private final SgfTokenizer tokenizer;

    public SgfPropertyParser() {
        this(new SgfTokenizer());
    }

    public SgfPropertyParser(SgfTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public SgfProperties parse(String nodeText) {
        return parse(tokenizer.tokenize(nodeText));
    }

    public SgfProperties parse(List<Token> tokens) {
        SgfProperties.Builder properties = SgfProperties.builder();
        String currentKey = tokens.isEmpty() || tokens.get(0).isValue() ? "" : tokens.get(0).text();

        for (Token token : tokens) {
            if (token.isValue()) {
                properties.add(currentKey, token.text());
            } else {
                currentKey = token.text();
            }
        }

        return properties.build();
    }
}
