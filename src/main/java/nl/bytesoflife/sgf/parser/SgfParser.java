package nl.bytesoflife.sgf.parser;

import nl.bytesoflife.sgf.model.SgfNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Parses SGF text into a tree of {@link SgfNode}s.
 * <p>
 * The text is scanned once, left to right. Every {@code (} opens a branch, every {@code )} closes
 * the innermost open branch and expands it into its chain of moves. Open branches are kept on an
 * explicit stack, so nesting depth is not limited by the call stack.
 * <p>
 * The returned root is an empty node whose children are the game trees of the collection.
 * Parentheses inside property values are not recognized as such.
 */
public class SgfParser {

    private static final Logger log = LoggerFactory.getLogger(SgfParser.class);

    private boolean strict;

    /**
     * In strict mode unbalanced parentheses and broken property values throw {@link ParseException},
     * positioned in the input after surrounding whitespace, newlines and tabs are removed.
     * Otherwise an unmatched {@code )} is ignored, branches still open at the end of the input are
     * discarded and an unterminated value is dropped.
     */
    public SgfParser withStrictMode(boolean strict) {
        this.strict = strict;
        return this;
    }

    public SgfNode parse(String sgf) {
        String text = cleanup(sgf);
        NodeChainExpander expander = new NodeChainExpander(
                new SgfPropertyParser(new SgfTokenizer().withStrictMode(strict)));

        Deque<OpenBranch> open = new ArrayDeque<>();
        OpenBranch collection = new OpenBranch(0);
        open.push(collection);

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '(' -> open.push(new OpenBranch(i));
                case ')' -> {
                    if (open.size() > 1) {
                        OpenBranch closed = open.pop();
                        open.peek().variations.add(closed.expand(expander));
                    } else if (strict) {
                        throw new ParseException("Unmatched ')'", i);
                    } else {
                        log.warn("Ignoring unmatched ')' at position {}", i);
                    }
                }
                default -> open.peek().append(c, i);
            }
        }

        if (open.size() > 1) {
            int position = open.peek().position;
            if (strict) {
                throw new ParseException("Unclosed '('", position);
            }
            log.warn("Discarding {} unclosed branch(es), innermost opened at position {}", open.size() - 1, position);
        }

        SgfNode root = new SgfNode();
        for (SgfNode tree : collection.variations) {
            root.addChild(tree);
        }
        log.debug("Parsed {} game tree(s) from {} characters", collection.variations.size(), text.length());
        return root;
    }

    public SgfNode parse(InputStream is) throws IOException {
        String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        return parse(content);
    }

    static String cleanup(String sgf) {
        return sgf.trim()
                .replace("\r", "")
                .replace("\n", "")
                .replace("\t", "");
    }

    private static class OpenBranch {
        final int position;
        final StringBuilder text = new StringBuilder();
        final List<SgfNode> variations = new ArrayList<>();
        // input position of every character in text; a nested branch can split the text in two
        int[] positions = new int[16];

        OpenBranch(int position) {
            this.position = position;
        }

        void append(char c, int inputPosition) {
            if (text.length() == positions.length) {
                positions = Arrays.copyOf(positions, positions.length * 2);
            }
            positions[text.length()] = inputPosition;
            text.append(c);
        }

        SgfNode expand(NodeChainExpander expander) {
            try {
                return expander.expand(text.toString(), variations);
            } catch (ParseException e) {
                int at = e.getPosition() < text.length() ? positions[e.getPosition()] : position;
                throw e.relocate(at);
            }
        }
    }
}
