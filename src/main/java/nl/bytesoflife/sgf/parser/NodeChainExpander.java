package nl.bytesoflife.sgf.parser;

import nl.bytesoflife.sgf.model.SgfNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the text of one parenthesized branch, {@code ;B[aa];W[bb];B[cc]}, into a chain of
 * single-child nodes, one per move. The variations that closed inside the branch hang below
 * the last move of the chain.
 */
public class NodeChainExpander {

    private final SgfPropertyParser propertyParser;

    public NodeChainExpander(SgfPropertyParser propertyParser) {
        this.propertyParser = propertyParser;
    }

    /**
     * @param branchText the semicolon-separated node texts of the branch; empty segments are skipped
     * @param variations the branches that follow the last node, in order
     * @return the first node of the chain. Without any node text it is an empty node that
     *         directly holds the variations.
     * @throws ParseException from a strict property parser, positioned in {@code branchText}
     */
    public SgfNode expand(String branchText, List<SgfNode> variations) {
        List<NodeText> nodeTexts = split(branchText);

        SgfNode head = nodeTexts.isEmpty() ? new SgfNode("", propertyParser) : createNode(nodeTexts.get(0));
        SgfNode tail = head;
        for (int i = 1; i < nodeTexts.size(); i++) {
            SgfNode next = createNode(nodeTexts.get(i));
            tail.addChild(next);
            tail = next;
        }

        for (SgfNode variation : variations) {
            tail.addChild(variation);
        }
        return head;
    }

    private SgfNode createNode(NodeText nodeText) {
        try {
            return new SgfNode(nodeText.text(), propertyParser);
        } catch (ParseException e) {
            throw e.relocate(nodeText.offset() + e.getPosition());
        }
    }

    private static List<NodeText> split(String branchText) {
        List<NodeText> nodeTexts = new ArrayList<>();
        int start = 0;
        while (start < branchText.length()) {
            int end = branchText.indexOf(';', start);
            if (end < 0) end = branchText.length();
            if (end > start) {
                nodeTexts.add(new NodeText(branchText.substring(start, end), start));
            }
            start = end + 1;
        }
        return nodeTexts;
    }

    private record NodeText(String text, int offset) {
    }
}
