package nl.bytesoflife.sgf.model;

import nl.bytesoflife.sgf.parser.SgfPropertyParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of an SGF game tree.
 * <p>
 * A node carries its properties twice: as the raw node text ({@code B[dd]C[nice]}) and as the
 * parsed {@link SgfProperties}. Whichever one a node is created from, the other is derived in the
 * constructor and neither changes afterwards. Only the children list is mutable.
 * <p>
 * A node with one child is a move in a linear sequence, a node with several children is where the
 * game splits into variations. The root has no parent and no properties; its children are the
 * game trees of the collection.
 */
public class SgfNode {

    private final String rawText;
    private final SgfProperties properties;
    private final List<SgfNode> children = new ArrayList<>();
    private SgfNode parent;

    /**
     * Creates an empty node. Used as the root of a collection.
     */
    public SgfNode() {
        this(SgfProperties.empty());
    }

    public SgfNode(SgfProperties properties) {
        this.properties = properties;
        this.rawText = properties.toSgf();
    }

    public SgfNode(String rawText) {
        this(rawText, new SgfPropertyParser());
    }

    public SgfNode(String rawText, SgfPropertyParser propertyParser) {
        this.rawText = rawText;
        this.properties = propertyParser.parse(rawText);
    }

    public String getRawText() {
        return rawText;
    }

    public SgfProperties getProperties() {
        return properties;
    }

    public List<SgfNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public SgfNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public SgfNode addChild(SgfNode child) {
        child.parent = this;
        children.add(child);
        return this;
    }

    // --- Tree editing ---
    //
    // Whether a position is free or even exists is up to the caller. Coordinates outside the
    // tree fail with the IndexOutOfBoundsException of the children list.

    /**
     * Inserts {@code node} at {@code coordinates}: descends {@code down} first children, then
     * inserts at position {@code right} of that node's children, moving later siblings one to the right.
     */
    public void add(SgfNode node, TreeCoordinates coordinates) {
        SgfNode target = descend(coordinates.down());
        node.parent = target;
        target.children.add(coordinates.right() - 1, node);
    }

    /**
     * Removes the child at {@code coordinates} together with its subtree. A {@code right} of 0
     * removes nothing.
     */
    public void remove(TreeCoordinates coordinates) {
        SgfNode target = descend(coordinates.down());
        int right = coordinates.right();
        if (right != 0) {
            target.children.remove(right - 1);
        }
    }

    /**
     * Swaps the child at {@code coordinates} with its left or right neighbour.
     */
    public void shift(TreeCoordinates coordinates, boolean left) {
        SgfNode target = descend(coordinates.down());
        int index = coordinates.right() - 1;
        int neighbourIndex = left ? index - 1 : index + 1;

        SgfNode child = target.children.get(index);
        SgfNode neighbour = target.children.get(neighbourIndex);
        target.children.set(neighbourIndex, child);
        target.children.set(index, neighbour);
    }

    public void shift(TreeCoordinates coordinates) {
        shift(coordinates, false);
    }

    private SgfNode descend(int down) {
        SgfNode current = this;
        for (int i = 0; i < down; i++) {
            current = current.children.get(0);
        }
        return current;
    }

    @Override
    public String toString() {
        return "SgfNode{rawText='" + rawText + "', children=" + children.size() + "}";
    }
}
