package nl.bytesoflife.sgf.writer;

import nl.bytesoflife.sgf.model.SgfProperties;

import java.util.List;

/**
 * Structural copy of a game tree holding only the parsed properties of each node.
 */
public record SgfTreeData(SgfProperties data, List<SgfTreeData> children) {

    public SgfTreeData {
        children = List.copyOf(children);
    }
}
