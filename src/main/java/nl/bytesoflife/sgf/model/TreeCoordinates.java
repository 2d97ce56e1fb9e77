package nl.bytesoflife.sgf.model;

/**
 * Address of an edit in a game tree.
 *
 * @param down  number of first-child descents from the node the edit starts at; the node
 *              reached is the parent whose children are edited
 * @param right 1-based index among that parent's children
 */
public record TreeCoordinates(int down, int right) {

    @Override
    public String toString() {
        return "(" + down + ", " + right + ")";
    }
}
