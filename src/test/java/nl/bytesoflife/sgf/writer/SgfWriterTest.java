package nl.bytesoflife.sgf.writer;

import nl.bytesoflife.sgf.model.SgfNode;
import nl.bytesoflife.sgf.model.SgfProperties;
import nl.bytesoflife.sgf.model.TreeCoordinates;
import nl.bytesoflife.sgf.parser.SgfParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SgfWriterTest {

    private final SgfParser parser = new SgfParser();
    private final SgfWriter writer = new SgfWriter();

    @Test
    void writeSequence() {
        assertEquals("(;B[aa];W[bb])", writer.toSgf(parser.parse("(;B[aa];W[bb])")));
    }

    @Test
    void writeVariations() {
        String sgf = "(;B[aa](;W[bb])(;W[cc];B[dd]))";
        assertEquals(sgf, writer.toSgf(parser.parse(sgf)));
    }

    @Test
    void writeCollectionWithoutSeparator() {
        String sgf = "(;GM[1];B[aa])(;GM[1];B[bb])";
        assertEquals(sgf, writer.toSgf(parser.parse(sgf)));
    }

    @Test
    void writeSubtreeWithoutParentheses() {
        SgfNode root = parser.parse("(;B[aa];W[bb](;B[cc])(;B[dd]))");
        SgfNode white = root.getChildren().get(0).getChildren().get(0);
        assertEquals("W[bb](;B[cc])(;B[dd])", writer.toSgf(white));
    }

    @Test
    void writeDropsStrippedWhitespace() throws IOException {
        String content = Files.readString(Path.of("testdata/sgf/variations.sgf"));
        String written = writer.toSgf(parser.parse(content));
        assertFalse(written.contains("\n"));
        assertFalse(written.contains("\t"));
        assertTrue(written.startsWith("(;GM[1]FF[4]SZ[9]"));
    }

    @Test
    void roundTripFiles() throws IOException {
        for (String file : List.of("testdata/sgf/variations.sgf", "testdata/sgf/collection.sgf")) {
            SgfNode parsed = parser.parse(Files.readString(Path.of(file)));
            SgfNode reparsed = parser.parse(writer.toSgf(parsed));
            assertEquals(writer.toData(parsed), writer.toData(reparsed), file);
            assertEquals(writer.toArray(parsed), writer.toArray(reparsed), file);
        }
    }

    @Test
    void roundTripAfterEditing() {
        SgfNode root = parser.parse("(;B[aa](;W[bb])(;W[cc]))");
        root.add(new SgfNode(SgfProperties.builder().add("W", "dd").add("C", "new").build()),
                new TreeCoordinates(1, 3));
        root.remove(new TreeCoordinates(1, 1));
        root.shift(new TreeCoordinates(1, 1));

        String written = writer.toSgf(root);

        assertEquals("(;B[aa](;W[dd]C[new])(;W[cc]))", written);
        assertEquals(writer.toData(root), writer.toData(parser.parse(written)));
    }

    @Test
    void singleRemainingVariationIsWrittenAsSequence() {
        SgfNode root = parser.parse("(;B[aa](;W[bb])(;W[cc]))");
        root.remove(new TreeCoordinates(1, 2));
        assertEquals("(;B[aa];W[bb])", writer.toSgf(root));
    }

    @Test
    void toDataMirrorsTree() {
        SgfNode root = parser.parse("(;B[aa](;W[bb])(;AB[cc][dd]))");

        SgfTreeData data = writer.toData(root);

        assertTrue(data.data().isEmpty());
        SgfTreeData black = data.children().get(0);
        assertEquals("aa", black.data().getFirst("B"));
        assertEquals(2, black.children().size());
        assertEquals(List.of("cc", "dd"), black.children().get(1).data().get("AB").values());
        assertTrue(black.children().get(1).children().isEmpty());
    }

    @Test
    void toArrayNestsRawText() {
        SgfNode root = parser.parse("(;B[aa];W[bb])");

        List<Object> array = writer.toArray(root);

        List<Object> expected = List.of("", List.of(
                List.of("B[aa]", List.of(
                        List.of("W[bb]", List.of())))));
        assertEquals(expected, array);
    }

    @Test
    void projectionsAreRepeatable() {
        SgfNode root = parser.parse("(;B[aa](;W[bb])(;W[cc]))");
        assertEquals(writer.toData(root), writer.toData(root));
        assertEquals(writer.toArray(root), writer.toArray(root));
        assertEquals(writer.toPrettyJson(root), writer.toPrettyJson(root));
    }

    @Test
    void prettyJson() {
        SgfNode root = parser.parse("(;B[aa]AB[cc][dd]C[say \"hi\"])");

        String expected = """
                {
                  "data": {},
                  "children": [
                    {
                      "data": {
                        "B": "aa",
                        "AB": [
                          "cc",
                          "dd"
                        ],
                        "C": "say \\"hi\\""
                      },
                      "children": []
                    }
                  ]
                }""";
        assertEquals(expected, writer.toPrettyJson(root));
    }

    @Test
    void quoteEscapesControlAndLineSeparatorCharacters() {
        assertEquals("\"a\\\\b\\u0001\"", SgfWriter.quote("a\\b\u0001"));
        assertEquals("\"line\\nbreak\\u2028\"", SgfWriter.quote("line\nbreak\u2028"));
    }

    @Test
    void writeLongGame() {
        int moves = 50_000;
        String sgf = "(;GM[1]" + ";B[aa];W[bb]".repeat(moves / 2) + ")";
        SgfNode parsed = parser.parse(sgf);

        String written = writer.toSgf(parsed);

        assertEquals(sgf, written);
        assertEquals(written, writer.toSgf(parser.parse(written)));

        SgfTreeData data = writer.toData(parsed).children().get(0);
        int dataDepth = 1;
        while (!data.children().isEmpty()) {
            data = data.children().get(0);
            dataDepth++;
        }
        assertEquals(moves + 1, dataDepth);
        assertEquals("bb", data.data().getFirst("W"));

        List<?> array = (List<?>) ((List<?>) writer.toArray(parsed).get(1)).get(0);
        int arrayDepth = 1;
        while (!((List<?>) array.get(1)).isEmpty()) {
            array = (List<?>) ((List<?>) array.get(1)).get(0);
            arrayDepth++;
        }
        assertEquals(moves + 1, arrayDepth);
        assertEquals("W[bb]", array.get(0));
    }

    @Test
    void writeDeeplyNestedBranches() {
        int depth = 20_000;
        SgfNode parsed = parser.parse("(;B[aa]".repeat(depth) + ")".repeat(depth));

        String written = writer.toSgf(parsed);

        assertEquals("(;B[aa]" + ";B[aa]".repeat(depth - 1) + ")", written);
        assertEquals(written, writer.toSgf(parser.parse(written)));
    }

    @Test
    void prettyJsonOfVariations() {
        SgfNode root = parser.parse("(;B[aa](;W[bb])(;W[cc]))");
        SgfNode black = root.getChildren().get(0);

        String expected = """
                {
                  "data": {
                    "B": "aa"
                  },
                  "children": [
                    {
                      "data": {
                        "W": "bb"
                      },
                      "children": []
                    },
                    {
                      "data": {
                        "W": "cc"
                      },
                      "children": []
                    }
                  ]
                }""";
        assertEquals(expected, writer.toPrettyJson(black));
    }
}
