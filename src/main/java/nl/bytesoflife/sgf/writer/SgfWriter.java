package nl.bytesoflife.sgf.writer;

import nl.bytesoflife.sgf.model.PropertyValue;
import nl.bytesoflife.sgf.model.SgfNode;
import nl.bytesoflife.sgf.model.SgfProperties;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes a game tree back out: as SGF text, as a {@link SgfTreeData} copy, as nested lists of
 * node text, or as pretty-printed JSON. None of these modify the tree.
 * <p>
 * Every move of a game is one level deeper in the tree, so all projections walk it with an
 * explicit work stack instead of recursing.
 */
public class SgfWriter {

    private static final String INDENT = "  ";

    /**
     * Writes SGF text. Called on the root it writes every game tree of the collection, each in its
     * own parentheses. Called on any other node it writes that node and its subtree without the
     * enclosing parentheses.
     */
    public String toSgf(SgfNode node) {
        StringBuilder sb = new StringBuilder();
        // SgfNode entries are written as node text, String entries verbatim
        Deque<Object> work = new ArrayDeque<>();
        if (node.isRoot()) {
            pushVariations(work, node.getChildren());
        } else {
            work.push(node);
        }

        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String s) {
                sb.append(s);
                continue;
            }
            SgfNode current = (SgfNode) item;
            sb.append(current.getRawText());
            while (current.getChildren().size() == 1) {
                current = current.getChildren().get(0);
                sb.append(';').append(current.getRawText());
            }
            pushVariations(work, current.getChildren());
        }
        return sb.toString();
    }

    private void pushVariations(Deque<Object> work, List<SgfNode> variations) {
        for (int i = variations.size() - 1; i >= 0; i--) {
            work.push(")");
            work.push(variations.get(i));
            work.push("(;");
        }
    }

    public SgfTreeData toData(SgfNode node) {
        // Children before parents: reverse of a pre-order walk
        List<SgfNode> preOrder = preOrder(node);
        Map<SgfNode, SgfTreeData> built = new IdentityHashMap<>();
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            SgfNode current = preOrder.get(i);
            List<SgfTreeData> children = new ArrayList<>(current.getChildren().size());
            for (SgfNode child : current.getChildren()) {
                children.add(built.remove(child));
            }
            built.put(current, new SgfTreeData(current.getProperties(), children));
        }
        return built.get(node);
    }

    private List<SgfNode> preOrder(SgfNode node) {
        List<SgfNode> nodes = new ArrayList<>();
        Deque<SgfNode> work = new ArrayDeque<>();
        work.push(node);
        while (!work.isEmpty()) {
            SgfNode current = work.pop();
            nodes.add(current);
            List<SgfNode> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                work.push(children.get(i));
            }
        }
        return nodes;
    }

    /**
     * Nested lists of the form {@code [rawText, [child, child, ...]]}, where every child is again
     * such a two-element list.
     */
    public List<Object> toArray(SgfNode node) {
        List<Object> children = new ArrayList<>();
        List<Object> result = List.of(node.getRawText(), children);

        Deque<ArrayEntry> work = new ArrayDeque<>();
        work.push(new ArrayEntry(node, children));
        while (!work.isEmpty()) {
            ArrayEntry entry = work.pop();
            for (SgfNode child : entry.node().getChildren()) {
                List<Object> grandChildren = new ArrayList<>();
                entry.children().add(List.of(child.getRawText(), grandChildren));
                work.push(new ArrayEntry(child, grandChildren));
            }
        }
        return result;
    }

    private record ArrayEntry(SgfNode node, List<Object> children) {
    }

    /**
     * JSON of {@link #toData(SgfNode)}, indented by two spaces:
     * {@code {"data": {"B": "aa", "AB": ["aa", "bb"]}, "children": [...]}}.
     */
    public String toPrettyJson(SgfNode node) {
        StringBuilder json = new StringBuilder();
        // JsonEntry items open a node object, String items are written verbatim
        Deque<Object> work = new ArrayDeque<>();
        work.push(new JsonEntry(node, ""));

        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String s) {
                json.append(s);
                continue;
            }
            JsonEntry entry = (JsonEntry) item;
            String indent = entry.indent();
            String inner = indent + INDENT;
            List<SgfNode> children = entry.node().getChildren();

            json.append("{\n");
            json.append(inner).append("\"data\": ");
            appendProperties(json, entry.node().getProperties(), inner);
            json.append(",\n");
            json.append(inner).append("\"children\": ");
            if (children.isEmpty()) {
                json.append("[]\n").append(indent).append('}');
                continue;
            }

            json.append("[\n");
            work.push(inner + "]\n" + indent + "}");
            for (int i = children.size() - 1; i >= 0; i--) {
                work.push(i < children.size() - 1 ? ",\n" : "\n");
                work.push(new JsonEntry(children.get(i), inner + INDENT));
                work.push(inner + INDENT);
            }
        }
        return json.toString();
    }

    private record JsonEntry(SgfNode node, String indent) {
    }

    private void appendProperties(StringBuilder json, SgfProperties properties, String indent) {
        if (properties.isEmpty()) {
            json.append("{}");
            return;
        }
        String inner = indent + INDENT;
        json.append("{\n");
        Iterator<Map.Entry<String, PropertyValue>> it = properties.asMap().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, PropertyValue> entry = it.next();
            json.append(inner).append(quote(entry.getKey())).append(": ");
            if (entry.getValue() instanceof PropertyValue.Single single) {
                json.append(quote(single.value()));
            } else {
                appendValueList(json, entry.getValue().values(), inner);
            }
            json.append(it.hasNext() ? ",\n" : "\n");
        }
        json.append(indent).append('}');
    }

    private void appendValueList(StringBuilder json, List<String> values, String indent) {
        json.append("[\n");
        for (int i = 0; i < values.size(); i++) {
            json.append(indent).append(INDENT).append(quote(values.get(i)));
            json.append(i < values.size() - 1 ? ",\n" : "\n");
        }
        json.append(indent).append(']');
    }

    /**
     * JSON string literal of a property key or value. Parsed values never hold newlines or tabs,
     * but values of nodes built from properties can hold any character.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c == 0x2028 || c == 0x2029) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
