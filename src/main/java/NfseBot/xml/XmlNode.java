package NfseBot.xml;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Element of a parsed document, reduced to what the extraction needs:
 * local name without namespace prefix, attributes, text content and child elements.
 *
 * Nodes are only mutated by {@link XmlTreeParser} while the tree is being built.
 */
public final class XmlNode {

    private final String localName;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final StringBuilder text = new StringBuilder();
    private final List<XmlNode> children = new ArrayList<>();

    public XmlNode(String localName) {
        this.localName = localName;
    }

    // =====================
    // Accessors
    // =====================

    public String getLocalName() { return localName; }
    public Map<String, String> getAttributes() { return Collections.unmodifiableMap(attributes); }
    public String getText() { return text.toString(); }
    public List<XmlNode> getChildren() { return Collections.unmodifiableList(children); }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    // =====================
    // Tree building
    // =====================

    XmlNode addChild(XmlNode child) {
        children.add(child);
        return child;
    }

    void putAttribute(String name, String value) {
        attributes.putIfAbsent(name, value);
    }

    void appendText(String chunk) {
        text.append(chunk);
    }

    // =====================
    // Search
    // =====================

    /**
     * Depth-first, pre-order search (this node included) for the first element with the given
     * local name in document order. Returns null if there is none.
     */
    public XmlNode findFirst(String name) {
        return search(name, false);
    }

    /**
     * Like {@link #findFirst(String)} but skips elements whose text is blank, so container
     * elements such as {@code <CpfCnpj>} never shadow a populated one later in the document.
     */
    public XmlNode findFirstWithText(String name) {
        return search(name, true);
    }

    /**
     * Number of elements with the given local name in this subtree, this node included.
     */
    public int countAll(String name) {
        int count = 0;
        Deque<XmlNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            XmlNode node = pending.pop();
            if (node.localName.equals(name)) {
                count++;
            }
            node.children.forEach(pending::push);
        }
        return count;
    }

    // explicit stack: documents may nest far deeper than the call stack allows
    private XmlNode search(String name, boolean withText) {
        Deque<XmlNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            XmlNode node = pending.pop();
            if (node.localName.equals(name) && (!withText || !node.text.toString().isBlank())) {
                return node;
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "XmlNode{" +
                "localName='" + localName + '\'' +
                ", attributes=" + attributes +
                ", children=" + children.size() +
                '}';
    }
}
