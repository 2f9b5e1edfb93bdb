package org.dxworks.mathrules.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a MathML (or intent) tree.
 *
 * Elements own their children exclusively: a node can be adopted by one parent only.
 * A leaf element carries text instead of children. Attribute and text nodes are
 * created together with their element so that the whole tree is immutable once built;
 * they are reachable only through {@link #attributeNode(String)} and {@link #textNode()},
 * never through {@link #children()}.
 */
public final class Node {

    private static final int ATTRIBUTE_ORDER_BASE = Integer.MIN_VALUE / 2;

    private final NodeKind kind;
    private final String name;
    private final Map<String, String> attributes;
    private final List<Node> children;
    private final String text;
    private final Map<String, Node> attributeNodes;
    private final Node textNode;

    private Node parent;
    private int index = -1;

    private Node(NodeKind kind, String name, Map<String, String> attributes, List<Node> children, String text) {
        this.kind = kind;
        this.name = name;
        this.attributes = attributes;
        this.children = children;
        this.text = text;

        if (kind != NodeKind.ELEMENT) {
            this.attributeNodes = Collections.emptyMap();
            this.textNode = null;
            return;
        }

        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child.kind != NodeKind.ELEMENT) {
                throw new IllegalArgumentException("Only elements can be children of <" + name + ">");
            }
            if (child.parent != null) {
                throw new IllegalArgumentException("<" + child.name + "> already belongs to <" + child.parent.name + ">");
            }
            child.parent = this;
            child.index = i;
        }

        Map<String, Node> attrs = new LinkedHashMap<>();
        int attrIndex = 0;
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            Node attr = new Node(NodeKind.ATTRIBUTE, e.getKey(), Collections.emptyMap(), Collections.emptyList(), e.getValue());
            attr.parent = this;
            attr.index = ATTRIBUTE_ORDER_BASE + attrIndex++;
            attrs.put(e.getKey(), attr);
        }
        this.attributeNodes = Collections.unmodifiableMap(attrs);

        if (children.isEmpty() && text != null && !text.isEmpty()) {
            Node t = new Node(NodeKind.TEXT, "#text", Collections.emptyMap(), Collections.emptyList(), text);
            t.parent = this;
            t.index = -1;
            this.textNode = t;
        } else {
            this.textNode = null;
        }
    }

    public static Node element(String name, Map<String, String> attributes, List<Node> children) {
        Objects.requireNonNull(name, "name");
        return new Node(NodeKind.ELEMENT, name,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes)),
                List.copyOf(children == null ? List.of() : children),
                null);
    }

    public static Node element(String name, Node... children) {
        return element(name, Map.of(), List.of(children));
    }

    public static Node leaf(String name, Map<String, String> attributes, String text) {
        Objects.requireNonNull(name, "name");
        return new Node(NodeKind.ELEMENT, name,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes)),
                List.of(),
                text == null ? "" : text);
    }

    public static Node leaf(String name, String text) {
        return leaf(name, Map.of(), text);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean isElement() {
        return kind == NodeKind.ELEMENT;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String attributeName) {
        return attributes.get(attributeName);
    }

    public String getId() {
        return attributes.get("id");
    }

    public List<Node> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public Node child(int i) {
        return i >= 0 && i < children.size() ? children.get(i) : null;
    }

    public boolean isLeaf() {
        return kind == NodeKind.ELEMENT && children.isEmpty();
    }

    /**
     * Text of a leaf element, the value of an attribute node, or the content of a text node.
     * Null for elements that have children.
     */
    public String getText() {
        return text;
    }

    public Node getParent() {
        return parent;
    }

    public int getIndex() {
        return index;
    }

    public Node attributeNode(String attributeName) {
        return attributeNodes.get(attributeName);
    }

    public List<Node> attributeNodes() {
        return new ArrayList<>(attributeNodes.values());
    }

    public Node textNode() {
        return textNode;
    }

    public Node root() {
        Node n = this;
        while (n.parent != null) {
            n = n.parent;
        }
        return n;
    }

    public Node previousSibling() {
        if (parent == null || kind != NodeKind.ELEMENT) return null;
        return parent.child(index - 1);
    }

    public Node nextSibling() {
        if (parent == null || kind != NodeKind.ELEMENT) return null;
        return parent.child(index + 1);
    }

    /**
     * XPath string-value: the concatenated text of all descendant leaves for elements.
     */
    public String stringValue() {
        if (kind != NodeKind.ELEMENT) {
            return text == null ? "" : text;
        }
        if (children.isEmpty()) {
            return text == null ? "" : text;
        }
        StringBuilder sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(Node node, StringBuilder sb) {
        if (node.children.isEmpty()) {
            if (node.text != null) sb.append(node.text);
            return;
        }
        for (Node child : node.children) {
            appendText(child, sb);
        }
    }

    /**
     * Orders nodes of the same tree in document order: an element comes before its attributes,
     * its attributes before its text, and its text before its children.
     */
    public static int compareDocumentOrder(Node a, Node b) {
        if (a == b) return 0;
        List<Integer> pa = orderKey(a);
        List<Integer> pb = orderKey(b);
        int n = Math.min(pa.size(), pb.size());
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(pa.get(i), pb.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(pa.size(), pb.size());
    }

    private static List<Integer> orderKey(Node node) {
        List<Integer> key = new ArrayList<>();
        for (Node n = node; n.parent != null; n = n.parent) {
            key.add(n.index);
        }
        Collections.reverse(key);
        return key;
    }

    @Override
    public String toString() {
        switch (kind) {
            case ATTRIBUTE:
                return "@" + name + "='" + text + "'";
            case TEXT:
                return "'" + text + "'";
            default:
                if (children.isEmpty()) {
                    return "<" + name + ">" + (text == null ? "" : text) + "</" + name + ">";
                }
                return "<" + name + " children=" + children.size() + ">";
        }
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Node> children = new ArrayList<>();
        private String text;

        private Builder(String name) {
            this.name = name;
        }

        public Builder attribute(String attributeName, String value) {
            attributes.put(attributeName, value);
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            attributes.putAll(values);
            return this;
        }

        public Builder id(String id) {
            return attribute("id", id);
        }

        public Builder child(Node child) {
            children.add(child);
            return this;
        }

        public Builder children(List<Node> nodes) {
            children.addAll(nodes);
            return this;
        }

        public Builder text(String value) {
            this.text = value;
            return this;
        }

        public Node build() {
            if (!children.isEmpty() && text != null && !text.isEmpty()) {
                throw new IllegalArgumentException("<" + name + "> cannot have both text and children");
            }
            if (children.isEmpty()) {
                return leaf(name, attributes, text);
            }
            return element(name, attributes, children);
        }
    }
}
