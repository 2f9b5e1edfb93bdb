package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes in document order without duplicates.
 */
public final class NodeSetValue implements Value {

    public static final NodeSetValue EMPTY = new NodeSetValue(Collections.emptyList());

    private final List<Node> nodes;

    private NodeSetValue(List<Node> nodes) {
        this.nodes = nodes;
    }

    public static NodeSetValue of(Node node) {
        return node == null ? EMPTY : new NodeSetValue(List.of(node));
    }

    /**
     * Copies, deduplicates and sorts {@code nodes} into document order.
     */
    public static NodeSetValue of(Collection<Node> nodes) {
        if (nodes.isEmpty()) return EMPTY;
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        List<Node> unique = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (node != null && seen.put(node, Boolean.TRUE) == null) {
                unique.add(node);
            }
        }
        unique.sort(Node::compareDocumentOrder);
        return new NodeSetValue(Collections.unmodifiableList(unique));
    }

    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Node first() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    @Override
    public ValueType type() {
        return ValueType.NODE_SET;
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
