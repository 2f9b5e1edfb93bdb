package org.dxworks.mathrules.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class TreeHelper {

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(Node node, String... types) {
        if (node == null || !node.isElement()) return false;
        return isTypeOneOf(node.getName(), types);
    }

    /**
     * Number of element levels below and including {@code node}; a single leaf has height 1.
     */
    public static int height(Node node) {
        if (node == null) return 0;
        int max = 0;
        for (Node child : node.children()) {
            max = Math.max(max, height(child));
        }
        return max + 1;
    }

    /**
     * Diagnostic location such as {@code /math[1]/mrow[1]/msup[2]}, counting same-named siblings.
     */
    public static String path(Node node) {
        if (node == null) return "";
        if (!node.isElement()) {
            Node owner = node.getParent();
            String self = node.getKind() == NodeKind.ATTRIBUTE ? "@" + node.getName() : "text()";
            return (owner == null ? "" : path(owner)) + "/" + self;
        }
        Deque<String> parts = new ArrayDeque<>();
        for (Node n = node; n != null; n = n.getParent()) {
            int position = 1;
            Node parent = n.getParent();
            if (parent != null) {
                for (int i = 0; i < n.getIndex(); i++) {
                    if (parent.child(i).getName().equals(n.getName())) position++;
                }
            }
            parts.push(n.getName() + "[" + position + "]");
        }
        return "/" + String.join("/", parts);
    }

    /**
     * A copy of the tree in which every element without an {@code id} gets one, numbered in
     * document order ({@code m1}, {@code m2}, ...) and skipping ids the tree already uses.
     */
    public static Node assignIds(Node root) {
        Set<String> taken = new HashSet<>();
        collectIds(root, taken);
        return withIds(root, taken, new int[]{0});
    }

    private static void collectIds(Node node, Set<String> into) {
        if (node.getId() != null) into.add(node.getId());
        for (Node child : node.children()) {
            collectIds(child, into);
        }
    }

    private static Node withIds(Node node, Set<String> taken, int[] counter) {
        Map<String, String> attributes = new LinkedHashMap<>(node.getAttributes());
        if (node.getId() == null) {
            String id;
            do {
                id = "m" + (++counter[0]);
            } while (taken.contains(id));
            attributes.put("id", id);
        }
        if (node.isLeaf()) {
            return Node.leaf(node.getName(), attributes, node.getText());
        }
        List<Node> children = new ArrayList<>();
        for (Node child : node.children()) {
            children.add(withIds(child, taken, counter));
        }
        return Node.element(node.getName(), attributes, children);
    }
}
