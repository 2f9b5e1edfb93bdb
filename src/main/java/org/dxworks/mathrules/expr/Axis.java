package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Navigation axes. {@link #select(Node)} returns nodes in axis order: document order for forward
 * axes, nearest-first for reverse axes, which is what positional predicates count in.
 */
public enum Axis {
    CHILD("child"),
    DESCENDANT("descendant"),
    DESCENDANT_OR_SELF("descendant-or-self"),
    PARENT("parent"),
    ANCESTOR("ancestor"),
    ANCESTOR_OR_SELF("ancestor-or-self"),
    FOLLOWING_SIBLING("following-sibling"),
    PRECEDING_SIBLING("preceding-sibling"),
    FOLLOWING("following"),
    PRECEDING("preceding"),
    ATTRIBUTE("attribute"),
    SELF("self");

    private final String axisName;

    Axis(String axisName) {
        this.axisName = axisName;
    }

    public NodeKind principalKind() {
        return this == ATTRIBUTE ? NodeKind.ATTRIBUTE : NodeKind.ELEMENT;
    }

    public static Axis fromName(String name) {
        for (Axis axis : values()) {
            if (axis.axisName.equals(name)) return axis;
        }
        return null;
    }

    public List<Node> select(Node node) {
        List<Node> result = new ArrayList<>();
        switch (this) {
            case CHILD:
                result.addAll(childNodes(node));
                break;
            case DESCENDANT:
                addDescendants(node, result);
                break;
            case DESCENDANT_OR_SELF:
                result.add(node);
                addDescendants(node, result);
                break;
            case PARENT:
                if (node.getParent() != null) result.add(node.getParent());
                break;
            case ANCESTOR:
                for (Node n = node.getParent(); n != null; n = n.getParent()) result.add(n);
                break;
            case ANCESTOR_OR_SELF:
                for (Node n = node; n != null; n = n.getParent()) result.add(n);
                break;
            case FOLLOWING_SIBLING:
                for (Node n = node.nextSibling(); n != null; n = n.nextSibling()) result.add(n);
                break;
            case PRECEDING_SIBLING:
                for (Node n = node.previousSibling(); n != null; n = n.previousSibling()) result.add(n);
                break;
            case FOLLOWING:
                for (Node n = elementOf(node); n != null; n = n.getParent()) {
                    for (Node sibling = n.nextSibling(); sibling != null; sibling = sibling.nextSibling()) {
                        result.add(sibling);
                        addDescendants(sibling, result);
                    }
                }
                if (!node.isElement()) {
                    // nodes inside the owner element follow its attributes and text
                    List<Node> inside = new ArrayList<>();
                    addDescendants(elementOf(node), inside);
                    inside.removeIf(n -> n == node);
                    result.addAll(0, inside);
                }
                break;
            case PRECEDING:
                for (Node n = elementOf(node); n != null; n = n.getParent()) {
                    for (Node sibling = n.previousSibling(); sibling != null; sibling = sibling.previousSibling()) {
                        List<Node> subtree = new ArrayList<>();
                        subtree.add(sibling);
                        addDescendants(sibling, subtree);
                        Collections.reverse(subtree);
                        result.addAll(subtree);
                    }
                }
                break;
            case ATTRIBUTE:
                if (node.isElement()) result.addAll(node.attributeNodes());
                break;
            case SELF:
                result.add(node);
                break;
            default:
                break;
        }
        return result;
    }

    private static Node elementOf(Node node) {
        return node.isElement() ? node : node.getParent();
    }

    private static List<Node> childNodes(Node node) {
        if (!node.isElement()) return Collections.emptyList();
        if (node.isLeaf()) {
            return node.textNode() == null ? Collections.emptyList() : List.of(node.textNode());
        }
        return node.children();
    }

    private static void addDescendants(Node node, List<Node> into) {
        for (Node child : childNodes(node)) {
            into.add(child);
            addDescendants(child, into);
        }
    }
}
