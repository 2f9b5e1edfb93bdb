package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.NodeKind;

/**
 * {@code *}, a name, {@code text()} or {@code node()}. Namespace prefixes such as {@code m:} are ignored.
 */
final class NodeTest {

    enum Kind { ANY, NAME, TEXT, NODE }

    static final NodeTest ANY_NODE = new NodeTest(Kind.NODE, null);

    private final Kind kind;
    private final String name;

    private NodeTest(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    static NodeTest any() {
        return new NodeTest(Kind.ANY, null);
    }

    static NodeTest text() {
        return new NodeTest(Kind.TEXT, null);
    }

    static NodeTest named(String qualifiedName) {
        String local = localName(qualifiedName);
        if (local.equals("*")) return any();
        return new NodeTest(Kind.NAME, local);
    }

    static String localName(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1);
    }

    boolean matches(Node node, Axis axis) {
        switch (kind) {
            case NODE:
                return true;
            case TEXT:
                return node.getKind() == NodeKind.TEXT;
            case ANY:
                return node.getKind() == axis.principalKind();
            case NAME:
                return node.getKind() == axis.principalKind() && name.equals(node.getName());
            default:
                return false;
        }
    }
}
