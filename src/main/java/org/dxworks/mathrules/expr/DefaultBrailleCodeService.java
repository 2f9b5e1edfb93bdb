package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

/**
 * Repeats nesting indicators per level of fractions nested inside the node and passes characters
 * through unchanged. Rule sets whose character tables already produce braille cells need nothing more.
 */
public class DefaultBrailleCodeService implements BrailleCodeService {

    public static final DefaultBrailleCodeService INSTANCE = new DefaultBrailleCodeService();

    @Override
    public String nestingChars(Node node, String indicator) {
        if (node == null) return "";
        int depth = 0;
        for (Node child : node.children()) {
            depth = Math.max(depth, fractionDepth(child));
        }
        return indicator.repeat(depth);
    }

    private static int fractionDepth(Node node) {
        int depth = 0;
        for (Node child : node.children()) {
            depth = Math.max(depth, fractionDepth(child));
        }
        return "mfrac".equals(node.getName()) ? depth + 1 : depth;
    }

    @Override
    public String brailleChars(String text, String code, Node node) {
        return text;
    }
}
