package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.BrailleCodeService;
import org.dxworks.mathrules.output.IntentNodeBuilder;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.rules.RuleSet;
import org.dxworks.mathrules.tree.Node;

import java.util.List;

/**
 * Rewrites a MathML tree into an intent tree. Nodes without a matching rule are copied with
 * their attributes and their converted children.
 */
public class IntentConversion extends Conversion {

    public static final String WRAPPER = "mrow";

    public IntentConversion(RuleSet rules, Definitions definitions, BrailleCodeService braille, int maxDepth) {
        super(rules, definitions, braille, maxDepth);
    }

    public Node convert(Node root, Scope scope) {
        IntentNodeBuilder out = new IntentNodeBuilder();
        dispatch(root, scope, out);
        Node result = materialize(root, out);
        if (result == null) {
            throw new ConversionException("Intent rules produced nothing for the root", "/" + root.getName() + "[1]", null);
        }
        return result;
    }

    @Override
    protected void applyRule(Node node, RuleMatch match, OutputSink out) {
        IntentNodeBuilder content = new IntentNodeBuilder();
        super.applyRule(node, match, content);
        Node result = materialize(node, content);
        if (result != null) {
            out.element(result);
        }
    }

    @Override
    protected void noRule(Node node, Scope scope, OutputSink out) {
        Node.Builder copy = Node.builder(node.getName()).attributes(node.getAttributes());
        if (node.isLeaf()) {
            copy.text(node.getText());
        } else {
            IntentNodeBuilder children = new IntentNodeBuilder();
            for (Node child : node.children()) {
                dispatch(child, scope, children);
            }
            copy.children(children.elements());
        }
        out.element(copy.build());
    }

    @Override
    protected void emitText(String text, Node context, Scope scope, OutputSink out, boolean characterRule) {
        out.text(text);
    }

    /**
     * One element is used as is, several are wrapped in an {@code mrow} carrying the original id,
     * text alone replaces the text of a copy of {@code original}, and no output drops the node.
     */
    static Node materialize(Node original, IntentNodeBuilder content) {
        if (content.isEmpty()) {
            return null;
        }
        if (!content.hasElements()) {
            return Node.leaf(original.getName(), original.getAttributes(), content.text());
        }
        List<Node> elements = content.elements();
        if (elements.size() == 1) {
            return elements.get(0);
        }
        Node.Builder wrapper = Node.builder(WRAPPER).children(elements);
        if (original.getId() != null) {
            wrapper.id(original.getId());
        }
        return wrapper.build();
    }
}
