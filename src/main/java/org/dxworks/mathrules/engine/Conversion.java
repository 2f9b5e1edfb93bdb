package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.BrailleCodeService;
import org.dxworks.mathrules.expr.EvalContext;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.rules.RuleSet;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;

import java.util.Optional;

/**
 * One pass over one tree. Not thread safe: create a new instance per conversion.
 */
public abstract class Conversion {

    protected final RuleSet rules;
    private final RuleDispatcher dispatcher;
    private final Definitions definitions;
    private final BrailleCodeService braille;
    private final int maxDepth;
    private int depth;

    protected Conversion(RuleSet rules, Definitions definitions, BrailleCodeService braille, int maxDepth) {
        this.rules = rules;
        this.dispatcher = new RuleDispatcher(rules);
        this.definitions = definitions;
        this.braille = braille;
        this.maxDepth = maxDepth;
    }

    public EvalContext evalContext(Node node, Scope scope) {
        return new EvalContext(node, scope, definitions, braille);
    }

    /**
     * Applies the first matching rule to an element. Text and attribute nodes are emitted as text.
     */
    public void dispatch(Node node, Scope scope, OutputSink out) {
        if (!node.isElement()) {
            emitText(node.stringValue(), node.getParent(), scope, out, false);
            return;
        }
        if (depth >= maxDepth) {
            throw new ReplacementEvaluationException("Rule recursion exceeded depth " + maxDepth,
                    TreeHelper.path(node), null, null);
        }
        depth++;
        try {
            Optional<RuleMatch> match = dispatcher.find(node, scope, this);
            if (match.isPresent()) {
                applyRule(node, match.get(), out);
            } else {
                noRule(node, scope, out);
            }
        } finally {
            depth--;
        }
    }

    protected void applyRule(Node node, RuleMatch match, OutputSink out) {
        context(node, match.getScope(), match.getRule().getName(), false)
                .run(match.getRule().getReplace(), out);
    }

    protected ReplacementContext context(Node node, Scope scope, String ruleName, boolean characterRule) {
        return new ReplacementContext(this, node, scope, ruleName, characterRule);
    }

    protected abstract void noRule(Node node, Scope scope, OutputSink out);

    /**
     * Emits computed text produced while {@code context} was being converted.
     */
    protected abstract void emitText(String text, Node context, Scope scope, OutputSink out, boolean characterRule);
}
