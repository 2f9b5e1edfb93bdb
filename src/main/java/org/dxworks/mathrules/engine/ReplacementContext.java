package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.Coerce;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.expr.EvalContext;
import org.dxworks.mathrules.expr.EvaluationException;
import org.dxworks.mathrules.expr.NodeSetValue;
import org.dxworks.mathrules.expr.Value;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.replace.Instruction;
import org.dxworks.mathrules.rules.VariableDef;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;

import java.util.List;

/**
 * State seen by replacement instructions while one rule (or one character entry) is applied:
 * the matched node and the variables in effect.
 */
public final class ReplacementContext {

    private final Conversion conversion;
    private final Node node;
    private final Scope scope;
    private final String ruleName;
    private final boolean characterRule;

    ReplacementContext(Conversion conversion, Node node, Scope scope, String ruleName, boolean characterRule) {
        this.conversion = conversion;
        this.node = node;
        this.scope = scope;
        this.ruleName = ruleName;
        this.characterRule = characterRule;
    }

    public Node getNode() {
        return node;
    }

    public Scope getScope() {
        return scope;
    }

    public String getRuleName() {
        return ruleName;
    }

    public ReplacementContext withScope(Scope other) {
        return new ReplacementContext(conversion, node, other, ruleName, characterRule);
    }

    public Value evaluate(CompiledExpression expression) {
        return evaluate(expression, scope);
    }

    public boolean evaluateBoolean(CompiledExpression expression) {
        return Coerce.toBoolean(evaluate(expression));
    }

    public String evaluateString(CompiledExpression expression) {
        return Coerce.toString(evaluate(expression));
    }

    /**
     * Evaluates the definitions in order, each one against the bindings made before it, and
     * returns the resulting scope.
     */
    public Scope bindAll(List<VariableDef> variables) {
        Scope result = scope;
        for (VariableDef variable : variables) {
            result = result.bind(variable.getName(), evaluate(variable.getExpression(), result));
        }
        return result;
    }

    /**
     * Node-sets are dispatched node by node; any other value is emitted as text.
     */
    public void emit(Value value, OutputSink out) {
        if (value instanceof NodeSetValue) {
            for (Node selected : ((NodeSetValue) value).nodes()) {
                dispatch(selected, out);
            }
        } else {
            conversion.emitText(Coerce.toString(value), node, scope, out, characterRule);
        }
    }

    public void dispatch(Node target, OutputSink out) {
        conversion.dispatch(target, scope, out);
    }

    public void run(List<Instruction> instructions, OutputSink out) {
        for (Instruction instruction : instructions) {
            instruction.execute(this, out);
        }
    }

    public ReplacementEvaluationException error(String message, Throwable cause) {
        return new ReplacementEvaluationException(message, TreeHelper.path(node), ruleName, cause);
    }

    private Value evaluate(CompiledExpression expression, Scope variables) {
        EvalContext context = conversion.evalContext(node, variables);
        try {
            return expression.evaluate(context);
        } catch (EvaluationException e) {
            throw error("Cannot evaluate '" + expression.getSource() + "': " + e.getMessage(), e);
        }
    }
}
