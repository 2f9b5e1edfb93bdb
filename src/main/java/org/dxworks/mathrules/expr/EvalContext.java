package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.tree.Node;

/**
 * Everything an expression can see: the context node with its position and size inside the
 * node-set being filtered, the variable bindings, and the lookup tables used by the math functions.
 */
public final class EvalContext {

    private final Node node;
    private final int position;
    private final int size;
    private final VariableResolver variables;
    private final Definitions definitions;
    private final BrailleCodeService braille;

    public EvalContext(Node node, VariableResolver variables, Definitions definitions, BrailleCodeService braille) {
        this(node, 1, 1, variables, definitions, braille);
    }

    private EvalContext(Node node, int position, int size, VariableResolver variables,
                        Definitions definitions, BrailleCodeService braille) {
        this.node = node;
        this.position = position;
        this.size = size;
        this.variables = variables == null ? VariableResolver.EMPTY : variables;
        this.definitions = definitions == null ? Definitions.EMPTY : definitions;
        this.braille = braille == null ? DefaultBrailleCodeService.INSTANCE : braille;
    }

    public static EvalContext of(Node node) {
        return new EvalContext(node, null, null, null);
    }

    public EvalContext at(Node other, int otherPosition, int otherSize) {
        return new EvalContext(other, otherPosition, otherSize, variables, definitions, braille);
    }

    public EvalContext withVariables(VariableResolver other) {
        return new EvalContext(node, position, size, other, definitions, braille);
    }

    public Node getNode() {
        return node;
    }

    public int getPosition() {
        return position;
    }

    public int getSize() {
        return size;
    }

    public VariableResolver getVariables() {
        return variables;
    }

    public Definitions getDefinitions() {
        return definitions;
    }

    public BrailleCodeService getBraille() {
        return braille;
    }
}
