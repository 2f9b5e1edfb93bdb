package org.dxworks.mathrules.expr;

public class UnboundVariableException extends EvaluationException {

    private final String variableName;

    public UnboundVariableException(String variableName) {
        super("Unbound variable $" + variableName);
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
