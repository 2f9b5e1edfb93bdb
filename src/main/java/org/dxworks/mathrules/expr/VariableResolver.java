package org.dxworks.mathrules.expr;

@FunctionalInterface
public interface VariableResolver {

    VariableResolver EMPTY = name -> {
        throw new UnboundVariableException(name);
    };

    /**
     * @throws UnboundVariableException when {@code name} is not bound
     */
    Value resolve(String name);
}
