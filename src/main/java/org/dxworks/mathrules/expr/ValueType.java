package org.dxworks.mathrules.expr;

public enum ValueType {
    BOOLEAN,
    NUMBER,
    STRING,
    NODE_SET
}
