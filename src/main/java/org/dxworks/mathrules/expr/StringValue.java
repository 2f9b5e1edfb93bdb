package org.dxworks.mathrules.expr;

public final class StringValue implements Value {

    public static final StringValue EMPTY = new StringValue("");

    private final String value;

    public StringValue(String value) {
        this.value = value == null ? "" : value;
    }

    public static StringValue of(String value) {
        return value == null || value.isEmpty() ? EMPTY : new StringValue(value);
    }

    public String get() {
        return value;
    }

    @Override
    public ValueType type() {
        return ValueType.STRING;
    }

    @Override
    public String toString() {
        return value;
    }
}
