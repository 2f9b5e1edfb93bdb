package org.dxworks.mathrules.expr;

public final class NumberValue implements Value {

    private final double value;

    public NumberValue(double value) {
        this.value = value;
    }

    public static NumberValue of(double value) {
        return new NumberValue(value);
    }

    public double get() {
        return value;
    }

    @Override
    public ValueType type() {
        return ValueType.NUMBER;
    }

    @Override
    public String toString() {
        return Coerce.formatNumber(value);
    }
}
