package org.pragmatica.calc.tree;

/**
 * Named mathematical constants.
 */
public enum ConstKind {
    PI("pi", Math.PI),
    TAU("tau", Math.PI * 2.0),
    E("e", Math.E);

    private final String symbol;
    private final double value;

    ConstKind(String symbol, double value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String symbol() {
        return symbol;
    }

    public double value() {
        return value;
    }
}
