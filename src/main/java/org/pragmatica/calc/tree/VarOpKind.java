package org.pragmatica.calc.tree;

/**
 * Kind of an n-ary associative operator.
 *
 * <p>Parameterizes child collection in reduction: supplies the identity, the combining
 * function and the rule that collapses a repeated child. Collecting like terms
 * ({@code 2*x + 3*x}) and collecting like factors ({@code x^2 * x^3}) are then the same
 * algorithm.
 */
public enum VarOpKind {
    ADD,
    MUL;

    public String symbol() {
        return switch (this) {
            case ADD -> "+";
            case MUL -> "*";
        };
    }

    public double identityDouble() {
        return switch (this) {
            case ADD -> 0.0;
            case MUL -> 1.0;
        };
    }

    public Rational identityRational() {
        return switch (this) {
            case ADD -> Rational.ZERO;
            case MUL -> Rational.ONE;
        };
    }

    public double combine(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case MUL -> left * right;
        };
    }

    public Rational combine(Rational left, Rational right) {
        return switch (this) {
            case ADD -> left.add(right);
            case MUL -> left.multiply(right);
        };
    }

    /**
     * Collapse {@code term} repeated {@code count} times into a single node:
     * {@code count * term} for a sum, {@code term ^ count} for a product. The coefficient
     * comes first so that splitting the product again yields the same term and weight.
     */
    public Node compress(Node term, Node count) {
        return switch (this) {
            case ADD -> Node.mul(count, term);
            case MUL -> new Node.Exp(term, count);
        };
    }
}
