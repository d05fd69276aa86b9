package org.pragmatica.calc.eval;

import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Approximate value of an expression plus the radix the output layer should prefer.
 */
public record EvalResult(double value, Optional<Integer> displayBase) {

    public static EvalResult of(double value) {
        return new EvalResult(value, Optional.empty());
    }

    public static EvalResult of(double value, Optional<Integer> displayBase) {
        return new EvalResult(value, displayBase);
    }

    /**
     * Apply a function to the value, keeping the base hint.
     */
    public EvalResult map(DoubleUnaryOperator function) {
        return new EvalResult(function.applyAsDouble(value), displayBase);
    }
}
