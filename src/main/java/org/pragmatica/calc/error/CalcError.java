package org.pragmatica.calc.error;

/**
 * Description of a failure raised while computing with exact values.
 */
public sealed interface CalcError {
    String message();

    /**
     * Exact division by zero, either a zero denominator or the reciprocal of zero.
     */
    record DivisionByZero(String context) implements CalcError {
        @Override
        public String message() {
            return "Division by zero in " + context;
        }
    }

    /**
     * A value that cannot be represented by the exact number type.
     */
    record UnsupportedValue(String detail) implements CalcError {
        @Override
        public String message() {
            return "Unsupported value: " + detail;
        }
    }
}
