package org.pragmatica.calc.error;

/**
 * Unchecked carrier for a {@link CalcError}.
 */
public final class CalcException extends ArithmeticException {
    private final transient CalcError error;

    public CalcException(CalcError error) {
        super(error.message());
        this.error = error;
    }

    public CalcError error() {
        return error;
    }
}
