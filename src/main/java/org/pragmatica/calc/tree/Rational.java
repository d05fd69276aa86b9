package org.pragmatica.calc.tree;

import org.pragmatica.calc.error.CalcError;
import org.pragmatica.calc.error.CalcException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Exact arbitrary-precision rational number.
 * Always kept in lowest terms with a positive denominator, so record equality is value equality.
 */
public record Rational(BigInteger numerator, BigInteger denominator) {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    // one guard digit above what a double can hold
    private static final MathContext TO_DOUBLE = new MathContext(18);

    public Rational {
        if (denominator.signum() == 0) {
            throw new CalcException(new CalcError.DivisionByZero(numerator + "/0"));
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        var gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
    }

    public static Rational of(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational of(BigInteger numerator, BigInteger denominator) {
        return new Rational(numerator, denominator);
    }

    public Rational add(Rational other) {
        return new Rational(numerator.multiply(other.denominator)
                                     .add(other.numerator.multiply(denominator)),
                            denominator.multiply(other.denominator));
    }

    public Rational multiply(Rational other) {
        return new Rational(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    /**
     * Swap numerator and denominator.
     *
     * @throws CalcException with {@link CalcError.DivisionByZero} when this value is zero
     */
    public Rational reciprocal() {
        if (isZero()) {
            throw new CalcException(new CalcError.DivisionByZero("reciprocal of 0"));
        }
        return new Rational(denominator, numerator);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    /**
     * Nearest double approximation. Works for values whose numerator or denominator alone
     * would overflow a double.
     */
    public double toDouble() {
        if (isInteger()) {
            return numerator.doubleValue();
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), TO_DOUBLE)
                                        .doubleValue();
    }

    @Override
    public String toString() {
        return isInteger()
               ? numerator.toString()
               : numerator + "/" + denominator;
    }
}
