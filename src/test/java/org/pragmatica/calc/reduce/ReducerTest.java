package org.pragmatica.calc.reduce;

import org.junit.jupiter.api.Test;
import org.pragmatica.calc.error.CalcError;
import org.pragmatica.calc.error.CalcException;
import org.pragmatica.calc.eval.Evaluator;
import org.pragmatica.calc.tree.Node;
import org.pragmatica.calc.tree.Rational;
import org.pragmatica.calc.tree.VarOpKind;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class ReducerTest {
    private static final Node PI = Node.pi();
    private static final Node E = Node.e();

    /**
     * Expressions whose reduction preserves the value.
     */
    private static final List<Node> CORPUS = List.of(
        Node.add(Node.mul(Node.num(2), PI), Node.mul(Node.num(3), PI)),
        Node.mul(PI, PI),
        Node.add(Node.add(Node.num(1), Node.num(2)), E),
        Node.mul(Node.mul(Node.num(2), E), Node.mul(Node.num(3), E)),
        Node.div(PI, Node.num(2)),
        Node.add(Node.mul(PI, E), E),
        new Node.Sin(Node.add(PI, PI)),
        new Node.Exp(new Node.Exp(PI, Node.num(2)), Node.add(Node.one(), Node.one())),
        Node.mul(PI, new Node.Exp(PI, E)),
        Node.add(Node.mul(Node.num(2), Node.mul(PI, E)), Node.mul(Node.num(3), Node.mul(PI, E))),
        Node.sub(PI, PI),
        Node.mul(new Node.Inverse(PI), PI),
        new Node.Cos(Node.mul(Node.num(3), Node.tau())),
        Node.add(Node.num(Rational.of(1, 2)), Node.num(Rational.of(1, 3), 16)),
        Node.mul(Node.add(PI, Node.one()), Node.add(PI, Node.one())),
        Node.add(PI, Node.mul(PI, Node.num(2))),
        Node.div(Node.sub(Node.mul(Node.num(4), E), E), Node.num(3)),
        new Node.Tan(Node.add(Node.num(1), E)),
        Node.add(Node.mul(PI, E), Node.one()),
        Node.add(Node.mul(E, Node.mul(PI, new Node.Exp(PI, Node.minusOne()))), E)
    );

    // === General properties ===

    @Test
    void reduce_isIdempotent() {
        for (var node : CORPUS) {
            var once = Reducer.reduce(node);

            assertEquals(once, Reducer.reduce(once), () -> "not idempotent: " + node);
        }
    }

    @Test
    void reduce_preservesValue() {
        for (var node : CORPUS) {
            var expected = Evaluator.evaluate(node).value();
            var actual = Evaluator.evaluate(Reducer.reduce(node)).value();

            assertEquals(expected, actual, 1e-9, () -> "value changed: " + node);
        }
    }

    // === Sums and products ===

    @Test
    void associativity_isNormalized() {
        var left = Node.add(Node.add(Node.num(1), Node.num(2)), Node.num(3));
        var right = Node.add(Node.num(1), Node.add(Node.num(2), Node.num(3)));

        assertEquals(Node.num(6), Reducer.reduce(left));
        assertEquals(Node.num(6), Reducer.reduce(right));
    }

    @Test
    void likeTerms_areCollected() {
        var node = Node.add(Node.mul(Node.num(2), PI), Node.mul(Node.num(3), PI));

        assertEquals(Node.mul(Node.num(5), PI), Reducer.reduce(node));
    }

    @Test
    void likeTerms_withoutCoefficient_countOnce() {
        assertEquals(Node.mul(Node.num(3), PI), Reducer.reduce(Node.add(PI, Node.mul(PI, Node.num(2)))));
    }

    @Test
    void likeTerms_withCompoundKey_areCollected() {
        var piE = Node.mul(PI, E);
        var node = Node.add(Node.mul(Node.num(2), piE), Node.mul(Node.num(3), piE));

        assertEquals(new Node.VarOp(VarOpKind.MUL, List.of(Node.num(5), PI, E)), Reducer.reduce(node));
    }

    @Test
    void literalFreeProduct_inSum_keepsFactorOrder() {
        var once = Reducer.reduce(Node.add(Node.mul(PI, E), Node.one()));

        assertEquals(Node.add(Node.mul(PI, E), Node.one()), once);
        assertEquals(once, Reducer.reduce(once));
        assertEquals(once, Reducer.reduce(Reducer.reduce(once)));
    }

    @Test
    void cancelledFactor_leavesNoLiteralOne() {
        var product = Node.mul(E, Node.mul(PI, new Node.Exp(PI, Node.minusOne())));

        assertEquals(Node.mul(Node.num(2), E), Reducer.reduce(Node.add(product, E)));
        assertEquals(Node.mul(Node.one(), E), Reducer.reduce(product));
    }

    @Test
    void likeFactors_areCollected() {
        var sum = Node.add(PI, E);

        assertEquals(new Node.Exp(PI, Node.num(2)), Reducer.reduce(Node.mul(PI, PI)));
        assertEquals(new Node.Exp(new Node.Sin(E), Node.num(2)), Reducer.reduce(Node.mul(new Node.Sin(E), new Node.Sin(E))));
        assertEquals(new Node.Exp(sum, Node.num(2)), Reducer.reduce(Node.mul(sum, sum)));
    }

    @Test
    void likeFactors_sumTheirExponents() {
        var node = Node.mul(new Node.Exp(PI, Node.num(2)), Node.mul(PI, new Node.Exp(PI, Node.num(4))));

        assertEquals(new Node.Exp(PI, Node.num(7)), Reducer.reduce(node));
    }

    @Test
    void numericLiterals_foldIntoOne() {
        var reduced = Reducer.reduce(Node.add(Node.add(Node.num(1), Node.num(2)), PI));

        assertThat(reduced).isInstanceOf(Node.VarOp.class);
        assertThat(((Node.VarOp) reduced).children()).hasSize(2)
                                                     .contains(Node.num(3), PI);
    }

    @Test
    void numericLiterals_foldBaseHints() {
        var reduced = Reducer.reduce(Node.add(Node.num(Rational.of(1), 2), Node.num(Rational.of(3), 16)));
        var decimalAndHex = Reducer.reduce(Node.mul(Node.num(Rational.of(2), 10), Node.num(Rational.of(3), 16)));

        assertEquals(new Node.Num(Rational.of(4), Optional.of(2)), reduced);
        assertEquals(new Node.Num(Rational.of(6), Optional.of(16)), decimalAndHex);
    }

    @Test
    void product_putsCoefficientFirst() {
        assertEquals(Node.mul(Node.num(6), E),
                     Reducer.reduce(Node.mul(Node.mul(E, Node.num(2)), Node.num(3))));
    }

    @Test
    void emptyOperator_becomesIdentity() {
        assertEquals(Node.zero(), Reducer.reduce(new Node.VarOp(VarOpKind.ADD, List.of())));
        assertEquals(Node.one(), Reducer.reduce(new Node.VarOp(VarOpKind.MUL, List.of())));
    }

    @Test
    void singleChildOperator_isUnwrapped() {
        assertEquals(PI, Reducer.reduce(new Node.VarOp(VarOpKind.ADD, List.of(PI))));
        assertEquals(E, Reducer.reduce(new Node.VarOp(VarOpKind.MUL, List.of(new Node.VarOp(VarOpKind.MUL, List.of(E))))));
    }

    @Test
    void oppositeTerms_keepZeroCoefficient() {
        assertEquals(Node.mul(Node.zero(), PI), Reducer.reduce(Node.sub(PI, PI)));
    }

    // === Exponentiation ===

    @Test
    void exp_ofOne_isOne() {
        assertEquals(Node.one(), Reducer.reduce(new Node.Exp(Node.one(), PI)));
        assertEquals(Node.one(), Reducer.reduce(new Node.Exp(Node.num(Rational.ONE, 16), E)));
    }

    @Test
    void exp_toZero_isOne() {
        assertEquals(Node.one(), Reducer.reduce(new Node.Exp(PI, Node.zero())));
        assertEquals(Node.one(), Reducer.reduce(new Node.Exp(PI, Node.sub(Node.one(), Node.one()))));
    }

    @Test
    void exp_otherwise_keepsReducedOperands() {
        assertEquals(new Node.Exp(PI, Node.num(2)),
                     Reducer.reduce(new Node.Exp(PI, Node.add(Node.one(), Node.one()))));
    }

    // === Inverse ===

    @Test
    void inverse_ofLiteral_isReciprocal() {
        assertEquals(Node.num(Rational.of(3, 2)), Reducer.reduce(new Node.Inverse(Node.num(Rational.of(2, 3)))));
        assertEquals(Node.num(Rational.of(1, 4), 8), Reducer.reduce(new Node.Inverse(Node.num(Rational.of(4), 8))));
    }

    @Test
    void inverse_ofSymbol_isKept() {
        assertEquals(new Node.Inverse(PI), Reducer.reduce(new Node.Inverse(PI)));
    }

    @Test
    void inverse_ofZero_failsWithDivisionByZero() {
        var node = Node.div(PI, Node.sub(Node.num(2), Node.num(2)));

        assertThatThrownBy(() -> Reducer.reduce(node))
            .isInstanceOf(CalcException.class)
            .hasMessageContaining("Division by zero");
        assertThat(assertThrows(CalcException.class, () -> Reducer.reduce(node)).error())
            .isInstanceOf(CalcError.DivisionByZero.class);
    }

    @Test
    void division_byLiteral_becomesFractionCoefficient() {
        assertEquals(Node.mul(Node.num(Rational.of(1, 2)), PI), Reducer.reduce(Node.div(PI, Node.num(2))));
    }

    // === Trigonometry ===

    @Test
    void trig_ofEvenMultipleOfPi_isExact() {
        assertEquals(Node.zero(), Reducer.reduce(new Node.Sin(Node.tau())));
        assertEquals(Node.one(), Reducer.reduce(new Node.Cos(Node.tau())));
        assertEquals(Node.zero(), Reducer.reduce(new Node.Tan(Node.zero())));
        assertEquals(Node.zero(), Reducer.reduce(new Node.Sin(Node.add(PI, PI))));
    }

    @Test
    void trig_ofOddMultipleOfPi_usesFixedTable() {
        assertEquals(Node.minusOne(), Reducer.reduce(new Node.Cos(PI)));
        assertEquals(Node.zero(), Reducer.reduce(new Node.Tan(PI)));
        assertEquals(Node.one(), Reducer.reduce(new Node.Sin(PI)));
    }

    @Test
    void trig_ofNegativeMultiple_wrapsRemainder() {
        assertEquals(Node.minusOne(), Reducer.reduce(new Node.Cos(Node.mul(Node.num(-3), PI))));
        assertEquals(Node.one(), Reducer.reduce(new Node.Cos(Node.mul(Node.num(-2), PI))));
    }

    @Test
    void trig_ofOtherArgument_keepsReducedArgument() {
        assertEquals(new Node.Sin(Node.num(3)), Reducer.reduce(new Node.Sin(Node.add(Node.num(1), Node.num(2)))));
        assertEquals(new Node.Cos(E), Reducer.reduce(new Node.Cos(E)));
    }

    @Test
    void trig_onOverflowingMultiplier_isLeftUnreduced() {
        var node = new Node.Cos(Node.mul(Node.num(Long.MAX_VALUE), Node.mul(Node.num(2), PI)));

        assertThat(Reducer.reduce(node)).isInstanceOf(Node.Cos.class);
    }

    // === Leaves ===

    @Test
    void leaves_areUnchanged() {
        assertEquals(PI, Reducer.reduce(PI));
        assertEquals(Node.num(Rational.of(7), 2), Reducer.reduce(Node.num(Rational.of(7), 2)));
    }
}
