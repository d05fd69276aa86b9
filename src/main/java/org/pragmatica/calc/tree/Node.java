package org.pragmatica.calc.tree;

import org.pragmatica.calc.error.CalcError;
import org.pragmatica.calc.error.CalcException;
import org.pragmatica.calc.render.Renderer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression tree node. Trees are immutable values: each composite node exclusively owns its
 * children and record equality is structural over the whole subtree, so subtrees can be used
 * as map keys.
 */
public sealed interface Node {

    /**
     * Text form with minimal parentheses.
     */
    default String render() {
        return Renderer.render(this);
    }

    // === Leaves ===

    /**
     * Named constant: pi, tau or e.
     */
    record Const(ConstKind kind) implements Node {
        public Const {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * Exact rational literal.
     *
     * @param value     the exact value
     * @param inputBase radix the user wrote the literal in, empty for derived values
     */
    record Num(Rational value, Optional<Integer> inputBase) implements Node {
        public static final int MIN_RADIX = 2;
        public static final int MAX_RADIX = 36;

        public Num {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(inputBase, "inputBase");
            inputBase.ifPresent(Num::checkRadix);
        }

        private static void checkRadix(int radix) {
            if (radix < MIN_RADIX || radix > MAX_RADIX) {
                throw new CalcException(new CalcError.UnsupportedValue("input base " + radix));
            }
        }
    }

    // === Operators ===

    /**
     * Multiplicative inverse.
     */
    record Inverse(Node child) implements Node {
        public Inverse {
            Objects.requireNonNull(child, "child");
        }
    }

    /**
     * N-ary associative operator. Child order only matters for display.
     */
    record VarOp(VarOpKind kind, List<Node> children) implements Node {
        public VarOp {
            Objects.requireNonNull(kind, "kind");
            children = List.copyOf(children);
        }
    }

    /**
     * Exponentiation, right-associative.
     */
    record Exp(Node base, Node exponent) implements Node {
        public Exp {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }
    }

    // === Functions ===

    record Sin(Node child) implements Node {
        public Sin {
            Objects.requireNonNull(child, "child");
        }
    }

    record Cos(Node child) implements Node {
        public Cos {
            Objects.requireNonNull(child, "child");
        }
    }

    record Tan(Node child) implements Node {
        public Tan {
            Objects.requireNonNull(child, "child");
        }
    }

    // === Constructors ===

    static Node zero() {
        return num(Rational.ZERO);
    }

    static Node one() {
        return num(Rational.ONE);
    }

    static Node minusOne() {
        return num(Rational.MINUS_ONE);
    }

    static Node num(long value) {
        return num(Rational.of(value));
    }

    static Node num(Rational value) {
        return new Num(value, Optional.empty());
    }

    /**
     * Literal as written by the user in the given radix.
     */
    static Node num(Rational value, int inputBase) {
        return new Num(value, Optional.of(inputBase));
    }

    static Node pi() {
        return new Const(ConstKind.PI);
    }

    static Node tau() {
        return new Const(ConstKind.TAU);
    }

    static Node e() {
        return new Const(ConstKind.E);
    }

    static Node add(Node a, Node b) {
        return op(VarOpKind.ADD, a, b);
    }

    static Node sub(Node a, Node b) {
        return add(a, opposite(b));
    }

    static Node mul(Node a, Node b) {
        return op(VarOpKind.MUL, a, b);
    }

    static Node div(Node a, Node b) {
        return mul(a, new Inverse(b));
    }

    static Node opposite(Node node) {
        return mul(minusOne(), node);
    }

    private static Node op(VarOpKind kind, Node a, Node b) {
        return new VarOp(kind, List.of(a, b));
    }
}
