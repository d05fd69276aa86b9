package org.pragmatica.calc.reduce;

import org.pragmatica.calc.eval.DisplayBase;
import org.pragmatica.calc.tree.Node;
import org.pragmatica.calc.tree.Rational;
import org.pragmatica.calc.tree.VarOpKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deep structural reduction of expression trees to a canonical form.
 *
 * <p>For n-ary operators the reduction flattens nested operators of the same kind, folds
 * numeric literals exactly, and collects like children: {@code 2*x + 3*x} becomes
 * {@code 5*x} and {@code x * x^2} becomes {@code x^3}. Both collections are the same
 * algorithm, parameterized by {@link VarOpKind}. Trigonometric functions of integer
 * multiples of pi are replaced by their exact value.
 *
 * <p>Reduction never changes the value of an expression. Where a simplification cannot be
 * proven the subtree is left as it is.
 */
public final class Reducer {
    private Reducer() {}

    /**
     * Reduce the tree.
     *
     * @throws org.pragmatica.calc.error.CalcException when the exact reciprocal of zero is taken
     */
    public static Node reduce(Node node) {
        if (node instanceof Node.VarOp varOp) {
            return reduceVarOp(varOp.kind(), varOp.children());
        }
        if (node instanceof Node.Exp exp) {
            return reduceExp(exp);
        }
        if (node instanceof Node.Inverse inverse) {
            return reduceInverse(inverse);
        }
        if (node instanceof Node.Sin sin) {
            return reduceTrig(sin.child(), TrigFunction.SIN);
        }
        if (node instanceof Node.Cos cos) {
            return reduceTrig(cos.child(), TrigFunction.COS);
        }
        if (node instanceof Node.Tan tan) {
            return reduceTrig(tan.child(), TrigFunction.TAN);
        }
        // constants and literals are already reduced
        return node;
    }

    // === N-ary operators ===

    private static Node reduceVarOp(VarOpKind kind, List<Node> children) {
        var reduced = new ArrayList<Node>();
        for (var child : flatten(children, kind)) {
            reduced.add(reduce(child));
        }
        // a reduced child may itself have become an operator of the same kind
        var terms = foldNumbers(flatten(reduced, kind), kind);

        Map<Node, List<Node>> weightsByKey = new LinkedHashMap<>();
        for (var term : terms) {
            var split = split(term, kind);
            weightsByKey.computeIfAbsent(split.key(), key -> new ArrayList<>())
                        .add(split.weight());
        }

        var compressed = new ArrayList<Node>();
        weightsByKey.forEach((key, weights) -> recombine(kind, key, weights).ifPresent(compressed::add));

        // a collapsed group may have become a literal, as x * x^-1 does
        return assemble(kind, foldNumbers(flatten(compressed, kind), kind));
    }

    /**
     * Turns {@code add(add(1, add(2)), 3)} into {@code [1, 2, 3]}.
     */
    static List<Node> flatten(List<Node> children, VarOpKind kind) {
        var result = new ArrayList<Node>();
        var remaining = List.copyOf(children);

        while (!remaining.isEmpty()) {
            var next = new ArrayList<Node>();
            for (var child : remaining) {
                if (child instanceof Node.VarOp varOp && varOp.kind() == kind) {
                    next.addAll(varOp.children());
                } else {
                    result.add(child);
                }
            }
            remaining = next;
        }
        return result;
    }

    /**
     * Combine all literals into one. Non-literal nodes keep their relative order. The folded
     * literal goes last in a sum and first in a product, where it acts as the coefficient.
     */
    static List<Node> foldNumbers(List<Node> nodes, VarOpKind kind) {
        var result = new ArrayList<Node>();
        Rational number = null;
        Optional<Integer> base = Optional.empty();

        for (var node : nodes) {
            if (node instanceof Node.Num num) {
                number = kind.combine(number == null ? kind.identityRational() : number, num.value());
                base = DisplayBase.combine(base, num.inputBase());
            } else {
                result.add(node);
            }
        }

        if (number != null) {
            var folded = new Node.Num(number, base);
            if (kind == VarOpKind.MUL) {
                result.add(0, folded);
            } else {
                result.add(folded);
            }
        }
        return result;
    }

    private record Split(Node key, Node weight) {}

    /**
     * Split a child into the part to group by and its weight: the coefficient of a term in a
     * sum, the exponent of a factor in a product.
     */
    private static Split split(Node child, VarOpKind kind) {
        if (kind == VarOpKind.ADD && child instanceof Node.VarOp product && product.kind() == VarOpKind.MUL) {
            var factors = product.children();
            if (factors.size() < 2) {
                // reduction never leaves a product with less than two factors
                throw new IllegalStateException("Multiplication with less than 2 factors: " + product);
            }
            var rest = factors.size() == 2
                       ? factors.get(1)
                       : new Node.VarOp(VarOpKind.MUL, factors.subList(1, factors.size()));
            return new Split(rest, factors.get(0));
        }
        if (kind == VarOpKind.MUL && child instanceof Node.Exp exp) {
            return new Split(exp.base(), exp.exponent());
        }
        // a weight of 1 does not change the value
        return new Split(child, Node.one());
    }

    /**
     * Sum the weights of one group and collapse the group into a single node.
     * Weights are always added: coefficients of like terms and exponents of like factors.
     */
    private static Optional<Node> recombine(VarOpKind kind, Node key, List<Node> weights) {
        var folded = foldNumbers(weights, VarOpKind.ADD);
        if (folded.isEmpty()) {
            return Optional.empty();
        }
        var weight = folded.size() == 1
                     ? folded.get(0)
                     : reduce(new Node.VarOp(VarOpKind.ADD, folded));
        if (isLiteral(weight, Rational.ONE)) {
            return Optional.of(key);
        }
        return Optional.of(reduce(kind.compress(key, weight)));
    }

    private static Node assemble(VarOpKind kind, List<Node> nodes) {
        if (nodes.isEmpty()) {
            return Node.num(kind.identityRational());
        }
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        return new Node.VarOp(kind, nodes);
    }

    // === Exponentiation and inverse ===

    private static Node reduceExp(Node.Exp exp) {
        var base = reduce(exp.base());
        var exponent = reduce(exp.exponent());

        // 1^k = 1 and k^0 = 1
        if (isLiteral(base, Rational.ONE) || isLiteral(exponent, Rational.ZERO)) {
            return Node.one();
        }
        return new Node.Exp(base, exponent);
    }

    private static Node reduceInverse(Node.Inverse inverse) {
        var child = reduce(inverse.child());
        if (child instanceof Node.Num num) {
            return new Node.Num(num.value().reciprocal(), num.inputBase());
        }
        return new Node.Inverse(child);
    }

    // === Trigonometry ===

    private enum TrigFunction {
        SIN,
        COS,
        TAN
    }

    private static Node reduceTrig(Node argument, TrigFunction function) {
        var reduced = reduce(argument);
        var multiplier = PiMultiplier.of(reduced);

        if (multiplier.isEmpty()) {
            return switch (function) {
                case SIN -> new Node.Sin(reduced);
                case COS -> new Node.Cos(reduced);
                case TAN -> new Node.Tan(reduced);
            };
        }

        // (2a + b) * pi with b in {0, 1}
        var remainder = multiplier.getAsLong() % 2;
        if (remainder < 0) {
            remainder += 2;
        }

        if (remainder == 0) {
            return switch (function) {
                case SIN, TAN -> Node.zero();
                case COS -> Node.one();
            };
        }
        // sine of an odd multiple of pi stays 1 on purpose
        return switch (function) {
            case SIN -> Node.one();
            case COS -> Node.minusOne();
            case TAN -> Node.zero();
        };
    }

    private static boolean isLiteral(Node node, Rational value) {
        return node instanceof Node.Num num && num.value().equals(value);
    }
}
