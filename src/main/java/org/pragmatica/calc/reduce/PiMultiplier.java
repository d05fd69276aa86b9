package org.pragmatica.calc.reduce;

import org.pragmatica.calc.tree.ConstKind;
import org.pragmatica.calc.tree.Node;
import org.pragmatica.calc.tree.VarOpKind;

import java.util.OptionalLong;

/**
 * Detection of expressions whose exact value is an integer multiple of pi.
 * Any shape it does not understand, a fractional factor, pi squared or an overflow yields
 * an empty result, never an error.
 */
public final class PiMultiplier {
    private PiMultiplier() {}

    /**
     * @return {@code k} such that the node equals {@code k * pi}, or empty when unknown
     */
    public static OptionalLong of(Node node) {
        if (node instanceof Node.Const constant) {
            if (constant.kind() == ConstKind.PI) {
                return OptionalLong.of(1);
            }
            if (constant.kind() == ConstKind.TAU) {
                return OptionalLong.of(2);
            }
            return OptionalLong.empty();
        }
        if (node instanceof Node.Num num) {
            return num.value().isZero()
                   ? OptionalLong.of(0)
                   : OptionalLong.empty();
        }
        if (node instanceof Node.VarOp varOp && varOp.kind() == VarOpKind.MUL) {
            return ofProduct(varOp);
        }
        return OptionalLong.empty();
    }

    private static OptionalLong ofProduct(Node.VarOp product) {
        long multiplier = 1;
        boolean hasPi = false;

        try {
            for (var child : product.children()) {
                if (child instanceof Node.Num num) {
                    var value = num.value();
                    if (!value.isInteger()) {
                        return OptionalLong.empty();
                    }
                    multiplier = Math.multiplyExact(multiplier, value.numerator().longValueExact());
                    continue;
                }
                var sub = of(child);
                if (sub.isEmpty()) {
                    return OptionalLong.empty();
                }
                if (sub.getAsLong() == 0) {
                    return OptionalLong.of(0);
                }
                if (hasPi) {
                    // pi squared
                    return OptionalLong.empty();
                }
                multiplier = Math.multiplyExact(multiplier, sub.getAsLong());
                hasPi = true;
            }
        } catch (ArithmeticException overflow) {
            return OptionalLong.empty();
        }
        return hasPi
               ? OptionalLong.of(multiplier)
               : OptionalLong.empty();
    }
}
