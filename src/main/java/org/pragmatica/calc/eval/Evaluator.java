package org.pragmatica.calc.eval;

import org.pragmatica.calc.tree.Node;

import java.util.Optional;

/**
 * Floating-point approximation of expression trees.
 * Never throws: division by zero and domain errors follow IEEE 754 semantics.
 */
public final class Evaluator {
    private Evaluator() {}

    public static EvalResult evaluate(Node node) {
        if (node instanceof Node.Const constant) {
            return EvalResult.of(constant.kind().value());
        }
        if (node instanceof Node.Num num) {
            return EvalResult.of(num.value().toDouble(), num.inputBase());
        }
        if (node instanceof Node.Inverse inverse) {
            return evaluate(inverse.child()).map(x -> 1.0 / x);
        }
        if (node instanceof Node.VarOp varOp) {
            return evaluateVarOp(varOp);
        }
        if (node instanceof Node.Exp exp) {
            var base = evaluate(exp.base());
            var exponent = evaluate(exp.exponent());
            return EvalResult.of(Math.pow(base.value(), exponent.value()),
                                 DisplayBase.combine(base.displayBase(), exponent.displayBase()));
        }
        if (node instanceof Node.Sin sin) {
            return evaluate(sin.child()).map(Math::sin);
        }
        if (node instanceof Node.Cos cos) {
            return evaluate(cos.child()).map(Math::cos);
        }
        if (node instanceof Node.Tan tan) {
            return evaluate(tan.child()).map(Math::tan);
        }
        throw new IllegalStateException("Unknown node type: " + node.getClass());
    }

    private static EvalResult evaluateVarOp(Node.VarOp varOp) {
        var kind = varOp.kind();
        var value = kind.identityDouble();
        Optional<Integer> base = Optional.empty();

        for (var child : varOp.children()) {
            var result = evaluate(child);
            value = kind.combine(value, result.value());
            base = DisplayBase.combine(base, result.displayBase());
        }
        return EvalResult.of(value, base);
    }
}
