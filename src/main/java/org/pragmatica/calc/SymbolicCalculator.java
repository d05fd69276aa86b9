package org.pragmatica.calc;

import org.pragmatica.calc.eval.EvalResult;
import org.pragmatica.calc.eval.Evaluator;
import org.pragmatica.calc.reduce.Reducer;
import org.pragmatica.calc.render.Renderer;
import org.pragmatica.calc.tree.Node;

/**
 * Entry point tying reduction, evaluation and rendering together.
 *
 * <p>Example usage:
 * <pre>{@code
 * var calculator = SymbolicCalculator.create();
 *
 * var calculation = calculator.calculate(Node.add(Node.mul(Node.num(2), Node.pi()),
 *                                                 Node.mul(Node.num(3), Node.pi())));
 * calculation.text();           // "5 * pi"
 * calculation.result().value(); // 15.707963...
 * }</pre>
 */
public final class SymbolicCalculator {
    private final CalculatorConfig config;

    private SymbolicCalculator(CalculatorConfig config) {
        this.config = config;
    }

    public static SymbolicCalculator create() {
        return create(CalculatorConfig.DEFAULT);
    }

    public static SymbolicCalculator create(CalculatorConfig config) {
        return new SymbolicCalculator(config);
    }

    public CalculatorConfig config() {
        return config;
    }

    /**
     * Canonical reduced form of the expression.
     *
     * @throws org.pragmatica.calc.error.CalcException on exact division by zero
     */
    public Node simplify(Node node) {
        return Reducer.reduce(node);
    }

    public EvalResult evaluate(Node node) {
        return Evaluator.evaluate(config.reduceBeforeEvaluation()
                                  ? Reducer.reduce(node)
                                  : node);
    }

    public String render(Node node) {
        return Renderer.render(config.renderReduced()
                               ? Reducer.reduce(node)
                               : node);
    }

    /**
     * Reduce, approximate and render in one pass.
     *
     * @throws org.pragmatica.calc.error.CalcException on exact division by zero
     */
    public Calculation calculate(Node node) {
        var reduced = Reducer.reduce(node);
        var result = Evaluator.evaluate(config.reduceBeforeEvaluation()
                                        ? reduced
                                        : node);
        var text = Renderer.render(config.renderReduced()
                                   ? reduced
                                   : node);
        return new Calculation(node, reduced, text, result);
    }

    /**
     * Create a builder for calculator configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean reduceBeforeEvaluation = true;
        private boolean renderReduced = true;

        private Builder() {}

        public Builder reduceBeforeEvaluation(boolean enabled) {
            this.reduceBeforeEvaluation = enabled;
            return this;
        }

        public Builder renderReduced(boolean enabled) {
            this.renderReduced = enabled;
            return this;
        }

        public SymbolicCalculator build() {
            return create(new CalculatorConfig(reduceBeforeEvaluation, renderReduced));
        }
    }
}
