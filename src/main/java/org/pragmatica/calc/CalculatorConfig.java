package org.pragmatica.calc;

/**
 * Calculator configuration options.
 *
 * @param reduceBeforeEvaluation approximate the reduced tree instead of the input tree
 * @param renderReduced          render the reduced tree instead of the input tree
 */
public record CalculatorConfig(
    boolean reduceBeforeEvaluation,
    boolean renderReduced
) {
    public static final CalculatorConfig DEFAULT = new CalculatorConfig(
        true,
        true
    );
}
