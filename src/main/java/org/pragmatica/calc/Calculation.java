package org.pragmatica.calc;

import org.pragmatica.calc.eval.EvalResult;
import org.pragmatica.calc.tree.Node;

/**
 * Everything computed for one expression.
 *
 * @param input   the tree as received
 * @param reduced the canonical form of {@code input}
 * @param text    rendered text, of {@code reduced} or {@code input} depending on configuration
 * @param result  approximate value and display base hint
 */
public record Calculation(Node input, Node reduced, String text, EvalResult result) {}
