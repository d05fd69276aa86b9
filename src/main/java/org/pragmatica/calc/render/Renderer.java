package org.pragmatica.calc.render;

import org.pragmatica.calc.tree.Node;
import org.pragmatica.calc.tree.VarOpKind;

/**
 * Prints expression trees as text with the minimal parentheses needed to keep
 * operator precedence.
 *
 * <pre>{@code
 * add(mul(2, pi), 3)      -> 2 * pi + 3
 * mul(add(1, pi), 2)      -> (1 + pi) * 2
 * exp(pi, exp(2, 3))      -> pi^(2^3)
 * div(pi, 2)              -> pi / 2
 * sin(pi), sin(add(1, e)) -> sin pi, sin(1 + e)
 * }</pre>
 */
public final class Renderer {
    private Renderer() {}

    public static String render(Node node) {
        var out = new StringBuilder();
        write(out, node);
        return out.toString();
    }

    private static void write(StringBuilder out, Node node) {
        if (node instanceof Node.Const constant) {
            out.append(constant.kind().symbol());
        } else if (node instanceof Node.Num num) {
            // always decimal, the output layer decides on the displayed base
            out.append(num.value());
        } else if (node instanceof Node.Inverse inverse) {
            out.append("1/");
            writeOperand(out, inverse.child(), Priority.MUL, false, false);
        } else if (node instanceof Node.VarOp varOp) {
            writeVarOp(out, varOp);
        } else if (node instanceof Node.Exp exp) {
            writeOperand(out, exp.base(), Priority.EXP, true, false);
            out.append('^');
            writeOperand(out, exp.exponent(), Priority.EXP, true, false);
        } else if (node instanceof Node.Sin sin) {
            writeFunction(out, "sin", sin.child());
        } else if (node instanceof Node.Cos cos) {
            writeFunction(out, "cos", cos.child());
        } else if (node instanceof Node.Tan tan) {
            writeFunction(out, "tan", tan.child());
        } else {
            throw new IllegalStateException("Unknown node type: " + node.getClass());
        }
    }

    private static void writeVarOp(StringBuilder out, Node.VarOp varOp) {
        var priority = Priority.of(varOp);
        var first = true;

        for (var child : varOp.children()) {
            if (first) {
                first = false;
            } else if (varOp.kind() == VarOpKind.MUL && child instanceof Node.Inverse inverse) {
                // "a / b" instead of "a * 1/b"
                out.append(" / ");
                writeOperand(out, inverse.child(), Priority.MUL, false, false);
                continue;
            } else {
                out.append(' ')
                   .append(varOp.kind().symbol())
                   .append(' ');
            }
            writeOperand(out, child, priority, false, false);
        }
    }

    private static void writeFunction(StringBuilder out, String name, Node argument) {
        out.append(name);
        writeOperand(out, argument, Priority.VALUE, false, true);
    }

    /**
     * Write an operand of a parent with the given priority.
     *
     * @param rightAssociative the operand is the right side of a right-associative operator,
     *                         so equal priority needs parentheses too: {@code 1^(2^3)}
     * @param separated        emit a space before an operand printed without parentheses
     */
    private static void writeOperand(StringBuilder out,
                                     Node operand,
                                     Priority parent,
                                     boolean rightAssociative,
                                     boolean separated) {
        var priority = Priority.of(operand);
        var needsParens = rightAssociative
                          ? !parent.isWeakerThan(priority)
                          : priority.isWeakerThan(parent);
        if (needsParens) {
            out.append('(');
        } else if (separated) {
            out.append(' ');
        }
        write(out, operand);
        if (needsParens) {
            out.append(')');
        }
    }
}
