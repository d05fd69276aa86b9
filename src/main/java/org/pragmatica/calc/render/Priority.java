package org.pragmatica.calc.render;

import org.pragmatica.calc.tree.Node;
import org.pragmatica.calc.tree.VarOpKind;

/**
 * Binding strength of a node when printed, weakest first.
 */
public enum Priority {
    ADD,
    MUL,
    EXP,
    VALUE;

    public static Priority of(Node node) {
        if (node instanceof Node.Num num) {
            // a fraction is printed with a division sign
            return num.value().isInteger()
                   ? VALUE
                   : MUL;
        }
        if (node instanceof Node.Inverse) {
            return MUL;
        }
        if (node instanceof Node.VarOp varOp) {
            return varOp.kind() == VarOpKind.ADD
                   ? ADD
                   : MUL;
        }
        if (node instanceof Node.Exp) {
            return EXP;
        }
        // constants and function applications
        return VALUE;
    }

    public boolean isWeakerThan(Priority other) {
        return compareTo(other) < 0;
    }
}
