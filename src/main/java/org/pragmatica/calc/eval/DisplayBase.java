package org.pragmatica.calc.eval;

import java.util.Optional;

/**
 * Folding of display base hints. Binary is the most specific hint, decimal the least.
 */
public final class DisplayBase {
    public static final int BINARY = 2;
    public static final int DECIMAL = 10;

    private DisplayBase() {}

    /**
     * Combine the hints of two operands.
     * <ul>
     *   <li>a present hint beats an absent one</li>
     *   <li>any other base beats decimal</li>
     *   <li>binary beats every other base</li>
     *   <li>otherwise the first operand wins</li>
     * </ul>
     */
    public static Optional<Integer> combine(Optional<Integer> first, Optional<Integer> second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        int a = first.get();
        int b = second.get();
        if (a == DECIMAL) {
            return second;
        }
        if (b == DECIMAL) {
            return first;
        }
        if (a == BINARY || b == BINARY) {
            return Optional.of(BINARY);
        }
        return first;
    }
}
