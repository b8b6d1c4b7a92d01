package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.List;

/**
 * A value that is fixed before the program runs.
 * <p>
 * Most constants are {@link UniquedConstant uniqued}; globals and
 * {@link ConstantPlaceholder placeholders} are not.
 */
public abstract class Constant extends User {
    protected Constant(Type type) {
        super(type);
    }

    protected Constant(Type type, List<? extends Value> operands) {
        super(type, operands);
    }

    /**
     * Whether this constant is structurally unique, and so must be rebuilt rather
     * than mutated when an operand changes.
     *
     * @return Whether this constant is uniqued.
     */
    public boolean isUniqued() {
        return false;
    }

    public Constant getConstantOperand(int i) {
        return (Constant) getOperand(i);
    }
}
