package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

/**
 * A value with operands.
 */
public abstract class User extends Value {
    private final List<Use> operands = new ArrayList<>();

    protected User(Type type) {
        super(type);
    }

    protected User(Type type, List<? extends Value> operands) {
        super(type);
        for (Value operand : operands) {
            addOperand(operand);
        }
    }

    public int getNumOperands() {
        return operands.size();
    }

    public @Nullable Value getOperand(int i) {
        return operands.get(i).get();
    }

    public Use getOperandUse(int i) {
        return operands.get(i);
    }

    public void setOperand(int i, @Nullable Value value) {
        operands.get(i).set(value);
    }

    /**
     * Get a live view of the operand values.
     *
     * @return The operands.
     */
    public List<Value> getOperands() {
        return new AbstractList<Value>() {
            @Override
            public Value get(int index) {
                return getOperand(index);
            }

            @Override
            public int size() {
                return getNumOperands();
            }
        };
    }

    protected void addOperand(@Nullable Value value) {
        Use use = new Use(this, operands.size());
        use.set(value);
        operands.add(use);
    }

    /**
     * Create a use owned by this user that is not one of its operands.
     *
     * @param value The initial value.
     * @return The use.
     */
    protected Use newSideUse(@Nullable Value value) {
        Use use = new Use(this, -1);
        use.set(value);
        return use;
    }

    /**
     * Remove the last operands, so that only {@code size} remain.
     *
     * @param size The number of operands to keep.
     */
    protected void truncateOperands(int size) {
        while (operands.size() > size) {
            operands.remove(operands.size() - 1).set(null);
        }
    }

    /**
     * Clear every operand of this user, unlinking it from the use lists of its operands.
     */
    public void dropAllReferences() {
        for (Use operand : operands) {
            operand.set(null);
        }
    }

    /**
     * Replace every operand equal to {@code from} with {@code to}.
     *
     * @param from The value to replace.
     * @param to   The replacement.
     */
    public void replaceUsesOfWith(Value from, Value to) {
        for (Use operand : operands) {
            if (operand.get() == from) operand.set(to);
        }
    }
}
