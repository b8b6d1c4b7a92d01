package io.github.eutro.jbitcode.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * One edge from a {@link User} to a {@link Value} it refers to.
 * <p>
 * Uses compare by identity. Setting the value of a use keeps the use lists of
 * the old and new values up to date.
 */
public final class Use {
    private final User user;
    private final int operandNo;
    @Nullable
    private Value value;

    Use(User user, int operandNo) {
        this.user = user;
        this.operandNo = operandNo;
    }

    public User getUser() {
        return user;
    }

    /**
     * Get the index of this use in its user's operand list.
     *
     * @return The operand number, or -1 if this use is a side reference such as a metadata attachment.
     */
    public int getOperandNo() {
        return operandNo;
    }

    public @Nullable Value get() {
        return value;
    }

    public void set(@Nullable Value value) {
        if (this.value == value) return;
        if (this.value != null) this.value.removeUse(this);
        this.value = value;
        if (value != null) value.addUse(this);
    }
}
