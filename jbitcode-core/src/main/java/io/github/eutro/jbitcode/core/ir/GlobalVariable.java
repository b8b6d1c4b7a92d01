package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.ThreadLocalMode;
import org.jetbrains.annotations.Nullable;

/**
 * A global variable. Its initializer, if it has one, is its only operand.
 */
public final class GlobalVariable extends GlobalValue {
    private boolean constant;
    private ThreadLocalMode threadLocalMode = ThreadLocalMode.NOT_THREAD_LOCAL;

    public GlobalVariable(Type valueType, int addressSpace, boolean constant,
                          Linkage linkage, @Nullable Constant initializer, @Nullable String name) {
        super(PointerType.get(valueType, addressSpace), linkage, name);
        this.constant = constant;
        setInitializer(initializer);
    }

    @Override
    public boolean isDeclaration() {
        return !hasInitializer();
    }

    public boolean hasInitializer() {
        return getNumOperands() != 0;
    }

    public @Nullable Constant getInitializer() {
        return hasInitializer() ? (Constant) getOperand(0) : null;
    }

    /**
     * Set or clear the initializer.
     *
     * @param initializer The initializer, whose type must be the value type of this global, or null.
     */
    public void setInitializer(@Nullable Constant initializer) {
        if (initializer == null) {
            truncateOperands(0);
            return;
        }
        if (!initializer.getType().equals(getValueType())) {
            throw new IllegalArgumentException("initializer of type " + initializer.getType()
                    + " for global of type " + getValueType());
        }
        if (hasInitializer()) {
            setOperand(0, initializer);
        } else {
            addOperand(initializer);
        }
    }

    public boolean isConstant() {
        return constant;
    }

    public void setConstant(boolean constant) {
        this.constant = constant;
    }

    public ThreadLocalMode getThreadLocalMode() {
        return threadLocalMode;
    }

    public void setThreadLocalMode(ThreadLocalMode threadLocalMode) {
        this.threadLocalMode = threadLocalMode;
    }

    public boolean isThreadLocal() {
        return threadLocalMode != ThreadLocalMode.NOT_THREAD_LOCAL;
    }
}
