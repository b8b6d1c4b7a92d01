package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A constant that exists at most once per {@link Context} for a given type, payload and
 * operand list. Two uniqued constants with the same content are the same object.
 * <p>
 * Since identity is content, a uniqued constant is never changed in place. Changing
 * an operand {@link #rebuild(List) rebuilds} it and replaces the old constant everywhere.
 */
public abstract class UniquedConstant extends Constant {
    private final Context context;
    @Nullable
    List<Object> key;

    protected UniquedConstant(Context context, Type type) {
        super(type);
        this.context = context;
    }

    protected UniquedConstant(Context context, Type type, List<? extends Value> operands) {
        super(type, operands);
        this.context = context;
    }

    public Context getContext() {
        return context;
    }

    @Override
    public final boolean isUniqued() {
        return true;
    }

    /**
     * Get the uniqued constant with the same kind, type and payload as this,
     * but with the given operands.
     *
     * @param operands The new operands, one for each operand of this constant.
     * @return The constant.
     */
    public abstract Constant rebuild(List<Value> operands);

    void handleOperandChange(Value from, Value to) {
        List<Value> newOperands = new ArrayList<>(getNumOperands());
        for (int i = 0; i < getNumOperands(); i++) {
            Value operand = getOperand(i);
            newOperands.add(operand == from ? to : operand);
        }
        Constant replacement = rebuild(newOperands);
        if (replacement == this) return;
        replaceAllUsesWith(replacement);
        destroy();
    }

    /**
     * Remove this constant from its context and drop its operands.
     * <p>
     * Only legal once nothing uses it.
     *
     * @throws IllegalStateException If this constant still has uses.
     */
    public void destroy() {
        if (hasUses()) throw new IllegalStateException("destroying a constant that is still used: " + this);
        context.forget(this);
        dropAllReferences();
    }
}
