package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.Collections;
import java.util.List;

/**
 * A null pointer, or an all-zero aggregate.
 * <p>
 * Zero integers and floating point values are {@link ConstantInt} and {@link ConstantFP};
 * use {@link Constants#getNullValue(Context, Type)} to get the right one.
 */
public final class ConstantNull extends UniquedConstant {
    private ConstantNull(Context context, Type type) {
        super(context, type);
    }

    public static ConstantNull get(Context context, Type type) {
        return context.intern(ConstantNull.class, type, null, Collections.emptyList(),
                () -> new ConstantNull(context, type));
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return this;
    }

    @Override
    public String toString() {
        return getType() + (getType().isPointer() ? " null" : " zeroinitializer");
    }
}
