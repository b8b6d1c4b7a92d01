package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.Collections;
import java.util.List;

public final class UndefValue extends UniquedConstant {
    private UndefValue(Context context, Type type) {
        super(context, type);
    }

    public static UndefValue get(Context context, Type type) {
        return context.intern(UndefValue.class, type, null, Collections.emptyList(),
                () -> new UndefValue(context, type));
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return this;
    }

    @Override
    public String toString() {
        return getType() + " undef";
    }
}
