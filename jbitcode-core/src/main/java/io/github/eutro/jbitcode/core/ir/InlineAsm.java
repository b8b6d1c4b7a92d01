package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.PointerType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An inline assembly snippet, callable like a function.
 */
public final class InlineAsm extends UniquedConstant {
    private final String asm;
    private final String constraints;
    private final boolean sideEffects;
    private final boolean alignStack;

    private InlineAsm(Context context, PointerType type, String asm, String constraints,
                      boolean sideEffects, boolean alignStack) {
        super(context, type);
        this.asm = asm;
        this.constraints = constraints;
        this.sideEffects = sideEffects;
        this.alignStack = alignStack;
    }

    /**
     * Get an inline assembly value.
     *
     * @param context     The context.
     * @param type        A pointer to the function type of the snippet.
     * @param asm         The assembly text.
     * @param constraints The constraint string.
     * @param sideEffects Whether the snippet has side effects.
     * @param alignStack  Whether the stack must be aligned.
     * @return The value.
     */
    public static InlineAsm get(Context context, PointerType type, String asm, String constraints,
                                boolean sideEffects, boolean alignStack) {
        if (!type.getElementType().isFunction()) {
            throw new IllegalArgumentException("inline asm must have a pointer to function type");
        }
        List<Object> payload = Arrays.asList(asm, constraints, sideEffects, alignStack);
        return context.intern(InlineAsm.class, type, payload, Collections.emptyList(),
                () -> new InlineAsm(context, type, asm, constraints, sideEffects, alignStack));
    }

    public String getAsm() {
        return asm;
    }

    public String getConstraints() {
        return constraints;
    }

    public boolean hasSideEffects() {
        return sideEffects;
    }

    public boolean isAlignStack() {
        return alignStack;
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return this;
    }
}
