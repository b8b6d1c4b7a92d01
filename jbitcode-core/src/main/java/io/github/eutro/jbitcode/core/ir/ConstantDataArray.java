package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.ArrayType;
import io.github.eutro.jbitcode.core.ir.types.IntegerType;
import io.github.eutro.jbitcode.core.ir.types.SequentialType;
import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A constant array or vector of integers, stored flat rather than as one operand per element.
 * Strings are arrays of {@code i8}.
 */
public final class ConstantDataArray extends UniquedConstant {
    private final long[] elements;

    private ConstantDataArray(Context context, Type type, long[] elements) {
        super(context, type);
        this.elements = elements;
    }

    /**
     * Get a data array.
     *
     * @param context  The context.
     * @param type     An array or vector of integers with as many elements as given.
     * @param elements The elements, truncated to the element width.
     * @return The constant.
     */
    public static ConstantDataArray get(Context context, SequentialType type, long[] elements) {
        if (!(type.getElementType() instanceof IntegerType) || type.getNumElements() != elements.length) {
            throw new IllegalArgumentException("invalid data array type " + type);
        }
        int width = ((IntegerType) type.getElementType()).getWidth();
        long[] copy = new long[elements.length];
        for (int i = 0; i < elements.length; i++) {
            copy[i] = width >= 64 ? elements[i] : elements[i] & ((1L << width) - 1);
        }
        return context.intern(ConstantDataArray.class, type, new Payload(copy), Collections.emptyList(),
                () -> new ConstantDataArray(context, type, copy));
    }

    /**
     * Get the constant for a string of bytes.
     *
     * @param context The context.
     * @param bytes   The characters.
     * @return An {@code [n x i8]} constant.
     */
    public static ConstantDataArray ofString(Context context, byte[] bytes) {
        long[] elements = new long[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            elements[i] = bytes[i] & 0xFF;
        }
        return get(context, ArrayType.get(Type.i8(), bytes.length), elements);
    }

    @Override
    public SequentialType getType() {
        return (SequentialType) super.getType();
    }

    public int getNumElements() {
        return elements.length;
    }

    public long getElement(int i) {
        return elements[i];
    }

    public boolean isString() {
        return getType().getElementType().isInteger(8);
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return this;
    }

    private static final class Payload {
        final long[] elements;

        Payload(long[] elements) {
            this.elements = elements;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Payload && Arrays.equals(((Payload) o).elements, elements);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(elements);
        }
    }
}
