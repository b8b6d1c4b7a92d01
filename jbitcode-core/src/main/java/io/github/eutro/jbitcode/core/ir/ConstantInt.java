package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.IntegerType;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * An integer constant. The value is kept sign-extended from the width of its type.
 */
public final class ConstantInt extends UniquedConstant {
    private final BigInteger value;

    private ConstantInt(Context context, IntegerType type, BigInteger value) {
        super(context, type);
        this.value = value;
    }

    /**
     * Get an integer constant, truncating the value to the width of the type.
     *
     * @param context The context.
     * @param type    The integer type.
     * @param value   The value.
     * @return The constant.
     */
    public static ConstantInt get(Context context, IntegerType type, BigInteger value) {
        BigInteger normalized = normalize(value, type.getWidth());
        return context.intern(ConstantInt.class, type, normalized, Collections.emptyList(),
                () -> new ConstantInt(context, type, normalized));
    }

    public static ConstantInt get(Context context, IntegerType type, long value) {
        return get(context, type, BigInteger.valueOf(value));
    }

    private static BigInteger normalize(BigInteger value, int width) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        BigInteger unsigned = value.mod(modulus);
        return unsigned.testBit(width - 1) ? unsigned.subtract(modulus) : unsigned;
    }

    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }

    public BigInteger getValue() {
        return value;
    }

    public long getSExtValue() {
        return value.longValue();
    }

    /**
     * Get the value zero-extended from the width of the type.
     *
     * @return The unsigned value.
     */
    public BigInteger getUnsignedValue() {
        return value.signum() >= 0 ? value : value.add(BigInteger.ONE.shiftLeft(getType().getWidth()));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return this;
    }

    @Override
    public String toString() {
        return getType() + " " + (getType().getWidth() == 1 ? (isZero() ? "false" : "true") : value.toString());
    }
}
