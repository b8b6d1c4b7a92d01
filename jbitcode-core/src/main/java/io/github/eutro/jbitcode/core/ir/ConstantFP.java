package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ir.types.Types;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * A floating point constant, kept as its raw bit pattern.
 */
public final class ConstantFP extends UniquedConstant {
    private final BigInteger bits;

    private ConstantFP(Context context, Type type, BigInteger bits) {
        super(context, type);
        this.bits = bits;
    }

    /**
     * Get a floating point constant from its bits.
     *
     * @param context The context.
     * @param type    The floating point type.
     * @param bits    The bit pattern, as an unsigned number.
     * @return The constant.
     * @throws IllegalArgumentException If the type is not floating point, or the bits don't fit.
     */
    public static ConstantFP get(Context context, Type type, BigInteger bits) {
        int width = Types.getFloatingPointWidth(type);
        if (width < 0) throw new IllegalArgumentException("not a floating point type: " + type);
        if (bits.signum() < 0 || bits.bitLength() > width) {
            throw new IllegalArgumentException("bit pattern does not fit in " + type);
        }
        return context.intern(ConstantFP.class, type, bits, Collections.emptyList(),
                () -> new ConstantFP(context, type, bits));
    }

    public static ConstantFP ofDouble(Context context, double value) {
        long raw = Double.doubleToRawLongBits(value);
        return get(context, Type.DOUBLE, new BigInteger(Long.toUnsignedString(raw)));
    }

    public static ConstantFP ofFloat(Context context, float value) {
        return get(context, Type.FLOAT, BigInteger.valueOf(Float.floatToRawIntBits(value) & 0xFFFFFFFFL));
    }

    public BigInteger getBits() {
        return bits;
    }

    public boolean isZero() {
        return bits.signum() == 0;
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return this;
    }

    @Override
    public String toString() {
        return getType() + " 0x" + bits.toString(16).toUpperCase();
    }
}
