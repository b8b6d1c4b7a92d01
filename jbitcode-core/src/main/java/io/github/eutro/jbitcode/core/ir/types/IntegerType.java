package io.github.eutro.jbitcode.core.ir.types;

import java.util.function.Function;

/**
 * An integer type of arbitrary bit width.
 */
public final class IntegerType extends Type {
    public static final int MIN_BITS = 1;
    public static final int MAX_BITS = (1 << 23) - 1;

    private static final IntegerType[] COMMON = new IntegerType[65];

    static {
        for (int i = 1; i < COMMON.length; i++) {
            COMMON[i] = new IntegerType(i);
        }
    }

    private final int width;

    private IntegerType(int width) {
        this.width = width;
    }

    /**
     * Get the integer type of the given width.
     *
     * @param width The width in bits.
     * @return The type.
     * @throws IllegalArgumentException If the width is out of range.
     */
    public static IntegerType get(int width) {
        if (width < MIN_BITS || width > MAX_BITS) {
            throw new IllegalArgumentException("invalid integer width: " + width);
        }
        return width < COMMON.length ? COMMON[width] : new IntegerType(width);
    }

    public int getWidth() {
        return width;
    }

    @Override
    public Kind getKind() {
        return Kind.INTEGER;
    }

    @Override
    public void print(StringBuilder sb, Function<StructType, String> structRef) {
        sb.append('i').append(width);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof IntegerType && ((IntegerType) o).width == width;
    }

    @Override
    public int hashCode() {
        return width;
    }
}
