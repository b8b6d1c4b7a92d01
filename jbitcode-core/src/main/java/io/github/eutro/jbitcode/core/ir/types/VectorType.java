package io.github.eutro.jbitcode.core.ir.types;

import java.util.Objects;

public final class VectorType extends SequentialType {
    private VectorType(Type elementType, int numElements) {
        super(elementType, numElements);
    }

    /**
     * Get a vector type.
     *
     * @param elementType The element type, an integer, floating point or pointer type.
     * @param numElements The number of elements, at least one.
     * @return The vector type.
     */
    public static VectorType get(Type elementType, int numElements) {
        if (numElements <= 0) throw new IllegalArgumentException("empty vector");
        return new VectorType(Objects.requireNonNull(elementType), numElements);
    }

    public static boolean isValidElementType(Type type) {
        return type.isInteger() || type.isFloatingPoint() || type.isPointer();
    }

    @Override
    public Type getScalarType() {
        return getElementType();
    }

    @Override
    public Kind getKind() {
        return Kind.VECTOR;
    }
}
