package io.github.eutro.jbitcode.core.ir.types;

import java.util.Objects;

public final class ArrayType extends SequentialType {
    private ArrayType(Type elementType, long numElements) {
        super(elementType, numElements);
    }

    public static ArrayType get(Type elementType, long numElements) {
        return new ArrayType(Objects.requireNonNull(elementType), numElements);
    }

    @Override
    public Kind getKind() {
        return Kind.ARRAY;
    }
}
