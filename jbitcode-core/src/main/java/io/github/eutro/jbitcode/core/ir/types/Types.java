package io.github.eutro.jbitcode.core.ir.types;

import org.jetbrains.annotations.Nullable;

/**
 * Static helpers for navigating aggregate types.
 */
public final class Types {
    private Types() {
    }

    /**
     * Get the type of the element at the given index of an aggregate.
     *
     * @param aggregate The struct, array or vector type.
     * @param index     The index.
     * @return The element type, or null if the index is invalid for the type.
     */
    public static @Nullable Type getIndexedType(Type aggregate, long index) {
        switch (aggregate.getKind()) {
            case STRUCT: {
                StructType st = (StructType) aggregate;
                if (index < 0 || index >= st.getNumElements()) return null;
                return st.getElement((int) index);
            }
            case ARRAY:
            case VECTOR:
                return ((SequentialType) aggregate).getElementType();
            default:
                return null;
        }
    }

    /**
     * Whether the type can be indexed into by {@code extractvalue}, {@code getelementptr} and friends.
     *
     * @param type The type.
     * @return Whether it is a struct, array or vector.
     */
    public static boolean isIndexable(Type type) {
        return type.isStruct() || type.getKind() == Type.Kind.ARRAY || type.isVector();
    }

    /**
     * Get the result type of an integer or floating point comparison of operands of the given type.
     *
     * @param operandType The operand type.
     * @return {@code i1}, or a vector of {@code i1} of the same length.
     */
    public static Type comparisonResult(Type operandType) {
        if (operandType.isVector()) {
            return VectorType.get(Type.i1(), (int) ((VectorType) operandType).getNumElements());
        }
        return Type.i1();
    }

    /**
     * Get the number of bits in a floating point type.
     *
     * @param type The type.
     * @return The width in bits, or -1 if it is not floating point.
     */
    public static int getFloatingPointWidth(Type type) {
        switch (type.getKind()) {
            case HALF:
                return 16;
            case FLOAT:
                return 32;
            case DOUBLE:
                return 64;
            case X86_FP80:
                return 80;
            case FP128:
            case PPC_FP128:
                return 128;
            default:
                return -1;
        }
    }
}
