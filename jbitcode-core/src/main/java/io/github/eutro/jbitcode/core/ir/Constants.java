package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.*;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Static helpers for building constants and computing result types shared by
 * instructions and constant expressions.
 */
public final class Constants {
    private Constants() {
    }

    /**
     * Get the zero value of a type.
     *
     * @param context The context.
     * @param type    The type.
     * @return A zero integer, a zero floating point value, a null pointer or a zero aggregate.
     */
    public static Constant getNullValue(Context context, Type type) {
        if (type.isInteger()) return ConstantInt.get(context, (IntegerType) type, 0);
        if (type.isFloatingPoint()) return ConstantFP.get(context, type, BigInteger.ZERO);
        return ConstantNull.get(context, type);
    }

    static List<Constant> asConstants(List<Value> values) {
        List<Constant> constants = new ArrayList<>(values.size());
        for (Value value : values) {
            if (!(value instanceof Constant)) {
                throw new IllegalArgumentException("not a constant: " + value);
            }
            constants.add((Constant) value);
        }
        return constants;
    }

    /**
     * Compute the type a {@code getelementptr} produces.
     *
     * @param pointerType The type of the base pointer.
     * @param indices     The indices. Struct indices must be {@link ConstantInt}s.
     * @return The result pointer type, or null if the indices are invalid for the type.
     */
    public static @Nullable Type getGepResultType(Type pointerType, List<? extends Value> indices) {
        if (!pointerType.isPointer()) return null;
        PointerType ptr = (PointerType) pointerType;
        Type current = ptr.getElementType();
        for (int i = 1; i < indices.size(); i++) {
            Value index = indices.get(i);
            if (current.isStruct()) {
                if (!(index instanceof ConstantInt)) return null;
                current = Types.getIndexedType(current, ((ConstantInt) index).getSExtValue());
            } else {
                if (!index.getType().isIntOrIntVector()) return null;
                current = Types.getIndexedType(current, 0);
            }
            if (current == null) return null;
        }
        if (!indices.isEmpty() && !indices.get(0).getType().isIntOrIntVector()) return null;
        return PointerType.get(current, ptr.getAddressSpace());
    }

    /**
     * Compute the type {@code extractvalue} produces.
     *
     * @param aggregate The aggregate type.
     * @param indices   The indices.
     * @return The indexed type, or null if the indices are invalid.
     */
    public static @Nullable Type getExtractValueType(Type aggregate, int[] indices) {
        Type current = aggregate;
        for (int index : indices) {
            if (current.isVector() || !Types.isIndexable(current)) return null;
            if (current.getKind() == Type.Kind.ARRAY && index >= ((ArrayType) current).getNumElements()) return null;
            current = Types.getIndexedType(current, index);
            if (current == null) return null;
        }
        return current;
    }

    /**
     * Compute the type a {@code shufflevector} produces.
     *
     * @param input The type of the shuffled vectors.
     * @param mask  The type of the mask.
     * @return The result type, or null if the operands are not vectors.
     */
    public static @Nullable Type getShuffleResultType(Type input, Type mask) {
        if (!input.isVector() || !mask.isVector()) return null;
        return VectorType.get(((VectorType) input).getElementType(), (int) ((VectorType) mask).getNumElements());
    }

    /**
     * Whether a constant expression is a pointer adjustment that does not change the address:
     * a bitcast, an address space cast or a {@code getelementptr} with all zero indices.
     *
     * @param constant The constant.
     * @return Whether it is a no-op pointer adjustment.
     */
    public static boolean isNoOpPointerAdjustment(Constant constant) {
        if (!(constant instanceof ConstantExpr)) return false;
        ConstantExpr ce = (ConstantExpr) constant;
        switch (ce.getOpcode()) {
            case BITCAST:
            case ADDRSPACECAST:
                return true;
            case GETELEMENTPTR:
                for (int i = 1; i < ce.getNumOperands(); i++) {
                    Value index = ce.getOperand(i);
                    if (!(index instanceof ConstantInt && ((ConstantInt) index).isZero()
                            || index instanceof ConstantNull)) {
                        return false;
                    }
                }
                return true;
            default:
                return false;
        }
    }
}
