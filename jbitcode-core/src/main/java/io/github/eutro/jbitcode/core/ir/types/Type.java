package io.github.eutro.jbitcode.core.ir.types;

import java.util.function.Function;

/**
 * A type descriptor.
 * <p>
 * Types other than identified {@link StructType structs} compare structurally,
 * so two independently built {@code i32*} are equal. Identified structs compare
 * by identity, which is what lets recursive types terminate.
 */
public abstract class Type {
    public static final Type VOID = new PrimitiveType(Kind.VOID, "void");
    public static final Type HALF = new PrimitiveType(Kind.HALF, "half");
    public static final Type FLOAT = new PrimitiveType(Kind.FLOAT, "float");
    public static final Type DOUBLE = new PrimitiveType(Kind.DOUBLE, "double");
    public static final Type X86_FP80 = new PrimitiveType(Kind.X86_FP80, "x86_fp80");
    public static final Type FP128 = new PrimitiveType(Kind.FP128, "fp128");
    public static final Type PPC_FP128 = new PrimitiveType(Kind.PPC_FP128, "ppc_fp128");
    public static final Type LABEL = new PrimitiveType(Kind.LABEL, "label");
    public static final Type METADATA = new PrimitiveType(Kind.METADATA, "metadata");
    public static final Type X86_MMX = new PrimitiveType(Kind.X86_MMX, "x86_mmx");

    /**
     * The kind of a type, for exhaustive switching.
     */
    public enum Kind {
        VOID,
        HALF,
        FLOAT,
        DOUBLE,
        X86_FP80,
        FP128,
        PPC_FP128,
        LABEL,
        METADATA,
        X86_MMX,
        INTEGER,
        POINTER,
        ARRAY,
        VECTOR,
        FUNCTION,
        STRUCT,
    }

    Type() {
    }

    public abstract Kind getKind();

    public boolean isVoid() {
        return getKind() == Kind.VOID;
    }

    public boolean isLabel() {
        return getKind() == Kind.LABEL;
    }

    public boolean isMetadata() {
        return getKind() == Kind.METADATA;
    }

    public boolean isInteger() {
        return getKind() == Kind.INTEGER;
    }

    public boolean isInteger(int width) {
        return isInteger() && ((IntegerType) this).getWidth() == width;
    }

    public boolean isPointer() {
        return getKind() == Kind.POINTER;
    }

    public boolean isFunction() {
        return getKind() == Kind.FUNCTION;
    }

    public boolean isStruct() {
        return getKind() == Kind.STRUCT;
    }

    public boolean isVector() {
        return getKind() == Kind.VECTOR;
    }

    public boolean isFloatingPoint() {
        switch (getKind()) {
            case HALF:
            case FLOAT:
            case DOUBLE:
            case X86_FP80:
            case FP128:
            case PPC_FP128:
                return true;
            default:
                return false;
        }
    }

    /**
     * Get the element type if this is a vector, or this type otherwise.
     *
     * @return The scalar type.
     */
    public Type getScalarType() {
        return this;
    }

    public boolean isFPOrFPVector() {
        return getScalarType().isFloatingPoint();
    }

    public boolean isIntOrIntVector() {
        return getScalarType().isInteger();
    }

    /**
     * Whether values of this type may be produced by instructions.
     *
     * @return Whether the type is first class.
     */
    public boolean isFirstClass() {
        return getKind() != Kind.FUNCTION && getKind() != Kind.VOID;
    }

    /**
     * Whether this type may be an element of an array, struct or pointer.
     *
     * @return Whether this type is a valid element type.
     */
    public boolean isValidElementType() {
        switch (getKind()) {
            case VOID:
            case LABEL:
            case METADATA:
            case FUNCTION:
                return false;
            default:
                return true;
        }
    }

    /**
     * Append the textual form of this type to a builder.
     *
     * @param sb        The builder.
     * @param structRef How to refer to identified structs.
     */
    public abstract void print(StringBuilder sb, Function<StructType, String> structRef);

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, StructType::defaultReference);
        return sb.toString();
    }

    public static IntegerType i1() {
        return IntegerType.get(1);
    }

    public static IntegerType i8() {
        return IntegerType.get(8);
    }

    public static IntegerType i32() {
        return IntegerType.get(32);
    }

    public static IntegerType i64() {
        return IntegerType.get(64);
    }
}
