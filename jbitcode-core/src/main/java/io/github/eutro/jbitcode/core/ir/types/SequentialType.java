package io.github.eutro.jbitcode.core.ir.types;

import java.util.function.Function;

/**
 * An array or vector: a fixed number of elements of one type.
 */
public abstract class SequentialType extends Type {
    private final Type elementType;
    private final long numElements;

    SequentialType(Type elementType, long numElements) {
        this.elementType = elementType;
        this.numElements = numElements;
    }

    public Type getElementType() {
        return elementType;
    }

    public long getNumElements() {
        return numElements;
    }

    @Override
    public void print(StringBuilder sb, Function<StructType, String> structRef) {
        boolean vector = getKind() == Kind.VECTOR;
        sb.append(vector ? '<' : '[').append(numElements).append(" x ");
        elementType.print(sb, structRef);
        sb.append(vector ? '>' : ']');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        SequentialType that = (SequentialType) o;
        return numElements == that.numElements && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return (elementType.hashCode() * 31 + Long.hashCode(numElements)) * 31 + getKind().ordinal();
    }
}
