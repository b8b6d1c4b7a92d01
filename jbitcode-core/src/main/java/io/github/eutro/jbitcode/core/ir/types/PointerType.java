package io.github.eutro.jbitcode.core.ir.types;

import java.util.Objects;
import java.util.function.Function;

/**
 * A pointer to a value of the element type, in some address space.
 */
public final class PointerType extends Type {
    private final Type elementType;
    private final int addressSpace;

    private PointerType(Type elementType, int addressSpace) {
        this.elementType = elementType;
        this.addressSpace = addressSpace;
    }

    public static PointerType get(Type elementType, int addressSpace) {
        return new PointerType(Objects.requireNonNull(elementType), addressSpace);
    }

    public static PointerType getUnqual(Type elementType) {
        return get(elementType, 0);
    }

    public Type getElementType() {
        return elementType;
    }

    public int getAddressSpace() {
        return addressSpace;
    }

    @Override
    public Kind getKind() {
        return Kind.POINTER;
    }

    @Override
    public void print(StringBuilder sb, Function<StructType, String> structRef) {
        elementType.print(sb, structRef);
        if (addressSpace != 0) sb.append(" addrspace(").append(addressSpace).append(')');
        sb.append('*');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointerType)) return false;
        PointerType that = (PointerType) o;
        return addressSpace == that.addressSpace && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return elementType.hashCode() * 31 + addressSpace + 1;
    }
}
