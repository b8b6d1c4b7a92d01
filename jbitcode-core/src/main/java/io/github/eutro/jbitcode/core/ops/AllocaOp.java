package io.github.eutro.jbitcode.core.ops;

import io.github.eutro.jbitcode.core.ir.types.Type;

public final class AllocaOp extends Op {
    public final Type allocatedType;
    public final long alignment;

    public AllocaOp(Type allocatedType, long alignment) {
        super(Opcode.ALLOCA);
        this.allocatedType = allocatedType;
        this.alignment = alignment;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        AllocaOp that = (AllocaOp) o;
        return alignment == that.alignment && allocatedType.equals(that.allocatedType);
    }

    @Override
    public int hashCode() {
        return (super.hashCode() * 31 + allocatedType.hashCode()) * 31 + Long.hashCode(alignment);
    }
}
