package io.github.eutro.jbitcode.core.ops;

public final class RmwOp extends MemoryOp {
    public final RmwOperation operation;

    public RmwOp(RmwOperation operation, boolean isVolatile, AtomicOrdering ordering, SyncScope scope) {
        super(Opcode.ATOMICRMW, 0, isVolatile, ordering, scope);
        this.operation = operation;
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        super.printModifiers(sb);
        sb.append(' ').append(operation);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && ((RmwOp) o).operation == operation;
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + operation.hashCode();
    }
}
