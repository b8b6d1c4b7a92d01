package io.github.eutro.jbitcode.core.ops;

import java.util.Objects;

/**
 * A memory access: {@code load}, {@code store}, {@code cmpxchg}, {@code fence},
 * or (as {@link RmwOp}) {@code atomicrmw}.
 */
public class MemoryOp extends Op {
    public final long alignment;
    public final boolean isVolatile;
    public final AtomicOrdering ordering;
    public final SyncScope scope;

    public MemoryOp(Opcode key, long alignment, boolean isVolatile, AtomicOrdering ordering, SyncScope scope) {
        super(key);
        this.alignment = alignment;
        this.isVolatile = isVolatile;
        this.ordering = ordering;
        this.scope = scope;
    }

    /**
     * A plain, non-atomic load or store.
     *
     * @param key        {@link Opcode#LOAD} or {@link Opcode#STORE}.
     * @param alignment  The alignment, or 0.
     * @param isVolatile Whether the access is volatile.
     * @return The op.
     */
    public static MemoryOp simple(Opcode key, long alignment, boolean isVolatile) {
        return new MemoryOp(key, alignment, isVolatile, AtomicOrdering.NOT_ATOMIC, SyncScope.CROSS_THREAD);
    }

    public boolean isAtomic() {
        return ordering != AtomicOrdering.NOT_ATOMIC;
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        if (isAtomic() && key != Opcode.FENCE && key != Opcode.CMPXCHG && key != Opcode.ATOMICRMW) {
            sb.append(" atomic");
        }
        if (isVolatile) sb.append(" volatile");
    }

    /**
     * Append the trailing ordering and alignment text.
     *
     * @param sb The builder.
     */
    public void printSuffix(StringBuilder sb) {
        if (isAtomic()) {
            if (scope == SyncScope.SINGLE_THREAD) sb.append(" singlethread");
            sb.append(' ').append(ordering.mnemonic);
        }
        if (alignment != 0) sb.append(", align ").append(alignment);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        MemoryOp that = (MemoryOp) o;
        return alignment == that.alignment
                && isVolatile == that.isVolatile
                && ordering == that.ordering
                && scope == that.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, alignment, isVolatile, ordering, scope);
    }
}
