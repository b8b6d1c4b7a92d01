package io.github.eutro.jbitcode.core.ops;

/**
 * A binary operator carrying overflow or exactness flags.
 */
public final class FlagsOp extends Op {
    public static final int NO_UNSIGNED_WRAP = 1;
    public static final int NO_SIGNED_WRAP = 2;
    public static final int EXACT = 4;

    public final int flags;

    public FlagsOp(Opcode key, int flags) {
        super(key);
        if (!key.isBinary()) throw new IllegalArgumentException("not a binary operator: " + key);
        this.flags = flags;
    }

    /**
     * Get the op for a binary operator, with flags only if any are set.
     *
     * @param key   The opcode.
     * @param flags The flags.
     * @return The op.
     */
    public static Op of(Opcode key, int flags) {
        return flags == 0 ? Op.of(key) : new FlagsOp(key, flags);
    }

    public boolean has(int flag) {
        return (flags & flag) != 0;
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        if (has(NO_UNSIGNED_WRAP)) sb.append(" nuw");
        if (has(NO_SIGNED_WRAP)) sb.append(" nsw");
        if (has(EXACT)) sb.append(" exact");
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && ((FlagsOp) o).flags == flags;
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + flags;
    }
}
