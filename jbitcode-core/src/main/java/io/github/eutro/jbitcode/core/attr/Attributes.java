package io.github.eutro.jbitcode.core.attr;

import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * The attributes of one slot (return value, a parameter, or the function itself),
 * packed into a single word.
 */
public final class Attributes {
    public static final Attributes NONE = new Attributes(0);

    public static final long ALIGNMENT_MASK = 31L << 16;
    public static final long STACK_ALIGNMENT_MASK = 7L << 26;

    private final long raw;

    private Attributes(long raw) {
        this.raw = raw;
    }

    /**
     * Wrap a packed attribute word.
     *
     * @param raw The packed word.
     * @return The attributes.
     */
    public static Attributes fromRaw(long raw) {
        return raw == 0 ? NONE : new Attributes(raw);
    }

    /**
     * Pack a byte alignment into the alignment field.
     *
     * @param alignment The alignment, a power of two, or zero for none.
     * @return The bits to or into a packed word.
     * @throws IllegalArgumentException If the alignment is not a power of two.
     */
    public static long alignmentBits(long alignment) {
        if (alignment == 0) return 0;
        if (Long.bitCount(alignment) != 1) {
            throw new IllegalArgumentException("alignment is not a power of two: " + alignment);
        }
        long log2 = Long.numberOfTrailingZeros(alignment);
        if (log2 + 1 > 31) throw new IllegalArgumentException("alignment too large: " + alignment);
        return (log2 + 1) << 16;
    }

    public long getRaw() {
        return raw;
    }

    public boolean isEmpty() {
        return raw == 0;
    }

    public boolean has(Attribute attr) {
        return (raw & attr.mask) != 0;
    }

    public Set<Attribute> getFlags() {
        EnumSet<Attribute> set = EnumSet.noneOf(Attribute.class);
        for (Attribute attr : Attribute.values()) {
            if (has(attr)) set.add(attr);
        }
        return set;
    }

    /**
     * Get the alignment in bytes.
     *
     * @return The alignment, or 0 if none is set.
     */
    public long getAlignment() {
        long field = (raw & ALIGNMENT_MASK) >>> 16;
        return field == 0 ? 0 : 1L << (field - 1);
    }

    /**
     * Get the stack alignment in bytes.
     *
     * @return The stack alignment, or 0 if none is set.
     */
    public long getStackAlignment() {
        long field = (raw & STACK_ALIGNMENT_MASK) >>> 26;
        return field == 0 ? 0 : 1L << (field - 1);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Attributes && ((Attributes) o).raw == raw;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(raw);
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(" ");
        for (Attribute attr : getFlags()) {
            sj.add(attr.mnemonic);
        }
        long align = getAlignment();
        if (align != 0) sj.add("align " + align);
        long stackAlign = getStackAlignment();
        if (stackAlign != 0) sj.add("alignstack(" + stackAlign + ")");
        return sj.toString();
    }
}
