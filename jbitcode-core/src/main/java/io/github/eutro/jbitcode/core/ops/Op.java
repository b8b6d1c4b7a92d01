package io.github.eutro.jbitcode.core.ops;

import java.util.EnumMap;
import java.util.Map;

/**
 * An operation, encapsulating an {@link Opcode} and any intermediates that are not
 * operands, such as a comparison predicate or the alignment of a load.
 * <p>
 * Ops are immutable and compare by content.
 */
public /* virtual */ class Op {
    private static final Map<Opcode, Op> PLAIN = new EnumMap<>(Opcode.class);

    static {
        for (Opcode opcode : Opcode.values()) {
            PLAIN.put(opcode, new Op(opcode));
        }
    }

    /**
     * The opcode of the operation.
     */
    public final Opcode key;

    protected Op(Opcode key) {
        this.key = key;
    }

    /**
     * Get the op with no intermediates for an opcode.
     *
     * @param key The opcode.
     * @return The op.
     */
    public static Op of(Opcode key) {
        return PLAIN.get(key);
    }

    /**
     * Append the text of the intermediates that go after the mnemonic, if any.
     *
     * @param sb The builder.
     */
    public void printModifiers(StringBuilder sb) {
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o != null && o.getClass() == getClass() && ((Op) o).key == key;
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(key.mnemonic);
        printModifiers(sb);
        return sb.toString();
    }
}
