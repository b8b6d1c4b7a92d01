package io.github.eutro.jbitcode.core.ops;

/**
 * An {@code icmp} or {@code fcmp}.
 */
public final class CmpOp extends Op {
    public final Predicate predicate;

    public CmpOp(Predicate predicate) {
        super(predicate.isFloatingPoint() ? Opcode.FCMP : Opcode.ICMP);
        this.predicate = predicate;
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        sb.append(' ').append(predicate.mnemonic);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && ((CmpOp) o).predicate == predicate;
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + predicate.hashCode();
    }
}
