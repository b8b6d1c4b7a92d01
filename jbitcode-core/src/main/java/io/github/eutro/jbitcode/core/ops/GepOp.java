package io.github.eutro.jbitcode.core.ops;

public final class GepOp extends Op {
    public static final GepOp PLAIN = new GepOp(false);
    public static final GepOp IN_BOUNDS = new GepOp(true);

    public final boolean inBounds;

    private GepOp(boolean inBounds) {
        super(Opcode.GETELEMENTPTR);
        this.inBounds = inBounds;
    }

    public static GepOp of(boolean inBounds) {
        return inBounds ? IN_BOUNDS : PLAIN;
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        if (inBounds) sb.append(" inbounds");
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && ((GepOp) o).inBounds == inBounds;
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 2 + (inBounds ? 1 : 0);
    }
}
