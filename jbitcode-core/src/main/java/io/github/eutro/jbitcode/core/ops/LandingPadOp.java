package io.github.eutro.jbitcode.core.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@code landingpad}. Operand 0 is the personality function, followed by one
 * operand per clause.
 */
public final class LandingPadOp extends Op {
    public enum ClauseKind {
        CATCH,
        FILTER,
    }

    public final boolean cleanup;
    public final List<ClauseKind> clauses;

    public LandingPadOp(boolean cleanup, List<ClauseKind> clauses) {
        super(Opcode.LANDINGPAD);
        this.cleanup = cleanup;
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        LandingPadOp that = (LandingPadOp) o;
        return cleanup == that.cleanup && clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode() * 2 + (cleanup ? 1 : 0);
    }
}
