package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A source location: line, column, and the scope and inlined-at nodes as operands 0 and 1.
 * <p>
 * Not itself usable as an operand. It is a user so that the scope nodes follow replacement
 * of temporary metadata.
 */
public final class DebugLoc extends User {
    private final int line;
    private final int column;

    public DebugLoc(int line, int column, @Nullable MDNode scope, @Nullable MDNode inlinedAt) {
        super(Type.METADATA, Arrays.asList(scope, inlinedAt));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public @Nullable MDNode getScope() {
        return (MDNode) getOperand(0);
    }

    public @Nullable MDNode getInlinedAt() {
        return (MDNode) getOperand(1);
    }

    /**
     * Whether another location has the same line, column and nodes.
     *
     * @param other The other location.
     * @return Whether they are equal.
     */
    public boolean sameAs(@Nullable DebugLoc other) {
        return other != null
                && line == other.line
                && column == other.column
                && getScope() == other.getScope()
                && getInlinedAt() == other.getInlinedAt();
    }

    @Override
    public String toString() {
        return "!dbg(" + line + ":" + column + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }
}
