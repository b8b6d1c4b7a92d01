package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A metadata tuple. Operands may be any values, other nodes, strings, or null.
 * <p>
 * A temporary node stands in for a node that has been referenced but not read yet,
 * and is {@link #replaceAllUsesWith(Value) replaced} once it is.
 */
public final class MDNode extends User {
    private final boolean temporary;
    private final boolean functionLocal;

    private MDNode(List<? extends Value> operands, boolean temporary, boolean functionLocal) {
        super(Type.METADATA, operands);
        this.temporary = temporary;
        this.functionLocal = functionLocal;
    }

    public static MDNode get(List<? extends Value> operands) {
        return new MDNode(operands, false, false);
    }

    /**
     * Create a node that refers to values local to one function.
     *
     * @param operands The operands.
     * @return The node.
     */
    public static MDNode getFunctionLocal(List<? extends Value> operands) {
        return new MDNode(operands, false, true);
    }

    public static MDNode getTemporary() {
        return new MDNode(Collections.emptyList(), true, false);
    }

    public boolean isTemporary() {
        return temporary;
    }

    public boolean isFunctionLocal() {
        return functionLocal;
    }

    /**
     * Discard a temporary node once nothing uses it.
     *
     * @throws IllegalStateException If the node is not temporary, or still used.
     */
    public void deleteTemporary() {
        if (!temporary) throw new IllegalStateException("not a temporary node");
        if (hasUses()) throw new IllegalStateException("deleting a temporary node that is still used");
        dropAllReferences();
    }

    @Override
    public String toString() {
        return temporary ? "!<temporary>" : "!{" + getNumOperands() + " operand(s)}";
    }
}
