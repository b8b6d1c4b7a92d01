package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ext.Ext;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Op;
import io.github.eutro.jbitcode.core.ops.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An instruction, an {@link Op} applied to a list of operands.
 * <p>
 * The shape of the operand list depends on the opcode. For example, a {@code phi} has
 * value/block pairs, a {@code switch} has the condition, the default block and then
 * case value/block pairs, and a {@code call} has the arguments followed by the callee.
 * <p>
 * Metadata attachments are kept as uses that are not operands, so replacing a temporary
 * metadata node updates them too.
 */
public final class Instruction extends User {
    private Op op;
    @Nullable
    private SortedMap<Integer, Use> attachments;

    public Instruction(Op op, Type type, List<? extends Value> operands) {
        super(type, operands);
        this.op = op;
    }

    public static Instruction create(Op op, Type type, Value... operands) {
        return new Instruction(op, type, Arrays.asList(operands));
    }

    public Op getOp() {
        return op;
    }

    public void setOp(Op op) {
        this.op = op;
    }

    public Opcode getOpcode() {
        return op.key;
    }

    public boolean isTerminator() {
        return op.key.isTerminator();
    }

    /**
     * Add an operand to the end of the operand list.
     *
     * @param value The operand.
     */
    public void appendOperand(@Nullable Value value) {
        addOperand(value);
    }

    /**
     * Get the blocks this instruction may branch to.
     *
     * @return The block operands, in operand order.
     */
    public List<BasicBlock> getSuccessors() {
        if (!isTerminator()) return Collections.emptyList();
        List<BasicBlock> successors = new ArrayList<>();
        for (Value operand : getOperands()) {
            if (operand instanceof BasicBlock) successors.add((BasicBlock) operand);
        }
        return successors;
    }

    /**
     * Get the metadata node attached with the given kind.
     *
     * @param kind The kind, as registered in the {@link Module}.
     * @return The node, or null if there is none.
     */
    public @Nullable MDNode getMetadata(int kind) {
        if (attachments == null) return null;
        Use use = attachments.get(kind);
        return use == null ? null : (MDNode) use.get();
    }

    /**
     * Attach a metadata node, or remove the attachment with the given kind.
     *
     * @param kind The kind.
     * @param node The node, or null to remove it.
     */
    public void setMetadata(int kind, @Nullable MDNode node) {
        if (node == null) {
            if (attachments != null) {
                Use removed = attachments.remove(kind);
                if (removed != null) removed.set(null);
            }
            return;
        }
        if (attachments == null) attachments = new TreeMap<>();
        Use existing = attachments.get(kind);
        if (existing != null) {
            existing.set(node);
        } else {
            attachments.put(kind, newSideUse(node));
        }
    }

    /**
     * Get every attached metadata node, by kind.
     *
     * @return The attachments, in kind order.
     */
    public SortedMap<Integer, MDNode> getAllMetadata() {
        SortedMap<Integer, MDNode> map = new TreeMap<>();
        if (attachments != null) {
            for (Map.Entry<Integer, Use> entry : attachments.entrySet()) {
                Value node = entry.getValue().get();
                if (node != null) map.put(entry.getKey(), (MDNode) node);
            }
        }
        return map;
    }

    public @Nullable DebugLoc getDebugLoc() {
        return debugLoc;
    }

    public void setDebugLoc(@Nullable DebugLoc debugLoc) {
        this.debugLoc = debugLoc;
    }

    public @Nullable BasicBlock getParent() {
        return owner;
    }

    /**
     * Remove this instruction from its block, and drop its operands.
     */
    public void eraseFromParent() {
        if (owner != null) owner.getInstructions().remove(this);
        dropAllReferences();
    }

    /**
     * Clear every operand and metadata attachment of this instruction.
     */
    @Override
    public void dropAllReferences() {
        super.dropAllReferences();
        if (attachments != null) {
            for (Use use : attachments.values()) use.set(null);
            attachments = null;
        }
    }

    @Override
    public String toString() {
        return getType() + " " + op + " " + getNumOperands() + " operand(s)";
    }

    // exts
    private BasicBlock owner = null;
    private DebugLoc debugLoc = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        if (ext == CommonExts.DEBUG_LOC) {
            return (T) debugLoc;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        if (ext == CommonExts.DEBUG_LOC) {
            debugLoc = (DebugLoc) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        if (ext == CommonExts.DEBUG_LOC) {
            debugLoc = null;
            return;
        }
        super.removeExt(ext);
    }
}
