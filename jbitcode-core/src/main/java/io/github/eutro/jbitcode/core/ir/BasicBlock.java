package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ext.Ext;
import io.github.eutro.jbitcode.core.ext.TrackedList;
import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block, encapsulating a list of {@link Instruction instructions},
 * the last of which should be a terminator.
 * <p>
 * Blocks are values of type {@code label}, used by branches and block addresses.
 */
public final class BasicBlock extends Value {
    private final TrackedList<Instruction> instructions = new TrackedList<Instruction>(new ArrayList<>()) {
        @Override
        protected void onAdded(Instruction elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Instruction elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };

    BasicBlock() {
        super(Type.LABEL);
    }

    /**
     * Get the list of instructions in this basic block.
     *
     * @return The list.
     */
    public List<Instruction> getInstructions() {
        return instructions;
    }

    /**
     * Add an instruction to the end of this basic block.
     *
     * @param insn The instruction to add.
     */
    public void addInstruction(Instruction insn) {
        instructions.add(insn);
    }

    /**
     * Get the terminator of this block.
     *
     * @return The last instruction, if it is a terminator, otherwise null.
     */
    public @Nullable Instruction getTerminator() {
        if (instructions.isEmpty()) return null;
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public @Nullable Function getParent() {
        return owner;
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
