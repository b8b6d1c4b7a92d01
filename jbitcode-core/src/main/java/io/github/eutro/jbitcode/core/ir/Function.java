package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.attr.AttributeSet;
import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ext.TrackedList;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ops.CallOp;
import io.github.eutro.jbitcode.core.ops.Linkage;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function, encapsulating its {@link Argument arguments} and a list of {@link BasicBlock basic blocks}.
 * <p>
 * A function with no blocks is a declaration. A function read lazily stays a declaration
 * until its body is materialized.
 */
public final class Function extends GlobalValue {
    private final List<Argument> arguments;

    /**
     * The list of basic blocks in this function. The first element is the entry block.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    }; // [0] is entry

    private int callingConv = CallOp.CC_C;
    private AttributeSet attributes = AttributeSet.EMPTY;
    @Nullable
    private String gc;

    public Function(FunctionType type, Linkage linkage, @Nullable String name) {
        this(PointerType.getUnqual(type), linkage, name);
    }

    public Function(PointerType type, Linkage linkage, @Nullable String name) {
        super(type, linkage, name);
        if (!type.getElementType().isFunction()) {
            throw new IllegalArgumentException("function of non-function type " + type);
        }
        FunctionType fnType = getFunctionType();
        List<Argument> args = new ArrayList<>(fnType.getNumParams());
        for (int i = 0; i < fnType.getNumParams(); i++) {
            args.add(new Argument(fnType.getParam(i), this, i));
        }
        arguments = Collections.unmodifiableList(args);
    }

    public FunctionType getFunctionType() {
        return (FunctionType) getValueType();
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public Argument getArgument(int i) {
        return arguments.get(i);
    }

    @Override
    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    /**
     * Creates a new basic block at the end of this function.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    /**
     * Delete every block of this function, leaving it a declaration.
     * <p>
     * Instructions are unlinked from everything they use, and anything outside the body
     * that still refers to an instruction has that reference cleared. Blocks that are still
     * referenced, such as by a {@link BlockAddress}, must be dealt with by the caller first.
     */
    public void deleteBody() {
        for (BasicBlock block : blocks) {
            for (Instruction insn : block.getInstructions()) {
                insn.dropAllReferences();
            }
        }
        for (BasicBlock block : blocks) {
            for (Instruction insn : block.getInstructions()) {
                for (Use use : new ArrayList<>(insn.getUses())) {
                    use.set(null);
                }
            }
            block.getInstructions().clear();
        }
        blocks.clear();
    }

    public int getCallingConv() {
        return callingConv;
    }

    public void setCallingConv(int callingConv) {
        this.callingConv = callingConv;
    }

    public AttributeSet getAttributes() {
        return attributes;
    }

    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public @Nullable String getGC() {
        return gc;
    }

    public void setGC(@Nullable String gc) {
        this.gc = gc;
    }

    /**
     * Whether this is a declaration of a built-in function, whose name starts with {@code llvm.}.
     *
     * @return Whether this is an intrinsic.
     */
    public boolean isIntrinsic() {
        return hasName() && getName().startsWith("llvm.");
    }
}
