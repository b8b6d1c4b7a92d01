package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.Arrays;
import java.util.List;

/**
 * The address of a basic block, for {@code indirectbr}.
 * Operand 0 is the function, operand 1 the block.
 */
public final class BlockAddress extends UniquedConstant {
    private BlockAddress(Context context, Function function, BasicBlock block) {
        super(context, PointerType.getUnqual(Type.i8()), Arrays.asList(function, block));
    }

    public static BlockAddress get(Context context, Function function, BasicBlock block) {
        return context.intern(BlockAddress.class, PointerType.getUnqual(Type.i8()), null,
                Arrays.asList(function, block),
                () -> new BlockAddress(context, function, block));
    }

    public Function getFunction() {
        return (Function) getOperand(0);
    }

    public BasicBlock getBlock() {
        return (BasicBlock) getOperand(1);
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return get(getContext(), (Function) operands.get(0), (BasicBlock) operands.get(1));
    }
}
