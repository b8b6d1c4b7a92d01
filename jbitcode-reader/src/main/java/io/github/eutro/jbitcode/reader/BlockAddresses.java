package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.BasicBlock;
import io.github.eutro.jbitcode.core.ir.BlockAddress;
import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.GlobalVariable;
import io.github.eutro.jbitcode.core.ir.Instruction;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.Use;
import io.github.eutro.jbitcode.core.ir.User;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Linkage;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Block addresses of functions whose bodies have not been read.
 * <p>
 * Until the blocks exist, a block address is an anonymous internal {@code i8} global,
 * which is replaced with the real address once the function is materialized.
 */
final class BlockAddresses {
    private final Module module;
    private final Map<Function, List<ForwardRef>> forwardRefs = new IdentityHashMap<>();

    BlockAddresses(Module module) {
        this.module = module;
    }

    /**
     * Get the address of a block.
     *
     * @param function The function.
     * @param blockIdx The index of the block in the function.
     * @return The address, or a placeholder for it.
     * @throws BitcodeException If the function has a body without that block.
     */
    Constant get(Function function, long blockIdx) throws BitcodeException {
        if (!function.isDeclaration()) {
            if (blockIdx < 0 || blockIdx >= function.blocks.size()) {
                throw new BitcodeException(ErrorKind.INVALID_ID, "block " + blockIdx + " of " + function.getName());
            }
            return BlockAddress.get(module.getContext(), function, function.blocks.get((int) blockIdx));
        }
        GlobalVariable placeholder = new GlobalVariable(Type.i8(), 0, false, Linkage.INTERNAL, null, null);
        module.globals.add(placeholder);
        forwardRefs.computeIfAbsent(function, k -> new ArrayList<>()).add(new ForwardRef(blockIdx, placeholder));
        return placeholder;
    }

    boolean hasForwardRefs(Function function) {
        return forwardRefs.containsKey(function);
    }

    /**
     * Replace the placeholders for blocks of a function that has just been read.
     *
     * @param function The function.
     * @throws BitcodeException If a placeholder names a block the function doesn't have.
     */
    void resolve(Function function) throws BitcodeException {
        List<ForwardRef> refs = forwardRefs.get(function);
        if (refs == null) return;
        for (ForwardRef ref : refs) {
            if (ref.blockIdx < 0 || ref.blockIdx >= function.blocks.size()) {
                throw new BitcodeException(ErrorKind.INVALID_ID, "block address of block " + ref.blockIdx
                        + " in a function with " + function.blocks.size());
            }
        }
        forwardRefs.remove(function);
        for (ForwardRef ref : refs) {
            BasicBlock block = function.blocks.get((int) ref.blockIdx);
            ref.placeholder.replaceAllUsesWith(BlockAddress.get(module.getContext(), function, block));
            module.globals.remove(ref.placeholder);
        }
    }

    /**
     * Delete the body of a function, turning the block addresses still used outside it
     * back into placeholders.
     *
     * @param function The function.
     */
    void deleteBody(Function function) {
        List<BlockAddress> addresses = new ArrayList<>();
        for (Use use : function.getUses()) {
            User user = use.getUser();
            if (user instanceof BlockAddress && !addresses.contains(user)) addresses.add((BlockAddress) user);
        }
        List<BlockAddress> bodyOnly = new ArrayList<>();
        for (BlockAddress address : addresses) {
            if (!isUsedOutside(address, function)) {
                bodyOnly.add(address);
                continue;
            }
            long blockIdx = function.blocks.indexOf(address.getBlock());
            GlobalVariable placeholder = new GlobalVariable(Type.i8(), 0, false, Linkage.INTERNAL, null, null);
            module.globals.add(placeholder);
            forwardRefs.computeIfAbsent(function, k -> new ArrayList<>()).add(new ForwardRef(blockIdx, placeholder));
            address.replaceAllUsesWith(placeholder);
            address.destroy();
        }
        function.deleteBody();
        for (BlockAddress address : bodyOnly) {
            address.destroy();
        }
    }

    private static boolean isUsedOutside(BlockAddress address, Function function) {
        for (Use use : address.getUses()) {
            User user = use.getUser();
            if (!(user instanceof Instruction)) return true;
            BasicBlock block = ((Instruction) user).getParent();
            if (block == null || block.getParent() != function) return true;
        }
        return false;
    }

    private static final class ForwardRef {
        final long blockIdx;
        final GlobalVariable placeholder;

        ForwardRef(long blockIdx, GlobalVariable placeholder) {
            this.blockIdx = blockIdx;
            this.placeholder = placeholder;
        }
    }
}
