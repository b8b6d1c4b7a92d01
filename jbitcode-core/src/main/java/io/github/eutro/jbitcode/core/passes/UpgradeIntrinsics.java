package io.github.eutro.jbitcode.core.passes;

import io.github.eutro.jbitcode.core.ir.*;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Replaces declarations of intrinsics whose signature has changed, and rewrites their calls.
 * <p>
 * The only upgrade known is for {@code llvm.ctlz.*} and {@code llvm.cttz.*}, which gained
 * an {@code i1} "is zero undefined" parameter. Old calls pass {@code false}.
 * <p>
 * Declarations are {@link #upgradeDeclaration(Function) upgraded} as they are found, leaving
 * the old function in place renamed with a {@code .old} suffix. Calls are rewritten per function
 * with {@link #upgradeCallsIn(Function)}. {@link #runInPlace(Module) Running} the pass upgrades any
 * declarations not seen yet, rewrites what remains and removes the old declarations.
 */
public class UpgradeIntrinsics implements InPlaceIRPass<Module> {
    private final Map<Function, Function> upgraded = new LinkedHashMap<>();

    /**
     * Whether a function is an intrinsic with an outdated signature.
     *
     * @param function The function.
     * @return Whether it needs upgrading.
     */
    public static boolean needsUpgrade(Function function) {
        String name = function.getName();
        if (name == null) return false;
        if (!name.startsWith("llvm.ctlz.") && !name.startsWith("llvm.cttz.")) return false;
        return function.getFunctionType().getNumParams() == 1;
    }

    /**
     * Upgrade a declaration, if it needs it, adding the new declaration to the module.
     *
     * @param function The old declaration.
     * @return The new declaration, or null if the function doesn't need upgrading.
     */
    public @Nullable Function upgradeDeclaration(Function function) {
        if (!needsUpgrade(function)) return null;
        Module module = Objects.requireNonNull(function.getParent(), "function is not in a module");
        String name = Objects.requireNonNull(function.getName());
        FunctionType oldType = function.getFunctionType();
        FunctionType newType = FunctionType.get(oldType.getReturnType(),
                Arrays.asList(oldType.getParam(0), Type.i1()), false);
        function.setName(name + ".old");
        Function newFn = new Function(newType, function.getLinkage(), name);
        newFn.setAttributes(function.getAttributes());
        module.functions.add(module.functions.indexOf(function) + 1, newFn);
        upgraded.put(function, newFn);
        return newFn;
    }

    /**
     * Get the declarations upgraded so far.
     *
     * @return The old declarations, mapped to their replacements.
     */
    public Map<Function, Function> getUpgraded() {
        return Collections.unmodifiableMap(upgraded);
    }

    /**
     * Rewrite every call to an upgraded declaration in the body of a function.
     *
     * @param function The function.
     */
    public void upgradeCallsIn(Function function) {
        if (upgraded.isEmpty()) return;
        for (BasicBlock block : function.blocks) {
            for (Instruction insn : new ArrayList<>(block.getInstructions())) {
                if (insn.getOpcode() != Opcode.CALL) continue;
                Value callee = insn.getOperand(insn.getNumOperands() - 1);
                Function newFn = upgraded.get(callee);
                if (newFn != null) upgradeCall(insn, newFn);
            }
        }
    }

    private static void upgradeCall(Instruction call, Function newFn) {
        BasicBlock block = Objects.requireNonNull(call.getParent());
        Context context = Objects.requireNonNull(newFn.getParent()).getContext();
        Instruction newCall = Instruction.create(call.getOp(), call.getType(),
                call.getOperand(0), ConstantInt.get(context, Type.i1(), 0), newFn);
        newCall.setName(call.getName());
        newCall.setDebugLoc(call.getDebugLoc());
        for (Map.Entry<Integer, MDNode> entry : call.getAllMetadata().entrySet()) {
            newCall.setMetadata(entry.getKey(), entry.getValue());
        }
        List<Instruction> insns = block.getInstructions();
        insns.add(insns.indexOf(call), newCall);
        if (!call.getType().isVoid()) call.replaceAllUsesWith(newCall);
        call.eraseFromParent();
    }

    @Override
    public void runInPlace(Module module) {
        for (Function function : new ArrayList<>(module.functions)) {
            if (!upgraded.containsKey(function)) upgradeDeclaration(function);
        }
        for (Function function : module.functions) {
            if (!function.isDeclaration()) upgradeCallsIn(function);
        }
        for (Map.Entry<Function, Function> entry : upgraded.entrySet()) {
            Function oldFn = entry.getKey();
            Function newFn = entry.getValue();
            if (oldFn.hasUses()) {
                oldFn.replaceAllUsesWith(ConstantExpr.getCast(module.getContext(),
                        Opcode.BITCAST, newFn, oldFn.getType()));
            }
            module.functions.remove(oldFn);
        }
        upgraded.clear();
    }
}
