package io.github.eutro.jbitcode.core.passes;

import io.github.eutro.jbitcode.core.attr.AttributeSet;
import io.github.eutro.jbitcode.core.display.ModulePrinter;
import io.github.eutro.jbitcode.core.ir.BasicBlock;
import io.github.eutro.jbitcode.core.ir.ConstantExpr;
import io.github.eutro.jbitcode.core.ir.ConstantInt;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.GlobalVariable;
import io.github.eutro.jbitcode.core.ir.Instruction;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.CallOp;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.Op;
import io.github.eutro.jbitcode.core.ops.Opcode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class UpgradeIntrinsicsTest {
    private static final FunctionType UNARY = FunctionType.get(Type.i32(), Collections.singletonList(Type.i32()), false);

    private final Module module = new Module();
    private final Function ctlz = new Function(UNARY, Linkage.EXTERNAL, "llvm.ctlz.i32");
    private final Function caller = new Function(UNARY, Linkage.EXTERNAL, "caller");
    private final Instruction call = Instruction.create(new CallOp(Opcode.CALL, CallOp.CC_C, false, AttributeSet.EMPTY),
            Type.i32(), caller.getArgument(0), ctlz);
    private final Instruction ret = Instruction.create(Op.of(Opcode.RET), Type.VOID, call);

    {
        module.functions.add(ctlz);
        module.functions.add(caller);
        BasicBlock bb = caller.newBb();
        call.setName("n");
        bb.addInstruction(call);
        bb.addInstruction(ret);
    }

    @Test
    void onlyOldCountIntrinsicsNeedUpgrading() {
        assertTrue(UpgradeIntrinsics.needsUpgrade(ctlz));
        assertTrue(UpgradeIntrinsics.needsUpgrade(new Function(UNARY, Linkage.EXTERNAL, "llvm.cttz.i32")));
        assertFalse(UpgradeIntrinsics.needsUpgrade(caller));
        assertFalse(UpgradeIntrinsics.needsUpgrade(new Function(UNARY, Linkage.EXTERNAL, "llvm.ctpop.i32")));
        assertFalse(UpgradeIntrinsics.needsUpgrade(new Function(UNARY, Linkage.EXTERNAL, null)));
        FunctionType binary = FunctionType.get(Type.i32(), Arrays.asList(Type.i32(), Type.i1()), false);
        assertFalse(UpgradeIntrinsics.needsUpgrade(new Function(binary, Linkage.EXTERNAL, "llvm.ctlz.i32")));
    }

    @Test
    void callsAreRewritten() {
        UpgradeIntrinsics pass = new UpgradeIntrinsics();
        Function newFn = pass.upgradeDeclaration(ctlz);
        assertNotNull(newFn);
        assertEquals("llvm.ctlz.i32.old", ctlz.getName());
        assertEquals("llvm.ctlz.i32", newFn.getName());
        assertEquals(2, newFn.getFunctionType().getNumParams());
        assertEquals(Arrays.asList(ctlz, newFn, caller), module.functions);
        assertNull(pass.upgradeDeclaration(caller));

        pass.runInPlace(module);
        assertEquals(Arrays.asList(newFn, caller), module.functions);
        assertTrue(pass.getUpgraded().isEmpty());

        Instruction newCall = caller.blocks.get(0).getInstructions().get(0);
        assertNotSame(call, newCall);
        assertEquals("n", newCall.getName());
        assertSame(caller.getArgument(0), newCall.getOperand(0));
        assertTrue(((ConstantInt) newCall.getOperand(1)).isZero());
        assertSame(newFn, newCall.getOperand(2));
        assertSame(newCall, ret.getOperand(0));
        assertFalse(ctlz.hasUses());
        assertNull(ctlz.getParent());
    }

    @Test
    void otherUsesSeeACast() {
        GlobalVariable table = new GlobalVariable(ctlz.getType(), 0, true, Linkage.INTERNAL, ctlz, "table");
        module.globals.add(table);

        UpgradeIntrinsics pass = new UpgradeIntrinsics();
        Function newFn = pass.upgradeDeclaration(ctlz);
        pass.runInPlace(module);

        ConstantExpr cast = (ConstantExpr) table.getInitializer();
        assertNotNull(cast);
        assertEquals(Opcode.BITCAST, cast.getOpcode());
        assertSame(newFn, cast.getOperand(0));
        assertEquals(ctlz.getType(), cast.getType());
    }

    @Test
    void runsAsAPass() {
        String text = new UpgradeIntrinsics().then(ModulePrinter.INSTANCE).run(module);
        assertEquals("\n" +
                "declare i32 @llvm.ctlz.i32(i32 %0, i1 %1)\n" +
                "\n" +
                "define i32 @caller(i32 %0) {\n" +
                "1:\n" +
                "  %n = call i32 @llvm.ctlz.i32(i32 %0, i1 false)\n" +
                "  ret i32 %n\n" +
                "}\n", text);
    }
}
