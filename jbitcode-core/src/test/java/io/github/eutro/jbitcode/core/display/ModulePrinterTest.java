package io.github.eutro.jbitcode.core.display;

import io.github.eutro.jbitcode.core.ir.BasicBlock;
import io.github.eutro.jbitcode.core.ir.ConstantInt;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.GlobalVariable;
import io.github.eutro.jbitcode.core.ir.Instruction;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.Op;
import io.github.eutro.jbitcode.core.ops.Opcode;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ModulePrinterTest {
    private static Module module(String argName) {
        Module module = new Module();
        module.setTargetTriple("x86_64-pc-linux-gnu");
        module.globals.add(new GlobalVariable(Type.i32(), 0, false, Linkage.INTERNAL,
                ConstantInt.get(module.getContext(), Type.i32(), 7), "g"));

        Function f = new Function(FunctionType.get(Type.i32(), Collections.singletonList(Type.i32()), false),
                Linkage.EXTERNAL, "f");
        f.getArgument(0).setName(argName);
        module.functions.add(f);
        BasicBlock bb = f.newBb();
        Instruction add = Instruction.create(Op.of(Opcode.ADD), Type.i32(),
                f.getArgument(0), ConstantInt.get(module.getContext(), Type.i32(), 1));
        bb.addInstruction(add);
        bb.addInstruction(Instruction.create(Op.of(Opcode.RET), Type.VOID, add));

        module.functions.add(new Function(FunctionType.get(Type.VOID, Collections.emptyList(), false),
                Linkage.EXTERNAL, null));
        return module;
    }

    @Test
    void printsTheWholeModule() {
        assertEquals("target triple = \"x86_64-pc-linux-gnu\"\n" +
                        "@g = internal global i32 7\n" +
                        "\n" +
                        "define i32 @f(i32 %x) {\n" +
                        "0:\n" +
                        "  %1 = add i32 %x, i32 1\n" +
                        "  ret i32 %1\n" +
                        "}\n" +
                        "\n" +
                        "declare void @0()\n",
                ModulePrinter.INSTANCE.run(module("x")));
    }

    @Test
    void unnamedValuesAreNumberedInOrder() {
        String text = ModulePrinter.INSTANCE.run(module(null));
        assertTrue(text.contains("define i32 @f(i32 %0) {\n1:\n  %2 = add i32 %0, i32 1\n"), text);
        assertEquals(text, ModulePrinter.INSTANCE.run(module(null)));
    }
}
