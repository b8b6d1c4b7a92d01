package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.Op;
import io.github.eutro.jbitcode.core.ops.Opcode;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class UseListTest {
    private final Context context = new Context();

    private static Function unary() {
        return new Function(FunctionType.get(Type.i32(), Collections.singletonList(Type.i32()), false),
                Linkage.EXTERNAL, "f");
    }

    @Test
    void usesFollowOperands() {
        Function f = unary();
        Argument x = f.getArgument(0);
        BasicBlock bb = f.newBb();
        Instruction add = Instruction.create(Op.of(Opcode.ADD), Type.i32(), x, x);
        bb.addInstruction(add);
        assertSame(bb, add.getParent());
        assertSame(f, bb.getParent());

        assertEquals(2, x.getNumUses());
        assertEquals(Collections.singletonList(add), x.getUsers());

        ConstantInt one = ConstantInt.get(context, Type.i32(), 1);
        add.setOperand(1, one);
        assertEquals(1, x.getNumUses());
        assertEquals(1, one.getNumUses());
        assertEquals(1, one.getUses().iterator().next().getOperandNo());

        add.eraseFromParent();
        assertTrue(bb.getInstructions().isEmpty());
        assertNull(add.getParent());
        assertFalse(x.hasUses());
        assertFalse(one.hasUses());
    }

    @Test
    void replacingEveryUse() {
        Function f = unary();
        Argument x = f.getArgument(0);
        BasicBlock bb = f.newBb();
        Instruction add = Instruction.create(Op.of(Opcode.ADD), Type.i32(), x, x);
        Instruction ret = Instruction.create(Op.of(Opcode.RET), Type.VOID, add);
        bb.addInstruction(add);
        bb.addInstruction(ret);
        assertSame(ret, bb.getTerminator());

        ConstantInt two = ConstantInt.get(context, Type.i32(), 2);
        x.replaceAllUsesWith(two);
        assertFalse(x.hasUses());
        assertSame(two, add.getOperand(0));
        assertSame(two, add.getOperand(1));
        assertEquals(2, two.getNumUses());

        assertThrows(IllegalArgumentException.class, () -> add.replaceAllUsesWith(add));
        assertThrows(IllegalArgumentException.class,
                () -> add.replaceAllUsesWith(ConstantInt.get(context, Type.i8(), 2)));
    }

    @Test
    void constantsAreUniqued() {
        ConstantInt a = ConstantInt.get(context, Type.i32(), 5);
        assertSame(a, ConstantInt.get(context, Type.i32(), 5));
        assertNotSame(a, ConstantInt.get(context, Type.i64(), 5));
        assertNotSame(a, ConstantInt.get(new Context(), Type.i32(), 5));

        ConstantInt allOnes = ConstantInt.get(context, Type.i8(), 255);
        assertEquals(-1, allOnes.getSExtValue());
        assertEquals(255, allOnes.getUnsignedValue().intValueExact());
        assertSame(allOnes, ConstantInt.get(context, Type.i8(), -1));

        ConstantExpr sum = ConstantExpr.getBinary(context, Op.of(Opcode.ADD), a, a);
        assertSame(sum, ConstantExpr.getBinary(context, Op.of(Opcode.ADD), a, a));
        assertSame(Constants.getNullValue(context, Type.i32()), ConstantInt.get(context, Type.i32(), 0));
        assertTrue(Constants.getNullValue(context, Type.DOUBLE) instanceof ConstantFP);
    }

    @Test
    void replacingAPlaceholderRebuildsItsUsers() {
        ConstantPlaceholder placeholder = new ConstantPlaceholder(Type.i32());
        ConstantInt one = ConstantInt.get(context, Type.i32(), 1);
        ConstantInt two = ConstantInt.get(context, Type.i32(), 2);
        ConstantExpr sum = ConstantExpr.getBinary(context, Op.of(Opcode.ADD), placeholder, one);
        Instruction ret = Instruction.create(Op.of(Opcode.RET), Type.VOID, sum);
        int live = context.size();

        placeholder.replaceAllUsesWith(two);
        assertFalse(placeholder.hasUses());
        assertFalse(sum.hasUses());

        Value rebuilt = ret.getOperand(0);
        assertNotSame(sum, rebuilt);
        assertSame(ConstantExpr.getBinary(context, Op.of(Opcode.ADD), two, one), rebuilt);
        assertEquals(live, context.size());
    }

    @Test
    void destroyingAUsedConstant() {
        ConstantInt one = ConstantInt.get(context, Type.i32(), 1);
        ConstantExpr sum = ConstantExpr.getBinary(context, Op.of(Opcode.ADD), one, one);
        assertThrows(IllegalStateException.class, one::destroy);
        sum.destroy();
        assertFalse(one.hasUses());
        one.destroy();
        assertEquals(0, context.size());
        assertNotSame(one, ConstantInt.get(context, Type.i32(), 1));
    }
}
