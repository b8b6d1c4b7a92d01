package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ir.types.Types;
import io.github.eutro.jbitcode.core.ir.types.VectorType;
import io.github.eutro.jbitcode.core.ops.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An operation over constants, folded into a single constant.
 * <p>
 * The factories check operand types and throw {@link IllegalArgumentException} on mismatch.
 */
public final class ConstantExpr extends UniquedConstant {
    private final Op op;

    private ConstantExpr(Context context, Op op, Type type, List<? extends Constant> operands) {
        super(context, type, operands);
        this.op = op;
    }

    /**
     * Get a constant expression with an already computed type.
     *
     * @param context  The context.
     * @param op       The operation.
     * @param type     The result type.
     * @param operands The operands.
     * @return The constant.
     */
    public static ConstantExpr get(Context context, Op op, Type type, List<? extends Constant> operands) {
        return context.intern(ConstantExpr.class, type, op, operands,
                () -> new ConstantExpr(context, op, type, operands));
    }

    public static ConstantExpr getBinary(Context context, Op op, Constant lhs, Constant rhs) {
        if (!op.key.isBinary()) throw new IllegalArgumentException("not a binary operator: " + op);
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("binary operands of different types");
        }
        return get(context, op, lhs.getType(), Arrays.asList(lhs, rhs));
    }

    public static ConstantExpr getCast(Context context, Opcode opcode, Constant value, Type destType) {
        if (!opcode.isCast()) throw new IllegalArgumentException("not a cast: " + opcode);
        return get(context, Op.of(opcode), destType, Arrays.asList(value));
    }

    public static ConstantExpr getGetElementPtr(Context context, boolean inBounds, Constant base, List<Constant> indices) {
        List<Constant> operands = new ArrayList<>(indices.size() + 1);
        operands.add(base);
        operands.addAll(indices);
        Type type = Constants.getGepResultType(base.getType(), operands.subList(1, operands.size()));
        if (type == null) throw new IllegalArgumentException("invalid getelementptr indices for " + base.getType());
        return get(context, GepOp.of(inBounds), type, operands);
    }

    public static ConstantExpr getSelect(Context context, Constant cond, Constant ifTrue, Constant ifFalse) {
        if (!ifTrue.getType().equals(ifFalse.getType())) {
            throw new IllegalArgumentException("select arms of different types");
        }
        return get(context, Op.of(Opcode.SELECT), ifTrue.getType(), Arrays.asList(cond, ifTrue, ifFalse));
    }

    public static ConstantExpr getExtractElement(Context context, Constant vector, Constant index) {
        if (!vector.getType().isVector()) throw new IllegalArgumentException("extractelement from non-vector");
        Type elementType = ((VectorType) vector.getType()).getElementType();
        return get(context, Op.of(Opcode.EXTRACTELEMENT), elementType, Arrays.asList(vector, index));
    }

    public static ConstantExpr getInsertElement(Context context, Constant vector, Constant element, Constant index) {
        if (!vector.getType().isVector()) throw new IllegalArgumentException("insertelement into non-vector");
        return get(context, Op.of(Opcode.INSERTELEMENT), vector.getType(), Arrays.asList(vector, element, index));
    }

    public static ConstantExpr getShuffleVector(Context context, Constant v1, Constant v2, Constant mask) {
        Type type = Constants.getShuffleResultType(v1.getType(), mask.getType());
        if (type == null || !v1.getType().equals(v2.getType())) {
            throw new IllegalArgumentException("invalid shufflevector operands");
        }
        return get(context, Op.of(Opcode.SHUFFLEVECTOR), type, Arrays.asList(v1, v2, mask));
    }

    public static ConstantExpr getCompare(Context context, Predicate predicate, Constant lhs, Constant rhs) {
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("compared operands of different types");
        }
        return get(context, new CmpOp(predicate), Types.comparisonResult(lhs.getType()), Arrays.asList(lhs, rhs));
    }

    public Op getOp() {
        return op;
    }

    public Opcode getOpcode() {
        return op.key;
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        if (op.key == Opcode.GETELEMENTPTR) {
            List<Constant> constants = Constants.asConstants(operands);
            return getGetElementPtr(getContext(), ((GepOp) op).inBounds,
                    constants.get(0), constants.subList(1, constants.size()));
        }
        return get(getContext(), op, getType(), Constants.asConstants(operands));
    }

    @Override
    public String toString() {
        return getType() + " " + op + " (...)";
    }
}
