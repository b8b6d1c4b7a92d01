package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.SequentialType;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.List;

/**
 * A constant struct, array or vector, with one operand per element.
 */
public final class ConstantAggregate extends UniquedConstant {
    private ConstantAggregate(Context context, Type type, List<Constant> elements) {
        super(context, type, elements);
    }

    /**
     * Get an aggregate constant.
     *
     * @param context  The context.
     * @param type     The struct, array or vector type.
     * @param elements The elements, matching the type.
     * @return The constant.
     * @throws IllegalArgumentException If the elements don't match the type.
     */
    public static ConstantAggregate get(Context context, Type type, List<Constant> elements) {
        check(type, elements);
        return context.intern(ConstantAggregate.class, type, null, elements,
                () -> new ConstantAggregate(context, type, elements));
    }

    private static void check(Type type, List<Constant> elements) {
        switch (type.getKind()) {
            case STRUCT: {
                StructType st = (StructType) type;
                if (st.getNumElements() != elements.size()) {
                    throw new IllegalArgumentException("wrong number of struct elements for " + type);
                }
                for (int i = 0; i < elements.size(); i++) {
                    if (!elements.get(i).getType().equals(st.getElement(i))) {
                        throw new IllegalArgumentException("struct element " + i + " has the wrong type");
                    }
                }
                break;
            }
            case ARRAY:
            case VECTOR: {
                SequentialType seq = (SequentialType) type;
                if (seq.getNumElements() != elements.size()) {
                    throw new IllegalArgumentException("wrong number of elements for " + type);
                }
                for (Constant element : elements) {
                    if (!element.getType().equals(seq.getElementType())) {
                        throw new IllegalArgumentException("element of type " + element.getType() + " in " + type);
                    }
                }
                break;
            }
            default:
                throw new IllegalArgumentException("not an aggregate type: " + type);
        }
    }

    @Override
    public Constant rebuild(List<Value> operands) {
        return get(getContext(), getType(), Constants.asConstants(operands));
    }

    @Override
    public String toString() {
        return getType() + " <aggregate of " + getNumOperands() + ">";
    }
}
