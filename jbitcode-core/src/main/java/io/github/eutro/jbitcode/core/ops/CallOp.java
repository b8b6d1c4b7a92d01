package io.github.eutro.jbitcode.core.ops;

import io.github.eutro.jbitcode.core.attr.AttributeSet;

import java.util.Objects;

/**
 * A {@code call} or {@code invoke}.
 */
public final class CallOp extends Op {
    public static final int CC_C = 0;

    public final int callingConv;
    public final boolean tail;
    public final AttributeSet attributes;

    public CallOp(Opcode key, int callingConv, boolean tail, AttributeSet attributes) {
        super(key);
        if (key != Opcode.CALL && key != Opcode.INVOKE) {
            throw new IllegalArgumentException("not a call: " + key);
        }
        this.callingConv = callingConv;
        this.tail = tail;
        this.attributes = attributes;
    }

    @Override
    public String toString() {
        return (tail ? "tail " : "") + super.toString();
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        if (callingConv != CC_C) sb.append(" cc").append(callingConv);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        CallOp that = (CallOp) o;
        return callingConv == that.callingConv && tail == that.tail && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, callingConv, tail, attributes);
    }
}
