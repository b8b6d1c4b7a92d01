package io.github.eutro.jbitcode.core.ops;

import java.util.Arrays;

/**
 * An {@code extractvalue} or {@code insertvalue}, with its constant indices.
 */
public final class IndexOp extends Op {
    private final int[] indices;

    public IndexOp(Opcode key, int[] indices) {
        super(key);
        if (key != Opcode.EXTRACTVALUE && key != Opcode.INSERTVALUE) {
            throw new IllegalArgumentException("not an aggregate operation: " + key);
        }
        this.indices = indices.clone();
    }

    public int[] getIndices() {
        return indices.clone();
    }

    public int getNumIndices() {
        return indices.length;
    }

    public int getIndex(int i) {
        return indices[i];
    }

    @Override
    public void printModifiers(StringBuilder sb) {
        for (int index : indices) {
            sb.append(' ').append(index);
        }
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Arrays.equals(((IndexOp) o).indices, indices);
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + Arrays.hashCode(indices);
    }
}
