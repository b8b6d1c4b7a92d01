package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

/**
 * A stand-in for an instruction or argument that has been referenced but not yet read.
 * It is replaced with every use rewritten once the real value is known.
 */
public final class ValuePlaceholder extends Value {
    public ValuePlaceholder(Type type) {
        super(type);
    }

    @Override
    public String toString() {
        return getType() + " <forward reference>";
    }
}
