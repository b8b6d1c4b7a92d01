package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

/**
 * A metadata string.
 */
public final class MDString extends Value {
    private final String string;

    public MDString(String string) {
        super(Type.METADATA);
        this.string = string;
    }

    public String getString() {
        return string;
    }

    @Override
    public String toString() {
        return "!\"" + string + "\"";
    }
}
