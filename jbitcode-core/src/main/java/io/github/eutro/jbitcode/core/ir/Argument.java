package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ext.Ext;
import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A formal parameter of a {@link Function}.
 */
public final class Argument extends Value {
    private final int argNo;

    Argument(Type type, Function owner, int argNo) {
        super(type);
        this.owner = owner;
        this.argNo = argNo;
    }

    public int getArgNo() {
        return argNo;
    }

    public Function getParent() {
        return owner;
    }

    // exts
    private final Function owner;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }
}
