package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ext.Ext;
import io.github.eutro.jbitcode.core.ext.ExtContainer;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.Visibility;
import org.jetbrains.annotations.Nullable;

/**
 * A module-level named object: a {@link GlobalVariable}, {@link Function} or {@link GlobalAlias}.
 * <p>
 * The value of a global is its address, so its type is always a pointer.
 * Exts not found on a global are looked up on its {@link Module}.
 */
public abstract class GlobalValue extends Constant {
    private Linkage linkage;
    private Visibility visibility = Visibility.DEFAULT;
    @Nullable
    private String section;
    private long alignment;
    private boolean unnamedAddr;

    protected GlobalValue(PointerType type, Linkage linkage, @Nullable String name) {
        super(type);
        this.linkage = linkage;
        setName(name);
    }

    @Override
    public PointerType getType() {
        return (PointerType) super.getType();
    }

    /**
     * Get the type of the object this global points to.
     *
     * @return The pointee type.
     */
    public Type getValueType() {
        return getType().getElementType();
    }

    public abstract boolean isDeclaration();

    public Linkage getLinkage() {
        return linkage;
    }

    public void setLinkage(Linkage linkage) {
        this.linkage = linkage;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public void setVisibility(Visibility visibility) {
        this.visibility = visibility;
    }

    public @Nullable String getSection() {
        return section;
    }

    public void setSection(@Nullable String section) {
        this.section = section;
    }

    public long getAlignment() {
        return alignment;
    }

    public void setAlignment(long alignment) {
        this.alignment = alignment;
    }

    public boolean hasUnnamedAddr() {
        return unnamedAddr;
    }

    public void setUnnamedAddr(boolean unnamedAddr) {
        this.unnamedAddr = unnamedAddr;
    }

    public @Nullable Module getParent() {
        return owner;
    }

    // exts
    private Module owner = null;

    @Override
    protected @Nullable ExtContainer getDelegate() {
        return owner;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_MODULE) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_MODULE) {
            owner = (Module) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_MODULE) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
