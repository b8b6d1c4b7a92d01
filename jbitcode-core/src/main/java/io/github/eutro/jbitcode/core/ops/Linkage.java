package io.github.eutro.jbitcode.core.ops;

public enum Linkage {
    EXTERNAL("external"),
    AVAILABLE_EXTERNALLY("available_externally"),
    LINK_ONCE_ANY("linkonce"),
    LINK_ONCE_ODR("linkonce_odr"),
    WEAK_ANY("weak"),
    WEAK_ODR("weak_odr"),
    APPENDING("appending"),
    INTERNAL("internal"),
    PRIVATE("private"),
    EXTERNAL_WEAK("extern_weak"),
    COMMON("common"),
    ;

    public final String mnemonic;

    Linkage(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public boolean isLocal() {
        return this == INTERNAL || this == PRIVATE;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
