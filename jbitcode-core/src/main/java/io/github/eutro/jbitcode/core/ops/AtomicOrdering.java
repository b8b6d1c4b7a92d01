package io.github.eutro.jbitcode.core.ops;

public enum AtomicOrdering {
    NOT_ATOMIC(""),
    UNORDERED("unordered"),
    MONOTONIC("monotonic"),
    ACQUIRE("acquire"),
    RELEASE("release"),
    ACQ_REL("acq_rel"),
    SEQ_CST("seq_cst"),
    ;

    public final String mnemonic;

    AtomicOrdering(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
