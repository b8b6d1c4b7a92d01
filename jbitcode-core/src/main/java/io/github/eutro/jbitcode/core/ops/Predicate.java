package io.github.eutro.jbitcode.core.ops;

import org.jetbrains.annotations.Nullable;

/**
 * Comparison predicates, numbered as they are encoded.
 */
public enum Predicate {
    FCMP_FALSE(0, "false"),
    FCMP_OEQ(1, "oeq"),
    FCMP_OGT(2, "ogt"),
    FCMP_OGE(3, "oge"),
    FCMP_OLT(4, "olt"),
    FCMP_OLE(5, "ole"),
    FCMP_ONE(6, "one"),
    FCMP_ORD(7, "ord"),
    FCMP_UNO(8, "uno"),
    FCMP_UEQ(9, "ueq"),
    FCMP_UGT(10, "ugt"),
    FCMP_UGE(11, "uge"),
    FCMP_ULT(12, "ult"),
    FCMP_ULE(13, "ule"),
    FCMP_UNE(14, "une"),
    FCMP_TRUE(15, "true"),
    ICMP_EQ(32, "eq"),
    ICMP_NE(33, "ne"),
    ICMP_UGT(34, "ugt"),
    ICMP_UGE(35, "uge"),
    ICMP_ULT(36, "ult"),
    ICMP_ULE(37, "ule"),
    ICMP_SGT(38, "sgt"),
    ICMP_SGE(39, "sge"),
    ICMP_SLT(40, "slt"),
    ICMP_SLE(41, "sle"),
    ;

    public final int code;
    public final String mnemonic;

    Predicate(int code, String mnemonic) {
        this.code = code;
        this.mnemonic = mnemonic;
    }

    public boolean isFloatingPoint() {
        return code < 32;
    }

    /**
     * Look up a predicate by its numeric code.
     *
     * @param code The code.
     * @return The predicate, or null if there is none with that code.
     */
    public static @Nullable Predicate fromCode(long code) {
        for (Predicate p : values()) {
            if (p.code == code) return p;
        }
        return null;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
