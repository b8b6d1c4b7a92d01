package io.github.eutro.jbitcode.core.attr;

/**
 * A single flag attribute, identified by its bit in the packed attribute word.
 * <p>
 * Alignment and stack alignment are not flags; they occupy the bit fields
 * {@link Attributes#ALIGNMENT_MASK} and {@link Attributes#STACK_ALIGNMENT_MASK}.
 */
public enum Attribute {
    ZEXT(0, "zeroext"),
    SEXT(1, "signext"),
    NO_RETURN(2, "noreturn"),
    IN_REG(3, "inreg"),
    STRUCT_RET(4, "sret"),
    NO_UNWIND(5, "nounwind"),
    NO_ALIAS(6, "noalias"),
    BY_VAL(7, "byval"),
    NEST(8, "nest"),
    READ_NONE(9, "readnone"),
    READ_ONLY(10, "readonly"),
    NO_INLINE(11, "noinline"),
    ALWAYS_INLINE(12, "alwaysinline"),
    OPTIMIZE_FOR_SIZE(13, "optsize"),
    STACK_PROTECT(14, "ssp"),
    STACK_PROTECT_REQ(15, "sspreq"),
    NO_CAPTURE(21, "nocapture"),
    NO_RED_ZONE(22, "noredzone"),
    NO_IMPLICIT_FLOAT(23, "noimplicitfloat"),
    NAKED(24, "naked"),
    INLINE_HINT(25, "inlinehint"),
    RETURNS_TWICE(29, "returns_twice"),
    UW_TABLE(30, "uwtable"),
    NON_LAZY_BIND(31, "nonlazybind"),
    ;

    public final long mask;
    public final String mnemonic;

    Attribute(int bit, String mnemonic) {
        this.mask = 1L << bit;
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
