package io.github.eutro.jbitcode.core.ops;

/**
 * The instruction and constant expression opcode catalogue.
 */
public enum Opcode {
    // terminators
    RET("ret", Category.TERMINATOR),
    BR("br", Category.TERMINATOR),
    SWITCH("switch", Category.TERMINATOR),
    INDIRECTBR("indirectbr", Category.TERMINATOR),
    INVOKE("invoke", Category.TERMINATOR),
    RESUME("resume", Category.TERMINATOR),
    UNREACHABLE("unreachable", Category.TERMINATOR),

    // binary operators
    ADD("add", Category.BINARY),
    FADD("fadd", Category.BINARY),
    SUB("sub", Category.BINARY),
    FSUB("fsub", Category.BINARY),
    MUL("mul", Category.BINARY),
    FMUL("fmul", Category.BINARY),
    UDIV("udiv", Category.BINARY),
    SDIV("sdiv", Category.BINARY),
    FDIV("fdiv", Category.BINARY),
    UREM("urem", Category.BINARY),
    SREM("srem", Category.BINARY),
    FREM("frem", Category.BINARY),
    SHL("shl", Category.BINARY),
    LSHR("lshr", Category.BINARY),
    ASHR("ashr", Category.BINARY),
    AND("and", Category.BINARY),
    OR("or", Category.BINARY),
    XOR("xor", Category.BINARY),

    // memory
    ALLOCA("alloca", Category.MEMORY),
    LOAD("load", Category.MEMORY),
    STORE("store", Category.MEMORY),
    GETELEMENTPTR("getelementptr", Category.MEMORY),
    FENCE("fence", Category.MEMORY),
    CMPXCHG("cmpxchg", Category.MEMORY),
    ATOMICRMW("atomicrmw", Category.MEMORY),

    // casts
    TRUNC("trunc", Category.CAST),
    ZEXT("zext", Category.CAST),
    SEXT("sext", Category.CAST),
    FPTOUI("fptoui", Category.CAST),
    FPTOSI("fptosi", Category.CAST),
    UITOFP("uitofp", Category.CAST),
    SITOFP("sitofp", Category.CAST),
    FPTRUNC("fptrunc", Category.CAST),
    FPEXT("fpext", Category.CAST),
    PTRTOINT("ptrtoint", Category.CAST),
    INTTOPTR("inttoptr", Category.CAST),
    BITCAST("bitcast", Category.CAST),
    ADDRSPACECAST("addrspacecast", Category.CAST),

    // everything else
    ICMP("icmp", Category.OTHER),
    FCMP("fcmp", Category.OTHER),
    PHI("phi", Category.OTHER),
    CALL("call", Category.OTHER),
    SELECT("select", Category.OTHER),
    VAARG("va_arg", Category.OTHER),
    EXTRACTELEMENT("extractelement", Category.OTHER),
    INSERTELEMENT("insertelement", Category.OTHER),
    SHUFFLEVECTOR("shufflevector", Category.OTHER),
    EXTRACTVALUE("extractvalue", Category.OTHER),
    INSERTVALUE("insertvalue", Category.OTHER),
    LANDINGPAD("landingpad", Category.OTHER),
    ;

    /**
     * The broad class an opcode falls in.
     */
    public enum Category {
        TERMINATOR,
        BINARY,
        MEMORY,
        CAST,
        OTHER,
    }

    public final String mnemonic;
    public final Category category;

    Opcode(String mnemonic, Category category) {
        this.mnemonic = mnemonic;
        this.category = category;
    }

    public boolean isTerminator() {
        return category == Category.TERMINATOR;
    }

    public boolean isBinary() {
        return category == Category.BINARY;
    }

    public boolean isCast() {
        return category == Category.CAST;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
