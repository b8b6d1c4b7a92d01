package io.github.eutro.jbitcode.reader;

/**
 * Block ids and record codes of the module container format.
 */
public final class BitcodeCodes {
    private BitcodeCodes() {
    }

    // block ids
    public static final int MODULE_BLOCK_ID = 8;
    public static final int PARAMATTR_BLOCK_ID = 9;
    public static final int TYPE_BLOCK_ID_OLD = 10;
    public static final int CONSTANTS_BLOCK_ID = 11;
    public static final int FUNCTION_BLOCK_ID = 12;
    public static final int TYPE_SYMTAB_BLOCK_ID_OLD = 13;
    public static final int VALUE_SYMTAB_BLOCK_ID = 14;
    public static final int METADATA_BLOCK_ID = 15;
    public static final int METADATA_ATTACHMENT_ID = 16;
    public static final int TYPE_BLOCK_ID_NEW = 17;

    // MODULE_BLOCK
    public static final int MODULE_CODE_VERSION = 1;
    public static final int MODULE_CODE_TRIPLE = 2;
    public static final int MODULE_CODE_DATALAYOUT = 3;
    public static final int MODULE_CODE_ASM = 4;
    public static final int MODULE_CODE_SECTIONNAME = 5;
    public static final int MODULE_CODE_DEPLIB = 6;
    public static final int MODULE_CODE_GLOBALVAR = 7;
    public static final int MODULE_CODE_FUNCTION = 8;
    public static final int MODULE_CODE_ALIAS = 9;
    public static final int MODULE_CODE_PURGEVALS = 10;
    public static final int MODULE_CODE_GCNAME = 11;

    // PARAMATTR_BLOCK
    public static final int PARAMATTR_CODE_ENTRY_OLD = 1;
    public static final int PARAMATTR_CODE_ENTRY = 2;

    // TYPE_BLOCK_ID_NEW and TYPE_BLOCK_ID_OLD
    public static final int TYPE_CODE_NUMENTRY = 1;
    public static final int TYPE_CODE_VOID = 2;
    public static final int TYPE_CODE_FLOAT = 3;
    public static final int TYPE_CODE_DOUBLE = 4;
    public static final int TYPE_CODE_LABEL = 5;
    public static final int TYPE_CODE_OPAQUE = 6;
    public static final int TYPE_CODE_INTEGER = 7;
    public static final int TYPE_CODE_POINTER = 8;
    public static final int TYPE_CODE_FUNCTION_OLD = 9;
    public static final int TYPE_CODE_HALF = 10;
    public static final int TYPE_CODE_STRUCT_OLD = 10; // only in TYPE_BLOCK_ID_OLD
    public static final int TYPE_CODE_ARRAY = 11;
    public static final int TYPE_CODE_VECTOR = 12;
    public static final int TYPE_CODE_X86_FP80 = 13;
    public static final int TYPE_CODE_FP128 = 14;
    public static final int TYPE_CODE_PPC_FP128 = 15;
    public static final int TYPE_CODE_METADATA = 16;
    public static final int TYPE_CODE_X86_MMX = 17;
    public static final int TYPE_CODE_STRUCT_ANON = 18;
    public static final int TYPE_CODE_STRUCT_NAME = 19;
    public static final int TYPE_CODE_STRUCT_NAMED = 20;
    public static final int TYPE_CODE_FUNCTION = 21;

    // TYPE_SYMTAB_BLOCK_ID_OLD
    public static final int TST_CODE_ENTRY = 1;

    // VALUE_SYMTAB_BLOCK
    public static final int VST_CODE_ENTRY = 1;
    public static final int VST_CODE_BBENTRY = 2;

    // METADATA_BLOCK and METADATA_ATTACHMENT
    public static final int METADATA_STRING = 1;
    public static final int METADATA_NAME = 4;
    public static final int METADATA_KIND = 6;
    public static final int METADATA_NODE = 8;
    public static final int METADATA_FN_NODE = 9;
    public static final int METADATA_NAMED_NODE = 10;
    public static final int METADATA_ATTACHMENT = 11;

    // CONSTANTS_BLOCK
    public static final int CST_CODE_SETTYPE = 1;
    public static final int CST_CODE_NULL = 2;
    public static final int CST_CODE_UNDEF = 3;
    public static final int CST_CODE_INTEGER = 4;
    public static final int CST_CODE_WIDE_INTEGER = 5;
    public static final int CST_CODE_FLOAT = 6;
    public static final int CST_CODE_AGGREGATE = 7;
    public static final int CST_CODE_STRING = 8;
    public static final int CST_CODE_CSTRING = 9;
    public static final int CST_CODE_CE_BINOP = 10;
    public static final int CST_CODE_CE_CAST = 11;
    public static final int CST_CODE_CE_GEP = 12;
    public static final int CST_CODE_CE_SELECT = 13;
    public static final int CST_CODE_CE_EXTRACTELT = 14;
    public static final int CST_CODE_CE_INSERTELT = 15;
    public static final int CST_CODE_CE_SHUFFLEVEC = 16;
    public static final int CST_CODE_CE_CMP = 17;
    public static final int CST_CODE_INLINEASM = 18;
    public static final int CST_CODE_CE_SHUFVEC_EX = 19;
    public static final int CST_CODE_CE_INBOUNDS_GEP = 20;
    public static final int CST_CODE_BLOCKADDRESS = 21;

    // FUNCTION_BLOCK
    public static final int FUNC_CODE_DECLAREBLOCKS = 1;
    public static final int FUNC_CODE_INST_BINOP = 2;
    public static final int FUNC_CODE_INST_CAST = 3;
    public static final int FUNC_CODE_INST_GEP = 4;
    public static final int FUNC_CODE_INST_SELECT = 5;
    public static final int FUNC_CODE_INST_EXTRACTELT = 6;
    public static final int FUNC_CODE_INST_INSERTELT = 7;
    public static final int FUNC_CODE_INST_SHUFFLEVEC = 8;
    public static final int FUNC_CODE_INST_CMP = 9;
    public static final int FUNC_CODE_INST_RET = 10;
    public static final int FUNC_CODE_INST_BR = 11;
    public static final int FUNC_CODE_INST_SWITCH = 12;
    public static final int FUNC_CODE_INST_INVOKE = 13;
    public static final int FUNC_CODE_INST_UNWIND = 14;
    public static final int FUNC_CODE_INST_UNREACHABLE = 15;
    public static final int FUNC_CODE_INST_PHI = 16;
    public static final int FUNC_CODE_INST_ALLOCA = 19;
    public static final int FUNC_CODE_INST_LOAD = 20;
    public static final int FUNC_CODE_INST_VAARG = 23;
    public static final int FUNC_CODE_INST_STORE = 24;
    public static final int FUNC_CODE_INST_EXTRACTVAL = 26;
    public static final int FUNC_CODE_INST_INSERTVAL = 27;
    public static final int FUNC_CODE_INST_CMP2 = 28;
    public static final int FUNC_CODE_INST_VSELECT = 29;
    public static final int FUNC_CODE_INST_INBOUNDS_GEP = 30;
    public static final int FUNC_CODE_INST_INDIRECTBR = 31;
    public static final int FUNC_CODE_DEBUG_LOC_AGAIN = 33;
    public static final int FUNC_CODE_INST_CALL = 34;
    public static final int FUNC_CODE_DEBUG_LOC = 35;
    public static final int FUNC_CODE_INST_FENCE = 36;
    public static final int FUNC_CODE_INST_CMPXCHG = 37;
    public static final int FUNC_CODE_INST_ATOMICRMW = 38;
    public static final int FUNC_CODE_INST_RESUME = 39;
    public static final int FUNC_CODE_INST_LANDINGPAD = 40;
    public static final int FUNC_CODE_INST_LOADATOMIC = 41;
    public static final int FUNC_CODE_INST_STOREATOMIC = 42;

    // cast opcodes
    public static final int CAST_TRUNC = 0;
    public static final int CAST_ZEXT = 1;
    public static final int CAST_SEXT = 2;
    public static final int CAST_FPTOUI = 3;
    public static final int CAST_FPTOSI = 4;
    public static final int CAST_UITOFP = 5;
    public static final int CAST_SITOFP = 6;
    public static final int CAST_FPTRUNC = 7;
    public static final int CAST_FPEXT = 8;
    public static final int CAST_PTRTOINT = 9;
    public static final int CAST_INTTOPTR = 10;
    public static final int CAST_BITCAST = 11;

    // binary opcodes
    public static final int BINOP_ADD = 0;
    public static final int BINOP_SUB = 1;
    public static final int BINOP_MUL = 2;
    public static final int BINOP_UDIV = 3;
    public static final int BINOP_SDIV = 4;
    public static final int BINOP_UREM = 5;
    public static final int BINOP_SREM = 6;
    public static final int BINOP_SHL = 7;
    public static final int BINOP_LSHR = 8;
    public static final int BINOP_ASHR = 9;
    public static final int BINOP_AND = 10;
    public static final int BINOP_OR = 11;
    public static final int BINOP_XOR = 12;

    // flags on binary operators, as bit numbers
    public static final int OBO_NO_UNSIGNED_WRAP = 0;
    public static final int OBO_NO_SIGNED_WRAP = 1;
    public static final int PEO_EXACT = 0;

    public static final int LPAD_CATCH = 0;
    public static final int LPAD_FILTER = 1;
}
