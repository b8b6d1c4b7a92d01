package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.AtomicOrdering;
import io.github.eutro.jbitcode.core.ops.FlagsOp;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.Opcode;
import io.github.eutro.jbitcode.core.ops.RmwOperation;
import io.github.eutro.jbitcode.core.ops.SyncScope;
import io.github.eutro.jbitcode.core.ops.ThreadLocalMode;
import io.github.eutro.jbitcode.core.ops.Visibility;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.eutro.jbitcode.reader.BitcodeCodes.*;

/**
 * Mappings from encoded enumeration values to their IR counterparts.
 * <p>
 * Unknown linkages, visibilities, thread local modes, orderings and scopes map to a default,
 * as newer writers may add values. Unknown opcodes are reported as null, so the caller can decide.
 */
final class Decoders {
    private static final Logger LOG = LoggerFactory.getLogger(Decoders.class);

    private Decoders() {
    }

    static Linkage linkage(long val) {
        switch ((int) val) {
            case 0:
            case 5: // dllimport
            case 6: // dllexport
                return Linkage.EXTERNAL;
            case 1:
                return Linkage.WEAK_ANY;
            case 2:
                return Linkage.APPENDING;
            case 3:
                return Linkage.INTERNAL;
            case 4:
                return Linkage.LINK_ONCE_ANY;
            case 7:
            case 14: // linker_private_weak
                return Linkage.EXTERNAL_WEAK;
            case 8:
                return Linkage.COMMON;
            case 9:
            case 13: // linker_private
                return Linkage.PRIVATE;
            case 10:
                return Linkage.WEAK_ODR;
            case 11:
            case 15: // linkonce_odr_auto_hide
                return Linkage.LINK_ONCE_ODR;
            case 12:
                return Linkage.AVAILABLE_EXTERNALLY;
            default:
                LOG.warn("Unknown linkage {}, using external", val);
                return Linkage.EXTERNAL;
        }
    }

    static Visibility visibility(long val) {
        switch ((int) val) {
            case 1:
                return Visibility.HIDDEN;
            case 2:
                return Visibility.PROTECTED;
            default:
                return Visibility.DEFAULT;
        }
    }

    static ThreadLocalMode threadLocalMode(long val) {
        switch ((int) val) {
            case 0:
                return ThreadLocalMode.NOT_THREAD_LOCAL;
            case 2:
                return ThreadLocalMode.LOCAL_DYNAMIC;
            case 3:
                return ThreadLocalMode.INITIAL_EXEC;
            case 4:
                return ThreadLocalMode.LOCAL_EXEC;
            default:
                return ThreadLocalMode.GENERAL_DYNAMIC;
        }
    }

    static @Nullable Opcode castOpcode(long val) {
        switch ((int) val) {
            case CAST_TRUNC:
                return Opcode.TRUNC;
            case CAST_ZEXT:
                return Opcode.ZEXT;
            case CAST_SEXT:
                return Opcode.SEXT;
            case CAST_FPTOUI:
                return Opcode.FPTOUI;
            case CAST_FPTOSI:
                return Opcode.FPTOSI;
            case CAST_UITOFP:
                return Opcode.UITOFP;
            case CAST_SITOFP:
                return Opcode.SITOFP;
            case CAST_FPTRUNC:
                return Opcode.FPTRUNC;
            case CAST_FPEXT:
                return Opcode.FPEXT;
            case CAST_PTRTOINT:
                return Opcode.PTRTOINT;
            case CAST_INTTOPTR:
                return Opcode.INTTOPTR;
            case CAST_BITCAST:
                return Opcode.BITCAST;
            default:
                return null;
        }
    }

    /**
     * Decode a binary opcode, which depends on whether the operands are floating point.
     *
     * @param val  The encoded opcode.
     * @param type The type of the operands.
     * @return The opcode, or null if it is unknown.
     */
    static @Nullable Opcode binaryOpcode(long val, Type type) {
        boolean fp = type.isFPOrFPVector();
        switch ((int) val) {
            case BINOP_ADD:
                return fp ? Opcode.FADD : Opcode.ADD;
            case BINOP_SUB:
                return fp ? Opcode.FSUB : Opcode.SUB;
            case BINOP_MUL:
                return fp ? Opcode.FMUL : Opcode.MUL;
            case BINOP_UDIV:
                return Opcode.UDIV;
            case BINOP_SDIV:
                return fp ? Opcode.FDIV : Opcode.SDIV;
            case BINOP_UREM:
                return Opcode.UREM;
            case BINOP_SREM:
                return fp ? Opcode.FREM : Opcode.SREM;
            case BINOP_SHL:
                return Opcode.SHL;
            case BINOP_LSHR:
                return Opcode.LSHR;
            case BINOP_ASHR:
                return Opcode.ASHR;
            case BINOP_AND:
                return Opcode.AND;
            case BINOP_OR:
                return Opcode.OR;
            case BINOP_XOR:
                return Opcode.XOR;
            default:
                return null;
        }
    }

    /**
     * Decode the optional flags field of a binary operator.
     *
     * @param opcode The decoded opcode.
     * @param val    The encoded flags.
     * @return The {@link FlagsOp} flags.
     */
    static int binaryFlags(Opcode opcode, long val) {
        int flags = 0;
        switch (opcode) {
            case ADD:
            case SUB:
            case MUL:
            case SHL:
                if ((val & (1L << OBO_NO_SIGNED_WRAP)) != 0) flags |= FlagsOp.NO_SIGNED_WRAP;
                if ((val & (1L << OBO_NO_UNSIGNED_WRAP)) != 0) flags |= FlagsOp.NO_UNSIGNED_WRAP;
                break;
            case SDIV:
            case UDIV:
            case LSHR:
            case ASHR:
                if ((val & (1L << PEO_EXACT)) != 0) flags |= FlagsOp.EXACT;
                break;
            default:
                break;
        }
        return flags;
    }

    static @Nullable RmwOperation rmwOperation(long val) {
        RmwOperation[] values = RmwOperation.values();
        return val >= 0 && val < values.length ? values[(int) val] : null;
    }

    static AtomicOrdering ordering(long val) {
        AtomicOrdering[] values = AtomicOrdering.values();
        return val >= 0 && val < values.length ? values[(int) val] : AtomicOrdering.SEQ_CST;
    }

    static SyncScope syncScope(long val) {
        return val == 0 ? SyncScope.SINGLE_THREAD : SyncScope.CROSS_THREAD;
    }

    /**
     * Decode a log2 alignment plus one, as used by globals, functions and memory operations.
     *
     * @param val The encoded alignment.
     * @return The alignment in bytes, or 0.
     */
    static long alignment(long val) {
        if (val <= 0 || val > 63) return 0;
        return (1L << val) >> 1;
    }

    /**
     * Decode a signed value stored with its sign in the lowest bit.
     *
     * @param val The encoded value.
     * @return The value. An encoded "negative zero" is the minimum long.
     */
    static long signRotated(long val) {
        if ((val & 1) == 0) return val >>> 1;
        if (val != 1) return -(val >>> 1);
        return Long.MIN_VALUE;
    }
}
