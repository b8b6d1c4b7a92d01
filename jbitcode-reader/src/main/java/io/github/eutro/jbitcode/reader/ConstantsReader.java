package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.ConstantAggregate;
import io.github.eutro.jbitcode.core.ir.ConstantDataArray;
import io.github.eutro.jbitcode.core.ir.ConstantExpr;
import io.github.eutro.jbitcode.core.ir.ConstantFP;
import io.github.eutro.jbitcode.core.ir.ConstantInt;
import io.github.eutro.jbitcode.core.ir.Constants;
import io.github.eutro.jbitcode.core.ir.Context;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.InlineAsm;
import io.github.eutro.jbitcode.core.ir.UndefValue;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.ArrayType;
import io.github.eutro.jbitcode.core.ir.types.IntegerType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.SequentialType;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ir.types.VectorType;
import io.github.eutro.jbitcode.core.ops.FlagsOp;
import io.github.eutro.jbitcode.core.ops.Opcode;
import io.github.eutro.jbitcode.core.ops.Predicate;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads constants blocks, at module level or in a function body.
 * <p>
 * Constants are numbered consecutively from the end of the value table, and may refer
 * to any constant of the same block, before or after them. Forward references are
 * placeholders until the block ends.
 */
final class ConstantsReader {
    private static final Logger LOG = LoggerFactory.getLogger(ConstantsReader.class);

    private final Context context;
    private final TypeTable types;
    private final ValueTable values;
    private final BlockAddresses blockAddresses;

    ConstantsReader(Context context, TypeTable types, ValueTable values, BlockAddresses blockAddresses) {
        this.context = context;
        this.types = types;
        this.values = values;
        this.blockAddresses = blockAddresses;
    }

    void parseBlock(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.CONSTANTS_BLOCK_ID);

        Record record = new Record();
        Type curTy = Type.i32();
        int nextCstNo = values.size();
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) {
                if (nextCstNo != values.size()) {
                    Value unresolved = values.get(nextCstNo);
                    throw unresolved == null
                            ? new BitcodeException(ErrorKind.UNRESOLVED_FORWARD_REFERENCE, "constant " + nextCstNo)
                            : values.placeholderError(ErrorKind.UNRESOLVED_FORWARD_REFERENCE, unresolved,
                            "constant " + nextCstNo + " referenced but never defined");
                }
                values.resolveConstantForwardRefs();
                return;
            }

            record.clear();
            int code = cursor.readRecord(entry.id, record);
            if (code == BitcodeCodes.CST_CODE_SETTYPE) { // [typeid]
                TypeTable.requireSize(record, 1);
                Type type = types.get(record.get(0));
                if (type == null) throw new BitcodeException(ErrorKind.INVALID_RECORD, "constant type " + record.get(0));
                curTy = type;
                continue;
            }

            Constant value;
            try {
                value = readConstant(code, record, curTy);
            } catch (IllegalArgumentException e) {
                throw new BitcodeException(ErrorKind.INVALID_RECORD, "constant record " + code + " of type " + curTy, e);
            }
            values.assign(value, nextCstNo++);
        }
    }

    private Constant readConstant(int code, Record record, Type curTy) throws BitcodeException {
        switch (code) {
            case BitcodeCodes.CST_CODE_UNDEF:
                return UndefValue.get(context, curTy);
            case BitcodeCodes.CST_CODE_NULL:
                return Constants.getNullValue(context, curTy);
            case BitcodeCodes.CST_CODE_INTEGER: { // [intval]
                if (!curTy.isInteger() || record.isEmpty()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "integer constant of type " + curTy);
                }
                long val = Decoders.signRotated(record.get(0));
                return ConstantInt.get(context, (IntegerType) curTy, new BigInteger(Long.toUnsignedString(val)));
            }
            case BitcodeCodes.CST_CODE_WIDE_INTEGER: { // [n x intval]
                if (!curTy.isInteger() || record.isEmpty()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "wide integer constant of type " + curTy);
                }
                BigInteger val = BigInteger.ZERO;
                for (int i = record.size() - 1; i >= 0; i--) {
                    long word = Decoders.signRotated(record.get(i));
                    val = val.shiftLeft(64).or(new BigInteger(Long.toUnsignedString(word)));
                }
                return ConstantInt.get(context, (IntegerType) curTy, val);
            }
            case BitcodeCodes.CST_CODE_FLOAT: // [fpval]
                if (record.isEmpty()) throw new BitcodeException(ErrorKind.INVALID_RECORD, "empty float constant");
                return readFloat(record, curTy);
            case BitcodeCodes.CST_CODE_AGGREGATE: { // [n x value number]
                if (record.isEmpty()) throw new BitcodeException(ErrorKind.INVALID_RECORD, "empty aggregate constant");
                List<Constant> elements = new ArrayList<>(record.size());
                if (curTy.isStruct()) {
                    StructType st = (StructType) curTy;
                    if (st.getNumElements() != record.size()) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, record.size() + " elements for " + curTy);
                    }
                    for (int i = 0; i < record.size(); i++) {
                        elements.add(values.getConstantForwardRef(record.get(i), st.getElement(i)));
                    }
                } else if (curTy.getKind() == Type.Kind.ARRAY || curTy.isVector()) {
                    Type elementType = ((SequentialType) curTy).getElementType();
                    for (int i = 0; i < record.size(); i++) {
                        elements.add(values.getConstantForwardRef(record.get(i), elementType));
                    }
                } else {
                    return UndefValue.get(context, curTy);
                }
                return ConstantAggregate.get(context, curTy, elements);
            }
            case BitcodeCodes.CST_CODE_STRING: // [values]
            case BitcodeCodes.CST_CODE_CSTRING: { // [values], without the terminator
                if (record.isEmpty() || curTy.getKind() != Type.Kind.ARRAY) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "string constant of type " + curTy);
                }
                long[] elements = record.toArray();
                if (code == BitcodeCodes.CST_CODE_CSTRING) {
                    long[] terminated = new long[elements.length + 1];
                    System.arraycopy(elements, 0, terminated, 0, elements.length);
                    elements = terminated;
                }
                return ConstantDataArray.get(context, (ArrayType) curTy, elements);
            }
            case BitcodeCodes.CST_CODE_CE_BINOP: { // [opcode, opval, opval, flags?]
                TypeTable.requireSize(record, 3);
                Opcode opcode = Decoders.binaryOpcode(record.get(0), curTy);
                if (opcode == null) return UndefValue.get(context, curTy);
                Constant lhs = values.getConstantForwardRef(record.get(1), curTy);
                Constant rhs = values.getConstantForwardRef(record.get(2), curTy);
                int flags = record.size() >= 4 ? Decoders.binaryFlags(opcode, record.get(3)) : 0;
                return ConstantExpr.getBinary(context, FlagsOp.of(opcode, flags), lhs, rhs);
            }
            case BitcodeCodes.CST_CODE_CE_CAST: { // [opcode, opty, opval]
                TypeTable.requireSize(record, 3);
                Opcode opcode = Decoders.castOpcode(record.get(0));
                if (opcode == null) return UndefValue.get(context, curTy);
                Type opTy = requireType(record.get(1));
                return ConstantExpr.getCast(context, opcode, values.getConstantForwardRef(record.get(2), opTy), curTy);
            }
            case BitcodeCodes.CST_CODE_CE_GEP:
            case BitcodeCodes.CST_CODE_CE_INBOUNDS_GEP: { // [n x (type, value)]
                if (record.isEmpty() || record.size() % 2 == 1) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "getelementptr constant of size " + record.size());
                }
                List<Constant> operands = new ArrayList<>(record.size() / 2);
                for (int i = 0; i < record.size(); i += 2) {
                    operands.add(values.getConstantForwardRef(record.get(i + 1), requireType(record.get(i))));
                }
                return ConstantExpr.getGetElementPtr(context, code == BitcodeCodes.CST_CODE_CE_INBOUNDS_GEP,
                        operands.get(0), operands.subList(1, operands.size()));
            }
            case BitcodeCodes.CST_CODE_CE_SELECT: // [opval, opval, opval]
                TypeTable.requireSize(record, 3);
                return ConstantExpr.getSelect(context,
                        values.getConstantForwardRef(record.get(0), Type.i1()),
                        values.getConstantForwardRef(record.get(1), curTy),
                        values.getConstantForwardRef(record.get(2), curTy));
            case BitcodeCodes.CST_CODE_CE_EXTRACTELT: { // [opty, opval, opval]
                TypeTable.requireSize(record, 3);
                Type opTy = types.get(record.get(0));
                if (!(opTy instanceof VectorType)) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "extractelement from " + opTy);
                }
                return ConstantExpr.getExtractElement(context,
                        values.getConstantForwardRef(record.get(1), opTy),
                        values.getConstantForwardRef(record.get(2), Type.i32()));
            }
            case BitcodeCodes.CST_CODE_CE_INSERTELT: { // [opval, opval, opval]
                TypeTable.requireSize(record, 3);
                if (!curTy.isVector()) throw new BitcodeException(ErrorKind.INVALID_RECORD, "insertelement into " + curTy);
                return ConstantExpr.getInsertElement(context,
                        values.getConstantForwardRef(record.get(0), curTy),
                        values.getConstantForwardRef(record.get(1), ((VectorType) curTy).getElementType()),
                        values.getConstantForwardRef(record.get(2), Type.i32()));
            }
            case BitcodeCodes.CST_CODE_CE_SHUFFLEVEC: { // [opval, opval, opval]
                TypeTable.requireSize(record, 3);
                if (!curTy.isVector()) throw new BitcodeException(ErrorKind.INVALID_RECORD, "shufflevector of " + curTy);
                return shuffle(record, 0, curTy, (VectorType) curTy);
            }
            case BitcodeCodes.CST_CODE_CE_SHUFVEC_EX: { // [opty, opval, opval, opval]
                TypeTable.requireSize(record, 4);
                Type opTy = types.get(record.get(0));
                if (!curTy.isVector() || !(opTy instanceof VectorType)) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "shufflevector of " + opTy + " to " + curTy);
                }
                return shuffle(record, 1, opTy, (VectorType) curTy);
            }
            case BitcodeCodes.CST_CODE_CE_CMP: { // [opty, opval, opval, pred]
                TypeTable.requireSize(record, 4);
                Type opTy = requireType(record.get(0));
                Constant lhs = values.getConstantForwardRef(record.get(1), opTy);
                Constant rhs = values.getConstantForwardRef(record.get(2), opTy);
                Predicate predicate = Predicate.fromCode(record.get(3));
                if (predicate == null || predicate.isFloatingPoint() != opTy.isFPOrFPVector()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "predicate " + record.get(3) + " for " + opTy);
                }
                return ConstantExpr.getCompare(context, predicate, lhs, rhs);
            }
            case BitcodeCodes.CST_CODE_INLINEASM: { // [flags, asmlen, asmchar x N, constraintlen, constraintchar x N]
                TypeTable.requireSize(record, 2);
                boolean sideEffects = (record.get(0) & 1) != 0;
                boolean alignStack = (record.get(0) >> 1) != 0;
                long asmSize = record.get(1);
                if (asmSize < 0 || 2 + asmSize >= record.size()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "inline asm string of length " + asmSize);
                }
                long constraintSize = record.get(2 + (int) asmSize);
                if (constraintSize < 0 || 3 + asmSize + constraintSize > record.size()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "inline asm constraints of length " + constraintSize);
                }
                if (!(curTy instanceof PointerType) || !((PointerType) curTy).getElementType().isFunction()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "inline asm of type " + curTy);
                }
                String asm = record.getString(2, (int) asmSize);
                String constraints = record.getString(3 + (int) asmSize, (int) constraintSize);
                return InlineAsm.get(context, (PointerType) curTy, asm, constraints, sideEffects, alignStack);
            }
            case BitcodeCodes.CST_CODE_BLOCKADDRESS: { // [fnty, fnval, bb#]
                TypeTable.requireSize(record, 3);
                Type fnTy = requireType(record.get(0));
                Constant fn = values.getConstantForwardRef(record.get(1), fnTy);
                if (!(fn instanceof Function)) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "block address in " + fn);
                }
                return blockAddresses.get((Function) fn, record.get(2));
            }
            default:
                LOG.warn("Reading unknown constant code {} as undef", code);
                return UndefValue.get(context, curTy);
        }
    }

    private Constant shuffle(Record record, int from, Type opTy, VectorType resultTy) throws BitcodeException {
        Constant v1 = values.getConstantForwardRef(record.get(from), opTy);
        Constant v2 = values.getConstantForwardRef(record.get(from + 1), opTy);
        Type maskTy = VectorType.get(Type.i32(), (int) resultTy.getNumElements());
        Constant mask = values.getConstantForwardRef(record.get(from + 2), maskTy);
        return ConstantExpr.getShuffleVector(context, v1, v2, mask);
    }

    private Constant readFloat(Record record, Type curTy) throws BitcodeException {
        BigInteger bits;
        switch (curTy.getKind()) {
            case HALF:
                bits = BigInteger.valueOf(record.get(0) & 0xFFFFL);
                break;
            case FLOAT:
                bits = BigInteger.valueOf(record.get(0) & 0xFFFFFFFFL);
                break;
            case DOUBLE:
                bits = new BigInteger(Long.toUnsignedString(record.get(0)));
                break;
            case X86_FP80: {
                // the sign and exponent are in the top 16 bits of the first word
                TypeTable.requireSize(record, 2);
                long low = (record.get(1) & 0xFFFFL) | (record.get(0) << 16);
                long high = record.get(0) >>> 48;
                bits = BigInteger.valueOf(high).shiftLeft(64).or(new BigInteger(Long.toUnsignedString(low)));
                break;
            }
            case FP128:
            case PPC_FP128:
                TypeTable.requireSize(record, 2);
                bits = new BigInteger(Long.toUnsignedString(record.get(1))).shiftLeft(64)
                        .or(new BigInteger(Long.toUnsignedString(record.get(0))));
                break;
            default:
                return UndefValue.get(context, curTy);
        }
        return ConstantFP.get(context, curTy, bits);
    }

    private Type requireType(long id) throws BitcodeException {
        Type type = types.get(id);
        if (type == null) throw new BitcodeException(ErrorKind.INVALID_RECORD, "type " + id);
        return type;
    }
}
