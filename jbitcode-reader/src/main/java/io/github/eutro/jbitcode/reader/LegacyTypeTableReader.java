package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.types.ArrayType;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the type table and type symbol table of the old encoding.
 * <p>
 * Old type tables have no useful order: a type may refer to any other, and
 * struct bodies may refer to types defined later. The block is read in passes
 * from a saved position, each pass defining what it can, until every type is known.
 * A pass that defines nothing means some reference can never be satisfied.
 */
final class LegacyTypeTableReader {
    private static final Logger LOG = LoggerFactory.getLogger(LegacyTypeTableReader.class);

    private final TypeTable types;
    private int passes;

    LegacyTypeTableReader(TypeTable types) {
        this.types = types;
    }

    /**
     * Get the number of passes the last {@link #parseTypeTable(BitstreamCursor)} took.
     *
     * @return The number of passes.
     */
    int getPasses() {
        return passes;
    }

    void parseTypeTable(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.TYPE_BLOCK_ID_OLD);
        if (!types.isEmpty()) throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "type table is not empty");

        BitstreamCursor.Mark start = cursor.mark();
        Record record = new Record();
        int numTypesRead = 0;
        passes = 1;

        int nextTypeId = 0;
        boolean readAnyTypes = false;
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) {
                if (nextTypeId != types.size()) {
                    throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE,
                            nextTypeId + " type records for a table of " + types.size());
                }
                if (numTypesRead == types.size()) return;
                if (!readAnyTypes) {
                    throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE,
                            "no progress after " + passes + " pass(es), "
                                    + (types.size() - numTypesRead) + " type(s) unresolvable");
                }
                LOG.debug("Restarting old type table, {} of {} types read after pass {}",
                        numTypesRead, types.size(), passes);
                cursor.reset(start);
                passes++;
                nextTypeId = 0;
                readAnyTypes = false;
                continue;
            }

            record.clear();
            Type result = null;
            int code = cursor.readRecord(entry.id, record);
            switch (code) {
                case BitcodeCodes.TYPE_CODE_NUMENTRY: // [numentries]
                    requireSize(record, 1);
                    types.resize(record.get(0));
                    continue;
                case BitcodeCodes.TYPE_CODE_VOID:
                    result = Type.VOID;
                    break;
                case BitcodeCodes.TYPE_CODE_FLOAT:
                    result = Type.FLOAT;
                    break;
                case BitcodeCodes.TYPE_CODE_DOUBLE:
                    result = Type.DOUBLE;
                    break;
                case BitcodeCodes.TYPE_CODE_X86_FP80:
                    result = Type.X86_FP80;
                    break;
                case BitcodeCodes.TYPE_CODE_FP128:
                    result = Type.FP128;
                    break;
                case BitcodeCodes.TYPE_CODE_PPC_FP128:
                    result = Type.PPC_FP128;
                    break;
                case BitcodeCodes.TYPE_CODE_LABEL:
                    result = Type.LABEL;
                    break;
                case BitcodeCodes.TYPE_CODE_METADATA:
                    result = Type.METADATA;
                    break;
                case BitcodeCodes.TYPE_CODE_X86_MMX:
                    result = Type.X86_MMX;
                    break;
                case BitcodeCodes.TYPE_CODE_INTEGER: // [width]
                    requireSize(record, 1);
                    result = TypeTable.integerType(record.get(0));
                    break;
                case BitcodeCodes.TYPE_CODE_OPAQUE:
                    if (nextTypeId < types.size() && types.getSlot(nextTypeId) == null) {
                        result = types.createStruct(null);
                    }
                    break;
                case BitcodeCodes.TYPE_CODE_STRUCT_OLD: // [ispacked, eltty x N]
                    result = readStruct(record, nextTypeId);
                    break;
                case BitcodeCodes.TYPE_CODE_POINTER: { // [pointee type, address space?]
                    requireSize(record, 1);
                    int addrSpace = record.size() == 2 ? TypeTable.addressSpace(record.get(1)) : 0;
                    Type pointee = types.getOrNull(record.get(0));
                    if (pointee != null) result = PointerType.get(pointee, addrSpace);
                    break;
                }
                case BitcodeCodes.TYPE_CODE_FUNCTION_OLD: // [vararg, attrid, retty, paramty x N]
                    requireSize(record, 3);
                    result = readFunction(record, 2);
                    break;
                case BitcodeCodes.TYPE_CODE_FUNCTION: // [vararg, retty, paramty x N]
                    requireSize(record, 2);
                    result = readFunction(record, 1);
                    break;
                case BitcodeCodes.TYPE_CODE_ARRAY: { // [numelts, eltty]
                    requireSize(record, 2);
                    Type element = types.getOrNull(record.get(1));
                    if (element != null) result = ArrayType.get(element, record.get(0));
                    break;
                }
                case BitcodeCodes.TYPE_CODE_VECTOR: { // [numelts, eltty]
                    requireSize(record, 2);
                    Type element = types.getOrNull(record.get(1));
                    if (element != null) result = TypeTable.vectorType(element, record.get(0));
                    break;
                }
                default:
                    throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "unknown type code " + code);
            }

            if (nextTypeId >= types.size()) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "more types than the declared " + types.size());
            }
            if (result != null && types.getSlot(nextTypeId) == null) {
                numTypesRead++;
                readAnyTypes = true;
                types.setSlot(nextTypeId, result);
            }
            nextTypeId++;
        }
    }

    private @Nullable Type readStruct(Record record, int idx) throws BitcodeException {
        if (idx >= types.size()) return null;
        Type existing = types.getSlot(idx);
        if (existing != null) {
            if (!(existing instanceof StructType)) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "type " + idx + " is not a struct");
            }
            if (!((StructType) existing).isOpaque()) return null; // already read in an earlier pass
        }

        StructType st;
        if (existing == null) {
            st = types.createStruct(null);
            types.setSlot(idx, st);
        } else {
            st = (StructType) existing;
        }

        List<Type> elements = new ArrayList<>();
        for (int i = 1; i < record.size(); i++) {
            Type element = types.getOrNull(record.get(i));
            if (element == null) return null; // not ready, try again next pass
            elements.add(element);
        }
        st.setBody(elements, record.getBool(0));
        types.setSlot(idx, null);
        return st;
    }

    private @Nullable Type readFunction(Record record, int retIdx) throws BitcodeException {
        List<Type> params = new ArrayList<>();
        for (int i = retIdx + 1; i < record.size(); i++) {
            Type param = types.getOrNull(record.get(i));
            if (param == null) return null;
            params.add(param);
        }
        Type ret = types.getOrNull(record.get(retIdx));
        if (ret == null) return null;
        return FunctionType.get(ret, params, record.getBool(0));
    }

    /**
     * Parse an old type symbol table, which names struct types.
     *
     * @param cursor The cursor, just after the block id.
     * @throws BitcodeException If the block is malformed.
     */
    void parseTypeSymbolTable(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.TYPE_SYMTAB_BLOCK_ID_OLD);
        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) return;

            record.clear();
            if (cursor.readRecord(entry.id, record) != BitcodeCodes.TST_CODE_ENTRY) continue;
            requireSize(record, 1); // [typeid, namechar x N]
            long typeId = record.get(0);
            if (typeId < 0 || typeId >= types.size()) {
                throw new BitcodeException(ErrorKind.INVALID_RECORD, "type symbol for type " + typeId);
            }
            Type type = types.getSlot((int) typeId);
            if (type instanceof StructType) {
                StructType st = (StructType) type;
                if (!st.isLiteral() && st.getName() == null) st.setName(record.getString(1));
            }
        }
    }

    private static void requireSize(Record record, int min) throws BitcodeException {
        if (record.size() < min) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "expected at least " + min + " fields, got " + record.size());
        }
    }
}
