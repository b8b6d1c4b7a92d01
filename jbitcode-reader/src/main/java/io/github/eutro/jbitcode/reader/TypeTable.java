package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.types.ArrayType;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.IntegerType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ir.types.VectorType;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The types of a module, indexed by type id.
 * <p>
 * The size of the table is declared up front. A reference to an id that has not been
 * defined yet can only be to a named struct, so it gets an opaque struct that the
 * defining record later fills in.
 */
final class TypeTable {
    static final int MAX_TYPES = 1 << 24;

    private final List<@Nullable Type> types = new ArrayList<>();
    private final List<StructType> identifiedStructs;
    private boolean sized;

    TypeTable(List<StructType> identifiedStructs) {
        this.identifiedStructs = identifiedStructs;
    }

    int size() {
        return types.size();
    }

    boolean isEmpty() {
        return types.isEmpty();
    }

    StructType createStruct(@Nullable String name) {
        StructType st = StructType.create(name == null || name.isEmpty() ? null : name);
        identifiedStructs.add(st);
        return st;
    }

    /**
     * Declare the number of types, leaving every slot empty.
     *
     * @param n The number of types.
     * @throws BitcodeException If the table was already sized, or the count is absurd.
     */
    void recordNumEntries(long n) throws BitcodeException {
        if (sized) throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "type table sized twice");
        if (n < 0 || n > MAX_TYPES) throw new BitcodeException(ErrorKind.INVALID_RECORD, "type table of size " + n);
        sized = true;
        types.addAll(Collections.nCopies((int) n, null));
    }

    /**
     * Get a type, creating an opaque struct if it has not been defined yet.
     *
     * @param id The type id.
     * @return The type, or null if the id is out of range.
     */
    @Nullable Type get(long id) {
        if (id < 0 || id >= types.size()) return null;
        Type type = types.get((int) id);
        if (type != null) return type;
        StructType forward = createStruct(null);
        types.set((int) id, forward);
        return forward;
    }

    /**
     * Get a type, creating an opaque struct if it has not been defined yet.
     *
     * @param id The type id.
     * @return The type.
     * @throws BitcodeException If the id is out of range.
     */
    Type getOrCreateForwardRef(long id) throws BitcodeException {
        Type type = get(id);
        if (type == null) throw new BitcodeException(ErrorKind.INVALID_TYPE, "type " + id + " of " + types.size());
        return type;
    }

    /**
     * Get a slot without creating anything, growing the table if it is too small.
     *
     * @param id The type id.
     * @return The type, or null if the slot is empty.
     * @throws BitcodeException If the id is absurd.
     */
    @Nullable Type getOrNull(long id) throws BitcodeException {
        if (id < 0 || id >= MAX_TYPES) throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "type " + id);
        while (types.size() <= id) types.add(null);
        return types.get((int) id);
    }

    @Nullable Type getSlot(int idx) {
        return types.get(idx);
    }

    void setSlot(int idx, @Nullable Type type) {
        types.set(idx, type);
    }

    void resize(long n) throws BitcodeException {
        if (n < 0 || n > MAX_TYPES) throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "type table of size " + n);
        while (types.size() > n) types.remove(types.size() - 1);
        while (types.size() < n) types.add(null);
    }

    /**
     * Take the forward reference struct in a slot, if there is one, to define it.
     *
     * @param idx The slot.
     * @return The struct, or null if the slot is empty.
     * @throws BitcodeException If the slot holds something other than a forward reference.
     */
    @Nullable StructType takeForwardStruct(int idx) throws BitcodeException {
        Type type = types.get(idx);
        if (type == null) return null;
        if (type instanceof StructType && !((StructType) type).isLiteral() && ((StructType) type).isOpaque()) {
            return (StructType) type;
        }
        throw new BitcodeException(ErrorKind.DUPLICATE_DEFINITION, "type " + idx + " is already " + type);
    }

    /**
     * Fill a slot.
     *
     * @param idx  The slot.
     * @param type The type. If the slot holds a forward reference, it must be that struct.
     * @throws BitcodeException If the slot is out of range or already defined.
     */
    void define(int idx, Type type) throws BitcodeException {
        if (idx < 0 || idx >= types.size()) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "type " + idx + " of " + types.size());
        }
        Type existing = types.get(idx);
        if (existing != null && existing != type) {
            if (existing instanceof StructType && !((StructType) existing).isLiteral()
                    && ((StructType) existing).isOpaque()) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE, "type " + idx
                        + " was referenced as a struct, but defined as " + type);
            }
            throw new BitcodeException(ErrorKind.DUPLICATE_DEFINITION, "type " + idx);
        }
        types.set(idx, type);
    }

    static IntegerType integerType(long width) throws BitcodeException {
        if (width < IntegerType.MIN_BITS || width > IntegerType.MAX_BITS) {
            throw new BitcodeException(ErrorKind.INVALID_RECORD, "integer width " + width);
        }
        return IntegerType.get((int) width);
    }

    static VectorType vectorType(Type element, long numElements) throws BitcodeException {
        if (numElements <= 0 || numElements > Integer.MAX_VALUE || !VectorType.isValidElementType(element)) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE, "vector of " + numElements + " x " + element);
        }
        return VectorType.get(element, (int) numElements);
    }

    static int addressSpace(long value) throws BitcodeException {
        if (value < 0 || value > 0xFFFFFF) throw new BitcodeException(ErrorKind.INVALID_RECORD, "address space " + value);
        return (int) value;
    }

    /**
     * Parse a current format type table block, which must be the first.
     *
     * @param cursor The cursor, just after the block id.
     * @throws BitcodeException If the block is malformed.
     */
    void parseBlock(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.TYPE_BLOCK_ID_NEW);
        if (sized || !types.isEmpty()) throw new BitcodeException(ErrorKind.INVALID_MULTIPLE_BLOCKS, "type table");

        Record record = new Record();
        int numRecords = 0;
        String pendingName = null;

        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) {
                if (numRecords != types.size()) {
                    throw new BitcodeException(ErrorKind.MALFORMED_BLOCK,
                            numRecords + " types defined in a table of " + types.size());
                }
                return;
            }

            record.clear();
            Type result;
            int code = cursor.readRecord(entry.id, record);
            switch (code) {
                case BitcodeCodes.TYPE_CODE_NUMENTRY: // [numentries]
                    requireSize(record, 1);
                    recordNumEntries(record.get(0));
                    continue;
                case BitcodeCodes.TYPE_CODE_VOID:
                    result = Type.VOID;
                    break;
                case BitcodeCodes.TYPE_CODE_HALF:
                    result = Type.HALF;
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
                    result = integerType(record.get(0));
                    break;
                case BitcodeCodes.TYPE_CODE_POINTER: { // [pointee type, address space?]
                    requireSize(record, 1);
                    int addrSpace = record.size() == 2 ? addressSpace(record.get(1)) : 0;
                    Type pointee = get(record.get(0));
                    if (pointee == null) throw new BitcodeException(ErrorKind.INVALID_TYPE, "pointee " + record.get(0));
                    result = PointerType.get(pointee, addrSpace);
                    break;
                }
                case BitcodeCodes.TYPE_CODE_FUNCTION_OLD: // [vararg, attrid, retty, paramty x N]
                    requireSize(record, 3);
                    result = functionType(record, 2);
                    break;
                case BitcodeCodes.TYPE_CODE_FUNCTION: // [vararg, retty, paramty x N]
                    requireSize(record, 2);
                    result = functionType(record, 1);
                    break;
                case BitcodeCodes.TYPE_CODE_STRUCT_ANON: { // [ispacked, eltty x N]
                    requireSize(record, 1);
                    List<Type> elements = elementTypes(record, ErrorKind.INVALID_TYPE);
                    result = StructType.literal(elements, record.getBool(0));
                    break;
                }
                case BitcodeCodes.TYPE_CODE_STRUCT_NAME: // [strchr x N]
                    pendingName = record.getString(0);
                    continue;
                case BitcodeCodes.TYPE_CODE_STRUCT_NAMED: { // [ispacked, eltty x N]
                    requireSize(record, 1);
                    StructType st = namedStruct(numRecords, pendingName);
                    pendingName = null;
                    List<Type> elements = elementTypes(record, ErrorKind.INVALID_RECORD);
                    st.setBody(elements, record.getBool(0));
                    result = st;
                    break;
                }
                case BitcodeCodes.TYPE_CODE_OPAQUE: // []
                    if (record.size() != 1) throw new BitcodeException(ErrorKind.INVALID_RECORD, "opaque type record");
                    result = namedStruct(numRecords, pendingName);
                    pendingName = null;
                    break;
                case BitcodeCodes.TYPE_CODE_ARRAY: { // [numelts, eltty]
                    requireSize(record, 2);
                    Type element = get(record.get(1));
                    if (element == null || !element.isValidElementType()) {
                        throw new BitcodeException(ErrorKind.INVALID_TYPE, "array element " + record.get(1));
                    }
                    result = ArrayType.get(element, record.get(0));
                    break;
                }
                case BitcodeCodes.TYPE_CODE_VECTOR: { // [numelts, eltty]
                    requireSize(record, 2);
                    Type element = get(record.get(1));
                    if (element == null) throw new BitcodeException(ErrorKind.INVALID_TYPE, "vector element " + record.get(1));
                    result = vectorType(element, record.get(0));
                    break;
                }
                default:
                    throw new BitcodeException(ErrorKind.INVALID_VALUE, "unknown type code " + code);
            }

            if (numRecords >= types.size()) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "more types than the declared " + types.size());
            }
            define(numRecords++, result);
        }
    }

    private StructType namedStruct(int idx, @Nullable String name) throws BitcodeException {
        if (idx >= types.size()) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE_TABLE, "more types than the declared " + types.size());
        }
        StructType st = takeForwardStruct(idx);
        if (st == null) return createStruct(name);
        st.setName(name == null || name.isEmpty() ? null : name);
        return st;
    }

    private FunctionType functionType(Record record, int retIdx) throws BitcodeException {
        List<Type> params = new ArrayList<>(record.size() - retIdx - 1);
        for (int i = retIdx + 1; i < record.size(); i++) {
            Type param = get(record.get(i));
            if (param == null || !FunctionType.isValidArgumentType(param)) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE, "parameter type " + record.get(i));
            }
            params.add(param);
        }
        Type ret = get(record.get(retIdx));
        if (ret == null || !FunctionType.isValidReturnType(ret)) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE, "return type " + record.get(retIdx));
        }
        return FunctionType.get(ret, params, record.getBool(0));
    }

    private List<Type> elementTypes(Record record, ErrorKind onError) throws BitcodeException {
        List<Type> elements = new ArrayList<>(record.size() - 1);
        for (int i = 1; i < record.size(); i++) {
            Type element = get(record.get(i));
            if (element == null || !element.isValidElementType()) {
                throw new BitcodeException(onError, "struct element type " + record.get(i));
            }
            elements.add(element);
        }
        return elements;
    }

    static void requireSize(Record record, int min) throws BitcodeException {
        if (record.size() < min) {
            throw new BitcodeException(ErrorKind.INVALID_RECORD, "expected at least " + min + " fields, got " + record.size());
        }
    }
}
