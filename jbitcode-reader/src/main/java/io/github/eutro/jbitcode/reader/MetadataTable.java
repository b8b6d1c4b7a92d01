package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.Instruction;
import io.github.eutro.jbitcode.core.ir.MDNode;
import io.github.eutro.jbitcode.core.ir.MDString;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.NamedMDNode;
import io.github.eutro.jbitcode.core.ir.User;
import io.github.eutro.jbitcode.core.ir.Use;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The metadata of a module, and of the function being read, indexed by metadata id.
 * <p>
 * Each record appends one value. A node referenced before it is read is a temporary
 * node, which is replaced wholesale, and deleted, once the real one is read.
 */
final class MetadataTable {
    private static final Logger LOG = LoggerFactory.getLogger(MetadataTable.class);

    private final Module module;
    private final TypeTable types;
    private final ValueTable values;
    private final ValueSlots slots = new ValueSlots();
    private final Map<Long, Integer> kinds = new HashMap<>();

    MetadataTable(Module module, TypeTable types, ValueTable values) {
        this.module = module;
        this.types = types;
        this.values = values;
    }

    int size() {
        return slots.getNumOperands();
    }

    @Nullable Value get(long idx) {
        if (idx < 0 || idx >= size()) return null;
        return slots.getOperand((int) idx);
    }

    /**
     * Get a metadata value by id, creating a temporary node if it has not been read yet.
     *
     * @param idx The metadata id.
     * @return The value.
     * @throws BitcodeException If the id is absurd.
     */
    Value getForwardRef(long idx) throws BitcodeException {
        if (idx < 0 || idx >= ValueTable.MAX_VALUES) throw new BitcodeException(ErrorKind.INVALID_ID, "metadata " + idx);
        while (size() <= idx) slots.add(null);
        Value existing = slots.getOperand((int) idx);
        if (existing != null) return existing;
        MDNode temporary = MDNode.getTemporary();
        slots.setOperand((int) idx, temporary);
        return temporary;
    }

    void assign(Value value, int idx) throws BitcodeException {
        while (size() <= idx) slots.add(null);
        Value old = slots.getOperand(idx);
        if (old == null) {
            slots.setOperand(idx, value);
            return;
        }
        if (!(old instanceof MDNode) || !((MDNode) old).isTemporary()) {
            throw new BitcodeException(ErrorKind.DUPLICATE_DEFINITION, "metadata " + idx);
        }
        if (!(value instanceof MDNode)) {
            for (Use use : old.getUses()) {
                User user = use.getUser();
                if (user instanceof NamedMDNode || user instanceof Instruction) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD,
                            "metadata " + idx + " is used as a node, but is " + value);
                }
            }
        }
        old.replaceAllUsesWith(value);
        ((MDNode) old).deleteTemporary();
    }

    /**
     * Map a metadata kind id of the file to the id of the module.
     *
     * @param kind The kind id in the file.
     * @return The kind id in the module.
     * @throws BitcodeException If there was no kind record for it.
     */
    int mapKind(long kind) throws BitcodeException {
        Integer mapped = kinds.get(kind);
        if (mapped == null) throw new BitcodeException(ErrorKind.INVALID_ID, "metadata kind " + kind);
        return mapped;
    }

    /**
     * Find a slot from {@code from} on that still holds a temporary node.
     *
     * @param from The first slot to check.
     * @return The slot, or -1.
     */
    int findTemporary(int from) {
        for (int i = from; i < size(); i++) {
            Value value = slots.getOperand(i);
            if (value instanceof MDNode && ((MDNode) value).isTemporary()) return i;
        }
        return -1;
    }

    void shrinkTo(int size) {
        if (size < size()) slots.truncate(size);
    }

    void clear() {
        slots.truncate(0);
    }

    /**
     * Parse a metadata block, at module level or in a function body.
     *
     * @param cursor The cursor, just after the block id.
     * @throws BitcodeException If the block is malformed.
     */
    void parseBlock(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.METADATA_BLOCK_ID);
        int nextMdNo = size();
        Record record = new Record();

        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) return;

            record.clear();
            int code = cursor.readRecord(entry.id, record);
            switch (code) {
                case BitcodeCodes.METADATA_NAME: { // [namechar x N], then a NAMED_NODE
                    String name = record.getString(0);
                    BitstreamEntry next = cursor.advanceSkippingSubblocks();
                    if (next.kind != BitstreamEntry.Kind.RECORD) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "metadata name " + name + " without a node list");
                    }
                    record.clear();
                    if (cursor.readRecord(next.id, record) != BitcodeCodes.METADATA_NAMED_NODE) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "metadata name " + name + " without a node list");
                    }
                    NamedMDNode named = module.getOrInsertNamedMetadata(name);
                    for (int i = 0; i < record.size(); i++) { // [n x mdnodes]
                        Value node = getForwardRef(record.get(i));
                        if (!(node instanceof MDNode)) {
                            throw new BitcodeException(ErrorKind.INVALID_RECORD, "named metadata operand " + node);
                        }
                        named.addNode((MDNode) node);
                    }
                    break;
                }
                case BitcodeCodes.METADATA_FN_NODE:
                case BitcodeCodes.METADATA_NODE: { // [n x (type, value)]
                    if (record.size() % 2 == 1) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "odd metadata node record");
                    }
                    List<Value> elements = new ArrayList<>(record.size() / 2);
                    for (int i = 0; i < record.size(); i += 2) {
                        Type type = types.get(record.get(i));
                        if (type == null) throw new BitcodeException(ErrorKind.INVALID_RECORD, "metadata operand type " + record.get(i));
                        if (type.isMetadata()) {
                            elements.add(getForwardRef(record.get(i + 1)));
                        } else if (!type.isVoid()) {
                            elements.add(values.getValueForwardRef(record.get(i + 1), type));
                        } else {
                            elements.add(null);
                        }
                    }
                    MDNode node = code == BitcodeCodes.METADATA_FN_NODE
                            ? MDNode.getFunctionLocal(elements)
                            : MDNode.get(elements);
                    assign(node, nextMdNo++);
                    break;
                }
                case BitcodeCodes.METADATA_STRING: // [strchr x N]
                    assign(new MDString(record.getString(0)), nextMdNo++);
                    break;
                case BitcodeCodes.METADATA_KIND: { // [kind, namechar x N]
                    if (record.size() < 2) throw new BitcodeException(ErrorKind.INVALID_RECORD, "metadata kind record");
                    long kind = record.get(0);
                    int moduleKind = module.getMDKindID(record.getString(1));
                    Integer previous = kinds.putIfAbsent(kind, moduleKind);
                    if (previous != null) {
                        throw new BitcodeException(ErrorKind.CONFLICTING_METADATA_KIND_RECORDS, "kind " + kind);
                    }
                    break;
                }
                default:
                    LOG.warn("Skipping unknown metadata record code {}", code);
                    break;
            }
        }
    }

    /**
     * Parse the metadata attachments of a function body.
     *
     * @param cursor       The cursor, just after the block id.
     * @param instructions The instructions of the function, in order.
     * @throws BitcodeException If the block is malformed.
     */
    void parseAttachmentBlock(BitstreamCursor cursor, List<Instruction> instructions) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.METADATA_ATTACHMENT_ID);
        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) return;

            record.clear();
            if (cursor.readRecord(entry.id, record) != BitcodeCodes.METADATA_ATTACHMENT) continue;
            // [instid, n x (kind, mdnode)]
            if (record.isEmpty() || record.size() % 2 == 0) {
                throw new BitcodeException(ErrorKind.INVALID_RECORD, "metadata attachment record of size " + record.size());
            }
            long instId = record.get(0);
            if (instId < 0 || instId >= instructions.size()) {
                throw new BitcodeException(ErrorKind.INVALID_RECORD, "attachment to instruction " + instId);
            }
            Instruction insn = instructions.get((int) instId);
            for (int i = 1; i < record.size(); i += 2) {
                int kind = mapKind(record.get(i));
                Value node = getForwardRef(record.get(i + 1));
                if (!(node instanceof MDNode)) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "attachment of " + node);
                }
                insn.setMetadata(kind, (MDNode) node);
            }
        }
    }
}
