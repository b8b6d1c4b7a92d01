package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.attr.AttributeSet;
import io.github.eutro.jbitcode.core.attr.Attributes;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The attribute sets of a module, in the order of their records. Functions and calls refer
 * to them by one-based index, with zero meaning no attributes.
 */
final class AttributeTable {
    private static final long FUNCTION_SLOT = 0xFFFFFFFFL;

    private final List<AttributeSet> sets = new ArrayList<>();
    private final Map<AttributeSet, AttributeSet> interned = new HashMap<>();

    int size() {
        return sets.size();
    }

    /**
     * Get an attribute set by its encoded reference.
     *
     * @param ref The one-based index, or zero.
     * @return The set.
     * @throws BitcodeException If the index is out of range.
     */
    AttributeSet get(long ref) throws BitcodeException {
        if (ref == 0) return AttributeSet.EMPTY;
        if (ref < 0 || ref > sets.size()) {
            throw new BitcodeException(ErrorKind.INVALID_ID, "attribute set " + ref + " of " + sets.size());
        }
        return sets.get((int) ref - 1);
    }

    private AttributeSet intern(AttributeSet set) {
        AttributeSet existing = interned.putIfAbsent(set, set);
        return existing == null ? set : existing;
    }

    /**
     * Unpack an attribute word as it is stored in the container. The alignment is a plain
     * byte count in bits 16 to 31, and the flags above bit 32 are stored 11 bits higher than in memory.
     *
     * @param encoded The encoded word.
     * @return The attributes.
     * @throws BitcodeException If the alignment is not a power of two.
     */
    static Attributes decodeAttributes(long encoded) throws BitcodeException {
        long alignment = (encoded & (0xFFFFL << 16)) >>> 16;
        if (alignment != 0 && Long.bitCount(alignment) != 1) {
            throw new BitcodeException(ErrorKind.INVALID_RECORD, "alignment " + alignment + " is not a power of two");
        }
        long raw = ((encoded & (0xFFFFFL << 32)) >>> 11) | (encoded & 0xFFFF);
        return Attributes.fromRaw(raw | Attributes.alignmentBits(alignment));
    }

    void parseBlock(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.PARAMATTR_BLOCK_ID);
        if (!sets.isEmpty()) throw new BitcodeException(ErrorKind.INVALID_MULTIPLE_BLOCKS, "attribute table");

        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) return;

            record.clear();
            switch (cursor.readRecord(entry.id, record)) {
                case BitcodeCodes.PARAMATTR_CODE_ENTRY_OLD: { // [paramidx0, attr0, ...]
                    if ((record.size() & 1) != 0) throw new BitcodeException(ErrorKind.INVALID_RECORD, "odd attribute entry");
                    Map<Integer, Attributes> slots = new HashMap<>();
                    for (int i = 0; i < record.size(); i += 2) {
                        long slot = record.get(i);
                        int index = slot == FUNCTION_SLOT ? AttributeSet.FUNCTION_INDEX : (int) slot;
                        Attributes attrs = decodeAttributes(record.get(i + 1));
                        slots.merge(index, attrs, (a, b) -> Attributes.fromRaw(a.getRaw() | b.getRaw()));
                    }
                    sets.add(intern(AttributeSet.of(slots)));
                    break;
                }
                case BitcodeCodes.PARAMATTR_CODE_ENTRY: // [attrgrp0, ...]
                    // attribute groups are never written alongside this format
                    if (!record.isEmpty()) throw new BitcodeException(ErrorKind.INVALID_ID, "attribute group " + record.get(0));
                    sets.add(AttributeSet.EMPTY);
                    break;
                default:
                    break;
            }
        }
    }
}
