package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.BasicBlock;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Reads value symbol tables, which name values that have already been read.
 */
final class SymbolTableReader {
    private final ValueTable values;

    SymbolTableReader(ValueTable values) {
        this.values = values;
    }

    /**
     * Parse a value symbol table block.
     *
     * @param cursor The cursor, just after the block id.
     * @param blocks The blocks of the function being read, or null at module level.
     * @throws BitcodeException If an entry names a value or block that doesn't exist.
     */
    void parseBlock(BitstreamCursor cursor, @Nullable List<BasicBlock> blocks) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.VALUE_SYMTAB_BLOCK_ID);
        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) return;

            record.clear();
            switch (cursor.readRecord(entry.id, record)) {
                case BitcodeCodes.VST_CODE_ENTRY: { // [valueid, namechar x N]
                    TypeTable.requireSize(record, 1);
                    long valueId = record.get(0);
                    Value value = values.get(valueId);
                    if (value == null) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "name for value " + valueId
                                + " of " + values.size());
                    }
                    value.setName(record.getString(1));
                    break;
                }
                case BitcodeCodes.VST_CODE_BBENTRY: { // [bbid, namechar x N]
                    TypeTable.requireSize(record, 1);
                    long blockId = record.get(0);
                    if (blocks == null || blockId < 0 || blockId >= blocks.size()) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "name for block " + blockId);
                    }
                    blocks.get((int) blockId).setName(record.getString(1));
                    break;
                }
                default:
                    break;
            }
        }
    }
}
