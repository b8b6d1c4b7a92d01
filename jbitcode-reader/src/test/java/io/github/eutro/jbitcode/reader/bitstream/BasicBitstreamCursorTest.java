package io.github.eutro.jbitcode.reader.bitstream;

import io.github.eutro.jbitcode.reader.BitcodeException;
import io.github.eutro.jbitcode.reader.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;

import static org.junit.jupiter.api.Assertions.*;

public class BasicBitstreamCursorTest {
    private static BasicBitstreamCursor cursor(BitstreamWriter writer) {
        return new BasicBitstreamCursor(new ArrayByteSource(writer.toByteArray()));
    }

    @Test
    void fixedAndVbrFields() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter()
                .emit(5, 3)
                .emitVBR(1000, 6)
                .emit(0xDEADBEEFL, 32)
                .emitVBR(-1L, 8);
        BasicBitstreamCursor cursor = cursor(writer);
        assertEquals(5, cursor.read(3));
        assertEquals(1000, cursor.readVBR(6));
        assertEquals(0xDEADBEEFL, cursor.read(32));
        assertEquals(-1L, cursor.readVBR(8));
    }

    @Test
    void unabbreviatedRecords() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(8, 3);
        writer.emitRecord(7, 1, 2, 300);
        writer.emitRecord(2, "hello");
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        BitstreamEntry entry = cursor.advance();
        assertEquals(BitstreamEntry.Kind.SUB_BLOCK, entry.kind);
        assertEquals(8, entry.id);
        cursor.enterSubBlock(8);
        assertEquals(3, cursor.getAbbrevIdWidth());

        Record record = new Record();
        entry = cursor.advance();
        assertEquals(BitstreamEntry.Kind.RECORD, entry.kind);
        assertEquals(7, cursor.readRecord(entry.id, record));
        assertArrayEquals(new long[]{1, 2, 300}, record.toArray());

        record.clear();
        assertEquals(2, cursor.readRecord(cursor.advance().id, record));
        assertEquals("hello", record.getString(0));

        assertEquals(BitstreamEntry.Kind.END_BLOCK, cursor.advance().kind);
        assertEquals(BitCodes.TOP_LEVEL_ABBREV_WIDTH, cursor.getAbbrevIdWidth());
        assertTrue(cursor.atEndOfStream());
    }

    @Test
    void abbreviatedRecords() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(9, 4);
        int fixed = writer.defineAbbrev(AbbrevOp.literal(5), AbbrevOp.of(AbbrevOp.Encoding.FIXED, 3),
                AbbrevOp.of(AbbrevOp.Encoding.VBR, 6));
        int chars = writer.defineAbbrev(AbbrevOp.of(AbbrevOp.Encoding.FIXED, 4),
                AbbrevOp.of(AbbrevOp.Encoding.ARRAY), AbbrevOp.of(AbbrevOp.Encoding.CHAR6));
        int blob = writer.defineAbbrev(AbbrevOp.literal(9), AbbrevOp.of(AbbrevOp.Encoding.BLOB));
        writer.emitAbbreviatedRecord(fixed, 5, 6, 12345);
        writer.emitAbbreviatedRecord(chars, 3, BitstreamWriter.chars("x_1.Y"));
        writer.emitAbbreviatedRecord(blob, 9, 1, 2, 3, 4, 5);
        writer.emitRecord(1, 42);
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        cursor.advance();
        cursor.enterSubBlock(9);
        Record record = new Record();

        BitstreamEntry entry = cursor.advance();
        assertEquals(fixed, entry.id);
        assertEquals(5, cursor.readRecord(entry.id, record));
        assertArrayEquals(new long[]{6, 12345}, record.toArray());

        record.clear();
        entry = cursor.advance();
        assertEquals(chars, entry.id);
        assertEquals(3, cursor.readRecord(entry.id, record));
        assertEquals("x_1.Y", record.getString(0));

        record.clear();
        entry = cursor.advance();
        assertEquals(9, cursor.readRecord(entry.id, record));
        assertArrayEquals(new long[]{1, 2, 3, 4, 5}, record.toArray());

        record.clear();
        assertEquals(1, cursor.readRecord(cursor.advance().id, record));
        assertArrayEquals(new long[]{42}, record.toArray());
        assertEquals(BitstreamEntry.Kind.END_BLOCK, cursor.advance().kind);
    }

    @Test
    void abbreviationsAreScopedToTheirBlock() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(8, 3);
        writer.defineAbbrev(AbbrevOp.literal(1), AbbrevOp.of(AbbrevOp.Encoding.FIXED, 8));
        writer.enterSubBlock(9, 3);
        writer.emit(BitCodes.FIRST_APPLICATION_ABBREV, 3); // not defined in this block
        writer.exitBlock();
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        cursor.advance();
        cursor.enterSubBlock(8);
        BitstreamEntry entry = cursor.advance();
        assertEquals(9, entry.id);
        cursor.enterSubBlock(9);
        int abbrevId = cursor.advance().id;
        assertEquals(BitCodes.FIRST_APPLICATION_ABBREV, abbrevId);
        BitcodeException e = assertThrows(BitcodeException.class, () -> cursor.readRecord(abbrevId, new Record()));
        assertEquals(ErrorKind.MALFORMED_BLOCK, e.getKind());
    }

    @Test
    void blockInfoAbbreviations() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterBlockInfoBlock();
        writer.setBlockInfoTarget(14);
        int entryAbbrev = writer.defineBlockInfoAbbrev(AbbrevOp.literal(1), AbbrevOp.of(AbbrevOp.Encoding.VBR, 8),
                AbbrevOp.of(AbbrevOp.Encoding.ARRAY), AbbrevOp.of(AbbrevOp.Encoding.FIXED, 8));
        writer.exitBlock();
        writer.enterSubBlock(14, 4);
        writer.emitAbbreviatedRecord(entryAbbrev, 1, 3, 'f', 'o', 'o');
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        BitstreamEntry entry = cursor.advance(BitstreamCursor.AF_DONT_AUTOPROCESS_ABBREVS);
        assertEquals(BitCodes.BLOCKINFO_BLOCK_ID, entry.id);
        cursor.readBlockInfoBlock();
        assertNotNull(cursor.getBlockInfoAbbrevs(14));
        assertEquals(1, cursor.getBlockInfoAbbrevs(14).size());

        entry = cursor.advance();
        assertEquals(14, entry.id);
        cursor.enterSubBlock(14);
        Record record = new Record();
        entry = cursor.advance();
        assertEquals(entryAbbrev, entry.id);
        assertEquals(1, cursor.readRecord(entry.id, record));
        assertEquals(3, record.get(0));
        assertEquals("foo", record.getString(1));
    }

    @Test
    void skipBlockJumpsToTheNextEntry() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(8, 3);
        writer.enterSubBlock(11, 5);
        for (int i = 0; i < 20; i++) writer.emitRecord(4, i * 1000L);
        writer.exitBlock();
        writer.emitRecord(2, 77);
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        cursor.advance();
        cursor.enterSubBlock(8);
        BitstreamEntry entry = cursor.advance();
        assertEquals(BitstreamEntry.Kind.SUB_BLOCK, entry.kind);
        cursor.skipBlock();

        Record record = new Record();
        assertEquals(2, cursor.readRecord(cursor.advance().id, record));
        assertEquals(77, record.get(0));
        assertEquals(BitstreamEntry.Kind.END_BLOCK, cursor.advance().kind);
    }

    @Test
    void advanceSkippingSubblocks() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(8, 3);
        writer.enterSubBlock(12, 4);
        writer.emitRecord(1, 1);
        writer.exitBlock();
        writer.emitRecord(3, 3);
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        cursor.advance();
        cursor.enterSubBlock(8);
        BitstreamEntry entry = cursor.advanceSkippingSubblocks();
        assertEquals(BitstreamEntry.Kind.RECORD, entry.kind);
        assertEquals(3, cursor.readRecord(entry.id, new Record()));
    }

    @Test
    void markAndResetRestoreAbbreviations() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(10, 3);
        int abbrev = writer.defineAbbrev(AbbrevOp.literal(7), AbbrevOp.of(AbbrevOp.Encoding.FIXED, 5));
        writer.emitAbbreviatedRecord(abbrev, 7, 21);
        writer.emitRecord(8, 1);
        writer.exitBlock();

        BasicBitstreamCursor cursor = cursor(writer);
        cursor.advance();
        cursor.enterSubBlock(10);
        BitstreamCursor.Mark mark = cursor.mark();

        Record record = new Record();
        for (int pass = 0; pass < 2; pass++) {
            record.clear();
            assertEquals(7, cursor.readRecord(cursor.advance().id, record));
            assertEquals(21, record.get(0));
            cursor.skipRecord(cursor.advance().id);
            assertEquals(BitstreamEntry.Kind.END_BLOCK, cursor.advance().kind);
            cursor.reset(mark);
            assertEquals(mark.getBitNo(), cursor.getCurrentBitNo());
            assertEquals(3, cursor.getAbbrevIdWidth());
        }
    }

    @Test
    void endBlockAtTopLevelIsMalformed() {
        BitstreamWriter writer = new BitstreamWriter().emit(BitCodes.END_BLOCK, 2);
        BasicBitstreamCursor cursor = cursor(writer);
        BitcodeException e = assertThrows(BitcodeException.class, cursor::advance);
        assertEquals(ErrorKind.MALFORMED_BLOCK, e.getKind());
    }

    @Test
    void truncatedStreamIsMalformed() {
        byte[] bytes = new BitstreamWriter().enterSubBlock(8, 3).emitRecord(1, 1, 2, 3).toByteArray();
        BasicBitstreamCursor cursor = new BasicBitstreamCursor(new ArrayByteSource(bytes, 0, 8));
        BitcodeException e = assertThrows(BitcodeException.class, () -> {
            cursor.advance();
            cursor.enterSubBlock(8);
            cursor.readRecord(cursor.advance().id, new Record());
        });
        assertEquals(ErrorKind.MALFORMED_BLOCK, e.getKind());
    }

    @Test
    void skippingPastTheEndIsMalformed() {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(8, 3);
        writer.emitRecord(1, 1);
        writer.exitBlock();
        byte[] bytes = writer.toByteArray();
        bytes[4] = 100; // the length word claims far more than there is

        BasicBitstreamCursor cursor = new BasicBitstreamCursor(new ArrayByteSource(bytes));
        BitcodeException e = assertThrows(BitcodeException.class, () -> {
            cursor.advance();
            cursor.skipBlock();
        });
        assertEquals(ErrorKind.MALFORMED_BLOCK, e.getKind());
    }

    @Test
    void streamingSourceReadsOnDemand() throws BitcodeException {
        BitstreamWriter writer = new BitstreamWriter();
        writer.enterSubBlock(8, 3);
        for (int i = 0; i < 3000; i++) writer.emitRecord(1, i);
        writer.exitBlock();
        byte[] bytes = writer.toByteArray();

        StreamingByteSource source = new StreamingByteSource(new ByteArrayInputStream(bytes));
        assertFalse(source.isComplete());
        BasicBitstreamCursor cursor = new BasicBitstreamCursor(source);
        cursor.advance();
        cursor.enterSubBlock(8);
        Record record = new Record();
        cursor.readRecord(cursor.advance().id, record);
        assertEquals(0, record.get(0));
        assertTrue(source.getFetched() < bytes.length);

        for (int i = 1; i < 3000; i++) {
            record.clear();
            cursor.readRecord(cursor.advance().id, record);
            assertEquals(i, record.get(0));
        }
        assertEquals(BitstreamEntry.Kind.END_BLOCK, cursor.advance().kind);
        assertTrue(cursor.atEndOfStream());
    }
}
