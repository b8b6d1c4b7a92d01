package io.github.eutro.jbitcode.reader.bitstream;

import io.github.eutro.jbitcode.reader.BitcodeException;
import io.github.eutro.jbitcode.reader.ErrorKind;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A {@link BitstreamCursor} over a {@link ByteSource}. Bits are read least significant first.
 */
public final class BasicBitstreamCursor implements BitstreamCursor {
    private final ByteSource source;
    private long bitPos;
    private int abbrevWidth = BitCodes.TOP_LEVEL_ABBREV_WIDTH;
    private List<Abbrev> abbrevs = new ArrayList<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();

    private final Map<Integer, List<Abbrev>> blockInfo = new HashMap<>();
    private boolean blockInfoRead;

    public BasicBitstreamCursor(ByteSource source) {
        this.source = source;
    }

    public ByteSource getSource() {
        return source;
    }

    private static BitcodeException malformed(String detail) {
        return new BitcodeException(ErrorKind.MALFORMED_BLOCK, detail);
    }

    private int byteAt(long pos) throws BitcodeException {
        try {
            if (!source.isAvailable(pos)) throw malformed("unexpected end of stream at byte " + pos);
            return source.getByte(pos);
        } catch (IOException e) {
            throw new BitcodeException(ErrorKind.MALFORMED_BLOCK, "failed to read byte " + pos, e);
        }
    }

    private boolean canSkipTo(long bytePos) throws BitcodeException {
        try {
            return bytePos == 0 || source.isAvailable(bytePos - 1);
        } catch (IOException e) {
            throw new BitcodeException(ErrorKind.MALFORMED_BLOCK, "failed to read byte " + (bytePos - 1), e);
        }
    }

    @Override
    public long read(int width) throws BitcodeException {
        if (width < 0 || width > 64) throw malformed("invalid field width " + width);
        long result = 0;
        int got = 0;
        while (got < width) {
            int b = byteAt(bitPos >>> 3);
            int off = (int) (bitPos & 7);
            int take = Math.min(8 - off, width - got);
            long bits = (b >>> off) & ((1 << take) - 1);
            result |= bits << got;
            got += take;
            bitPos += take;
        }
        return result;
    }

    @Override
    public long readVBR(int width) throws BitcodeException {
        if (width < 2 || width > 64) throw malformed("invalid VBR width " + width);
        long piece = read(width);
        long hi = 1L << (width - 1);
        if ((piece & hi) == 0) return piece;
        long result = 0;
        int shift = 0;
        while (true) {
            result |= (piece & (hi - 1)) << shift;
            if ((piece & hi) == 0) return result;
            shift += width - 1;
            if (shift >= 64) throw malformed("VBR value too large");
            piece = read(width);
        }
    }

    private void alignTo32() {
        bitPos = (bitPos + 31) & ~31L;
    }

    @Override
    public BitstreamEntry advance(int flags) throws BitcodeException {
        while (true) {
            int code = (int) read(abbrevWidth);
            if (code == BitCodes.END_BLOCK) {
                if ((flags & AF_DONT_POP_BLOCK_AT_END) == 0) readBlockEnd();
                return BitstreamEntry.endBlock();
            }
            if (code == BitCodes.ENTER_SUBBLOCK) {
                return BitstreamEntry.subBlock((int) readVBR(BitCodes.BLOCK_ID_WIDTH));
            }
            if (code == BitCodes.DEFINE_ABBREV && (flags & AF_DONT_AUTOPROCESS_ABBREVS) == 0) {
                readAbbrevRecord();
                continue;
            }
            return BitstreamEntry.record(code);
        }
    }

    @Override
    public BitstreamEntry advanceSkippingSubblocks(int flags) throws BitcodeException {
        while (true) {
            BitstreamEntry entry = advance(flags);
            if (entry.kind != BitstreamEntry.Kind.SUB_BLOCK) return entry;
            skipBlock();
        }
    }

    private void readBlockEnd() throws BitcodeException {
        if (scopes.isEmpty()) throw malformed("end of block at top level");
        alignTo32();
        Scope scope = scopes.pop();
        abbrevWidth = scope.abbrevWidth;
        abbrevs = scope.abbrevs;
    }

    @Override
    public void enterSubBlock(int blockId) throws BitcodeException {
        scopes.push(new Scope(abbrevWidth, abbrevs));
        abbrevs = new ArrayList<>();
        List<Abbrev> infoAbbrevs = blockInfo.get(blockId);
        if (infoAbbrevs != null) abbrevs.addAll(infoAbbrevs);

        abbrevWidth = (int) readVBR(BitCodes.CODE_LEN_WIDTH);
        alignTo32();
        read(BitCodes.BLOCK_SIZE_WIDTH); // length in words, only needed for skipping
        if (abbrevWidth == 0 || abbrevWidth > 32) throw malformed("invalid abbreviation width " + abbrevWidth);
        if (atEndOfStream()) throw malformed("block " + blockId + " is empty");
    }

    @Override
    public void skipBlock() throws BitcodeException {
        readVBR(BitCodes.CODE_LEN_WIDTH);
        alignTo32();
        long numWords = read(BitCodes.BLOCK_SIZE_WIDTH);
        long skipTo = bitPos + numWords * 32;
        if (atEndOfStream() || !canSkipTo(skipTo >>> 3)) throw malformed("block runs past the end of the stream");
        bitPos = skipTo;
    }

    private Abbrev getAbbrev(int abbrevId) throws BitcodeException {
        int idx = abbrevId - BitCodes.FIRST_APPLICATION_ABBREV;
        if (idx < 0 || idx >= abbrevs.size()) throw malformed("invalid abbreviation id " + abbrevId);
        return abbrevs.get(idx);
    }

    private long readScalar(AbbrevOp op) throws BitcodeException {
        switch (op.encoding) {
            case LITERAL:
                return op.value;
            case FIXED:
                return read((int) op.value);
            case VBR:
                return readVBR((int) op.value);
            case CHAR6:
                return AbbrevOp.decodeChar6(read(6));
            default:
                throw malformed("not a scalar operand: " + op);
        }
    }

    @Override
    public int readRecord(int abbrevId, Record out) throws BitcodeException {
        if (abbrevId == BitCodes.UNABBREV_RECORD) {
            int code = (int) readVBR(6);
            long numElts = readVBR(6);
            for (long i = 0; i < numElts; i++) {
                out.add(readVBR(6));
            }
            return code;
        }

        Abbrev abbrev = getAbbrev(abbrevId);
        if (abbrev.getNumOps() == 0) throw malformed("empty abbreviation");
        AbbrevOp codeOp = abbrev.getOp(0);
        if (!codeOp.isScalar()) throw malformed("abbreviation starts with an array or a blob");
        int code = (int) readScalar(codeOp);

        for (int i = 1, e = abbrev.getNumOps(); i < e; i++) {
            AbbrevOp op = abbrev.getOp(i);
            if (op.isScalar()) {
                out.add(readScalar(op));
                continue;
            }
            if (op.encoding == AbbrevOp.Encoding.ARRAY) {
                if (i + 2 != e) throw malformed("array is not the second to last operand");
                AbbrevOp eltOp = abbrev.getOp(++i);
                if (!eltOp.isScalar()) throw malformed("array element is not a scalar");
                long numElts = readVBR(6);
                for (long j = 0; j < numElts; j++) {
                    out.add(readScalar(eltOp));
                }
                continue;
            }
            // blob
            if (i + 1 != e) throw malformed("blob is not the last operand");
            long numBytes = readVBR(6);
            alignTo32();
            long start = bitPos >>> 3;
            long end = (bitPos + (((numBytes + 3) & ~3L) * 8));
            if (!canSkipTo(end >>> 3)) throw malformed("blob runs past the end of the stream");
            for (long j = 0; j < numBytes; j++) {
                out.add(byteAt(start + j));
            }
            bitPos = end;
        }
        return code;
    }

    @Override
    public void skipRecord(int abbrevId) throws BitcodeException {
        readRecord(abbrevId, new Record());
    }

    @Override
    public void readAbbrevRecord() throws BitcodeException {
        int numOps = (int) readVBR(5);
        List<AbbrevOp> ops = new ArrayList<>(numOps);
        for (int i = 0; i < numOps; i++) {
            boolean isLiteral = read(1) != 0;
            if (isLiteral) {
                ops.add(AbbrevOp.literal(readVBR(8)));
                continue;
            }
            AbbrevOp.Encoding encoding = AbbrevOp.encodingOf(read(3));
            if (encoding == null) throw malformed("unknown abbreviation encoding");
            if (encoding == AbbrevOp.Encoding.FIXED || encoding == AbbrevOp.Encoding.VBR) {
                long width = readVBR(5);
                if (width > 64) throw malformed("field width " + width + " too large");
                // a zero-width field always reads as zero
                ops.add(width == 0 ? AbbrevOp.literal(0) : AbbrevOp.of(encoding, width));
            } else {
                ops.add(AbbrevOp.of(encoding));
            }
        }
        abbrevs.add(new Abbrev(ops));
    }

    @Override
    public void readBlockInfoBlock() throws BitcodeException {
        if (blockInfoRead) {
            skipBlock();
            return;
        }
        enterSubBlock(BitCodes.BLOCKINFO_BLOCK_ID);
        Record record = new Record();
        List<Abbrev> current = null;
        while (true) {
            BitstreamEntry entry = advanceSkippingSubblocks(AF_DONT_AUTOPROCESS_ABBREVS);
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) {
                blockInfoRead = true;
                return;
            }
            if (entry.id == BitCodes.DEFINE_ABBREV) {
                if (current == null) throw malformed("abbreviation before SETBID in BLOCKINFO");
                readAbbrevRecord();
                current.add(abbrevs.remove(abbrevs.size() - 1));
                continue;
            }
            record.clear();
            if (readRecord(entry.id, record) == BitCodes.BLOCKINFO_CODE_SETBID) {
                if (record.isEmpty()) throw malformed("empty SETBID record");
                current = blockInfo.computeIfAbsent((int) record.get(0), k -> new ArrayList<>());
            }
        }
    }

    @Override
    public boolean atEndOfStream() throws BitcodeException {
        try {
            return !source.isAvailable(bitPos >>> 3);
        } catch (IOException e) {
            throw new BitcodeException(ErrorKind.MALFORMED_BLOCK, "failed to read byte " + (bitPos >>> 3), e);
        }
    }

    @Override
    public long getCurrentBitNo() {
        return bitPos;
    }

    @Override
    public void jumpToBit(long bitNo) throws BitcodeException {
        if (bitNo < 0 || !canSkipTo((bitNo + 7) >>> 3)) throw malformed("jump past the end of the stream");
        bitPos = bitNo;
    }

    @Override
    public int getAbbrevIdWidth() {
        return abbrevWidth;
    }

    /**
     * Get the abbreviations registered for a block id by the BLOCKINFO block.
     *
     * @param blockId The block id.
     * @return The abbreviations, or null if there are none.
     */
    public @Nullable List<Abbrev> getBlockInfoAbbrevs(int blockId) {
        return blockInfo.get(blockId);
    }

    @Override
    public Mark mark() {
        Deque<Scope> scopesCopy = new ArrayDeque<>();
        for (Scope scope : scopes) {
            scopesCopy.addLast(new Scope(scope.abbrevWidth, new ArrayList<>(scope.abbrevs)));
        }
        return new Snapshot(bitPos, abbrevWidth, new ArrayList<>(abbrevs), scopesCopy);
    }

    @Override
    public void reset(Mark mark) {
        Snapshot snapshot = (Snapshot) mark;
        bitPos = snapshot.bitPos;
        abbrevWidth = snapshot.abbrevWidth;
        abbrevs = new ArrayList<>(snapshot.abbrevs);
        scopes.clear();
        Iterator<Scope> it = snapshot.scopes.iterator();
        while (it.hasNext()) {
            Scope scope = it.next();
            scopes.addLast(new Scope(scope.abbrevWidth, new ArrayList<>(scope.abbrevs)));
        }
    }

    private static final class Scope {
        final int abbrevWidth;
        final List<Abbrev> abbrevs;

        Scope(int abbrevWidth, List<Abbrev> abbrevs) {
            this.abbrevWidth = abbrevWidth;
            this.abbrevs = abbrevs;
        }
    }

    private static final class Snapshot implements Mark {
        final long bitPos;
        final int abbrevWidth;
        final List<Abbrev> abbrevs;
        final Deque<Scope> scopes;

        Snapshot(long bitPos, int abbrevWidth, List<Abbrev> abbrevs, Deque<Scope> scopes) {
            this.bitPos = bitPos;
            this.abbrevWidth = abbrevWidth;
            this.abbrevs = abbrevs;
            this.scopes = scopes;
        }

        @Override
        public long getBitNo() {
            return bitPos;
        }
    }
}
