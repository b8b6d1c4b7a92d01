package io.github.eutro.jbitcode.reader.bitstream;

import io.github.eutro.jbitcode.reader.BitcodeException;

/**
 * A position in a bitstream, which turns bits into blocks, records and abbreviations.
 * <p>
 * Every method that reads fails with a {@link io.github.eutro.jbitcode.reader.ErrorKind#MALFORMED_BLOCK}
 * exception if the stream is truncated or inconsistent.
 */
public interface BitstreamCursor {
    /**
     * Don't read abbreviation definitions automatically, return them as records with id
     * {@link BitCodes#DEFINE_ABBREV} instead.
     */
    int AF_DONT_AUTOPROCESS_ABBREVS = 1;
    /**
     * Return {@link BitstreamEntry.Kind#END_BLOCK} without leaving the block.
     */
    int AF_DONT_POP_BLOCK_AT_END = 2;

    long read(int width) throws BitcodeException;

    long readVBR(int width) throws BitcodeException;

    /**
     * Find the next entry of the current block.
     *
     * @param flags Any of {@link #AF_DONT_AUTOPROCESS_ABBREVS} and {@link #AF_DONT_POP_BLOCK_AT_END}.
     * @return The entry.
     * @throws BitcodeException If the stream is malformed.
     */
    BitstreamEntry advance(int flags) throws BitcodeException;

    default BitstreamEntry advance() throws BitcodeException {
        return advance(0);
    }

    /**
     * Like {@link #advance()}, but skip every sub-block.
     *
     * @param flags As for {@link #advance(int)}.
     * @return An {@link BitstreamEntry.Kind#END_BLOCK} or {@link BitstreamEntry.Kind#RECORD} entry.
     * @throws BitcodeException If the stream is malformed.
     */
    BitstreamEntry advanceSkippingSubblocks(int flags) throws BitcodeException;

    default BitstreamEntry advanceSkippingSubblocks() throws BitcodeException {
        return advanceSkippingSubblocks(0);
    }

    /**
     * Enter a sub-block whose id was just returned by {@link #advance()}.
     *
     * @param blockId The id of the block.
     * @throws BitcodeException If the block header is malformed.
     */
    void enterSubBlock(int blockId) throws BitcodeException;

    /**
     * Skip a sub-block whose id was just returned by {@link #advance()}.
     *
     * @throws BitcodeException If the block header is malformed, or the block runs past the end.
     */
    void skipBlock() throws BitcodeException;

    /**
     * Read the fields of a record.
     *
     * @param abbrevId The id returned by {@link #advance()}.
     * @param out      Where to put the fields, which is not cleared first.
     * @return The record code.
     * @throws BitcodeException If the record is malformed.
     */
    int readRecord(int abbrevId, Record out) throws BitcodeException;

    void skipRecord(int abbrevId) throws BitcodeException;

    /**
     * Read the definition of an abbreviation, adding it to the current block.
     *
     * @throws BitcodeException If the definition is malformed.
     */
    void readAbbrevRecord() throws BitcodeException;

    /**
     * Read a {@link BitCodes#BLOCKINFO_BLOCK_ID BLOCKINFO} block, whose id was just
     * returned by {@link #advance()}. Only the first is read, later ones are skipped.
     *
     * @throws BitcodeException If the block is malformed.
     */
    void readBlockInfoBlock() throws BitcodeException;

    boolean atEndOfStream() throws BitcodeException;

    long getCurrentBitNo();

    /**
     * Move to a bit position. The block nesting is not changed.
     *
     * @param bitNo The position.
     * @throws BitcodeException If the position is past the end of the stream.
     */
    void jumpToBit(long bitNo) throws BitcodeException;

    int getAbbrevIdWidth();

    /**
     * Capture the position, block nesting and abbreviations of this cursor.
     *
     * @return The mark.
     */
    Mark mark();

    /**
     * Restore a state captured by {@link #mark()}.
     *
     * @param mark The mark.
     */
    void reset(Mark mark);

    /**
     * An opaque saved cursor state.
     */
    interface Mark {
        long getBitNo();
    }
}
