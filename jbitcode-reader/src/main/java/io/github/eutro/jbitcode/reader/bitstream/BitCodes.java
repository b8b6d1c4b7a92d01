package io.github.eutro.jbitcode.reader.bitstream;

/**
 * The fixed codes of the generic bitstream layer.
 */
public final class BitCodes {
    private BitCodes() {
    }

    // builtin abbreviation ids
    public static final int END_BLOCK = 0;
    public static final int ENTER_SUBBLOCK = 1;
    public static final int DEFINE_ABBREV = 2;
    public static final int UNABBREV_RECORD = 3;
    public static final int FIRST_APPLICATION_ABBREV = 4;

    public static final int BLOCKINFO_BLOCK_ID = 0;

    public static final int BLOCKINFO_CODE_SETBID = 1;
    public static final int BLOCKINFO_CODE_BLOCKNAME = 2;
    public static final int BLOCKINFO_CODE_SETRECORDNAME = 3;

    // field widths
    public static final int BLOCK_ID_WIDTH = 8;
    public static final int CODE_LEN_WIDTH = 4;
    public static final int BLOCK_SIZE_WIDTH = 32;
    public static final int TOP_LEVEL_ABBREV_WIDTH = 2;
}
