package io.github.eutro.jbitcode.reader.bitstream;

/**
 * What a {@link BitstreamCursor} found when {@link BitstreamCursor#advance() advancing}.
 */
public final class BitstreamEntry {
    public enum Kind {
        /**
         * The current block ended, and the cursor is back in the parent block.
         */
        END_BLOCK,
        /**
         * A sub-block starts. Its id has been read, and it must be entered or skipped next.
         */
        SUB_BLOCK,
        /**
         * A record, whose abbreviation id is given, must be read or skipped next.
         */
        RECORD,
    }

    private static final BitstreamEntry END = new BitstreamEntry(Kind.END_BLOCK, 0);

    public final Kind kind;
    public final int id;

    private BitstreamEntry(Kind kind, int id) {
        this.kind = kind;
        this.id = id;
    }

    public static BitstreamEntry endBlock() {
        return END;
    }

    public static BitstreamEntry subBlock(int id) {
        return new BitstreamEntry(Kind.SUB_BLOCK, id);
    }

    public static BitstreamEntry record(int abbrevId) {
        return new BitstreamEntry(Kind.RECORD, abbrevId);
    }

    @Override
    public String toString() {
        return kind == Kind.END_BLOCK ? kind.toString() : kind + "(" + id + ")";
    }
}
