package io.github.eutro.jbitcode.reader.bitstream;

/**
 * One operand of an {@link Abbrev abbreviation}.
 */
public final class AbbrevOp {
    public enum Encoding {
        LITERAL,
        FIXED,
        VBR,
        ARRAY,
        CHAR6,
        BLOB,
    }

    public final Encoding encoding;
    /**
     * The literal value, or the bit width of a fixed or VBR field.
     */
    public final long value;

    public AbbrevOp(Encoding encoding, long value) {
        this.encoding = encoding;
        this.value = value;
    }

    public static AbbrevOp literal(long value) {
        return new AbbrevOp(Encoding.LITERAL, value);
    }

    public static AbbrevOp of(Encoding encoding) {
        return new AbbrevOp(encoding, 0);
    }

    public static AbbrevOp of(Encoding encoding, long width) {
        return new AbbrevOp(encoding, width);
    }

    /**
     * Decode the encoding number used in an abbreviation definition.
     *
     * @param code The number.
     * @return The encoding, or null if the number is not known.
     */
    static Encoding encodingOf(long code) {
        switch ((int) code) {
            case 1:
                return Encoding.FIXED;
            case 2:
                return Encoding.VBR;
            case 3:
                return Encoding.ARRAY;
            case 4:
                return Encoding.CHAR6;
            case 5:
                return Encoding.BLOB;
            default:
                return null;
        }
    }

    public boolean isScalar() {
        return encoding != Encoding.ARRAY && encoding != Encoding.BLOB;
    }

    public static char decodeChar6(long v) {
        if (v < 26) return (char) ('a' + v);
        if (v < 52) return (char) ('A' + v - 26);
        if (v < 62) return (char) ('0' + v - 52);
        return v == 62 ? '.' : '_';
    }

    @Override
    public String toString() {
        return encoding == Encoding.LITERAL || encoding == Encoding.FIXED || encoding == Encoding.VBR
                ? encoding + "(" + value + ")"
                : encoding.toString();
    }
}
