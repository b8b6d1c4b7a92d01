package io.github.eutro.jbitcode.reader.bitstream;

/**
 * A {@link ByteSource} over an array that is entirely in memory.
 */
public final class ArrayByteSource implements ByteSource {
    private final byte[] bytes;
    private final int offset;
    private final int length;

    public ArrayByteSource(byte[] bytes) {
        this(bytes, 0, bytes.length);
    }

    public ArrayByteSource(byte[] bytes, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IndexOutOfBoundsException("region " + offset + "+" + length + " of " + bytes.length);
        }
        this.bytes = bytes;
        this.offset = offset;
        this.length = length;
    }

    public int size() {
        return length;
    }

    @Override
    public boolean isAvailable(long pos) {
        return pos >= 0 && pos < length;
    }

    @Override
    public int getByte(long pos) {
        if (!isAvailable(pos)) throw new IndexOutOfBoundsException("byte " + pos + " of " + length);
        return bytes[offset + (int) pos] & 0xFF;
    }

    @Override
    public boolean isComplete() {
        return true;
    }

    @Override
    public ByteSource slice(long offset, long length) {
        if (offset < 0 || length < 0 || offset + length > this.length) {
            throw new IndexOutOfBoundsException("region " + offset + "+" + length + " of " + this.length);
        }
        return new ArrayByteSource(bytes, this.offset + (int) offset, (int) length);
    }
}
