package io.github.eutro.jbitcode.reader.bitstream;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * A {@link ByteSource} that pulls bytes from an {@link InputStream} only as they are needed.
 * <p>
 * Fetched bytes are kept, so earlier positions can be revisited.
 */
public final class StreamingByteSource implements ByteSource {
    private static final int CHUNK = 4096;

    private final InputStream in;
    private byte[] buf = new byte[CHUNK];
    private int fetched;
    private boolean eof;

    public StreamingByteSource(InputStream in) {
        this.in = in;
    }

    private void fetchUntil(long pos) throws IOException {
        while (!eof && fetched <= pos) {
            if (fetched == buf.length) {
                if (buf.length > Integer.MAX_VALUE / 2) throw new IOException("stream too large");
                buf = Arrays.copyOf(buf, buf.length * 2);
            }
            int read = in.read(buf, fetched, Math.min(CHUNK, buf.length - fetched));
            if (read == -1) {
                eof = true;
            } else {
                fetched += read;
            }
        }
    }

    /**
     * Get the number of bytes fetched from the stream so far.
     *
     * @return The count.
     */
    public int getFetched() {
        return fetched;
    }

    @Override
    public boolean isAvailable(long pos) throws IOException {
        if (pos < 0 || pos >= Integer.MAX_VALUE) return false;
        fetchUntil(pos);
        return pos < fetched;
    }

    @Override
    public int getByte(long pos) throws IOException {
        if (!isAvailable(pos)) throw new IOException("unexpected end of stream at byte " + pos);
        return buf[(int) pos] & 0xFF;
    }

    @Override
    public boolean isComplete() {
        return false;
    }
}
