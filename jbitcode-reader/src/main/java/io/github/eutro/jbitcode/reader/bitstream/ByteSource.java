package io.github.eutro.jbitcode.reader.bitstream;

import java.io.IOException;

/**
 * Random access to the bytes of a container, which need not all be available up front.
 */
public interface ByteSource {
    /**
     * Whether a byte exists at the given position, fetching more of the source if needed.
     *
     * @param pos The position.
     * @return Whether the byte can be read.
     * @throws IOException If fetching fails.
     */
    boolean isAvailable(long pos) throws IOException;

    /**
     * Read one byte.
     *
     * @param pos The position, which must be {@link #isAvailable(long) available}.
     * @return The byte, from 0 to 255.
     * @throws IOException If fetching fails.
     */
    int getByte(long pos) throws IOException;

    /**
     * Whether the whole source is in memory, so its size is known without fetching.
     *
     * @return Whether the source is finite and complete.
     */
    boolean isComplete();

    /**
     * Get a view of part of this source, with positions relative to {@code offset}.
     *
     * @param offset The first byte of the view.
     * @param length The number of bytes in the view.
     * @return The view.
     */
    default ByteSource slice(long offset, long length) {
        ByteSource parent = this;
        return new ByteSource() {
            @Override
            public boolean isAvailable(long pos) throws IOException {
                return pos >= 0 && pos < length && parent.isAvailable(offset + pos);
            }

            @Override
            public int getByte(long pos) throws IOException {
                return parent.getByte(offset + pos);
            }

            @Override
            public boolean isComplete() {
                return parent.isComplete();
            }
        };
    }
}
