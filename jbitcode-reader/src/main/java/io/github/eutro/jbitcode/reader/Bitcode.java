package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.reader.bitstream.ArrayByteSource;
import io.github.eutro.jbitcode.reader.bitstream.ByteSource;
import io.github.eutro.jbitcode.reader.bitstream.StreamingByteSource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Entry points for reading containers, which take care of the optional wrapper header.
 * <p>
 * The wrapper header is five little-endian words: the magic {@code 0x0B17C0DE}, a version,
 * the offset and size of the container proper, and a CPU type. Anything outside the
 * enclosed region is ignored.
 */
public final class Bitcode {
    public static final int WRAPPER_MAGIC = 0x0B17C0DE;
    private static final int WRAPPER_HEADER_SIZE = 20;

    private Bitcode() {
    }

    /**
     * Open a reader over container bytes in memory.
     *
     * @param bytes   The container, possibly wrapped.
     * @param options The options.
     * @return A reader that has not read anything yet.
     * @throws BitcodeException If the bytes can't be a container, or the wrapper header is malformed.
     */
    public static BitcodeReader openReader(byte[] bytes, ReaderOptions options) throws BitcodeException {
        if ((bytes.length & 3) != 0) {
            throw new BitcodeException(ErrorKind.INVALID_SIGNATURE, "length " + bytes.length + " is not a multiple of 4");
        }
        ByteSource source;
        if (isWrapper(bytes)) {
            if (bytes.length < WRAPPER_HEADER_SIZE) {
                throw new BitcodeException(ErrorKind.INVALID_WRAPPER_HEADER, "header is cut off");
            }
            long offset = wordAt(bytes, 8);
            long size = wordAt(bytes, 12);
            if (offset + size > bytes.length) {
                throw new BitcodeException(ErrorKind.INVALID_WRAPPER_HEADER,
                        "container at " + offset + "+" + size + " runs past " + bytes.length + " bytes");
            }
            source = new ArrayByteSource(bytes, (int) offset, (int) size);
        } else {
            source = new ArrayByteSource(bytes);
        }
        return new BitcodeReader(source, options);
    }

    /**
     * Open a reader over a stream, which will only be read as far as needed.
     *
     * @param in      The container, possibly wrapped.
     * @param options The options.
     * @return A reader that has not read anything yet.
     * @throws BitcodeException If the stream doesn't start like a container.
     */
    public static BitcodeReader openReader(InputStream in, ReaderOptions options) throws BitcodeException {
        StreamingByteSource stream = new StreamingByteSource(in);
        byte[] head = new byte[16];
        try {
            if (!stream.isAvailable(head.length - 1)) {
                throw new BitcodeException(ErrorKind.INVALID_SIGNATURE, "stream is too short");
            }
            for (int i = 0; i < head.length; i++) {
                head[i] = (byte) stream.getByte(i);
            }
        } catch (IOException e) {
            throw new BitcodeException(ErrorKind.MALFORMED_BLOCK, "failed to read the stream", e);
        }
        if (isWrapper(head)) {
            return new BitcodeReader(stream.slice(wordAt(head, 8), wordAt(head, 12)), options);
        }
        if (!isRawContainer(head)) throw new BitcodeException(ErrorKind.INVALID_SIGNATURE);
        return new BitcodeReader(stream, options);
    }

    private static boolean isWrapper(byte[] bytes) {
        return bytes.length >= 4 && wordAt(bytes, 0) == (WRAPPER_MAGIC & 0xFFFFFFFFL);
    }

    private static boolean isRawContainer(byte[] bytes) {
        return bytes.length >= 4
                && bytes[0] == 'B'
                && bytes[1] == 'C'
                && (bytes[2] & 0xFF) == 0xC0
                && (bytes[3] & 0xFF) == 0xDE;
    }

    private static long wordAt(byte[] bytes, int pos) {
        return (bytes[pos] & 0xFFL)
                | (bytes[pos + 1] & 0xFFL) << 8
                | (bytes[pos + 2] & 0xFFL) << 16
                | (bytes[pos + 3] & 0xFFL) << 24;
    }

    /**
     * Read a module without its function bodies, which are read on demand by the
     * {@link ReaderExts#MATERIALIZER materializer} attached to it.
     *
     * @param bytes   The container.
     * @param options The options.
     * @return The module.
     * @throws BitcodeException If the container is malformed.
     */
    public static Module getLazyModule(byte[] bytes, ReaderOptions options) throws BitcodeException {
        return openReader(bytes, options).readModule();
    }

    public static Module getLazyModule(byte[] bytes) throws BitcodeException {
        return getLazyModule(bytes, ReaderOptions.DEFAULT);
    }

    /**
     * Like {@link #getLazyModule(byte[], ReaderOptions)}, but reading a stream as far as needed.
     *
     * @param in      The container.
     * @param options The options.
     * @return The module.
     * @throws BitcodeException If the container is malformed.
     */
    public static Module getStreamedModule(InputStream in, ReaderOptions options) throws BitcodeException {
        return openReader(in, options).readModule();
    }

    /**
     * Read a whole module, including every function body.
     *
     * @param bytes   The container.
     * @param options The options.
     * @return The module, which no longer refers to the container.
     * @throws BitcodeException If the container is malformed.
     */
    public static Module parseModule(byte[] bytes, ReaderOptions options) throws BitcodeException {
        try (BitcodeReader reader = openReader(bytes, options)) {
            Module module = reader.readModule();
            reader.materializeAll();
            return module;
        }
    }

    public static Module parseModule(byte[] bytes) throws BitcodeException {
        return parseModule(bytes, ReaderOptions.DEFAULT);
    }

    /**
     * Read only the target triple of a container.
     *
     * @param bytes The container.
     * @return The triple, or the empty string if there is none.
     * @throws BitcodeException If the container is malformed.
     */
    public static String readTargetTriple(byte[] bytes) throws BitcodeException {
        try (BitcodeReader reader = openReader(bytes, ReaderOptions.DEFAULT)) {
            return reader.readTriple();
        }
    }
}
