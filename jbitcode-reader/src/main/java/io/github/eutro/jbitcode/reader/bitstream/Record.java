package io.github.eutro.jbitcode.reader.bitstream;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A reusable buffer for the fields of a record.
 */
public final class Record {
    private long[] fields = new long[64];
    private int size;

    public void clear() {
        size = 0;
    }

    public void add(long field) {
        if (size == fields.length) fields = Arrays.copyOf(fields, size * 2);
        fields[size++] = field;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public long get(int i) {
        if (i < 0 || i >= size) throw new IndexOutOfBoundsException("field " + i + " of " + size);
        return fields[i];
    }

    /**
     * Get a field as a non-negative int, for use as an index.
     *
     * @param i The field number.
     * @return The field, or -1 if it doesn't fit in an int.
     */
    public int getIndex(int i) {
        long v = get(i);
        return v < 0 || v > Integer.MAX_VALUE ? -1 : (int) v;
    }

    public boolean getBool(int i) {
        return get(i) != 0;
    }

    /**
     * Read fields as the bytes of a UTF-8 string.
     *
     * @param from The first field.
     * @return The string.
     */
    public String getString(int from) {
        return getString(from, size - from);
    }

    /**
     * Read fields as the bytes of a UTF-8 string.
     *
     * @param from   The first field.
     * @param length The number of fields.
     * @return The string.
     */
    public String getString(int from, int length) {
        if (from < 0 || length < 0 || from + length > size) {
            throw new IndexOutOfBoundsException("fields " + from + "+" + length + " of " + size);
        }
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) fields[from + i];
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public long[] toArray() {
        return Arrays.copyOf(fields, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
