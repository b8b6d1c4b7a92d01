package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A stand-in for a constant that has been referenced but not yet read.
 * <p>
 * Placeholders are never uniqued, and are ordered by a serial number assigned at
 * creation, so a set of them can be sorted and binary searched.
 */
public final class ConstantPlaceholder extends Constant implements Comparable<ConstantPlaceholder> {
    private static final AtomicLong SERIAL = new AtomicLong();

    private final long serial = SERIAL.getAndIncrement();

    public ConstantPlaceholder(Type type) {
        super(type);
    }

    public long getSerial() {
        return serial;
    }

    @Override
    public int compareTo(ConstantPlaceholder o) {
        return Long.compare(serial, o.serial);
    }

    @Override
    public String toString() {
        return getType() + " <placeholder #" + serial + ">";
    }
}
