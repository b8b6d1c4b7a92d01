package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ext.Ext;
import io.github.eutro.jbitcode.core.ir.Module;

/**
 * {@link Ext}s the reader attaches to the graphs it produces.
 */
public class ReaderExts {
    /**
     * Attached to a {@link Module} read lazily, until its reader is closed.
     * What reads the bodies of its functions.
     */
    public static final Ext<Materializer> MATERIALIZER = Ext.create(Materializer.class, "MATERIALIZER");
}
