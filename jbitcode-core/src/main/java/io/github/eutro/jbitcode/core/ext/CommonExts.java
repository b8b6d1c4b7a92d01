package io.github.eutro.jbitcode.core.ext;

import io.github.eutro.jbitcode.core.ir.*;
import io.github.eutro.jbitcode.core.ir.Module;

/**
 * A collection of {@link Ext}s that are attached to IR nodes.
 * <p>
 * The ownership exts are stored in fields by the nodes they are attached to,
 * so looking them up is as fast as a field access.
 */
public class CommonExts {
    /**
     * Attached to a {@link BasicBlock} or {@link Argument}. The function it belongs to.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");

    /**
     * Attached to an {@link Instruction}. The block it is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    /**
     * Attached to a {@link GlobalValue}. The module it is in.
     */
    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");

    /**
     * Attached to an {@link Instruction}. Its source location.
     */
    public static final Ext<DebugLoc> DEBUG_LOC = Ext.create(DebugLoc.class, "DEBUG_LOC");

    /**
     * Attached to a placeholder, if placeholder tracking is enabled.
     * Where the placeholder was created.
     */
    public static final Ext<Throwable> CREATED_AT = Ext.create(Throwable.class, "CREATED_AT");
}
