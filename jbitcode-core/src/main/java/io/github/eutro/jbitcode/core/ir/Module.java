package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ext.ExtHolder;
import io.github.eutro.jbitcode.core.ext.TrackedList;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A module, encapsulating its global variables, functions, aliases and module-level metadata.
 */
public final class Module extends ExtHolder {
    /**
     * The metadata kinds every module knows about, with fixed ids.
     */
    public static final int MD_DBG = 0, MD_TBAA = 1, MD_PROF = 2, MD_FPMATH = 3, MD_RANGE = 4;

    private final Context context = new Context();

    @Nullable
    private String targetTriple;
    @Nullable
    private String dataLayout;
    private String moduleAsm = "";
    private final List<String> dependentLibraries = new ArrayList<>();

    public final List<GlobalVariable> globals = ownedList();
    public final List<Function> functions = ownedList();
    public final List<GlobalAlias> aliases = ownedList();

    private final Map<String, NamedMDNode> namedMetadata = new LinkedHashMap<>();
    private final List<String> mdKindNames = new ArrayList<>(Arrays.asList("dbg", "tbaa", "prof", "fpmath", "range"));
    private final List<StructType> identifiedStructs = new ArrayList<>();

    private <T extends GlobalValue> List<T> ownedList() {
        return new TrackedList<T>(new ArrayList<>()) {
            @Override
            protected void onAdded(T elt) {
                elt.attachExt(CommonExts.OWNING_MODULE, Module.this);
            }

            @Override
            protected void onRemoved(T elt) {
                elt.removeExt(CommonExts.OWNING_MODULE);
            }
        };
    }

    /**
     * Get the context that owns the uniqued constants of this module.
     *
     * @return The context.
     */
    public Context getContext() {
        return context;
    }

    public @Nullable String getTargetTriple() {
        return targetTriple;
    }

    public void setTargetTriple(@Nullable String targetTriple) {
        this.targetTriple = targetTriple;
    }

    public @Nullable String getDataLayout() {
        return dataLayout;
    }

    public void setDataLayout(@Nullable String dataLayout) {
        this.dataLayout = dataLayout;
    }

    public String getModuleAsm() {
        return moduleAsm;
    }

    public void setModuleAsm(String moduleAsm) {
        this.moduleAsm = moduleAsm;
    }

    /**
     * Append a line of module-level inline assembly.
     *
     * @param asm The text.
     */
    public void appendModuleAsm(String asm) {
        moduleAsm = moduleAsm.isEmpty() ? asm : moduleAsm + "\n" + asm;
    }

    public List<String> getDependentLibraries() {
        return dependentLibraries;
    }

    public @Nullable Function getFunction(String name) {
        for (Function function : functions) {
            if (name.equals(function.getName())) return function;
        }
        return null;
    }

    public @Nullable GlobalVariable getGlobalVariable(String name) {
        for (GlobalVariable global : globals) {
            if (name.equals(global.getName())) return global;
        }
        return null;
    }

    /**
     * Get the named metadata list with the given name, creating it if it doesn't exist.
     *
     * @param name The name.
     * @return The list.
     */
    public NamedMDNode getOrInsertNamedMetadata(String name) {
        return namedMetadata.computeIfAbsent(name, NamedMDNode::new);
    }

    public @Nullable NamedMDNode getNamedMetadata(String name) {
        return namedMetadata.get(name);
    }

    public Collection<NamedMDNode> getNamedMetadata() {
        return Collections.unmodifiableCollection(namedMetadata.values());
    }

    /**
     * Get the id of a metadata kind, registering it if it is new.
     *
     * @param name The kind name.
     * @return The id.
     */
    public int getMDKindID(String name) {
        int id = mdKindNames.indexOf(name);
        if (id != -1) return id;
        mdKindNames.add(name);
        return mdKindNames.size() - 1;
    }

    /**
     * Get the names of every registered metadata kind, indexed by id.
     *
     * @return The names.
     */
    public List<String> getMDKindNames() {
        return Collections.unmodifiableList(mdKindNames);
    }

    /**
     * Get the struct types with identity (named or opaque) that were created for this module,
     * in creation order.
     *
     * @return The struct types.
     */
    public List<StructType> getIdentifiedStructTypes() {
        return identifiedStructs;
    }

    @Override
    public String toString() {
        return "module(" + globals.size() + " globals, " + functions.size() + " functions, "
                + aliases.size() + " aliases)";
    }
}
