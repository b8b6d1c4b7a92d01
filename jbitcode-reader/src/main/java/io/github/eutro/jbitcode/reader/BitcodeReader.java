package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.GlobalAlias;
import io.github.eutro.jbitcode.core.ir.GlobalVariable;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.passes.UpgradeIntrinsics;
import io.github.eutro.jbitcode.reader.bitstream.BasicBitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitCodes;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.ByteSource;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads one module from a container, and then the bodies of its functions on demand.
 * <p>
 * {@link #readModule()} reads everything but the function bodies, recording where each
 * body starts. Bodies are then read by {@link #materialize(Function)}, and can be dropped
 * and read again later. If the bytes are streamed, reading the module stops at the first
 * function body, and carries on as far as needed whenever a later body is asked for.
 * <p>
 * A reader is not thread-safe, since every read moves the same cursor.
 */
public final class BitcodeReader implements Materializer, Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(BitcodeReader.class);

    private final ReaderOptions options;
    private final boolean streaming;
    private @Nullable BitstreamCursor cursor;

    private final Module module = new Module();
    private final TypeTable types = new TypeTable(module.getIdentifiedStructTypes());
    private final LegacyTypeTableReader legacyTypes = new LegacyTypeTableReader(types);
    private final AttributeTable attributes = new AttributeTable();
    private final ValueTable values;
    private final MetadataTable metadata;
    private final BlockAddresses blockAddresses = new BlockAddresses(module);
    private final ConstantsReader constants;
    private final SymbolTableReader symbols;
    private final FunctionBodyReader bodies;
    private final UpgradeIntrinsics upgrader = new UpgradeIntrinsics();

    private final List<String> sections = new ArrayList<>();
    private final List<String> gcs = new ArrayList<>();
    private final List<Pending<GlobalVariable>> globalInits = new ArrayList<>();
    private final List<Pending<GlobalAlias>> aliasInits = new ArrayList<>();
    private final List<Function> functionsWithBodies = new ArrayList<>();
    private final Map<Function, Long> deferred = new IdentityHashMap<>();

    private boolean seenModule;
    private boolean seenFirstFunctionBody;
    private boolean seenValueSymbolTable;
    /**
     * Where to carry on reading the module block, if reading it stopped early, or -1 once
     * it has been read to the end.
     */
    private long nextUnreadBit = -1;

    /**
     * Create a reader over container bytes, without the wrapper header.
     *
     * @param source  The bytes.
     * @param options The options.
     */
    public BitcodeReader(ByteSource source, ReaderOptions options) {
        this.options = options;
        this.streaming = !source.isComplete();
        this.cursor = new BasicBitstreamCursor(source);
        values = new ValueTable(options.isTrackPlaceholders());
        metadata = new MetadataTable(module, types, values);
        constants = new ConstantsReader(module.getContext(), types, values, blockAddresses);
        symbols = new SymbolTableReader(values);
        bodies = new FunctionBodyReader(module, types, attributes, values, metadata, constants, symbols, blockAddresses);
    }

    public ReaderOptions getOptions() {
        return options;
    }

    public Module getModule() {
        return module;
    }

    ValueTable getValueTable() {
        return values;
    }

    private BitstreamCursor cursor() {
        if (cursor == null) throw new IllegalStateException("reader is closed");
        return cursor;
    }

    private void readSignature(BitstreamCursor cursor) throws BitcodeException {
        try {
            if (cursor.read(8) != 'B'
                    || cursor.read(8) != 'C'
                    || cursor.read(4) != 0x0
                    || cursor.read(4) != 0xC
                    || cursor.read(4) != 0xE
                    || cursor.read(4) != 0xD) {
                throw new BitcodeException(ErrorKind.INVALID_SIGNATURE);
            }
        } catch (BitcodeException e) {
            if (e.getKind() == ErrorKind.INVALID_SIGNATURE) throw e;
            throw new BitcodeException(ErrorKind.INVALID_SIGNATURE, "container is too short", e);
        }
    }

    /**
     * Read the module, except for the function bodies, unless the reader is not
     * {@link ReaderOptions#isLazy() lazy}.
     * <p>
     * The module is given this reader as its {@link ReaderExts#MATERIALIZER materializer}.
     *
     * @return The module.
     * @throws BitcodeException If the container is malformed.
     */
    public Module readModule() throws BitcodeException {
        BitstreamCursor cursor = cursor();
        if (seenModule) throw new IllegalStateException("module was already read");
        readSignature(cursor);

        parseTopLevel(cursor);
        if (!seenModule) {
            // nothing to materialize, but the module is still usable
            LOG.debug("Container has no module block");
        }
        module.attachExt(ReaderExts.MATERIALIZER, this);
        if (!options.isLazy()) materializeAll();
        return module;
    }

    private void parseTopLevel(BitstreamCursor cursor) throws BitcodeException {
        while (true) {
            if (cursor.atEndOfStream()) return;
            BitstreamEntry entry = cursor.advance(BitstreamCursor.AF_DONT_AUTOPROCESS_ABBREVS
                    | BitstreamCursor.AF_DONT_POP_BLOCK_AT_END);
            switch (entry.kind) {
                case END_BLOCK:
                    return;
                case SUB_BLOCK:
                    switch (entry.id) {
                        case BitCodes.BLOCKINFO_BLOCK_ID:
                            cursor.readBlockInfoBlock();
                            break;
                        case BitcodeCodes.MODULE_BLOCK_ID:
                            if (seenModule) {
                                throw new BitcodeException(ErrorKind.INVALID_MULTIPLE_BLOCKS, "second module block");
                            }
                            seenModule = true;
                            parseModule(cursor, false);
                            if (nextUnreadBit != -1) return;
                            break;
                        default:
                            LOG.debug("Skipping top-level block {}", entry.id);
                            cursor.skipBlock();
                            break;
                    }
                    break;
                case RECORD:
                    // archive tools may pad a member with newlines up to a multiple of 8 bytes
                    if (cursor.getAbbrevIdWidth() == BitCodes.TOP_LEVEL_ABBREV_WIDTH
                            && entry.id == BitCodes.DEFINE_ABBREV
                            && cursor.read(6) == 2
                            && cursor.read(24) == 0xa0a0a
                            && cursor.atEndOfStream()) {
                        return;
                    }
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "record at top level");
            }
        }
    }

    private void resumeModule(BitstreamCursor cursor) throws BitcodeException {
        parseModule(cursor, true);
        // the module ended, so whatever follows it is checked as in a buffered read
        if (nextUnreadBit == -1) parseTopLevel(cursor);
    }

    private void parseModule(BitstreamCursor cursor, boolean resume) throws BitcodeException {
        if (resume) {
            LOG.debug("Resuming module at bit {}", nextUnreadBit);
            cursor.jumpToBit(nextUnreadBit);
            nextUnreadBit = -1;
        } else {
            cursor.enterSubBlock(BitcodeCodes.MODULE_BLOCK_ID);
        }

        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advance();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) {
                finishModule();
                return;
            }
            if (entry.kind == BitstreamEntry.Kind.SUB_BLOCK) {
                if (parseModuleSubBlock(cursor, entry.id)) return;
                continue;
            }

            record.clear();
            int code = cursor.readRecord(entry.id, record);
            try {
                parseModuleRecord(code, record);
            } catch (IndexOutOfBoundsException e) {
                throw new BitcodeException(ErrorKind.INVALID_RECORD, "module record " + code + " " + record, e);
            }
        }
    }

    /**
     * @return Whether to stop reading the module here.
     */
    private boolean parseModuleSubBlock(BitstreamCursor cursor, int id) throws BitcodeException {
        switch (id) {
            case BitCodes.BLOCKINFO_BLOCK_ID:
                cursor.readBlockInfoBlock();
                break;
            case BitcodeCodes.PARAMATTR_BLOCK_ID:
                attributes.parseBlock(cursor);
                break;
            case BitcodeCodes.TYPE_BLOCK_ID_NEW:
                types.parseBlock(cursor);
                break;
            case BitcodeCodes.TYPE_BLOCK_ID_OLD:
                legacyTypes.parseTypeTable(cursor);
                break;
            case BitcodeCodes.TYPE_SYMTAB_BLOCK_ID_OLD:
                legacyTypes.parseTypeSymbolTable(cursor);
                break;
            case BitcodeCodes.VALUE_SYMTAB_BLOCK_ID:
                symbols.parseBlock(cursor, null);
                seenValueSymbolTable = true;
                break;
            case BitcodeCodes.CONSTANTS_BLOCK_ID:
                constants.parseBlock(cursor);
                resolveGlobalAndAliasInits();
                break;
            case BitcodeCodes.METADATA_BLOCK_ID:
                metadata.parseBlock(cursor);
                break;
            case BitcodeCodes.FUNCTION_BLOCK_ID:
                if (!seenFirstFunctionBody) {
                    Collections.reverse(functionsWithBodies);
                    globalCleanup();
                    seenFirstFunctionBody = true;
                }
                rememberAndSkipFunctionBody(cursor);
                // bodies come last, so with a symbol table already read, nothing else is needed yet
                if (streaming && seenValueSymbolTable) {
                    nextUnreadBit = cursor.getCurrentBitNo();
                    LOG.debug("Suspending module at bit {}", nextUnreadBit);
                    return true;
                }
                break;
            default:
                LOG.debug("Skipping module block {}", id);
                cursor.skipBlock();
                break;
        }
        return false;
    }

    private void parseModuleRecord(int code, Record record) throws BitcodeException {
        switch (code) {
            case BitcodeCodes.MODULE_CODE_VERSION: // [version#]
                TypeTable.requireSize(record, 1);
                if (record.get(0) != 0) throw new BitcodeException(ErrorKind.INVALID_VALUE, "version " + record.get(0));
                break;
            case BitcodeCodes.MODULE_CODE_TRIPLE: // [strchr x N]
                module.setTargetTriple(record.getString(0));
                break;
            case BitcodeCodes.MODULE_CODE_DATALAYOUT: // [strchr x N]
                module.setDataLayout(record.getString(0));
                break;
            case BitcodeCodes.MODULE_CODE_ASM: // [strchr x N]
                module.appendModuleAsm(record.getString(0));
                break;
            case BitcodeCodes.MODULE_CODE_DEPLIB: // [strchr x N]
                LOG.debug("Ignoring dependent library {}", record.getString(0));
                break;
            case BitcodeCodes.MODULE_CODE_SECTIONNAME: // [strchr x N]
                sections.add(record.getString(0));
                break;
            case BitcodeCodes.MODULE_CODE_GCNAME: // [strchr x N]
                gcs.add(record.getString(0));
                break;
            case BitcodeCodes.MODULE_CODE_GLOBALVAR:
                readGlobalVar(record);
                break;
            case BitcodeCodes.MODULE_CODE_FUNCTION:
                readFunction(record);
                break;
            case BitcodeCodes.MODULE_CODE_ALIAS:
                readAlias(record);
                break;
            case BitcodeCodes.MODULE_CODE_PURGEVALS: // [numvals]
                if (record.isEmpty() || record.get(0) > values.size()) {
                    throw new BitcodeException(ErrorKind.INVALID_RECORD, "purging to " + record + " of " + values.size());
                }
                values.shrinkTo((int) record.get(0));
                break;
            default:
                LOG.warn("Skipping unknown module record {}", code);
                break;
        }
    }

    private @Nullable String section(long ref) throws BitcodeException {
        if (ref == 0) return null;
        if (ref - 1 >= sections.size()) {
            throw new BitcodeException(ErrorKind.INVALID_ID, "section " + ref + " of " + sections.size());
        }
        return sections.get((int) ref - 1);
    }

    private Type requireType(long id) throws BitcodeException {
        Type type = types.get(id);
        if (type == null) throw new BitcodeException(ErrorKind.INVALID_RECORD, "type " + id);
        return type;
    }

    // [ty, isconst, initid, linkage, alignment, section, visibility, threadlocal, unnamed_addr]
    private void readGlobalVar(Record record) throws BitcodeException {
        TypeTable.requireSize(record, 6);
        Type type = requireType(record.get(0));
        long flags = record.get(1);
        Type valueType;
        int addressSpace;
        if ((flags & 2) != 0) {
            valueType = type;
            addressSpace = TypeTable.addressSpace(flags >>> 2);
        } else {
            if (!(type instanceof PointerType)) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, "global of type " + type);
            }
            valueType = ((PointerType) type).getElementType();
            addressSpace = ((PointerType) type).getAddressSpace();
        }

        GlobalVariable global = new GlobalVariable(valueType, addressSpace, (flags & 1) != 0,
                Decoders.linkage(record.get(3)), null, null);
        global.setAlignment(Decoders.alignment(record.get(4)));
        global.setSection(section(record.get(5)));
        if (record.size() > 6) global.setVisibility(Decoders.visibility(record.get(6)));
        if (record.size() > 7) global.setThreadLocalMode(Decoders.threadLocalMode(record.get(7)));
        if (record.size() > 8) global.setUnnamedAddr(record.getBool(8));
        module.globals.add(global);
        values.push(global);

        long initId = record.get(2);
        if (initId != 0) globalInits.add(new Pending<>(global, initId - 1));
    }

    // [type, callingconv, isproto, linkage, paramattr, alignment, section, visibility, gc, unnamed_addr]
    private void readFunction(Record record) throws BitcodeException {
        TypeTable.requireSize(record, 8);
        Type type = requireType(record.get(0));
        if (!(type instanceof PointerType) || !(((PointerType) type).getElementType() instanceof FunctionType)) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, "function of type " + type);
        }

        Function function = new Function((PointerType) type, Decoders.linkage(record.get(3)), null);
        function.setCallingConv((int) record.get(1));
        function.setAttributes(attributes.get(record.get(4)));
        function.setAlignment(Decoders.alignment(record.get(5)));
        function.setSection(section(record.get(6)));
        function.setVisibility(Decoders.visibility(record.get(7)));
        if (record.size() > 8 && record.get(8) != 0) {
            long gc = record.get(8);
            if (gc - 1 >= gcs.size()) throw new BitcodeException(ErrorKind.INVALID_ID, "gc " + gc + " of " + gcs.size());
            function.setGC(gcs.get((int) gc - 1));
        }
        if (record.size() > 9) function.setUnnamedAddr(record.getBool(9));
        module.functions.add(function);
        values.push(function);

        boolean isProto = record.getBool(2);
        if (!isProto) {
            functionsWithBodies.add(function);
            if (streaming) deferred.put(function, 0L);
        }
    }

    // [alias type, aliasee val#, linkage, visibility?]
    private void readAlias(Record record) throws BitcodeException {
        TypeTable.requireSize(record, 3);
        Type type = requireType(record.get(0));
        if (!(type instanceof PointerType)) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, "alias of type " + type);
        }
        GlobalAlias alias = new GlobalAlias((PointerType) type, Decoders.linkage(record.get(2)), null, null);
        if (record.size() > 3) alias.setVisibility(Decoders.visibility(record.get(3)));
        module.aliases.add(alias);
        values.push(alias);
        aliasInits.add(new Pending<>(alias, record.get(1)));
    }

    private void resolveGlobalAndAliasInits() throws BitcodeException {
        for (Iterator<Pending<GlobalVariable>> it = globalInits.iterator(); it.hasNext(); ) {
            Pending<GlobalVariable> pending = it.next();
            if (pending.valueId >= values.size()) continue;
            try {
                pending.global.setInitializer(initializer(pending.valueId));
            } catch (IllegalArgumentException e) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, e.getMessage(), e);
            }
            it.remove();
        }
        for (Iterator<Pending<GlobalAlias>> it = aliasInits.iterator(); it.hasNext(); ) {
            Pending<GlobalAlias> pending = it.next();
            if (pending.valueId >= values.size()) continue;
            try {
                pending.global.setAliasee(initializer(pending.valueId));
            } catch (IllegalArgumentException e) {
                throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, e.getMessage(), e);
            }
            it.remove();
        }
    }

    private Constant initializer(long valueId) throws BitcodeException {
        Value value = values.get(valueId);
        if (!(value instanceof Constant)) {
            throw new BitcodeException(ErrorKind.EXPECTED_CONSTANT, "initializer " + valueId + " is " + value);
        }
        return (Constant) value;
    }

    private void globalCleanup() throws BitcodeException {
        resolveGlobalAndAliasInits();
        if (!globalInits.isEmpty() || !aliasInits.isEmpty()) {
            throw new BitcodeException(ErrorKind.MALFORMED_GLOBAL_INITIALIZER_SET,
                    globalInits.size() + " initializers and " + aliasInits.size() + " aliasees were never read");
        }
        for (GlobalAlias alias : module.aliases) {
            if (alias.resolveAliasedGlobal() == null) {
                throw new BitcodeException(ErrorKind.INVALID_ALIASEE, "alias " + alias);
            }
        }
        if (options.isUpgradeIntrinsics()) {
            for (Function function : new ArrayList<>(module.functions)) {
                if (upgrader.getUpgraded().containsKey(function)) continue;
                Function upgraded = upgrader.upgradeDeclaration(function);
                if (upgraded != null) LOG.debug("Upgrading intrinsic {}", upgraded.getName());
            }
        }
    }

    private void finishModule() throws BitcodeException {
        int placeholder = values.findValuePlaceholder(0);
        if (placeholder != -1) {
            Value value = values.get(placeholder);
            throw value == null
                    ? new BitcodeException(ErrorKind.UNRESOLVED_FORWARD_REFERENCE, "value " + placeholder)
                    : values.placeholderError(ErrorKind.UNRESOLVED_FORWARD_REFERENCE, value,
                    "value " + placeholder + " at the end of the module");
        }
        int temporary = metadata.findTemporary(0);
        if (temporary != -1) {
            throw new BitcodeException(ErrorKind.UNRESOLVED_FORWARD_REFERENCE,
                    "metadata " + temporary + " at the end of the module");
        }
        globalCleanup();
        nextUnreadBit = -1;
    }

    private void rememberAndSkipFunctionBody(BitstreamCursor cursor) throws BitcodeException {
        if (functionsWithBodies.isEmpty()) {
            throw new BitcodeException(ErrorKind.INSUFFICIENT_FUNCTION_PROTOS, "more bodies than function records");
        }
        Function function = functionsWithBodies.remove(functionsWithBodies.size() - 1);
        long bit = cursor.getCurrentBitNo();
        deferred.put(function, bit);
        LOG.debug("Body of {} is at bit {}", describe(function), bit);

        if (!options.isLazy() && options.isEagerInlineWhenSafe() && !streaming && seenValueSymbolTable) {
            bodies.parse(cursor, function);
            upgrader.upgradeCallsIn(function);
            return;
        }
        cursor.skipBlock();
    }

    private static String describe(Function function) {
        return function.hasName() ? "@" + function.getName() : "an unnamed function";
    }

    /**
     * Read the target triple of the module, skipping everything else.
     *
     * @return The triple, or the empty string if the module has none.
     * @throws BitcodeException If the container is malformed.
     */
    public String readTriple() throws BitcodeException {
        BitstreamCursor cursor = cursor();
        if (seenModule) throw new IllegalStateException("module was already read");
        readSignature(cursor);
        while (true) {
            if (cursor.atEndOfStream()) return "";
            BitstreamEntry entry = cursor.advance();
            switch (entry.kind) {
                case END_BLOCK:
                    return "";
                case SUB_BLOCK:
                    if (entry.id == BitcodeCodes.MODULE_BLOCK_ID) return readModuleTriple(cursor);
                    cursor.skipBlock();
                    break;
                case RECORD:
                    cursor.skipRecord(entry.id);
                    break;
            }
        }
    }

    private static String readModuleTriple(BitstreamCursor cursor) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.MODULE_BLOCK_ID);
        String triple = "";
        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advanceSkippingSubblocks();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) return triple;
            record.clear();
            if (cursor.readRecord(entry.id, record) == BitcodeCodes.MODULE_CODE_TRIPLE) {
                triple = record.getString(0);
            }
        }
    }

    @Override
    public boolean isMaterializable(Function function) {
        return function.isDeclaration() && deferred.containsKey(function);
    }

    @Override
    public void materialize(Function function) throws BitcodeException {
        if (!isMaterializable(function)) return;
        BitstreamCursor cursor = cursor();

        Long bit = deferred.get(function);
        while (bit == 0) {
            if (nextUnreadBit == -1) {
                throw new BitcodeException(ErrorKind.COULD_NOT_FIND_FUNCTION_IN_STREAM, describe(function));
            }
            resumeModule(cursor);
            bit = deferred.get(function);
        }

        LOG.debug("Materializing {}", describe(function));
        BitstreamCursor.Mark mark = cursor.mark();
        try {
            cursor.jumpToBit(bit);
            bodies.parse(cursor, function);
        } catch (BitcodeException e) {
            blockAddresses.deleteBody(function);
            throw e;
        } finally {
            cursor.reset(mark);
        }
        upgrader.upgradeCallsIn(function);
    }

    @Override
    public boolean isDematerializable(Function function) {
        return !function.isDeclaration() && deferred.containsKey(function);
    }

    @Override
    public void dematerialize(Function function) {
        if (!deferred.containsKey(function)) {
            throw new IllegalStateException(describe(function) + " has no body to read again");
        }
        if (function.isDeclaration()) return;
        LOG.debug("Dematerializing {}", describe(function));
        blockAddresses.deleteBody(function);
    }

    @Override
    public void materializeAll() throws BitcodeException {
        BitstreamCursor cursor = cursor();
        while (nextUnreadBit != -1) resumeModule(cursor);
        for (Function function : new ArrayList<>(module.functions)) {
            materialize(function);
        }
        if (options.isUpgradeIntrinsics()) upgrader.runInPlace(module);
    }

    /**
     * Release the container. The module stays usable, but no more bodies can be read.
     */
    @Override
    public void close() {
        if (cursor == null) return;
        cursor = null;
        values.clear();
        metadata.clear();
        deferred.clear();
        functionsWithBodies.clear();
        if (module.getNullable(ReaderExts.MATERIALIZER) == this) module.removeExt(ReaderExts.MATERIALIZER);
    }

    private static final class Pending<T> {
        final T global;
        final long valueId;

        Pending(T global, long valueId) {
            this.global = global;
            this.valueId = valueId;
        }
    }
}
