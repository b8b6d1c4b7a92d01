package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.attr.AttributeSet;
import io.github.eutro.jbitcode.core.ir.BasicBlock;
import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.ConstantExpr;
import io.github.eutro.jbitcode.core.ir.ConstantInt;
import io.github.eutro.jbitcode.core.ir.Constants;
import io.github.eutro.jbitcode.core.ir.DebugLoc;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.Instruction;
import io.github.eutro.jbitcode.core.ir.MDNode;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ir.types.Types;
import io.github.eutro.jbitcode.core.ir.types.VectorType;
import io.github.eutro.jbitcode.core.ops.AllocaOp;
import io.github.eutro.jbitcode.core.ops.AtomicOrdering;
import io.github.eutro.jbitcode.core.ops.CallOp;
import io.github.eutro.jbitcode.core.ops.CmpOp;
import io.github.eutro.jbitcode.core.ops.FlagsOp;
import io.github.eutro.jbitcode.core.ops.GepOp;
import io.github.eutro.jbitcode.core.ops.IndexOp;
import io.github.eutro.jbitcode.core.ops.LandingPadOp;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.MemoryOp;
import io.github.eutro.jbitcode.core.ops.Op;
import io.github.eutro.jbitcode.core.ops.Opcode;
import io.github.eutro.jbitcode.core.ops.Predicate;
import io.github.eutro.jbitcode.core.ops.RmwOp;
import io.github.eutro.jbitcode.core.ops.RmwOperation;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamCursor;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamEntry;
import io.github.eutro.jbitcode.reader.bitstream.Record;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Decodes the body of one function into its blocks.
 * <p>
 * The arguments, then function-level constants, then every instruction that produces a
 * value are numbered after the module-level values. Operands may refer forward to
 * instructions that haven't been read yet, in which case they are placeholders until
 * the instruction is read. Whether the body is read or not, the value and metadata
 * tables are trimmed back to their module-level size afterwards.
 */
final class FunctionBodyReader {
    private static final Logger LOG = LoggerFactory.getLogger(FunctionBodyReader.class);

    static final String GCC_PERSONALITY = "__gcc_personality_v0";

    private final Module module;
    private final TypeTable types;
    private final AttributeTable attributes;
    private final ValueTable values;
    private final MetadataTable metadata;
    private final ConstantsReader constants;
    private final SymbolTableReader symbols;
    private final BlockAddresses blockAddresses;

    // state of the body being read
    private List<BasicBlock> blocks = Collections.emptyList();
    private final List<Instruction> instructions = new ArrayList<>();
    private int nextValueNo;

    FunctionBodyReader(Module module,
                       TypeTable types,
                       AttributeTable attributes,
                       ValueTable values,
                       MetadataTable metadata,
                       ConstantsReader constants,
                       SymbolTableReader symbols,
                       BlockAddresses blockAddresses) {
        this.module = module;
        this.types = types;
        this.attributes = attributes;
        this.values = values;
        this.metadata = metadata;
        this.constants = constants;
        this.symbols = symbols;
        this.blockAddresses = blockAddresses;
    }

    /**
     * Read the body of a function. The cursor must be just after the id of its block.
     * <p>
     * On failure, the function may be left with a partial body, which the caller must delete.
     *
     * @param cursor   The cursor.
     * @param function The function, which must be a declaration.
     * @throws BitcodeException If the body is malformed.
     */
    void parse(BitstreamCursor cursor, Function function) throws BitcodeException {
        int moduleValues = values.size();
        int moduleMetadata = metadata.size();
        try {
            parseBody(cursor, function, moduleValues, moduleMetadata);
        } finally {
            values.shrinkTo(moduleValues);
            metadata.shrinkTo(moduleMetadata);
            blocks = Collections.emptyList();
            instructions.clear();
        }
    }

    private void parseBody(BitstreamCursor cursor, Function function,
                           int moduleValues, int moduleMetadata) throws BitcodeException {
        cursor.enterSubBlock(BitcodeCodes.FUNCTION_BLOCK_ID);
        instructions.clear();
        blocks = function.blocks;

        for (Value arg : function.getArguments()) {
            values.push(arg);
        }
        nextValueNo = values.size();

        BasicBlock curBb = null;
        int curBbNo = 0;
        Instruction last = null;
        DebugLoc lastLoc = null;

        Record record = new Record();
        while (true) {
            BitstreamEntry entry = cursor.advance();
            if (entry.kind == BitstreamEntry.Kind.END_BLOCK) break;
            if (entry.kind == BitstreamEntry.Kind.SUB_BLOCK) {
                switch (entry.id) {
                    case BitcodeCodes.CONSTANTS_BLOCK_ID:
                        constants.parseBlock(cursor);
                        nextValueNo = values.size();
                        break;
                    case BitcodeCodes.VALUE_SYMTAB_BLOCK_ID:
                        symbols.parseBlock(cursor, blocks);
                        break;
                    case BitcodeCodes.METADATA_ATTACHMENT_ID:
                        metadata.parseAttachmentBlock(cursor, instructions);
                        break;
                    case BitcodeCodes.METADATA_BLOCK_ID:
                        metadata.parseBlock(cursor);
                        break;
                    default:
                        LOG.debug("Skipping block {} in function body", entry.id);
                        cursor.skipBlock();
                        break;
                }
                continue;
            }

            record.clear();
            int code = cursor.readRecord(entry.id, record);
            switch (code) {
                case BitcodeCodes.FUNC_CODE_DECLAREBLOCKS: { // [nblocks]
                    if (record.isEmpty() || record.get(0) == 0 || record.get(0) >= ValueTable.MAX_VALUES) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "declaring " + (record.isEmpty() ? "no" : record.get(0)) + " blocks");
                    }
                    if (!function.blocks.isEmpty()) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "blocks declared twice");
                    }
                    for (long i = record.get(0); i > 0; i--) {
                        function.newBb();
                    }
                    curBb = function.blocks.get(0);
                    continue;
                }
                case BitcodeCodes.FUNC_CODE_DEBUG_LOC_AGAIN: {
                    if (last == null) throw new BitcodeException(ErrorKind.INVALID_RECORD, "debug location with no instruction");
                    last.setDebugLoc(lastLoc);
                    continue;
                }
                case BitcodeCodes.FUNC_CODE_DEBUG_LOC: { // [line, col, scope + 1, inlinedAt + 1]
                    if (last == null || record.size() < 4) {
                        throw new BitcodeException(ErrorKind.INVALID_RECORD, "debug location");
                    }
                    lastLoc = new DebugLoc((int) record.get(0), (int) record.get(1),
                            debugScope(record.get(2)), debugScope(record.get(3)));
                    last.setDebugLoc(lastLoc);
                    continue;
                }
                default:
                    break;
            }

            if (curBb == null) {
                throw new BitcodeException(ErrorKind.INVALID_INSTRUCTION_WITH_NO_BB, "instruction code " + code);
            }
            Instruction insn = readInstruction(code, record, function, curBb);
            curBb.addInstruction(insn);
            last = insn;
            instructions.add(insn);
            if (insn.isTerminator()) {
                curBbNo++;
                curBb = curBbNo < function.blocks.size() ? function.blocks.get(curBbNo) : null;
            }
            if (!insn.getType().isVoid()) {
                values.assign(insn, nextValueNo++);
            }
        }

        int unresolved = values.findValuePlaceholder(moduleValues);
        if (unresolved != -1) {
            Value placeholder = values.get(unresolved);
            throw values.placeholderError(ErrorKind.NEVER_RESOLVED_VALUE_IN_FUNCTION, placeholder,
                    "value " + unresolved + " in " + describe(function));
        }
        int temporary = metadata.findTemporary(moduleMetadata);
        if (temporary != -1) {
            throw new BitcodeException(ErrorKind.UNRESOLVED_FORWARD_REFERENCE,
                    "metadata " + temporary + " in " + describe(function));
        }
        blockAddresses.resolve(function);
    }

    private static String describe(Function function) {
        return function.hasName() ? "@" + function.getName() : "an unnamed function";
    }

    private @Nullable MDNode debugScope(long id) throws BitcodeException {
        if (id == 0) return null;
        Value node = metadata.getForwardRef(id - 1);
        if (!(node instanceof MDNode)) throw new BitcodeException(ErrorKind.INVALID_RECORD, "debug scope " + node);
        return (MDNode) node;
    }

    private Instruction readInstruction(int code, Record record, Function function, BasicBlock curBb)
            throws BitcodeException {
        Operands ops = new Operands(record);
        switch (code) {
            case BitcodeCodes.FUNC_CODE_INST_BINOP: { // [opval, ty?, opval, opcode, flags?]
                Value lhs = ops.typed();
                Value rhs = ops.of(lhs.getType());
                Opcode opcode = Decoders.binaryOpcode(ops.next(), lhs.getType());
                if (opcode == null) throw invalid("binary operator for " + lhs.getType());
                int flags = ops.hasMore() ? Decoders.binaryFlags(opcode, ops.next()) : 0;
                return Instruction.create(FlagsOp.of(opcode, flags), lhs.getType(), lhs, rhs);
            }
            case BitcodeCodes.FUNC_CODE_INST_CAST: { // [opval, ty?, destty, castopc]
                Value operand = ops.typed();
                ops.expectRemaining(2);
                Type destTy = types.get(ops.next());
                Opcode opcode = Decoders.castOpcode(ops.next());
                if (opcode == null || destTy == null) throw invalid("cast");
                return Instruction.create(Op.of(opcode), destTy, operand);
            }
            case BitcodeCodes.FUNC_CODE_INST_INBOUNDS_GEP:
            case BitcodeCodes.FUNC_CODE_INST_GEP: { // [n x (opval, ty?)]
                Value base = ops.typed();
                List<Value> indices = new ArrayList<>();
                while (ops.hasMore()) indices.add(ops.typed());
                Type resultTy = Constants.getGepResultType(base.getType(), indices);
                if (resultTy == null) throw invalid("getelementptr indices into " + base.getType());
                List<Value> operands = new ArrayList<>(indices.size() + 1);
                operands.add(base);
                operands.addAll(indices);
                return new Instruction(GepOp.of(code == BitcodeCodes.FUNC_CODE_INST_INBOUNDS_GEP), resultTy, operands);
            }
            case BitcodeCodes.FUNC_CODE_INST_EXTRACTVAL: { // [opval, ty?, n x indices]
                Value aggregate = ops.typed();
                int[] indices = ops.indices();
                Type resultTy = Constants.getExtractValueType(aggregate.getType(), indices);
                if (resultTy == null) throw invalid("extractvalue indices into " + aggregate.getType());
                return Instruction.create(new IndexOp(Opcode.EXTRACTVALUE, indices), resultTy, aggregate);
            }
            case BitcodeCodes.FUNC_CODE_INST_INSERTVAL: { // [opval, ty?, opval, ty?, n x indices]
                Value aggregate = ops.typed();
                Value element = ops.typed();
                int[] indices = ops.indices();
                Type indexedTy = Constants.getExtractValueType(aggregate.getType(), indices);
                if (indexedTy == null || !indexedTy.equals(element.getType())) {
                    throw invalid("insertvalue of " + element.getType() + " into " + aggregate.getType());
                }
                return Instruction.create(new IndexOp(Opcode.INSERTVALUE, indices), aggregate.getType(), aggregate, element);
            }
            case BitcodeCodes.FUNC_CODE_INST_SELECT: { // [opval, ty?, opval, opval]
                Value ifTrue = ops.typed();
                Value ifFalse = ops.of(ifTrue.getType());
                Value cond = ops.of(Type.i1());
                return Instruction.create(Op.of(Opcode.SELECT), ifTrue.getType(), cond, ifTrue, ifFalse);
            }
            case BitcodeCodes.FUNC_CODE_INST_VSELECT: { // [opval, ty?, opval, predval, predty?]
                Value ifTrue = ops.typed();
                Value ifFalse = ops.of(ifTrue.getType());
                Value cond = ops.typed();
                Type condTy = cond.getType();
                if (!condTy.getScalarType().isInteger(1)) {
                    throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, "select condition of type " + condTy);
                }
                return Instruction.create(Op.of(Opcode.SELECT), ifTrue.getType(), cond, ifTrue, ifFalse);
            }
            case BitcodeCodes.FUNC_CODE_INST_EXTRACTELT: { // [opval, ty?, opval]
                Value vector = ops.typed();
                Value index = ops.of(Type.i32());
                if (!vector.getType().isVector()) throw invalid("extractelement from " + vector.getType());
                return Instruction.create(Op.of(Opcode.EXTRACTELEMENT),
                        ((VectorType) vector.getType()).getElementType(), vector, index);
            }
            case BitcodeCodes.FUNC_CODE_INST_INSERTELT: { // [opval, ty?, opval, opval]
                Value vector = ops.typed();
                if (!vector.getType().isVector()) throw invalid("insertelement into " + vector.getType());
                Value element = ops.of(((VectorType) vector.getType()).getElementType());
                Value index = ops.of(Type.i32());
                return Instruction.create(Op.of(Opcode.INSERTELEMENT), vector.getType(), vector, element, index);
            }
            case BitcodeCodes.FUNC_CODE_INST_SHUFFLEVEC: { // [opval, ty?, opval, opval, ty?]
                Value v1 = ops.typed();
                Value v2 = ops.of(v1.getType());
                Value mask = ops.typed();
                Type resultTy = Constants.getShuffleResultType(v1.getType(), mask.getType());
                if (resultTy == null) throw invalid("shufflevector of " + v1.getType() + " with " + mask.getType());
                return Instruction.create(Op.of(Opcode.SHUFFLEVECTOR), resultTy, v1, v2, mask);
            }
            case BitcodeCodes.FUNC_CODE_INST_CMP:
            case BitcodeCodes.FUNC_CODE_INST_CMP2: { // [opval, ty?, opval, pred]
                Value lhs = ops.typed();
                Value rhs = ops.of(lhs.getType());
                ops.expectRemaining(1);
                long code2 = ops.next();
                Predicate predicate = Predicate.fromCode(code2);
                if (predicate == null || predicate.isFloatingPoint() != lhs.getType().isFPOrFPVector()) {
                    throw invalid("predicate " + code2 + " for " + lhs.getType());
                }
                return Instruction.create(new CmpOp(predicate), Types.comparisonResult(lhs.getType()), lhs, rhs);
            }

            case BitcodeCodes.FUNC_CODE_INST_RET: { // [opval, ty?] or []
                if (record.isEmpty()) return Instruction.create(Op.of(Opcode.RET), Type.VOID);
                Value value = ops.typed();
                ops.expectRemaining(0);
                return Instruction.create(Op.of(Opcode.RET), Type.VOID, value);
            }
            case BitcodeCodes.FUNC_CODE_INST_BR: { // [bb] or [bb, bb, cond]
                if (record.size() != 1 && record.size() != 3) throw invalid("br with " + record.size() + " fields");
                BasicBlock ifTrue = block(record.get(0));
                if (record.size() == 1) return Instruction.create(Op.of(Opcode.BR), Type.VOID, ifTrue);
                BasicBlock ifFalse = block(record.get(1));
                Value cond = value(record.get(2), Type.i1());
                return Instruction.create(Op.of(Opcode.BR), Type.VOID, cond, ifTrue, ifFalse);
            }
            case BitcodeCodes.FUNC_CODE_INST_SWITCH: { // [opty, cond, default, n x (val, bb)]
                if (record.size() < 3 || record.size() % 2 == 0) throw invalid("switch with " + record.size() + " fields");
                Type condTy = types.get(record.get(0));
                if (condTy == null) throw invalid("switch type " + record.get(0));
                Instruction insn = Instruction.create(Op.of(Opcode.SWITCH), Type.VOID,
                        value(record.get(1), condTy), block(record.get(2)));
                for (int i = 3; i < record.size(); i += 2) {
                    Value caseValue = value(record.get(i), condTy);
                    if (!(caseValue instanceof ConstantInt)) throw invalid("switch case " + caseValue);
                    insn.appendOperand(caseValue);
                    insn.appendOperand(block(record.get(i + 1)));
                }
                return insn;
            }
            case BitcodeCodes.FUNC_CODE_INST_INDIRECTBR: { // [opty, addr, n x bb]
                if (record.size() < 2) throw invalid("indirectbr with " + record.size() + " fields");
                Type addrTy = types.get(record.get(0));
                if (addrTy == null) throw invalid("indirectbr type " + record.get(0));
                Instruction insn = Instruction.create(Op.of(Opcode.INDIRECTBR), Type.VOID, value(record.get(1), addrTy));
                for (int i = 2; i < record.size(); i++) {
                    insn.appendOperand(block(record.get(i)));
                }
                return insn;
            }
            case BitcodeCodes.FUNC_CODE_INST_INVOKE: { // [attrs, cc, normal, unwind, callee, ty?, args...]
                if (record.size() < 4) throw invalid("invoke with " + record.size() + " fields");
                AttributeSet attrs = attributes.get(record.get(0));
                int cc = (int) record.get(1);
                BasicBlock normal = block(record.get(2));
                BasicBlock unwind = block(record.get(3));
                ops.pos = 4;
                Value callee = ops.typed();
                List<Value> operands = ops.arguments(callee, false);
                operands.add(callee);
                operands.add(normal);
                operands.add(unwind);
                return new Instruction(new CallOp(Opcode.INVOKE, cc, false, attrs),
                        calleeType(callee).getReturnType(), operands);
            }
            case BitcodeCodes.FUNC_CODE_INST_RESUME: { // [opval, ty?]
                return Instruction.create(Op.of(Opcode.RESUME), Type.VOID, ops.typed());
            }
            case BitcodeCodes.FUNC_CODE_INST_UNWIND: {
                // no longer exists; the same as resuming a fresh cleanup landing pad
                StructType exnTy = StructType.literal(Arrays.<Type>asList(PointerType.getUnqual(Type.i8()), Type.i32()), false);
                Instruction landingPad = Instruction.create(new LandingPadOp(true, Collections.emptyList()),
                        exnTy, gccPersonality());
                curBb.addInstruction(landingPad);
                return Instruction.create(Op.of(Opcode.RESUME), Type.VOID, landingPad);
            }
            case BitcodeCodes.FUNC_CODE_INST_UNREACHABLE:
                return Instruction.create(Op.of(Opcode.UNREACHABLE), Type.VOID);

            case BitcodeCodes.FUNC_CODE_INST_PHI: { // [ty, n x (val, bb)]
                if (record.isEmpty() || record.size() % 2 == 0) throw invalid("phi with " + record.size() + " fields");
                Type type = types.get(record.get(0));
                if (type == null) throw invalid("phi type " + record.get(0));
                Instruction phi = Instruction.create(Op.of(Opcode.PHI), type);
                for (int i = 1; i < record.size(); i += 2) {
                    phi.appendOperand(value(record.get(i), type));
                    phi.appendOperand(block(record.get(i + 1)));
                }
                return phi;
            }
            case BitcodeCodes.FUNC_CODE_INST_LANDINGPAD: { // [ty, persfn, ty?, cleanup, n, n x (kind, val, ty?)]
                if (record.size() < 4) throw invalid("landingpad with " + record.size() + " fields");
                Type type = types.get(ops.next());
                if (type == null) throw invalid("landingpad type " + record.get(0));
                Value personality = ops.typed();
                boolean cleanup = ops.next() != 0;
                long numClauses = ops.next();
                List<LandingPadOp.ClauseKind> kinds = new ArrayList<>();
                List<Value> operands = new ArrayList<>();
                operands.add(personality);
                for (long i = 0; i < numClauses; i++) {
                    long kind = ops.next();
                    if (kind == BitcodeCodes.LPAD_CATCH) {
                        kinds.add(LandingPadOp.ClauseKind.CATCH);
                    } else if (kind == BitcodeCodes.LPAD_FILTER) {
                        kinds.add(LandingPadOp.ClauseKind.FILTER);
                    } else {
                        throw invalid("landingpad clause kind " + kind);
                    }
                    Value clause = ops.typed();
                    if (!(clause instanceof Constant)) throw invalid("landingpad clause " + clause);
                    operands.add(clause);
                }
                return new Instruction(new LandingPadOp(cleanup, kinds), type, operands);
            }

            case BitcodeCodes.FUNC_CODE_INST_ALLOCA: { // [instty, opty, op, align]
                if (record.size() != 4) throw invalid("alloca with " + record.size() + " fields");
                Type type = types.get(record.get(0));
                Type sizeTy = types.get(record.get(1));
                if (!(type instanceof PointerType) || sizeTy == null) throw invalid("alloca types");
                Value size = value(record.get(2), sizeTy);
                return Instruction.create(new AllocaOp(((PointerType) type).getElementType(),
                        Decoders.alignment(record.get(3))), type, size);
            }
            case BitcodeCodes.FUNC_CODE_INST_LOAD: { // [op, ty?, align, vol]
                Value ptr = ops.typed();
                ops.expectRemaining(2);
                long align = Decoders.alignment(ops.next());
                boolean isVolatile = ops.next() != 0;
                return Instruction.create(MemoryOp.simple(Opcode.LOAD, align, isVolatile), pointee(ptr), ptr);
            }
            case BitcodeCodes.FUNC_CODE_INST_LOADATOMIC: { // [op, ty?, align, vol, ordering, scope]
                Value ptr = ops.typed();
                ops.expectRemaining(4);
                long encodedAlign = ops.next();
                boolean isVolatile = ops.next() != 0;
                AtomicOrdering ordering = Decoders.ordering(ops.next());
                if (ordering == AtomicOrdering.NOT_ATOMIC || ordering == AtomicOrdering.RELEASE
                        || ordering == AtomicOrdering.ACQ_REL || encodedAlign == 0) {
                    throw invalid("atomic load " + ordering + " aligned " + encodedAlign);
                }
                MemoryOp op = new MemoryOp(Opcode.LOAD, Decoders.alignment(encodedAlign), isVolatile,
                        ordering, Decoders.syncScope(ops.next()));
                return Instruction.create(op, pointee(ptr), ptr);
            }
            case BitcodeCodes.FUNC_CODE_INST_STORE: { // [ptr, ty?, val, align, vol]
                Value ptr = ops.typed();
                Value value = ops.of(pointee(ptr));
                ops.expectRemaining(2);
                long align = Decoders.alignment(ops.next());
                boolean isVolatile = ops.next() != 0;
                return Instruction.create(MemoryOp.simple(Opcode.STORE, align, isVolatile), Type.VOID, value, ptr);
            }
            case BitcodeCodes.FUNC_CODE_INST_STOREATOMIC: { // [ptr, ty?, val, align, vol, ordering, scope]
                Value ptr = ops.typed();
                Value value = ops.of(pointee(ptr));
                ops.expectRemaining(4);
                long encodedAlign = ops.next();
                boolean isVolatile = ops.next() != 0;
                AtomicOrdering ordering = Decoders.ordering(ops.next());
                if (ordering == AtomicOrdering.NOT_ATOMIC || ordering == AtomicOrdering.ACQUIRE
                        || ordering == AtomicOrdering.ACQ_REL || encodedAlign == 0) {
                    throw invalid("atomic store " + ordering + " aligned " + encodedAlign);
                }
                MemoryOp op = new MemoryOp(Opcode.STORE, Decoders.alignment(encodedAlign), isVolatile,
                        ordering, Decoders.syncScope(ops.next()));
                return Instruction.create(op, Type.VOID, value, ptr);
            }
            case BitcodeCodes.FUNC_CODE_INST_CMPXCHG: { // [ptr, ty?, cmp, new, vol, ordering, scope]
                Value ptr = ops.typed();
                Type valueTy = pointee(ptr);
                Value cmp = ops.of(valueTy);
                Value replacement = ops.of(valueTy);
                ops.expectRemaining(3);
                boolean isVolatile = ops.next() != 0;
                AtomicOrdering ordering = Decoders.ordering(ops.next());
                if (ordering == AtomicOrdering.NOT_ATOMIC || ordering == AtomicOrdering.UNORDERED) {
                    throw invalid("cmpxchg " + ordering);
                }
                MemoryOp op = new MemoryOp(Opcode.CMPXCHG, 0, isVolatile, ordering, Decoders.syncScope(ops.next()));
                return Instruction.create(op, valueTy, ptr, cmp, replacement);
            }
            case BitcodeCodes.FUNC_CODE_INST_ATOMICRMW: { // [ptr, ty?, val, op, vol, ordering, scope]
                Value ptr = ops.typed();
                Value value = ops.of(pointee(ptr));
                ops.expectRemaining(4);
                RmwOperation operation = Decoders.rmwOperation(ops.next());
                if (operation == null) throw invalid("atomicrmw operation " + record.get(ops.pos - 1));
                boolean isVolatile = ops.next() != 0;
                AtomicOrdering ordering = Decoders.ordering(ops.next());
                if (ordering == AtomicOrdering.NOT_ATOMIC || ordering == AtomicOrdering.UNORDERED) {
                    throw invalid("atomicrmw " + ordering);
                }
                RmwOp op = new RmwOp(operation, isVolatile, ordering, Decoders.syncScope(ops.next()));
                return Instruction.create(op, value.getType(), ptr, value);
            }
            case BitcodeCodes.FUNC_CODE_INST_FENCE: { // [ordering, scope]
                if (record.size() != 2) throw invalid("fence with " + record.size() + " fields");
                AtomicOrdering ordering = Decoders.ordering(record.get(0));
                if (ordering == AtomicOrdering.NOT_ATOMIC || ordering == AtomicOrdering.UNORDERED
                        || ordering == AtomicOrdering.MONOTONIC) {
                    throw invalid("fence " + ordering);
                }
                MemoryOp op = new MemoryOp(Opcode.FENCE, 0, false, ordering, Decoders.syncScope(record.get(1)));
                return Instruction.create(op, Type.VOID);
            }

            case BitcodeCodes.FUNC_CODE_INST_CALL: { // [attrs, cc, callee, ty?, args...]
                if (record.size() < 3) throw invalid("call with " + record.size() + " fields");
                AttributeSet attrs = attributes.get(record.get(0));
                long ccInfo = record.get(1);
                ops.pos = 2;
                Value callee = ops.typed();
                List<Value> operands = ops.arguments(callee, true);
                operands.add(callee);
                CallOp op = new CallOp(Opcode.CALL, (int) (ccInfo >>> 1), (ccInfo & 1) != 0, attrs);
                return new Instruction(op, calleeType(callee).getReturnType(), operands);
            }
            case BitcodeCodes.FUNC_CODE_INST_VAARG: { // [valistty, valist, instty]
                if (record.size() < 3) throw invalid("va_arg with " + record.size() + " fields");
                Type listTy = types.get(record.get(0));
                Type resultTy = types.get(record.get(2));
                if (listTy == null || resultTy == null) throw invalid("va_arg types");
                return Instruction.create(Op.of(Opcode.VAARG), resultTy, value(record.get(1), listTy));
            }
            default:
                throw new BitcodeException(ErrorKind.INVALID_VALUE, "unknown instruction code " + code);
        }
    }

    private static BitcodeException invalid(String detail) {
        return new BitcodeException(ErrorKind.INVALID_RECORD, detail);
    }

    private Constant gccPersonality() {
        FunctionType type = FunctionType.get(Type.i32(), Collections.emptyList(), true);
        Function existing = module.getFunction(GCC_PERSONALITY);
        if (existing == null) {
            Function personality = new Function(type, Linkage.EXTERNAL, GCC_PERSONALITY);
            module.functions.add(personality);
            return personality;
        }
        if (existing.getFunctionType().equals(type)) return existing;
        return ConstantExpr.getCast(module.getContext(), Opcode.BITCAST, existing, PointerType.getUnqual(type));
    }

    private static FunctionType calleeType(Value callee) throws BitcodeException {
        Type type = callee.getType();
        if (type instanceof PointerType && ((PointerType) type).getElementType() instanceof FunctionType) {
            return (FunctionType) ((PointerType) type).getElementType();
        }
        throw invalid("call of " + type);
    }

    private static Type pointee(Value ptr) throws BitcodeException {
        if (!(ptr.getType() instanceof PointerType)) {
            throw new BitcodeException(ErrorKind.INVALID_TYPE_FOR_VALUE, "memory access through " + ptr.getType());
        }
        return ((PointerType) ptr.getType()).getElementType();
    }

    private BasicBlock block(long id) throws BitcodeException {
        if (id < 0 || id >= blocks.size()) throw invalid("block " + id + " of " + blocks.size());
        return blocks.get((int) id);
    }

    private @Nullable Value valueOrNull(long id, @Nullable Type type) throws BitcodeException {
        if (type != null && type.isMetadata()) return metadata.getForwardRef(id);
        return values.getValueForwardRef(id, type);
    }

    private Value value(long id, Type type) throws BitcodeException {
        Value value = valueOrNull(id, type);
        if (value == null) throw invalid("value " + id);
        return value;
    }

    /**
     * A position in the fields of an instruction record.
     */
    private final class Operands {
        final Record record;
        int pos;

        Operands(Record record) {
            this.record = record;
        }

        boolean hasMore() {
            return pos < record.size();
        }

        long next() throws BitcodeException {
            if (!hasMore()) throw invalid("record ends after " + pos + " fields");
            return record.get(pos++);
        }

        void expectRemaining(int n) throws BitcodeException {
            if (record.size() - pos != n) {
                throw invalid("expected " + n + " more fields after " + pos + ", found " + (record.size() - pos));
            }
        }

        /**
         * Read a value id, followed by a type id if the value is a forward reference.
         */
        Value typed() throws BitcodeException {
            long id = next();
            if (id < nextValueNo) {
                Value value = valueOrNull(id, null);
                if (value == null) throw invalid("value " + id);
                return value;
            }
            Type type = types.get(next());
            if (type == null) throw invalid("type of value " + id);
            return value(id, type);
        }

        Value of(Type type) throws BitcodeException {
            return value(next(), type);
        }

        int[] indices() throws BitcodeException {
            int[] indices = new int[record.size() - pos];
            for (int i = 0; i < indices.length; i++) {
                long index = next();
                if (index < 0 || index > 0xFFFFFFFFL) throw new BitcodeException(ErrorKind.INVALID_VALUE, "index " + index);
                indices[i] = (int) index;
            }
            return indices;
        }

        /**
         * Read the arguments of a call: one value per fixed parameter, by its type, then
         * value/type pairs for the variadic part.
         */
        List<Value> arguments(Value callee, boolean labelsAsBlocks) throws BitcodeException {
            FunctionType fnTy = calleeType(callee);
            if (record.size() - pos < fnTy.getNumParams()) {
                throw invalid("call of " + fnTy + " with " + (record.size() - pos) + " arguments");
            }
            List<Value> args = new ArrayList<>();
            for (Type param : fnTy.getParams()) {
                if (labelsAsBlocks && param.isLabel()) {
                    args.add(block(next()));
                } else {
                    args.add(of(param));
                }
            }
            if (!fnTy.isVarArg()) {
                expectRemaining(0);
            } else {
                while (hasMore()) args.add(typed());
            }
            return args;
        }
    }
}
