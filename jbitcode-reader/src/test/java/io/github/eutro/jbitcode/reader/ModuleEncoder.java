package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.attr.AttributeSet;
import io.github.eutro.jbitcode.core.attr.Attributes;
import io.github.eutro.jbitcode.core.ir.Argument;
import io.github.eutro.jbitcode.core.ir.BasicBlock;
import io.github.eutro.jbitcode.core.ir.BlockAddress;
import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.ConstantAggregate;
import io.github.eutro.jbitcode.core.ir.ConstantDataArray;
import io.github.eutro.jbitcode.core.ir.ConstantExpr;
import io.github.eutro.jbitcode.core.ir.ConstantFP;
import io.github.eutro.jbitcode.core.ir.ConstantInt;
import io.github.eutro.jbitcode.core.ir.ConstantNull;
import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.GlobalAlias;
import io.github.eutro.jbitcode.core.ir.GlobalValue;
import io.github.eutro.jbitcode.core.ir.GlobalVariable;
import io.github.eutro.jbitcode.core.ir.InlineAsm;
import io.github.eutro.jbitcode.core.ir.Instruction;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.UndefValue;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.ArrayType;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.IntegerType;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.SequentialType;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.AllocaOp;
import io.github.eutro.jbitcode.core.ops.CallOp;
import io.github.eutro.jbitcode.core.ops.CmpOp;
import io.github.eutro.jbitcode.core.ops.FlagsOp;
import io.github.eutro.jbitcode.core.ops.GepOp;
import io.github.eutro.jbitcode.core.ops.IndexOp;
import io.github.eutro.jbitcode.core.ops.LandingPadOp;
import io.github.eutro.jbitcode.core.ops.Linkage;
import io.github.eutro.jbitcode.core.ops.MemoryOp;
import io.github.eutro.jbitcode.core.ops.Opcode;
import io.github.eutro.jbitcode.core.ops.RmwOp;
import io.github.eutro.jbitcode.core.ops.SyncScope;
import io.github.eutro.jbitcode.core.ops.ThreadLocalMode;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamWriter;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.jbitcode.reader.BitcodeCodes.*;

/**
 * Writes a fully read module back out as a container, using unabbreviated records throughout.
 * <p>
 * Identified structs are numbered in the order the module lists them, so reading the result
 * gives back the same struct order as long as no struct refers to a later one by value.
 * Metadata and debug locations are not written.
 */
public class ModuleEncoder {
    private static final int VISITING = -1;

    private final Module module;
    private final BitstreamWriter out = new BitstreamWriter();

    private final Map<Type, Integer> typeIds = new HashMap<>();
    private final List<Type> typeList = new ArrayList<>();
    private final Map<Value, Integer> moduleIds = new IdentityHashMap<>();
    private final List<Constant> moduleConstants = new ArrayList<>();
    private final Map<Function, Locals> locals = new IdentityHashMap<>();
    private final Map<AttributeSet, Integer> attributeRefs = new HashMap<>();
    private final List<AttributeSet> attributeSets = new ArrayList<>();
    private final List<String> sections = new ArrayList<>();
    private final List<String> gcs = new ArrayList<>();

    private ModuleEncoder(Module module) {
        this.module = module;
    }

    /**
     * Encode a module whose function bodies have all been read.
     *
     * @param module The module.
     * @return The container.
     * @throws UnsupportedOperationException If the module has something that isn't written.
     */
    public static byte[] encode(Module module) {
        ModuleEncoder encoder = new ModuleEncoder(module);
        encoder.enumerate();
        encoder.write();
        return encoder.out.toByteArray();
    }

    /**
     * The numbering of one function body.
     */
    private static final class Locals {
        final Map<Value, Integer> ids = new IdentityHashMap<>();
        final List<Constant> constants = new ArrayList<>();
        int next;
        int firstInstruction;
    }

    private void enumerate() {
        if (!module.getNamedMetadata().isEmpty()) throw new UnsupportedOperationException("named metadata");
        for (StructType st : module.getIdentifiedStructTypes()) {
            enumerateType(st);
        }
        for (GlobalVariable global : module.globals) addGlobal(global);
        for (Function function : module.functions) addGlobal(function);
        for (GlobalAlias alias : module.aliases) addGlobal(alias);

        for (GlobalVariable global : module.globals) {
            if (global.getInitializer() != null) enumerateConstant(global.getInitializer(), moduleIds, moduleConstants, null);
            if (global.getSection() != null && !sections.contains(global.getSection())) sections.add(global.getSection());
        }
        for (GlobalAlias alias : module.aliases) {
            if (alias.getAliasee() != null) enumerateConstant(alias.getAliasee(), moduleIds, moduleConstants, null);
        }
        for (Function function : module.functions) {
            if (function.getSection() != null && !sections.contains(function.getSection())) sections.add(function.getSection());
            if (function.getGC() != null && !gcs.contains(function.getGC())) gcs.add(function.getGC());
            attributeRef(function.getAttributes());
            for (Argument arg : function.getArguments()) enumerateType(arg.getType());
            if (!function.isDeclaration()) enumerateBody(function);
        }
    }

    private void addGlobal(GlobalValue global) {
        enumerateType(global.getType());
        moduleIds.put(global, moduleIds.size());
    }

    private void enumerateBody(Function function) {
        Locals body = new Locals();
        body.next = moduleIds.size();
        for (Argument arg : function.getArguments()) {
            body.ids.put(arg, body.next++);
        }
        for (BasicBlock bb : function.blocks) {
            for (Instruction insn : bb.getInstructions()) {
                if (insn.getDebugLoc() != null || !insn.getAllMetadata().isEmpty()) {
                    throw new UnsupportedOperationException("instruction metadata");
                }
                if (insn.getOp() instanceof CallOp) attributeRef(((CallOp) insn.getOp()).attributes);
                enumerateType(insn.getType());
                for (Value operand : insn.getOperands()) {
                    if (operand == null) continue;
                    enumerateType(operand.getType());
                    if (operand instanceof Constant) {
                        enumerateConstant((Constant) operand, body.ids, body.constants, body);
                    }
                }
            }
        }
        body.firstInstruction = body.next;
        for (BasicBlock bb : function.blocks) {
            for (Instruction insn : bb.getInstructions()) {
                if (!insn.getType().isVoid()) body.ids.put(insn, body.next++);
            }
        }
        locals.put(function, body);
    }

    private void enumerateConstant(Constant constant, Map<Value, Integer> ids, List<Constant> into, Locals body) {
        if (moduleIds.containsKey(constant) || ids.containsKey(constant)) return;
        if (constant instanceof GlobalValue) throw new IllegalStateException(constant + " is not in the module");
        enumerateType(constant.getType());
        if (constant instanceof BlockAddress) {
            enumerateType(((BlockAddress) constant).getFunction().getType());
        } else {
            for (Value operand : constant.getOperands()) {
                enumerateType(operand.getType());
                enumerateConstant((Constant) operand, ids, into, body);
            }
        }
        ids.put(constant, body == null ? ids.size() : body.next++);
        into.add(constant);
    }

    private void enumerateType(Type type) {
        if (typeIds.containsKey(type)) return;
        if (type instanceof StructType && !((StructType) type).isLiteral()) {
            typeIds.put(type, VISITING);
            for (Type element : ((StructType) type).getElements()) enumerateType(element);
            assignType(type);
            return;
        }
        if (type instanceof PointerType) {
            enumerateType(((PointerType) type).getElementType());
        } else if (type instanceof SequentialType) {
            enumerateType(((SequentialType) type).getElementType());
        } else if (type instanceof FunctionType) {
            enumerateType(((FunctionType) type).getReturnType());
            for (Type param : ((FunctionType) type).getParams()) enumerateType(param);
        } else if (type instanceof StructType) {
            for (Type element : ((StructType) type).getElements()) enumerateType(element);
        }
        assignType(type);
    }

    private void assignType(Type type) {
        typeIds.put(type, typeList.size());
        typeList.add(type);
    }

    private int attributeRef(AttributeSet set) {
        if (set.isEmpty()) return 0;
        Integer ref = attributeRefs.get(set);
        if (ref == null) {
            attributeSets.add(set);
            ref = attributeSets.size();
            attributeRefs.put(set, ref);
        }
        return ref;
    }

    private long typeId(Type type) {
        Integer id = typeIds.get(type);
        if (id == null || id == VISITING) throw new IllegalStateException("type " + type + " was not numbered");
        return id;
    }

    private void write() {
        out.writeMagic();
        out.enterSubBlock(MODULE_BLOCK_ID, 3);
        out.emitRecord(MODULE_CODE_VERSION, 0);
        writeAttributes();
        writeTypes();
        if (module.getTargetTriple() != null) out.emitRecord(MODULE_CODE_TRIPLE, utf8(module.getTargetTriple()));
        if (module.getDataLayout() != null) out.emitRecord(MODULE_CODE_DATALAYOUT, utf8(module.getDataLayout()));
        if (!module.getModuleAsm().isEmpty()) {
            for (String line : module.getModuleAsm().split("\n", -1)) {
                out.emitRecord(MODULE_CODE_ASM, utf8(line));
            }
        }
        for (String section : sections) out.emitRecord(MODULE_CODE_SECTIONNAME, utf8(section));
        for (String gc : gcs) out.emitRecord(MODULE_CODE_GCNAME, utf8(gc));

        for (GlobalVariable global : module.globals) writeGlobalVar(global);
        for (Function function : module.functions) writeFunctionRecord(function);
        for (GlobalAlias alias : module.aliases) {
            out.emitRecord(MODULE_CODE_ALIAS, typeId(alias.getType()), id(alias.getAliasee(), moduleIds),
                    linkage(alias.getLinkage()), alias.getVisibility().ordinal());
        }

        writeConstants(moduleConstants, moduleIds);
        writeModuleSymbols();
        for (Function function : module.functions) {
            if (!function.isDeclaration()) writeBody(function, locals.get(function));
        }
        out.exitBlock();
    }

    private void writeAttributes() {
        if (attributeSets.isEmpty()) return;
        out.enterSubBlock(PARAMATTR_BLOCK_ID, 4);
        for (AttributeSet set : attributeSets) {
            List<Long> fields = new ArrayList<>();
            for (Map.Entry<Integer, Attributes> slot : set.getSlots().entrySet()) {
                fields.add(slot.getKey() == AttributeSet.FUNCTION_INDEX ? 0xFFFFFFFFL : (long) slot.getKey());
                fields.add(encodeAttributes(slot.getValue()));
            }
            out.emitRecord(PARAMATTR_CODE_ENTRY_OLD, toArray(fields));
        }
        out.exitBlock();
    }

    static long encodeAttributes(Attributes attributes) {
        long raw = attributes.getRaw();
        return (raw & 0xFFFFL)
                | attributes.getAlignment() << 16
                | (raw & (0xFFFFFL << 21)) << 11;
    }

    private void writeTypes() {
        out.enterSubBlock(TYPE_BLOCK_ID_NEW, 4);
        out.emitRecord(TYPE_CODE_NUMENTRY, typeList.size());
        for (Type type : typeList) {
            writeType(type);
        }
        out.exitBlock();
    }

    private void writeType(Type type) {
        switch (type.getKind()) {
            case VOID:
                out.emitRecord(TYPE_CODE_VOID);
                break;
            case HALF:
                out.emitRecord(TYPE_CODE_HALF);
                break;
            case FLOAT:
                out.emitRecord(TYPE_CODE_FLOAT);
                break;
            case DOUBLE:
                out.emitRecord(TYPE_CODE_DOUBLE);
                break;
            case X86_FP80:
                out.emitRecord(TYPE_CODE_X86_FP80);
                break;
            case FP128:
                out.emitRecord(TYPE_CODE_FP128);
                break;
            case PPC_FP128:
                out.emitRecord(TYPE_CODE_PPC_FP128);
                break;
            case LABEL:
                out.emitRecord(TYPE_CODE_LABEL);
                break;
            case METADATA:
                out.emitRecord(TYPE_CODE_METADATA);
                break;
            case X86_MMX:
                out.emitRecord(TYPE_CODE_X86_MMX);
                break;
            case INTEGER:
                out.emitRecord(TYPE_CODE_INTEGER, ((IntegerType) type).getWidth());
                break;
            case POINTER: {
                PointerType pt = (PointerType) type;
                out.emitRecord(TYPE_CODE_POINTER, typeId(pt.getElementType()), pt.getAddressSpace());
                break;
            }
            case ARRAY:
            case VECTOR: {
                SequentialType seq = (SequentialType) type;
                out.emitRecord(type.getKind() == Type.Kind.ARRAY ? TYPE_CODE_ARRAY : TYPE_CODE_VECTOR,
                        seq.getNumElements(), typeId(seq.getElementType()));
                break;
            }
            case FUNCTION: {
                FunctionType ft = (FunctionType) type;
                List<Long> fields = new ArrayList<>();
                fields.add(ft.isVarArg() ? 1L : 0L);
                fields.add(typeId(ft.getReturnType()));
                for (Type param : ft.getParams()) fields.add(typeId(param));
                out.emitRecord(TYPE_CODE_FUNCTION, toArray(fields));
                break;
            }
            case STRUCT: {
                StructType st = (StructType) type;
                if (!st.isLiteral() && st.getName() != null) out.emitRecord(TYPE_CODE_STRUCT_NAME, utf8(st.getName()));
                if (!st.isLiteral() && st.isOpaque()) {
                    out.emitRecord(TYPE_CODE_OPAQUE, 0);
                    break;
                }
                List<Long> fields = new ArrayList<>();
                fields.add(st.isPacked() ? 1L : 0L);
                for (Type element : st.getElements()) fields.add(typeId(element));
                out.emitRecord(st.isLiteral() ? TYPE_CODE_STRUCT_ANON : TYPE_CODE_STRUCT_NAMED, toArray(fields));
                break;
            }
            default:
                throw new UnsupportedOperationException("type " + type);
        }
    }

    private void writeGlobalVar(GlobalVariable global) {
        Constant init = global.getInitializer();
        out.emitRecord(MODULE_CODE_GLOBALVAR,
                typeId(global.getType()),
                global.isConstant() ? 1 : 0,
                init == null ? 0 : id(init, moduleIds) + 1,
                linkage(global.getLinkage()),
                alignment(global.getAlignment()),
                sectionRef(global.getSection()),
                global.getVisibility().ordinal(),
                threadLocalMode(global.getThreadLocalMode()),
                global.hasUnnamedAddr() ? 1 : 0);
    }

    private void writeFunctionRecord(Function function) {
        out.emitRecord(MODULE_CODE_FUNCTION,
                typeId(function.getType()),
                function.getCallingConv(),
                function.isDeclaration() ? 1 : 0,
                linkage(function.getLinkage()),
                attributeRef(function.getAttributes()),
                alignment(function.getAlignment()),
                sectionRef(function.getSection()),
                function.getVisibility().ordinal(),
                function.getGC() == null ? 0 : gcs.indexOf(function.getGC()) + 1,
                function.hasUnnamedAddr() ? 1 : 0);
    }

    private long sectionRef(String section) {
        return section == null ? 0 : sections.indexOf(section) + 1;
    }

    private void writeModuleSymbols() {
        List<GlobalValue> named = new ArrayList<>();
        named.addAll(module.globals);
        named.addAll(module.functions);
        named.addAll(module.aliases);
        named.removeIf(gv -> !gv.hasName());
        if (named.isEmpty()) return;
        out.enterSubBlock(VALUE_SYMTAB_BLOCK_ID, 4);
        for (GlobalValue gv : named) {
            out.emitRecord(VST_CODE_ENTRY, named(id(gv, moduleIds), gv.getName()));
        }
        out.exitBlock();
    }

    private void writeConstants(List<Constant> constants, Map<Value, Integer> ids) {
        if (constants.isEmpty()) return;
        out.enterSubBlock(CONSTANTS_BLOCK_ID, 4);
        Type curTy = Type.i32();
        for (Constant constant : constants) {
            if (!constant.getType().equals(curTy)) {
                curTy = constant.getType();
                out.emitRecord(CST_CODE_SETTYPE, typeId(curTy));
            }
            writeConstant(constant, ids);
        }
        out.exitBlock();
    }

    private void writeConstant(Constant constant, Map<Value, Integer> ids) {
        if (constant instanceof UndefValue) {
            out.emitRecord(CST_CODE_UNDEF);
        } else if (constant instanceof ConstantNull) {
            out.emitRecord(CST_CODE_NULL);
        } else if (constant instanceof ConstantInt) {
            ConstantInt ci = (ConstantInt) constant;
            int width = ci.getType().getWidth();
            if (width <= 64) {
                out.emitRecord(CST_CODE_INTEGER, signRotate(ci.getValue().longValue()));
            } else {
                BigInteger unsigned = ci.getUnsignedValue();
                long[] words = new long[(width + 63) / 64];
                for (int i = 0; i < words.length; i++) {
                    words[i] = signRotate(unsigned.shiftRight(64 * i).longValue());
                }
                out.emitRecord(CST_CODE_WIDE_INTEGER, words);
            }
        } else if (constant instanceof ConstantFP) {
            writeFloat((ConstantFP) constant);
        } else if (constant instanceof ConstantAggregate) {
            out.emitRecord(CST_CODE_AGGREGATE, operandIds(constant, ids));
        } else if (constant instanceof ConstantDataArray) {
            ConstantDataArray data = (ConstantDataArray) constant;
            if (!(data.getType() instanceof ArrayType)) throw new UnsupportedOperationException("vector data " + data);
            long[] elements = new long[data.getNumElements()];
            for (int i = 0; i < elements.length; i++) elements[i] = data.getElement(i);
            out.emitRecord(CST_CODE_STRING, elements);
        } else if (constant instanceof ConstantExpr) {
            writeConstantExpr((ConstantExpr) constant, ids);
        } else if (constant instanceof InlineAsm) {
            InlineAsm asm = (InlineAsm) constant;
            List<Long> fields = new ArrayList<>();
            fields.add((asm.hasSideEffects() ? 1L : 0L) | (asm.isAlignStack() ? 2L : 0L));
            long[] text = utf8(asm.getAsm());
            fields.add((long) text.length);
            for (long c : text) fields.add(c);
            long[] constraints = utf8(asm.getConstraints());
            fields.add((long) constraints.length);
            for (long c : constraints) fields.add(c);
            out.emitRecord(CST_CODE_INLINEASM, toArray(fields));
        } else if (constant instanceof BlockAddress) {
            BlockAddress ba = (BlockAddress) constant;
            out.emitRecord(CST_CODE_BLOCKADDRESS, typeId(ba.getFunction().getType()), id(ba.getFunction(), ids),
                    ba.getFunction().blocks.indexOf(ba.getBlock()));
        } else {
            throw new UnsupportedOperationException("constant " + constant);
        }
    }

    private void writeFloat(ConstantFP fp) {
        BigInteger bits = fp.getBits();
        long low = bits.longValue();
        long high = bits.shiftRight(64).longValue();
        switch (fp.getType().getKind()) {
            case X86_FP80:
                out.emitRecord(CST_CODE_FLOAT, (high << 48) | (low >>> 16), low & 0xFFFFL);
                break;
            case FP128:
            case PPC_FP128:
                out.emitRecord(CST_CODE_FLOAT, low, high);
                break;
            default:
                out.emitRecord(CST_CODE_FLOAT, low);
                break;
        }
    }

    private void writeConstantExpr(ConstantExpr ce, Map<Value, Integer> ids) {
        Opcode opcode = ce.getOpcode();
        if (opcode.isBinary()) {
            int flags = ce.getOp() instanceof FlagsOp ? binaryFlags((FlagsOp) ce.getOp()) : 0;
            long lhs = id(ce.getOperand(0), ids);
            long rhs = id(ce.getOperand(1), ids);
            if (flags == 0) {
                out.emitRecord(CST_CODE_CE_BINOP, binaryOpcode(opcode), lhs, rhs);
            } else {
                out.emitRecord(CST_CODE_CE_BINOP, binaryOpcode(opcode), lhs, rhs, flags);
            }
            return;
        }
        if (opcode.isCast()) {
            Value operand = ce.getOperand(0);
            out.emitRecord(CST_CODE_CE_CAST, castOpcode(opcode), typeId(operand.getType()), id(operand, ids));
            return;
        }
        switch (opcode) {
            case GETELEMENTPTR: {
                List<Long> fields = new ArrayList<>();
                for (Value operand : ce.getOperands()) {
                    fields.add(typeId(operand.getType()));
                    fields.add((long) id(operand, ids));
                }
                out.emitRecord(((GepOp) ce.getOp()).inBounds ? CST_CODE_CE_INBOUNDS_GEP : CST_CODE_CE_GEP, toArray(fields));
                break;
            }
            case SELECT:
                out.emitRecord(CST_CODE_CE_SELECT, operandIds(ce, ids));
                break;
            case EXTRACTELEMENT:
                out.emitRecord(CST_CODE_CE_EXTRACTELT, typeId(ce.getOperand(0).getType()),
                        id(ce.getOperand(0), ids), id(ce.getOperand(1), ids));
                break;
            case INSERTELEMENT:
                out.emitRecord(CST_CODE_CE_INSERTELT, operandIds(ce, ids));
                break;
            case SHUFFLEVECTOR:
                if (ce.getOperand(0).getType().equals(ce.getType())) {
                    out.emitRecord(CST_CODE_CE_SHUFFLEVEC, operandIds(ce, ids));
                } else {
                    out.emitRecord(CST_CODE_CE_SHUFVEC_EX, typeId(ce.getOperand(0).getType()),
                            id(ce.getOperand(0), ids), id(ce.getOperand(1), ids), id(ce.getOperand(2), ids));
                }
                break;
            case ICMP:
            case FCMP:
                out.emitRecord(CST_CODE_CE_CMP, typeId(ce.getOperand(0).getType()),
                        id(ce.getOperand(0), ids), id(ce.getOperand(1), ids),
                        ((CmpOp) ce.getOp()).predicate.code);
                break;
            default:
                throw new UnsupportedOperationException("constant expression " + ce);
        }
    }

    private void writeBody(Function function, Locals body) {
        out.enterSubBlock(FUNCTION_BLOCK_ID, 4);
        out.emitRecord(FUNC_CODE_DECLAREBLOCKS, function.blocks.size());
        writeConstants(body.constants, body.ids);
        int next = body.firstInstruction;
        for (BasicBlock bb : function.blocks) {
            for (Instruction insn : bb.getInstructions()) {
                writeInstruction(function, insn, body.ids, next);
                if (!insn.getType().isVoid()) next++;
            }
        }

        List<Value> named = new ArrayList<>(function.getArguments());
        for (BasicBlock bb : function.blocks) named.addAll(bb.getInstructions());
        named.removeIf(v -> !v.hasName() || !body.ids.containsKey(v));
        boolean namedBlocks = function.blocks.stream().anyMatch(Value::hasName);
        if (!named.isEmpty() || namedBlocks) {
            out.enterSubBlock(VALUE_SYMTAB_BLOCK_ID, 4);
            for (Value value : named) {
                out.emitRecord(VST_CODE_ENTRY, named(body.ids.get(value), value.getName()));
            }
            for (int i = 0; i < function.blocks.size(); i++) {
                BasicBlock bb = function.blocks.get(i);
                if (bb.hasName()) out.emitRecord(VST_CODE_BBENTRY, named(i, bb.getName()));
            }
            out.exitBlock();
        }
        out.exitBlock();
    }

    /**
     * @param self The id the instruction has, or would have if it produced a value.
     */
    private void writeInstruction(Function function, Instruction insn, Map<Value, Integer> ids, int self) {
        Fields f = new Fields(ids, self, function);
        Opcode opcode = insn.getOpcode();
        if (opcode.isBinary()) {
            f.typed(insn.getOperand(0)).value(insn.getOperand(1)).add(binaryOpcode(opcode));
            int flags = insn.getOp() instanceof FlagsOp ? binaryFlags((FlagsOp) insn.getOp()) : 0;
            if (flags != 0) f.add(flags);
            out.emitRecord(FUNC_CODE_INST_BINOP, f.toArray());
            return;
        }
        if (opcode.isCast()) {
            f.typed(insn.getOperand(0)).add(typeId(insn.getType())).add(castOpcode(opcode));
            out.emitRecord(FUNC_CODE_INST_CAST, f.toArray());
            return;
        }
        switch (opcode) {
            case GETELEMENTPTR:
                for (Value operand : insn.getOperands()) f.typed(operand);
                out.emitRecord(((GepOp) insn.getOp()).inBounds ? FUNC_CODE_INST_INBOUNDS_GEP : FUNC_CODE_INST_GEP, f.toArray());
                break;
            case EXTRACTVALUE:
                f.typed(insn.getOperand(0));
                for (int index : ((IndexOp) insn.getOp()).getIndices()) f.add(index & 0xFFFFFFFFL);
                out.emitRecord(FUNC_CODE_INST_EXTRACTVAL, f.toArray());
                break;
            case INSERTVALUE:
                f.typed(insn.getOperand(0)).typed(insn.getOperand(1));
                for (int index : ((IndexOp) insn.getOp()).getIndices()) f.add(index & 0xFFFFFFFFL);
                out.emitRecord(FUNC_CODE_INST_INSERTVAL, f.toArray());
                break;
            case SELECT: {
                Value cond = insn.getOperand(0);
                f.typed(insn.getOperand(1)).value(insn.getOperand(2));
                if (cond.getType().isInteger(1)) {
                    out.emitRecord(FUNC_CODE_INST_SELECT, f.value(cond).toArray());
                } else {
                    out.emitRecord(FUNC_CODE_INST_VSELECT, f.typed(cond).toArray());
                }
                break;
            }
            case EXTRACTELEMENT:
                out.emitRecord(FUNC_CODE_INST_EXTRACTELT, f.typed(insn.getOperand(0)).value(insn.getOperand(1)).toArray());
                break;
            case INSERTELEMENT:
                out.emitRecord(FUNC_CODE_INST_INSERTELT, f.typed(insn.getOperand(0))
                        .value(insn.getOperand(1)).value(insn.getOperand(2)).toArray());
                break;
            case SHUFFLEVECTOR:
                out.emitRecord(FUNC_CODE_INST_SHUFFLEVEC, f.typed(insn.getOperand(0))
                        .value(insn.getOperand(1)).typed(insn.getOperand(2)).toArray());
                break;
            case ICMP:
            case FCMP:
                f.typed(insn.getOperand(0)).value(insn.getOperand(1)).add(((CmpOp) insn.getOp()).predicate.code);
                out.emitRecord(FUNC_CODE_INST_CMP2, f.toArray());
                break;
            case RET:
                if (insn.getNumOperands() != 0) f.typed(insn.getOperand(0));
                out.emitRecord(FUNC_CODE_INST_RET, f.toArray());
                break;
            case BR:
                if (insn.getNumOperands() == 1) {
                    f.block(insn.getOperand(0));
                } else {
                    f.block(insn.getOperand(1)).block(insn.getOperand(2)).value(insn.getOperand(0));
                }
                out.emitRecord(FUNC_CODE_INST_BR, f.toArray());
                break;
            case SWITCH:
                f.add(typeId(insn.getOperand(0).getType())).value(insn.getOperand(0)).block(insn.getOperand(1));
                for (int i = 2; i < insn.getNumOperands(); i += 2) {
                    f.value(insn.getOperand(i)).block(insn.getOperand(i + 1));
                }
                out.emitRecord(FUNC_CODE_INST_SWITCH, f.toArray());
                break;
            case INDIRECTBR:
                f.add(typeId(insn.getOperand(0).getType())).value(insn.getOperand(0));
                for (int i = 1; i < insn.getNumOperands(); i++) f.block(insn.getOperand(i));
                out.emitRecord(FUNC_CODE_INST_INDIRECTBR, f.toArray());
                break;
            case INVOKE: {
                CallOp op = (CallOp) insn.getOp();
                int n = insn.getNumOperands();
                Value callee = insn.getOperand(n - 3);
                f.add(attributeRef(op.attributes)).add(op.callingConv)
                        .block(insn.getOperand(n - 2)).block(insn.getOperand(n - 1))
                        .typed(callee).arguments(insn, n - 3, callee, false);
                out.emitRecord(FUNC_CODE_INST_INVOKE, f.toArray());
                break;
            }
            case CALL: {
                CallOp op = (CallOp) insn.getOp();
                int n = insn.getNumOperands();
                Value callee = insn.getOperand(n - 1);
                f.add(attributeRef(op.attributes)).add((long) op.callingConv << 1 | (op.tail ? 1 : 0))
                        .typed(callee).arguments(insn, n - 1, callee, true);
                out.emitRecord(FUNC_CODE_INST_CALL, f.toArray());
                break;
            }
            case RESUME:
                out.emitRecord(FUNC_CODE_INST_RESUME, f.typed(insn.getOperand(0)).toArray());
                break;
            case UNREACHABLE:
                out.emitRecord(FUNC_CODE_INST_UNREACHABLE);
                break;
            case PHI:
                f.add(typeId(insn.getType()));
                for (int i = 0; i < insn.getNumOperands(); i += 2) {
                    f.value(insn.getOperand(i)).block(insn.getOperand(i + 1));
                }
                out.emitRecord(FUNC_CODE_INST_PHI, f.toArray());
                break;
            case LANDINGPAD: {
                LandingPadOp op = (LandingPadOp) insn.getOp();
                f.add(typeId(insn.getType())).typed(insn.getOperand(0))
                        .add(op.cleanup ? 1 : 0).add(op.clauses.size());
                for (int i = 0; i < op.clauses.size(); i++) {
                    f.add(op.clauses.get(i) == LandingPadOp.ClauseKind.CATCH ? LPAD_CATCH : LPAD_FILTER)
                            .typed(insn.getOperand(i + 1));
                }
                out.emitRecord(FUNC_CODE_INST_LANDINGPAD, f.toArray());
                break;
            }
            case ALLOCA: {
                AllocaOp op = (AllocaOp) insn.getOp();
                Value size = insn.getOperand(0);
                out.emitRecord(FUNC_CODE_INST_ALLOCA, typeId(insn.getType()), typeId(size.getType()),
                        id(size, ids), alignment(op.alignment));
                break;
            }
            case LOAD: {
                MemoryOp op = (MemoryOp) insn.getOp();
                f.typed(insn.getOperand(0)).add(alignment(op.alignment)).add(op.isVolatile ? 1 : 0);
                if (op.isAtomic()) {
                    f.add(op.ordering.ordinal()).add(syncScope(op.scope));
                    out.emitRecord(FUNC_CODE_INST_LOADATOMIC, f.toArray());
                } else {
                    out.emitRecord(FUNC_CODE_INST_LOAD, f.toArray());
                }
                break;
            }
            case STORE: {
                MemoryOp op = (MemoryOp) insn.getOp();
                f.typed(insn.getOperand(1)).value(insn.getOperand(0))
                        .add(alignment(op.alignment)).add(op.isVolatile ? 1 : 0);
                if (op.isAtomic()) {
                    f.add(op.ordering.ordinal()).add(syncScope(op.scope));
                    out.emitRecord(FUNC_CODE_INST_STOREATOMIC, f.toArray());
                } else {
                    out.emitRecord(FUNC_CODE_INST_STORE, f.toArray());
                }
                break;
            }
            case CMPXCHG: {
                MemoryOp op = (MemoryOp) insn.getOp();
                f.typed(insn.getOperand(0)).value(insn.getOperand(1)).value(insn.getOperand(2))
                        .add(op.isVolatile ? 1 : 0).add(op.ordering.ordinal()).add(syncScope(op.scope));
                out.emitRecord(FUNC_CODE_INST_CMPXCHG, f.toArray());
                break;
            }
            case ATOMICRMW: {
                RmwOp op = (RmwOp) insn.getOp();
                f.typed(insn.getOperand(0)).value(insn.getOperand(1)).add(op.operation.ordinal())
                        .add(op.isVolatile ? 1 : 0).add(op.ordering.ordinal()).add(syncScope(op.scope));
                out.emitRecord(FUNC_CODE_INST_ATOMICRMW, f.toArray());
                break;
            }
            case FENCE: {
                MemoryOp op = (MemoryOp) insn.getOp();
                out.emitRecord(FUNC_CODE_INST_FENCE, op.ordering.ordinal(), syncScope(op.scope));
                break;
            }
            case VAARG: {
                Value list = insn.getOperand(0);
                out.emitRecord(FUNC_CODE_INST_VAARG, typeId(list.getType()), id(list, ids), typeId(insn.getType()));
                break;
            }
            default:
                throw new UnsupportedOperationException("instruction " + insn);
        }
    }

    /**
     * The fields of one instruction record.
     */
    private final class Fields {
        final List<Long> fields = new ArrayList<>();
        final Map<Value, Integer> ids;
        final int self;
        final Function function;

        Fields(Map<Value, Integer> ids, int self, Function function) {
            this.ids = ids;
            this.self = self;
            this.function = function;
        }

        Fields add(long field) {
            fields.add(field);
            return this;
        }

        Fields value(Value value) {
            return add(id(value, ids));
        }

        Fields typed(Value value) {
            int id = id(value, ids);
            add(id);
            if (id >= self) add(typeId(value.getType()));
            return this;
        }

        Fields block(Value block) {
            int index = function.blocks.indexOf((BasicBlock) block);
            if (index == -1) throw new IllegalStateException(block + " is not in " + function);
            return add(index);
        }

        Fields arguments(Instruction insn, int count, Value callee, boolean labelsAsBlocks) {
            FunctionType fnTy = (FunctionType) ((PointerType) callee.getType()).getElementType();
            for (int i = 0; i < count; i++) {
                Value arg = insn.getOperand(i);
                if (i >= fnTy.getNumParams()) {
                    typed(arg);
                } else if (labelsAsBlocks && fnTy.getParam(i).isLabel()) {
                    block(arg);
                } else {
                    value(arg);
                }
            }
            return this;
        }

        long[] toArray() {
            return ModuleEncoder.toArray(fields);
        }
    }

    private int id(Value value, Map<Value, Integer> ids) {
        Integer id = ids.get(value);
        if (id == null) id = moduleIds.get(value);
        if (id == null) throw new IllegalStateException(value + " was not numbered");
        return id;
    }

    private long[] operandIds(Constant constant, Map<Value, Integer> ids) {
        long[] fields = new long[constant.getNumOperands()];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = id(constant.getOperand(i), ids);
        }
        return fields;
    }

    private static long[] toArray(List<Long> fields) {
        long[] array = new long[fields.size()];
        for (int i = 0; i < array.length; i++) array[i] = fields.get(i);
        return array;
    }

    private static long[] named(long id, String name) {
        long[] chars = utf8(name);
        long[] fields = new long[chars.length + 1];
        fields[0] = id;
        System.arraycopy(chars, 0, fields, 1, chars.length);
        return fields;
    }

    static long[] utf8(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        long[] fields = new long[bytes.length];
        for (int i = 0; i < bytes.length; i++) fields[i] = bytes[i] & 0xFF;
        return fields;
    }

    static long signRotate(long value) {
        if (value == Long.MIN_VALUE) return 1;
        return value >= 0 ? value << 1 : (-value << 1) | 1;
    }

    static long alignment(long bytes) {
        return bytes == 0 ? 0 : Long.numberOfTrailingZeros(bytes) + 1;
    }

    private static long syncScope(SyncScope scope) {
        return scope == SyncScope.SINGLE_THREAD ? 0 : 1;
    }

    private static long threadLocalMode(ThreadLocalMode mode) {
        return mode.ordinal();
    }

    static long linkage(Linkage linkage) {
        switch (linkage) {
            case EXTERNAL:
                return 0;
            case WEAK_ANY:
                return 1;
            case APPENDING:
                return 2;
            case INTERNAL:
                return 3;
            case LINK_ONCE_ANY:
                return 4;
            case EXTERNAL_WEAK:
                return 7;
            case COMMON:
                return 8;
            case PRIVATE:
                return 9;
            case WEAK_ODR:
                return 10;
            case LINK_ONCE_ODR:
                return 11;
            case AVAILABLE_EXTERNALLY:
                return 12;
            default:
                throw new IllegalArgumentException(linkage.toString());
        }
    }

    private static int binaryFlags(FlagsOp op) {
        int flags = 0;
        if (op.has(FlagsOp.NO_UNSIGNED_WRAP)) flags |= 1 << OBO_NO_UNSIGNED_WRAP;
        if (op.has(FlagsOp.NO_SIGNED_WRAP)) flags |= 1 << OBO_NO_SIGNED_WRAP;
        if (op.has(FlagsOp.EXACT)) flags |= 1 << PEO_EXACT;
        return flags;
    }

    static long binaryOpcode(Opcode opcode) {
        switch (opcode) {
            case ADD:
            case FADD:
                return BINOP_ADD;
            case SUB:
            case FSUB:
                return BINOP_SUB;
            case MUL:
            case FMUL:
                return BINOP_MUL;
            case UDIV:
                return BINOP_UDIV;
            case SDIV:
            case FDIV:
                return BINOP_SDIV;
            case UREM:
                return BINOP_UREM;
            case SREM:
            case FREM:
                return BINOP_SREM;
            case SHL:
                return BINOP_SHL;
            case LSHR:
                return BINOP_LSHR;
            case ASHR:
                return BINOP_ASHR;
            case AND:
                return BINOP_AND;
            case OR:
                return BINOP_OR;
            case XOR:
                return BINOP_XOR;
            default:
                throw new IllegalArgumentException(opcode.toString());
        }
    }

    static long castOpcode(Opcode opcode) {
        switch (opcode) {
            case TRUNC:
                return CAST_TRUNC;
            case ZEXT:
                return CAST_ZEXT;
            case SEXT:
                return CAST_SEXT;
            case FPTOUI:
                return CAST_FPTOUI;
            case FPTOSI:
                return CAST_FPTOSI;
            case UITOFP:
                return CAST_UITOFP;
            case SITOFP:
                return CAST_SITOFP;
            case FPTRUNC:
                return CAST_FPTRUNC;
            case FPEXT:
                return CAST_FPEXT;
            case PTRTOINT:
                return CAST_PTRTOINT;
            case INTTOPTR:
                return CAST_INTTOPTR;
            case BITCAST:
                return CAST_BITCAST;
            default:
                throw new UnsupportedOperationException(opcode.toString());
        }
    }
}
