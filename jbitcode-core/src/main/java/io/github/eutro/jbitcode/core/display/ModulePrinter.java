package io.github.eutro.jbitcode.core.display;

import io.github.eutro.jbitcode.core.attr.AttributeSet;
import io.github.eutro.jbitcode.core.attr.Attributes;
import io.github.eutro.jbitcode.core.ir.*;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.types.StructType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.*;
import io.github.eutro.jbitcode.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Prints a module as text in an assembly-like syntax.
 * <p>
 * The output only depends on the structure of the module: unnamed values are numbered
 * in order, and metadata nodes are numbered in the order they are first reached.
 * Two modules with the same graph print the same, so the text can be compared in tests.
 */
public class ModulePrinter implements IRPass<Module, String> {
    /**
     * A singleton instance of this pass.
     */
    public static final ModulePrinter INSTANCE = new ModulePrinter();

    @Override
    public String run(Module module) {
        return new Printer(module).print();
    }

    private static final class Printer {
        private final Module module;
        private final StringBuilder sb = new StringBuilder();
        private final Map<StructType, String> structNames = new HashMap<>();
        private final Map<GlobalValue, Integer> globalSlots = new HashMap<>();
        private final Map<MDNode, Integer> mdSlots = new LinkedHashMap<>();
        private final Map<Value, Integer> localSlots = new HashMap<>();

        Printer(Module module) {
            this.module = module;
        }

        String print() {
            numberStructs();
            numberGlobals();
            numberMetadata();

            if (module.getDataLayout() != null) {
                sb.append("target datalayout = ");
                quote(module.getDataLayout());
                sb.append('\n');
            }
            if (module.getTargetTriple() != null) {
                sb.append("target triple = ");
                quote(module.getTargetTriple());
                sb.append('\n');
            }
            if (!module.getModuleAsm().isEmpty()) {
                for (String line : module.getModuleAsm().split("\n", -1)) {
                    sb.append("module asm ");
                    quote(line);
                    sb.append('\n');
                }
            }
            for (String lib : module.getDependentLibraries()) {
                sb.append("deplib ");
                quote(lib);
                sb.append('\n');
            }
            for (StructType st : module.getIdentifiedStructTypes()) {
                sb.append(structNames.get(st)).append(" = type ");
                st.printBody(sb, this::structRef);
                sb.append('\n');
            }
            for (GlobalVariable global : module.globals) {
                printGlobal(global);
            }
            for (GlobalAlias alias : module.aliases) {
                printAlias(alias);
            }
            for (Function function : module.functions) {
                printFunction(function);
            }
            for (NamedMDNode named : module.getNamedMetadata()) {
                sb.append('!').append(named.getName()).append(" = !{");
                boolean first = true;
                for (MDNode node : named.getNodes()) {
                    if (!first) sb.append(", ");
                    first = false;
                    printMDRef(node);
                }
                sb.append("}\n");
            }
            for (Map.Entry<MDNode, Integer> entry : mdSlots.entrySet()) {
                sb.append('!').append(entry.getValue()).append(" = ");
                printMDBody(entry.getKey());
                sb.append('\n');
            }
            return sb.toString();
        }

        private void numberStructs() {
            int anon = 0;
            for (StructType st : module.getIdentifiedStructTypes()) {
                structNames.put(st, st.getName() == null ? "%" + anon++ : "%" + st.getName());
            }
        }

        private String structRef(StructType st) {
            String name = structNames.get(st);
            return name == null ? (st.getName() == null ? "%<anon>" : "%" + st.getName()) : name;
        }

        private void numberGlobals() {
            int slot = 0;
            List<GlobalValue> all = new ArrayList<>();
            all.addAll(module.globals);
            all.addAll(module.aliases);
            all.addAll(module.functions);
            for (GlobalValue gv : all) {
                if (!gv.hasName()) globalSlots.put(gv, slot++);
            }
        }

        private void numberMetadata() {
            Deque<MDNode> queue = new ArrayDeque<>();
            for (NamedMDNode named : module.getNamedMetadata()) {
                queue.addAll(named.getNodes());
            }
            for (Function function : module.functions) {
                for (BasicBlock block : function.blocks) {
                    for (Instruction insn : block.getInstructions()) {
                        queue.addAll(insn.getAllMetadata().values());
                        DebugLoc loc = insn.getDebugLoc();
                        if (loc != null) {
                            if (loc.getScope() != null) queue.add(loc.getScope());
                            if (loc.getInlinedAt() != null) queue.add(loc.getInlinedAt());
                        }
                        for (Value operand : insn.getOperands()) {
                            if (operand instanceof MDNode) queue.add((MDNode) operand);
                        }
                    }
                }
            }
            while (!queue.isEmpty()) {
                MDNode node = queue.poll();
                if (mdSlots.containsKey(node)) continue;
                mdSlots.put(node, mdSlots.size());
                for (Value operand : node.getOperands()) {
                    if (operand instanceof MDNode) queue.add((MDNode) operand);
                }
            }
        }

        private void numberLocals(Function function) {
            localSlots.clear();
            int slot = 0;
            for (Argument arg : function.getArguments()) {
                if (!arg.hasName()) localSlots.put(arg, slot++);
            }
            for (BasicBlock block : function.blocks) {
                if (!block.hasName()) localSlots.put(block, slot++);
                for (Instruction insn : block.getInstructions()) {
                    if (!insn.hasName() && !insn.getType().isVoid()) localSlots.put(insn, slot++);
                }
            }
        }

        private void quote(String s) {
            sb.append('"');
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '"' || c == '\\' || c < 0x20 || c >= 0x7F) {
                    sb.append('\\').append(String.format("%02X", c & 0xFF));
                } else {
                    sb.append(c);
                }
            }
            sb.append('"');
        }

        private void type(Type type) {
            type.print(sb, this::structRef);
        }

        private void printGlobal(GlobalVariable global) {
            globalRef(global);
            sb.append(" = ");
            if (global.isDeclaration() && global.getLinkage() == Linkage.EXTERNAL) {
                sb.append("external ");
            } else if (global.getLinkage() != Linkage.EXTERNAL) {
                sb.append(global.getLinkage()).append(' ');
            }
            printGlobalPrefix(global);
            if (global.isThreadLocal()) sb.append(global.getThreadLocalMode()).append(' ');
            if (global.getType().getAddressSpace() != 0) {
                sb.append("addrspace(").append(global.getType().getAddressSpace()).append(") ");
            }
            sb.append(global.isConstant() ? "constant " : "global ");
            Constant init = global.getInitializer();
            if (init == null) {
                type(global.getValueType());
            } else {
                typedOperand(init);
            }
            printGlobalSuffix(global);
            sb.append('\n');
        }

        private void printGlobalPrefix(GlobalValue gv) {
            if (gv.getVisibility() != Visibility.DEFAULT) sb.append(gv.getVisibility()).append(' ');
            if (gv.hasUnnamedAddr()) sb.append("unnamed_addr ");
        }

        private void printGlobalSuffix(GlobalValue gv) {
            if (gv.getSection() != null) {
                sb.append(", section ");
                quote(gv.getSection());
            }
            if (gv.getAlignment() != 0) sb.append(", align ").append(gv.getAlignment());
        }

        private void printAlias(GlobalAlias alias) {
            globalRef(alias);
            sb.append(" = ");
            printGlobalPrefix(alias);
            sb.append("alias ");
            if (alias.getLinkage() != Linkage.EXTERNAL) sb.append(alias.getLinkage()).append(' ');
            Constant aliasee = alias.getAliasee();
            if (aliasee == null) {
                sb.append("null");
            } else {
                typedOperand(aliasee);
            }
            sb.append('\n');
        }

        private void printFunction(Function function) {
            numberLocals(function);
            sb.append('\n').append(function.isDeclaration() ? "declare " : "define ");
            if (function.getLinkage() != Linkage.EXTERNAL) sb.append(function.getLinkage()).append(' ');
            printGlobalPrefix(function);
            if (function.getCallingConv() != CallOp.CC_C) sb.append("cc").append(function.getCallingConv()).append(' ');
            AttributeSet attrs = function.getAttributes();
            attrs(attrs.getReturnAttributes());
            type(function.getFunctionType().getReturnType());
            sb.append(' ');
            globalRef(function);
            sb.append('(');
            for (Argument arg : function.getArguments()) {
                if (arg.getArgNo() != 0) sb.append(", ");
                type(arg.getType());
                sb.append(' ');
                attrs(attrs.getParamAttributes(arg.getArgNo()));
                localRef(arg);
            }
            if (function.getFunctionType().isVarArg()) {
                sb.append(function.getArguments().isEmpty() ? "..." : ", ...");
            }
            sb.append(')');
            Attributes fnAttrs = attrs.getFunctionAttributes();
            if (!fnAttrs.isEmpty()) sb.append(' ').append(fnAttrs);
            printGlobalSuffix(function);
            if (function.getGC() != null) {
                sb.append(" gc ");
                quote(function.getGC());
            }
            if (function.isDeclaration()) {
                sb.append('\n');
                return;
            }
            sb.append(" {\n");
            for (BasicBlock block : function.blocks) {
                if (block.hasName()) {
                    sb.append(block.getName());
                } else {
                    sb.append(localSlots.get(block));
                }
                sb.append(":\n");
                for (Instruction insn : block.getInstructions()) {
                    sb.append("  ");
                    printInstruction(insn);
                    sb.append('\n');
                }
            }
            sb.append("}\n");
        }

        private void attrs(Attributes attributes) {
            if (!attributes.isEmpty()) sb.append(attributes).append(' ');
        }

        private void printInstruction(Instruction insn) {
            if (!insn.getType().isVoid()) {
                localRef(insn);
                sb.append(" = ");
            }
            Op op = insn.getOp();
            sb.append(op);
            switch (op.key) {
                case ALLOCA:
                    sb.append(' ');
                    type(((AllocaOp) op).allocatedType);
                    if (insn.getNumOperands() != 0) {
                        sb.append(", ");
                        typedOperand(insn.getOperand(0));
                    }
                    if (((AllocaOp) op).alignment != 0) sb.append(", align ").append(((AllocaOp) op).alignment);
                    break;
                case CALL:
                case INVOKE: {
                    CallOp call = (CallOp) op;
                    int nArgs = insn.getNumOperands() - (op.key == Opcode.INVOKE ? 3 : 1);
                    Value callee = insn.getOperand(nArgs);
                    sb.append(' ');
                    type(insn.getType());
                    sb.append(' ');
                    operand(callee);
                    sb.append('(');
                    for (int i = 0; i < nArgs; i++) {
                        if (i != 0) sb.append(", ");
                        attrs(call.attributes.getParamAttributes(i));
                        typedOperand(insn.getOperand(i));
                    }
                    sb.append(')');
                    Attributes fnAttrs = call.attributes.getFunctionAttributes();
                    if (!fnAttrs.isEmpty()) sb.append(' ').append(fnAttrs);
                    if (op.key == Opcode.INVOKE) {
                        sb.append(" to ");
                        typedOperand(insn.getOperand(nArgs + 1));
                        sb.append(" unwind ");
                        typedOperand(insn.getOperand(nArgs + 2));
                    }
                    break;
                }
                default:
                    if (op.key.isCast() || op.key == Opcode.VAARG) {
                        sb.append(' ');
                        typedOperand(insn.getOperand(0));
                        sb.append(" to ");
                        type(insn.getType());
                        break;
                    }
                    for (int i = 0; i < insn.getNumOperands(); i++) {
                        sb.append(i == 0 ? " " : ", ");
                        typedOperand(insn.getOperand(i));
                    }
                    if (op.key == Opcode.LANDINGPAD) {
                        sb.append(" ->");
                        type(insn.getType());
                        for (LandingPadOp.ClauseKind kind : ((LandingPadOp) op).clauses) {
                            sb.append(' ').append(kind.name().toLowerCase());
                        }
                    }
            }
            if (op instanceof MemoryOp) ((MemoryOp) op).printSuffix(sb);
            DebugLoc loc = insn.getDebugLoc();
            if (loc != null) {
                sb.append(", !dbg !{").append(loc.getLine()).append(", ").append(loc.getColumn()).append(", ");
                printMDRef(loc.getScope());
                sb.append(", ");
                printMDRef(loc.getInlinedAt());
                sb.append('}');
            }
            List<String> kinds = module.getMDKindNames();
            for (Map.Entry<Integer, MDNode> entry : insn.getAllMetadata().entrySet()) {
                int kind = entry.getKey();
                sb.append(", !").append(kind < kinds.size() ? kinds.get(kind) : Integer.toString(kind)).append(' ');
                printMDRef(entry.getValue());
            }
        }

        private void globalRef(GlobalValue gv) {
            sb.append('@');
            if (gv.hasName()) {
                sb.append(gv.getName());
            } else {
                sb.append(globalSlots.get(gv));
            }
        }

        private void localRef(Value value) {
            sb.append('%');
            if (value.hasName()) {
                sb.append(value.getName());
            } else {
                Integer slot = localSlots.get(value);
                sb.append(slot == null ? "<badref>" : slot.toString());
            }
        }

        private void printMDRef(@Nullable MDNode node) {
            if (node == null) {
                sb.append("null");
            } else {
                Integer slot = mdSlots.get(node);
                sb.append('!').append(slot == null ? "<badref>" : slot.toString());
            }
        }

        private void printMDBody(MDNode node) {
            sb.append(node.isFunctionLocal() ? "local !{" : "!{");
            for (int i = 0; i < node.getNumOperands(); i++) {
                if (i != 0) sb.append(", ");
                Value operand = node.getOperand(i);
                if (operand == null) {
                    sb.append("null");
                } else {
                    typedOperand(operand);
                }
            }
            sb.append('}');
        }

        private void typedOperand(@Nullable Value value) {
            if (value == null) {
                sb.append("<null operand>");
                return;
            }
            if (!(value instanceof MDNode || value instanceof MDString)) {
                type(value.getType());
                sb.append(' ');
            }
            operand(value);
        }

        private void operand(@Nullable Value value) {
            if (value == null) {
                sb.append("<null operand>");
            } else if (value instanceof GlobalValue) {
                globalRef((GlobalValue) value);
            } else if (value instanceof Argument || value instanceof Instruction || value instanceof BasicBlock) {
                localRef(value);
            } else if (value instanceof MDNode) {
                printMDRef((MDNode) value);
            } else if (value instanceof MDString) {
                sb.append('!');
                quote(((MDString) value).getString());
            } else if (value instanceof Constant) {
                constant((Constant) value);
            } else {
                sb.append("<badref>");
            }
        }

        private void constant(Constant c) {
            if (c instanceof ConstantInt) {
                ConstantInt ci = (ConstantInt) c;
                if (ci.getType().getWidth() == 1) {
                    sb.append(ci.isZero() ? "false" : "true");
                } else {
                    sb.append(ci.getValue());
                }
            } else if (c instanceof ConstantFP) {
                sb.append("0x").append(((ConstantFP) c).getBits().toString(16).toUpperCase());
            } else if (c instanceof ConstantNull) {
                sb.append(c.getType().isPointer() ? "null" : "zeroinitializer");
            } else if (c instanceof UndefValue) {
                sb.append("undef");
            } else if (c instanceof ConstantDataArray) {
                ConstantDataArray data = (ConstantDataArray) c;
                if (data.isString() && !data.getType().isVector()) {
                    sb.append('c');
                    byte[] bytes = new byte[data.getNumElements()];
                    for (int i = 0; i < bytes.length; i++) bytes[i] = (byte) data.getElement(i);
                    quote(new String(bytes, java.nio.charset.StandardCharsets.ISO_8859_1));
                } else {
                    sb.append(data.getType().isVector() ? "<" : "[");
                    for (int i = 0; i < data.getNumElements(); i++) {
                        if (i != 0) sb.append(", ");
                        type(data.getType().getElementType());
                        sb.append(' ').append(data.getElement(i));
                    }
                    sb.append(data.getType().isVector() ? ">" : "]");
                }
            } else if (c instanceof ConstantAggregate) {
                String open, close;
                if (c.getType().isStruct()) {
                    boolean packed = ((StructType) c.getType()).isPacked();
                    open = packed ? "<{ " : "{ ";
                    close = packed ? " }>" : " }";
                } else if (c.getType().isVector()) {
                    open = "<";
                    close = ">";
                } else {
                    open = "[";
                    close = "]";
                }
                sb.append(open);
                for (int i = 0; i < c.getNumOperands(); i++) {
                    if (i != 0) sb.append(", ");
                    typedOperand(c.getOperand(i));
                }
                sb.append(close);
            } else if (c instanceof ConstantExpr) {
                ConstantExpr ce = (ConstantExpr) c;
                sb.append(ce.getOp()).append(" (");
                for (int i = 0; i < ce.getNumOperands(); i++) {
                    if (i != 0) sb.append(", ");
                    typedOperand(ce.getOperand(i));
                }
                if (ce.getOpcode().isCast()) {
                    sb.append(" to ");
                    type(ce.getType());
                }
                sb.append(')');
            } else if (c instanceof InlineAsm) {
                InlineAsm asm = (InlineAsm) c;
                sb.append("asm ");
                if (asm.hasSideEffects()) sb.append("sideeffect ");
                if (asm.isAlignStack()) sb.append("alignstack ");
                quote(asm.getAsm());
                sb.append(", ");
                quote(asm.getConstraints());
            } else if (c instanceof BlockAddress) {
                BlockAddress ba = (BlockAddress) c;
                sb.append("blockaddress(");
                globalRef(ba.getFunction());
                sb.append(", ");
                BasicBlock bb = ba.getBlock();
                Function fn = bb.getParent();
                sb.append('%').append(bb.hasName() ? bb.getName() : fn == null ? "<detached>" : Integer.toString(fn.blocks.indexOf(bb)));
                sb.append(')');
            } else {
                sb.append("<placeholder>");
            }
        }
    }
}
