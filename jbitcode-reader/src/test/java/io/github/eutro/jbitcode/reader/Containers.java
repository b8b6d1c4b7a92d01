package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.reader.bitstream.BitstreamWriter;

import java.util.function.Consumer;

import static io.github.eutro.jbitcode.reader.BitcodeCodes.*;

/**
 * Hand-assembled containers for the reader tests.
 */
final class Containers {
    // ids in the table written by standardTypes
    static final long T_I32 = 0;
    static final long T_I1 = 1;
    static final long T_VOID = 2;
    static final long T_FN_I32_I32 = 3;
    static final long T_PTR_FN_I32_I32 = 4;
    static final long T_PTR_I32 = 5;
    static final long T_FN_VOID = 6;
    static final long T_PTR_FN_VOID = 7;
    static final long T_I8 = 8;
    static final long T_PTR_I8 = 9;
    static final long T_METADATA = 10;
    static final long T_PTR_PTR_I8 = 11;

    static final String TRIPLE = "x86_64-pc-linux-gnu";

    private Containers() {
    }

    /**
     * Start a container with an open module block.
     */
    static BitstreamWriter module() {
        BitstreamWriter w = new BitstreamWriter().writeMagic();
        w.enterSubBlock(MODULE_BLOCK_ID, 3);
        w.emitRecord(MODULE_CODE_VERSION, 0);
        return w;
    }

    static byte[] finish(BitstreamWriter w) {
        w.exitBlock();
        return w.toByteArray();
    }

    static void standardTypes(BitstreamWriter w) {
        w.enterSubBlock(TYPE_BLOCK_ID_NEW, 4);
        w.emitRecord(TYPE_CODE_NUMENTRY, 12);
        w.emitRecord(TYPE_CODE_INTEGER, 32);
        w.emitRecord(TYPE_CODE_INTEGER, 1);
        w.emitRecord(TYPE_CODE_VOID);
        w.emitRecord(TYPE_CODE_FUNCTION, 0, T_I32, T_I32);
        w.emitRecord(TYPE_CODE_POINTER, T_FN_I32_I32);
        w.emitRecord(TYPE_CODE_POINTER, T_I32);
        w.emitRecord(TYPE_CODE_FUNCTION, 0, T_VOID);
        w.emitRecord(TYPE_CODE_POINTER, T_FN_VOID);
        w.emitRecord(TYPE_CODE_INTEGER, 8);
        w.emitRecord(TYPE_CODE_POINTER, T_I8);
        w.emitRecord(TYPE_CODE_METADATA);
        w.emitRecord(TYPE_CODE_POINTER, T_PTR_I8);
        w.exitBlock();
    }

    /**
     * A function record for an {@code i32 (i32)} function.
     */
    static void functionRecord(BitstreamWriter w, boolean isProto) {
        w.emitRecord(MODULE_CODE_FUNCTION, T_PTR_FN_I32_I32, 0, isProto ? 1 : 0, 0, 0, 0, 0, 0);
    }

    static void body(BitstreamWriter w, Consumer<BitstreamWriter> records) {
        w.enterSubBlock(FUNCTION_BLOCK_ID, 4);
        records.accept(w);
        w.exitBlock();
    }

    static void names(BitstreamWriter w, String... names) {
        w.enterSubBlock(VALUE_SYMTAB_BLOCK_ID, 4);
        for (int i = 0; i < names.length; i++) {
            if (names[i] != null) w.emitRecord(VST_CODE_ENTRY, i, names[i]);
        }
        w.exitBlock();
    }

    /**
     * <pre>
     * target triple = "x86_64-pc-linux-gnu"
     * &#64;counter = global i32 42, align 4
     *
     * define i32 &#64;sum(i32 %x) {
     *   %t = add i32 %x, 42
     *   %r = call i32 &#64;ext(i32 %t)
     *   store i32 %r, i32* &#64;counter, align 4
     *   ret i32 %r
     * }
     *
     * declare i32 &#64;ext(i32)
     *
     * define i32 &#64;twice(i32 %y) {
     *   %d = add i32 %y, %y
     *   ; then as many more adds as asked for
     *   ret i32 %d
     * }
     * </pre>
     * Module values are numbered {@code @counter, @sum, @ext, @twice, 42}, so both bodies
     * start numbering at 5.
     */
    static byte[] sumModule(int extraAdds) {
        BitstreamWriter w = module();
        standardTypes(w);
        w.emitRecord(MODULE_CODE_TRIPLE, TRIPLE);
        w.emitRecord(MODULE_CODE_GLOBALVAR, T_PTR_I32, 0, 5, 0, 3, 0);
        functionRecord(w, false);
        functionRecord(w, true);
        functionRecord(w, false);

        w.enterSubBlock(CONSTANTS_BLOCK_ID, 4);
        w.emitRecord(CST_CODE_SETTYPE, T_I32);
        w.emitRecord(CST_CODE_INTEGER, 84);
        w.exitBlock();
        names(w, "counter", "sum", "ext", "twice");

        body(w, b -> {
            b.emitRecord(FUNC_CODE_DECLAREBLOCKS, 1);
            b.emitRecord(FUNC_CODE_INST_BINOP, 5, 4, 0);
            b.emitRecord(FUNC_CODE_INST_CALL, 0, 0, 2, 6);
            b.emitRecord(FUNC_CODE_INST_STORE, 0, 7, 3, 0);
            b.emitRecord(FUNC_CODE_INST_RET, 7);
            names(b, null, null, null, null, null, "x", "t", "r");
        });
        body(w, b -> {
            b.emitRecord(FUNC_CODE_DECLAREBLOCKS, 1);
            b.emitRecord(FUNC_CODE_INST_BINOP, 5, 5, 0);
            for (int i = 0; i < extraAdds; i++) {
                b.emitRecord(FUNC_CODE_INST_BINOP, 5, 5, 0);
            }
            b.emitRecord(FUNC_CODE_INST_RET, 6);
            names(b, null, null, null, null, null, "y", "d");
        });
        return finish(w);
    }

    static byte[] sumModule() {
        return sumModule(0);
    }

    /**
     * A module with standard types, defining {@code i32 @f(i32)} as value 0. Anything written by
     * {@code moduleLevel} comes after the function record, so the argument of {@code @f} is numbered
     * after whatever values it adds.
     */
    static byte[] function(Consumer<BitstreamWriter> moduleLevel, Consumer<BitstreamWriter> records) {
        BitstreamWriter w = module();
        standardTypes(w);
        functionRecord(w, false);
        moduleLevel.accept(w);
        names(w, "f");
        body(w, records);
        return finish(w);
    }

    /**
     * Like {@link #function(Consumer, Consumer)}, with nothing else at module level, so the
     * argument is value 1 and the first instruction is value 2.
     */
    static byte[] function(Consumer<BitstreamWriter> records) {
        return function(w -> {
        }, records);
    }

    /**
     * A module with standard types and just a module-level constants block.
     */
    static byte[] constants(Consumer<BitstreamWriter> records) {
        BitstreamWriter w = module();
        standardTypes(w);
        w.enterSubBlock(CONSTANTS_BLOCK_ID, 4);
        records.accept(w);
        w.exitBlock();
        return finish(w);
    }
}
