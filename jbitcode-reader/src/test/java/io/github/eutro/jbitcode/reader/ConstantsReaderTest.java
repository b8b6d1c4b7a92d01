package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.ConstantAggregate;
import io.github.eutro.jbitcode.core.ir.ConstantDataArray;
import io.github.eutro.jbitcode.core.ir.ConstantExpr;
import io.github.eutro.jbitcode.core.ir.ConstantFP;
import io.github.eutro.jbitcode.core.ir.ConstantInt;
import io.github.eutro.jbitcode.core.ir.ConstantNull;
import io.github.eutro.jbitcode.core.ir.UndefValue;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.CmpOp;
import io.github.eutro.jbitcode.core.ops.Opcode;
import io.github.eutro.jbitcode.core.ops.Predicate;
import io.github.eutro.jbitcode.reader.bitstream.BitstreamWriter;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.function.Consumer;

import static io.github.eutro.jbitcode.reader.BitcodeCodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConstantsReaderTest {
    private static final long I32 = 0;
    private static final long I32_ARRAY = 1;
    private static final long I8 = 2;
    private static final long I8_ARRAY = 3;
    private static final long I128 = 4;
    private static final long DOUBLE = 5;
    private static final long X86_FP80 = 6;
    private static final long FP128 = 7;
    private static final long FLOAT = 8;
    private static final long I1 = 9;
    private static final long PAIR = 10;
    private static final long PTR_I32 = 11;
    private static final long I64 = 12;

    private static byte[] constants(Consumer<BitstreamWriter> records) {
        BitstreamWriter w = Containers.module();
        w.enterSubBlock(TYPE_BLOCK_ID_NEW, 4);
        w.emitRecord(TYPE_CODE_NUMENTRY, 13);
        w.emitRecord(TYPE_CODE_INTEGER, 32);
        w.emitRecord(TYPE_CODE_ARRAY, 1000, I32);
        w.emitRecord(TYPE_CODE_INTEGER, 8);
        w.emitRecord(TYPE_CODE_ARRAY, 6, I8);
        w.emitRecord(TYPE_CODE_INTEGER, 128);
        w.emitRecord(TYPE_CODE_DOUBLE);
        w.emitRecord(TYPE_CODE_X86_FP80);
        w.emitRecord(TYPE_CODE_FP128);
        w.emitRecord(TYPE_CODE_FLOAT);
        w.emitRecord(TYPE_CODE_INTEGER, 1);
        w.emitRecord(TYPE_CODE_STRUCT_ANON, 0, I32, I8);
        w.emitRecord(TYPE_CODE_POINTER, I32);
        w.emitRecord(TYPE_CODE_INTEGER, 64);
        w.exitBlock();

        w.enterSubBlock(CONSTANTS_BLOCK_ID, 4);
        records.accept(w);
        w.exitBlock();
        return Containers.finish(w);
    }

    private static ValueTable read(Consumer<BitstreamWriter> records) throws BitcodeException {
        BitcodeReader reader = Bitcode.openReader(constants(records), ReaderOptions.DEFAULT);
        reader.readModule();
        return reader.getValueTable();
    }

    private static ErrorKind failure(Consumer<BitstreamWriter> records) {
        byte[] bytes = constants(records);
        return assertThrows(BitcodeException.class, () -> Bitcode.parseModule(bytes)).getKind();
    }

    @Test
    void forwardReferencedOperandsAreFilledIn() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_CE_BINOP, BINOP_ADD, 1, 2);
            w.emitRecord(CST_CODE_INTEGER, 2);
            w.emitRecord(CST_CODE_INTEGER, 4);
        });
        assertEquals(3, values.size());
        ConstantExpr sum = (ConstantExpr) values.get(0);
        assertNotNull(sum);
        assertEquals(Opcode.ADD, sum.getOpcode());
        assertSame(values.get(1), sum.getOperand(0));
        assertSame(values.get(2), sum.getOperand(1));
        assertEquals(1, ((ConstantInt) sum.getOperand(0)).getSExtValue());
        assertEquals(1, values.getRebuildCount());
    }

    @Test
    void largeAggregateIsRebuiltOnce() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, I32_ARRAY);
            long[] elements = new long[1000];
            for (int i = 0; i < elements.length; i++) {
                elements[i] = i + 1;
            }
            w.emitRecord(CST_CODE_AGGREGATE, elements);
            w.emitRecord(CST_CODE_SETTYPE, I32);
            for (int i = 0; i < 1000; i++) {
                w.emitRecord(CST_CODE_INTEGER, 2L * i);
            }
        });
        assertEquals(1001, values.size());
        ConstantAggregate array = (ConstantAggregate) values.get(0);
        assertNotNull(array);
        assertEquals(1000, array.getNumOperands());
        for (int i = 0; i < 1000; i++) {
            assertSame(values.get(i + 1), array.getOperand(i));
            assertEquals(i, ((ConstantInt) array.getOperand(i)).getSExtValue());
        }
        assertEquals(1, values.getRebuildCount());
    }

    @Test
    void constantNeverDefined() {
        assertEquals(ErrorKind.UNRESOLVED_FORWARD_REFERENCE,
                failure(w -> w.emitRecord(CST_CODE_CE_BINOP, BINOP_MUL, 1, 1)));
    }

    @Test
    void strings() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, I8_ARRAY);
            w.emitRecord(CST_CODE_STRING, "hello!");
            w.emitRecord(CST_CODE_CSTRING, "hello");
        });
        ConstantDataArray plain = (ConstantDataArray) values.get(0);
        ConstantDataArray terminated = (ConstantDataArray) values.get(1);
        assertNotNull(plain);
        assertNotNull(terminated);
        assertTrue(plain.isString());
        assertEquals(6, plain.getNumElements());
        assertEquals('h', plain.getElement(0));
        assertEquals('!', plain.getElement(5));
        assertEquals(6, terminated.getNumElements());
        assertEquals('o', terminated.getElement(4));
        assertEquals(0, terminated.getElement(5));
    }

    @Test
    void stringOfANonArray() {
        assertEquals(ErrorKind.INVALID_RECORD, failure(w -> w.emitRecord(CST_CODE_STRING, "a")));
    }

    @Test
    void integers() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, I128);
            w.emitRecord(CST_CODE_WIDE_INTEGER, 10, 2);
            w.emitRecord(CST_CODE_SETTYPE, I32);
            w.emitRecord(CST_CODE_INTEGER, 11);
            w.emitRecord(CST_CODE_SETTYPE, I64);
            w.emitRecord(CST_CODE_INTEGER, 1);
        });
        ConstantInt wide = (ConstantInt) values.get(0);
        assertNotNull(wide);
        assertEquals(BigInteger.ONE.shiftLeft(64).add(BigInteger.valueOf(5)), wide.getValue());
        assertEquals(-5, ((ConstantInt) values.get(1)).getSExtValue());
        assertEquals(Long.MIN_VALUE, ((ConstantInt) values.get(2)).getSExtValue());
    }

    @Test
    void floats() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, DOUBLE);
            w.emitRecord(CST_CODE_FLOAT, Double.doubleToRawLongBits(1.5));
            w.emitRecord(CST_CODE_SETTYPE, X86_FP80);
            w.emitRecord(CST_CODE_FLOAT, 0x3FFF800000000000L, 0);
            w.emitRecord(CST_CODE_SETTYPE, FLOAT);
            w.emitRecord(CST_CODE_FLOAT, Float.floatToRawIntBits(2.5f));
            w.emitRecord(CST_CODE_SETTYPE, FP128);
            w.emitRecord(CST_CODE_FLOAT, 1, 0x3FFF000000000000L);
        });
        ConstantFP d = (ConstantFP) values.get(0);
        assertNotNull(d);
        assertEquals(Type.DOUBLE, d.getType());
        assertEquals(Double.doubleToRawLongBits(1.5), d.getBits().longValueExact());

        ConstantFP x87 = (ConstantFP) values.get(1);
        assertNotNull(x87);
        assertEquals(new BigInteger("3FFF8000000000000000", 16), x87.getBits());

        ConstantFP f = (ConstantFP) values.get(2);
        assertNotNull(f);
        assertEquals(Float.floatToRawIntBits(2.5f), f.getBits().intValue());

        ConstantFP quad = (ConstantFP) values.get(3);
        assertNotNull(quad);
        assertEquals(new BigInteger("3FFF0000000000000000000000000001", 16), quad.getBits());
    }

    @Test
    void nullsUndefsAndExpressions() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, PTR_I32);
            w.emitRecord(CST_CODE_NULL);
            w.emitRecord(CST_CODE_SETTYPE, I32);
            w.emitRecord(CST_CODE_UNDEF);
            w.emitRecord(CST_CODE_SETTYPE, I64);
            w.emitRecord(CST_CODE_CE_CAST, CAST_SEXT, I32, 1);
            w.emitRecord(CST_CODE_SETTYPE, I1);
            w.emitRecord(CST_CODE_INTEGER, 2);
            w.emitRecord(CST_CODE_SETTYPE, I32);
            w.emitRecord(CST_CODE_CE_SELECT, 3, 1, 1);
            w.emitRecord(CST_CODE_CE_CMP, I32, 1, 1, 40);
        });
        Value nullPtr = values.get(0);
        assertTrue(nullPtr instanceof ConstantNull);
        assertEquals(PointerType.getUnqual(Type.i32()), nullPtr.getType());

        Value undef = values.get(1);
        assertTrue(undef instanceof UndefValue);
        assertEquals(Type.i32(), undef.getType());

        ConstantExpr sext = (ConstantExpr) values.get(2);
        assertNotNull(sext);
        assertEquals(Opcode.SEXT, sext.getOpcode());
        assertEquals(Type.i64(), sext.getType());
        assertSame(undef, sext.getOperand(0));

        ConstantExpr select = (ConstantExpr) values.get(4);
        assertNotNull(select);
        assertEquals(Opcode.SELECT, select.getOpcode());
        assertSame(values.get(3), select.getOperand(0));

        ConstantExpr cmp = (ConstantExpr) values.get(5);
        assertNotNull(cmp);
        assertEquals(Type.i1(), cmp.getType());
        assertEquals(Predicate.ICMP_SLT, ((CmpOp) cmp.getOp()).predicate);
        assertEquals(0, values.getRebuildCount());
    }

    @Test
    void unknownCodesReadAsUndef() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, I8);
            w.emitRecord(99, 1, 2, 3);
        });
        Value value = values.get(0);
        assertTrue(value instanceof UndefValue);
        assertEquals(Type.i8(), value.getType());
    }

    @Test
    void structAggregates() throws BitcodeException {
        ValueTable values = read(w -> {
            w.emitRecord(CST_CODE_SETTYPE, PAIR);
            w.emitRecord(CST_CODE_AGGREGATE, 1, 2);
            w.emitRecord(CST_CODE_SETTYPE, I32);
            w.emitRecord(CST_CODE_INTEGER, 14);
            w.emitRecord(CST_CODE_SETTYPE, I8);
            w.emitRecord(CST_CODE_INTEGER, 2);
        });
        ConstantAggregate pair = (ConstantAggregate) values.get(0);
        assertNotNull(pair);
        Constant first = pair.getConstantOperand(0);
        assertEquals(7, ((ConstantInt) first).getSExtValue());
        assertEquals(Type.i8(), pair.getOperand(1).getType());
        assertEquals(1, values.getRebuildCount());

        assertEquals(ErrorKind.INVALID_RECORD, failure(w -> {
            w.emitRecord(CST_CODE_SETTYPE, PAIR);
            w.emitRecord(CST_CODE_AGGREGATE, 1);
        }));
    }

    @Test
    void referenceOfTheWrongType() {
        assertEquals(ErrorKind.TYPE_MISMATCH, failure(w -> {
            w.emitRecord(CST_CODE_INTEGER, 2);
            w.emitRecord(CST_CODE_SETTYPE, I8);
            w.emitRecord(CST_CODE_CE_BINOP, BINOP_ADD, 0, 0);
        }));
    }
}
