package io.github.eutro.jbitcode.core.ext;

import io.github.eutro.jbitcode.core.ir.Function;
import io.github.eutro.jbitcode.core.ir.Module;
import io.github.eutro.jbitcode.core.ir.types.FunctionType;
import io.github.eutro.jbitcode.core.ir.types.Type;
import io.github.eutro.jbitcode.core.ops.Linkage;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    private static final Ext<String> SOURCE = Ext.create(String.class, "SOURCE");
    private static final Ext<Integer> LEVEL = Ext.create(Integer.class, "LEVEL");

    @Test
    void attachAndRemove() {
        ExtHolder holder = new ExtHolder();
        assertNull(holder.getNullable(SOURCE));
        assertFalse(holder.getExt(SOURCE).isPresent());
        assertThrows(NoSuchElementException.class, () -> holder.getExtOrThrow(SOURCE));

        holder.attachExt(SOURCE, "a.bc");
        holder.attachExt(LEVEL, 2);
        assertEquals("a.bc", holder.getExtOrThrow(SOURCE));
        assertEquals(2, holder.getNullable(LEVEL));

        holder.removeExt(SOURCE);
        assertNull(holder.getNullable(SOURCE));
        assertEquals(2, holder.getNullable(LEVEL));
    }

    @Test
    void globalsLookThroughToTheirModule() {
        Module module = new Module();
        module.attachExt(SOURCE, "a.bc");
        Function f = new Function(FunctionType.get(Type.VOID, Collections.emptyList(), false), Linkage.EXTERNAL, "f");
        assertNull(f.getNullable(SOURCE));

        module.functions.add(f);
        assertSame(module, f.getExtOrThrow(CommonExts.OWNING_MODULE));
        assertEquals("a.bc", f.getNullable(SOURCE));

        f.attachExt(SOURCE, "b.bc");
        assertEquals("b.bc", f.getNullable(SOURCE));

        module.functions.remove(f);
        assertNull(f.getParent());
        f.removeExt(SOURCE);
        assertNull(f.getNullable(SOURCE));
    }

    @Test
    void extsHaveADistinctIdentity() {
        Ext<String> other = Ext.create(String.class, "SOURCE");
        assertNotEquals(SOURCE, other);
        assertEquals("SOURCE", other.getName());
        assertEquals(String.class, other.getType());
    }
}
