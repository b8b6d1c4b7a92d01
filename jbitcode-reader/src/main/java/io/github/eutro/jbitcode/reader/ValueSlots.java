package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.User;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * An indexed table of values, held as uses so that replacing a value anywhere
 * in the graph replaces it in the table too.
 */
final class ValueSlots extends User {
    ValueSlots() {
        super(Type.VOID);
    }

    void add(@Nullable Value value) {
        addOperand(value);
    }

    void truncate(int size) {
        truncateOperands(size);
    }
}
