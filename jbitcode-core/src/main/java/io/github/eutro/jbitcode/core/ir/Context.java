package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The owner of the uniqued constants of a module.
 */
public final class Context {
    private final Map<List<Object>, UniquedConstant> pool = new HashMap<>();

    /**
     * Get the constant with the given content, creating it if it doesn't exist.
     * <p>
     * Operands are compared by identity, since values are.
     *
     * @param kind     The class of the constant.
     * @param type     The type of the constant.
     * @param payload  Any non-operand content, or null.
     * @param operands The operands.
     * @param factory  Creates the constant if it doesn't exist.
     * @param <T>      The class of the constant.
     * @return The constant.
     */
    public <T extends UniquedConstant> T intern(Class<T> kind,
                                                Type type,
                                                Object payload,
                                                List<? extends Value> operands,
                                                Supplier<T> factory) {
        List<Object> key = new ArrayList<>(operands.size() + 3);
        key.add(kind);
        key.add(type);
        key.add(payload);
        key.addAll(operands);
        UniquedConstant existing = pool.get(key);
        if (existing != null) return kind.cast(existing);
        T created = factory.get();
        created.key = key;
        pool.put(key, created);
        return created;
    }

    void forget(UniquedConstant constant) {
        if (constant.key != null && pool.get(constant.key) == constant) {
            pool.remove(constant.key);
        }
        constant.key = null;
    }

    /**
     * Get the number of live uniqued constants.
     *
     * @return The number of constants.
     */
    public int size() {
        return pool.size();
    }
}
