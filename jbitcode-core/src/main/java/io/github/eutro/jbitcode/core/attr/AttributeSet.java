package io.github.eutro.jbitcode.core.attr;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The attributes of a function or call site, keyed by slot index:
 * {@link #RETURN_INDEX} for the return value, 1 to n for parameters,
 * {@link #FUNCTION_INDEX} for the function itself.
 * <p>
 * Instances are immutable and compare by content. A reader interns them, so sets
 * decoded from the same attribute record are identical.
 */
public final class AttributeSet {
    public static final int RETURN_INDEX = 0;
    public static final int FUNCTION_INDEX = -1;

    public static final AttributeSet EMPTY = new AttributeSet(Collections.emptySortedMap());

    private final SortedMap<Integer, Attributes> slots;

    private AttributeSet(SortedMap<Integer, Attributes> slots) {
        this.slots = slots;
    }

    /**
     * Build an attribute set from slot/attribute pairs. Empty attributes are dropped,
     * and attributes for the same slot are merged.
     *
     * @param slots The attributes by slot index.
     * @return The set.
     */
    public static AttributeSet of(Map<Integer, Attributes> slots) {
        TreeMap<Integer, Attributes> copy = new TreeMap<>();
        for (Map.Entry<Integer, Attributes> entry : slots.entrySet()) {
            if (entry.getValue().isEmpty()) continue;
            copy.merge(entry.getKey(), entry.getValue(),
                    (a, b) -> Attributes.fromRaw(a.getRaw() | b.getRaw()));
        }
        return copy.isEmpty() ? EMPTY : new AttributeSet(Collections.unmodifiableSortedMap(copy));
    }

    public Attributes get(int index) {
        return slots.getOrDefault(index, Attributes.NONE);
    }

    public Attributes getFunctionAttributes() {
        return get(FUNCTION_INDEX);
    }

    public Attributes getReturnAttributes() {
        return get(RETURN_INDEX);
    }

    /**
     * Get the attributes of a parameter.
     *
     * @param param The zero-based parameter number.
     * @return The attributes.
     */
    public Attributes getParamAttributes(int param) {
        return get(param + 1);
    }

    public SortedMap<Integer, Attributes> getSlots() {
        return slots;
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof AttributeSet && ((AttributeSet) o).slots.equals(slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }

    @Override
    public String toString() {
        return slots.toString();
    }
}
