package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ext.CommonExts;
import io.github.eutro.jbitcode.core.ir.Constant;
import io.github.eutro.jbitcode.core.ir.ConstantPlaceholder;
import io.github.eutro.jbitcode.core.ir.Use;
import io.github.eutro.jbitcode.core.ir.UniquedConstant;
import io.github.eutro.jbitcode.core.ir.User;
import io.github.eutro.jbitcode.core.ir.Value;
import io.github.eutro.jbitcode.core.ir.ValuePlaceholder;
import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The values of a module, and of the function being read, indexed by value id.
 * <p>
 * A slot is empty, holds a placeholder for a value referenced before it was read,
 * or holds the value itself. Slots are uses of their values, so replacing a value
 * anywhere in the graph updates the table too.
 * <p>
 * Placeholders for non-constants are replaced as soon as the value is read. Constant
 * placeholders may be nested in uniqued constants, which have to be rebuilt, so they
 * are only recorded on assignment and {@link #resolveConstantForwardRefs() resolved}
 * together once a whole constants block is read.
 */
final class ValueTable {
    private static final Logger LOG = LoggerFactory.getLogger(ValueTable.class);

    static final int MAX_VALUES = 1 << 24;

    private static final Comparator<PendingConstant> BY_PLACEHOLDER =
            Comparator.comparing(pending -> pending.placeholder);

    private final boolean trackPlaceholders;
    private final ValueSlots slots = new ValueSlots();
    private final List<PendingConstant> pendingConstants = new ArrayList<>();
    private int rebuilds;

    ValueTable(boolean trackPlaceholders) {
        this.trackPlaceholders = trackPlaceholders;
    }

    int size() {
        return slots.getNumOperands();
    }

    /**
     * Get the value in a slot.
     *
     * @param idx The value id.
     * @return The value, which may be a placeholder, or null if the slot is empty or out of range.
     */
    @Nullable Value get(long idx) {
        if (idx < 0 || idx >= size()) return null;
        return slots.getOperand((int) idx);
    }

    /**
     * Get the number of uniqued constants rebuilt by {@link #resolveConstantForwardRefs()} so far.
     *
     * @return The number of rebuilds.
     */
    int getRebuildCount() {
        return rebuilds;
    }

    void push(Value value) throws BitcodeException {
        assign(value, size());
    }

    private void ensureSize(long idx) throws BitcodeException {
        if (idx < 0 || idx >= MAX_VALUES) throw new BitcodeException(ErrorKind.INVALID_ID, "value " + idx);
        while (size() <= idx) slots.add(null);
    }

    /**
     * Put a value that has just been read in its slot, resolving any forward reference to it.
     *
     * @param value The value.
     * @param idx   The value id.
     * @throws BitcodeException If the slot already holds a value, or a placeholder of a different type.
     */
    void assign(Value value, long idx) throws BitcodeException {
        ensureSize(idx);
        int i = (int) idx;
        Value old = slots.getOperand(i);
        if (old == null) {
            slots.setOperand(i, value);
            return;
        }
        if (!old.getType().equals(value.getType())
                && (old instanceof ConstantPlaceholder || old instanceof ValuePlaceholder)) {
            throw placeholderError(ErrorKind.TYPE_MISMATCH, old,
                    "value " + idx + " was referenced as " + old.getType() + ", but is " + value.getType());
        }
        if (old instanceof ConstantPlaceholder) {
            pendingConstants.add(new PendingConstant((ConstantPlaceholder) old, i));
            slots.setOperand(i, value);
        } else if (old instanceof ValuePlaceholder) {
            old.replaceAllUsesWith(value);
        } else {
            throw new BitcodeException(ErrorKind.DUPLICATE_DEFINITION, "value " + idx + " is already " + old);
        }
    }

    /**
     * Get a constant by id, creating a placeholder if it has not been read yet.
     *
     * @param idx  The value id.
     * @param type The type of the constant.
     * @return The constant or its placeholder.
     * @throws BitcodeException If the slot holds a value that is not a constant, or has a different type.
     */
    Constant getConstantForwardRef(long idx, Type type) throws BitcodeException {
        ensureSize(idx);
        Value existing = slots.getOperand((int) idx);
        if (existing != null) {
            if (!(existing instanceof Constant)) {
                throw new BitcodeException(ErrorKind.INVALID_CONSTANT_REFERENCE, "value " + idx + " is " + existing);
            }
            if (!existing.getType().equals(type)) {
                throw new BitcodeException(ErrorKind.TYPE_MISMATCH, "constant " + idx + " of type "
                        + existing.getType() + " referenced as " + type);
            }
            return (Constant) existing;
        }
        ConstantPlaceholder placeholder = new ConstantPlaceholder(type);
        track(placeholder);
        slots.setOperand((int) idx, placeholder);
        return placeholder;
    }

    /**
     * Get a value by id, creating a placeholder if it has not been read yet and its type is known.
     *
     * @param idx  The value id.
     * @param type The expected type, or null if it is not known.
     * @return The value, or null if it has not been read yet and no type was given.
     * @throws BitcodeException If the value has a different type, or the id is absurd.
     */
    @Nullable Value getValueForwardRef(long idx, @Nullable Type type) throws BitcodeException {
        ensureSize(idx);
        Value existing = slots.getOperand((int) idx);
        if (existing != null) {
            if (type != null && !existing.getType().equals(type)) {
                throw new BitcodeException(ErrorKind.TYPE_MISMATCH, "value " + idx + " of type "
                        + existing.getType() + " referenced as " + type);
            }
            return existing;
        }
        if (type == null) return null;
        ValuePlaceholder placeholder = new ValuePlaceholder(type);
        track(placeholder);
        slots.setOperand((int) idx, placeholder);
        return placeholder;
    }

    private void track(Value placeholder) {
        if (trackPlaceholders) placeholder.attachExt(CommonExts.CREATED_AT, new Throwable("placeholder created here"));
    }

    BitcodeException placeholderError(ErrorKind kind, Value placeholder, String detail) {
        Throwable createdAt = placeholder.getNullable(CommonExts.CREATED_AT);
        return createdAt == null
                ? new BitcodeException(kind, detail)
                : new BitcodeException(kind, detail, createdAt);
    }

    /**
     * Find a slot from {@code from} on that still holds a non-constant placeholder.
     *
     * @param from The first slot to check.
     * @return The slot, or -1.
     */
    int findValuePlaceholder(int from) {
        for (int i = from; i < size(); i++) {
            if (slots.getOperand(i) instanceof ValuePlaceholder) return i;
        }
        return -1;
    }

    /**
     * Replace every use of every constant placeholder that has since been assigned.
     * <p>
     * Uses by instructions, globals and metadata are changed in place. A uniqued constant
     * can't be changed, so it is rebuilt with all of its placeholder operands replaced at once,
     * and the old constant replaced by the new one.
     *
     * @throws BitcodeException If a uniqued constant refers to a placeholder that was never assigned,
     *                          or cannot be rebuilt with the real operands.
     */
    void resolveConstantForwardRefs() throws BitcodeException {
        if (pendingConstants.isEmpty()) return;
        pendingConstants.sort(BY_PLACEHOLDER);
        int resolved = pendingConstants.size();
        int rebuildsBefore = rebuilds;

        while (!pendingConstants.isEmpty()) {
            PendingConstant pending = pendingConstants.remove(pendingConstants.size() - 1);
            ConstantPlaceholder placeholder = pending.placeholder;
            Value real = slots.getOperand(pending.idx);

            while (placeholder.hasUses()) {
                Use use = placeholder.getUses().iterator().next();
                User user = use.getUser();
                if (!(user instanceof UniquedConstant)) {
                    use.set(real);
                    continue;
                }

                UniquedConstant userConstant = (UniquedConstant) user;
                List<Value> newOperands = new ArrayList<>(userConstant.getNumOperands());
                for (Value operand : userConstant.getOperands()) {
                    if (operand == placeholder) {
                        newOperands.add(real);
                    } else if (operand instanceof ConstantPlaceholder) {
                        newOperands.add(lookupPending((ConstantPlaceholder) operand));
                    } else {
                        newOperands.add(operand);
                    }
                }

                Constant rebuilt;
                try {
                    rebuilt = userConstant.rebuild(newOperands);
                } catch (IllegalArgumentException e) {
                    throw new BitcodeException(ErrorKind.INVALID_CONSTANT_REFERENCE,
                            "cannot rebuild " + userConstant + " with resolved operands", e);
                }
                if (rebuilt == userConstant) {
                    throw new IllegalStateException("rebuilding " + userConstant + " did not replace a placeholder");
                }
                rebuilds++;
                userConstant.replaceAllUsesWith(rebuilt);
                userConstant.destroy();
            }
        }
        LOG.trace("Resolved {} constant placeholder(s) with {} rebuild(s)", resolved, rebuilds - rebuildsBefore);
    }

    private Value lookupPending(ConstantPlaceholder placeholder) throws BitcodeException {
        int found = Collections.binarySearch(pendingConstants, new PendingConstant(placeholder, -1), BY_PLACEHOLDER);
        if (found < 0) {
            throw placeholderError(ErrorKind.UNRESOLVED_FORWARD_REFERENCE, placeholder,
                    "constant placeholder " + placeholder + " was never assigned");
        }
        return slots.getOperand(pendingConstants.get(found).idx);
    }

    /**
     * Drop every slot from {@code size} on, with any placeholders or pending resolutions in them.
     *
     * @param size The size to shrink to.
     */
    void shrinkTo(int size) {
        if (size >= size()) return;
        pendingConstants.removeIf(pending -> pending.idx >= size);
        slots.truncate(size);
    }

    /**
     * Release every slot.
     */
    void clear() {
        pendingConstants.clear();
        slots.truncate(0);
    }

    private static final class PendingConstant {
        final ConstantPlaceholder placeholder;
        final int idx;

        PendingConstant(ConstantPlaceholder placeholder, int idx) {
            this.placeholder = placeholder;
            this.idx = idx;
        }
    }
}
