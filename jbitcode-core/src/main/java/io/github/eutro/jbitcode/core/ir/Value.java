package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ext.DelegatingExtHolder;
import io.github.eutro.jbitcode.core.ext.ExtContainer;
import io.github.eutro.jbitcode.core.ir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Anything that can be an operand: constants, globals, arguments, basic blocks,
 * instructions and metadata.
 * <p>
 * Every value tracks its {@link Use uses}, so that it can be
 * {@link #replaceAllUsesWith(Value) replaced} wholesale. Values compare by identity.
 */
public abstract class Value extends DelegatingExtHolder {
    private Type type;
    @Nullable
    private String name;
    private final Set<Use> uses = new LinkedHashSet<>();

    protected Value(Type type) {
        this.type = Objects.requireNonNull(type);
    }

    public Type getType() {
        return type;
    }

    protected void mutateType(Type type) {
        this.type = Objects.requireNonNull(type);
    }

    public @Nullable String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    public void setName(@Nullable String name) {
        this.name = name == null || name.isEmpty() ? null : name;
    }

    void addUse(Use use) {
        uses.add(use);
    }

    void removeUse(Use use) {
        uses.remove(use);
    }

    /**
     * Get the uses of this value, in the order they were made.
     *
     * @return An unmodifiable view of the uses.
     */
    public Set<Use> getUses() {
        return Collections.unmodifiableSet(uses);
    }

    public boolean hasUses() {
        return !uses.isEmpty();
    }

    public int getNumUses() {
        return uses.size();
    }

    /**
     * Get the distinct users of this value.
     *
     * @return The users, in first-use order.
     */
    public List<User> getUsers() {
        Set<User> users = new LinkedHashSet<>();
        for (Use use : uses) {
            users.add(use.getUser());
        }
        return new ArrayList<>(users);
    }

    /**
     * Make every use of this value use {@code replacement} instead.
     * <p>
     * Uniqued constants that use this value are rebuilt with the new operand
     * and then replaced in turn, since they cannot be changed in place.
     *
     * @param replacement The value to use instead, which must have the same type.
     * @throws IllegalArgumentException If the types differ, or {@code replacement} is this value.
     */
    public void replaceAllUsesWith(Value replacement) {
        if (replacement == this) throw new IllegalArgumentException("cannot replace a value with itself");
        if (!replacement.getType().equals(getType())) {
            throw new IllegalArgumentException("replacement of type " + replacement.getType()
                    + " for a value of type " + getType());
        }
        for (Use use : new ArrayList<>(uses)) {
            if (use.get() != this) continue; // already rewritten through a rebuilt constant
            User user = use.getUser();
            if (user instanceof UniquedConstant) {
                ((UniquedConstant) user).handleOperandChange(this, replacement);
            } else {
                use.set(replacement);
            }
        }
    }

    @Override
    protected @Nullable ExtContainer getDelegate() {
        return null;
    }

    @Override
    public String toString() {
        return getType() + " " + (hasName() ? "%" + name : "<" + getClass().getSimpleName() + ">");
    }
}
