package io.github.eutro.jbitcode.core.ir.types;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * An aggregate of heterogeneous fields.
 * <p>
 * A struct is either <i>literal</i>, compared structurally, or <i>identified</i>,
 * compared by identity. An identified struct starts out opaque, and gets its body
 * set exactly once.
 */
public final class StructType extends Type {
    private final boolean literal;
    @Nullable
    private String name;
    private List<Type> elements = Collections.emptyList();
    private boolean packed;
    private boolean opaque;

    private StructType(boolean literal, @Nullable String name) {
        this.literal = literal;
        this.name = name;
        this.opaque = !literal;
    }

    /**
     * Create a literal struct type.
     *
     * @param elements The field types.
     * @param packed   Whether the struct is packed.
     * @return The struct type.
     */
    public static StructType literal(List<Type> elements, boolean packed) {
        StructType st = new StructType(true, null);
        st.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        st.packed = packed;
        return st;
    }

    /**
     * Create a new opaque identified struct type.
     *
     * @param name The name, or null for an unnamed struct.
     * @return The struct type.
     */
    public static StructType create(@Nullable String name) {
        return new StructType(false, name);
    }

    /**
     * Set the body of this opaque identified struct.
     *
     * @param elements The field types.
     * @param packed   Whether the struct is packed.
     * @throws IllegalStateException If this struct is literal or already has a body.
     */
    public void setBody(List<Type> elements, boolean packed) {
        if (!opaque) throw new IllegalStateException("struct body already set: " + this);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.packed = packed;
        this.opaque = false;
    }

    public void setName(@Nullable String name) {
        if (literal) throw new IllegalStateException("literal structs have no name");
        this.name = name;
    }

    public @Nullable String getName() {
        return name;
    }

    public boolean isLiteral() {
        return literal;
    }

    public boolean isOpaque() {
        return opaque;
    }

    public boolean isPacked() {
        return packed;
    }

    public List<Type> getElements() {
        return elements;
    }

    public int getNumElements() {
        return elements.size();
    }

    public Type getElement(int i) {
        return elements.get(i);
    }

    @Override
    public Kind getKind() {
        return Kind.STRUCT;
    }

    static String defaultReference(StructType st) {
        return st.name == null ? "%<anon>" : "%" + st.name;
    }

    /**
     * Append the body of this struct, ignoring whether it is identified.
     *
     * @param sb        The builder.
     * @param structRef How to refer to nested identified structs.
     */
    public void printBody(StringBuilder sb, Function<StructType, String> structRef) {
        if (opaque) {
            sb.append("opaque");
            return;
        }
        if (packed) sb.append('<');
        if (elements.isEmpty()) {
            sb.append("{}");
        } else {
            sb.append("{ ");
            boolean first = true;
            for (Type element : elements) {
                if (!first) sb.append(", ");
                first = false;
                element.print(sb, structRef);
            }
            sb.append(" }");
        }
        if (packed) sb.append('>');
    }

    @Override
    public void print(StringBuilder sb, Function<StructType, String> structRef) {
        if (literal) {
            printBody(sb, structRef);
        } else {
            sb.append(structRef.apply(this));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!literal || !(o instanceof StructType)) return false;
        StructType that = (StructType) o;
        return that.literal && packed == that.packed && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return literal ? elements.hashCode() * 2 + (packed ? 1 : 0) : System.identityHashCode(this);
    }
}
