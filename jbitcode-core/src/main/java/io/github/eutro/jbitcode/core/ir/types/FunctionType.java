package io.github.eutro.jbitcode.core.ir.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * A function signature.
 */
public final class FunctionType extends Type {
    private final Type returnType;
    private final List<Type> params;
    private final boolean varArg;

    private FunctionType(Type returnType, List<Type> params, boolean varArg) {
        this.returnType = returnType;
        this.params = params;
        this.varArg = varArg;
    }

    public static FunctionType get(Type returnType, List<Type> params, boolean varArg) {
        return new FunctionType(returnType, Collections.unmodifiableList(new ArrayList<>(params)), varArg);
    }

    public static boolean isValidReturnType(Type type) {
        return type.getKind() != Kind.FUNCTION && type.getKind() != Kind.LABEL && type.getKind() != Kind.METADATA;
    }

    public static boolean isValidArgumentType(Type type) {
        return type.isFirstClass();
    }

    public Type getReturnType() {
        return returnType;
    }

    public List<Type> getParams() {
        return params;
    }

    public int getNumParams() {
        return params.size();
    }

    public Type getParam(int i) {
        return params.get(i);
    }

    public boolean isVarArg() {
        return varArg;
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION;
    }

    @Override
    public void print(StringBuilder sb, Function<StructType, String> structRef) {
        returnType.print(sb, structRef);
        sb.append(" (");
        boolean first = true;
        for (Type param : params) {
            if (!first) sb.append(", ");
            first = false;
            param.print(sb, structRef);
        }
        if (varArg) sb.append(first ? "..." : ", ...");
        sb.append(')');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return varArg == that.varArg && returnType.equals(that.returnType) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return (returnType.hashCode() * 31 + params.hashCode()) * 2 + (varArg ? 1 : 0);
    }
}
