package io.github.eutro.jbitcode.core.ir.types;

import java.util.function.Function;

final class PrimitiveType extends Type {
    private final Kind kind;
    private final String name;

    PrimitiveType(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    @Override
    public Kind getKind() {
        return kind;
    }

    @Override
    public void print(StringBuilder sb, Function<StructType, String> structRef) {
        sb.append(name);
    }
}
