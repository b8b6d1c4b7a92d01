package io.github.eutro.jbitcode.core.ops;

public enum Visibility {
    DEFAULT,
    HIDDEN,
    PROTECTED,
    ;

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
