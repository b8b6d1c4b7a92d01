package io.github.eutro.jbitcode.core.ops;

/**
 * The operation of an {@code atomicrmw} instruction.
 */
public enum RmwOperation {
    XCHG,
    ADD,
    SUB,
    AND,
    NAND,
    OR,
    XOR,
    MAX,
    MIN,
    UMAX,
    UMIN,
    ;

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
