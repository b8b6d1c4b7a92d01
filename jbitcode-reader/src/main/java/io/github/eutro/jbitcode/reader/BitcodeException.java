package io.github.eutro.jbitcode.reader;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a container cannot be decoded.
 * <p>
 * Failures in the module block leave the reader unusable. A failure while materializing
 * one function leaves the module as it was before the attempt, so other functions can
 * still be materialized.
 */
public class BitcodeException extends Exception {
    private final ErrorKind kind;

    public BitcodeException(ErrorKind kind) {
        super(kind.description);
        this.kind = kind;
    }

    public BitcodeException(ErrorKind kind, String detail) {
        super(kind.description + ": " + detail);
        this.kind = kind;
    }

    public BitcodeException(ErrorKind kind, String detail, @Nullable Throwable cause) {
        super(kind.description + ": " + detail, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
