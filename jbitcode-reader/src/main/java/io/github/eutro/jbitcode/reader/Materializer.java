package io.github.eutro.jbitcode.reader;

import io.github.eutro.jbitcode.core.ir.Function;

/**
 * Reads the bodies of functions in a module on demand.
 * <p>
 * A function with a body in the container starts out as a declaration. {@link #materialize(Function)
 * Materializing} it reads its body, and {@link #dematerialize(Function) dematerializing} it turns
 * it back into a declaration, from which it can be materialized again.
 *
 * @see ReaderExts#MATERIALIZER
 */
public interface Materializer {
    /**
     * Whether a function has a body that has not been read yet.
     *
     * @param function The function.
     * @return Whether materializing it would read a body.
     */
    boolean isMaterializable(Function function);

    /**
     * Read the body of a function, if it is materializable. Otherwise, do nothing.
     * <p>
     * If this fails, the function is left a declaration, and the module is as it was before.
     *
     * @param function The function.
     * @throws BitcodeException If the body is malformed.
     */
    void materialize(Function function) throws BitcodeException;

    /**
     * Whether a function has a body that could be read again if it were dropped.
     *
     * @param function The function.
     * @return Whether the function can be dematerialized.
     */
    boolean isDematerializable(Function function);

    /**
     * Drop the body of a function, so it can be materialized again later.
     *
     * @param function The function.
     * @throws IllegalStateException If the function has no body in the container.
     */
    void dematerialize(Function function);

    /**
     * Materialize every materializable function, then finish upgrading the module.
     *
     * @throws BitcodeException If any body is malformed.
     */
    void materializeAll() throws BitcodeException;
}
