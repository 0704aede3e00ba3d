// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util;

import org.jetbrains.annotations.NotNull;

/**
 * Bypasses the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable without the compiler knowing about its checked-ness.
     * <p>
     * Only meant for throwables that are not really exceptional, like {@link son.util.condition.Unwind}, which would
     * otherwise have to be declared by every method that might signal a condition.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(t)} so
     * the compiler's control flow analysis sees the jump.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode, while the compiler infers E from the call site.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
