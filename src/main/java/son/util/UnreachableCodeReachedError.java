// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util;

import org.jetbrains.annotations.NotNull;

/**
 * Error type signifying that execution got somewhere it provably cannot get, such as a {@link java.io.IOException}
 * out of an in-memory writer.
 * <p>
 * Since this represents a programming error, this class extends {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message, final @NotNull Throwable cause) {
        super(message, cause);
    }
}
