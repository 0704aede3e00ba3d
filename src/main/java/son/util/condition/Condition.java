// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * Unlike exceptions, condition handlers execute <em>before</em> the stack is unwound, so a handler can inspect the
 * active {@link son.util.Trace traces} and choose among restart points established after the handler itself.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message of this condition, including any context subclasses know about.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
