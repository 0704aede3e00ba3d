// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when no handler transferred control away from a fatal
 * condition.
 * <p>
 * Code that signals errors but runs without any handlers installed, such as a quick script, sees its errors as this
 * type. Since failing to handle a fatal condition is a programming error, this class extends {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the fatal condition nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    // Conditions aren't serializable; neither is this error in any meaningful way.
    private final transient @NotNull Condition condition;
}
