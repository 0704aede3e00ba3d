// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The procedure of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Looks at the given condition.
     * <p>
     * A procedure declines the condition by returning normally, letting older handlers see it. It handles the
     * condition by transferring control elsewhere, usually with {@link Restart#unwindTo()}.
     */
    void handle(@NotNull SignaledCondition condition) throws Unwind;
}
