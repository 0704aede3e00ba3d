// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable used by {@link Restart#unwindTo()} to transfer control to a restart point.
 * <p>
 * Exposed only so that methods can declare that they may unwind. <strong>Do not catch or throw it
 * manually.</strong>
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}, as it represents neither: it is non-local control flow,
 * which the JVM offers no better vehicle for.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart point " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
