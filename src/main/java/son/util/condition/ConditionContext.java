// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import son.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Keeps track of the installed handlers and established restart points of one thread.
 * <p>
 * Instances are thread-local and not accessible directly; the static methods operate on the calling thread's
 * context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition to the installed handlers, newest first.
     * <p>
     * Returns normally if every handler declines. May throw {@link Unwind} if a handler unwinds to a restart.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if every handler declines, {@link UnhandledErrorError} is
     * thrown. A condition signaled this way is called <dfn>fatal</dfn>.
     * <p>
     * Never returns normally; the declared return type lets call sites write
     * {@code throw ConditionContext.error(...)} to help the compiler's control flow analysis.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given callback with a restart point around it.
     *
     * @param restartName The user-readable name of the restart point.
     * @param callback    The code to run; receives the restart object.
     * @return The value returned by {@code callback}, or {@code null} if control was transferred to this restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the established restart points of the calling thread, newest first.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        return localContext().new RestartIterable();
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        for (var handler = firstUsableHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler firstUsableHandler() {
        // A condition signaled from within a handler is only shown to the handlers older than that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    private final class RestartIterable implements Iterable<@NotNull Restart> {
        @Override
        public @NotNull Iterator<@NotNull Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
