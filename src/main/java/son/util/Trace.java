// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message describing the operation in progress, intended to be used within try-with-resources.
 * <p>
 * Traces tell a person reading an error report <em>what</em> was being done, such as which container body was
 * being parsed when a syntax error was found; they're <em>not</em> a machine stack trace.
 * <p>
 * Trace objects are bound to the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a new trace with the given <em>lazily evaluated</em> message as the innermost active trace of the
     * calling thread.
     * <p>
     * The supplier is called at most once, and only if someone asks for the active traces.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a new trace with the given message as the innermost active trace of the calling thread.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object object) {
        final var context = localContext();
        next = context.innermost;
        messageOrSupplier = object;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns an iterable over the calling thread's active trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return ActiveTraces.instance;
    }

    /**
     * Returns a snapshot of the calling thread's active trace messages, innermost first.
     * <p>
     * Useful in condition handlers that want to keep the context around after the stack has been unwound.
     */
    public static List<String> snapshot() {
        final var result = new ArrayList<String>();
        for (final var message : activeTraces()) {
            result.add(message);
        }
        return result;
    }

    /**
     * Does nothing; silences warnings about try-with-resources variables that are never referenced.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes this trace from the thread's trace chain. Called by try-with-resources, never manually.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself, or the MessageSupplier that produces it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    /**
     * A lazily evaluated trace message.
     */
    @FunctionalInterface
    public interface MessageSupplier {
        String get();
    }

    private static final class Context {
        private @Nullable Trace innermost = null;
    }

    private static final class ActiveTraces implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new TraceIterator(localContext().innermost);
        }

        private static final ActiveTraces instance = new ActiveTraces();
    }

    private static final class TraceIterator implements Iterator<String> {
        private TraceIterator(final @Nullable Trace innermost) {
            current = innermost;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
