// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import son.util.Trace;
import son.util.condition.ConditionContext;
import son.util.condition.UnhandledErrorError;
import org.jetbrains.annotations.NotNull;

/**
 * The notation reader: turns notation text into children of a container.
 * <p>
 * Each container body is read in two phases. The first scans the body from left to right, creating the fields and
 * child containers it finds, and registering the names of child containers right away; the bodies of child
 * containers are only skipped over. Once the body is closed, the second phase reads the skipped child bodies, in the
 * order their containers were opened. This way, an alias anywhere inside a body can refer to any container declared
 * at that body's level, before or after it.
 */
final class Reader {
    private Reader(final @NotNull String text, final @NotNull Syntax syntax) {
        this.text = text;
        this.syntax = syntax;
    }

    /**
     * Reads the given text, appending what it describes to the children of {@code target}.
     * <p>
     * On error, a fatal {@link ReadErrorCondition} is signaled. If control leaves this method abnormally, whether by
     * an exception or by unwinding to a restart, {@code target} is left as it was before the call.
     */
    static void read(final @NotNull Node.Container target, final @NotNull String text) {
        final var savedSize = target.size();
        final var savedNames = Set.copyOf(target.names());
        var completed = false;
        try (final var trace = new Trace("Parsing notation text")) {
            trace.use();
            new Reader(text, target.syntax()).readBody(target, 0, true);
            completed = true;
        } finally {
            if (!completed) {
                target.truncate(savedSize, savedNames);
            }
        }
    }

    private void readBody(final @NotNull Node.Container container, final int start, final boolean topLevel) {
        final var pendingChildren = new ArrayList<PendingChild>();
        final var field = new StringBuilder();
        var fieldStart = start;
        var quoted = false;
        var afterChild = false;
        var afterSeparator = false;
        var index = start;
        while (index < text.length()) {
            final var character = text.charAt(index);
            if (character == syntax.quote()) {
                quoted = !quoted;
            }
            if (!quoted && character == syntax.open()) {
                if (afterChild) {
                    throw signalSyntaxError(index, "Expected '" + syntax.separator() + "' between two containers");
                }
                final var child = openContainer(container, field.toString(), fieldStart);
                pendingChildren.add(new PendingChild(child, index + 1));
                index = skipBody(index + 1);
                field.setLength(0);
                fieldStart = index;
                afterChild = true;
                afterSeparator = false;
                continue;
            }
            if (!quoted && (character == syntax.separator() || character == syntax.close())) {
                final var closing = character == syntax.close();
                if (closing && topLevel) {
                    throw signalSyntaxError(index, "Unexpected '" + character + "' outside of any container");
                }
                if (afterChild) {
                    if (!field.toString().isBlank()) {
                        throw signalSyntaxError(
                            contentStart(field, fieldStart),
                            "Unexpected text after a container: '" + field.toString().strip() + "'"
                        );
                    }
                } else if (!closing || afterSeparator || !field.toString().isBlank()) {
                    // An empty field is only implied before a closing delimiter if a separator says there's one.
                    commitField(container, field.toString(), fieldStart);
                }
                field.setLength(0);
                fieldStart = index + 1;
                afterChild = false;
                afterSeparator = !closing;
                if (closing) {
                    readPendingChildren(pendingChildren);
                    return;
                }
            } else {
                field.append(character);
            }
            index += 1;
        }

        // End of input. Child bodies always end with their closing delimiter, as skipBody made sure of, so this is the
        // top level.
        readPendingChildren(pendingChildren);
        if (afterChild) {
            if (!field.toString().isBlank()) {
                throw signalSyntaxError(
                    contentStart(field, fieldStart),
                    "Unexpected text after a container: '" + field.toString().strip() + "'"
                );
            }
        } else {
            commitField(container, field.toString(), fieldStart);
        }
    }

    private @NotNull Node.Container openContainer(
        final @NotNull Node.Container container,
        final @NotNull String rawName,
        final int rawNameStart
    ) {
        final var name = rawName.strip();
        if (name.isEmpty()) {
            return container.appendContainer(null);
        }
        final var nameStart = contentStart(rawName, rawNameStart);
        if (!syntax.isBare(name)) {
            throw signalError(new InvalidFieldErrorCondition(name, locate(nameStart)));
        }
        if (container.declares(name)) {
            throw signalError(new KeyErrorCondition(name, locate(nameStart)));
        }
        return container.appendContainer(name);
    }

    // Returns the index just past the closing delimiter matching the opening one right before bodyStart.
    private int skipBody(final int bodyStart) {
        var depth = 1;
        var quoted = false;
        for (int index = bodyStart; index < text.length(); index += 1) {
            final var character = text.charAt(index);
            if (character == syntax.quote()) {
                quoted = !quoted;
            } else if (!quoted && character == syntax.open()) {
                depth += 1;
            } else if (!quoted && character == syntax.close()) {
                depth -= 1;
                if (depth == 0) {
                    return index + 1;
                }
            }
        }
        throw signalSyntaxError(
            bodyStart - 1,
            "Expected '" + syntax.close() + "' closing this container, but found end of input instead"
        );
    }

    private void readPendingChildren(final @NotNull List<PendingChild> pendingChildren) {
        for (final var pending : pendingChildren) {
            try (final var trace = new Trace(() -> describe(pending))) {
                trace.use();
                currentDepth += 1;
                try {
                    if (currentDepth > maxDepth) {
                        throw signalSyntaxError(pending.bodyStart() - 1, "Nesting limit reached, try to limit nesting");
                    }
                    readBody(pending.container(), pending.bodyStart(), false);
                } finally {
                    currentDepth -= 1;
                }
            }
        }
    }

    private void commitField(final @NotNull Node.Container container, final @NotNull String rawField, final int start) {
        if (rawField.isEmpty()) {
            container.appendLeaf("");
            return;
        }
        final var field = rawField.strip();
        final var location = locate(contentStart(rawField, start));
        if (isQuoted(field)) {
            container.appendLeaf(field.substring(1, field.length() - 1));
        } else if (syntax.isBare(field)) {
            container.appendLeaf(field);
        } else if (field.charAt(0) == syntax.alias() && syntax.isBare(field.substring(1))) {
            appendAlias(container, field.substring(1).strip(), location);
        } else {
            throw signalError(new InvalidFieldErrorCondition(field, location));
        }
    }

    private void appendAlias(
        final @NotNull Node.Container container,
        final @NotNull String name,
        final @NotNull SourceLocation location
    ) {
        if (name.isEmpty() || container.declares(name)) {
            throw signalError(new KeyErrorCondition(name, location));
        }
        final var target = Scopes.findUpward(container, name);
        if (target == null) {
            throw signalError(new ReferenceErrorCondition(name, location));
        }
        container.appendAlias(name, target);
    }

    // Quote characters cannot be escaped, so a quoted field has exactly two: the first and the last.
    private boolean isQuoted(final @NotNull String field) {
        final var last = field.length() - 1;
        return last >= 1 && field.charAt(0) == syntax.quote() && field.indexOf(syntax.quote(), 1) == last;
    }

    private @NotNull String describe(final @NotNull PendingChild pending) {
        final var name = pending.container().name();
        final var what = (name != null) ? ("container '" + name + "'") : "an anonymous container";
        final var location = locate(pending.bodyStart() - 1);
        return "Parsing the body of " + what + " opened in line " + location.line() + ", column " + location.column();
    }

    private @NotNull SourceLocation locate(final int offset) {
        return SourceLocation.of(text, offset);
    }

    private @NotNull UnhandledErrorError signalSyntaxError(final int offset, final @NotNull String message) {
        throw signalError(new SyntaxErrorCondition(message, locate(offset)));
    }

    private static @NotNull UnhandledErrorError signalError(final @NotNull ReadErrorCondition condition) {
        throw ConditionContext.error(condition);
    }

    // Offset of the first non-whitespace character of a field starting at fieldStart.
    private static int contentStart(final @NotNull CharSequence field, final int fieldStart) {
        final var string = field.toString();
        return fieldStart + (string.length() - string.stripLeading().length());
    }

    private static final int maxDepth = 500;

    private final @NotNull String text;
    private final @NotNull Syntax syntax;
    private int currentDepth = 0;

    private record PendingChild(@NotNull Node.Container container, int bodyStart) {
    }
}
