// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;
import son.util.Trace;
import son.util.UnreachableCodeReachedError;
import org.jetbrains.annotations.NotNull;

/**
 * The tree-to-text serializer.
 * <p>
 * Containers are written as their name followed by their delimited, separated children; the root container, having no
 * owner, is written without delimiters. Owned children are written recursively, aliases as the alias character
 * followed by the alias name. Leaves are written verbatim, unless they'd read back differently that way, in which case
 * they're quoted.
 * <p>
 * Reading the output of a tree built by {@link Node#parse(String, Syntax)} back yields a tree with the same shape,
 * names, leaf texts and alias targets. Whitespace of the original text is not preserved. A tree extended with
 * {@link Node#add(String)} may hold aliases that only resolve because of the order the additions were made in, such as
 * an alias of a container whose body hasn't been read yet at the alias's position in the output; such output does
 * not read back.
 */
public final class Serializer {
    private Serializer(final @NotNull Writer writer, final @NotNull Syntax syntax) {
        this.writer = writer;
        this.syntax = syntax;
    }

    /**
     * Serializes the tree rooted at {@code rootNode}, writing the output to the given {@link Writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void serialize(final @NotNull Writer writer, final @NotNull Node rootNode) throws IOException {
        try (final var trace = new Trace("Serializing a tree")) {
            trace.use();
            new Serializer(writer, rootNode.syntax()).serializeNode(rootNode, false);
        }
    }

    /**
     * Serializes the tree rooted at {@code rootNode} into a string.
     */
    public static @NotNull String toString(final @NotNull Node rootNode) {
        final var writer = new StringWriter();
        try {
            serialize(writer, rootNode);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter threw an IOException", e);
        }
        return writer.toString();
    }

    private void serializeNode(final @NotNull Node node, final boolean onlyChild) throws IOException {
        if (node instanceof Node.Leaf leaf) {
            serializeLeaf(leaf.text(), onlyChild);
        } else if (node instanceof Node.Container container) {
            serializeContainer(container);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeContainer(final @NotNull Node.Container container) throws IOException {
        final var name = container.name();
        if (name != null) {
            writer.write(name);
        }
        final var delimited = container.parent() != null;
        if (delimited) {
            writer.write(syntax.open());
        }
        final var children = container.children();
        final var onlyChild = delimited && children.size() == 1;
        var first = true;
        for (final var child : children) {
            if (!first) {
                writer.write(syntax.separator());
            }
            first = false;
            if (container.owns(child)) {
                serializeNode(child, onlyChild);
            } else {
                writer.write(syntax.alias());
                writer.write(Objects.requireNonNull(child.name(), "Aliased containers always have names"));
            }
        }
        if (delimited) {
            writer.write(syntax.close());
        }
    }

    private void serializeLeaf(final @NotNull String text, final boolean onlyChild) throws IOException {
        if (needsQuoting(text, onlyChild)) {
            writer.write(syntax.quote());
            writer.write(text);
            writer.write(syntax.quote());
        } else {
            writer.write(text);
        }
    }

    private boolean needsQuoting(final @NotNull String text, final boolean onlyChild) {
        if (text.isEmpty()) {
            // "()" reads back as an empty container, not one holding an empty leaf.
            return onlyChild;
        }
        return !syntax.isBare(text) || !text.strip().equals(text);
    }

    private final @NotNull Writer writer;
    private final @NotNull Syntax syntax;
}
