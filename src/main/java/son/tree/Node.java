// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import son.util.condition.ConditionContext;
import son.util.condition.UnhandledErrorError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The base class of tree nodes: either a {@link Leaf} holding text, or a {@link Container} holding an ordered list of
 * children and a table of names.
 * <p>
 * Every node but the root is <dfn>owned</dfn> by exactly one container, its {@link #parent()}. A container's children
 * may additionally include <dfn>aliases</dfn>: named containers owned by some other container in the same tree,
 * linked rather than copied. Whether a child is owned or aliased can be told with {@link #owns(Node)}.
 * <p>
 * Operations that only make sense on containers signal a fatal {@link UsageErrorCondition} when invoked on a leaf.
 * <p>
 * Nodes are not thread-safe. Trees are only modified while text is being read into them.
 */
public abstract sealed class Node permits Node.Leaf, Node.Container {
    Node(final @Nullable Container parent, final @NotNull Syntax syntax) {
        this.parent = parent;
        this.syntax = syntax;
    }

    /**
     * Reads the given notation text into a new root container, using the {@linkplain Syntax#standard() standard
     * syntax}.
     * <p>
     * On error, a fatal {@link ReadErrorCondition} is signaled.
     */
    @CheckReturnValue
    public static @NotNull Container parse(final @NotNull String text) {
        return parse(text, Syntax.standard());
    }

    /**
     * Reads the given notation text into a new root container, using the given syntax. The syntax is remembered by
     * the tree, for later calls to {@link #add(String)} and serialization.
     * <p>
     * On error, a fatal {@link ReadErrorCondition} is signaled.
     */
    @CheckReturnValue
    public static @NotNull Container parse(final @NotNull String text, final @NotNull Syntax syntax) {
        final var root = new Container(null, null, syntax);
        Reader.read(root, text);
        return root;
    }

    /**
     * Returns {@code true} iff this node is a container.
     */
    public abstract boolean isContainer();

    /**
     * Retrieves the container owning this node, or {@code null} if this node is the root.
     */
    public final @Nullable Container parent() {
        return parent;
    }

    /**
     * Retrieves the syntax of the tree this node belongs to.
     */
    public final @NotNull Syntax syntax() {
        return syntax;
    }

    /**
     * Retrieves the raw field of this node: the text of a leaf, or the name of a container. Anonymous containers
     * have no field.
     */
    public abstract @Nullable String field();

    /**
     * Retrieves the name this container was declared with, or {@code null} for leaves and anonymous containers.
     */
    public @Nullable String name() {
        return null;
    }

    /**
     * Reads the given notation text, appending the nodes it describes to this container's children.
     * <p>
     * Aliases in the text can refer to names declared by this container's ancestors. If reading fails, this container
     * is left unchanged.
     */
    public void add(final @NotNull String text) {
        throw signalUsageError("Cannot add fields to a leaf");
    }

    /**
     * Retrieves the child at the given position, owned or aliased.
     *
     * @throws IndexOutOfBoundsException if there's no child at that position.
     */
    public @NotNull Node get(final int index) {
        throw signalUsageError("Cannot access the children of a leaf");
    }

    /**
     * Retrieves the container registered in this container's name table under the given name: either a named child,
     * or an alias. Returns {@code null} if there is none.
     */
    public @Nullable Node get(final @NotNull String name) {
        throw signalUsageError("Cannot look up names in a leaf");
    }

    /**
     * Retrieves the number of children of this container.
     */
    public int size() {
        throw signalUsageError("Cannot count the children of a leaf");
    }

    /**
     * Returns an unmodifiable view of the children of this container, owned and aliased, in order.
     */
    public @NotNull List<@NotNull Node> children() {
        throw signalUsageError("Cannot access the children of a leaf");
    }

    /**
     * Returns an unmodifiable view of the names registered in this container's name table, in order of
     * registration.
     */
    public @NotNull Set<@NotNull String> names() {
        throw signalUsageError("Cannot look up names in a leaf");
    }

    /**
     * Returns {@code true} iff the given node is owned by this node, rather than being an alias or unrelated.
     */
    public final boolean owns(final @NotNull Node node) {
        return node.parent == this;
    }

    /**
     * Parses the text of this leaf as a number.
     * <p>
     * A fatal {@link ValueErrorCondition} is signaled if the text isn't numeric.
     */
    public double number() {
        throw signalUsageError("Containers have no numeric value");
    }

    /**
     * Finds the container declared with the given name in this node's name table or, failing that, among its owned
     * descendants in depth-first order. Aliases are not descended into.
     * <p>
     * Returns {@code null} if there's no such container, or if this node is a leaf.
     */
    @CheckReturnValue
    public final @Nullable Node findDownward(final @NotNull String name) {
        return Scopes.findDownward(this, name);
    }

    /**
     * Finds the container with the given name visible from this node's position: the nearest ancestor that either
     * has the name in its table or owns, outside of the branch leading to this node, a descendant declaring it.
     * <p>
     * This is how aliases are resolved. Returns {@code null} if there's no such container.
     */
    @CheckReturnValue
    public final @Nullable Node findUpward(final @NotNull String name) {
        return Scopes.findUpward(this, name);
    }

    /**
     * Serializes the tree rooted at this node into notation text.
     *
     * @see Serializer
     */
    @Override
    public final @NotNull String toString() {
        return Serializer.toString(this);
    }

    private static @NotNull UnhandledErrorError signalUsageError(final @NotNull String message) {
        throw ConditionContext.error(new UsageErrorCondition(message));
    }

    private final @Nullable Container parent;
    private final @NotNull Syntax syntax;

    /**
     * A node holding text. The text is fixed at creation.
     */
    public static final class Leaf extends Node {
        Leaf(final @NotNull Container parent, final @NotNull String text) {
            super(parent, parent.syntax());
            this.text = text;
        }

        /**
         * Retrieves the text of this leaf. Empty for empty fields.
         */
        public @NotNull String text() {
            return text;
        }

        @Override
        public boolean isContainer() {
            return false;
        }

        @Override
        public @NotNull String field() {
            return text;
        }

        @Override
        public double number() {
            final var stripped = text.strip();
            if (!decimalPattern.matcher(stripped).matches()) {
                throw ConditionContext.error(new ValueErrorCondition(text));
            }
            return Double.parseDouble(stripped);
        }

        // Plain decimal notation only; Java literal suffixes, hexadecimal, NaN and infinities are not numbers here.
        private static final Pattern decimalPattern =
            Pattern.compile("[+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

        private final @NotNull String text;
    }

    /**
     * A node holding children and a name table.
     * <p>
     * The name table holds one entry for each named container this container owns, and one for each alias among
     * its children. Names are unique within one table.
     */
    public static final class Container extends Node {
        Container(final @Nullable Container parent, final @Nullable String name, final @NotNull Syntax syntax) {
            super(parent, syntax);
            this.name = name;
        }

        @Override
        public boolean isContainer() {
            return true;
        }

        @Override
        public @Nullable String field() {
            return name;
        }

        @Override
        public @Nullable String name() {
            return name;
        }

        @Override
        public void add(final @NotNull String text) {
            Reader.read(this, text);
        }

        @Override
        public @NotNull Node get(final int index) {
            return children.get(index);
        }

        @Override
        public @Nullable Node get(final @NotNull String name) {
            return lookup(name);
        }

        @Override
        public int size() {
            return children.size();
        }

        @Override
        public @NotNull List<@NotNull Node> children() {
            return Collections.unmodifiableList(children);
        }

        @Override
        public @NotNull Set<@NotNull String> names() {
            return Collections.unmodifiableSet(nameTable.keySet());
        }

        @Nullable Container lookup(final @NotNull String name) {
            return nameTable.get(name);
        }

        boolean declares(final @NotNull String name) {
            return nameTable.containsKey(name);
        }

        // The caller is responsible for checking that a name is neither empty nor taken.
        @NotNull Container appendContainer(final @Nullable String childName) {
            final var child = new Container(this, childName, syntax());
            children.add(child);
            if (childName != null) {
                nameTable.put(childName, child);
            }
            return child;
        }

        @NotNull Leaf appendLeaf(final @NotNull String text) {
            final var child = new Leaf(this, text);
            children.add(child);
            return child;
        }

        // Drops the children past the first count, and the name table entries not among the given names.
        void truncate(final int count, final @NotNull Set<@NotNull String> keptNames) {
            children.subList(count, children.size()).clear();
            nameTable.keySet().retainAll(keptNames);
        }

        void appendAlias(final @NotNull String aliasName, final @NotNull Container target) {
            assert !owns(target) : "Containers cannot alias their own children";
            children.add(target);
            nameTable.put(aliasName, target);
        }

        private final @Nullable String name;
        private final ArrayList<@NotNull Node> children = new ArrayList<>();
        private final Map<@NotNull String, @NotNull Container> nameTable = new LinkedHashMap<>();
    }
}
