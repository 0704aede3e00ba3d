// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Name resolution within a tree.
 */
final class Scopes {
    private Scopes() {
    }

    static @Nullable Node.Container findDownward(final @NotNull Node node, final @NotNull String name) {
        if (!(node instanceof Node.Container container)) {
            return null;
        }
        final var declared = container.lookup(name);
        if (declared != null) {
            return declared;
        }
        return findInOwnedChildren(container, name, null);
    }

    static @Nullable Node.Container findUpward(final @NotNull Node node, final @NotNull String name) {
        var previous = node;
        for (var ancestor = node.parent(); ancestor != null; ancestor = ancestor.parent()) {
            final var declared = ancestor.lookup(name);
            if (declared != null) {
                return declared;
            }
            // The branch we came from has been searched already, except for the starting node's own subtree, which
            // is out of scope.
            final var found = findInOwnedChildren(ancestor, name, previous);
            if (found != null) {
                return found;
            }
            previous = ancestor;
        }
        return null;
    }

    private static @Nullable Node.Container findInOwnedChildren(
        final @NotNull Node.Container container,
        final @NotNull String name,
        final @Nullable Node skipped
    ) {
        for (final var child : container.children()) {
            if (child == skipped || !container.owns(child)) {
                continue;
            }
            final var found = findDownward(child, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
