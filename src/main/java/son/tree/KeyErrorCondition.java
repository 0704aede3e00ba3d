// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

/**
 * A condition type indicating that a container name or alias name is empty, or already taken within the enclosing
 * container.
 */
public final class KeyErrorCondition extends ReadErrorCondition {
    KeyErrorCondition(final String key, final SourceLocation location) {
        super(key.isEmpty() ? "Empty name" : ("Name already taken: '" + key + "'"), location);
        this.key = key;
    }

    /**
     * Retrieves the offending name.
     */
    public String key() {
        return key;
    }

    private final String key;
}
