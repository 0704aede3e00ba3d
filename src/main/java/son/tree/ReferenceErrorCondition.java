// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

/**
 * A condition type indicating that an alias doesn't name any container visible from where it appears.
 */
public final class ReferenceErrorCondition extends ReadErrorCondition {
    ReferenceErrorCondition(final String name, final SourceLocation location) {
        super("Alias target not found: '" + name + "'", location);
        this.name = name;
    }

    /**
     * Retrieves the name that could not be resolved.
     */
    public String name() {
        return name;
    }

    private final String name;
}
