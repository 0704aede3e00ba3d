// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

/**
 * A condition type indicating that a field is neither a quoted string, a bare field, nor an alias; or that the name
 * in front of an opening delimiter contains reserved characters.
 */
public final class InvalidFieldErrorCondition extends ReadErrorCondition {
    InvalidFieldErrorCondition(final String field, final SourceLocation location) {
        super("Invalid field: '" + field + "'", location);
        this.field = field;
    }

    /**
     * Retrieves the offending field text, trimmed.
     */
    public String field() {
        return field;
    }

    private final String field;
}
