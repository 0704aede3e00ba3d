// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

/**
 * A condition type indicating unbalanced delimiters, a closing delimiter without an enclosing container, or text
 * following a container with no separator in between.
 */
public final class SyntaxErrorCondition extends ReadErrorCondition {
    SyntaxErrorCondition(final String message, final SourceLocation location) {
        super(message, location);
    }
}
