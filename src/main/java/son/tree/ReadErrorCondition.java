// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import son.util.condition.Condition;

/**
 * The base type of conditions indicating that notation text could not be read into a tree.
 * <p>
 * The detailed message includes the location of the offending character.
 */
public abstract sealed class ReadErrorCondition extends Condition
    permits SyntaxErrorCondition, KeyErrorCondition, ReferenceErrorCondition, InvalidFieldErrorCondition {
    ReadErrorCondition(final String message, final SourceLocation location) {
        super(message);
        this.location = location;
    }

    /**
     * Retrieves the location of the character at which the error was detected.
     */
    public final SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + location;
    }

    private final SourceLocation location;
}
