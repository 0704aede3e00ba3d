// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import son.util.condition.Condition;

/**
 * A condition type indicating that the text of a leaf could not be converted to a number.
 */
public final class ValueErrorCondition extends Condition {
    ValueErrorCondition(final String text) {
        super("Not a number: '" + text + "'");
        this.text = text;
    }

    /**
     * Retrieves the text that failed to convert.
     */
    public String text() {
        return text;
    }

    private final String text;
}
