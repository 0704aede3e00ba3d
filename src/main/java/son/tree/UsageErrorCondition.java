// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

import son.util.condition.Condition;

/**
 * A condition type indicating that an operation was attempted on the wrong kind of node, such as indexing a leaf.
 */
public final class UsageErrorCondition extends Condition {
    UsageErrorCondition(final String message) {
        super(message);
    }
}
