// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Errors found while reading or querying a tree are signaled as {@link son.util.condition.Condition conditions}.
 * Handlers get to look at a condition while the stack that produced it is still intact, and decide where control
 * goes next by unwinding to a {@link son.util.condition.Restart restart}.
 */
package son.util.condition;
