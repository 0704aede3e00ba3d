// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Simple Object Notation: an S-expression-like tree notation with named sub-trees and aliases.
 */
module son {
    requires static org.jetbrains.annotations;
    requires static org.checkerframework.checker.qual;
    requires static com.github.spotbugs.annotations;

    exports son.tree;
    exports son.util;
    exports son.util.condition;
}
