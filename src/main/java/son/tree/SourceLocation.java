// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

/**
 * The position of a character within notation text.
 *
 * @param offset The zero-based character offset.
 * @param line   The one-based line number.
 * @param column The one-based column number.
 */
public record SourceLocation(int offset, int line, int column) {
    static SourceLocation of(final String text, final int offset) {
        final var end = Math.min(offset, text.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < end; i += 1) {
            if (text.charAt(i) == '\n') {
                line += 1;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(offset, line, end - lineStart + 1);
    }

    @Override
    public String toString() {
        return "In line " + line + ", column " + column + " (offset " + offset + ")";
    }
}
