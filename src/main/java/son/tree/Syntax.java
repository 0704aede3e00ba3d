// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.tree;

/**
 * The reserved characters of the notation.
 * <p>
 * The roles are fixed, the characters are not: any five distinct non-whitespace characters will do.
 *
 * @param open      Opens the body of a container.
 * @param close     Closes the body of a container.
 * @param separator Separates fields within a body.
 * @param alias     Marks a field as an alias of a named container.
 * @param quote     Delimits a quoted leaf, within which the other reserved characters are literal text.
 */
public record Syntax(char open, char close, char separator, char alias, char quote) {
    /**
     * Validates the reserved characters.
     *
     * @throws IllegalArgumentException if two roles share a character, or a character is whitespace.
     */
    public Syntax {
        final var reserved = new char[] {open, close, separator, alias, quote};
        for (int i = 0; i < reserved.length; i += 1) {
            if (Character.isWhitespace(reserved[i])) {
                throw new IllegalArgumentException("Reserved characters must not be whitespace");
            }
            for (int j = i + 1; j < reserved.length; j += 1) {
                if (reserved[i] == reserved[j]) {
                    throw new IllegalArgumentException("Reserved character '" + reserved[i] + "' used twice");
                }
            }
        }
    }

    /**
     * Returns the standard syntax: {@code (}, {@code )}, {@code ,}, {@code @} and {@code "}.
     */
    public static Syntax standard() {
        return standard;
    }

    /**
     * Returns {@code true} iff the given character is one of the reserved characters.
     */
    public boolean isReserved(final char character) {
        return character == open || character == close || character == separator || character == alias
            || character == quote;
    }

    /**
     * Returns {@code true} iff the given text contains no reserved characters, i.e. it can be written as a bare leaf
     * or used as a name.
     */
    public boolean isBare(final String text) {
        final var length = text.length();
        for (int i = 0; i < length; i += 1) {
            if (isReserved(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static final Syntax standard = new Syntax('(', ')', ',', '@', '"');
}
