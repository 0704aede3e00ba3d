// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Simple Object Notation trees: the node model, the reader turning notation text into trees, and the serializer
 * turning trees back into text.
 * <p>
 * The notation is a comma-separated list of fields, where each field is one of:
 * <ul>
 * <li>{@code name(child, child, ...)}, a named container;
 * <li>{@code (child, child, ...)}, an anonymous container;
 * <li>{@code text}, a leaf whose text contains no reserved characters, surrounding whitespace trimmed;
 * <li>{@code "text"}, a leaf that may contain reserved characters;
 * <li>{@code @name}, an alias of a container named {@code name} declared elsewhere in the tree.
 * </ul>
 */
package son.tree;
