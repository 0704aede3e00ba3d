// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.stream.LongStream;
import son.tree.Node;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class RoundTripTest {
    static LongStream provideSeeds() {
        return RandomUtils.seeds(32);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "root(a(1,2), b(@a), \"x,y\")",
        "(1,2,)",
        "outer(a(1), alias(@a), )",
        "p(x(1), y(@x))",
        "  spaced  , \" quoted \" , (nested (deeper(\"(\")))",
        "self(@self), other(@self, inner(@other))",
        "(\"\"), (,), ()",
        "",
    })
    void knownInputsRoundTrip(final String text) {
        assertRoundTrips(text);
    }

    @ParameterizedTest(name = "seed {0}")
    @MethodSource("provideSeeds")
    void randomTreesRoundTrip(final long seed) {
        final var text = new TextGenerator(RandomUtils.createGenerator(seed)).generate();
        assertThat(Conditions.fatalConditionOf(() -> Node.parse(text))).as("parsing %s", text).isNull();
        assertRoundTrips(text);
    }

    @Test
    void reparsedAliasesPointAtTheSameDeclaration() {
        final var original = Node.parse("root(a(1,2), b(@a), \"x,y\")");
        final var reparsed = Node.parse(original.toString());
        final var root = reparsed.get("root");
        assertThat(root.get("b").get(0)).isSameAs(root.get("a"));
    }

    private static void assertRoundTrips(final String text) {
        final var first = Node.parse(text);
        final var serialized = first.toString();
        final var second = Node.parse(serialized);
        assertThat(shape(second)).as("shape of %s reread from %s", text, serialized).isEqualTo(shape(first));
        assertThat(second.toString()).isEqualTo(serialized);
    }

    // Renders the structure independently of the serializer, with aliases shown as the index path of their target.
    private static String shape(final Node node) {
        final var builder = new StringBuilder();
        appendShape(builder, node);
        return builder.toString();
    }

    private static void appendShape(final StringBuilder builder, final Node node) {
        if (!node.isContainer()) {
            builder.append("leaf[").append(node.field()).append(']');
            return;
        }
        builder.append("container[").append(node.name()).append("]{");
        for (final var child : node.children()) {
            if (node.owns(child)) {
                appendShape(builder, child);
            } else {
                builder.append("alias").append(pathOf(child));
            }
            builder.append(';');
        }
        builder.append('}');
    }

    private static List<Integer> pathOf(final Node node) {
        final var path = new ArrayList<Integer>();
        var current = node;
        for (var parent = current.parent(); parent != null; parent = current.parent()) {
            path.add(0, indexOf(parent, current));
            current = parent;
        }
        return path;
    }

    private static int indexOf(final Node parent, final Node child) {
        final var children = parent.children();
        for (int i = 0; i < children.size(); i += 1) {
            if (children.get(i) == child) {
                return i;
            }
        }
        throw new AssertionError("Child not found in its parent");
    }

    // Generates valid notation text. Aliases only refer to the named containers at the top level, which are visible
    // from everywhere once the top level has been scanned.
    private static final class TextGenerator {
        private TextGenerator(final RandomGenerator random) {
            this.random = random;
        }

        private String generate() {
            final var groupCount = 1 + random.nextInt(5);
            for (int i = 0; i < groupCount; i += 1) {
                if (i > 0) {
                    appendSeparator();
                }
                if (random.nextInt(4) == 0) {
                    appendLeaf();
                    appendSeparator();
                }
                builder.append(whitespace()).append("g").append(i).append('(');
                appendBody(groupCount, 1);
                builder.append(')');
            }
            return builder.toString();
        }

        private void appendBody(final int groupCount, final int depth) {
            final var childCount = random.nextInt(5);
            final var aliased = new HashSet<Integer>();
            for (int i = 0; i < childCount; i += 1) {
                if (i > 0) {
                    appendSeparator();
                }
                final var kind = random.nextInt(10);
                if (kind < 3 && depth < 5) {
                    builder.append(whitespace());
                    if (random.nextBoolean()) {
                        builder.append("n").append(i);
                    }
                    builder.append('(');
                    appendBody(groupCount, depth + 1);
                    builder.append(')');
                } else if (kind < 5) {
                    final var target = random.nextInt(groupCount);
                    if (aliased.add(target)) {
                        builder.append(whitespace()).append("@g").append(target);
                    } else {
                        appendLeaf();
                    }
                } else {
                    appendLeaf();
                }
            }
        }

        private void appendLeaf() {
            switch (random.nextInt(4)) {
                case 0 -> builder.append(whitespace());
                case 1 -> builder.append(whitespace()).append('"').append(word(quotedAlphabet)).append('"');
                default -> builder.append(whitespace()).append(word(bareAlphabet)).append(whitespace());
            }
        }

        private void appendSeparator() {
            builder.append(whitespace()).append(',');
        }

        private String word(final String alphabet) {
            final var length = 1 + random.nextInt(6);
            final var word = new StringBuilder(length);
            for (int i = 0; i < length; i += 1) {
                word.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            return word.toString();
        }

        private String whitespace() {
            return switch (random.nextInt(4)) {
                case 0 -> " ";
                case 1 -> "\n  ";
                default -> "";
            };
        }

        private static final String bareAlphabet = "abcxyz019.- ";
        private static final String quotedAlphabet = "ab (),@ \n";

        private final RandomGenerator random;
        private final StringBuilder builder = new StringBuilder();
    }
}
