// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package son.test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import son.tree.Node;
import son.tree.Serializer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class SerializerTest {
    @Test
    void exampleIsCanonicalized() {
        final var tree = Node.parse("root( a(1, 2), b( @a ), \"x,y\" )");
        assertThat(Serializer.toString(tree)).isEqualTo("root(a(1,2),b(@a),\"x,y\")");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '\'', value = {
        "'(1,2,)'           | '(1,2,)'",
        "'()'               | '()'",
        "'(,)'              | '(,)'",
        "'(\"\")'           | '(\"\")'",
        "'a(\"\", b)'       | 'a(,b)'",
        "'\" padded \"'     | '\" padded \"'",
        "'\"a(b)\"'         | '\"a(b)\"'",
        "'\"plain\"'        | 'plain'",
        "'a , b'            | 'a,b'",
        "''                 | ''",
        "'x(1), y(z(2), @x)'| 'x(1),y(z(2),@x)'",
    })
    void serializesCanonically(final String input, final String expected) {
        assertThat(Node.parse(input).toString()).isEqualTo(expected);
    }

    @Test
    void subtreesKeepTheirDelimiters() {
        final var tree = Node.parse("outer(inner(1, 2), link(@inner))");
        assertThat(tree.get("outer").get("inner").toString()).isEqualTo("inner(1,2)");
        assertThat(tree.get("outer").get("link").toString()).isEqualTo("link(@inner)");
        assertThat(tree.get("outer").get("inner").get(0).toString()).isEqualTo("1");
    }

    @Test
    void writesToWriter() throws IOException {
        final var writer = new StringWriter();
        Serializer.serialize(writer, Node.parse("a(b(c))"));
        assertThat(writer).hasToString("a(b(c))");
    }

    @Test
    void writerFailuresPropagate() {
        final var tree = Node.parse("a(1)");
        assertThatIOException().isThrownBy(() -> Serializer.serialize(new FailingWriter(), tree));
    }

    private static final class FailingWriter extends Writer {
        @Override
        public void write(final char[] buffer, final int offset, final int length) throws IOException {
            throw new IOException("Disk full");
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
