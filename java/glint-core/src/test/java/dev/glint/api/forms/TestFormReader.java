/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.glint.api.forms;

import static dev.glint.api.forms.Forms.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.glint.api.Node;
import org.junit.jupiter.api.Test;

public final class TestFormReader {
    @Test
    public void testReadsNestedCalls() {
        Node read = FormReader.read("(defn float square (float x) (return (* x x)))");
        Node expected = call(
                "defn",
                symbol("float"),
                symbol("square"),
                call("float", symbol("x")),
                call("return", call("*", symbol("x"), symbol("x"))));
        assertEquals(expected, read);
    }

    @Test
    public void testReadsAtoms() {
        assertEquals(Keyword.of("model-view-matrix"), FormReader.read(":model-view-matrix"));
        assertEquals(Literal.float64(1.5), FormReader.read("1.5"));
        assertEquals(Literal.int32(-2), FormReader.read("-2"));
        assertEquals(Literal.int64(10_000_000_000L), FormReader.read("10000000000"));
        assertEquals(Literal.float64(0.001), FormReader.read("1e-3"));
        assertEquals(Literal.float32(0.5f), FormReader.read("0.5f"));
        assertEquals("0.25", FormReader.read("0.25F").toString());
        assertEquals(Literal.bool(true), FormReader.read("true"));
        assertEquals(Symbol.of("-"), FormReader.read("-"));
        assertEquals(Symbol.of("->"), FormReader.read("->"));
        assertEquals(Symbol.of(".xyz"), FormReader.read(".xyz"));
        assertEquals(Symbol.of("set!"), FormReader.read("set!"));
        assertSame(Empty.INSTANCE, FormReader.read("()"));
        assertSame(Empty.INSTANCE, FormReader.read("[]"));
    }

    @Test
    public void testVectorsReadAsGroups() {
        assertEquals(
                group(symbol("a"), literal(1), symbol("b"), literal(2)),
                FormReader.read("[a 1 b 2]"));
        Node params = FormReader.read("[[float x] [vec3 y]]");
        assertEquals(group(call("float", symbol("x")), call("vec3", symbol("y"))), params);
        assertTrue(((Call) params).isGroup());
    }

    @Test
    public void testSkipsCommasAndComments() {
        Node read = FormReader.read("; add them up\n(+ a, b) ; trailing");
        assertEquals(call("+", symbol("a"), symbol("b")), read);
        assertEquals(3, FormReader.readAll("(a) (b)\n(c)").size());
    }

    @Test
    public void testPrintsBackToSource() {
        String source = "(set! (.xyz color) (* :model-view-matrix 2.0))";
        assertEquals(source, FormReader.read(source).toString());
    }

    @Test
    public void testRejectsMalformedText() {
        FormSyntaxException unterminated = assertThrows(FormSyntaxException.class, () -> FormReader.read("(a (b c)"));
        assertEquals(0, unterminated.getOffset());
        FormSyntaxException mismatched = assertThrows(FormSyntaxException.class, () -> FormReader.read("(a b]"));
        assertEquals(4, mismatched.getOffset());
        assertThrows(FormSyntaxException.class, () -> FormReader.read(")"));
        assertThrows(FormSyntaxException.class, () -> FormReader.read(":"));
        FormSyntaxException overflow =
                assertThrows(FormSyntaxException.class, () -> FormReader.read("99999999999999999999"));
        assertTrue(overflow.getCause() instanceof NumberFormatException);
        assertThrows(FormSyntaxException.class, () -> FormReader.read(""));
        assertThrows(FormSyntaxException.class, () -> FormReader.read("(a) (b)"));
    }
}
