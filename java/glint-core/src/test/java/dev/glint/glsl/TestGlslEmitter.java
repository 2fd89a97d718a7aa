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
package dev.glint.glsl;

import static dev.glint.api.forms.FormReader.read;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.glint.api.Declaration;
import dev.glint.api.GlslTranslationException;
import dev.glint.api.forms.Literal;
import org.junit.jupiter.api.Test;

public final class TestGlslEmitter {
    private final GlslEmitter emitter = new GlslEmitter();

    private String render(String source) {
        return emitter.render(read(source));
    }

    @Test
    public void testInfixFoldsLeftToRight() {
        assertEquals("((a - b) - c)", render("(- a b c)"));
        assertEquals("((a || b) || c)", render("(or a b c)"));
        assertEquals("x * x", render("(* x x)"));
        assertEquals("(x + 1) * 2", render("(* (+ x 1) 2)"));
        assertEquals("(a < b) && !c", render("(and (< a b) (not c))"));
        assertEquals("a == b", render("(= a b)"));
        assertEquals("a ^^ b", render("(xor a b)"));
    }

    @Test
    public void testUnary() {
        assertEquals("-a", render("(- a)"));
        assertEquals("-(a + b)", render("(- (+ a b))"));
        assertEquals("!(a && b)", render("(not (and a b))"));
        assertEquals("++i", render("(++ i)"));
    }

    @Test
    public void testAtoms() {
        assertEquals("gl_ModelViewMatrix", render(":model-view-matrix"));
        assertEquals("gl_MultiTexCoord0", render(":multi-tex-coord0"));
        assertEquals("tex_coord", render("tex-coord"));
        assertEquals("0.5", render("0.5"));
        assertEquals("true", emitter.render(Literal.bool(true)));
        assertEquals("", render("()"));
    }

    @Test
    public void testMemberAccessAndIndexing() {
        assertEquals("position.xyz", render("(.xyz position)"));
        assertEquals("(a + b).xy", render("(.xy (+ a b))"));
        assertEquals("weights[i]", render("(nth weights i)"));
        assertEquals("gl_TexCoord[0].st", render("(.st (nth :tex-coord 0))"));
    }

    @Test
    public void testFunctionCalls() {
        assertEquals("texture2D(tex, coord.st)", render("(texture2D tex (.st coord))"));
        assertEquals("vec4(1.0, 0.5, 0, 1)", render("(vec4 1.0 0.5 0 1)"));
        assertEquals("smooth_step(0.0, 1.0, t)", render("(smooth-step 0.0 1.0 t)"));
        assertEquals("normalize(a + b)", render("(normalize (+ a b))"));
    }

    @Test
    public void testAssignments() {
        assertEquals(
                "gl_Position = gl_ModelViewProjectionMatrix * gl_Vertex",
                render("(set! :position (* :model-view-projection-matrix :vertex))"));
        assertEquals("float x", render("(declare (float x))"));
        assertEquals("float x = 1.0", render("(declare (float x) 1.0)"));
        assertEquals("sum += weights[2]", render("(+= sum (nth weights 2))"));
        assertEquals("a[0] = 1", render("(set! (nth a 0) 1)"));
        assertEquals("color.xyz = v", render("(set! (.xyz color) v)"));
        assertEquals("total *= 2", render("(*= total 2)"));
    }

    @Test
    public void testStatements() {
        assertEquals("a = 1;\nb = 2;\nreturn a;\n", render("(do (set! a 1) (set! b 2) (return a))"));
        assertEquals("a = 1;\nb = 2;\nreturn a;\n", render("(let [a 1 b 2] (return a))"));
        assertEquals("return x * x", render("(return (* x x))"));
        assertEquals("", render("(import (lib f))"));
        assertEquals("a = 1;\n", render("(do (import (lib f)) (set! a 1))"));
    }

    @Test
    public void testIf() {
        assertEquals(
                "if (a < b)\n{\n  return a;\n}\nelse\n{\n  return b;\n}\n",
                render("(if (< a b) (return a) (return b))"));
        assertEquals("if (c)\n{\n  a = 1;\n  b = 2;\n}\n", render("(if c ((set! a 1) (set! b 2)))"));
    }

    @Test
    public void testFunctionDefinitions() {
        assertEquals(
                "float square(float x)\n{\n  return x * x;\n}\n",
                render("(defn float square (float x) (return (* x x)))"));
        assertEquals(
                "vec3 mix_colors(vec3 a, vec3 b, float t)\n{\n  return mix(a, b, t);\n}\n",
                render("(defn vec3 mix-colors [[vec3 a] [vec3 b] [float t]] (return (mix a b t)))"));
        assertEquals("void reset()\n{\n  count = 0;\n}\n", render("(defn void reset [] (set! count 0))"));
    }

    @Test
    public void testArrayParameters() {
        assertEquals(
                "float first(float xs[4])\n{\n  return xs[0];\n}\n",
                render("(defn float first (float (nth xs 4)) (return (nth xs 0)))"));
        assertEquals(
                "float weighted(float xs[4], int n)\n{\n  return xs[n];\n}\n",
                render("(defn float weighted [[float (nth xs 4)] [int n]] (return (nth xs n)))"));
    }

    @Test
    public void testMainAndNestedIndentation() {
        assertEquals("void main()\n{\n  gl_FragColor = color;\n}\n", render("(main (set! :frag-color color))"));
        assertEquals(
                "void main()\n{\n  if (c)\n  {\n    discard();\n  }\n  gl_FragColor = color;\n}\n",
                render("(main (if c (discard)) (set! :frag-color color))"));
        assertEquals("void main()\n{\n}\n", render("(main)"));
    }

    @Test
    public void testDeclarations() {
        assertEquals(
                "uniform float time;\nvarying vec2 tex_coord;\n",
                emitter.renderDeclarations(ImmutableList.of(
                        Declaration.of("uniform", "float", "time"), Declaration.of("varying", "vec2", "tex-coord"))));
        assertEquals("", emitter.renderDeclarations(ImmutableList.of()));
        assertEquals("uniform vec3[4] lights", emitter.renderLValue(read("(uniform (nth vec3 4) lights)")));
    }

    @Test
    public void testKnownFunctions() {
        GlslEmitter strict = new GlslEmitter(ImmutableSet.of("vec4"));
        assertEquals("vec4(1, 2, 3, 4)", strict.render(read("(vec4 1 2 3 4)")));
        assertEquals("void main()\n{\n  x = a + b;\n}\n", strict.render(read("(main (set! x (+ a b)))")));
        GlslTranslationException e =
                assertThrows(GlslTranslationException.class, () -> strict.render(read("(texture2D t c)")));
        assertEquals("unknown function texture2D in (texture2D t c)", e.getMessage());
    }

    @Test
    public void testDeterministic() {
        String source = "(defn float f [[float a] [float b]] (if (> a b) (return (- a b c)) (return (-> a (* b)))))";
        assertEquals(render(source), render(source));
    }
}
