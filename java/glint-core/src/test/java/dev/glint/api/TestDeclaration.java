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
package dev.glint.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.glint.api.forms.FormReader;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public final class TestDeclaration {
    @Test
    public void testQualifier() {
        Declaration normal = Declaration.parse("(attribute vec3 normal)");
        assertEquals(Optional.of("attribute"), normal.getQualifier());
        assertTrue(normal.isAttribute());

        Declaration time = Declaration.of("uniform", "float", "time");
        assertFalse(time.isAttribute());
        assertEquals(3, time.getParts().size());
    }

    @Test
    public void testDeclareForm() {
        assertEquals(
                FormReader.read("(declare (varying vec2 tex-coord))"),
                Declaration.of("varying", "vec2", "tex-coord").toForm());
        assertEquals(Declaration.of("float", "x"), Declaration.parse("[float x]"));
    }

    @Test
    public void testRejectsAtoms() {
        assertThrows(IllegalArgumentException.class, () -> Declaration.parse("x"));
        assertThrows(IllegalArgumentException.class, () -> Declaration.of(new String[0]));
    }

    @Test
    public void testMapBindingResolver() {
        MapBindingResolver bindings = MapBindingResolver.builder()
                .bind("noise", "hash", "(defn float hash (float n) (return (fract (* (sin n) 43758.5453))))")
                .build();
        assertEquals(1, bindings.size());
        assertEquals("defn", bindings.resolve("noise", "hash").toString().substring(1, 5));

        MissingBindingException missing =
                assertThrows(MissingBindingException.class, () -> bindings.resolve("noise", "perlin"));
        assertEquals("noise", missing.getNamespace());
        assertEquals("perlin", missing.getSymbol());
        assertThrows(MissingBindingException.class, () -> BindingResolver.none().resolve("noise", "hash"));
    }

    @Test
    public void testOptionsValidation() {
        TranslatorOptions defaults = TranslatorOptions.of();
        assertEquals(64, defaults.maxGenerationRounds());
        assertTrue(defaults.knownFunctions().isEmpty());
        assertThrows(
                IllegalStateException.class,
                () -> TranslatorOptions.builder().maxGenerationRounds(0).build());
    }
}
