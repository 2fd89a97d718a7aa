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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.glint.api.forms.Call;
import dev.glint.api.forms.FormReader;
import dev.glint.api.forms.Symbol;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A global shader variable such as {@code (uniform mat4 transform)} or
 * {@code (attribute vec3 normal)}, rendered ahead of the shader body.
 */
public final class Declaration {
    private static final String ATTRIBUTE = "attribute";
    private static final Symbol DECLARE = Symbol.of("declare");

    private final ImmutableList<Node> parts;

    private Declaration(ImmutableList<Node> parts) {
        this.parts = parts;
    }

    public static Declaration of(String... parts) {
        Preconditions.checkArgument(parts.length > 0, "declaration must not be empty");
        return new Declaration(
                Arrays.stream(parts).map(Symbol::of).collect(ImmutableList.toImmutableList()));
    }

    public static Declaration of(List<? extends Node> parts) {
        Preconditions.checkArgument(!parts.isEmpty(), "declaration must not be empty");
        return new Declaration(ImmutableList.copyOf(parts));
    }

    /**
     * Reads a declaration from text such as {@code "(varying vec2 tex-coord)"}.
     */
    public static Declaration parse(String source) {
        Node form = FormReader.read(source);
        Preconditions.checkArgument(form instanceof Call, "declaration must be a form: %s", source);
        return of(((Call) form).getElements());
    }

    public List<Node> getParts() {
        return parts;
    }

    /**
     * The storage qualifier, the first part when it is a symbol.
     */
    public Optional<String> getQualifier() {
        Node first = parts.get(0);
        if (first instanceof Symbol) {
            return Optional.of(((Symbol) first).getName());
        }
        return Optional.empty();
    }

    /**
     * Attributes only exist in the vertex stage.
     */
    public boolean isAttribute() {
        return getQualifier().map(ATTRIBUTE::equals).orElse(false);
    }

    /**
     * This declaration as a {@code (declare (parts...))} form.
     */
    public Call toForm() {
        return Call.of(DECLARE, Call.of(parts));
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Declaration that = (Declaration) o;
        return Objects.equals(parts, that.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(parts);
    }

    @Override
    public String toString() {
        return Call.of(parts).toString();
    }
}
