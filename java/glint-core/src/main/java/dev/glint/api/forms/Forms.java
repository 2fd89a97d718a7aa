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

import dev.glint.api.Node;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand constructors for building shader forms in code.
 */
public final class Forms {
    private Forms() {}

    public static Symbol symbol(String name) {
        return Symbol.of(name);
    }

    public static Keyword keyword(String name) {
        return Keyword.of(name);
    }

    public static Literal<Integer> literal(int value) {
        return Literal.int32(value);
    }

    public static Literal<Double> literal(double value) {
        return Literal.float64(value);
    }

    public static Literal<Boolean> literal(boolean value) {
        return Literal.bool(value);
    }

    /**
     * Builds {@code (operator args...)}.
     */
    public static Call call(String operator, Node... args) {
        return Call.of(Symbol.of(operator), args);
    }

    /**
     * Builds a bare sequence of forms, {@link Empty} when there are none.
     */
    public static Node group(List<? extends Node> forms) {
        if (forms.isEmpty()) {
            return Empty.INSTANCE;
        }
        return Call.of(forms);
    }

    public static Node group(Node... forms) {
        return group(Arrays.asList(forms));
    }

    public static Node read(String text) {
        return FormReader.read(text);
    }
}
