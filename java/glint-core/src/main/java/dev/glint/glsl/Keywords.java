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

import com.google.common.base.Splitter;

final class Keywords {
    private static final Splitter HYPHEN = Splitter.on('-').omitEmptyStrings();

    private Keywords() {}

    /**
     * Turns {@code model-view-matrix} into {@code gl_ModelViewMatrix}.
     */
    static String builtinName(String keyword) {
        StringBuilder name = new StringBuilder("gl_");
        for (String segment : HYPHEN.split(keyword)) {
            name.append(Character.toUpperCase(segment.charAt(0))).append(segment, 1, segment.length());
        }
        return name.toString();
    }

    /**
     * GLSL identifiers cannot contain hyphens.
     */
    static String identifier(String name) {
        return name.replace('-', '_');
    }
}
