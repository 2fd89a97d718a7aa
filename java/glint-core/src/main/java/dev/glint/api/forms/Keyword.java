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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import dev.glint.api.Node;
import java.util.Objects;

/**
 * Reference to a GLSL builtin, e.g. {@code :model-view-matrix} for {@code gl_ModelViewMatrix}.
 */
public final class Keyword implements Node {
    private final String name;

    private Keyword(String name) {
        this.name = name;
    }

    /**
     * Creates a keyword. A leading {@code :} is accepted and dropped.
     */
    public static Keyword of(String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "keyword name must not be empty");
        String bare = name.charAt(0) == ':' ? name.substring(1) : name;
        Preconditions.checkArgument(!bare.isEmpty(), "keyword name must not be empty");
        return new Keyword(bare);
    }

    public String getName() {
        return name;
    }

    @Override
    public String type() {
        return "keyword";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitKeyword(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Keyword keyword = (Keyword) o;
        return Objects.equals(name, keyword.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return ":" + name;
    }
}
