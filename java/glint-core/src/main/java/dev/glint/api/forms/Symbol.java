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

public final class Symbol implements Node {
    private final String name;

    private Symbol(String name) {
        this.name = name;
    }

    public static Symbol of(String name) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "symbol name must not be empty");
        return new Symbol(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Whether this symbol names a member or swizzle accessor such as {@code .xyz}.
     */
    public boolean isAccessor() {
        return name.length() > 1 && name.charAt(0) == '.';
    }

    @Override
    public String type() {
        return "symbol";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(name, symbol.name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
