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

/**
 * The empty form {@code ()}. Renders to nothing.
 */
public final class Empty implements Node {
    public static final Empty INSTANCE = new Empty();

    private Empty() {}

    @Override
    public String type() {
        return "empty";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitEmpty(this);
    }

    @Override
    public String toString() {
        return "()";
    }
}
