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

import dev.glint.api.forms.*;

/**
 * A term of the shader form language.
 * <p>
 * Nodes are immutable values; every pass of the translator builds new trees rather
 * than editing the ones it was given.
 */
public interface Node {
    String type();

    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitCall(Call call);

        T visitSymbol(Symbol symbol);

        T visitKeyword(Keyword keyword);

        T visitLiteral(Literal<?> literal);

        T visitEmpty(Empty empty);
    }
}
