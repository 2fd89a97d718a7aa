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

/**
 * No binding exists for a symbol named by an {@code import} form.
 */
public final class MissingBindingException extends GlslTranslationException {
    private final String namespace;
    private final String symbol;

    public MissingBindingException(String namespace, String symbol) {
        super("No binding for " + symbol + " in namespace " + namespace);
        this.namespace = namespace;
        this.symbol = symbol;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getSymbol() {
        return symbol;
    }
}
