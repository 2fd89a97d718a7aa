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
import com.google.common.collect.ImmutableTable;
import dev.glint.api.forms.FormReader;

/**
 * A fixed table of namespace and symbol to form.
 */
public final class MapBindingResolver implements BindingResolver {
    private final ImmutableTable<String, String, Node> bindings;

    private MapBindingResolver(ImmutableTable<String, String, Node> bindings) {
        this.bindings = bindings;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Node resolve(String namespace, String symbol) {
        Node bound = bindings.get(namespace, symbol);
        if (bound == null) {
            throw new MissingBindingException(namespace, symbol);
        }
        return bound;
    }

    public int size() {
        return bindings.size();
    }

    public static final class Builder {
        private final ImmutableTable.Builder<String, String, Node> bindings = ImmutableTable.builder();

        private Builder() {}

        public Builder bind(String namespace, String symbol, Node form) {
            Preconditions.checkNotNull(namespace, "namespace");
            Preconditions.checkNotNull(symbol, "symbol");
            Preconditions.checkNotNull(form, "form");
            bindings.put(namespace, symbol, form);
            return this;
        }

        /**
         * Binds the form read from {@code source}.
         */
        public Builder bind(String namespace, String symbol, String source) {
            return bind(namespace, symbol, FormReader.read(source));
        }

        public MapBindingResolver build() {
            return new MapBindingResolver(bindings.build());
        }
    }
}
