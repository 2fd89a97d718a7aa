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
import java.util.Set;
import org.immutables.value.Value;

/**
 * Settings for a {@link Translator}.
 */
@Value.Immutable
public interface TranslatorOptions {
    /**
     * Resolves the symbols named by {@code import} forms. Defaults to a resolver with no bindings.
     */
    @Value.Default
    default BindingResolver bindings() {
        return BindingResolver.none();
    }

    /**
     * Upper bound on rounds of import generation before translation is abandoned.
     */
    @Value.Default
    default int maxGenerationRounds() {
        return 64;
    }

    /**
     * GLSL function names allowed in plain function calls. When empty, any name passes through.
     */
    Set<String> knownFunctions();

    @Value.Check
    default void check() {
        Preconditions.checkState(
                maxGenerationRounds() > 0, "maxGenerationRounds must be positive: %s", maxGenerationRounds());
    }

    static TranslatorOptions of() {
        return ImmutableTranslatorOptions.builder().build();
    }

    static ImmutableTranslatorOptions.Builder builder() {
        return ImmutableTranslatorOptions.builder();
    }
}
