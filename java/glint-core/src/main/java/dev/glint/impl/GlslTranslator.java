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
package dev.glint.impl;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import dev.glint.api.Declaration;
import dev.glint.api.Node;
import dev.glint.api.ShaderProgramSource;
import dev.glint.api.Translator;
import dev.glint.api.TranslatorOptions;
import dev.glint.api.forms.Call;
import dev.glint.api.forms.Symbol;
import dev.glint.glsl.GlslEmitter;
import dev.glint.glsl.ImportGenerator;
import dev.glint.glsl.MacroExpander;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a shader body in three passes: macro expansion, import generation and emission.
 */
public final class GlslTranslator implements Translator {
    private static final Logger log = LoggerFactory.getLogger(GlslTranslator.class);

    private static final Symbol MAIN = Symbol.of("main");

    private final ImportGenerator generator;
    private final GlslEmitter emitter;

    public GlslTranslator(TranslatorOptions options) {
        Preconditions.checkNotNull(options, "options");
        this.generator = new ImportGenerator(options.bindings(), options.maxGenerationRounds());
        this.emitter = new GlslEmitter(options.knownFunctions());
    }

    @Override
    public String translate(List<Declaration> declarations, Node body) {
        Preconditions.checkNotNull(declarations, "declarations");
        Preconditions.checkNotNull(body, "body");

        String declarationSection = emitter.renderDeclarations(declarations);
        Node expanded = MacroExpander.expand(Call.of(MAIN, body));
        List<Node> program = generator.generate(expanded);
        String source = declarationSection + emitter.renderProgram(program);

        log.debug(
                "translated {} declarations and {} top level forms into {} chars of GLSL",
                declarations.size(),
                program.size(),
                source.length());
        return source;
    }

    @Override
    public String vertexSource(List<Declaration> declarations, Node body) {
        return translate(declarations, body);
    }

    @Override
    public String vertexSource(String extensions, List<Declaration> declarations, Node body) {
        return withExtensions(extensions, vertexSource(declarations, body));
    }

    @Override
    public String fragmentSource(List<Declaration> declarations, Node body) {
        Preconditions.checkNotNull(declarations, "declarations");
        return translate(
                declarations.stream().filter(d -> !d.isAttribute()).collect(toImmutableList()), body);
    }

    @Override
    public String fragmentSource(String extensions, List<Declaration> declarations, Node body) {
        return withExtensions(extensions, fragmentSource(declarations, body));
    }

    @Override
    public ShaderProgramSource program(String extensions, List<Declaration> declarations, Node vertex, Node fragment) {
        return ShaderProgramSource.of(
                vertexSource(extensions, declarations, vertex), fragmentSource(extensions, declarations, fragment));
    }

    @Override
    public Node expand(Node form) {
        return MacroExpander.expand(Preconditions.checkNotNull(form, "form"));
    }

    private static String withExtensions(String extensions, String source) {
        if (Strings.isNullOrEmpty(extensions)) {
            return source;
        }
        return extensions + "\n" + source;
    }
}
