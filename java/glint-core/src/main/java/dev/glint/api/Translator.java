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

import java.util.List;

/**
 * Translates shader forms into GLSL source.
 * <p>
 * Implementations are stateless and may be shared between threads.
 */
public interface Translator {
    /**
     * Translate the declarations and a body wrapped in {@code void main()}, without any stage
     * specific filtering.
     */
    String translate(List<Declaration> declarations, Node body);

    /**
     * Vertex shader source for the given declarations and {@code main} body.
     */
    String vertexSource(List<Declaration> declarations, Node body);

    /**
     * Vertex shader source preceded by an extension directive block, e.g.
     * {@code "#extension GL_ARB_texture_rectangle : enable"}.
     */
    String vertexSource(String extensions, List<Declaration> declarations, Node body);

    /**
     * Fragment shader source. {@code attribute} declarations are left out.
     */
    String fragmentSource(List<Declaration> declarations, Node body);

    String fragmentSource(String extensions, List<Declaration> declarations, Node body);

    /**
     * Both stages of a program sharing one list of declarations.
     */
    ShaderProgramSource program(String extensions, List<Declaration> declarations, Node vertex, Node fragment);

    /**
     * Expand every macro form in {@code form}.
     */
    Node expand(Node form);
}
