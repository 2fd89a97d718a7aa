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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import dev.glint.api.forms.Call;
import java.util.Arrays;
import java.util.Optional;

/**
 * The operators the translator gives special meaning to. Calls to any other operator are
 * rendered as plain GLSL function calls.
 */
enum Builtin {
    // macros
    LET("let", Shape.MACRO, ""),
    THREAD("->", Shape.MACRO, ""),
    // generators
    IMPORT("import", Shape.GENERATOR, ""),
    // infix
    ADD("+", Shape.INFIX, "+"),
    DIVIDE("/", Shape.INFIX, "/"),
    MULTIPLY("*", Shape.INFIX, "*"),
    EQ("=", Shape.INFIX, "=="),
    AND("and", Shape.INFIX, "&&"),
    OR("or", Shape.INFIX, "||"),
    XOR("xor", Shape.INFIX, "^^"),
    LT("<", Shape.INFIX, "<"),
    LT_EQ("<=", Shape.INFIX, "<="),
    GT(">", Shape.INFIX, ">"),
    GT_EQ(">=", Shape.INFIX, ">="),
    // unary
    NOT("not", Shape.UNARY, "!"),
    INCREMENT("++", Shape.UNARY, "++"),
    DECREMENT("--", Shape.UNARY, "--"),
    MINUS("-", Shape.MINUS, "-"),
    // assignment
    DECLARE("declare", Shape.ASSIGNMENT, "="),
    SET("set!", Shape.ASSIGNMENT, "="),
    ADD_ASSIGN("+=", Shape.ASSIGNMENT, "+="),
    SUBTRACT_ASSIGN("-=", Shape.ASSIGNMENT, "-="),
    MULTIPLY_ASSIGN("*=", Shape.ASSIGNMENT, "*="),
    // structure
    NTH("nth", Shape.INDEX, ""),
    DO("do", Shape.DO, ""),
    IF("if", Shape.IF, ""),
    RETURN("return", Shape.RETURN, "return"),
    MAIN("main", Shape.MAIN, "void main()"),
    DEFN("defn", Shape.DEFN, ""),
    ;

    private static final ImmutableMap<String, Builtin> BY_SYMBOL =
            Maps.uniqueIndex(Arrays.asList(values()), Builtin::getSymbol);

    private final String symbol;
    private final Shape shape;
    private final String glsl;

    Builtin(String symbol, Shape shape, String glsl) {
        this.symbol = symbol;
        this.shape = shape;
        this.glsl = glsl;
    }

    static Optional<Builtin> lookup(Call call) {
        return call.getOperator().map(BY_SYMBOL::get);
    }

    String getSymbol() {
        return symbol;
    }

    Shape getShape() {
        return shape;
    }

    /**
     * The GLSL operator or header text this builtin renders with.
     */
    String getGlsl() {
        return glsl;
    }

    enum Shape {
        MACRO,
        GENERATOR,
        INFIX,
        UNARY,
        MINUS,
        ASSIGNMENT,
        INDEX,
        DO,
        IF,
        RETURN,
        MAIN,
        DEFN,
    }
}
