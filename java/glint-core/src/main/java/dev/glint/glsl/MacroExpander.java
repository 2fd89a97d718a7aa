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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import dev.glint.api.GlslTranslationException;
import dev.glint.api.Node;
import dev.glint.api.forms.*;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites the macro forms of a tree into core forms.
 * <p>
 * The walk is top-down: a macro call is replaced by its expansion and the expansion is walked
 * again, so macros that expand into other macros are fully processed. Calls to anything else keep
 * their shape and have their elements walked.
 * <ul>
 *  <li>{@code (let [a 1 b 2] body...)} becomes {@code (do (set! a 1) (set! b 2) body...)}</li>
 *  <li>{@code (-> x f (g y))} becomes {@code (g (f x) y)}</li>
 * </ul>
 */
public final class MacroExpander implements Node.Visitor<Node> {
    public static final MacroExpander INSTANCE = new MacroExpander();

    private static final Symbol DO = Symbol.of("do");
    private static final Symbol SET = Symbol.of("set!");

    private MacroExpander() {}

    public static Node expand(Node node) {
        return node.accept(INSTANCE);
    }

    @Override
    public Node visitCall(Call call) {
        Optional<Builtin> builtin = Builtin.lookup(call);
        if (builtin.isPresent() && builtin.get().getShape() == Builtin.Shape.MACRO) {
            return expand(expandOnce(builtin.get(), call));
        }
        return Call.of(call.getElements().stream().map(MacroExpander::expand).collect(toImmutableList()));
    }

    @Override
    public Node visitSymbol(Symbol symbol) {
        return symbol;
    }

    @Override
    public Node visitKeyword(Keyword keyword) {
        return keyword;
    }

    @Override
    public Node visitLiteral(Literal<?> literal) {
        return literal;
    }

    @Override
    public Node visitEmpty(Empty empty) {
        return empty;
    }

    private static Node expandOnce(Builtin macro, Call call) {
        switch (macro) {
            case LET:
                return expandLet(call);
            case THREAD:
                return expandThread(call);
            default:
                throw new IllegalStateException("Not a macro: " + macro);
        }
    }

    private static Node expandLet(Call let) {
        List<Node> bindings = bindingsOf(let);
        if (bindings.size() % 2 != 0) {
            throw GlslTranslationException.of(
                    "let needs an even number of binding forms but got %s in %s", bindings.size(), let);
        }

        ImmutableList.Builder<Node> expanded = ImmutableList.builder();
        expanded.add(DO);
        for (int i = 0; i < bindings.size(); i += 2) {
            expanded.add(Call.of(SET, bindings.get(i), bindings.get(i + 1)));
        }
        List<Node> args = let.getArgs();
        if (args.size() > 1) {
            expanded.addAll(args.subList(1, args.size()));
        }
        return Call.of(expanded.build());
    }

    private static List<Node> bindingsOf(Call let) {
        Node bindings = let.getArg(0);
        if (bindings instanceof Empty) {
            return ImmutableList.of();
        }
        if (bindings instanceof Call) {
            return ((Call) bindings).getElements();
        }
        throw GlslTranslationException.of("let bindings must be a vector of pairs, got %s in %s", bindings, let);
    }

    private static Node expandThread(Call thread) {
        List<Node> args = thread.getArgs();
        if (args.isEmpty()) {
            return Empty.INSTANCE;
        }
        Node term = args.get(0);
        for (Node step : args.subList(1, args.size())) {
            term = combine(term, step);
        }
        return term;
    }

    // (f a b) with x -> (f x a b); f with x -> (f x)
    private static Node combine(Node term, Node step) {
        if (step instanceof Call) {
            Call call = (Call) step;
            return Call.of(
                    ImmutableList.<Node>builder()
                            .add(call.getHead())
                            .add(term)
                            .addAll(call.getArgs())
                            .build());
        }
        return Call.of(step, term);
    }
}
