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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.glint.api.Declaration;
import dev.glint.api.GlslTranslationException;
import dev.glint.api.Node;
import dev.glint.api.forms.*;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders expanded shader forms as GLSL text.
 * <p>
 * Member access ({@code (.xyz position)} to {@code position.xyz}) and atoms are handled first,
 * then the {@link Builtin} operators, and anything else becomes a plain function call
 * {@code name(arg, arg)}. Statements are terminated with {@code ;} and a newline, blocks are
 * brace delimited and indented by two spaces.
 */
public final class GlslEmitter {
    private static final Joiner COMMA = Joiner.on(", ");
    private static final Joiner SPACE = Joiner.on(' ');
    private static final Splitter LINES = Splitter.on('\n').omitEmptyStrings();
    private static final String STATEMENT_END = ";";

    private final ImmutableSet<String> knownFunctions;
    private final ExpressionRenderer statement = new ExpressionRenderer(false);
    private final ExpressionRenderer operand = new ExpressionRenderer(true);
    private final LValueRenderer lvalue = new LValueRenderer();

    public GlslEmitter() {
        this(ImmutableSet.of());
    }

    /**
     * @param knownFunctions names allowed in plain function calls, or empty to allow any name
     */
    public GlslEmitter(Set<String> knownFunctions) {
        this.knownFunctions = ImmutableSet.copyOf(Preconditions.checkNotNull(knownFunctions, "knownFunctions"));
    }

    /**
     * Render a single form in statement position, without a terminator.
     */
    public String render(Node form) {
        return form.accept(statement);
    }

    /**
     * Render a form as the target of an assignment, a declaration or a parameter.
     */
    public String renderLValue(Node form) {
        return form.accept(lvalue);
    }

    /**
     * Render a body, a single form or a group of forms, as terminated statements.
     */
    public String renderStatements(Node body) {
        return lines(STATEMENT_END, ImmutableList.of(body));
    }

    public String renderDeclarations(List<Declaration> declarations) {
        return lines(
                STATEMENT_END,
                declarations.stream().map(Declaration::toForm).collect(toImmutableList()));
    }

    /**
     * Render the top level forms of a program. These are blocks and carry their own line ends.
     */
    public String renderProgram(List<Node> forms) {
        return lines("", forms);
    }

    private String lines(String terminator, List<Node> forms) {
        if (forms.isEmpty()) {
            return "";
        }
        Node first = forms.get(0);
        if (forms.size() == 1) {
            if (first instanceof Call && ((Call) first).isGroup()) {
                return lines(terminator, ((Call) first).getElements());
            }
            return terminate(terminator, forms);
        }
        if (first instanceof Call) {
            return terminate(terminator, forms);
        }
        // a bare form spelled out as a sequence
        return terminate(terminator, ImmutableList.of(Call.of(forms)));
    }

    private String terminate(String terminator, List<Node> forms) {
        StringBuilder out = new StringBuilder();
        for (Node form : forms) {
            String text = render(form);
            if (text.trim().isEmpty()) {
                continue;
            }
            out.append(text);
            if (!text.endsWith("\n")) {
                out.append(terminator).append('\n');
            }
        }
        return out.toString();
    }

    private static String indent(String text) {
        StringBuilder out = new StringBuilder();
        for (String line : LINES.split(text)) {
            out.append("  ").append(line).append('\n');
        }
        return out.toString();
    }

    private String scope(String header, List<Node> body) {
        return header + "\n{\n" + indent(lines(STATEMENT_END, body)) + "}\n";
    }

    private static boolean isAccessor(Call call) {
        return call.getHead() instanceof Symbol && ((Symbol) call.getHead()).isAccessor();
    }

    // (float x) is a whole parameter; (nth xs 4) and (.xyz v) are parts of one
    private static boolean isParameter(Node element) {
        if (!(element instanceof Call)) {
            return false;
        }
        Call call = (Call) element;
        return !isAccessor(call) && !Builtin.lookup(call).isPresent();
    }

    private static List<Node> argsFrom(Call call, int index) {
        List<Node> args = call.getArgs();
        return index < args.size() ? args.subList(index, args.size()) : ImmutableList.of();
    }

    /**
     * Renders expressions. Operands of other operators keep the parentheses around binary
     * operations; elsewhere a two operand operation is written bare.
     */
    private final class ExpressionRenderer implements Node.Visitor<String> {
        private final boolean nested;

        ExpressionRenderer(boolean nested) {
            this.nested = nested;
        }

        @Override
        public String visitCall(Call call) {
            if (call.isGroup()) {
                return lines(STATEMENT_END, call.getElements());
            }
            if (isAccessor(call)) {
                return call.getArg(0).accept(operand) + call.getHead();
            }

            Optional<Builtin> builtin = Builtin.lookup(call);
            if (!builtin.isPresent()) {
                return function(call);
            }

            Builtin op = builtin.get();
            List<Node> args = call.getArgs();
            switch (op.getShape()) {
                case MACRO:
                    return MacroExpander.expand(call).accept(this);
                case GENERATOR:
                    return "";
                case INFIX:
                    return infix(op.getGlsl(), args);
                case UNARY:
                    return op.getGlsl() + call.getArg(0).accept(operand);
                case MINUS:
                    if (args.size() <= 1) {
                        return "-" + call.getArg(0).accept(operand);
                    }
                    return infix(op.getGlsl(), args);
                case ASSIGNMENT:
                    if (args.size() <= 1) {
                        return call.getArg(0).accept(lvalue);
                    }
                    return call.getArg(0).accept(lvalue) + " " + op.getGlsl() + " " + render(call.getArg(1));
                case INDEX:
                    return call.getArg(0).accept(operand) + "[" + render(call.getArg(1)) + "]";
                case DO:
                    return lines(STATEMENT_END, args);
                case IF:
                    return conditional(call);
                case RETURN:
                    return args.isEmpty() ? op.getGlsl() : op.getGlsl() + " " + render(call.getArg(0));
                case MAIN:
                    return scope(op.getGlsl(), args);
                case DEFN:
                    return scope(functionHeader(call), argsFrom(call, 3));
                default:
                    throw new IllegalStateException("Unhandled builtin: " + op);
            }
        }

        @Override
        public String visitSymbol(Symbol symbol) {
            return Keywords.identifier(symbol.getName());
        }

        @Override
        public String visitKeyword(Keyword keyword) {
            return Keywords.builtinName(keyword.getName());
        }

        @Override
        public String visitLiteral(Literal<?> literal) {
            return literal.getText();
        }

        @Override
        public String visitEmpty(Empty empty) {
            return "";
        }

        // (- a b c) -> ((a - b) - c)
        private String infix(String operator, List<Node> operands) {
            if (operands.isEmpty()) {
                return "";
            }
            String folded = operands.get(0).accept(operand);
            for (Node next : operands.subList(1, operands.size())) {
                folded = "(" + folded + " " + operator + " " + next.accept(operand) + ")";
            }
            if (!nested && operands.size() == 2) {
                return folded.substring(1, folded.length() - 1);
            }
            return folded;
        }

        private String conditional(Call call) {
            String out = "if (" + render(call.getArg(0)) + ")\n{\n"
                    + indent(renderStatements(call.getArg(1))) + "}\n";
            if (call.argCount() > 2) {
                out += "else\n{\n" + indent(renderStatements(call.getArg(2))) + "}\n";
            }
            return out;
        }

        private String function(Call call) {
            String name = functionName(call.getHead());
            if (!knownFunctions.isEmpty() && !knownFunctions.contains(name)) {
                throw GlslTranslationException.of("unknown function %s in %s", name, call);
            }
            return name + "(" + COMMA.join(call.getArgs().stream().map(GlslEmitter.this::render).iterator()) + ")";
        }

        private String functionName(Node head) {
            if (head instanceof Symbol) {
                return Keywords.identifier(((Symbol) head).getName());
            }
            if (head instanceof Keyword) {
                return Keywords.identifier(((Keyword) head).getName());
            }
            return render(head);
        }

        // (defn float square (float x) ...) -> float square(float x)
        private String functionHeader(Call defn) {
            return defn.getArg(0).accept(lvalue) + " "
                    + defn.getArg(1).accept(lvalue) + "("
                    + parameters(defn.getArg(2)) + ")";
        }

        private String parameters(Node params) {
            if (!(params instanceof Call)) {
                return params.accept(lvalue);
            }
            List<Node> elements = ((Call) params).getElements();
            boolean list = elements.stream().anyMatch(GlslEmitter::isParameter);
            if (!list) {
                return params.accept(lvalue);
            }
            return COMMA.join(elements.stream().map(element -> element.accept(lvalue)).iterator());
        }
    }

    private final class LValueRenderer implements Node.Visitor<String> {
        @Override
        public String visitCall(Call call) {
            if (isAccessor(call)) {
                return call.getArg(0).accept(this) + call.getHead();
            }
            if (Builtin.lookup(call).filter(Builtin.NTH::equals).isPresent()) {
                return call.getArg(0).accept(this) + "[" + render(call.getArg(1)) + "]";
            }
            return SPACE.join(call.getElements().stream()
                    .map(element -> element.accept(this))
                    .filter(text -> !text.isEmpty())
                    .iterator());
        }

        @Override
        public String visitSymbol(Symbol symbol) {
            return Keywords.identifier(symbol.getName());
        }

        @Override
        public String visitKeyword(Keyword keyword) {
            return Keywords.builtinName(keyword.getName());
        }

        @Override
        public String visitLiteral(Literal<?> literal) {
            return literal.getText();
        }

        @Override
        public String visitEmpty(Empty empty) {
            return "";
        }
    }
}
