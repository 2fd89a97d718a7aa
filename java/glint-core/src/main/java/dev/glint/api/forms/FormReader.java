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

import com.google.common.collect.ImmutableList;
import dev.glint.api.Node;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads shader forms from s-expression text.
 * <p>
 * The reader understands:
 * <ul>
 *  <li>{@code (...)}, read as a {@link Call}, or {@link Empty} when there is nothing inside</li>
 *  <li>{@code [...]}, read the same way; used for binding vectors and parameter lists</li>
 *  <li>{@code :name}, read as a {@link Keyword}</li>
 *  <li>{@code true}, {@code false} and decimal numbers, read as {@link Literal}s; a trailing
 *  {@code f} reads a single precision value</li>
 *  <li>anything else up to a delimiter, read as a {@link Symbol}</li>
 * </ul>
 * Commas count as whitespace and {@code ;} starts a comment running to the end of the line.
 */
public final class FormReader {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?[fF]");

    private final String source;
    private int loc = 0;

    private FormReader(String source) {
        this.source = source;
    }

    /**
     * Read exactly one form.
     */
    public static Node read(String source) {
        List<Node> forms = readAll(source);
        if (forms.size() != 1) {
            throw new FormSyntaxException("Expected exactly one form but found " + forms.size(), 0);
        }
        return forms.get(0);
    }

    /**
     * Read every top level form in {@code source}, in order.
     */
    public static List<Node> readAll(String source) {
        FormReader reader = new FormReader(source);
        ImmutableList.Builder<Node> forms = ImmutableList.builder();
        while (reader.skipWhitespace()) {
            forms.add(reader.readForm());
        }
        return forms.build();
    }

    // Returns false once the end of input is reached.
    private boolean skipWhitespace() {
        while (loc < source.length()) {
            char c = source.charAt(loc);
            if (c == ';') {
                while (loc < source.length() && source.charAt(loc) != '\n') {
                    loc++;
                }
            } else if (Character.isWhitespace(c) || c == ',') {
                loc++;
            } else {
                return true;
            }
        }
        return false;
    }

    private Node readForm() {
        char c = source.charAt(loc);
        switch (c) {
            case '(':
                return readSequence(')');
            case '[':
                return readSequence(']');
            case ')':
            case ']':
                throw new FormSyntaxException("Unexpected '" + c + "'", loc);
            default:
                return readAtom();
        }
    }

    private Node readSequence(char close) {
        int start = loc;
        loc++;
        ImmutableList.Builder<Node> elements = ImmutableList.builder();
        while (true) {
            if (!skipWhitespace()) {
                throw new FormSyntaxException("Unterminated form, expected '" + close + "'", start);
            }
            char c = source.charAt(loc);
            if (c == close) {
                loc++;
                return Forms.group(elements.build());
            }
            if (c == ')' || c == ']') {
                throw new FormSyntaxException("Mismatched '" + c + "', expected '" + close + "'", loc);
            }
            elements.add(readForm());
        }
    }

    private Node readAtom() {
        int start = loc;
        while (loc < source.length() && !isDelimiter(source.charAt(loc))) {
            loc++;
        }
        String token = source.substring(start, loc);

        if (token.charAt(0) == ':') {
            if (token.length() == 1) {
                throw new FormSyntaxException("Empty keyword", start);
            }
            return Keyword.of(token);
        }
        if (token.equals("true")) {
            return Literal.bool(true);
        }
        if (token.equals("false")) {
            return Literal.bool(false);
        }
        if (INTEGER.matcher(token).matches()) {
            long value;
            try {
                value = Long.parseLong(token);
            } catch (NumberFormatException e) {
                throw new FormSyntaxException("Integer literal out of range: " + token, start, e);
            }
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return Literal.int32((int) value);
            }
            return Literal.int64(value);
        }
        if (DECIMAL.matcher(token).matches()) {
            return Literal.float64(Double.parseDouble(token));
        }
        if (FLOAT.matcher(token).matches()) {
            return Literal.float32(Float.parseFloat(token));
        }
        return Symbol.of(token);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == ',' || c == ';' || c == '(' || c == ')' || c == '[' || c == ']';
    }
}
