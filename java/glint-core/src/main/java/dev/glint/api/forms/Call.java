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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.glint.api.Node;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parenthesized form. The head is usually a {@link Symbol} naming the operator; a call whose
 * head is itself a call is a <em>group</em>, a plain sequence of forms such as a statement list
 * or a parameter list.
 */
public final class Call implements Node {
    private static final Joiner SPACE = Joiner.on(' ');

    private final ImmutableList<Node> elements;

    private Call(ImmutableList<Node> elements) {
        this.elements = elements;
    }

    public static Call of(Node head, Node... args) {
        return new Call(ImmutableList.<Node>builder().add(head).add(args).build());
    }

    public static Call of(Node head, List<? extends Node> args) {
        return new Call(ImmutableList.<Node>builder().add(head).addAll(args).build());
    }

    public static Call of(List<? extends Node> elements) {
        Preconditions.checkArgument(!elements.isEmpty(), "Call must have at least one element, use Empty instead");
        return new Call(ImmutableList.copyOf(elements));
    }

    public Node getHead() {
        return elements.get(0);
    }

    public List<Node> getArgs() {
        return elements.subList(1, elements.size());
    }

    public List<Node> getElements() {
        return elements;
    }

    /**
     * Returns the argument at {@code index}, or {@link Empty#INSTANCE} when the form is too short.
     */
    public Node getArg(int index) {
        Preconditions.checkArgument(index >= 0, "negative argument index: %s", index);
        return index + 1 < elements.size() ? elements.get(index + 1) : Empty.INSTANCE;
    }

    public int argCount() {
        return elements.size() - 1;
    }

    /**
     * The operator name, present when the head is a symbol.
     */
    public Optional<String> getOperator() {
        Node head = getHead();
        if (head instanceof Symbol) {
            return Optional.of(((Symbol) head).getName());
        }
        return Optional.empty();
    }

    public boolean isGroup() {
        return getHead() instanceof Call;
    }

    @Override
    public String type() {
        return "call";
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Call call = (Call) o;
        return Objects.equals(elements, call.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements);
    }

    @Override
    public String toString() {
        return "(" + SPACE.join(elements) + ")";
    }
}
