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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import dev.glint.api.Node;

/**
 * A numeric or boolean constant. Literals are emitted as their {@link #getText() text}.
 */
public abstract class Literal<T> implements Node {
    private final T value;

    private Literal(T value) {
        this.value = Preconditions.checkNotNull(value, "literal value");
    }

    public T getValue() {
        return this.value;
    }

    /**
     * The source text of this literal as it appears in GLSL.
     */
    public String getText() {
        return String.valueOf(value);
    }

    @Override
    public String type() {
        return "literal";
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getValue());
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Literal<?> literal = (Literal<?>) o;
        return java.util.Objects.equals(value, literal.value);
    }

    @Override
    public String toString() {
        return getText();
    }

    public static Literal<Boolean> bool(boolean value) {
        return new BooleanLiteral(value);
    }

    public static Literal<Integer> int32(int value) {
        return new Int32Literal(value);
    }

    public static Literal<Long> int64(long value) {
        return new Int64Literal(value);
    }

    public static Literal<Float> float32(float value) {
        return new Float32Literal(value);
    }

    public static Literal<Double> float64(double value) {
        return new Float64Literal(value);
    }

    @Override
    public <R> R accept(Node.Visitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    static final class BooleanLiteral extends Literal<Boolean> {
        BooleanLiteral(Boolean value) {
            super(value);
        }
    }

    static final class Int32Literal extends Literal<Integer> {
        Int32Literal(Integer value) {
            super(value);
        }
    }

    static final class Int64Literal extends Literal<Long> {
        Int64Literal(Long value) {
            super(value);
        }
    }

    static final class Float32Literal extends Literal<Float> {
        Float32Literal(Float value) {
            super(value);
        }
    }

    static final class Float64Literal extends Literal<Double> {
        Float64Literal(Double value) {
            super(value);
        }
    }
}
