/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.offload.sql.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.google.common.collect.ImmutableList;
import io.trino.spi.type.Type;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record Arithmetic(
        @JsonProperty("operator") Operator operator,
        @JsonProperty("type") @JsonSerialize(using = ToStringSerializer.class) Type type,
        @JsonProperty("left") Expression left,
        @JsonProperty("right") Expression right)
        implements Expression
{
    public enum Operator
    {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULUS("%");

        private final String value;

        Operator(String value)
        {
            this.value = value;
        }

        public String getValue()
        {
            return value;
        }
    }

    @JsonCreator
    public Arithmetic(
            @JsonProperty("operator") Operator operator,
            @JsonProperty("type") Type type,
            @JsonProperty("left") Expression left,
            @JsonProperty("right") Expression right)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.type = requireNonNull(type, "type is null");
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
    }

    @Override
    public List<? extends Expression> children()
    {
        return ImmutableList.of(left, right);
    }

    @Override
    public String toString()
    {
        return "(%s %s %s)".formatted(left, operator.getValue(), right);
    }
}
