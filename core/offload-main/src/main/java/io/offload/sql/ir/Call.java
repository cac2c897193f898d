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
import static java.util.stream.Collectors.joining;

public record Call(
        @JsonProperty("function") String function,
        @JsonProperty("type") @JsonSerialize(using = ToStringSerializer.class) Type type,
        @JsonProperty("arguments") List<Expression> arguments)
        implements Expression
{
    @JsonCreator
    public Call(
            @JsonProperty("function") String function,
            @JsonProperty("type") Type type,
            @JsonProperty("arguments") List<Expression> arguments)
    {
        this.function = requireNonNull(function, "function is null");
        this.type = requireNonNull(type, "type is null");
        this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
    }

    @Override
    public List<? extends Expression> children()
    {
        return arguments;
    }

    @Override
    public String toString()
    {
        return arguments.stream()
                .map(Expression::toString)
                .collect(joining(", ", function + "(", ")"));
    }
}
