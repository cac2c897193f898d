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

public record Cast(@JsonProperty("expression") Expression expression, @JsonProperty("type") @JsonSerialize(using = ToStringSerializer.class) Type type)
        implements Expression
{
    @JsonCreator
    public Cast(@JsonProperty("expression") Expression expression, @JsonProperty("type") Type type)
    {
        this.expression = requireNonNull(expression, "expression is null");
        this.type = requireNonNull(type, "type is null");
    }

    @Override
    public List<? extends Expression> children()
    {
        return ImmutableList.of(expression);
    }

    @Override
    public String toString()
    {
        return "CAST(%s AS %s)".formatted(expression, type);
    }
}
