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
package io.offload.sql.planner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.ir.Reference;
import io.trino.spi.type.Type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A column produced somewhere in the plan. Symbols are equal when both the name and the type match.
 */
public record Symbol(@JsonProperty("type") @JsonSerialize(using = ToStringSerializer.class) Type type, @JsonProperty("name") String name)
{
    @JsonCreator
    public Symbol(@JsonProperty("type") Type type, @JsonProperty("name") String name)
    {
        this.type = requireNonNull(type, "type is null");
        this.name = requireNonNull(name, "name is null");
        checkArgument(!name.isEmpty(), "name is empty");
    }

    public static Symbol from(NamedExpression expression)
    {
        return new Symbol(expression.type(), expression.name());
    }

    public Reference toSymbolReference()
    {
        return new Reference(type, name);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
