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
package io.offload.sql.planner.offload;

import com.google.common.collect.ImmutableList;
import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.plan.AggregationNode.Aggregation;
import io.offload.sql.planner.plan.AggregationNode.Step;
import io.trino.spi.TrinoException;

import javax.inject.Inject;

import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static io.offload.OffloadErrorCode.NATIVE_OUTPUT_UNRESOLVED;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * The native engine emits the grouping keys first, then one column per aggregation,
 * both in declaration order.
 */
public class DefaultNativeOutputResolver
        implements NativeOutputResolver
{
    private final Set<String> supportedFunctions;

    @Inject
    public DefaultNativeOutputResolver(OffloadConfig config)
    {
        this(config.getNativeAggregateFunctions());
    }

    public DefaultNativeOutputResolver(List<String> supportedFunctions)
    {
        this.supportedFunctions = requireNonNull(supportedFunctions, "supportedFunctions is null").stream()
                .map(function -> function.toLowerCase(ENGLISH))
                .collect(toImmutableSet());
    }

    @Override
    public List<Symbol> resolve(List<Symbol> groupingKeys, List<Aggregation> aggregations, List<Symbol> aggregationResultSymbols, Step step)
    {
        requireNonNull(groupingKeys, "groupingKeys is null");
        requireNonNull(step, "step is null");
        checkArgument(
                aggregations.size() == aggregationResultSymbols.size(),
                "aggregations and result symbols differ in size: %s vs %s",
                aggregations.size(),
                aggregationResultSymbols.size());

        for (Aggregation aggregation : aggregations) {
            if (!supportedFunctions.contains(aggregation.getFunction().toLowerCase(ENGLISH))) {
                throw new TrinoException(NATIVE_OUTPUT_UNRESOLVED, format("Aggregate function %s is not supported by the native engine", aggregation.getFunction()));
            }
            if (aggregation.isDistinct() && step.isOutputPartial()) {
                throw new TrinoException(NATIVE_OUTPUT_UNRESOLVED, format("Native engine cannot produce partial state for %s", aggregation));
            }
        }

        return ImmutableList.<Symbol>builder()
                .addAll(groupingKeys)
                .addAll(aggregationResultSymbols)
                .build();
    }
}
