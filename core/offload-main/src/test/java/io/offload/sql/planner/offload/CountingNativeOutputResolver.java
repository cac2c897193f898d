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

import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.plan.AggregationNode.Aggregation;
import io.offload.sql.planner.plan.AggregationNode.Step;

import java.util.List;

import static java.util.Objects.requireNonNull;

public class CountingNativeOutputResolver
        implements NativeOutputResolver
{
    private final NativeOutputResolver delegate;
    private int calls;

    public CountingNativeOutputResolver(NativeOutputResolver delegate)
    {
        this.delegate = requireNonNull(delegate, "delegate is null");
    }

    @Override
    public List<Symbol> resolve(List<Symbol> groupingKeys, List<Aggregation> aggregations, List<Symbol> aggregationResultSymbols, Step step)
    {
        calls++;
        return delegate.resolve(groupingKeys, aggregations, aggregationResultSymbols, step);
    }

    public int getCalls()
    {
        return calls;
    }
}
