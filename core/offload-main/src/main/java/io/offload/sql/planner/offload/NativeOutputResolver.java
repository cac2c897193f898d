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

/**
 * Describes the columns a native engine emits when it executes an aggregation.
 */
public interface NativeOutputResolver
{
    /**
     * Returns the columns, in order, that the native engine produces for an aggregation
     * with the given grouping keys and aggregations. {@code aggregationResultSymbols}
     * holds the symbol each of {@code aggregations} binds its result to. The result must be the
     * same for the same arguments.
     *
     * @throws io.trino.spi.TrinoException with {@link io.offload.OffloadErrorCode#NATIVE_OUTPUT_UNRESOLVED}
     * if the native engine cannot execute the aggregation
     */
    List<Symbol> resolve(List<Symbol> groupingKeys, List<Aggregation> aggregations, List<Symbol> aggregationResultSymbols, Step step);
}
