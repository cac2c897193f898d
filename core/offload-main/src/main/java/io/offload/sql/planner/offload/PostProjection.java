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

import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.ProjectNode;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An aggregation that declares exactly the native output, and the projection above it that
 * restores the output of the aggregation it replaces.
 */
public record PostProjection(ProjectNode projection, AggregationNode nativeAggregation)
{
    public PostProjection
    {
        requireNonNull(projection, "projection is null");
        requireNonNull(nativeAggregation, "nativeAggregation is null");
        checkArgument(projection.getSource() == nativeAggregation, "projection must be the parent of the native aggregation");
    }
}
