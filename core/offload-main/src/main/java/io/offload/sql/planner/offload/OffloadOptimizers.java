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
import io.offload.sql.planner.optimizations.PlanOptimizer;
import io.offload.sql.planner.optimizations.PullOutPostProjection;
import io.offload.sql.planner.plan.PlanNode;

import javax.inject.Inject;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The offload passes in the order they run: nodes are tagged first, then rewritten.
 */
public class OffloadOptimizers
{
    private final List<PlanOptimizer> optimizers;

    @Inject
    public OffloadOptimizers(AddOffloadTags addOffloadTags, PullOutPostProjection pullOutPostProjection)
    {
        this.optimizers = ImmutableList.of(
                requireNonNull(addOffloadTags, "addOffloadTags is null"),
                requireNonNull(pullOutPostProjection, "pullOutPostProjection is null"));
    }

    public List<PlanOptimizer> get()
    {
        return optimizers;
    }

    public PlanNode optimize(PlanNode plan, PlanOptimizer.Context context)
    {
        PlanNode result = plan;
        for (PlanOptimizer optimizer : optimizers) {
            result = optimizer.optimize(result, context);
        }
        return result;
    }
}
