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

import io.offload.sql.planner.optimizations.PlanOptimizer;
import io.offload.sql.planner.plan.PlanNode;

/**
 * A rule that can show a feasibility check the node it would produce, without changing the plan.
 */
public interface ValidationApplyRule
{
    /**
     * Applies the rule to {@code node} alone, without visiting its sources. Returns {@code node}
     * when the rule does not match. Nodes the rule adds only to adapt its result to the rest of
     * the plan are left out of the returned node. Must not modify {@code node}, the plan or the
     * tags in {@code context}, and must return the same result when called again.
     */
    PlanNode applyForValidation(PlanNode node, PlanOptimizer.Context context);
}
