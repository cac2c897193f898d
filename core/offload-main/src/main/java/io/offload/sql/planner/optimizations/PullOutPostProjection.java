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
package io.offload.sql.planner.optimizations;

import io.airlift.log.Logger;
import io.offload.sql.planner.offload.OffloadConfig;
import io.offload.sql.planner.offload.PostProjection;
import io.offload.sql.planner.offload.PostProjectionRewriter;
import io.offload.sql.planner.offload.ValidationApplyRule;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.PlanNode;
import io.offload.sql.planner.plan.ProjectNode;
import io.offload.sql.planner.plan.SimplePlanRewriter;

import javax.inject.Inject;

import java.util.Optional;

import static io.offload.sql.planner.planprinter.PlanPrinter.textLogicalPlan;
import static java.util.Objects.requireNonNull;

/**
 * The native engine does not always lay out an aggregation's output the way the plan declares
 * it. Where the two differ, the aggregation is changed to declare the native layout and a
 * projection is put on top of it to restore the declared output. Consumers above it see the
 * same columns whether the aggregation ends up running natively or not.
 */
public class PullOutPostProjection
        implements PlanOptimizer, ValidationApplyRule
{
    private static final Logger log = Logger.get(PullOutPostProjection.class);

    private final PostProjectionRewriter rewriter;
    private final boolean enabled;

    @Inject
    public PullOutPostProjection(PostProjectionRewriter rewriter, OffloadConfig config)
    {
        this(rewriter, config.isPostProjectionEnabled());
    }

    public PullOutPostProjection(PostProjectionRewriter rewriter, boolean enabled)
    {
        this.rewriter = requireNonNull(rewriter, "rewriter is null");
        this.enabled = enabled;
    }

    @Override
    public PlanNode optimize(PlanNode plan, Context context)
    {
        requireNonNull(plan, "plan is null");
        requireNonNull(context, "context is null");
        if (!enabled) {
            return plan;
        }
        return SimplePlanRewriter.rewriteWith(new Rewriter(context), plan);
    }

    @Override
    public PlanNode applyForValidation(PlanNode node, Context context)
    {
        requireNonNull(node, "node is null");
        requireNonNull(context, "context is null");
        if (!enabled || !(node instanceof AggregationNode aggregation)) {
            return node;
        }
        // the overlay keeps the tag transfer away from the plan's tags
        Optional<PostProjection> postProjection = rewriter.tryPullOut(aggregation, context.offloadTags().overlay(), context.idAllocator());
        return postProjection
                .<PlanNode>map(PostProjection::nativeAggregation)
                .orElse(node);
    }

    private class Rewriter
            extends SimplePlanRewriter<Void>
    {
        private final Context context;

        private Rewriter(Context context)
        {
            this.context = context;
        }

        @Override
        public PlanNode visitAggregation(AggregationNode node, RewriteContext<Void> rewriteContext)
        {
            AggregationNode rewrittenNode = (AggregationNode) rewriteContext.defaultRewrite(node);
            Optional<PostProjection> postProjection = rewriter.tryPullOut(rewrittenNode, context.offloadTags(), context.idAllocator());
            if (postProjection.isEmpty()) {
                return rewrittenNode;
            }
            ProjectNode projection = postProjection.get().projection();
            if (log.isDebugEnabled()) {
                log.debug("Pulled post-projection %s out of aggregation %s:%n%s", projection.getId(), node.getId(), textLogicalPlan(projection));
            }
            return projection;
        }
    }
}
