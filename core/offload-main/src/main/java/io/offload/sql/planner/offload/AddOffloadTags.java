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
import io.airlift.log.Logger;
import io.offload.sql.planner.optimizations.PlanOptimizer;
import io.offload.sql.planner.plan.PlanNode;
import io.trino.spi.TrinoException;

import java.util.List;

import static io.offload.OffloadErrorCode.NATIVE_OUTPUT_UNRESOLVED;
import static java.util.Objects.requireNonNull;

/**
 * Tags every node of the plan that is not tagged yet as either supported or excluded from
 * offload. Post-projections inserted by {@link io.offload.sql.planner.optimizations.PullOutPostProjection}
 * stay untagged, so the pass can run again after the pull-out. A node is judged by the shape the validation rules would give it, so an aggregation
 * is not rejected for output it only declares because a later rule has not adapted it yet.
 * The plan itself is returned unchanged.
 */
public class AddOffloadTags
        implements PlanOptimizer
{
    private static final Logger log = Logger.get(AddOffloadTags.class);

    private final List<ValidationApplyRule> validationRules;
    private final NativePlanValidator validator;

    public AddOffloadTags(List<ValidationApplyRule> validationRules, NativePlanValidator validator)
    {
        this.validationRules = ImmutableList.copyOf(requireNonNull(validationRules, "validationRules is null"));
        this.validator = requireNonNull(validator, "validator is null");
    }

    @Override
    public PlanNode optimize(PlanNode plan, Context context)
    {
        requireNonNull(plan, "plan is null");
        requireNonNull(context, "context is null");
        addTags(plan, context);
        return plan;
    }

    private void addTags(PlanNode node, Context context)
    {
        for (PlanNode source : node.getSources()) {
            addTags(source, context);
        }
        OffloadTags tags = context.offloadTags();
        if (tags.isTagged(node) || tags.isPostProjection(node)) {
            return;
        }
        OffloadTag tag = evaluate(node, context);
        log.debug("Tagging %s %s as %s", node.getClass().getSimpleName(), node.getId(), tag);
        tags.tag(node, tag);
    }

    private OffloadTag evaluate(PlanNode node, Context context)
    {
        PlanNode candidate = node;
        try {
            for (ValidationApplyRule rule : validationRules) {
                candidate = rule.applyForValidation(candidate, context);
            }
        }
        catch (TrinoException e) {
            if (!e.getErrorCode().equals(NATIVE_OUTPUT_UNRESOLVED.toErrorCode())) {
                throw e;
            }
            return OffloadTag.excluded(e.getMessage());
        }

        NativeValidationResult result = validator.validate(candidate);
        if (!result.isValid()) {
            return OffloadTag.excluded(result.failureReason().orElseThrow());
        }
        return OffloadTag.supported();
    }
}
