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

import io.offload.sql.ir.ExpressionNormalizer;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.ir.Reference;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.AggregationNode.Aggregation;
import io.offload.sql.planner.plan.PlanNode;
import io.offload.sql.planner.plan.PlanVisitor;

import javax.inject.Inject;

import java.util.Set;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

public class DefaultNativePlanValidator
        implements NativePlanValidator
{
    private final Set<String> supportedAggregateFunctions;
    private final ExpressionNormalizer normalizer;

    @Inject
    public DefaultNativePlanValidator(OffloadConfig config, ExpressionNormalizer normalizer)
    {
        this.supportedAggregateFunctions = config.getNativeAggregateFunctions().stream()
                .map(function -> function.toLowerCase(ENGLISH))
                .collect(toImmutableSet());
        this.normalizer = requireNonNull(normalizer, "normalizer is null");
    }

    @Override
    public NativeValidationResult validate(PlanNode node)
    {
        return node.accept(new Visitor(), null);
    }

    private class Visitor
            extends PlanVisitor<NativeValidationResult, Void>
    {
        @Override
        protected NativeValidationResult visitPlan(PlanNode node, Void context)
        {
            return NativeValidationResult.ok();
        }

        @Override
        public NativeValidationResult visitAggregation(AggregationNode node, Void context)
        {
            for (Aggregation aggregation : node.getAggregations().values()) {
                if (!supportedAggregateFunctions.contains(aggregation.getFunction().toLowerCase(ENGLISH))) {
                    return NativeValidationResult.failed(format("Aggregate function %s is not supported by the native engine", aggregation.getFunction()));
                }
            }
            for (NamedExpression expression : node.getResultExpressions()) {
                if (!(normalizer.stripRenaming(expression) instanceof Reference)) {
                    return NativeValidationResult.failed(format("Native aggregation cannot produce result expression %s", expression));
                }
            }
            return NativeValidationResult.ok();
        }
    }
}
