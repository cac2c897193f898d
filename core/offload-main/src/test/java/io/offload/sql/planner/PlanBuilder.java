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

import com.google.common.collect.ImmutableList;
import io.offload.sql.ir.Alias;
import io.offload.sql.ir.Expression;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.AggregationNode.Aggregation;
import io.offload.sql.planner.plan.AggregationNode.Step;
import io.offload.sql.planner.plan.FilterNode;
import io.offload.sql.planner.plan.PlanNode;
import io.offload.sql.planner.plan.ProjectNode;
import io.offload.sql.planner.plan.ValuesNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public class PlanBuilder
{
    private final PlanNodeIdAllocator idAllocator;

    public PlanBuilder(PlanNodeIdAllocator idAllocator)
    {
        this.idAllocator = requireNonNull(idAllocator, "idAllocator is null");
    }

    public ValuesNode values(Symbol... columns)
    {
        return new ValuesNode(idAllocator.getNextId(), ImmutableList.copyOf(columns), 1);
    }

    public FilterNode filter(Expression predicate, PlanNode source)
    {
        return new FilterNode(idAllocator.getNextId(), source, predicate);
    }

    public ProjectNode project(PlanNode source, NamedExpression... projections)
    {
        return new ProjectNode(idAllocator.getNextId(), source, ImmutableList.copyOf(projections));
    }

    public AggregationNode aggregation(Consumer<AggregationBuilder> aggregationBuilderConsumer)
    {
        AggregationBuilder aggregationBuilder = new AggregationBuilder();
        aggregationBuilderConsumer.accept(aggregationBuilder);
        return aggregationBuilder.build();
    }

    public static Alias alias(Expression expression, String name)
    {
        return new Alias(expression, name);
    }

    public class AggregationBuilder
    {
        private PlanNode source;
        private final List<Symbol> groupingKeys = new ArrayList<>();
        private final Map<Symbol, Aggregation> aggregations = new LinkedHashMap<>();
        private Step step = Step.SINGLE;
        private Optional<List<NamedExpression>> resultExpressions = Optional.empty();

        public AggregationBuilder source(PlanNode source)
        {
            this.source = source;
            return this;
        }

        public AggregationBuilder singleGroupingSet(Symbol... symbols)
        {
            groupingKeys.addAll(ImmutableList.copyOf(symbols));
            return this;
        }

        public AggregationBuilder addAggregation(Symbol output, String function, Expression... arguments)
        {
            return addAggregation(output, new Aggregation(function, ImmutableList.copyOf(arguments), false, Optional.empty()));
        }

        public AggregationBuilder addAggregation(Symbol output, Aggregation aggregation)
        {
            checkState(aggregations.put(output, aggregation) == null, "duplicate aggregation output %s", output);
            return this;
        }

        public AggregationBuilder step(Step step)
        {
            this.step = step;
            return this;
        }

        public AggregationBuilder resultExpressions(NamedExpression... expressions)
        {
            this.resultExpressions = Optional.of(ImmutableList.copyOf(expressions));
            return this;
        }

        protected AggregationNode build()
        {
            checkState(source != null, "source is not set");
            List<NamedExpression> output = resultExpressions.orElseGet(() -> ImmutableList.<Symbol>builder()
                    .addAll(groupingKeys)
                    .addAll(aggregations.keySet())
                    .build().stream()
                    .<NamedExpression>map(Symbol::toSymbolReference)
                    .collect(toImmutableList()));
            return new AggregationNode(
                    idAllocator.getNextId(),
                    source,
                    groupingKeys,
                    aggregations,
                    step,
                    output);
        }
    }
}
