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
package io.offload.sql.planner.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.offload.sql.ir.Expression;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.planner.Symbol;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.Iterables.getOnlyElement;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Computes aggregations over groups of its source rows.
 * <p>
 * The aggregation itself produces the grouping keys and one symbol per aggregation. The
 * columns the node declares to its consumers are defined separately by the result expressions,
 * which are built over those symbols and may rename, reorder or combine them.
 */
public class AggregationNode
        extends PlanNode
{
    private final PlanNode source;
    private final List<Symbol> groupingKeys;
    private final Map<Symbol, Aggregation> aggregations;
    private final Step step;
    private final List<NamedExpression> resultExpressions;

    @JsonCreator
    public AggregationNode(
            @JsonProperty("id") PlanNodeId id,
            @JsonProperty("source") PlanNode source,
            @JsonProperty("groupingKeys") List<Symbol> groupingKeys,
            @JsonProperty("aggregations") Map<Symbol, Aggregation> aggregations,
            @JsonProperty("step") Step step,
            @JsonProperty("resultExpressions") List<NamedExpression> resultExpressions)
    {
        super(id);
        this.source = requireNonNull(source, "source is null");
        this.groupingKeys = ImmutableList.copyOf(requireNonNull(groupingKeys, "groupingKeys is null"));
        this.aggregations = ImmutableMap.copyOf(requireNonNull(aggregations, "aggregations is null"));
        this.step = requireNonNull(step, "step is null");
        this.resultExpressions = ImmutableList.copyOf(requireNonNull(resultExpressions, "resultExpressions is null"));
    }

    @JsonProperty
    public PlanNode getSource()
    {
        return source;
    }

    @JsonProperty
    public List<Symbol> getGroupingKeys()
    {
        return groupingKeys;
    }

    /**
     * Aggregations in declaration order, keyed by the symbol each one binds its result to.
     */
    @JsonProperty
    public Map<Symbol, Aggregation> getAggregations()
    {
        return aggregations;
    }

    public List<Symbol> getAggregationResultSymbols()
    {
        return ImmutableList.copyOf(aggregations.keySet());
    }

    @JsonProperty
    public Step getStep()
    {
        return step;
    }

    @JsonProperty
    public List<NamedExpression> getResultExpressions()
    {
        return resultExpressions;
    }

    @Override
    public List<Symbol> getOutputSymbols()
    {
        return resultExpressions.stream()
                .map(Symbol::from)
                .collect(toImmutableList());
    }

    @Override
    public List<PlanNode> getSources()
    {
        return ImmutableList.of(source);
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context)
    {
        return visitor.visitAggregation(this, context);
    }

    @Override
    public PlanNode replaceChildren(List<PlanNode> newChildren)
    {
        return builderFrom(this)
                .setSource(getOnlyElement(newChildren))
                .build();
    }

    public static Builder builderFrom(AggregationNode node)
    {
        return new Builder(node);
    }

    public enum Step
    {
        PARTIAL(true),
        FINAL(false),
        INTERMEDIATE(true),
        SINGLE(false);

        private final boolean outputPartial;

        Step(boolean outputPartial)
        {
            this.outputPartial = outputPartial;
        }

        public boolean isOutputPartial()
        {
            return outputPartial;
        }
    }

    public static class Builder
    {
        private PlanNodeId id;
        private PlanNode source;
        private final List<Symbol> groupingKeys;
        private final Map<Symbol, Aggregation> aggregations;
        private final Step step;
        private List<NamedExpression> resultExpressions;

        public Builder(AggregationNode node)
        {
            requireNonNull(node, "node is null");
            this.id = node.getId();
            this.source = node.getSource();
            this.groupingKeys = node.getGroupingKeys();
            this.aggregations = node.getAggregations();
            this.step = node.getStep();
            this.resultExpressions = node.getResultExpressions();
        }

        public Builder setId(PlanNodeId id)
        {
            this.id = requireNonNull(id, "id is null");
            return this;
        }

        public Builder setSource(PlanNode source)
        {
            this.source = requireNonNull(source, "source is null");
            return this;
        }

        public Builder setResultExpressions(List<? extends NamedExpression> resultExpressions)
        {
            this.resultExpressions = ImmutableList.copyOf(requireNonNull(resultExpressions, "resultExpressions is null"));
            return this;
        }

        public AggregationNode build()
        {
            return new AggregationNode(id, source, groupingKeys, aggregations, step, resultExpressions);
        }
    }

    public static class Aggregation
    {
        private final String function;
        private final List<Expression> arguments;
        private final boolean distinct;
        private final Optional<Symbol> filter;

        @JsonCreator
        public Aggregation(
                @JsonProperty("function") String function,
                @JsonProperty("arguments") List<Expression> arguments,
                @JsonProperty("distinct") boolean distinct,
                @JsonProperty("filter") Optional<Symbol> filter)
        {
            this.function = requireNonNull(function, "function is null");
            this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
            this.distinct = distinct;
            this.filter = requireNonNull(filter, "filter is null");
        }

        @JsonProperty
        public String getFunction()
        {
            return function;
        }

        @JsonProperty
        public List<Expression> getArguments()
        {
            return arguments;
        }

        @JsonProperty
        public boolean isDistinct()
        {
            return distinct;
        }

        @JsonProperty
        public Optional<Symbol> getFilter()
        {
            return filter;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Aggregation that = (Aggregation) o;
            return distinct == that.distinct &&
                    Objects.equals(function, that.function) &&
                    Objects.equals(arguments, that.arguments) &&
                    Objects.equals(filter, that.filter);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(function, arguments, distinct, filter);
        }

        @Override
        public String toString()
        {
            String call = arguments.stream()
                    .map(Expression::toString)
                    .collect(joining(", ", function + "(" + (distinct ? "DISTINCT " : ""), ")"));
            return filter.map(symbol -> call + " FILTER (WHERE " + symbol + ")").orElse(call);
        }
    }
}
