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
package io.offload.sql.planner.planprinter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.airlift.json.ObjectMapperProvider;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.AggregationNode.Aggregation;
import io.offload.sql.planner.plan.FilterNode;
import io.offload.sql.planner.plan.PlanNode;
import io.offload.sql.planner.plan.PlanVisitor;
import io.offload.sql.planner.plan.ProjectNode;
import io.offload.sql.planner.plan.ValuesNode;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Strings.repeat;
import static java.util.stream.Collectors.joining;

/**
 * Renders plans for logs and tests. Node ids are left out of the text rendering so that plans
 * built independently can be compared by their rendering.
 */
public final class PlanPrinter
{
    private static final ObjectWriter PLAN_WRITER = new ObjectMapperProvider().get()
            .writerFor(PlanNode.class)
            .withDefaultPrettyPrinter();

    private PlanPrinter() {}

    public static String textLogicalPlan(PlanNode plan)
    {
        StringBuilder output = new StringBuilder();
        plan.accept(new Visitor(output), 0);
        return output.toString();
    }

    public static String jsonPlan(PlanNode plan)
    {
        try {
            return PLAN_WRITER.writeValueAsString(plan);
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render plan as JSON", e);
        }
    }

    private static class Visitor
            extends PlanVisitor<Void, Integer>
    {
        private final StringBuilder output;

        private Visitor(StringBuilder output)
        {
            this.output = output;
        }

        @Override
        protected Void visitPlan(PlanNode node, Integer indent)
        {
            print(indent, "- %s => %s", node.getClass().getSimpleName(), formatLayout(node.getOutputSymbols()));
            return visitSources(node, indent);
        }

        @Override
        public Void visitAggregation(AggregationNode node, Integer indent)
        {
            print(indent, "- Aggregate[type = %s, keys = %s] => %s", node.getStep(), node.getGroupingKeys(), formatLayout(node.getOutputSymbols()));
            for (Map.Entry<Symbol, Aggregation> entry : node.getAggregations().entrySet()) {
                print(indent + 1, "%s := %s", entry.getKey(), entry.getValue());
            }
            print(indent + 1, "output := %s", formatExpressions(node.getResultExpressions()));
            return visitSources(node, indent);
        }

        @Override
        public Void visitProject(ProjectNode node, Integer indent)
        {
            print(indent, "- Project => %s", formatLayout(node.getOutputSymbols()));
            print(indent + 1, "output := %s", formatExpressions(node.getProjections()));
            return visitSources(node, indent);
        }

        @Override
        public Void visitFilter(FilterNode node, Integer indent)
        {
            print(indent, "- Filter[%s] => %s", node.getPredicate(), formatLayout(node.getOutputSymbols()));
            return visitSources(node, indent);
        }

        @Override
        public Void visitValues(ValuesNode node, Integer indent)
        {
            print(indent, "- Values[rows = %s] => %s", node.getRowCount(), formatLayout(node.getOutputSymbols()));
            return null;
        }

        private Void visitSources(PlanNode node, int indent)
        {
            for (PlanNode source : node.getSources()) {
                source.accept(this, indent + 1);
            }
            return null;
        }

        private void print(int indent, String format, Object... args)
        {
            output.append(repeat("    ", indent))
                    .append(format.formatted(args))
                    .append('\n');
        }
    }

    private static String formatLayout(List<Symbol> symbols)
    {
        return symbols.stream()
                .map(symbol -> symbol.name() + ":" + symbol.type())
                .collect(joining(", ", "[", "]"));
    }

    private static String formatExpressions(List<NamedExpression> expressions)
    {
        return expressions.stream()
                .map(NamedExpression::toString)
                .collect(joining(", ", "[", "]"));
    }
}
