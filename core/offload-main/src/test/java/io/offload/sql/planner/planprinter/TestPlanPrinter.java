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

import io.offload.sql.ir.Arithmetic;
import io.offload.sql.ir.Constant;
import io.offload.sql.planner.PlanBuilder;
import io.offload.sql.planner.PlanNodeIdAllocator;
import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.AggregationNode.Aggregation;
import io.offload.sql.planner.plan.ProjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.offload.sql.ir.Arithmetic.Operator.MULTIPLY;
import static io.offload.sql.planner.PlanBuilder.alias;
import static io.offload.sql.planner.plan.AggregationNode.Step.PARTIAL;
import static io.trino.spi.type.BigintType.BIGINT;
import static io.trino.spi.type.BooleanType.BOOLEAN;
import static org.assertj.core.api.Assertions.assertThat;

public class TestPlanPrinter
{
    private static final Symbol X = new Symbol(BIGINT, "x");
    private static final Symbol KEEP = new Symbol(BOOLEAN, "keep");
    private static final Symbol COUNT = new Symbol(BIGINT, "count");

    private final PlanBuilder planBuilder = new PlanBuilder(new PlanNodeIdAllocator());

    @Test
    public void testTextPlan()
    {
        AggregationNode aggregation = planBuilder.aggregation(builder -> builder
                .source(planBuilder.values(X, KEEP))
                .addAggregation(COUNT, new Aggregation("count", List.of(X.toSymbolReference()), true, Optional.of(KEEP)))
                .step(PARTIAL));
        ProjectNode projection = planBuilder.project(aggregation, alias(new Arithmetic(MULTIPLY, BIGINT, COUNT.toSymbolReference(), new Constant(BIGINT, 2L)), "doubled"));

        assertThat(PlanPrinter.textLogicalPlan(projection)).isEqualTo("""
                - Project => [doubled:bigint]
                    output := [(count * 2) AS doubled]
                    - Aggregate[type = PARTIAL, keys = []] => [count:bigint]
                        count := count(DISTINCT x) FILTER (WHERE keep)
                        output := [count]
                        - Values[rows = 1] => [x:bigint, keep:boolean]
                """);
    }

    @Test
    public void testTextPlanIgnoresNodeIds()
    {
        PlanBuilder otherBuilder = new PlanBuilder(new PlanNodeIdAllocator());
        otherBuilder.values(X);

        assertThat(PlanPrinter.textLogicalPlan(otherBuilder.values(X)))
                .isEqualTo(PlanPrinter.textLogicalPlan(planBuilder.values(X)));
    }

    @Test
    public void testJsonPlan()
    {
        AggregationNode aggregation = planBuilder.aggregation(builder -> builder
                .source(planBuilder.values(X))
                .addAggregation(COUNT, "count"));

        String json = PlanPrinter.jsonPlan(aggregation);

        assertThat(json)
                .contains("\"@type\" : \"aggregation\"")
                .contains("\"@type\" : \"values\"")
                .contains("\"function\" : \"count\"")
                .contains("\"step\" : \"SINGLE\"")
                .contains("\"type\" : \"bigint\"");
    }
}
