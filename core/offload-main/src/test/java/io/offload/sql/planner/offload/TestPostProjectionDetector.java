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
import io.offload.sql.ir.AliasTrimmingNormalizer;
import io.offload.sql.ir.Arithmetic;
import io.offload.sql.ir.Cast;
import io.offload.sql.ir.Constant;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.ir.Reference;
import io.offload.sql.planner.PlanBuilder;
import io.offload.sql.planner.PlanNodeIdAllocator;
import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.ValuesNode;
import io.trino.spi.TrinoException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.offload.OffloadErrorCode.NATIVE_OUTPUT_UNRESOLVED;
import static io.offload.sql.ir.Arithmetic.Operator.ADD;
import static io.offload.sql.planner.PlanBuilder.alias;
import static io.trino.spi.type.BigintType.BIGINT;
import static io.trino.spi.type.DoubleType.DOUBLE;
import static io.trino.spi.type.IntegerType.INTEGER;
import static io.trino.spi.type.VarcharType.VARCHAR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestPostProjectionDetector
{
    private static final Symbol GROUP_A = new Symbol(VARCHAR, "group_a");
    private static final Symbol GROUP_B = new Symbol(BIGINT, "group_b");
    private static final Symbol X = new Symbol(BIGINT, "x");
    private static final Symbol SUM_RESULT = new Symbol(BIGINT, "sum_result");

    private PlanBuilder planBuilder;
    private ValuesNode source;
    private CountingNativeOutputResolver resolver;
    private PostProjectionDetector detector;
    private OffloadTags tags;

    @BeforeEach
    public void setUp()
    {
        planBuilder = new PlanBuilder(new PlanNodeIdAllocator());
        source = planBuilder.values(GROUP_A, GROUP_B, X);
        resolver = new CountingNativeOutputResolver(new DefaultNativeOutputResolver(new OffloadConfig()));
        detector = new PostProjectionDetector(resolver, new AliasTrimmingNormalizer());
        tags = new OffloadTags();
    }

    @Test
    public void testMatchingOutput()
    {
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), ref(GROUP_B), ref(SUM_RESULT));

        assertThat(detector.needsPostProjection(aggregation, tags)).isFalse();
        assertThat(detector.detectMismatch(aggregation, tags)).isEmpty();
    }

    @Test
    public void testRenamedColumnMatches()
    {
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), alias(ref(GROUP_B), "renamed"), alias(alias(ref(SUM_RESULT), "inner"), "total"));

        assertThat(detector.needsPostProjection(aggregation, tags)).isFalse();
    }

    @Test
    public void testComputedExpression()
    {
        Arithmetic plusZero = new Arithmetic(ADD, BIGINT, ref(SUM_RESULT), new Constant(BIGINT, 0L));
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), ref(GROUP_B), alias(plusZero, "sum_plus_zero"));

        assertThat(detector.detectMismatch(aggregation, tags))
                .contains(ImmutableList.of(GROUP_A, GROUP_B, SUM_RESULT));
    }

    @Test
    public void testConstantAndCast()
    {
        assertThat(detector.needsPostProjection(
                sumAggregation(ref(GROUP_A), ref(GROUP_B), alias(new Constant(BIGINT, 1L), "sum_result")),
                tags))
                .isTrue();
        assertThat(detector.needsPostProjection(
                sumAggregation(ref(GROUP_A), ref(GROUP_B), alias(new Cast(ref(SUM_RESULT), DOUBLE), "sum_result")),
                tags))
                .isTrue();
    }

    @Test
    public void testExtraColumn()
    {
        Arithmetic doubled = new Arithmetic(ADD, BIGINT, ref(SUM_RESULT), ref(SUM_RESULT));
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), ref(GROUP_B), ref(SUM_RESULT), alias(doubled, "doubled"));

        assertThat(detector.needsPostProjection(aggregation, tags)).isTrue();
    }

    @Test
    public void testMissingColumn()
    {
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), ref(SUM_RESULT));

        assertThat(detector.needsPostProjection(aggregation, tags)).isTrue();
    }

    @Test
    public void testReorderedColumns()
    {
        AggregationNode aggregation = sumAggregation(ref(SUM_RESULT), ref(GROUP_A), ref(GROUP_B));

        assertThat(detector.needsPostProjection(aggregation, tags)).isTrue();
    }

    @Test
    public void testTypeMismatch()
    {
        // same name as the native column, different type
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), ref(GROUP_B), new Reference(INTEGER, "sum_result"));

        assertThat(detector.needsPostProjection(aggregation, tags)).isTrue();
    }

    @Test
    public void testExcludedNodeIsNotResolved()
    {
        Arithmetic plusZero = new Arithmetic(ADD, BIGINT, ref(SUM_RESULT), new Constant(BIGINT, 0L));
        AggregationNode aggregation = sumAggregation(ref(GROUP_A), ref(GROUP_B), alias(plusZero, "sum_plus_zero"));
        tags.tag(aggregation, OffloadTag.excluded("not supported"));

        assertThat(detector.needsPostProjection(aggregation, tags)).isFalse();
        assertThat(resolver.getCalls()).isZero();
    }

    @Test
    public void testUnresolvableAggregation()
    {
        AggregationNode aggregation = planBuilder.aggregation(builder -> builder
                .source(source)
                .singleGroupingSet(GROUP_A)
                .addAggregation(SUM_RESULT, "geometric_mean", ref(X)));

        assertThatThrownBy(() -> detector.needsPostProjection(aggregation, tags))
                .isInstanceOf(TrinoException.class)
                .hasMessage("Aggregate function geometric_mean is not supported by the native engine")
                .satisfies(e -> assertThat(((TrinoException) e).getErrorCode()).isEqualTo(NATIVE_OUTPUT_UNRESOLVED.toErrorCode()));
    }

    private AggregationNode sumAggregation(NamedExpression... resultExpressions)
    {
        return planBuilder.aggregation(builder -> builder
                .source(source)
                .singleGroupingSet(GROUP_A, GROUP_B)
                .addAggregation(SUM_RESULT, "sum", ref(X))
                .resultExpressions(resultExpressions));
    }

    private static Reference ref(Symbol symbol)
    {
        return symbol.toSymbolReference();
    }
}
