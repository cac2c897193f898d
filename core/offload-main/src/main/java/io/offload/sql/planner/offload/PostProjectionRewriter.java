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

import io.offload.sql.ir.NamedExpression;
import io.offload.sql.planner.PlanNodeIdAllocator;
import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.SymbolsExtractor;
import io.offload.sql.planner.plan.AggregationNode;
import io.offload.sql.planner.plan.ProjectNode;
import io.trino.spi.TrinoException;

import javax.inject.Inject;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.Sets.difference;
import static io.offload.OffloadErrorCode.POST_PROJECTION_INVARIANT_VIOLATION;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Replaces an aggregation whose declared output differs from its native output with an
 * aggregation declaring the native output, topped by a projection that evaluates the original
 * result expressions.
 */
public class PostProjectionRewriter
{
    private final PostProjectionDetector detector;

    @Inject
    public PostProjectionRewriter(PostProjectionDetector detector)
    {
        this.detector = requireNonNull(detector, "detector is null");
    }

    /**
     * Pulls the post-projection out of {@code node} if it needs one. Offload tags are moved
     * from {@code node} to the new aggregation in {@code tags}; pass an overlay to keep the
     * move from being visible outside.
     */
    public Optional<PostProjection> tryPullOut(AggregationNode node, OffloadTags tags, PlanNodeIdAllocator idAllocator)
    {
        requireNonNull(tags, "tags is null");
        requireNonNull(idAllocator, "idAllocator is null");
        return detector.detectMismatch(node, tags)
                .map(nativeOutput -> pullOut(node, nativeOutput, tags, idAllocator));
    }

    private static PostProjection pullOut(AggregationNode node, List<Symbol> nativeOutput, OffloadTags tags, PlanNodeIdAllocator idAllocator)
    {
        AggregationNode nativeAggregation = AggregationNode.builderFrom(node)
                .setId(idAllocator.getNextId())
                .setResultExpressions(nativeOutput.stream()
                        .map(Symbol::toSymbolReference)
                        .collect(toImmutableList()))
                .build();
        verifyNativeAggregation(node, nativeAggregation, nativeOutput);

        tags.copyTags(node, nativeAggregation);
        tags.clearTags(node);

        ProjectNode projection = new ProjectNode(idAllocator.getNextId(), nativeAggregation, node.getResultExpressions());
        if (!projection.getOutputSymbols().equals(node.getOutputSymbols())) {
            throw new TrinoException(POST_PROJECTION_INVARIANT_VIOLATION, format(
                    "Post-projection output %s does not match output %s of aggregation %s",
                    projection.getOutputSymbols(),
                    node.getOutputSymbols(),
                    node.getId()));
        }
        tags.markPostProjection(projection);
        return new PostProjection(projection, nativeAggregation);
    }

    private static void verifyNativeAggregation(AggregationNode node, AggregationNode nativeAggregation, List<Symbol> nativeOutput)
    {
        if (!nativeAggregation.getOutputSymbols().equals(nativeOutput)) {
            throw new TrinoException(POST_PROJECTION_INVARIANT_VIOLATION, format(
                    "Native aggregation output %s does not match resolved native output %s for aggregation %s",
                    nativeAggregation.getOutputSymbols(),
                    nativeOutput,
                    node.getId()));
        }
        List<NamedExpression> resultExpressions = node.getResultExpressions();
        Set<Symbol> missing = difference(SymbolsExtractor.extractUnique(resultExpressions), Set.copyOf(nativeOutput));
        if (!missing.isEmpty()) {
            throw new TrinoException(POST_PROJECTION_INVARIANT_VIOLATION, format(
                    "Result expressions of aggregation %s reference %s, which the native aggregation does not produce",
                    node.getId(),
                    missing));
        }
    }
}
