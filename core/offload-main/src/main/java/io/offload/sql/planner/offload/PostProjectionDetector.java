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

import io.offload.sql.ir.Expression;
import io.offload.sql.ir.ExpressionNormalizer;
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.ir.Reference;
import io.offload.sql.planner.Symbol;
import io.offload.sql.planner.plan.AggregationNode;

import javax.inject.Inject;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether an aggregation's declared output differs from what the native engine
 * emits for it, in which case a projection has to adapt the native output.
 */
public class PostProjectionDetector
{
    private final NativeOutputResolver nativeOutputResolver;
    private final ExpressionNormalizer normalizer;

    @Inject
    public PostProjectionDetector(NativeOutputResolver nativeOutputResolver, ExpressionNormalizer normalizer)
    {
        this.nativeOutputResolver = requireNonNull(nativeOutputResolver, "nativeOutputResolver is null");
        this.normalizer = requireNonNull(normalizer, "normalizer is null");
    }

    public boolean needsPostProjection(AggregationNode node, OffloadTagOracle tags)
    {
        return detectMismatch(node, tags).isPresent();
    }

    /**
     * Returns the native output of {@code node} if it does not match the declared output,
     * and empty if it matches or the node is excluded from offload. Excluded nodes are not
     * resolved at all.
     */
    public Optional<List<Symbol>> detectMismatch(AggregationNode node, OffloadTagOracle tags)
    {
        if (tags.isExcluded(node)) {
            return Optional.empty();
        }
        List<Symbol> nativeOutput = resolveNativeOutput(node);
        if (!needsPostProjection(node.getResultExpressions(), nativeOutput)) {
            return Optional.empty();
        }
        return Optional.of(nativeOutput);
    }

    public List<Symbol> resolveNativeOutput(AggregationNode node)
    {
        return nativeOutputResolver.resolve(
                node.getGroupingKeys(),
                List.copyOf(node.getAggregations().values()),
                node.getAggregationResultSymbols(),
                node.getStep());
    }

    public boolean needsPostProjection(List<NamedExpression> resultExpressions, List<Symbol> nativeOutput)
    {
        if (resultExpressions.size() != nativeOutput.size()) {
            return true;
        }
        for (int i = 0; i < resultExpressions.size(); i++) {
            Expression expression = normalizer.stripRenaming(resultExpressions.get(i));
            // the native engine emits columns, it does not evaluate expressions over them
            if (!(expression instanceof Reference reference)) {
                return true;
            }
            if (!Symbol.from(reference).equals(nativeOutput.get(i))) {
                return true;
            }
        }
        return false;
    }
}
