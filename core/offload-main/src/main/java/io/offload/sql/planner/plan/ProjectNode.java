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
import io.offload.sql.ir.NamedExpression;
import io.offload.sql.planner.Symbol;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.Iterables.getOnlyElement;
import static java.util.Objects.requireNonNull;

public class ProjectNode
        extends PlanNode
{
    private final PlanNode source;
    private final List<NamedExpression> projections;

    @JsonCreator
    public ProjectNode(
            @JsonProperty("id") PlanNodeId id,
            @JsonProperty("source") PlanNode source,
            @JsonProperty("projections") List<NamedExpression> projections)
    {
        super(id);
        this.source = requireNonNull(source, "source is null");
        this.projections = ImmutableList.copyOf(requireNonNull(projections, "projections is null"));
    }

    @JsonProperty
    public PlanNode getSource()
    {
        return source;
    }

    @JsonProperty
    public List<NamedExpression> getProjections()
    {
        return projections;
    }

    @Override
    public List<Symbol> getOutputSymbols()
    {
        return projections.stream()
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
        return visitor.visitProject(this, context);
    }

    @Override
    public PlanNode replaceChildren(List<PlanNode> newChildren)
    {
        return new ProjectNode(getId(), getOnlyElement(newChildren), projections);
    }
}
