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

import io.offload.sql.planner.plan.PlanNode;
import io.offload.sql.planner.plan.PlanNodeId;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Offload tags of the nodes of one plan, kept outside the (immutable) plan nodes and keyed
 * by node id.
 * <p>
 * An {@link #overlay()} reads through to the tags it was created from but keeps its own
 * writes and clears, so work done against an overlay is dropped together with it.
 * <p>
 * This class is not thread safe. A plan and its tags are rewritten by one thread at a time.
 */
public final class OffloadTags
        implements OffloadTagOracle
{
    private final Optional<OffloadTags> parent;
    private final Map<PlanNodeId, OffloadTag> tags = new HashMap<>();
    private final Set<PlanNodeId> cleared = new HashSet<>();
    private final Set<PlanNodeId> postProjections = new HashSet<>();

    public OffloadTags()
    {
        this(Optional.empty());
    }

    private OffloadTags(Optional<OffloadTags> parent)
    {
        this.parent = requireNonNull(parent, "parent is null");
    }

    public OffloadTags overlay()
    {
        return new OffloadTags(Optional.of(this));
    }

    public void tag(PlanNode node, OffloadTag tag)
    {
        requireNonNull(tag, "tag is null");
        PlanNodeId id = node.getId();
        checkArgument(!isPostProjection(node), "cannot tag post-projection %s", id);
        tags.put(id, tag);
        cleared.remove(id);
    }

    public Optional<OffloadTag> getTag(PlanNode node)
    {
        return getTag(node.getId());
    }

    public boolean isTagged(PlanNode node)
    {
        return getTag(node).isPresent();
    }

    @Override
    public boolean isExcluded(PlanNode node)
    {
        return getTag(node)
                .map(OffloadTag::isExcluded)
                .orElse(false);
    }

    /**
     * Makes {@code target} carry exactly the tags {@code source} carries.
     */
    public void copyTags(PlanNode source, PlanNode target)
    {
        checkArgument(!source.getId().equals(target.getId()), "cannot copy tags of node %s onto itself", source.getId());
        Optional<OffloadTag> tag = getTag(source);
        if (tag.isPresent()) {
            tag(target, tag.get());
        }
        else {
            clearTags(target);
        }
    }

    public void clearTags(PlanNode node)
    {
        PlanNodeId id = node.getId();
        tags.remove(id);
        if (parent.isPresent()) {
            cleared.add(id);
        }
    }

    /**
     * Marks {@code projection} as adapting the output of an aggregation below it. Such a
     * projection is never tagged itself.
     */
    public void markPostProjection(PlanNode projection)
    {
        PlanNodeId id = projection.getId();
        checkArgument(!isTagged(projection), "post-projection %s is already tagged", id);
        postProjections.add(id);
    }

    public boolean isPostProjection(PlanNode node)
    {
        PlanNodeId id = node.getId();
        return postProjections.contains(id) || parent.map(tags -> tags.isPostProjection(node)).orElse(false);
    }

    private Optional<OffloadTag> getTag(PlanNodeId id)
    {
        OffloadTag tag = tags.get(id);
        if (tag != null) {
            return Optional.of(tag);
        }
        if (cleared.contains(id)) {
            return Optional.empty();
        }
        return parent.flatMap(tags -> tags.getTag(id));
    }
}
