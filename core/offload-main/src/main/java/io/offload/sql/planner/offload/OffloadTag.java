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

import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Records whether a plan node may be executed by the native engine.
 */
public final class OffloadTag
{
    private static final OffloadTag SUPPORTED = new OffloadTag(Optional.empty());

    private final Optional<String> exclusionReason;

    private OffloadTag(Optional<String> exclusionReason)
    {
        this.exclusionReason = requireNonNull(exclusionReason, "exclusionReason is null");
    }

    public static OffloadTag supported()
    {
        return SUPPORTED;
    }

    public static OffloadTag excluded(String reason)
    {
        return new OffloadTag(Optional.of(requireNonNull(reason, "reason is null")));
    }

    public boolean isExcluded()
    {
        return exclusionReason.isPresent();
    }

    public Optional<String> getExclusionReason()
    {
        return exclusionReason;
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
        OffloadTag that = (OffloadTag) o;
        return exclusionReason.equals(that.exclusionReason);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(exclusionReason);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("excluded", isExcluded())
                .add("reason", exclusionReason.orElse(null))
                .omitNullValues()
                .toString();
    }
}
