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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.ENGLISH;

public class OffloadConfig
{
    private static final Splitter SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private boolean postProjectionEnabled = true;
    private List<String> nativeAggregateFunctions = ImmutableList.of(
            "count",
            "sum",
            "avg",
            "min",
            "max",
            "count_if",
            "bool_and",
            "bool_or",
            "approx_distinct",
            "stddev",
            "variance");

    public boolean isPostProjectionEnabled()
    {
        return postProjectionEnabled;
    }

    @Config("offload.post-projection.enabled")
    @ConfigDescription("Adapt the native output of offloaded aggregations with a projection when it differs from the declared output")
    public OffloadConfig setPostProjectionEnabled(boolean postProjectionEnabled)
    {
        this.postProjectionEnabled = postProjectionEnabled;
        return this;
    }

    public List<String> getNativeAggregateFunctions()
    {
        return nativeAggregateFunctions;
    }

    @Config("offload.native.aggregate-functions")
    @ConfigDescription("Comma separated list of aggregate functions the native engine supports")
    public OffloadConfig setNativeAggregateFunctions(String nativeAggregateFunctions)
    {
        this.nativeAggregateFunctions = SPLITTER.splitToStream(nativeAggregateFunctions)
                .map(function -> function.toLowerCase(ENGLISH))
                .collect(toImmutableList());
        return this;
    }
}
