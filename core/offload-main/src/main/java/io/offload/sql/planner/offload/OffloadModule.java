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
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.offload.sql.ir.AliasTrimmingNormalizer;
import io.offload.sql.ir.ExpressionNormalizer;
import io.offload.sql.planner.optimizations.PullOutPostProjection;

import static io.airlift.configuration.ConfigBinder.configBinder;

public class OffloadModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        configBinder(binder).bindConfig(OffloadConfig.class);

        binder.bind(ExpressionNormalizer.class).to(AliasTrimmingNormalizer.class).in(Scopes.SINGLETON);
        binder.bind(NativeOutputResolver.class).to(DefaultNativeOutputResolver.class).in(Scopes.SINGLETON);
        binder.bind(NativePlanValidator.class).to(DefaultNativePlanValidator.class).in(Scopes.SINGLETON);
        binder.bind(PostProjectionDetector.class).in(Scopes.SINGLETON);
        binder.bind(PostProjectionRewriter.class).in(Scopes.SINGLETON);
        binder.bind(PullOutPostProjection.class).in(Scopes.SINGLETON);
        binder.bind(OffloadOptimizers.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    public static AddOffloadTags createAddOffloadTags(PullOutPostProjection pullOutPostProjection, NativePlanValidator validator)
    {
        return new AddOffloadTags(ImmutableList.of(pullOutPostProjection), validator);
    }
}
