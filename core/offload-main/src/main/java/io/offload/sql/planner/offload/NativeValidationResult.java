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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record NativeValidationResult(Optional<String> failureReason)
{
    private static final NativeValidationResult OK = new NativeValidationResult(Optional.empty());

    public NativeValidationResult
    {
        requireNonNull(failureReason, "failureReason is null");
    }

    public static NativeValidationResult ok()
    {
        return OK;
    }

    public static NativeValidationResult failed(String reason)
    {
        return new NativeValidationResult(Optional.of(reason));
    }

    public boolean isValid()
    {
        return failureReason.isEmpty();
    }
}
