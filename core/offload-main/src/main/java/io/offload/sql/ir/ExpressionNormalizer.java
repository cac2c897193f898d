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
package io.offload.sql.ir;

public interface ExpressionNormalizer
{
    /**
     * Removes the renaming wrapped around {@code expression}, exposing the expression
     * that actually computes the value. Must be idempotent and must not change the value
     * the expression evaluates to.
     */
    Expression stripRenaming(Expression expression);
}
