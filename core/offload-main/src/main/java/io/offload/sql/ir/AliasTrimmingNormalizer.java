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

import static java.util.Objects.requireNonNull;

public class AliasTrimmingNormalizer
        implements ExpressionNormalizer
{
    @Override
    public Expression stripRenaming(Expression expression)
    {
        requireNonNull(expression, "expression is null");
        Expression current = expression;
        while (current instanceof Alias alias) {
            current = alias.expression();
        }
        return current;
    }
}
