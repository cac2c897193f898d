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
package io.offload.sql.planner;

import com.google.common.collect.ImmutableSet;
import io.offload.sql.ir.Expression;
import io.offload.sql.ir.Reference;

import java.util.Collection;
import java.util.Set;

public final class SymbolsExtractor
{
    private SymbolsExtractor() {}

    public static Set<Symbol> extractUnique(Collection<? extends Expression> expressions)
    {
        ImmutableSet.Builder<Symbol> symbols = ImmutableSet.builder();
        for (Expression expression : expressions) {
            collect(expression, symbols);
        }
        return symbols.build();
    }

    private static void collect(Expression expression, ImmutableSet.Builder<Symbol> symbols)
    {
        if (expression instanceof Reference reference) {
            symbols.add(Symbol.from(reference));
            return;
        }
        for (Expression child : expression.children()) {
            collect(child, symbols);
        }
    }
}
