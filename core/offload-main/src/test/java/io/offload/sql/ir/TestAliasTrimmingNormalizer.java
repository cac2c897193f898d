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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static io.trino.spi.type.BigintType.BIGINT;
import static io.trino.spi.type.DoubleType.DOUBLE;
import static org.assertj.core.api.Assertions.assertThat;

public class TestAliasTrimmingNormalizer
{
    private static final Reference X = new Reference(BIGINT, "x");

    private final ExpressionNormalizer normalizer = new AliasTrimmingNormalizer();

    @Test
    public void testStripsNestedAliases()
    {
        assertThat(normalizer.stripRenaming(new Alias(X, "y"))).isEqualTo(X);
        assertThat(normalizer.stripRenaming(new Alias(new Alias(X, "y"), "z"))).isEqualTo(X);
    }

    @Test
    public void testKeepsOtherExpressions()
    {
        Cast cast = new Cast(X, DOUBLE);
        Call call = new Call("abs", BIGINT, ImmutableList.of(X));

        assertThat(normalizer.stripRenaming(X)).isSameAs(X);
        assertThat(normalizer.stripRenaming(cast)).isSameAs(cast);
        assertThat(normalizer.stripRenaming(new Alias(call, "magnitude"))).isSameAs(call);
        // only the outermost renaming is pass-through
        Cast aliasUnderCast = new Cast(new Alias(X, "y"), DOUBLE);
        assertThat(normalizer.stripRenaming(aliasUnderCast)).isSameAs(aliasUnderCast);
    }

    @Test
    public void testIdempotent()
    {
        Expression expression = new Alias(new Arithmetic(Arithmetic.Operator.ADD, BIGINT, X, new Constant(BIGINT, 1L)), "x_plus_one");
        Expression stripped = normalizer.stripRenaming(expression);

        assertThat(normalizer.stripRenaming(stripped)).isSameAs(stripped);
        assertThat(stripped.type()).isEqualTo(expression.type());
    }
}
