/*
 * Copyright 2026 The Tmplr Authors.
 *
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

package org.tmplr.javascript.jscomp;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DefaultPassConfigTest {

  private static ImmutableList<String> passNames(CompilerOptions options) {
    return new DefaultPassConfig(options).getOptimizations().stream()
        .map(PassFactory::getName)
        .collect(toImmutableList());
  }

  @Test
  public void testAllPassesInOrder() {
    assertThat(passNames(new CompilerOptions()))
        .containsExactly(
            PassNames.FLATTEN_NESTED_BLOCKS,
            PassNames.HOIST_TAGGED_FUNCTIONS,
            PassNames.REMOVE_UNUSED_ASSIGNMENTS,
            PassNames.REPLACE_CONTEXT_REFERENCES,
            PassNames.REMOVE_UNUSED_VARS,
            PassNames.COMBINE_OUTPUT_STATEMENTS,
            PassNames.NORMALIZE_FIRST_OUTPUT_STATEMENT)
        .inOrder();
  }

  @Test
  public void testDisabledPassesAreFiltered() {
    CompilerOptions options = new CompilerOptions();
    options.setHoistTaggedFunctions(false);
    options.setReplaceContextReferences(false);
    options.setNormalizeFirstOutputStatement(false);
    assertThat(passNames(options))
        .containsExactly(
            PassNames.FLATTEN_NESTED_BLOCKS,
            PassNames.REMOVE_UNUSED_ASSIGNMENTS,
            PassNames.REMOVE_UNUSED_VARS,
            PassNames.COMBINE_OUTPUT_STATEMENTS)
        .inOrder();
  }

  @Test
  public void testFactoriesCreateFreshPasses() {
    Compiler compiler = new Compiler();
    CompilerPass first = DefaultPassConfig.removeUnusedVars.create(compiler);
    CompilerPass second = DefaultPassConfig.removeUnusedVars.create(compiler);
    assertThat(first).isInstanceOf(RemoveUnusedVarDeclarations.class);
    assertThat(first).isNotSameInstanceAs(second);
  }

  @Test
  public void testPassFactoryNeedsAName() {
    assertThrows(
        IllegalStateException.class,
        () ->
            PassFactory.builder()
                .setName("")
                .setInternalFactory(FlattenNestedBlocks::new)
                .build());
  }

  @Test
  public void testPassFactoryIsEnabledByDefault() {
    PassFactory factory =
        PassFactory.builder()
            .setName("flatten")
            .setInternalFactory(FlattenNestedBlocks::new)
            .build();
    assertThat(factory.isEnabled(new CompilerOptions())).isTrue();

    PassFactory disabled = factory.toBuilder().setCondition(o -> false).build();
    assertThat(disabled.isEnabled(new CompilerOptions())).isFalse();
  }
}
