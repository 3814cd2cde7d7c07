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

import com.google.common.collect.ImmutableList;

/**
 * Pass factories and meta-data for the render-function optimizations.
 *
 * <p>The order matters: each pass relies on the normal form left by the passes before it. Blocks
 * are flattened first so the later passes see straight-line statement lists, and output
 * statements are normalized last, once they have been combined.
 */
public final class DefaultPassConfig {

  private final CompilerOptions options;

  public DefaultPassConfig(CompilerOptions options) {
    this.options = options;
  }

  /** Returns the optimization passes to run, in order, with the disabled ones filtered out. */
  ImmutableList<PassFactory> getOptimizations() {
    return ALL_OPTIMIZATIONS.stream()
        .filter(pass -> pass.isEnabled(options))
        .collect(ImmutableList.toImmutableList());
  }

  static final PassFactory flattenNestedBlocks =
      PassFactory.builder()
          .setName(PassNames.FLATTEN_NESTED_BLOCKS)
          .setCondition(CompilerOptions::isFlattenNestedBlocks)
          .setInternalFactory(FlattenNestedBlocks::new)
          .build();

  static final PassFactory hoistTaggedFunctions =
      PassFactory.builder()
          .setName(PassNames.HOIST_TAGGED_FUNCTIONS)
          .setCondition(CompilerOptions::isHoistTaggedFunctions)
          .setInternalFactory(HoistTaggedFunctions::new)
          .build();

  static final PassFactory removeUnusedAssignments =
      PassFactory.builder()
          .setName(PassNames.REMOVE_UNUSED_ASSIGNMENTS)
          .setCondition(CompilerOptions::isRemoveUnusedAssignments)
          .setInternalFactory(RemoveUnusedAssignments::new)
          .build();

  static final PassFactory replaceContextReferences =
      PassFactory.builder()
          .setName(PassNames.REPLACE_CONTEXT_REFERENCES)
          .setCondition(CompilerOptions::isReplaceContextReferences)
          .setInternalFactory(ReplaceContextReferences::new)
          .build();

  static final PassFactory removeUnusedVars =
      PassFactory.builder()
          .setName(PassNames.REMOVE_UNUSED_VARS)
          .setCondition(CompilerOptions::isRemoveUnusedVars)
          .setInternalFactory(RemoveUnusedVarDeclarations::new)
          .build();

  static final PassFactory combineOutputStatements =
      PassFactory.builder()
          .setName(PassNames.COMBINE_OUTPUT_STATEMENTS)
          .setCondition(CompilerOptions::isCombineOutputStatements)
          .setInternalFactory(CombineOutputStatements::new)
          .build();

  static final PassFactory normalizeFirstOutputStatement =
      PassFactory.builder()
          .setName(PassNames.NORMALIZE_FIRST_OUTPUT_STATEMENT)
          .setCondition(CompilerOptions::isNormalizeFirstOutputStatement)
          .setInternalFactory(NormalizeFirstOutputStatement::new)
          .build();

  private static final ImmutableList<PassFactory> ALL_OPTIMIZATIONS =
      ImmutableList.of(
          flattenNestedBlocks,
          hoistTaggedFunctions,
          removeUnusedAssignments,
          replaceContextReferences,
          removeUnusedVars,
          combineOutputStatements,
          normalizeFirstOutputStatement);
}
