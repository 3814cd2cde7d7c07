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

/**
 * If the name of a pass is used in more than one place in the source, it's good to create a
 * symbolic name here.
 */
public final class PassNames {
  public static final String COMBINE_OUTPUT_STATEMENTS = "combineOutputStatements";
  public static final String FLATTEN_NESTED_BLOCKS = "flattenNestedBlocks";
  public static final String HOIST_TAGGED_FUNCTIONS = "hoistTaggedFunctions";
  public static final String NORMALIZE_FIRST_OUTPUT_STATEMENT = "normalizeFirstOutputStatement";
  public static final String REMOVE_UNUSED_ASSIGNMENTS = "removeUnusedAssignments";
  public static final String REMOVE_UNUSED_VARS = "removeUnusedVars";
  public static final String REPLACE_CONTEXT_REFERENCES = "replaceContextReferences";

  private PassNames() {}
}
