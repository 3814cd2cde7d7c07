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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import java.io.Serializable;

/** Compiler options */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 7L;

  /** The variable the render function accumulates its output in. */
  private String outputVariableName = "html";

  /** Function declarations whose name contains this character are hoisted to the top level. */
  private char hoistMarker = '$';

  /** The name under which generated closures refer to the render context. */
  private String contextName = "context";

  /** Validate the AST before the first pass and after every pass. */
  private boolean checkAstValidity = false;

  //--------------------------------
  // Optimizations
  //--------------------------------

  boolean flattenNestedBlocks = true;

  boolean hoistTaggedFunctions = true;

  boolean removeUnusedAssignments = true;

  boolean replaceContextReferences = true;

  boolean removeUnusedVars = true;

  boolean combineOutputStatements = true;

  boolean normalizeFirstOutputStatement = true;

  public CompilerOptions() {}

  public String getOutputVariableName() {
    return outputVariableName;
  }

  public void setOutputVariableName(String outputVariableName) {
    checkArgument(!outputVariableName.isEmpty(), "Output variable name must not be empty");
    this.outputVariableName = outputVariableName;
  }

  public char getHoistMarker() {
    return hoistMarker;
  }

  public void setHoistMarker(char hoistMarker) {
    this.hoistMarker = hoistMarker;
  }

  public String getContextName() {
    return contextName;
  }

  public void setContextName(String contextName) {
    checkArgument(!contextName.isEmpty(), "Context name must not be empty");
    this.contextName = contextName;
  }

  public boolean shouldCheckAstValidity() {
    return checkAstValidity;
  }

  public void setCheckAstValidity(boolean checkAstValidity) {
    this.checkAstValidity = checkAstValidity;
  }

  public boolean isFlattenNestedBlocks() {
    return flattenNestedBlocks;
  }

  public void setFlattenNestedBlocks(boolean enabled) {
    this.flattenNestedBlocks = enabled;
  }

  public boolean isHoistTaggedFunctions() {
    return hoistTaggedFunctions;
  }

  public void setHoistTaggedFunctions(boolean enabled) {
    this.hoistTaggedFunctions = enabled;
  }

  public boolean isRemoveUnusedAssignments() {
    return removeUnusedAssignments;
  }

  public void setRemoveUnusedAssignments(boolean enabled) {
    this.removeUnusedAssignments = enabled;
  }

  public boolean isReplaceContextReferences() {
    return replaceContextReferences;
  }

  public void setReplaceContextReferences(boolean enabled) {
    this.replaceContextReferences = enabled;
  }

  public boolean isRemoveUnusedVars() {
    return removeUnusedVars;
  }

  public void setRemoveUnusedVars(boolean enabled) {
    this.removeUnusedVars = enabled;
  }

  public boolean isCombineOutputStatements() {
    return combineOutputStatements;
  }

  public void setCombineOutputStatements(boolean enabled) {
    this.combineOutputStatements = enabled;
  }

  public boolean isNormalizeFirstOutputStatement() {
    return normalizeFirstOutputStatement;
  }

  public void setNormalizeFirstOutputStatement(boolean enabled) {
    this.normalizeFirstOutputStatement = enabled;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("outputVariableName", outputVariableName)
        .add("hoistMarker", hoistMarker)
        .add("contextName", contextName)
        .add("checkAstValidity", checkAstValidity)
        .add("flattenNestedBlocks", flattenNestedBlocks)
        .add("hoistTaggedFunctions", hoistTaggedFunctions)
        .add("removeUnusedAssignments", removeUnusedAssignments)
        .add("replaceContextReferences", replaceContextReferences)
        .add("removeUnusedVars", removeUnusedVars)
        .add("combineOutputStatements", combineOutputStatements)
        .add("normalizeFirstOutputStatement", normalizeFirstOutputStatement)
        .toString();
  }
}
