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

import org.tmplr.javascript.rhino.Node;

/** An abstract compiler, to help remove the circular dependency of passes on the Compiler. */
public abstract class AbstractCompiler {

  /** Returns the options this compiler was created with. */
  public abstract CompilerOptions getOptions();

  /**
   * Passes that make modifications to the tree must call this method with the node that changed,
   * or with its nearest surviving ancestor when the node itself was removed.
   */
  public abstract void reportChangeToEnclosingScope(Node n);

  /**
   * Returns a number that increases every time a change is reported. Comparing two stamps tells
   * whether anything changed in between.
   */
  public abstract int getChangeStamp();
}
