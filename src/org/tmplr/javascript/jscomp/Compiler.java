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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.tmplr.javascript.jscomp.PhaseOptimizer.PassResult;
import org.tmplr.javascript.rhino.Node;

/**
 * Compiler (and the other classes in this package) does the following:
 *
 * <ul>
 *   <li>receives the AST of a generated render function from the template compiler
 *   <li>runs the render-function optimizations over it, in place
 *   <li>hands the same AST back, ready for the code generator
 * </ul>
 *
 * A Compiler is not thread-safe. Use one per AST.
 */
public class Compiler extends AbstractCompiler {

  /**
   * Logger for the whole org.tmplr.javascript.jscomp domain - setting configuration for this logger
   * affects all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("org.tmplr.javascript.jscomp");

  private final CompilerOptions options;

  private int changeStamp = 0;

  private ImmutableList<PassResult> passResults = ImmutableList.of();

  /** Creates a Compiler with the default options. */
  public Compiler() {
    this(new CompilerOptions());
  }

  public Compiler(CompilerOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Optimizes the given program.
   *
   * @param root the SCRIPT produced by the template compiler; it is mutated in place
   * @return {@code root}, optimized
   */
  @CanIgnoreReturnValue
  public Node optimize(Node root) {
    checkNotNull(root);
    checkArgument(root.isScript(), "Expected SCRIPT but was %s", root);
    logger.fine("Optimizing with " + options);

    PhaseOptimizer phaseOptimizer =
        new PhaseOptimizer(this, new DefaultPassConfig(options).getOptimizations());
    phaseOptimizer.process(root);
    passResults = phaseOptimizer.getPassResults();
    return root;
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  @Override
  public void reportChangeToEnclosingScope(Node n) {
    checkNotNull(n);
    changeStamp++;
  }

  @Override
  public int getChangeStamp() {
    return changeStamp;
  }

  /** Returns whether any pass has changed the tree so far. */
  public boolean hasCodeChanged() {
    return changeStamp != 0;
  }

  /** Returns what each pass did during the last {@link #optimize} call. */
  ImmutableList<PassResult> getPassResults() {
    return passResults;
  }

  /** Sets the logging level for the org.tmplr.javascript.jscomp package. */
  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
  }
}
