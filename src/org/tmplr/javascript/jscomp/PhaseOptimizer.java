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

import com.google.auto.value.AutoValue;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.tmplr.javascript.rhino.Node;

/**
 * Runs a sequence of optimization passes over the tree, each exactly once and in order.
 *
 * <p>When AST validation is enabled, the input is validated before the first pass and the output of
 * every pass after it runs, so a pass that breaks the tree is caught right away and named.
 */
class PhaseOptimizer implements CompilerPass {

  private static final Logger logger = Logger.getLogger(PhaseOptimizer.class.getName());

  private final AbstractCompiler compiler;
  private final ImmutableList<PassFactory> passes;
  private final ImmutableList.Builder<PassResult> results = ImmutableList.builder();

  /** What happened when a single pass ran. */
  @AutoValue
  abstract static class PassResult {
    abstract String getName();

    /** Whether the pass reported any change to the tree. */
    abstract boolean isChanged();

    abstract long getRuntimeMillis();

    static PassResult create(String name, boolean changed, long runtimeMillis) {
      return new AutoValue_PhaseOptimizer_PassResult(name, changed, runtimeMillis);
    }
  }

  PhaseOptimizer(AbstractCompiler compiler, ImmutableList<PassFactory> passes) {
    this.compiler = compiler;
    this.passes = passes;
  }

  @Override
  public void process(Node root) {
    boolean validate = compiler.getOptions().shouldCheckAstValidity();
    AstValidator validator = new AstValidator();
    if (validate) {
      validator.validateScript(root);
    }

    for (PassFactory factory : passes) {
      String name = factory.getName();
      logger.fine("Running pass " + name);

      int changeStamp = compiler.getChangeStamp();
      Stopwatch stopwatch = Stopwatch.createStarted();
      factory.create(compiler).process(root);
      long runtime = stopwatch.elapsed(TimeUnit.MILLISECONDS);
      boolean changed = changeStamp != compiler.getChangeStamp();

      if (validate) {
        try {
          validator.validateScript(root);
        } catch (IllegalStateException e) {
          throw new IllegalStateException("Validity check failed for pass " + name, e);
        }
      }
      results.add(PassResult.create(name, changed, runtime));
      logger.finer(
          String.format(
              "Pass %s took %dms, %s", name, runtime, changed ? "changed" : "no changes"));
    }
  }

  /** Returns the results of the passes that ran, in order. */
  ImmutableList<PassResult> getPassResults() {
    return results.build();
  }
}
