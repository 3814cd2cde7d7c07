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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tmplr.javascript.jscomp.PhaseOptimizer.PassResult;
import org.tmplr.javascript.rhino.IR;
import org.tmplr.javascript.rhino.Node;
import org.tmplr.javascript.rhino.Token;

/** Tests for {@link PhaseOptimizer}. */
@RunWith(JUnit4.class)
public final class PhaseOptimizerTest {

  private final Logger logger = Logger.getLogger(PhaseOptimizer.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  private Level oldLevel;
  private CompilerOptions options;

  @Before
  public void setUp() {
    oldLevel = logger.getLevel();
    logger.setLevel(Level.FINER);
    logger.addHandler(handler);
    options = new CompilerOptions();
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
    logger.setLevel(oldLevel);
  }

  /** function render() { { a(); } } */
  private static Node nestedBlockScript() {
    return IR.script(
        IR.function(
            IR.name("render"),
            IR.paramList(),
            IR.block(IR.block(IR.exprResult(IR.call(IR.name("a")))))));
  }

  private ImmutableList<PassResult> process(Node root, PassFactory... passes) {
    Compiler compiler = new Compiler(options);
    PhaseOptimizer optimizer = new PhaseOptimizer(compiler, ImmutableList.copyOf(passes));
    optimizer.process(root);
    return optimizer.getPassResults();
  }

  @Test
  public void testPassesRunInOrderAndReportChanges() {
    ImmutableList<PassResult> results =
        process(
            nestedBlockScript(),
            DefaultPassConfig.combineOutputStatements,
            DefaultPassConfig.flattenNestedBlocks,
            DefaultPassConfig.hoistTaggedFunctions);

    assertThat(results.stream().map(PassResult::getName).collect(toImmutableList()))
        .containsExactly(
            PassNames.COMBINE_OUTPUT_STATEMENTS,
            PassNames.FLATTEN_NESTED_BLOCKS,
            PassNames.HOIST_TAGGED_FUNCTIONS)
        .inOrder();
    assertThat(results.stream().map(PassResult::isChanged).collect(toImmutableList()))
        .containsExactly(false, true, false)
        .inOrder();
    for (PassResult result : results) {
      assertThat(result.getRuntimeMillis()).isAtLeast(0L);
    }
  }

  @Test
  public void testLogsEachPass() {
    process(nestedBlockScript(), DefaultPassConfig.flattenNestedBlocks);

    List<String> messages = new ArrayList<>();
    for (LogRecord record : records) {
      messages.add(record.getMessage());
    }
    assertThat(messages).contains("Running pass " + PassNames.FLATTEN_NESTED_BLOCKS);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.FINE);
    assertThat(messages.get(messages.size() - 1)).contains("changed");
  }

  @Test
  public void testValidationNamesTheBrokenPass() {
    options.setCheckAstValidity(true);
    PassFactory breaker =
        PassFactory.builder()
            .setName("breaker")
            .setInternalFactory(compiler -> root -> root.addChildToBack(new Node(Token.RETURN)))
            .build();

    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> process(nestedBlockScript(), DefaultPassConfig.flattenNestedBlocks, breaker));
    assertThat(e).hasMessageThat().isEqualTo("Validity check failed for pass breaker");
    assertThat(e).hasCauseThat().hasMessageThat().contains("RETURN outside of a function");
  }

  @Test
  public void testInputIsValidatedBeforeTheFirstPass() {
    options.setCheckAstValidity(true);
    Node root = new Node(Token.SCRIPT, IR.name("x"));
    assertThrows(
        IllegalStateException.class,
        () -> process(root, DefaultPassConfig.flattenNestedBlocks));
  }

  @Test
  public void testNoValidationByDefault() {
    Node root = new Node(Token.SCRIPT, IR.name("x"));
    assertThat(process(root, DefaultPassConfig.flattenNestedBlocks)).hasSize(1);
  }
}
