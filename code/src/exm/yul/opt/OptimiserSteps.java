/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.yul.opt;

import java.util.Map;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableMap;

import exm.yul.common.exceptions.YulRuntimeError;
import exm.yul.opt.steps.BlockFlattener;
import exm.yul.opt.steps.CircularReferencesPruner;
import exm.yul.opt.steps.CommonSubexpressionEliminator;
import exm.yul.opt.steps.ConditionalSimplifier;
import exm.yul.opt.steps.ConditionalUnsimplifier;
import exm.yul.opt.steps.ControlFlowSimplifier;
import exm.yul.opt.steps.DeadCodeEliminator;
import exm.yul.opt.steps.EquivalentFunctionCombiner;
import exm.yul.opt.steps.ExpressionInliner;
import exm.yul.opt.steps.ExpressionJoiner;
import exm.yul.opt.steps.ExpressionSimplifier;
import exm.yul.opt.steps.ExpressionSplitter;
import exm.yul.opt.steps.ForLoopConditionIntoBody;
import exm.yul.opt.steps.ForLoopConditionOutOfBody;
import exm.yul.opt.steps.ForLoopInitRewriter;
import exm.yul.opt.steps.FullInliner;
import exm.yul.opt.steps.FunctionGrouper;
import exm.yul.opt.steps.FunctionHoister;
import exm.yul.opt.steps.LiteralRematerialiser;
import exm.yul.opt.steps.LoadResolver;
import exm.yul.opt.steps.LoopInvariantCodeMotion;
import exm.yul.opt.steps.RedundantAssignEliminator;
import exm.yul.opt.steps.Rematerialiser;
import exm.yul.opt.steps.SSAReverser;
import exm.yul.opt.steps.SSATransform;
import exm.yul.opt.steps.StructuralSimplifier;
import exm.yul.opt.steps.UnusedPruner;
import exm.yul.opt.steps.VarDeclInitializer;

/**
 * The fixed set of steps available to optimiser sequences, with the one
 * character abbreviation used for each in sequence strings.
 *
 * {@link VarNameCleaner} is deliberately absent: it breaks the unique
 * names every registered step relies on.
 */
public class OptimiserSteps {

  private static Map<String, OptimiserStep> allSteps = null;
  private static ImmutableBiMap<String, Character> abbreviations = null;

  /**
   * @return all steps by name
   */
  public static synchronized Map<String, OptimiserStep> allSteps() {
    if (allSteps == null) {
      init();
    }
    return allSteps;
  }

  /**
   * @return step name to abbreviation
   */
  public static synchronized Map<String, Character>
                                          stepNameToAbbreviationMap() {
    if (abbreviations == null) {
      init();
    }
    return abbreviations;
  }

  /**
   * @return abbreviation to step name
   */
  public static synchronized Map<Character, String>
                                          stepAbbreviationToNameMap() {
    if (abbreviations == null) {
      init();
    }
    return abbreviations.inverse();
  }

  private static void init() {
    OptimiserStep[] steps = new OptimiserStep[] {
        new BlockFlattener(),
        new CircularReferencesPruner(),
        new CommonSubexpressionEliminator(),
        new ConditionalSimplifier(),
        new ConditionalUnsimplifier(),
        new ControlFlowSimplifier(),
        new DeadCodeEliminator(),
        new EquivalentFunctionCombiner(),
        new ExpressionInliner(),
        new ExpressionJoiner(),
        new ExpressionSimplifier(),
        new ExpressionSplitter(),
        new ForLoopConditionIntoBody(),
        new ForLoopConditionOutOfBody(),
        new ForLoopInitRewriter(),
        new FullInliner(),
        new FunctionGrouper(),
        new FunctionHoister(),
        new LiteralRematerialiser(),
        new LoadResolver(),
        new LoopInvariantCodeMotion(),
        new RedundantAssignEliminator(),
        new Rematerialiser(),
        new SSAReverser(),
        new SSATransform(),
        new StructuralSimplifier(),
        new UnusedPruner(),
        new VarDeclInitializer(),
    };
    ImmutableMap.Builder<String, OptimiserStep> stepBuilder =
                                      ImmutableMap.builder();
    for (OptimiserStep step: steps) {
      stepBuilder.put(step.getStepName(), step);
    }
    Map<String, OptimiserStep> stepMap;
    try {
      stepMap = stepBuilder.build();
    } catch (IllegalArgumentException ex) {
      throw new YulRuntimeError("Duplicate optimiser step name", ex);
    }

    ImmutableBiMap<String, Character> abbrevMap;
    try {
      abbrevMap = ImmutableBiMap.<String, Character>builder()
        .put("BlockFlattener", 'f')
        .put("CircularReferencesPruner", 'l')
        .put("CommonSubexpressionEliminator", 'c')
        .put("ConditionalSimplifier", 'C')
        .put("ConditionalUnsimplifier", 'U')
        .put("ControlFlowSimplifier", 'n')
        .put("DeadCodeEliminator", 'D')
        .put("EquivalentFunctionCombiner", 'v')
        .put("ExpressionInliner", 'e')
        .put("ExpressionJoiner", 'j')
        .put("ExpressionSimplifier", 's')
        .put("ExpressionSplitter", 'x')
        .put("ForLoopConditionIntoBody", 'I')
        .put("ForLoopConditionOutOfBody", 'O')
        .put("ForLoopInitRewriter", 'o')
        .put("FullInliner", 'i')
        .put("FunctionGrouper", 'g')
        .put("FunctionHoister", 'h')
        .put("LiteralRematerialiser", 'T')
        .put("LoadResolver", 'L')
        .put("LoopInvariantCodeMotion", 'M')
        .put("RedundantAssignEliminator", 'r')
        .put("Rematerialiser", 'm')
        .put("SSAReverser", 'V')
        .put("SSATransform", 'a')
        .put("StructuralSimplifier", 't')
        .put("UnusedPruner", 'u')
        .put("VarDeclInitializer", 'd')
        .build();
    } catch (IllegalArgumentException ex) {
      throw new YulRuntimeError("Duplicate optimiser step abbreviation", ex);
    }

    if (abbrevMap.size() != stepMap.size()) {
      throw new YulRuntimeError("Optimiser step abbreviation table has " +
            abbrevMap.size() + " entries but there are " + stepMap.size() +
            " steps");
    }
    for (Map.Entry<String, Character> e: abbrevMap.entrySet()) {
      char c = e.getValue();
      if (!stepMap.containsKey(e.getKey())) {
        throw new YulRuntimeError("Abbreviation " + c +
                                  " for unknown step " + e.getKey());
      }
      if (c == ' ' || c == '\n' || c == '(' || c == ')') {
        throw new YulRuntimeError("Reserved character " + c +
                                  " used as step abbreviation");
      }
    }
    allSteps = stepMap;
    abbreviations = abbrevMap;
  }
}
