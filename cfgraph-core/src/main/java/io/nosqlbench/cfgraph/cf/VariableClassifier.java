package io.nosqlbench.cfgraph.cf;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/// First pass: assigns [CfCategory] roles to every variable of a dataset.
///
/// Roles come from the shape of a variable itself (dimension coordinates, grid mappings) and
/// from the name-valued attributes of every other variable. Roles only accumulate. Variables
/// that end the pass without any role become data variables.
final class VariableClassifier {
  private static final Logger logger = LogManager.getLogger(VariableClassifier.class);

  private final Map<String, CfVariable> arena;
  private final CfReaderOptions options;

  VariableClassifier(Map<String, CfVariable> arena, CfReaderOptions options) {
    this.arena = arena;
    this.options = options;
  }

  void classify() {
    identifyCoordinates();
    for (CfVariable variable : arena.values()) {
      for (CfReference reference : CfReference.values()) {
        if (reference != CfReference.FORMULA_TERMS) {
          variable.findAttribute(reference.attribute())
              .ifPresent(value -> assign(variable, reference, value));
        }
      }
      if (variable.hasAttribute(CfAttributeNames.GRID_MAPPING_NAME)) {
        variable.addCategory(CfCategory.GRID_MAPPING);
      }
    }
    identifyFormulaTerms();

    int dataVariables = 0;
    for (CfVariable variable : arena.values()) {
      if (variable.categories().isEmpty()) {
        variable.addCategory(CfCategory.DATA_VARIABLE);
        dataVariables++;
      }
    }
    logger.debug("classified {} variables, {} of them data variables", arena.size(), dataVariables);
  }

  /// One-dimensional, non-text variables named after their only dimension.
  private void identifyCoordinates() {
    for (CfVariable variable : arena.values()) {
      if (variable.ndim() == 1
          && variable.dimensions().get(0).equals(variable.name())
          && !variable.type().isText()
          && (!options.checkMonotonic() || isMonotonic(variable))) {
        variable.addCategory(CfCategory.COORDINATE);
      }
    }
  }

  private void assign(CfVariable referencing, CfReference reference, Object value) {
    for (NameTokens.Token token : reference.tokens(value)) {
      CfVariable target = lookup(referencing, reference, token.name());
      if (target == null) {
        continue;
      }
      switch (reference) {
        case COORDINATES -> {
          // dimension coordinates listed in 'coordinates' keep their single role
          if (target.is(CfCategory.COORDINATE)) {
            continue;
          }
          target.addCategory(target.type().isText() ? CfCategory.LABEL : CfCategory.AUXILIARY_COORDINATE);
        }
        case CELL_MEASURES -> {
          target.addCategory(CfCategory.CELL_MEASURE);
          target.setCellMeasure(token.key());
        }
        default -> target.addCategory(reference.category());
      }
    }
  }

  private void identifyFormulaTerms() {
    for (CfVariable root : arena.values()) {
      Object value = root.findAttribute(CfReference.FORMULA_TERMS.attribute()).orElse(null);
      if (value == null) {
        continue;
      }
      if (root.is(CfCategory.BOUNDS)) {
        logger.debug("skipping formula terms of bounds variable '{}'", root.name());
        continue;
      }
      for (NameTokens.Token token : CfReference.FORMULA_TERMS.tokens(value)) {
        CfVariable term = lookup(root, CfReference.FORMULA_TERMS, token.name());
        if (term == null) {
          continue;
        }
        term.addFormulaTerm(root.name(), token.key());
        if (term.categories().isEmpty()) {
          term.addCategory(CfCategory.AUXILIARY_COORDINATE);
        }
      }
    }
  }

  private CfVariable lookup(CfVariable referencing, CfReference reference, String name) {
    if (name.equals(referencing.name())) {
      logger.debug("variable '{}' references itself through '{}'", name, reference.attribute());
      return null;
    }
    CfVariable target = arena.get(name);
    if (target == null) {
      logger.debug("missing CF {} variable '{}', referenced by variable '{}'",
          reference.attribute(), name, referencing.name());
    }
    return target;
  }

  private static boolean isMonotonic(CfVariable variable) {
    if (!(variable.data() instanceof double[] values)) {
      return false;
    }
    if (values.length < 2) {
      return true;
    }
    double first = values[1] - values[0];
    if (first == 0.0d || Double.isNaN(first)) {
      return false;
    }
    for (int i = 1; i < values.length; i++) {
      double delta = values[i] - values[i - 1];
      if (Double.isNaN(delta) || Math.signum(delta) != Math.signum(first)) {
        return false;
      }
    }
    return true;
  }
}
