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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Second pass: turns name-valued attributes into cf_group edges.
///
/// Every name that resolves and whose dimensions fit the reference adds an edge in both
/// directions between the referencing and the referenced variable. A name that resolves but
/// does not fit is reported as ignored, so the reader can promote it later. Text variables
/// named in `coordinates` are labels and are left to [LabelResolver].
///
/// Data variables are additionally given their dimension coordinates and the formula terms of
/// any coordinate they already hold. Those edges point one way only.
final class ReferenceResolver {
  private static final Logger logger = LogManager.getLogger(ReferenceResolver.class);

  private final Map<String, CfVariable> arena;
  private final List<CfVariable> formulaTermProviders = new ArrayList<>();

  ReferenceResolver(Map<String, CfVariable> arena) {
    this.arena = arena;
    for (CfVariable variable : arena.values()) {
      if (!variable.formulaTermsByRoot().isEmpty()) {
        formulaTermProviders.add(variable);
      }
    }
  }

  /// Resolve the references of every variable, then attach data variable context.
  /// @param ignored receives the names of referenced variables that could not be attached
  void resolveAll(Set<String> ignored) {
    for (CfVariable variable : arena.values()) {
      resolveReferences(variable, ignored, true);
    }
    for (CfVariable variable : arena.values()) {
      if (variable.isDataVariable()) {
        attachDataContext(variable, ignored);
      }
    }
  }

  /// Follow the reference attributes of one variable.
  /// @param variable the referencing variable
  /// @param ignored receives names that resolve but do not span the variable
  /// @param mutual whether the referenced variables get an edge back
  void resolveReferences(CfVariable variable, Set<String> ignored, boolean mutual) {
    for (CfReference reference : CfReference.values()) {
      Object value = variable.findAttribute(reference.attribute()).orElse(null);
      if (value == null) {
        continue;
      }
      if (reference == CfReference.FORMULA_TERMS && variable.is(CfCategory.BOUNDS)) {
        continue;
      }
      for (NameTokens.Token token : reference.tokens(value)) {
        CfVariable target = arena.get(token.name());
        if (target == null || target.name().equals(variable.name())) {
          continue;
        }
        if (reference == CfReference.COORDINATES) {
          if (target.type().isText()) {
            continue;
          }
          if (target.is(CfCategory.COORDINATE)) {
            if (variable.isDataVariable()) {
              variable.addGroupMember(target.name());
            }
            continue;
          }
        }
        if (reference.spanRule().spans(target.dimensions(), variable.dimensions())) {
          link(variable, target, mutual);
        } else {
          ignore(variable, target, ignored);
        }
      }
    }
  }

  /// Give a data variable its dimension coordinates and relevant formula terms.
  /// @param dataVariable the data variable
  /// @param ignored receives formula terms that do not span the data variable
  void attachDataContext(CfVariable dataVariable, Set<String> ignored) {
    for (String dimension : dataVariable.dimensions()) {
      CfVariable coordinate = arena.get(dimension);
      if (coordinate != null && coordinate.is(CfCategory.COORDINATE)) {
        dataVariable.addGroupMember(dimension);
      }
    }
    for (CfVariable term : formulaTermProviders) {
      if (dataVariable.cfGroupNames().contains(term.name()) || term.name().equals(dataVariable.name())) {
        continue;
      }
      for (String root : term.formulaTermsByRoot().keySet()) {
        if (dataVariable.cfGroupNames().contains(root)) {
          if (CfReference.SpanRule.SUBSET.spans(term.dimensions(), dataVariable.dimensions())) {
            dataVariable.addGroupMember(term.name());
          } else {
            ignore(dataVariable, term, ignored);
          }
          break;
        }
      }
    }
  }

  static void link(CfVariable referencing, CfVariable referenced, boolean mutual) {
    referencing.addGroupMember(referenced.name());
    if (mutual) {
      referenced.addGroupMember(referencing.name());
    }
  }

  static void ignore(CfVariable referencing, CfVariable referenced, Set<String> ignored) {
    logger.warn("Ignoring variable '{}' referenced by variable '{}': dimensions {} do not span {}",
        referenced.name(), referencing.name(), referenced.dimensions(), referencing.dimensions());
    ignored.add(referenced.name());
  }
}
