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


import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A name-keyed collection of classified variables.
///
/// The dataset level group returned by [CfReader#cfGroup()] holds every variable of the
/// dataset; the group returned by [CfVariable#cfGroup()] holds one variable's direct
/// neighbours. Both offer the same category views. Views are derived from the category set of
/// each variable on every call and are never stored separately, so every view agrees with
/// every other. Iteration follows the dataset's declared variable order.
public class CfGroup implements Iterable<CfVariable> {

  private final Map<String, CfVariable> variables;
  private final Map<String, Object> globalAttributes;
  private final Map<String, CfVariable> promoted;

  CfGroup(Map<String, CfVariable> variables, Map<String, Object> globalAttributes, Map<String, CfVariable> promoted) {
    this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    this.globalAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(globalAttributes));
    this.promoted = Collections.unmodifiableMap(new LinkedHashMap<>(promoted));
  }

  /// @param name a variable name
  /// @return the variable
  /// @throws CfVariableNotFoundException if this group has no such variable
  public CfVariable get(String name) {
    CfVariable variable = variables.get(name);
    if (variable == null) {
      throw new CfVariableNotFoundException(name, variables.size());
    }
    return variable;
  }

  /// @param name a variable name
  /// @return the variable, or empty
  public Optional<CfVariable> find(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  public boolean contains(String name) {
    return variables.containsKey(name);
  }

  /// @return the variable names in declared order
  public Set<String> names() {
    return variables.keySet();
  }

  public int size() {
    return variables.size();
  }

  public boolean isEmpty() {
    return variables.isEmpty();
  }

  /// @return every variable of this group by name
  public Map<String, CfVariable> variables() {
    return variables;
  }

  @Override
  public Iterator<CfVariable> iterator() {
    return variables.values().iterator();
  }

  /// @param category a role
  /// @return the variables of this group holding the role, by name
  public Map<String, CfVariable> byCategory(CfCategory category) {
    Map<String, CfVariable> view = new LinkedHashMap<>();
    variables.forEach((name, variable) -> {
      if (variable.is(category)) {
        view.put(name, variable);
      }
    });
    return Collections.unmodifiableMap(view);
  }

  public Map<String, CfVariable> dataVariables() {
    return byCategory(CfCategory.DATA_VARIABLE);
  }

  public Map<String, CfVariable> coordinates() {
    return byCategory(CfCategory.COORDINATE);
  }

  public Map<String, CfVariable> auxiliaryCoordinates() {
    return byCategory(CfCategory.AUXILIARY_COORDINATE);
  }

  public Map<String, CfVariable> bounds() {
    return byCategory(CfCategory.BOUNDS);
  }

  public Map<String, CfVariable> cellMeasures() {
    return byCategory(CfCategory.CELL_MEASURE);
  }

  public Map<String, CfVariable> gridMappings() {
    return byCategory(CfCategory.GRID_MAPPING);
  }

  public Map<String, CfVariable> labels() {
    return byCategory(CfCategory.LABEL);
  }

  public Map<String, CfVariable> ancillaryVariables() {
    return byCategory(CfCategory.ANCILLARY_VARIABLE);
  }

  public Map<String, CfVariable> climatology() {
    return byCategory(CfCategory.CLIMATOLOGY_BOUNDS);
  }

  /// @return the variables that supply at least one formula term, by name
  public Map<String, CfVariable> formulaTerms() {
    Map<String, CfVariable> view = new LinkedHashMap<>();
    variables.forEach((name, variable) -> {
      if (!variable.formulaTermsByRoot().isEmpty()) {
        view.put(name, variable);
      }
    });
    return Collections.unmodifiableMap(view);
  }

  /// @return dataset level attributes; empty for the groups of non-data variables
  public Map<String, Object> globalAttributes() {
    return globalAttributes;
  }

  /// @return variables that could not be attached where they were referenced, or that are
  ///     reference surfaces of formula terms, offered again as data variables in their own
  ///     right; only the dataset level group has any
  public Map<String, CfVariable> promoted() {
    return promoted;
  }

  @Override
  public String toString() {
    return CfGroupSummary.render(this);
  }
}
