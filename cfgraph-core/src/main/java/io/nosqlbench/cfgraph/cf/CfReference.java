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


import java.util.List;

/// The name-valued CF attributes through which one variable points at others.
///
/// Each reference knows the attribute that carries it, how its value is tokenized, the role it
/// gives the variables it names, and which dimensional relationship must hold for the named
/// variable to be attached to the referencing one.
public enum CfReference {
  ANCILLARY_VARIABLES("ancillary_variables", Syntax.NAMES, CfCategory.ANCILLARY_VARIABLE, SpanRule.SUBSET),
  COORDINATES("coordinates", Syntax.NAMES, CfCategory.AUXILIARY_COORDINATE, SpanRule.SUBSET),
  BOUNDS("bounds", Syntax.NAMES, CfCategory.BOUNDS, SpanRule.SUBSET_EXCEPT_LAST),
  CLIMATOLOGY("climatology", Syntax.NAMES, CfCategory.CLIMATOLOGY_BOUNDS, SpanRule.SUBSET_EXCEPT_LAST),
  GRID_MAPPING("grid_mapping", Syntax.MAPPING_NAMES, CfCategory.GRID_MAPPING, SpanRule.ALWAYS),
  CELL_MEASURES("cell_measures", Syntax.KEYED_NAMES, CfCategory.CELL_MEASURE, SpanRule.SUBSET),
  FORMULA_TERMS("formula_terms", Syntax.KEYED_NAMES, null, SpanRule.ALWAYS);

  /// How an attribute value is split into variable names.
  public enum Syntax {
    /// whitespace separated names
    NAMES,
    /// whitespace separated `key: name` pairs
    KEYED_NAMES,
    /// a single mapping name, or the extended `mapping: coord coord mapping: coord` form
    MAPPING_NAMES
  }

  /// Which dimensions of the referenced variable must also be dimensions of the referencing one.
  public enum SpanRule {
    /// all of them
    SUBSET,
    /// all but the trailing one, which holds the cell vertices
    SUBSET_EXCEPT_LAST,
    /// none, the relationship is not dimensional
    ALWAYS;

    /// @param referenced the dimensions of the referenced variable
    /// @param referencing the dimensions of the referencing variable
    /// @return true if the referenced variable can be attached to the referencing one
    public boolean spans(List<String> referenced, List<String> referencing) {
      return switch (this) {
        case ALWAYS -> true;
        case SUBSET -> referencing.containsAll(referenced);
        case SUBSET_EXCEPT_LAST -> referenced.isEmpty()
            || referencing.containsAll(referenced.subList(0, referenced.size() - 1));
      };
    }
  }

  private final String attribute;
  private final Syntax syntax;
  private final CfCategory category;
  private final SpanRule spanRule;

  CfReference(String attribute, Syntax syntax, CfCategory category, SpanRule spanRule) {
    this.attribute = attribute;
    this.syntax = syntax;
    this.category = category;
    this.spanRule = spanRule;
  }

  /// @return the attribute name carrying this reference
  public String attribute() {
    return attribute;
  }

  public Syntax syntax() {
    return syntax;
  }

  /// @return the role given to referenced variables, or null for formula terms which keep
  /// whatever role they already have
  public CfCategory category() {
    return category;
  }

  public SpanRule spanRule() {
    return spanRule;
  }

  /// Split an attribute value into the names it references.
  /// @param value the raw attribute value
  /// @return the referenced names, in attribute order
  public List<NameTokens.Token> tokens(Object value) {
    return switch (syntax) {
      case NAMES -> NameTokens.names(value);
      case KEYED_NAMES -> NameTokens.keyedNames(value);
      case MAPPING_NAMES -> NameTokens.mappingNames(value);
    };
  }
}
