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


import io.nosqlbench.cfgraph.api.store.AttributeMissingException;
import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.api.store.VariableType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A store variable together with everything classification learned about it.
///
/// A variable carries the set of [CfCategory] roles it was given, the names of the variables
/// it is directly related to (its cf_group), the formula terms it provides and, for cell
/// measures, the measure kind. All of these are fixed once the owning [CfReader] has finished.
/// The only state that changes afterwards is attribute usage, tracked by the variable's own
/// [AttributeAccessCache].
public class CfVariable {

  private final RawVariableStore store;
  private final String name;
  private final List<String> dimensions;
  private final int[] shape;
  private final VariableType type;
  private final AttributeAccessCache attributes;

  private final EnumSet<CfCategory> categories = EnumSet.noneOf(CfCategory.class);
  private final LinkedHashSet<String> groupNames = new LinkedHashSet<>();
  private final Map<String, String> formulaTermsByRoot = new LinkedHashMap<>();
  private String cellMeasure;
  private boolean promoted;
  private CfGroup owner;

  CfVariable(RawVariableStore store, String name) {
    this.store = store;
    this.name = name;
    this.dimensions = List.copyOf(store.dimensions(name));
    this.shape = store.shape(name).clone();
    this.type = store.variableType(name);
    this.attributes = new AttributeAccessCache(store, name);
    if (shape.length != dimensions.size()) {
      throw new CfClassificationException(
          "Variable '" + name + "' has " + dimensions.size() + " dimensions but a shape of rank " + shape.length);
    }
  }

  /// @return the variable name, unique within its dataset
  public String name() {
    return name;
  }

  /// @return the ordered dimension names, empty for scalars
  public List<String> dimensions() {
    return dimensions;
  }

  /// @return the length of each dimension
  public int[] shape() {
    return shape.clone();
  }

  /// @return the number of dimensions
  public int ndim() {
    return dimensions.size();
  }

  public VariableType type() {
    return type;
  }

  /// @return a snapshot of the roles assigned to this variable
  public Set<CfCategory> categories() {
    return Collections.unmodifiableSet(EnumSet.copyOf(categories));
  }

  /// @param category a role
  /// @return true if this variable was given the role
  public boolean is(CfCategory category) {
    return categories.contains(category);
  }

  /// @return true if this is a data variable, including promoted ones
  public boolean isDataVariable() {
    return categories.contains(CfCategory.DATA_VARIABLE);
  }

  /// @return true if this wrapper was created to offer a non-data variable as a data variable
  public boolean isPromoted() {
    return promoted;
  }

  /// @return formula terms provided by this variable, keyed by the name of the variable whose
  ///     `formula_terms` attribute names it
  public Map<String, String> formulaTermsByRoot() {
    return Collections.unmodifiableMap(formulaTermsByRoot);
  }

  /// @return the measure kind (`area`, `volume`) when this variable is a cell measure
  public Optional<String> cellMeasure() {
    return Optional.ofNullable(cellMeasure);
  }

  /// Read an attribute, marking it used.
  /// @param attr the attribute name
  /// @return the attribute value
  /// @throws AttributeMissingException if the attribute is not declared
  public Object attribute(String attr) {
    return attributes.get(attr);
  }

  /// Read an attribute when it is declared, marking it used.
  /// @param attr the attribute name
  /// @return the attribute value, or empty
  public Optional<Object> findAttribute(String attr) {
    return attributes.find(attr);
  }

  /// @param attr the attribute name
  /// @return true if the attribute is declared; does not mark it used
  public boolean hasAttribute(String attr) {
    return attributes.isDeclared(attr);
  }

  /// @return all declared attributes sorted by name; does not mark any as used
  public List<CfAttribute> cfAttrs() {
    return describe(attributes.declared());
  }

  /// @return attributes read since construction finished or the last reset, sorted by name
  public List<CfAttribute> cfAttrsUsed() {
    return describe(attributes.used());
  }

  /// @return attributes not read since construction finished or the last reset, sorted by name
  public List<CfAttribute> cfAttrsUnused() {
    return describe(attributes.unused());
  }

  /// @return declared attributes whose names are reserved by the CF conventions
  public List<CfAttribute> cfAttrsIgnored() {
    List<String> reserved = new ArrayList<>();
    for (String attr : attributes.declared()) {
      if (CfAttributeNames.isReserved(attr)) {
        reserved.add(attr);
      }
    }
    return describe(reserved);
  }

  /// Forget which attributes were read. Categories and cf_group are unaffected.
  public void cfAttrsReset() {
    attributes.reset();
  }

  /// @return the names of the variables directly related to this one
  public Set<String> cfGroupNames() {
    return Collections.unmodifiableSet(groupNames);
  }

  /// The one-hop neighbourhood of this variable, with the same category views as the dataset
  /// level group. Data variables also see the dataset global attributes.
  /// @return a group over the related variables
  public CfGroup cfGroup() {
    if (owner == null) {
      throw new IllegalStateException("Variable '" + name + "' is not attached to a dataset group");
    }
    Map<String, CfVariable> members = new LinkedHashMap<>();
    for (String member : groupNames) {
      members.put(member, owner.get(member));
    }
    Map<String, Object> globals = isDataVariable() ? owner.globalAttributes() : Map.of();
    return new CfGroup(members, globals, Map.of());
  }

  /// Read the whole payload of this variable from the store.
  /// @return a flat row-major array, see [RawVariableStore#readData(String)]
  public Object data() {
    return store.readData(name);
  }

  /// @param dataVariable a data variable this label is attached to
  /// @return the dimensions of the data variable, in its order, that this label spans
  /// @throws IllegalStateException if this variable is not a label
  /// @throws IllegalArgumentException if the argument is not a data variable
  public List<String> cfLabelDimensions(CfVariable dataVariable) {
    return LabelResolver.labelDimensions(this, dataVariable);
  }

  /// @param dataVariable a data variable this label is attached to
  /// @return the label strings aligned with [#cfLabelDimensions(CfVariable)]
  /// @throws IllegalStateException if this variable is not a label
  /// @throws IllegalArgumentException if the argument is not a data variable, or the label
  ///     has no single string dimension relative to it
  public List<String> cfLabelData(CfVariable dataVariable) {
    return LabelResolver.labelData(this, dataVariable);
  }

  @Override
  public String toString() {
    return "CfVariable{" + name + dimensions + " " + categories + "}";
  }

  void addCategory(CfCategory category) {
    categories.add(category);
  }

  void addGroupMember(String member) {
    if (!member.equals(name)) {
      groupNames.add(member);
    }
  }

  void addFormulaTerm(String root, String term) {
    formulaTermsByRoot.putIfAbsent(root, term);
  }

  void setCellMeasure(String measure) {
    if (cellMeasure == null) {
      cellMeasure = measure;
    }
  }

  void markPromoted() {
    promoted = true;
  }

  void attach(CfGroup owner) {
    this.owner = owner;
  }

  AttributeAccessCache attributeCache() {
    return attributes;
  }

  private List<CfAttribute> describe(List<String> names) {
    List<CfAttribute> described = new ArrayList<>(names.size());
    for (String attr : names) {
      described.add(new CfAttribute(attr, attributes.peek(attr)));
    }
    return Collections.unmodifiableList(described);
  }
}
