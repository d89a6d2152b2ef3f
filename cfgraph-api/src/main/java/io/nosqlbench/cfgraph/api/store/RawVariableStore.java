package io.nosqlbench.cfgraph.api.store;

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
import java.util.Set;

/// A read-only view over the variables of one dataset.
///
/// Stores expose variables by name with their dimensions, shape and attributes. They carry no
/// classification logic at all; the CF relationship engine only ever reads from them.
///
/// Attribute values are normalized by every implementation to one of:
/// - a [String]
/// - a [Number]
/// - an immutable [List] of strings or numbers, for multi-valued attributes
///
/// Single element arrays are collapsed to their only element.
public interface RawVariableStore extends AutoCloseable {

  /// @return the unique variable names, in the dataset's declared order
  List<String> variables();

  /// @param name the variable name
  /// @return the ordered dimension names of the variable, empty for a scalar
  /// @throws VariableMissingException if the variable does not exist
  List<String> dimensions(String name);

  /// @param name the variable name
  /// @return the shape of the variable, one non-negative length per dimension
  /// @throws VariableMissingException if the variable does not exist
  int[] shape(String name);

  /// @param name the variable name
  /// @return the names of the attributes declared on the variable
  /// @throws VariableMissingException if the variable does not exist
  Set<String> attributeNames(String name);

  /// @param name the variable name
  /// @param attr the attribute name
  /// @return the normalized attribute value
  /// @throws AttributeMissingException if the attribute is not declared on the variable
  /// @throws VariableMissingException if the variable does not exist
  Object attributeValue(String name, String attr);

  /// @return the names of the dataset level attributes
  Set<String> globalAttributeNames();

  /// @param attr the global attribute name
  /// @return the normalized global attribute value
  /// @throws AttributeMissingException if the attribute is not declared on the dataset
  Object globalAttributeValue(String attr);

  /// @param name the variable name
  /// @return the element type family of the variable
  VariableType variableType(String name);

  /// Read the whole payload of a variable, flattened in row-major order.
  ///
  /// The array type follows [#variableType(String)]: `double[]` for numeric variables,
  /// `char[]` for character arrays and `String[]` for string variables.
  ///
  /// @param name the variable name
  /// @return a flat array with one element per cell
  Object readData(String name);

  /// Stores that hold no resources need not override this.
  @Override
  default void close() {
  }
}
