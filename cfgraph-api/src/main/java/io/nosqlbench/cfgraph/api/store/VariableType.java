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


import java.util.Locale;

/// The element type family of a variable, as far as classification cares about it.
public enum VariableType {
  /// any integral or floating point element type
  NUMERIC,
  /// single characters; the last dimension holds the characters of one string
  CHAR,
  /// variable or fixed length strings, one per cell
  STRING;

  /// @return true for both character arrays and string variables
  public boolean isText() {
    return this != NUMERIC;
  }

  /// Map a netCDF style type name onto a type family.
  ///
  /// @param typeName a name like `double`, `int`, `char` or `string`
  /// @return the matching type family
  /// @throws IllegalArgumentException for unknown type names
  public static VariableType fromTypeName(String typeName) {
    return switch (typeName.toLowerCase(Locale.ROOT)) {
      case "double", "float", "long", "int", "short", "byte", "ubyte", "ushort", "uint", "ulong",
           "int64", "int32", "int16", "int8", "float64", "float32" -> NUMERIC;
      case "char" -> CHAR;
      case "string", "str" -> STRING;
      default -> throw new IllegalArgumentException("Unknown variable type name: " + typeName);
    };
  }
}
