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


import java.util.Set;

/// Attribute names reserved by the CF conventions.
///
/// Loaders interpret these themselves, so they are reported separately from free-form
/// attributes that are usually carried through as metadata.
public final class CfAttributeNames {

  public static final String GRID_MAPPING_NAME = "grid_mapping_name";
  public static final String STANDARD_NAME = "standard_name";
  public static final String LONG_NAME = "long_name";

  public static final Set<String> RESERVED = Set.of(
      "add_offset",
      "ancillary_variables",
      "axis",
      "bounds",
      "calendar",
      "cell_measures",
      "cell_methods",
      "climatology",
      "compress",
      "coordinates",
      "_FillValue",
      "flag_masks",
      "flag_meanings",
      "flag_values",
      "formula_terms",
      "grid_mapping",
      "leap_month",
      "leap_year",
      "long_name",
      "missing_value",
      "month_lengths",
      "positive",
      "scale_factor",
      "standard_error_multiplier",
      "standard_name",
      "units",
      "valid_max",
      "valid_min",
      "valid_range"
  );

  private CfAttributeNames() {
  }

  /// @param attribute an attribute name
  /// @return true if the CF conventions give the attribute a meaning
  public static boolean isReserved(String attribute) {
    return RESERVED.contains(attribute);
  }
}
