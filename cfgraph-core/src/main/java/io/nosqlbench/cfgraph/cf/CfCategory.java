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


/// The semantic roles a variable can play in a CF dataset.
///
/// Roles are not exclusive: a variable collects every role any other variable assigns to it,
/// and never loses one. [#DATA_VARIABLE] is the exception that proves the rule, it is only
/// given to variables that ended classification with no other role.
public enum CfCategory {
  DATA_VARIABLE("Data variables"),
  COORDINATE("Coordinates"),
  AUXILIARY_COORDINATE("Auxiliary coordinates"),
  BOUNDS("Bounds"),
  CELL_MEASURE("Cell measures"),
  GRID_MAPPING("Grid mappings"),
  LABEL("Labels"),
  ANCILLARY_VARIABLE("Ancillary variables"),
  CLIMATOLOGY_BOUNDS("Climatology");

  private final String title;

  CfCategory(String title) {
    this.title = title;
  }

  /// @return the default section title used when rendering a group summary
  public String title() {
    return title;
  }
}
