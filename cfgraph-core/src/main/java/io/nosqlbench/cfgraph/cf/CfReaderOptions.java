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

/// Settings for a [CfReader].
/// @param checkMonotonic
///     only accept one-dimensional variables as coordinates when their values are strictly
///     monotonic; this reads the payload of every candidate coordinate
public record CfReaderOptions(boolean checkMonotonic) {

  /// The defaults: no monotonicity check.
  public static final CfReaderOptions DEFAULTS = new CfReaderOptions(false);

  /// @param checkMonotonic the new setting
  /// @return a copy with the monotonicity check set
  public CfReaderOptions withCheckMonotonic(boolean checkMonotonic) {
    return new CfReaderOptions(checkMonotonic);
  }
}
