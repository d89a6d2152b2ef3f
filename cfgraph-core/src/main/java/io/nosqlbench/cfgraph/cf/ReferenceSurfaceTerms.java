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
import java.util.Map;

/// The formula terms that describe a reference surface or field for each parametric vertical
/// coordinate, keyed by the coordinate's `standard_name`. Such terms are useful as data in
/// their own right, so the reader promotes them to data variables.
final class ReferenceSurfaceTerms {

  private static final Map<String, List<String>> TERMS = Map.of(
      "atmosphere_sigma_coordinate", List.of("ps"),
      "atmosphere_hybrid_sigma_pressure_coordinate", List.of("ps"),
      "atmosphere_hybrid_height_coordinate", List.of("orog"),
      "atmosphere_sleve_coordinate", List.of("zsurf1", "zsurf2"),
      "ocean_sigma_coordinate", List.of("eta", "depth"),
      "ocean_s_coordinate", List.of("eta", "depth"),
      "ocean_sigma_z_coordinate", List.of("eta", "depth"),
      "ocean_s_coordinate_g1", List.of("eta", "depth"),
      "ocean_s_coordinate_g2", List.of("eta", "depth")
  );

  private ReferenceSurfaceTerms() {
  }

  /// @param coordinateName the standard or long name of the parametric coordinate, may be null
  /// @param term the formula term name
  /// @return true if the term is a reference surface of that coordinate
  static boolean isReferenceSurface(String coordinateName, String term) {
    if (coordinateName == null) {
      return false;
    }
    return TERMS.getOrDefault(coordinateName, List.of()).contains(term);
  }
}
