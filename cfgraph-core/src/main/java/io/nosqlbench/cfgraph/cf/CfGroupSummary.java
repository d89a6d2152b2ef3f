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


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Sectioned, one-line-per-role rendering of a [CfGroup].
///
/// Every variable must fall into the section of each of its roles. A variable without a role,
/// or a role without a section, means category bookkeeping has gone wrong and raises a
/// [CfClassificationException].
public final class CfGroupSummary {

  /// Section title for promoted variables.
  public static final String PROMOTED_TITLE = "Promoted data variables";

  private CfGroupSummary() {
  }

  /// Assign the variables of a group to titled sections.
  /// @param group the group to summarize
  /// @return section title to variable names, in role order, empty sections included
  /// @throws CfClassificationException if a variable has no role or a role has no section
  public static Map<String, List<String>> sections(CfGroup group) {
    Map<String, List<String>> sections = new LinkedHashMap<>();
    for (CfCategory category : CfCategory.values()) {
      sections.put(category.title(), new ArrayList<>());
    }
    for (CfVariable variable : group) {
      if (variable.categories().isEmpty()) {
        throw new CfClassificationException("Variable '" + variable.name() + "' has no category");
      }
      for (CfCategory category : variable.categories()) {
        List<String> section = sections.get(category.title());
        if (section == null) {
          throw new CfClassificationException(
              "Unknown section for category " + category + " of variable '" + variable.name() + "'");
        }
        section.add(variable.name());
      }
    }
    sections.put(PROMOTED_TITLE, new ArrayList<>(group.promoted().keySet()));
    sections.replaceAll((title, names) -> Collections.unmodifiableList(names));
    return Collections.unmodifiableMap(sections);
  }

  /// @param group the group to render
  /// @return a multi-line summary listing non-empty sections
  public static String render(CfGroup group) {
    StringBuilder sb = new StringBuilder();
    sb.append("<CfGroup of ").append(group.size()).append(" variables");
    if (!group.globalAttributes().isEmpty()) {
      sb.append(", ").append(group.globalAttributes().size()).append(" global attributes");
    }
    sb.append(">");
    sections(group).forEach((title, names) -> {
      if (!names.isEmpty()) {
        sb.append(System.lineSeparator())
            .append("    ").append(title).append(": ").append(String.join(", ", names));
      }
    });
    return sb.toString();
  }
}
