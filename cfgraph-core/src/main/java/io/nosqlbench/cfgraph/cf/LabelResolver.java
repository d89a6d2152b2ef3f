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


import io.nosqlbench.cfgraph.api.store.VariableType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Third pass and queries for label variables.
///
/// Labels are text variables named in the `coordinates` attribute of another variable. A
/// character label keeps the characters of each string along one extra dimension, its string
/// dimension, which is never shared with the variables it labels. A string label has no such
/// dimension.
///
/// The queries align label strings with a data variable: the label dimensions are reported in
/// the data variable's order and the strings are laid out row-major over them, so element 0 is
/// the label at index 0 of the shared dimension however the label itself is stored.
final class LabelResolver {
  private static final Logger logger = LogManager.getLogger(LabelResolver.class);

  private final Map<String, CfVariable> arena;

  LabelResolver(Map<String, CfVariable> arena) {
    this.arena = arena;
  }

  /// Attach the labels of every variable.
  /// @param ignored receives labels that do not span the variable naming them
  void attachAll(Set<String> ignored) {
    for (CfVariable variable : arena.values()) {
      attach(variable, ignored, true);
    }
  }

  /// Attach the labels named by one variable.
  /// @param variable the referencing variable
  /// @param ignored receives labels that do not span the variable
  /// @param mutual whether labels get an edge back
  void attach(CfVariable variable, Set<String> ignored, boolean mutual) {
    Object value = variable.findAttribute(CfReference.COORDINATES.attribute()).orElse(null);
    if (value == null) {
      return;
    }
    for (NameTokens.Token token : CfReference.COORDINATES.tokens(value)) {
      CfVariable label = arena.get(token.name());
      if (label == null || label == variable || !label.is(CfCategory.LABEL)) {
        continue;
      }
      if (spans(label, variable)) {
        ReferenceResolver.link(variable, label, mutual);
      } else {
        ReferenceResolver.ignore(variable, label, ignored);
      }
    }
  }

  /// A string label must share all of its dimensions with the variable; a character label all
  /// but exactly one, its string dimension, wherever that sits.
  static boolean spans(CfVariable label, CfVariable variable) {
    int unshared = 0;
    for (String dimension : label.dimensions()) {
      if (!variable.dimensions().contains(dimension)) {
        unshared++;
      }
    }
    return label.type() == VariableType.CHAR ? unshared == 1 : unshared == 0;
  }

  static List<String> labelDimensions(CfVariable label, CfVariable dataVariable) {
    requireLabelAndData(label, dataVariable);
    List<String> shared = new ArrayList<>();
    for (String dimension : dataVariable.dimensions()) {
      if (label.dimensions().contains(dimension)) {
        shared.add(dimension);
      }
    }
    return Collections.unmodifiableList(shared);
  }

  static List<String> labelData(CfVariable label, CfVariable dataVariable) {
    requireLabelAndData(label, dataVariable);
    List<String> labelDims = label.dimensions();
    int[] shape = label.shape();

    int stringAxis = -1;
    if (label.type() == VariableType.CHAR) {
      List<String> extra = new ArrayList<>();
      for (String dimension : labelDims) {
        if (!dataVariable.dimensions().contains(dimension)) {
          extra.add(dimension);
        }
      }
      if (extra.size() != 1) {
        throw new IllegalArgumentException("Invalid string dimensions " + extra + " for CF label variable '"
            + label.name() + "' relative to data variable '" + dataVariable.name() + "'");
      }
      stringAxis = labelDims.indexOf(extra.get(0));
    } else if (!dataVariable.dimensions().containsAll(labelDims)) {
      throw new IllegalArgumentException("String label variable '" + label.name()
          + "' does not span data variable '" + dataVariable.name() + "'");
    }

    // label axes other than the string axis, in label storage order
    List<Integer> cellAxes = new ArrayList<>();
    for (int axis = 0; axis < shape.length; axis++) {
      if (axis != stringAxis) {
        cellAxes.add(axis);
      }
    }
    String[] cells = cellStrings(label, shape, stringAxis, cellAxes);

    List<String> outputDims = labelDimensions(label, dataVariable);
    int[] outputLengths = new int[outputDims.size()];
    int[] cellStrides = new int[outputDims.size()];
    for (int i = 0; i < outputDims.size(); i++) {
      int axis = labelDims.indexOf(outputDims.get(i));
      outputLengths[i] = shape[axis];
      cellStrides[i] = strideAmong(cellAxes, axis, shape);
    }

    List<String> aligned = new ArrayList<>(cells.length);
    int[] index = new int[outputDims.size()];
    for (int n = 0; n < cells.length; n++) {
      int offset = 0;
      for (int i = 0; i < index.length; i++) {
        offset += index[i] * cellStrides[i];
      }
      aligned.add(cells[offset]);
      increment(index, outputLengths);
    }
    logger.trace("aligned {} labels of '{}' to {} of '{}'", aligned.size(), label.name(), outputDims, dataVariable.name());
    return Collections.unmodifiableList(aligned);
  }

  /// One string per combination of the cell axes, row-major in label storage order.
  private static String[] cellStrings(CfVariable label, int[] shape, int stringAxis, List<Integer> cellAxes) {
    int cellCount = 1;
    for (int axis : cellAxes) {
      cellCount *= shape[axis];
    }
    Object data = label.data();
    if (stringAxis < 0) {
      String[] values = (String[]) data;
      String[] cells = new String[cellCount];
      for (int i = 0; i < cellCount; i++) {
        cells[i] = values[i] == null ? "" : values[i].strip();
      }
      return cells;
    }

    char[] chars = (char[]) data;
    int[] strides = strides(shape);
    int width = shape[stringAxis];
    int[] cellLengths = new int[cellAxes.size()];
    for (int i = 0; i < cellLengths.length; i++) {
      cellLengths[i] = shape[cellAxes.get(i)];
    }
    String[] cells = new String[cellCount];
    int[] index = new int[cellAxes.size()];
    char[] buffer = new char[width];
    for (int n = 0; n < cellCount; n++) {
      int base = 0;
      for (int i = 0; i < index.length; i++) {
        base += index[i] * strides[cellAxes.get(i)];
      }
      for (int k = 0; k < width; k++) {
        char c = chars[base + k * strides[stringAxis]];
        buffer[k] = c == '\0' ? ' ' : c;
      }
      cells[n] = new String(buffer).strip();
      increment(index, cellLengths);
    }
    return cells;
  }

  private static int[] strides(int[] shape) {
    int[] strides = new int[shape.length];
    int stride = 1;
    for (int axis = shape.length - 1; axis >= 0; axis--) {
      strides[axis] = stride;
      stride *= shape[axis];
    }
    return strides;
  }

  /// Row-major stride of one axis within the cell array that excludes the string axis.
  private static int strideAmong(List<Integer> cellAxes, int axis, int[] shape) {
    int stride = 1;
    for (int i = cellAxes.size() - 1; i >= 0; i--) {
      int cellAxis = cellAxes.get(i);
      if (cellAxis == axis) {
        return stride;
      }
      stride *= shape[cellAxis];
    }
    throw new IllegalStateException("axis " + axis + " is not a cell axis");
  }

  private static void increment(int[] index, int[] lengths) {
    for (int i = index.length - 1; i >= 0; i--) {
      if (++index[i] < lengths[i]) {
        return;
      }
      index[i] = 0;
    }
  }

  private static void requireLabelAndData(CfVariable label, CfVariable dataVariable) {
    if (!label.is(CfCategory.LABEL)) {
      throw new IllegalStateException("Variable '" + label.name() + "' is not a CF label variable");
    }
    if (!dataVariable.isDataVariable()) {
      throw new IllegalArgumentException("Variable '" + dataVariable.name() + "' is not a CF data variable");
    }
  }
}
