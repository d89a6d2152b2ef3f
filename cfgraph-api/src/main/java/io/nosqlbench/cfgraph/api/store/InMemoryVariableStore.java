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


import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A [RawVariableStore] held entirely in memory.
///
/// This is the store used by the other store implementations once a file has been decoded, and
/// the one to reach for when assembling datasets programmatically:
/// ```java
/// RawVariableStore store = InMemoryVariableStore.builder()
///     .globalAttribute("Conventions", "CF-1.7")
///     .dimension("time", 4)
///     .dimension("nv", 2)
///     .variable("time", VariableType.NUMERIC, "time")
///       .attribute("bounds", "time_bnds")
///       .done()
///     .variable("time_bnds", VariableType.NUMERIC, "time", "nv").done()
///     .build();
/// ```
public class InMemoryVariableStore implements RawVariableStore {

  private final Map<String, StoredVariable> variables;
  private final Map<String, Object> globalAttributes;

  private InMemoryVariableStore(Map<String, StoredVariable> variables, Map<String, Object> globalAttributes) {
    this.variables = Collections.unmodifiableMap(variables);
    this.globalAttributes = Collections.unmodifiableMap(globalAttributes);
  }

  /// @return a builder for a new store
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public List<String> variables() {
    return List.copyOf(variables.keySet());
  }

  @Override
  public List<String> dimensions(String name) {
    return variable(name).dimensions();
  }

  @Override
  public int[] shape(String name) {
    return variable(name).shape().clone();
  }

  @Override
  public Set<String> attributeNames(String name) {
    return Collections.unmodifiableSet(variable(name).attributes().keySet());
  }

  @Override
  public Object attributeValue(String name, String attr) {
    StoredVariable variable = variable(name);
    if (!variable.attributes().containsKey(attr)) {
      throw new AttributeMissingException(name, attr);
    }
    return variable.attributes().get(attr);
  }

  @Override
  public Set<String> globalAttributeNames() {
    return globalAttributes.keySet();
  }

  @Override
  public Object globalAttributeValue(String attr) {
    if (!globalAttributes.containsKey(attr)) {
      throw new AttributeMissingException(null, attr);
    }
    return globalAttributes.get(attr);
  }

  @Override
  public VariableType variableType(String name) {
    return variable(name).type();
  }

  @Override
  public Object readData(String name) {
    StoredVariable variable = variable(name);
    Object data = variable.data();
    if (data == null) {
      int size = cellCount(variable.shape());
      return switch (variable.type()) {
        case NUMERIC -> new double[size];
        case CHAR -> new char[size];
        case STRING -> {
          String[] empty = new String[size];
          Arrays.fill(empty, "");
          yield empty;
        }
      };
    }
    if (data instanceof double[] d) {
      return d.clone();
    }
    if (data instanceof char[] c) {
      return c.clone();
    }
    return ((String[]) data).clone();
  }

  @Override
  public String toString() {
    return "InMemoryVariableStore{variables=" + variables.keySet() + ", globals=" + globalAttributes.keySet() + "}";
  }

  private StoredVariable variable(String name) {
    StoredVariable variable = variables.get(name);
    if (variable == null) {
      throw new VariableMissingException(name);
    }
    return variable;
  }

  private static int cellCount(int[] shape) {
    int size = 1;
    for (int length : shape) {
      size *= length;
    }
    return size;
  }

  private static Object normalizeAttribute(String owner, String attr, Object value) {
    try {
      return AttributeValues.normalize(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Attribute '" + attr + "' of " + owner + ": " + e.getMessage(), e);
    }
  }

  private record StoredVariable(
      String name,
      VariableType type,
      List<String> dimensions,
      int[] shape,
      Map<String, Object> attributes,
      Object data
  ) {
  }

  /// Accumulates dimensions, variables and global attributes for an [InMemoryVariableStore].
  public static class Builder {
    private final Map<String, Integer> dimensions = new LinkedHashMap<>();
    private final Map<String, StoredVariable> variables = new LinkedHashMap<>();
    private final Map<String, Object> globalAttributes = new LinkedHashMap<>();

    private Builder() {
    }

    /// Declare a dimension. Variables may only use declared dimensions.
    /// @param name the dimension name
    /// @param length the dimension length, zero or more
    /// @return this builder
    public Builder dimension(String name, int length) {
      if (length < 0) {
        throw new IllegalArgumentException("Dimension '" + name + "' must not have a negative length: " + length);
      }
      dimensions.put(name, length);
      return this;
    }

    /// @param name the global attribute name
    /// @param value the raw attribute value, normalized on the way in
    /// @return this builder
    /// @throws IllegalArgumentException if the value cannot be normalized
    public Builder globalAttribute(String name, Object value) {
      globalAttributes.put(name, normalizeAttribute("global", name, value));
      return this;
    }

    /// Start a variable definition.
    /// @param name the variable name, replacing any earlier variable of the same name
    /// @param type the element type family
    /// @param dimensionNames the ordered dimension names
    /// @return a builder for the variable, finished with [VariableBuilder#done()]
    public VariableBuilder variable(String name, VariableType type, String... dimensionNames) {
      return new VariableBuilder(this, name, type, List.of(dimensionNames));
    }

    /// @return the assembled store
    public InMemoryVariableStore build() {
      return new InMemoryVariableStore(new LinkedHashMap<>(variables), new LinkedHashMap<>(globalAttributes));
    }

    private int[] shapeOf(String variable, List<String> dimensionNames) {
      int[] shape = new int[dimensionNames.size()];
      for (int i = 0; i < shape.length; i++) {
        Integer length = dimensions.get(dimensionNames.get(i));
        if (length == null) {
          throw new IllegalArgumentException(
              "Variable '" + variable + "' uses undeclared dimension '" + dimensionNames.get(i) + "'");
        }
        shape[i] = length;
      }
      return shape;
    }
  }

  /// Accumulates the attributes and payload of one variable.
  public static class VariableBuilder {
    private final Builder parent;
    private final String name;
    private final VariableType type;
    private final List<String> dimensionNames;
    private final int[] shape;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private Object data;

    private VariableBuilder(Builder parent, String name, VariableType type, List<String> dimensionNames) {
      this.parent = parent;
      this.name = name;
      this.type = type;
      this.dimensionNames = dimensionNames;
      this.shape = parent.shapeOf(name, dimensionNames);
    }

    /// @param attr the attribute name
    /// @param value the raw attribute value, normalized on the way in
    /// @return this variable builder
    public VariableBuilder attribute(String attr, Object value) {
      attributes.put(attr, normalizeAttribute("variable '" + name + "'", attr, value));
      return this;
    }

    /// Set a numeric payload, flattened in row-major order.
    /// @param values one value per cell
    /// @return this variable builder
    public VariableBuilder data(double... values) {
      requireType(VariableType.NUMERIC);
      requireSize(values.length, cellCount(shape));
      this.data = values.clone();
      return this;
    }

    /// Set a text payload.
    ///
    /// For [VariableType#STRING] variables there is one string per cell. For
    /// [VariableType#CHAR] variables there is one string per position of the leading
    /// dimensions; each string is padded with NULs to the length of the trailing dimension.
    ///
    /// @param values the strings, in row-major order
    /// @return this variable builder
    public VariableBuilder text(String... values) {
      if (type == VariableType.STRING) {
        requireSize(values.length, cellCount(shape));
        this.data = values.clone();
        return this;
      }
      requireType(VariableType.CHAR);
      if (shape.length == 0) {
        throw new IllegalArgumentException("Character variable '" + name + "' needs a string length dimension");
      }
      int width = shape[shape.length - 1];
      requireSize(values.length, cellCount(Arrays.copyOf(shape, shape.length - 1)));
      char[] chars = new char[values.length * width];
      for (int row = 0; row < values.length; row++) {
        String value = values[row];
        if (value.length() > width) {
          throw new IllegalArgumentException(
              "Label '" + value + "' is longer than the string dimension of '" + name + "' (" + width + ")");
        }
        value.getChars(0, value.length(), chars, row * width);
      }
      this.data = chars;
      return this;
    }

    /// Set a raw character payload, flattened in row-major order over all dimensions.
    /// @param values one character per cell
    /// @return this variable builder
    public VariableBuilder chars(char... values) {
      requireType(VariableType.CHAR);
      requireSize(values.length, cellCount(shape));
      this.data = values.clone();
      return this;
    }

    /// @return the parent store builder
    public Builder done() {
      parent.variables.put(name, new StoredVariable(
          name, type, List.copyOf(dimensionNames), shape, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), data));
      return parent;
    }

    private void requireType(VariableType expected) {
      if (type != expected) {
        throw new IllegalArgumentException("Variable '" + name + "' is " + type + ", not " + expected);
      }
    }

    private void requireSize(int actual, int expected) {
      if (actual != expected) {
        throw new IllegalArgumentException(
            "Variable '" + name + "' expects " + expected + " values, got " + actual);
      }
    }
  }
}
