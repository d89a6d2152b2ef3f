package io.nosqlbench.cfgraph.stores.yaml;

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

import io.nosqlbench.cfgraph.api.store.InMemoryVariableStore;
import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.api.store.VariableType;
import io.nosqlbench.cfgraph.stores.StoreFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A [RawVariableStore] described by a YAML document, for hand-written datasets and test
/// fixtures.
///
/// ```yaml
/// attributes:
///   Conventions: CF-1.7
/// dimensions:
///   time: 2
///   nv: 2
/// variables:
///   time:
///     type: double
///     dimensions: [time]
///     attributes:
///       units: days since 2000-01-01
///       bounds: time_bnds
///     data: [0, 1]
///   time_bnds:
///     dimensions: [time, nv]
/// ```
///
/// Variable `type` is a netCDF type name, `double` when omitted. Numeric `data` may be nested
/// lists and is flattened in row-major order. Character variables take one string per position
/// of their leading dimensions, string variables one string per cell. Variables without `data`
/// read as zeros or empty strings.
public class YamlVariableStore implements RawVariableStore {
  private static final Logger logger = LogManager.getLogger(YamlVariableStore.class);

  private final String source;
  private final RawVariableStore delegate;

  private YamlVariableStore(String source, RawVariableStore delegate) {
    this.source = source;
    this.delegate = delegate;
  }

  /// Read a descriptor file.
  /// @param path the YAML file
  /// @return the store described by the file
  /// @throws StoreFormatException if the document does not describe a valid dataset
  public static YamlVariableStore load(Path path) {
    LoadSettings loadSettings = LoadSettings.builder().setLabel(path.toString()).build();
    Load yaml = new Load(loadSettings);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromDocument(path.toString(), yaml.loadFromReader(reader));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (YamlEngineException e) {
      throw new StoreFormatException(path.toString(), "invalid YAML", e);
    }
  }

  /// Read a descriptor from text.
  /// @param label a name for the document, used in error messages
  /// @param yamlText the YAML document
  /// @return the store described by the document
  public static YamlVariableStore parse(String label, String yamlText) {
    Load yaml = new Load(LoadSettings.builder().setLabel(label).build());
    try {
      return fromDocument(label, yaml.loadFromString(yamlText));
    } catch (YamlEngineException e) {
      throw new StoreFormatException(label, "invalid YAML", e);
    }
  }

  private static YamlVariableStore fromDocument(String source, Object document) {
    Map<?, ?> root = document == null ? Map.of() : asMap(source, "document", document);
    InMemoryVariableStore.Builder builder = InMemoryVariableStore.builder();

    try {
      asMap(source, "attributes", root.get("attributes"))
          .forEach((name, value) -> builder.globalAttribute(String.valueOf(name), value));
    } catch (IllegalArgumentException e) {
      throw new StoreFormatException(source, e.getMessage(), e);
    }

    asMap(source, "dimensions", root.get("dimensions")).forEach((name, length) -> {
      if (!(length instanceof Number number)) {
        throw new StoreFormatException(source, "dimension '" + name + "' needs an integer length, got " + length);
      }
      builder.dimension(String.valueOf(name), number.intValue());
    });

    Map<?, ?> variables = asMap(source, "variables", root.get("variables"));
    for (Map.Entry<?, ?> entry : variables.entrySet()) {
      String name = String.valueOf(entry.getKey());
      Map<?, ?> definition = entry.getValue() == null ? Map.of() : asMap(source, "variable '" + name + "'", entry.getValue());
      try {
        addVariable(builder, source, name, definition);
      } catch (IllegalArgumentException e) {
        throw new StoreFormatException(source, e.getMessage(), e);
      }
    }
    logger.debug("loaded {} variables from {}", variables.size(), source);
    return new YamlVariableStore(source, builder.build());
  }

  private static void addVariable(InMemoryVariableStore.Builder builder, String source, String name, Map<?, ?> definition) {
    Object typeName = definition.get("type");
    VariableType type = typeName == null ? VariableType.NUMERIC : VariableType.fromTypeName(String.valueOf(typeName));

    List<String> dimensionNames = new ArrayList<>();
    Object dims = definition.get("dimensions");
    if (dims instanceof List<?> list) {
      for (Object dim : list) {
        dimensionNames.add(String.valueOf(dim));
      }
    } else if (dims != null) {
      dimensionNames.add(String.valueOf(dims));
    }

    InMemoryVariableStore.VariableBuilder variable =
        builder.variable(name, type, dimensionNames.toArray(String[]::new));
    asMap(source, "attributes of '" + name + "'", definition.get("attributes"))
        .forEach((attr, value) -> variable.attribute(String.valueOf(attr), value));

    Object data = definition.get("data");
    if (data != null) {
      List<Object> flat = new ArrayList<>();
      flatten(data, flat);
      if (type == VariableType.NUMERIC) {
        double[] values = new double[flat.size()];
        for (int i = 0; i < values.length; i++) {
          if (!(flat.get(i) instanceof Number number)) {
            throw new StoreFormatException(source, "variable '" + name + "' has non-numeric data: " + flat.get(i));
          }
          values[i] = number.doubleValue();
        }
        variable.data(values);
      } else {
        variable.text(flat.stream().map(String::valueOf).toArray(String[]::new));
      }
    }
    variable.done();
  }

  private static void flatten(Object data, List<Object> into) {
    if (data instanceof List<?> list) {
      for (Object element : list) {
        flatten(element, into);
      }
    } else {
      into.add(data);
    }
  }

  private static Map<?, ?> asMap(String source, String what, Object value) {
    if (value == null) {
      return Map.of();
    }
    if (value instanceof Map<?, ?> map) {
      return map;
    }
    throw new StoreFormatException(source, what + " must be a mapping, got " + value.getClass().getSimpleName());
  }

  @Override
  public List<String> variables() {
    return delegate.variables();
  }

  @Override
  public List<String> dimensions(String name) {
    return delegate.dimensions(name);
  }

  @Override
  public int[] shape(String name) {
    return delegate.shape(name);
  }

  @Override
  public Set<String> attributeNames(String name) {
    return delegate.attributeNames(name);
  }

  @Override
  public Object attributeValue(String name, String attr) {
    return delegate.attributeValue(name, attr);
  }

  @Override
  public Set<String> globalAttributeNames() {
    return delegate.globalAttributeNames();
  }

  @Override
  public Object globalAttributeValue(String attr) {
    return delegate.globalAttributeValue(attr);
  }

  @Override
  public VariableType variableType(String name) {
    return delegate.variableType(name);
  }

  @Override
  public Object readData(String name) {
    return delegate.readData(name);
  }

  @Override
  public String toString() {
    return "YamlVariableStore{" + source + "}";
  }
}
