package io.nosqlbench.cfgraph.stores.hdf5;

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

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.jhdf.object.datatype.StringData;
import io.nosqlbench.cfgraph.api.store.AttributeMissingException;
import io.nosqlbench.cfgraph.api.store.AttributeValues;
import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.api.store.VariableMissingException;
import io.nosqlbench.cfgraph.api.store.VariableType;
import io.nosqlbench.cfgraph.stores.StoreFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A [RawVariableStore] over the root group of an HDF5 file, which includes netCDF-4 files.
///
/// Every dataset in the root group is a variable and every root attribute a global attribute.
/// netCDF-4 bookkeeping is hidden: the dimension scale attributes, and the datasets which only
/// exist to carry a dimension. Axis names come from the netCDF-4 dimension ids
/// (`_Netcdf4Coordinates` against `_Netcdf4Dimid`), else from the `DIMENSION_LIST` scale
/// references, else from the first unused dimension scale (or one-dimensional dataset, when the
/// file has no dimension scales) of the same length. An axis that matches nothing is named
/// `phony_dim_<axis>`.
///
/// The underlying [HdfFile] stays open until [#close()].
public class Hdf5VariableStore implements RawVariableStore {
  private static final Logger logger = LogManager.getLogger(Hdf5VariableStore.class);

  private static final String NETCDF4_DIMID = "_Netcdf4Dimid";
  private static final String NETCDF4_COORDINATES = "_Netcdf4Coordinates";
  private static final Set<String> HIDDEN_ATTRIBUTES = Set.of(
      "CLASS",
      "NAME",
      "DIMENSION_LIST",
      "REFERENCE_LIST",
      NETCDF4_DIMID,
      NETCDF4_COORDINATES,
      "_NCProperties",
      "_nc3_strict"
  );
  private static final String DIMENSION_SCALE = "DIMENSION_SCALE";
  private static final String PURE_DIMENSION = "This is a netCDF dimension but not a netCDF variable";

  private final Path path;
  private final HdfFile hdfFile;
  private final Map<String, Dataset> datasets = new LinkedHashMap<>();
  private final Map<String, List<String>> dimensions = new LinkedHashMap<>();

  /// Open an HDF5 file.
  /// @param path the file
  /// @throws StoreFormatException if the file cannot be read as HDF5
  public Hdf5VariableStore(Path path) {
    this.path = path;
    try {
      this.hdfFile = new HdfFile(path);
    } catch (HdfException e) {
      throw new StoreFormatException(path.toString(), "not a readable HDF5 file", e);
    }

    List<Dataset> scales = new ArrayList<>();
    List<Dataset> oneDimensional = new ArrayList<>();
    Map<Integer, String> dimensionIds = new LinkedHashMap<>();
    Map<Long, String> scaleAddresses = new LinkedHashMap<>();
    for (Node node : hdfFile.getChildren().values()) {
      if (!(node instanceof Dataset dataset)) {
        logger.debug("skipping non-dataset node '{}' in {}", node.getName(), path);
        continue;
      }
      if (DIMENSION_SCALE.equals(textAttribute(dataset, "CLASS"))) {
        scales.add(dataset);
        scaleAddresses.put(dataset.getAddress(), dataset.getName());
      }
      if (dataset.getDimensions().length == 1) {
        oneDimensional.add(dataset);
      }
      List<Integer> dimid = intsAttribute(dataset, NETCDF4_DIMID);
      if (dimid.size() == 1) {
        dimensionIds.put(dimid.get(0), dataset.getName());
      }
      String scaleName = textAttribute(dataset, "NAME");
      if (scaleName != null && scaleName.startsWith(PURE_DIMENSION)) {
        continue;
      }
      datasets.put(dataset.getName(), dataset);
    }

    List<Dataset> candidates = scales.isEmpty() ? oneDimensional : scales;
    for (Dataset dataset : datasets.values()) {
      dimensions.put(dataset.getName(), nameAxes(dataset, dimensionIds, scaleAddresses, candidates));
    }
    logger.debug("opened {} with {} variables, {} dimension ids and {} dimension candidates",
        path, datasets.size(), dimensionIds.size(), candidates.size());
  }

  /// Name the axes of a dataset, preferring the netCDF-4 dimension ids, then the HDF5
  /// dimension scale references, then the first unused candidate of matching length.
  private List<String> nameAxes(
      Dataset dataset,
      Map<Integer, String> dimensionIds,
      Map<Long, String> scaleAddresses,
      List<Dataset> candidates
  ) {
    int[] shape = dataset.getDimensions();
    if (shape.length == 1
        && (dimensionIds.containsValue(dataset.getName()) || scaleAddresses.containsValue(dataset.getName()))) {
      return List.of(dataset.getName());
    }

    List<String> byId = namesById(intsAttribute(dataset, NETCDF4_COORDINATES), shape.length, dimensionIds);
    if (byId != null) {
      return byId;
    }
    List<String> byScale = shape.length == 0 ? null : namesByScaleReference(dataset, shape.length, scaleAddresses);
    if (byScale != null) {
      return byScale;
    }

    if (shape.length == 1 && candidates.contains(dataset)) {
      return List.of(dataset.getName());
    }
    if (shape.length > 1) {
      logger.debug("naming the axes of '{}' in {} by length", dataset.getName(), path);
    }
    List<String> names = new ArrayList<>(shape.length);
    Set<String> taken = new LinkedHashSet<>();
    for (int axis = 0; axis < shape.length; axis++) {
      String name = null;
      for (Dataset candidate : candidates) {
        int[] candidateShape = candidate.getDimensions();
        if (candidateShape.length == 1 && candidateShape[0] == shape[axis] && !taken.contains(candidate.getName())) {
          name = candidate.getName();
          break;
        }
      }
      if (name == null) {
        name = "phony_dim_" + axis;
      }
      taken.add(name);
      names.add(name);
    }
    return Collections.unmodifiableList(names);
  }

  private static List<String> namesById(List<Integer> ids, int rank, Map<Integer, String> dimensionIds) {
    if (ids.size() != rank || rank == 0) {
      return null;
    }
    List<String> names = new ArrayList<>(rank);
    for (Integer id : ids) {
      String name = dimensionIds.get(id);
      if (name == null) {
        return null;
      }
      names.add(name);
    }
    return Collections.unmodifiableList(names);
  }

  /// `DIMENSION_LIST` holds, per axis, a variable length list of object references to the
  /// attached dimension scales. The first attached scale names the axis.
  private List<String> namesByScaleReference(Dataset dataset, int rank, Map<Long, String> scaleAddresses) {
    Attribute attribute = dataset.getAttribute("DIMENSION_LIST");
    if (attribute == null || scaleAddresses.isEmpty()) {
      return null;
    }
    Object data;
    try {
      data = attribute.getData();
    } catch (HdfException e) {
      logger.debug("unreadable DIMENSION_LIST on '{}' in {}: {}", dataset.getName(), path, e.getMessage());
      return null;
    }
    if (data == null || !data.getClass().isArray() || Array.getLength(data) != rank) {
      return null;
    }
    List<String> names = new ArrayList<>(rank);
    for (int axis = 0; axis < rank; axis++) {
      Long address = firstAddress(Array.get(data, axis));
      String name = address == null ? null : scaleAddresses.get(address);
      if (name == null) {
        return null;
      }
      names.add(name);
    }
    return Collections.unmodifiableList(names);
  }

  private static Long firstAddress(Object references) {
    Object current = references;
    while (current != null && current.getClass().isArray()) {
      if (Array.getLength(current) == 0) {
        return null;
      }
      current = Array.get(current, 0);
    }
    return current instanceof Number number ? number.longValue() : null;
  }

  private static List<Integer> intsAttribute(Dataset dataset, String name) {
    Attribute attribute = dataset.getAttribute(name);
    if (attribute == null) {
      return List.of();
    }
    Object data = attribute.getData();
    List<Integer> ids = new ArrayList<>();
    if (data instanceof Number number) {
      ids.add(number.intValue());
    } else if (data != null && data.getClass().isArray()) {
      for (int i = 0; i < Array.getLength(data); i++) {
        if (!(Array.get(data, i) instanceof Number number)) {
          return List.of();
        }
        ids.add(number.intValue());
      }
    }
    return ids;
  }

  private static String textAttribute(Dataset dataset, String name) {
    Attribute attribute = dataset.getAttribute(name);
    if (attribute == null) {
      return null;
    }
    Object value = AttributeValues.normalize(attribute.getData());
    return value instanceof String text ? text : null;
  }

  @Override
  public List<String> variables() {
    return List.copyOf(datasets.keySet());
  }

  @Override
  public List<String> dimensions(String name) {
    dataset(name);
    return dimensions.get(name);
  }

  @Override
  public int[] shape(String name) {
    return dataset(name).getDimensions().clone();
  }

  @Override
  public Set<String> attributeNames(String name) {
    return visible(dataset(name).getAttributes());
  }

  @Override
  public Object attributeValue(String name, String attr) {
    Attribute attribute = HIDDEN_ATTRIBUTES.contains(attr) ? null : dataset(name).getAttribute(attr);
    if (attribute == null) {
      throw new AttributeMissingException(name, attr);
    }
    return normalize(attribute, "attribute '" + attr + "' of '" + name + "'");
  }

  @Override
  public Set<String> globalAttributeNames() {
    return visible(hdfFile.getAttributes());
  }

  @Override
  public Object globalAttributeValue(String attr) {
    Attribute attribute = HIDDEN_ATTRIBUTES.contains(attr) ? null : hdfFile.getAttribute(attr);
    if (attribute == null) {
      throw new AttributeMissingException(null, attr);
    }
    return normalize(attribute, "global attribute '" + attr + "'");
  }

  @Override
  public VariableType variableType(String name) {
    Dataset dataset = dataset(name);
    if (dataset.getJavaType() != String.class) {
      return VariableType.NUMERIC;
    }
    if (!dataset.isVariableLength()
        && dataset.getDataType() instanceof StringData
        && dataset.getDataType().getSize() == 1) {
      return VariableType.CHAR;
    }
    return VariableType.STRING;
  }

  @Override
  public Object readData(String name) {
    Dataset dataset = dataset(name);
    VariableType type = variableType(name);
    int size = Math.toIntExact(dataset.getSize());
    Object flat = dataset.isEmpty() ? null : dataset.getDataFlat();
    if (flat != null && !flat.getClass().isArray()) {
      Object single = Array.newInstance(flat.getClass(), 1);
      Array.set(single, 0, flat);
      flat = single;
    }
    int length = flat == null ? 0 : Array.getLength(flat);
    if (flat != null && length != size) {
      throw new StoreFormatException(path.toString(),
          "dataset '" + name + "' returned " + length + " values for a shape of " + Arrays.toString(dataset.getDimensions()));
    }

    switch (type) {
      case NUMERIC: {
        double[] values = new double[size];
        for (int i = 0; i < length; i++) {
          Object value = Array.get(flat, i);
          if (!(value instanceof Number number)) {
            throw new StoreFormatException(path.toString(), "dataset '" + name + "' holds non-numeric values");
          }
          values[i] = number.doubleValue();
        }
        return values;
      }
      case CHAR: {
        char[] chars = new char[size];
        for (int i = 0; i < length; i++) {
          Object value = Array.get(flat, i);
          String text = value == null ? "" : value.toString();
          chars[i] = text.isEmpty() ? '\0' : text.charAt(0);
        }
        return chars;
      }
      default: {
        String[] strings = new String[size];
        Arrays.fill(strings, "");
        for (int i = 0; i < length; i++) {
          Object value = Array.get(flat, i);
          strings[i] = value == null ? "" : AttributeValues.trimText(value.toString());
        }
        return strings;
      }
    }
  }

  /// Close the underlying HDF5 file.
  @Override
  public void close() {
    hdfFile.close();
  }

  @Override
  public String toString() {
    return "Hdf5VariableStore{" + path + "}";
  }

  private Dataset dataset(String name) {
    Dataset dataset = datasets.get(name);
    if (dataset == null) {
      throw new VariableMissingException(name);
    }
    return dataset;
  }

  private Object normalize(Attribute attribute, String what) {
    try {
      return AttributeValues.normalize(attribute.getData());
    } catch (IllegalArgumentException e) {
      throw new StoreFormatException(path.toString(), what + ": " + e.getMessage(), e);
    }
  }

  private static Set<String> visible(Map<String, Attribute> attributes) {
    Set<String> names = new LinkedHashSet<>();
    for (String name : attributes.keySet()) {
      if (!HIDDEN_ATTRIBUTES.contains(name)) {
        names.add(name);
      }
    }
    return Collections.unmodifiableSet(names);
  }
}
