package io.nosqlbench.cfgraph.stores;

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

import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.stores.hdf5.Hdf5VariableStore;
import io.nosqlbench.cfgraph.stores.yaml.YamlVariableStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/// Opens a [RawVariableStore] for a file, choosing the implementation by file extension.
///
/// | extension | store |
/// |-----------|-------|
/// | `.yaml`, `.yml` | [YamlVariableStore] |
/// | `.nc`, `.nc4`, `.h5`, `.hdf5` | [Hdf5VariableStore] |
public final class VariableStores {

  private VariableStores() {
  }

  /// @param path the dataset file
  /// @return an open store, to be closed by the caller
  /// @throws IllegalArgumentException if the file does not exist or has an unknown extension
  public static RawVariableStore open(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Dataset file does not exist: " + path);
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    String extension = dot < 0 ? "" : name.substring(dot + 1);
    return switch (extension) {
      case "yaml", "yml" -> YamlVariableStore.load(path);
      case "nc", "nc4", "h5", "hdf5" -> new Hdf5VariableStore(path);
      default -> throw new IllegalArgumentException(
          "Unknown dataset file type '" + extension + "' for " + path + ", expected one of yaml, yml, nc, nc4, h5, hdf5");
    };
  }
}
