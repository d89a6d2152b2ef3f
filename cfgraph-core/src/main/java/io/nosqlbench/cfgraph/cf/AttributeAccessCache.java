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


import io.nosqlbench.cfgraph.api.store.AttributeMissingException;
import io.nosqlbench.cfgraph.api.store.RawVariableStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Memoized, audited attribute access for one variable.
///
/// The declared attribute names are fetched from the store once, when the cache is created.
/// Each attribute value is fetched at most once for the life of the cache. Reads through
/// [#get(String)] and [#find(String)] mark the attribute as used, which is how loaders find
/// attributes that were declared but never consumed. [#reset()] forgets the usage marks but
/// keeps every fetched value.
///
/// Instances are not thread safe.
public class AttributeAccessCache {

  private final RawVariableStore store;
  private final String variableName;
  /// declared names, sorted
  private final List<String> declared;
  private final Set<String> declaredLookup;
  private final Map<String, Object> values = new HashMap<>();
  private final Set<String> used = new HashSet<>();

  /// Create a cache, fetching the declared attribute names of the variable.
  /// @param store the store that owns the variable
  /// @param variableName the variable whose attributes are cached
  public AttributeAccessCache(RawVariableStore store, String variableName) {
    this.store = store;
    this.variableName = variableName;
    this.declared = List.copyOf(new TreeSet<>(store.attributeNames(variableName)));
    this.declaredLookup = Set.copyOf(declared);
  }

  /// Read an attribute and mark it used.
  /// @param attr the attribute name
  /// @return the attribute value
  /// @throws AttributeMissingException if the attribute is not declared
  public Object get(String attr) {
    Object value = peek(attr);
    used.add(attr);
    return value;
  }

  /// Read an attribute if it is declared, marking it used only in that case.
  /// @param attr the attribute name
  /// @return the attribute value, or empty if it is not declared
  public Optional<Object> find(String attr) {
    if (!declaredLookup.contains(attr)) {
      return Optional.empty();
    }
    return Optional.ofNullable(get(attr));
  }

  /// Read an attribute without marking it used.
  /// @param attr the attribute name
  /// @return the attribute value
  /// @throws AttributeMissingException if the attribute is not declared
  public Object peek(String attr) {
    if (!declaredLookup.contains(attr)) {
      throw new AttributeMissingException(variableName, attr);
    }
    if (values.containsKey(attr)) {
      return values.get(attr);
    }
    Object value = store.attributeValue(variableName, attr);
    values.put(attr, value);
    return value;
  }

  /// @param attr the attribute name
  /// @return true if the variable declares the attribute; this does not mark it used
  public boolean isDeclared(String attr) {
    return declaredLookup.contains(attr);
  }

  /// @return every declared attribute name, sorted
  public List<String> declared() {
    return declared;
  }

  /// @return the declared names read since creation or the last reset, sorted
  public List<String> used() {
    return filter(true);
  }

  /// @return the declared names not read since creation or the last reset, sorted
  public List<String> unused() {
    return filter(false);
  }

  /// Forget which attributes were read. Cached values are kept.
  public void reset() {
    used.clear();
  }

  /// @return the name of the variable this cache serves
  public String variableName() {
    return variableName;
  }

  private List<String> filter(boolean wasUsed) {
    List<String> names = new ArrayList<>();
    for (String name : declared) {
      if (used.contains(name) == wasUsed) {
        names.add(name);
      }
    }
    return names;
  }
}
