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


import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Classifies the variables of one dataset and resolves their CF relationships.
///
/// Construction runs, in order:
/// 1. classification, assigning roles to every variable ([VariableClassifier])
/// 2. reference resolution over the complete name index ([ReferenceResolver])
/// 3. label resolution ([LabelResolver])
/// 4. promotion of variables that could not be attached where they were referenced, and of
///    reference surface formula terms, to data variables of their own
///
/// All of it happens exactly once. Afterwards the resulting [CfGroup] only changes through
/// attribute usage tracking, which is reset when construction finishes so that loaders start
/// from a clean slate.
///
/// The reader never closes the store; whoever opened it does.
public class CfReader {
  private static final Logger logger = LogManager.getLogger(CfReader.class);

  private final RawVariableStore store;
  private final CfReaderOptions options;
  private final CfGroup cfGroup;

  /// Read a dataset with default options.
  /// @param store the dataset's variables
  public CfReader(RawVariableStore store) {
    this(store, CfReaderOptions.DEFAULTS);
  }

  /// Read a dataset.
  /// @param store the dataset's variables
  /// @param options reader settings
  /// @throws CfClassificationException if classification ends in an inconsistent state
  public CfReader(RawVariableStore store, CfReaderOptions options) {
    this.store = store;
    this.options = options;
    long start = System.nanoTime();

    Map<String, CfVariable> arena = new LinkedHashMap<>();
    for (String name : store.variables()) {
      arena.put(name, new CfVariable(store, name));
    }

    new VariableClassifier(arena, options).classify();

    Set<String> ignored = new LinkedHashSet<>();
    ReferenceResolver references = new ReferenceResolver(arena);
    references.resolveAll(ignored);

    LabelResolver labels = new LabelResolver(arena);
    labels.attachAll(ignored);

    Map<String, CfVariable> promoted = promote(arena, references, labels, ignored);

    this.cfGroup = new CfGroup(arena, readGlobalAttributes(store), promoted);
    for (CfVariable variable : arena.values()) {
      variable.attach(cfGroup);
      variable.cfAttrsReset();
    }
    for (CfVariable variable : promoted.values()) {
      variable.attach(cfGroup);
      variable.cfAttrsReset();
    }

    CfGroupSummary.sections(cfGroup);
    logger.debug("resolved {} variables ({} promoted) in {} ms",
        arena.size(), promoted.size(), (System.nanoTime() - start) / 1_000_000);
  }

  /// @return the dataset level group
  public CfGroup cfGroup() {
    return cfGroup;
  }

  public CfReaderOptions options() {
    return options;
  }

  /// @return the store this reader was built from
  public RawVariableStore store() {
    return store;
  }

  @Override
  public String toString() {
    return "CfReader{" + store + "}";
  }

  private Map<String, CfVariable> promote(
      Map<String, CfVariable> arena,
      ReferenceResolver references,
      LabelResolver labels,
      Set<String> ignored
  ) {
    Map<String, CfVariable> promoted = new LinkedHashMap<>();

    for (CfVariable term : arena.values()) {
      for (Map.Entry<String, String> entry : term.formulaTermsByRoot().entrySet()) {
        CfVariable root = arena.get(entry.getKey());
        String rootName = root.findAttribute(CfAttributeNames.STANDARD_NAME)
            .or(() -> root.findAttribute(CfAttributeNames.LONG_NAME))
            .map(Object::toString)
            .orElse(null);
        if (ReferenceSurfaceTerms.isReferenceSurface(rootName, entry.getValue())
            && !promoted.containsKey(term.name())) {
          logger.debug("promoting reference surface '{}' of '{}'", term.name(), root.name());
          promoted.put(term.name(), buildPromoted(term.name(), references, labels, ignored));
          break;
        }
      }
    }

    Set<String> handled = new HashSet<>();
    Optional<String> next = nextUnhandled(ignored, handled);
    while (next.isPresent()) {
      String name = next.get();
      if (!arena.get(name).isDataVariable() && !promoted.containsKey(name)) {
        logger.debug("promoting ignored variable '{}'", name);
        promoted.put(name, buildPromoted(name, references, labels, ignored));
      }
      handled.add(name);
      next = nextUnhandled(ignored, handled);
    }
    return promoted;
  }

  private CfVariable buildPromoted(String name, ReferenceResolver references, LabelResolver labels, Set<String> ignored) {
    CfVariable variable = new CfVariable(store, name);
    variable.addCategory(CfCategory.DATA_VARIABLE);
    variable.markPromoted();
    references.resolveReferences(variable, ignored, false);
    references.attachDataContext(variable, ignored);
    labels.attach(variable, ignored, false);
    return variable;
  }

  private static Optional<String> nextUnhandled(Set<String> ignored, Set<String> handled) {
    for (String name : ignored) {
      if (!handled.contains(name)) {
        return Optional.of(name);
      }
    }
    return Optional.empty();
  }

  private static Map<String, Object> readGlobalAttributes(RawVariableStore store) {
    Map<String, Object> globals = new LinkedHashMap<>();
    for (String name : new TreeSet<>(store.globalAttributeNames())) {
      globals.put(name, store.globalAttributeValue(name));
    }
    return globals;
  }
}
