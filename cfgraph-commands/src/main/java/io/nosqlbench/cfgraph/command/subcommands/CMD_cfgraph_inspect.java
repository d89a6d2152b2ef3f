package io.nosqlbench.cfgraph.command.subcommands;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.cf.CfAttribute;
import io.nosqlbench.cfgraph.cf.CfGroup;
import io.nosqlbench.cfgraph.cf.CfGroupSummary;
import io.nosqlbench.cfgraph.cf.CfReader;
import io.nosqlbench.cfgraph.cf.CfReaderOptions;
import io.nosqlbench.cfgraph.cf.CfVariable;
import io.nosqlbench.cfgraph.cf.CfVariableNotFoundException;
import io.nosqlbench.cfgraph.stores.VariableStores;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/// Show how the variables of a dataset were classified and related.
///
/// ## Usage
///
/// ```bash
/// cfgraph inspect precipitation.nc
/// cfgraph inspect precipitation.nc --variable pr
/// cfgraph inspect hybrid_height.nc --variable surface_altitude --promoted
/// cfgraph inspect descriptor.yaml --json
/// ```
///
/// Without `--variable` the dataset summary is printed, one line per populated role. With it,
/// the variable's dimensions, roles and attributes are printed, followed by the summary of its
/// own cf_group. Attributes reserved by the CF conventions are marked with `*`. A promoted
/// variable shares its name with the variable it was promoted from; `--promoted` selects the
/// promoted data variable instead.
@CommandLine.Command(
    name = "inspect",
    header = "Show CF roles and relationships of a dataset",
    description = "Classifies every variable of a dataset and prints the resulting CF groups.",
    exitCodeList = {
        "0: Success",
        "1: Error reading the dataset or unknown variable"
    }
)
public class CMD_cfgraph_inspect implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_cfgraph_inspect.class);
    private static final Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE",
        description = "The dataset: .nc, .nc4, .h5, .hdf5, .yaml or .yml")
    private Path file;

    @CommandLine.Option(names = {"--variable", "-v"},
        description = "Show a single variable instead of the whole dataset")
    private String variableName;

    @CommandLine.Option(names = {"--promoted"},
        description = "With --variable, show the promoted data variable of that name")
    private boolean promoted = false;

    @CommandLine.Option(names = {"--json"},
        description = "Print JSON instead of text")
    private boolean json = false;

    @CommandLine.Option(names = {"--monotonic"},
        description = "Only accept coordinates whose values are strictly monotonic")
    private boolean monotonic = false;

    @Override
    public Integer call() {
        try (RawVariableStore store = VariableStores.open(file)) {
            CfReader reader = new CfReader(store, CfReaderOptions.DEFAULTS.withCheckMonotonic(monotonic));
            CfGroup group = reader.cfGroup();
            if (variableName == null) {
                printDataset(group);
            } else {
                printVariable(group, lookup(group, variableName, promoted));
            }
            return 0;
        } catch (CfVariableNotFoundException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.error("Error inspecting " + file, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printDataset(CfGroup group) {
        if (json) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("file", file.toString());
            out.put("globalAttributes", group.globalAttributes());
            out.put("sections", CfGroupSummary.sections(group));
            Map<String, Object> variables = new LinkedHashMap<>();
            for (CfVariable variable : group) {
                variables.put(variable.name(), describe(variable));
            }
            out.put("variables", variables);
            Map<String, Object> promoted = new LinkedHashMap<>();
            group.promoted().forEach((name, variable) -> promoted.put(name, describe(variable)));
            out.put("promoted", promoted);
            System.out.println(gson.toJson(out));
            return;
        }
        System.out.println(file);
        System.out.println(group);
    }

    private void printVariable(CfGroup group, CfVariable variable) {
        if (json) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("name", variable.name());
            out.putAll(describe(variable));
            System.out.println(gson.toJson(out));
            return;
        }
        System.out.printf("%s%s %s%s%n", variable.name(), variable.dimensions(), variable.type(),
            variable.isPromoted() ? " (promoted)" : "");
        System.out.printf("  Categories: %s%n", variable.categories());
        if (!variable.formulaTermsByRoot().isEmpty()) {
            System.out.printf("  Formula terms: %s%n", variable.formulaTermsByRoot());
        }
        variable.cellMeasure().ifPresent(measure -> System.out.printf("  Cell measure: %s%n", measure));

        Set<String> reserved = new HashSet<>();
        for (CfAttribute attribute : variable.cfAttrsIgnored()) {
            reserved.add(attribute.name());
        }
        System.out.println("  Attributes:");
        for (CfAttribute attribute : variable.cfAttrs()) {
            System.out.printf("   %s %s = %s%n", reserved.contains(attribute.name()) ? "*" : " ",
                attribute.name(), attribute.value());
        }
        System.out.println("  cf_group: " + variable.cfGroup().toString().replace(System.lineSeparator(), System.lineSeparator() + "  "));
    }

    static CfVariable lookup(CfGroup group, String name, boolean promoted) {
        if (promoted) {
            return Optional.ofNullable(group.promoted().get(name))
                .orElseThrow(() -> new CfVariableNotFoundException(name, group.promoted().size()));
        }
        return group.find(name)
            .orElseThrow(() -> new CfVariableNotFoundException(name, group.size()));
    }

    private static Map<String, Object> describe(CfVariable variable) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("dimensions", variable.dimensions());
        out.put("shape", variable.shape());
        out.put("type", variable.type().name());
        List<String> categories = new ArrayList<>();
        variable.categories().forEach(category -> categories.add(category.name()));
        out.put("categories", categories);
        out.put("promoted", variable.isPromoted());
        out.put("cfGroup", new ArrayList<>(variable.cfGroupNames()));
        if (!variable.formulaTermsByRoot().isEmpty()) {
            out.put("formulaTerms", variable.formulaTermsByRoot());
        }
        variable.cellMeasure().ifPresent(measure -> out.put("cellMeasure", measure));
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (CfAttribute attribute : variable.cfAttrs()) {
            attributes.put(attribute.name(), attribute.value());
        }
        out.put("attributes", attributes);
        return out;
    }
}
