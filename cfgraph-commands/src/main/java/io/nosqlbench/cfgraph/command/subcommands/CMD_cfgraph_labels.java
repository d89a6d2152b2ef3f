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

import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.cf.CfGroup;
import io.nosqlbench.cfgraph.cf.CfReader;
import io.nosqlbench.cfgraph.cf.CfVariable;
import io.nosqlbench.cfgraph.cf.CfVariableNotFoundException;
import io.nosqlbench.cfgraph.stores.VariableStores;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Print the labels of a data variable, aligned with the data variable's dimensions.
///
/// ```bash
/// cfgraph labels rivers.nc --data-variable temperature
/// ```
///
/// prints one line per label variable in the data variable's cf_group:
/// ```
/// georegion [georegion]: Anglian, Thames, Severn
/// ```
@CommandLine.Command(
    name = "labels",
    header = "Show the labels of a data variable",
    description = "Prints every label variable attached to a data variable, with its dimensions and strings.",
    exitCodeList = {
        "0: Success",
        "1: Error reading the dataset, or the variable is not a data variable"
    }
)
public class CMD_cfgraph_labels implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_cfgraph_labels.class);

    @CommandLine.Parameters(index = "0", paramLabel = "FILE",
        description = "The dataset: .nc, .nc4, .h5, .hdf5, .yaml or .yml")
    private Path file;

    @CommandLine.Option(names = {"--data-variable", "-d"}, required = true,
        description = "The data variable whose labels are shown")
    private String dataVariableName;

    @Override
    public Integer call() {
        try (RawVariableStore store = VariableStores.open(file)) {
            CfGroup group = new CfReader(store).cfGroup();
            CfVariable dataVariable = CMD_cfgraph_inspect.lookup(group, dataVariableName, false);
            if (!dataVariable.isDataVariable()) {
                System.err.println("Error: '" + dataVariableName + "' is not a data variable, its roles are "
                    + dataVariable.categories());
                return 1;
            }
            CfGroup local = dataVariable.cfGroup();
            if (local.labels().isEmpty()) {
                System.out.println("No labels for " + dataVariableName);
                return 0;
            }
            for (CfVariable label : local.labels().values()) {
                List<String> dimensions = label.cfLabelDimensions(dataVariable);
                List<String> values = label.cfLabelData(dataVariable);
                System.out.printf("%s %s: %s%n", label.name(), dimensions, String.join(", ", values));
            }
            return 0;
        } catch (CfVariableNotFoundException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.error("Error reading labels from " + file, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
