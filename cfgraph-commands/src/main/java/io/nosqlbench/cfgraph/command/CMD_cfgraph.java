package io.nosqlbench.cfgraph.command;

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

import io.nosqlbench.cfgraph.command.subcommands.CMD_cfgraph_inspect;
import io.nosqlbench.cfgraph.command.subcommands.CMD_cfgraph_labels;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Command line tools for looking at the CF relationships within a dataset.
///
/// This is the top level command which serves as an entry point for all sub-commands.
@CommandLine.Command(name = "cfgraph",
    header = "Inspect CF metadata relationships",
    description = "Classifies the variables of a netCDF-4 / HDF5 file or a YAML dataset descriptor "
        + "and shows how they are related according to the CF conventions",
    mixinStandardHelpOptions = true,
    subcommands = {
        CommandLine.HelpCommand.class,
        CMD_cfgraph_inspect.class,
        CMD_cfgraph_labels.class
    })
public class CMD_cfgraph implements Callable<Integer> {

    /// Run cfgraph
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_cfgraph()).execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
