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

/// Thrown when a [CfGroup] is asked directly for a variable it does not contain.
///
/// Dangling names met while resolving attribute references never raise this; they are dropped.
public class CfVariableNotFoundException extends RuntimeException {

    private final String variableName;

    public CfVariableNotFoundException(String variableName, int groupSize) {
        super(String.format("Variable '%s' not found in a group of %d variables", variableName, groupSize));
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
