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

/// Thrown by a [RawVariableStore] when asked about a variable it does not hold.
public class VariableMissingException extends RuntimeException {

    private final String variableName;

    public VariableMissingException(String variableName) {
        super(String.format("Variable '%s' does not exist in this store", variableName));
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
