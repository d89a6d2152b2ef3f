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

/// Thrown when an attribute is requested that is not declared on a variable, or on the dataset
/// itself when [#getVariableName()] is null.
public class AttributeMissingException extends RuntimeException {

    private final String variableName;
    private final String attributeName;

    public AttributeMissingException(String variableName, String attributeName) {
        super(variableName == null
            ? String.format("Global attribute '%s' is not declared on this dataset", attributeName)
            : String.format("Attribute '%s' is not declared on variable '%s'", attributeName, variableName));
        this.variableName = variableName;
        this.attributeName = attributeName;
    }

    public String getVariableName() {
        return variableName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
