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

/// Thrown when a dataset file is readable but does not describe a valid set of variables.
public class StoreFormatException extends RuntimeException {

    private final String source;

    public StoreFormatException(String source, String message) {
        super(String.format("%s: %s", source, message));
        this.source = source;
    }

    public StoreFormatException(String source, String message, Throwable cause) {
        super(String.format("%s: %s", source, message), cause);
        this.source = source;
    }

    /// @return the file or resource the problem was found in
    public String getSource() {
        return source;
    }
}
