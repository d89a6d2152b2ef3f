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

/// Thrown when category bookkeeping is internally inconsistent, for example a variable that
/// ended classification without any role, or a role with no summary section.
///
/// This signals a defect in classification rather than a problem with the dataset, and is
/// never downgraded to a warning.
public class CfClassificationException extends RuntimeException {

    public CfClassificationException(String message) {
        super(message);
    }
}
