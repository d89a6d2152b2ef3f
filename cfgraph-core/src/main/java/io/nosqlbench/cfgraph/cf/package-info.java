/// CF relationship resolution.
///
/// [io.nosqlbench.cfgraph.cf.CfReader] classifies the variables of a
/// [io.nosqlbench.cfgraph.api.store.RawVariableStore] into CF roles and resolves the
/// name-valued attributes between them into per-variable neighbourhoods, exposed through
/// [io.nosqlbench.cfgraph.cf.CfGroup] views. Every variable audits which of its attributes have
/// been read, so that loaders can report attributes they never consumed.
///
/// ```java
/// CfGroup group = new CfReader(store).cfGroup();
/// CfVariable pr = group.get("pr");
/// pr.cfGroup().auxiliaryCoordinates().keySet(); // [lon, lat]
/// pr.cfAttrsUnused();
/// ```
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

