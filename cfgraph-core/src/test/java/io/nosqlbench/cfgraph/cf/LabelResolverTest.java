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

import io.nosqlbench.cfgraph.api.store.InMemoryVariableStore;
import io.nosqlbench.cfgraph.api.store.VariableType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Label attachment and the alignment of label strings with the data variables they label.
public class LabelResolverTest {

    @Test
    void testCharacterRegionLabels() {
        CfGroup group = new CfReader(CfTestDatasets.riverClimatology()).cfGroup();
        CfVariable temperature = group.get("temperature");
        CfVariable georegion = temperature.cfGroup().labels().get("georegion");

        assertThat(georegion.cfLabelDimensions(temperature)).containsExactly("georegion");
        assertThat(georegion.cfLabelData(temperature)).containsExactly("Anglian", "Thames", "Severn");
        assertThat(georegion.cfGroupNames()).containsExactly("temperature");
    }

    @Test
    void testScalarLabels() {
        CfGroup group = new CfReader(CfTestDatasets.ensembleLabels()).cfGroup();
        CfVariable tas = group.get("tas");
        assertThat(tas.cfGroup().labels().keySet())
            .containsExactlyInAnyOrder("experiment_id", "institution", "source");

        CfVariable experiment = group.get("experiment_id");
        assertThat(experiment.cfLabelDimensions(tas)).isEmpty();
        assertThat(experiment.cfLabelData(tas)).containsExactly("2005");
        assertThat(group.get("institution").cfLabelData(tas)).containsExactly("ECMWF");
        assertThat(group.get("source").cfLabelData(tas))
            .containsExactly("IFS33R1/HOPE-E, Sys 1, Met 1, ENSEMBLES");
    }

    @Test
    void testStringDimensionFirst() {
        String[] names = {"north", "south", "east"};
        char[] chars = new char[5 * 3];
        for (int k = 0; k < 5; k++) {
            for (int r = 0; r < 3; r++) {
                chars[k * 3 + r] = k < names[r].length() ? names[r].charAt(k) : '\0';
            }
        }
        InMemoryVariableStore store = InMemoryVariableStore.builder()
            .dimension("strlen", 5)
            .dimension("region", 3)
            .dimension("time", 2)
            .variable("region_name", VariableType.CHAR, "strlen", "region").chars(chars).done()
            .variable("flow", VariableType.NUMERIC, "time", "region")
              .attribute("coordinates", "region_name")
              .done()
            .build();

        CfGroup group = new CfReader(store).cfGroup();
        CfVariable flow = group.get("flow");
        CfVariable label = group.get("region_name");
        assertThat(flow.cfGroupNames()).containsExactly("region_name");
        assertThat(label.cfLabelDimensions(flow)).containsExactly("region");
        assertThat(label.cfLabelData(flow)).containsExactly("north", "south", "east");
    }

    @Test
    void testStringLabelFollowsDataDimensionOrder() {
        InMemoryVariableStore store = InMemoryVariableStore.builder()
            .dimension("model", 2)
            .dimension("region", 3)
            .dimension("time", 4)
            .variable("run_id", VariableType.STRING, "model", "region")
              .text("a0", "a1", "a2", "b0", "b1", "b2")
              .done()
            .variable("swapped", VariableType.NUMERIC, "time", "region", "model")
              .attribute("coordinates", "run_id")
              .done()
            .variable("stored", VariableType.NUMERIC, "model", "region")
              .attribute("coordinates", "run_id")
              .done()
            .build();

        CfGroup group = new CfReader(store).cfGroup();
        CfVariable runId = group.get("run_id");
        CfVariable swapped = group.get("swapped");
        CfVariable stored = group.get("stored");

        assertThat(runId.is(CfCategory.LABEL)).isTrue();
        assertThat(runId.cfGroupNames()).containsExactlyInAnyOrder("swapped", "stored");
        assertThat(runId.cfLabelDimensions(swapped)).containsExactly("region", "model");
        assertThat(runId.cfLabelData(swapped)).containsExactly("a0", "b0", "a1", "b1", "a2", "b2");
        assertThat(runId.cfLabelDimensions(stored)).containsExactly("model", "region");
        assertThat(runId.cfLabelData(stored)).containsExactly("a0", "a1", "a2", "b0", "b1", "b2");
    }

    @Test
    void testLabelQueriesRejectWrongRoles() {
        CfGroup group = new CfReader(CfTestDatasets.riverClimatology()).cfGroup();
        CfVariable temperature = group.get("temperature");
        CfVariable georegion = group.get("georegion");

        assertThatThrownBy(() -> temperature.cfLabelData(temperature))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("temperature");
        assertThatThrownBy(() -> georegion.cfLabelDimensions(group.get("time")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("time");
    }

    @Test
    void testAmbiguousStringDimension() {
        InMemoryVariableStore store = InMemoryVariableStore.builder()
            .dimension("station", 2)
            .dimension("strlen", 4)
            .dimension("time", 3)
            .variable("station_name", VariableType.CHAR, "station", "strlen").text("abc", "xyz").done()
            .variable("obs", VariableType.NUMERIC, "time", "station")
              .attribute("coordinates", "station_name")
              .done()
            .variable("clock", VariableType.NUMERIC, "time").done()
            .build();

        CfGroup group = new CfReader(store).cfGroup();
        CfVariable label = group.get("station_name");
        assertThat(label.cfLabelData(group.get("obs"))).isEqualTo(List.of("abc", "xyz"));
        assertThatThrownBy(() -> label.cfLabelData(group.get("clock")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("station_name");
    }

    @Test
    void testSpanRule() {
        InMemoryVariableStore store = InMemoryVariableStore.builder()
            .dimension("station", 2)
            .dimension("strlen", 4)
            .dimension("time", 3)
            .variable("station_name", VariableType.CHAR, "station", "strlen").done()
            .variable("station_code", VariableType.STRING, "station").done()
            .variable("obs", VariableType.NUMERIC, "time", "station").done()
            .variable("clock", VariableType.NUMERIC, "time").done()
            .build();
        CfGroup group = new CfReader(store).cfGroup();

        assertThat(LabelResolver.spans(group.get("station_name"), group.get("obs"))).isTrue();
        assertThat(LabelResolver.spans(group.get("station_name"), group.get("clock"))).isFalse();
        assertThat(LabelResolver.spans(group.get("station_code"), group.get("obs"))).isTrue();
        assertThat(LabelResolver.spans(group.get("station_code"), group.get("clock"))).isFalse();
    }
}
