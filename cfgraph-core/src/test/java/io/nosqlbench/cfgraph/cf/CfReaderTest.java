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

import io.nosqlbench.cfgraph.api.store.AttributeMissingException;
import io.nosqlbench.cfgraph.api.store.InMemoryVariableStore;
import io.nosqlbench.cfgraph.api.store.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CfReaderTest {

    private CfGroup group;

    @BeforeEach
    void readRotatedPole() {
        group = new CfReader(CfTestDatasets.rotatedPolePrecipitation()).cfGroup();
    }

    @Test
    void testCategoryViews() {
        assertThat(group.size()).isEqualTo(8);
        assertThat(group.dataVariables().keySet()).containsExactly("pr");
        assertThat(group.coordinates().keySet()).containsExactly("time", "rlat", "rlon");
        assertThat(group.auxiliaryCoordinates().keySet()).containsExactlyInAnyOrder("lat", "lon");
        assertThat(group.bounds().keySet()).containsExactly("time_bnds");
        assertThat(group.gridMappings().keySet()).containsExactly("rotated_pole");
        assertThat(group.cellMeasures()).isEmpty();
        assertThat(group.labels()).isEmpty();
        assertThat(group.ancillaryVariables()).isEmpty();
        assertThat(group.climatology()).isEmpty();
        assertThat(group.formulaTerms()).isEmpty();
        assertThat(group.promoted()).isEmpty();
    }

    @Test
    void testViewsAreStable() {
        assertEquals(group.auxiliaryCoordinates(), group.auxiliaryCoordinates());
        assertThat(group.auxiliaryCoordinates().get("lat")).isSameAs(group.get("lat"));
        assertThatThrownBy(() -> group.dataVariables().put("x", group.get("pr")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testDataVariableGroup() {
        CfVariable pr = group.get("pr");
        assertThat(pr.cfGroupNames())
            .containsExactlyInAnyOrder("lat", "lon", "rlat", "rlon", "rotated_pole", "time");

        CfGroup local = pr.cfGroup();
        assertThat(local.auxiliaryCoordinates().keySet()).containsExactlyInAnyOrder("lat", "lon");
        assertThat(local.coordinates().keySet()).containsExactlyInAnyOrder("rlat", "rlon", "time");
        assertThat(local.gridMappings().keySet()).containsExactly("rotated_pole");
        assertThat(local.bounds()).isEmpty();
        assertThat(local.globalAttributes()).hasSize(6);
        assertThat(local.globalAttributes().get("institution")).isEqualTo("Met Office");
        assertThat(local.get("lat")).isSameAs(group.get("lat"));
    }

    @Test
    void testNeighbourhoodsOfOtherVariables() {
        assertThat(group.get("time").cfGroupNames()).containsExactly("time_bnds");
        assertThat(group.get("time_bnds").cfGroupNames()).containsExactly("time");
        assertThat(group.get("lat").cfGroupNames()).containsExactly("pr");
        assertThat(group.get("rotated_pole").cfGroupNames()).containsExactly("pr");
        // dimension coordinates do not point back at the data variables using them
        assertThat(group.get("rlat").cfGroupNames()).isEmpty();
        assertThat(group.get("lat").cfGroup().globalAttributes()).isEmpty();
        assertThat(group.get("time").cfGroup().bounds().keySet()).containsExactly("time_bnds");
    }

    @Test
    void testAttributeTracking() {
        CfVariable lat = group.get("lat");
        assertThat(lat.cfAttrs()).extracting(CfAttribute::name)
            .containsExactly("long_name", "standard_name", "units");
        assertThat(lat.cfAttrsUsed()).isEmpty();
        assertThat(lat.cfAttrsUnused()).hasSize(3);

        assertEquals("degrees_north", lat.attribute("units"));
        assertThat(lat.cfAttrsUsed()).containsExactly(new CfAttribute("units", "degrees_north"));
        assertThat(lat.cfAttrsUnused()).extracting(CfAttribute::name)
            .containsExactly("long_name", "standard_name");

        lat.cfAttrsReset();
        assertThat(lat.cfAttrsUsed()).isEmpty();
        assertThat(lat.cfAttrsUnused()).hasSize(3);
        assertThat(lat.is(CfCategory.AUXILIARY_COORDINATE)).isTrue();
    }

    @Test
    void testReferenceAttributesStartUnused() {
        CfVariable pr = group.get("pr");
        assertThat(pr.cfAttrsUnused()).extracting(CfAttribute::name).contains("coordinates", "grid_mapping");
        assertThat(pr.cfAttrsIgnored()).extracting(CfAttribute::name)
            .containsExactly("cell_methods", "coordinates", "grid_mapping", "standard_name", "units");
    }

    @Test
    void testMissingAttribute() {
        CfVariable lat = group.get("lat");
        assertThat(lat.findAttribute("axis")).isEmpty();
        assertThat(lat.hasAttribute("units")).isTrue();
        assertThatThrownBy(() -> lat.attribute("axis"))
            .isInstanceOf(AttributeMissingException.class)
            .hasMessageContaining("axis");
        assertThat(lat.cfAttrsUsed()).isEmpty();
    }

    @Test
    void testMissingVariable() {
        assertThatThrownBy(() -> group.get("nope"))
            .isInstanceOf(CfVariableNotFoundException.class)
            .hasMessageContaining("nope");
        assertThat(group.find("nope")).isEmpty();
        assertThat(group.contains("pr")).isTrue();
    }

    @Test
    void testVariableShape() {
        CfVariable pr = group.get("pr");
        assertThat(pr.dimensions()).containsExactly("time", "rlat", "rlon");
        assertThat(pr.shape()).containsExactly(4, 3, 2);
        assertThat(pr.ndim()).isEqualTo(3);
        assertThat(pr.type()).isEqualTo(VariableType.NUMERIC);
        assertThat(group.get("rotated_pole").ndim()).isZero();
        assertThat((double[]) group.get("rlat").data()).containsExactly(-1.0, 0.0, 1.0);
    }

    @Test
    void testClimatology() {
        CfGroup river = new CfReader(CfTestDatasets.riverClimatology()).cfGroup();
        assertThat(river.climatology().keySet()).containsExactly("climatology_bounds");
        assertThat(river.coordinates().keySet()).containsExactly("time");
        assertThat(river.labels().keySet()).containsExactly("georegion");
        assertThat(river.dataVariables().keySet()).containsExactly("temperature");
        assertThat(river.get("time").cfGroup().climatology().keySet()).containsExactly("climatology_bounds");
        assertThat(river.get("temperature").cfGroupNames()).containsExactlyInAnyOrder("georegion", "time");
        assertThat(river.get("climatology_bounds").cfGroupNames()).containsExactly("time");
        assertArrayEquals(new int[]{1, 2}, river.get("climatology_bounds").shape());
        assertThat(river.get("climatology_bounds").dimensions()).containsExactly("time", "nv");
    }

    @Test
    void testMonotonicCheck() {
        InMemoryVariableStore store = InMemoryVariableStore.builder()
            .dimension("depth", 3)
            .variable("depth", VariableType.NUMERIC, "depth").data(5.0, 1.0, 10.0).done()
            .variable("salinity", VariableType.NUMERIC, "depth").done()
            .build();

        CfGroup lenient = new CfReader(store).cfGroup();
        assertThat(lenient.coordinates().keySet()).containsExactly("depth");

        CfReader strict = new CfReader(store, CfReaderOptions.DEFAULTS.withCheckMonotonic(true));
        assertTrue(strict.options().checkMonotonic());
        assertThat(strict.cfGroup().coordinates()).isEmpty();
        assertThat(strict.cfGroup().dataVariables().keySet()).containsExactly("depth", "salinity");
    }

    @Test
    void testTextVariableNamedAfterDimensionIsNotCoordinate() {
        InMemoryVariableStore store = InMemoryVariableStore.builder()
            .dimension("station", 2)
            .variable("station", VariableType.STRING, "station").text("a", "b").done()
            .build();
        CfGroup stations = new CfReader(store).cfGroup();
        assertThat(stations.coordinates()).isEmpty();
        assertThat(stations.dataVariables().keySet()).containsExactly("station");
    }

    @Test
    void testEmptyDataset() {
        CfGroup empty = new CfReader(InMemoryVariableStore.builder().build()).cfGroup();
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.toString()).isEqualTo("<CfGroup of 0 variables>");
    }

    @Test
    void testSummary() {
        String expected = String.join(System.lineSeparator(),
            "<CfGroup of 8 variables, 6 global attributes>",
            "    Data variables: pr",
            "    Coordinates: time, rlat, rlon",
            "    Auxiliary coordinates: lat, lon",
            "    Bounds: time_bnds",
            "    Grid mappings: rotated_pole");
        assertEquals(expected, group.toString());
        assertThat(CfGroupSummary.sections(group).get("Coordinates")).isEqualTo(List.of("time", "rlat", "rlon"));
    }
}
