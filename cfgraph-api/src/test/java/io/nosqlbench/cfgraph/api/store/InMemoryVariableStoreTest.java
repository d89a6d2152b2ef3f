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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class InMemoryVariableStoreTest {

    private static InMemoryVariableStore sample() {
        return InMemoryVariableStore.builder()
            .globalAttribute("Conventions", "CF-1.7")
            .globalAttribute("history", new char[]{'a', 'b', '\0', '\0'})
            .dimension("time", 3)
            .dimension("nv", 2)
            .dimension("strlen", 4)
            .variable("time", VariableType.NUMERIC, "time")
              .attribute("bounds", "time_bnds")
              .attribute("valid_range", new double[]{0.0, 10.0})
              .data(0.0, 1.0, 2.0)
              .done()
            .variable("time_bnds", VariableType.NUMERIC, "time", "nv").done()
            .variable("name", VariableType.CHAR, "time", "strlen").text("ab", "cde", "f").done()
            .variable("code", VariableType.STRING, "time").text("x", "y", "z").done()
            .build();
    }

    @Test
    void testStructure() {
        InMemoryVariableStore store = sample();
        assertThat(store.variables()).containsExactly("time", "time_bnds", "name", "code");
        assertThat(store.dimensions("time_bnds")).containsExactly("time", "nv");
        assertArrayEquals(new int[]{3, 2}, store.shape("time_bnds"));
        assertEquals(VariableType.CHAR, store.variableType("name"));
        assertThat(store.globalAttributeNames()).containsExactly("Conventions", "history");
    }

    @Test
    void testAttributes() {
        InMemoryVariableStore store = sample();
        assertThat(store.attributeNames("time")).containsExactlyInAnyOrder("bounds", "valid_range");
        assertEquals("time_bnds", store.attributeValue("time", "bounds"));
        assertEquals(List.of(0.0, 10.0), store.attributeValue("time", "valid_range"));
        assertEquals("ab", store.globalAttributeValue("history"));

        assertThatThrownBy(() -> store.attributeValue("time", "units"))
            .isInstanceOf(AttributeMissingException.class)
            .hasMessageContaining("units");
        assertThatThrownBy(() -> store.globalAttributeValue("title"))
            .isInstanceOf(AttributeMissingException.class)
            .hasMessageContaining("Global attribute");
        assertThatThrownBy(() -> store.attributeNames("nope"))
            .isInstanceOf(VariableMissingException.class);
    }

    @Test
    void testData() {
        InMemoryVariableStore store = sample();
        assertArrayEquals(new double[]{0.0, 1.0, 2.0}, (double[]) store.readData("time"));
        assertArrayEquals(new double[6], (double[]) store.readData("time_bnds"));
        assertArrayEquals(new String[]{"x", "y", "z"}, (String[]) store.readData("code"));

        char[] chars = (char[]) store.readData("name");
        assertEquals(12, chars.length);
        assertEquals("cde", new String(chars, 4, 3));
        assertEquals('\0', chars[2]);

        ((double[]) store.readData("time"))[0] = 99.0;
        assertEquals(0.0, ((double[]) store.readData("time"))[0]);
    }

    @Test
    void testBuilderValidation() {
        InMemoryVariableStore.Builder builder = InMemoryVariableStore.builder().dimension("x", 2);
        assertThatThrownBy(() -> builder.variable("v", VariableType.NUMERIC, "y"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("undeclared dimension 'y'");
        assertThatThrownBy(() -> builder.variable("v", VariableType.NUMERIC, "x").data(1.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expects 2 values");
        assertThatThrownBy(() -> builder.variable("v", VariableType.NUMERIC, "x").text("a", "b"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.dimension("z", -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.variable("v", VariableType.NUMERIC, "x")
                .attribute("flag_values", new Object[]{1, null}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Attribute 'flag_values' of variable 'v'");
    }

    @Test
    void testVariableTypeNames() {
        assertEquals(VariableType.NUMERIC, VariableType.fromTypeName("float"));
        assertEquals(VariableType.NUMERIC, VariableType.fromTypeName("Int32"));
        assertEquals(VariableType.CHAR, VariableType.fromTypeName("char"));
        assertEquals(VariableType.STRING, VariableType.fromTypeName("string"));
        assertThat(VariableType.CHAR.isText()).isTrue();
        assertThat(VariableType.NUMERIC.isText()).isFalse();
        assertThatThrownBy(() -> VariableType.fromTypeName("complex"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"double", "float", "int", "short", "byte", "uint", "int64", "FLOAT32"})
    void testNumericTypeNames(String typeName) {
        assertEquals(VariableType.NUMERIC, VariableType.fromTypeName(typeName));
    }
}
