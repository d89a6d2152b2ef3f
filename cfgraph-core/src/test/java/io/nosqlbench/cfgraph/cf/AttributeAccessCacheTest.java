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
import io.nosqlbench.cfgraph.api.store.RawVariableStore;
import io.nosqlbench.cfgraph.api.store.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class AttributeAccessCacheTest {

    private CountingStore store;
    private AttributeAccessCache cache;

    @BeforeEach
    void setUp() {
        store = new CountingStore(InMemoryVariableStore.builder()
            .dimension("time", 2)
            .variable("time", VariableType.NUMERIC, "time")
              .attribute("units", "days since 2000-01-01")
              .attribute("calendar", "gregorian")
              .attribute("axis", "T")
              .done()
            .build());
        cache = new AttributeAccessCache(store, "time");
    }

    @Test
    void testDeclaredNamesAreSorted() {
        assertThat(cache.declared()).containsExactly("axis", "calendar", "units");
        assertThat(cache.unused()).containsExactly("axis", "calendar", "units");
        assertThat(cache.used()).isEmpty();
        assertEquals(1, store.nameReads);
    }

    @Test
    void testValuesAreFetchedOnce() {
        assertEquals("T", cache.get("axis"));
        assertEquals("T", cache.get("axis"));
        assertEquals("T", cache.peek("axis"));
        cache.reset();
        assertEquals("T", cache.get("axis"));
        assertEquals(1, store.valueReads);
        assertEquals(1, store.nameReads);
    }

    @Test
    void testUsageTracking() {
        cache.get("units");
        cache.peek("calendar");
        assertThat(cache.find("axis")).contains("T");
        assertThat(cache.find("bounds")).isEmpty();

        assertThat(cache.used()).containsExactly("axis", "units");
        assertThat(cache.unused()).containsExactly("calendar");
        assertEquals(1, store.nameReads);

        cache.reset();
        assertThat(cache.used()).isEmpty();
        assertThat(cache.isDeclared("calendar")).isTrue();
        assertThat(cache.isDeclared("bounds")).isFalse();
    }

    @Test
    void testUndeclaredAttribute() {
        assertThatThrownBy(() -> cache.get("bounds"))
            .isInstanceOf(AttributeMissingException.class)
            .satisfies(e -> {
                AttributeMissingException missing = (AttributeMissingException) e;
                assertEquals("time", missing.getVariableName());
                assertEquals("bounds", missing.getAttributeName());
            });
        assertThat(cache.used()).isEmpty();
        assertEquals(0, store.valueReads);
    }

    /// Delegating store that counts attribute reads.
    private static class CountingStore implements RawVariableStore {
        private final RawVariableStore delegate;
        private int nameReads;
        private int valueReads;

        CountingStore(RawVariableStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<String> variables() {
            return delegate.variables();
        }

        @Override
        public List<String> dimensions(String name) {
            return delegate.dimensions(name);
        }

        @Override
        public int[] shape(String name) {
            return delegate.shape(name);
        }

        @Override
        public Set<String> attributeNames(String name) {
            nameReads++;
            return delegate.attributeNames(name);
        }

        @Override
        public Object attributeValue(String name, String attr) {
            valueReads++;
            return delegate.attributeValue(name, attr);
        }

        @Override
        public Set<String> globalAttributeNames() {
            return delegate.globalAttributeNames();
        }

        @Override
        public Object globalAttributeValue(String attr) {
            return delegate.globalAttributeValue(attr);
        }

        @Override
        public VariableType variableType(String name) {
            return delegate.variableType(name);
        }

        @Override
        public Object readData(String name) {
            return delegate.readData(name);
        }
    }
}
