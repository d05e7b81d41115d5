/*
 *   Copyright Flux Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package com.danielgmyers.fluxio.options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.Node;

/**
 * The validated, fully-defaulted result of resolving an {@link OptionSchema}.
 * Remembers the node the options came from so that later validation can point at it.
 */
public final class ResolvedOptions {

    private final Map<String, Object> values;
    private final Node node;

    public ResolvedOptions(Map<String, Object> values, Node node) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.node = node;
    }

    public Node getNode() {
        return node;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        return (String)values.get(name);
    }

    public Long getLong(String name) {
        Object value = values.get(name);
        return value == null ? null : ((Number)value).longValue();
    }

    public Number getNumber(String name) {
        return (Number)values.get(name);
    }

    public Boolean getBoolean(String name) {
        return (Boolean)values.get(name);
    }

    /**
     * Returns a dict-valued option, or null if it has no value.
     *
     * @throws IllegalStateException if the value is not a dict with string keys.
     */
    public Map<String, Object> getMap(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new IllegalStateException(String.format("Option %s is not a dict: %s", name, value));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new IllegalStateException(String.format("Option %s has a non-string key: %s",
                                                              name, entry.getKey()));
            }
            result.put((String)entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Returns a list-valued option whose elements are all strings, or null if it has no value.
     *
     * @throws IllegalStateException if the value is not a list of strings.
     */
    public List<String> getStringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new IllegalStateException(String.format("Option %s is not a list: %s", name, value));
        }
        List<String> result = new ArrayList<>();
        for (Object element : (List<?>)value) {
            if (!(element instanceof String)) {
                throw new IllegalStateException(String.format("Option %s has a non-string element: %s",
                                                              name, element));
            }
            result.add((String)element);
        }
        return result;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
