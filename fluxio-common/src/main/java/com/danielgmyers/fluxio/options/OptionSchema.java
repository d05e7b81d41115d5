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

import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.Keyword;
import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;

/**
 * An ordered, declarative set of options. Resolving the schema against the values found in a script
 * validates them and fills in defaults for everything that was not supplied.
 */
public final class OptionSchema {

    private final Map<String, CallableOption> options;

    public OptionSchema() {
        this.options = new LinkedHashMap<>();
    }

    private OptionSchema(Map<String, CallableOption> options) {
        this.options = new LinkedHashMap<>(options);
    }

    public OptionSchema add(String name, CallableOption option) {
        if (name == null || option == null) {
            throw new IllegalArgumentException("Option name and declaration must not be null.");
        }
        options.put(name, option);
        return this;
    }

    /**
     * Returns a new schema containing this schema's options followed by the given ones.
     */
    public OptionSchema extend(Map<String, CallableOption> additional) {
        OptionSchema extended = new OptionSchema(options);
        additional.forEach(extended::add);
        return extended;
    }

    public Map<String, CallableOption> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    /**
     * Resolves the keyword arguments of a call.
     * @param keywords The supplied keyword arguments.
     * @param node     The node the options belong to, used for diagnostics.
     */
    public ResolvedOptions resolve(List<Keyword> keywords, Node node) {
        Map<String, Expression> supplied = new LinkedHashMap<>();
        for (Keyword keyword : keywords) {
            if (keyword.getArg() == null) {
                throw new WorkflowGraphBuildException("Keyword argument expansion is not supported", keyword);
            }
            if (!options.containsKey(keyword.getArg())) {
                throw new WorkflowGraphBuildException(
                        String.format("Invalid keyword argument %s. Options: %s", keyword.getArg(),
                                      String.join(", ", options.keySet())), keyword);
            }
            supplied.put(keyword.getArg(), keyword.getValue());
        }
        return resolveValues(supplied, node, "option", "the %s option");
    }

    /**
     * Resolves class-level attribute assignments. Names that are not part of the schema are ignored,
     * since classes may define helper constants of their own.
     * @param attributes The assigned values, by attribute name.
     * @param node       The class the attributes belong to, used for diagnostics.
     */
    public ResolvedOptions resolveAttributes(Map<String, Expression> attributes, Node node) {
        Map<String, Expression> supplied = new LinkedHashMap<>();
        attributes.forEach((name, value) -> {
            if (options.containsKey(name)) {
                supplied.put(name, value);
            }
        });
        return resolveValues(supplied, node, "class attribute", "class attribute %s");
    }

    private ResolvedOptions resolveValues(Map<String, Expression> supplied, Node node, String kind,
                                          String subjectFormat) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, CallableOption> entry : options.entrySet()) {
            String name = entry.getKey();
            CallableOption option = entry.getValue();
            Expression value = supplied.get(name);
            if (value == null) {
                if (option.isRequired()) {
                    missing.add(name);
                } else {
                    values.put(name, option.getDefaultValue());
                }
                continue;
            }

            String subject = String.format(subjectFormat, name);
            if (!option.accepts(value)) {
                throw new WorkflowGraphBuildException(
                        String.format("Invalid data type for %s: expected a %s", subject, option.getLabel()), value);
            }
            Object extracted = option.extract(value);
            if (!option.isAllowed(extracted)) {
                throw new WorkflowGraphBuildException(
                        String.format("Allowed values for %s include: %s", subject, option.getAllowedDescription()),
                        value);
            }
            values.put(name, extracted);
        }

        if (!missing.isEmpty()) {
            throw new WorkflowGraphBuildException(
                    String.format("The following %ss are required but were not provided: %s", kind,
                                  String.join(", ", missing)), node);
        }
        return new ResolvedOptions(values, node);
    }
}
