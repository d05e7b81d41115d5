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

package com.danielgmyers.fluxio.sfn.visitors;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.ast.Call;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.CallableOption;
import com.danielgmyers.fluxio.options.OptionSchema;
import com.danielgmyers.fluxio.options.ResolvedOptions;
import com.danielgmyers.fluxio.options.ValueShape;
import com.danielgmyers.fluxio.sfn.definitions.WorkflowDecorators;

/**
 * The decorators that configure a state machine function's deployment.
 */
public final class ResourceDecorators {

    public static final String SCHEDULE = "schedule";
    public static final String EXPORT = "export";
    public static final String SUBSCRIBE = "subscribe";
    public static final String PROCESS_EVENTS = "process_events";

    public static final String EXPRESSION = "expression";
    public static final String ENABLED = "enabled";
    public static final String TOPIC_ARN_IMPORT_VALUE = "topic_arn_import_value";
    public static final String PROJECT = "project";
    public static final String STATE_MACHINE = "state_machine";
    public static final String STATUS = "status";
    public static final String PROCESSOR = "processor";

    private static final Map<String, OptionSchema> SCHEMAS = new LinkedHashMap<>();
    private static final Map<String, Integer> MAX_COUNTS = new LinkedHashMap<>();

    static {
        SCHEMAS.put(SCHEDULE, new OptionSchema()
                .add(EXPRESSION, CallableOption.builder("string", ValueShape.STRING).required().build()));
        MAX_COUNTS.put(SCHEDULE, 1);

        SCHEMAS.put(EXPORT, new OptionSchema()
                .add(ENABLED, CallableOption.builder("boolean", ValueShape.BOOLEAN).defaultValue(true).build()));
        MAX_COUNTS.put(EXPORT, 1);

        SCHEMAS.put(SUBSCRIBE, new OptionSchema()
                .add(TOPIC_ARN_IMPORT_VALUE, CallableOption.builder("string", ValueShape.STRING).build())
                .add(PROJECT, CallableOption.builder("string", ValueShape.STRING).build())
                .add(STATE_MACHINE, CallableOption.builder("string", ValueShape.STRING).defaultValue("main").build())
                .add(STATUS, CallableOption.builder("string", ValueShape.STRING)
                                           .defaultValue("success")
                                           .allowedValues("success", "failure").build()));

        SCHEMAS.put(PROCESS_EVENTS, new OptionSchema()
                .add(PROCESSOR, CallableOption.builder("class name", ValueShape.NAME).build()));
        MAX_COUNTS.put(PROCESS_EVENTS, 1);
    }

    private ResourceDecorators() {}

    /**
     * Resolves the decorators of a state machine function, in the order they are declared.
     *
     * @param eventProcessors The event processor classes a {@code @process_events} decorator may name.
     */
    public static WorkflowDecorators resolve(FunctionDef function, Set<String> eventProcessors) {
        Map<String, List<ResolvedOptions>> resolved = new LinkedHashMap<>();
        for (Expression decorator : function.getDecorators()) {
            String name = decorator instanceof Call ? ((Call)decorator).getFuncName() : null;
            if (name == null || !SCHEMAS.containsKey(name)) {
                throw new WorkflowGraphBuildException(
                        String.format("Supported resource decorators include: %s", String.join(", ", SCHEMAS.keySet())),
                        decorator);
            }
            Call call = (Call)decorator;
            if (!call.getArgs().isEmpty()) {
                throw new WorkflowGraphBuildException(
                        String.format("The @%s decorator only accepts keyword arguments", name), decorator);
            }
            ResolvedOptions options = SCHEMAS.get(name).resolve(call.getKeywords(), decorator);
            validate(name, options, eventProcessors);

            List<ResolvedOptions> occurrences = resolved.computeIfAbsent(name, k -> new ArrayList<>());
            occurrences.add(options);
            Integer maxCount = MAX_COUNTS.get(name);
            if (maxCount != null && occurrences.size() > maxCount) {
                throw new WorkflowGraphBuildException(
                        String.format("Only %d @%s decorators can be applied to a state machine function",
                                      maxCount, name), function);
            }
        }

        return new WorkflowDecorators(first(resolved, SCHEDULE), first(resolved, EXPORT),
                                      resolved.getOrDefault(SUBSCRIBE, new ArrayList<>()),
                                      first(resolved, PROCESS_EVENTS));
    }

    private static ResolvedOptions first(Map<String, List<ResolvedOptions>> resolved, String name) {
        List<ResolvedOptions> occurrences = resolved.get(name);
        return occurrences == null ? null : occurrences.get(0);
    }

    private static void validate(String name, ResolvedOptions options, Set<String> eventProcessors) {
        if (SUBSCRIBE.equals(name)
                && options.get(TOPIC_ARN_IMPORT_VALUE) == null && options.get(PROJECT) == null) {
            throw new WorkflowGraphBuildException(
                    String.format("The @%s decorator requires either %s or %s", SUBSCRIBE, TOPIC_ARN_IMPORT_VALUE,
                                  PROJECT), options.getNode());
        }
        if (PROCESS_EVENTS.equals(name)) {
            String processor = options.getString(PROCESSOR);
            if (processor != null && !eventProcessors.contains(processor)) {
                throw new WorkflowGraphBuildException(
                        String.format("Unknown event processor %s. Declared event processors: %s", processor,
                                      String.join(", ", eventProcessors)), options.getNode());
            }
        }
    }
}
