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

package com.danielgmyers.fluxio.sfn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.sfn.definitions.EventProcessorDefinition;
import com.danielgmyers.fluxio.sfn.definitions.StateMachineDefinition;
import com.danielgmyers.fluxio.sfn.definitions.TaskDefinition;

/**
 * The result of compiling one script. All maps are ordered by declaration.
 */
public class CompiledScript {

    private final Map<String, TaskDefinition> taskDefinitions;
    private final Map<String, EventProcessorDefinition> eventProcessors;
    private final Map<String, StateMachineDefinition> stateMachines;
    private final boolean prettyPrint;

    public CompiledScript(Map<String, TaskDefinition> taskDefinitions,
                          Map<String, EventProcessorDefinition> eventProcessors,
                          Map<String, StateMachineDefinition> stateMachines, boolean prettyPrint) {
        this.taskDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(taskDefinitions));
        this.eventProcessors = Collections.unmodifiableMap(new LinkedHashMap<>(eventProcessors));
        this.stateMachines = Collections.unmodifiableMap(new LinkedHashMap<>(stateMachines));
        this.prettyPrint = prettyPrint;
    }

    public Map<String, TaskDefinition> getTaskDefinitions() {
        return taskDefinitions;
    }

    public Map<String, EventProcessorDefinition> getEventProcessors() {
        return eventProcessors;
    }

    /**
     * Every state machine function, including demoted map iterators and parallel branches.
     */
    public Map<String, StateMachineDefinition> getStateMachines() {
        return stateMachines;
    }

    /**
     * @throws IllegalArgumentException if the script declares no state machine with that name
     */
    public StateMachineDefinition getStateMachine(String name) {
        StateMachineDefinition definition = stateMachines.get(name);
        if (definition == null) {
            throw new IllegalArgumentException(String.format("Unknown state machine %s. Declared state machines: %s",
                                                             name, String.join(", ", stateMachines.keySet())));
        }
        return definition;
    }

    /**
     * The state machines deployed on their own, i.e. those not embedded as a map iterator or parallel branch.
     */
    public List<StateMachineDefinition> getFirstClassStateMachines() {
        List<StateMachineDefinition> result = new ArrayList<>();
        for (StateMachineDefinition definition : stateMachines.values()) {
            if (definition.isFirstClass()) {
                result.add(definition);
            }
        }
        return result;
    }

    public Map<String, Object> toDocument(String name) {
        return getStateMachine(name).toDocument();
    }

    public String toJson(String name) {
        return StateMachineDocuments.toJson(toDocument(name), prettyPrint);
    }
}
