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

package com.danielgmyers.fluxio.sfn.definitions;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.states.tasks.TaskServiceRegistry;

/**
 * Read-only view of everything declared at the top level of a script. Graph builders resolve names through it;
 * it is fully populated before the first builder runs.
 */
public final class ScriptDeclarations {

    private final Map<String, TaskDefinition> tasks;
    private final Map<String, StateMachineDefinition> stateMachines;
    private final TaskServiceRegistry serviceRegistry;

    public ScriptDeclarations(Map<String, TaskDefinition> tasks, Map<String, StateMachineDefinition> stateMachines,
                              TaskServiceRegistry serviceRegistry) {
        this.tasks = Collections.unmodifiableMap(tasks);
        this.stateMachines = Collections.unmodifiableMap(stateMachines);
        this.serviceRegistry = serviceRegistry;
    }

    public TaskDefinition getTask(String name) {
        return tasks.get(name);
    }

    public boolean isTask(String name) {
        return name != null && tasks.containsKey(name);
    }

    public StateMachineDefinition getStateMachine(String name) {
        return stateMachines.get(name);
    }

    public boolean isStateMachine(String name) {
        return name != null && stateMachines.containsKey(name);
    }

    public Set<String> getStateMachineNames() {
        return stateMachines.keySet();
    }

    public TaskServiceRegistry getServiceRegistry() {
        return serviceRegistry;
    }
}
