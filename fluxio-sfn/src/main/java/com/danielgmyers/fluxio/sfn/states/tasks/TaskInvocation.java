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

package com.danielgmyers.fluxio.sfn.states.tasks;

import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.options.ResolvedOptions;
import com.danielgmyers.fluxio.sfn.definitions.StateMachineDefinition;
import com.danielgmyers.fluxio.sfn.definitions.TaskDefinition;

/**
 * Everything known about one call site of a work unit or nested state machine.
 */
public final class TaskInvocation {

    public static final String KEY_OPTION = "key";
    public static final String TIMEOUT_OPTION = "timeout";

    private final Statement node;
    private final String definitionName;
    private final TaskDefinition definition;
    private final ResolvedOptions options;
    private final String inputPath;
    private final String resultPath;
    private final StateMachineDefinition owner;

    /**
     * @param node           The statement containing the call.
     * @param definitionName The called work unit class or state machine function.
     * @param definition     The called work unit, or null when a state machine is called.
     * @param options        The resolved call options; must contain at least key and timeout.
     * @param inputPath      The input data path passed to the task.
     * @param resultPath     Where the task's result is written, or null to discard it.
     * @param owner          The state machine containing the call.
     */
    public TaskInvocation(Statement node, String definitionName, TaskDefinition definition, ResolvedOptions options,
                          String inputPath, String resultPath, StateMachineDefinition owner) {
        this.node = node;
        this.definitionName = definitionName;
        this.definition = definition;
        this.options = options;
        this.inputPath = inputPath;
        this.resultPath = resultPath;
        this.owner = owner;
    }

    public String getKey() {
        return options.getString(KEY_OPTION);
    }

    public Statement getNode() {
        return node;
    }

    public String getDefinitionName() {
        return definitionName;
    }

    public TaskDefinition getDefinition() {
        return definition;
    }

    public ResolvedOptions getOptions() {
        return options;
    }

    public String getInputPath() {
        return inputPath;
    }

    public String getResultPath() {
        return resultPath;
    }

    public StateMachineDefinition getOwner() {
        return owner;
    }

    public long getTimeoutSeconds() {
        return options.getLong(TIMEOUT_OPTION);
    }
}
