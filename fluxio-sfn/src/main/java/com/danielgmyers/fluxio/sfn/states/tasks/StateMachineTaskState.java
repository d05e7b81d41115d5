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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.util.ResourceNaming;

/**
 * Starts an execution of another, independently deployed state machine and waits for it to finish.
 */
public class StateMachineTaskState extends TaskState {

    public static final String RESOURCE = "arn:aws:states:::states:startExecution.sync";

    public StateMachineTaskState(TaskInvocation invocation) {
        super(invocation);
    }

    private String getStateMachineVariable() {
        return ResourceNaming.stateMachine(getInvocation().getDefinitionName());
    }

    @Override
    public String getResource() {
        return RESOURCE;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("AWS_STEP_FUNCTIONS_STARTED_BY_EXECUTION_ID.$", "$$.Execution.Id");
        input.put("__trace.$", "$.__trace");
        input.put("data.$", getInvocation().getInputPath());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("Input", input);
        parameters.put("StateMachineArn", ResourceNaming.placeholder(getStateMachineVariable()));
        return parameters;
    }

    @Override
    public Set<String> getVariableNames() {
        return Collections.singleton(getStateMachineVariable());
    }
}
