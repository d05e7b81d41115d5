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

import com.danielgmyers.fluxio.sfn.definitions.TaskDefinition;
import com.danielgmyers.fluxio.sfn.util.ResourceNaming;

/**
 * Hands the work to a long-running ECS worker through its FIFO queue and waits for the worker to report back
 * with the task token.
 */
public class EcsWorkerTaskState extends TaskState {

    public static final String RESOURCE = "arn:aws:states:::sqs:sendMessage.waitForTaskToken";

    static final String MESSAGE_GROUP_ID = "States.Format('{}_{}', $$.Execution.Name, $$.State.EnteredTime)";

    // Iterations of a map run concurrently in the same execution, so the item index keeps their groups distinct.
    static final String MAP_ITERATOR_MESSAGE_GROUP_ID
            = "States.Format('{}_{}_{}', $$.Execution.Name, $$.State.EnteredTime, $.context_index)";

    public EcsWorkerTaskState(TaskInvocation invocation) {
        super(invocation);
    }

    @Override
    public String getResource() {
        return RESOURCE;
    }

    private static Map<String, Object> stringAttribute(String valuePath) {
        Map<String, Object> attribute = new LinkedHashMap<>();
        attribute.put("DataType", "String");
        attribute.put("StringValue.$", valuePath);
        return attribute;
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("SFN_EXECUTION_NAME", stringAttribute("$$.Execution.Name"));
        attributes.put("SFN_STATE_NAME", stringAttribute("$$.State.Name"));
        attributes.put("SFN_STATE_MACHINE_NAME", stringAttribute("$$.StateMachine.Name"));
        attributes.put("TRACE_ID", stringAttribute("$.__trace.id"));
        attributes.put("TRACE_SOURCE", stringAttribute("$.__trace.source"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Input.$", getInvocation().getInputPath());
        body.put("TaskToken.$", "$$.Task.Token");

        boolean inMapIterator = getInvocation().getOwner() != null && getInvocation().getOwner().isMapIterator();

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("QueueUrl", ResourceNaming.placeholder(ResourceNaming.queueUrl(getInvocation().getDefinitionName())));
        parameters.put("MessageGroupId.$", inMapIterator ? MAP_ITERATOR_MESSAGE_GROUP_ID : MESSAGE_GROUP_ID);
        parameters.put("MessageAttributes", attributes);
        parameters.put("MessageBody", body);
        return parameters;
    }

    @Override
    protected void putAdditionalFields(Map<String, Object> document) {
        TaskDefinition definition = getInvocation().getDefinition();
        if (definition != null && definition.getHeartbeatInterval() != null) {
            document.put("HeartbeatSeconds", definition.getHeartbeatInterval());
        }
    }

    @Override
    public Set<String> getVariableNames() {
        return Collections.singleton(ResourceNaming.queueUrl(getInvocation().getDefinitionName()));
    }
}
