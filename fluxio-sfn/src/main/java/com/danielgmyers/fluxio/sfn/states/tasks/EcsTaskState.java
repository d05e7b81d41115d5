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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.util.ResourceNaming;

/**
 * Runs the work unit as a Fargate task and waits for it to finish.
 */
public class EcsTaskState extends TaskState {

    public static final String RESOURCE = "arn:aws:states:::ecs:runTask.sync";

    public EcsTaskState(TaskInvocation invocation) {
        super(invocation);
    }

    @Override
    public String getResource() {
        return RESOURCE;
    }

    private static Map<String, Object> environmentVariable(String name, String valuePath) {
        Map<String, Object> variable = new LinkedHashMap<>();
        variable.put("Name", name);
        variable.put("Value.$", valuePath);
        return variable;
    }

    @Override
    public Map<String, Object> getParameters() {
        String name = getInvocation().getDefinitionName();

        List<Object> subnets = new ArrayList<>();
        for (int i = 0; i < ResourceNaming.SUBNET_COUNT; i++) {
            subnets.add(ResourceNaming.placeholder(ResourceNaming.subnet(i)));
        }
        Map<String, Object> awsvpcConfiguration = new LinkedHashMap<>();
        awsvpcConfiguration.put("AssignPublicIp", "DISABLED");
        awsvpcConfiguration.put("SecurityGroups", Arrays.asList(
                ResourceNaming.placeholder(ResourceNaming.DATABASE_SECURITY_GROUP),
                ResourceNaming.placeholder(ResourceNaming.PRIVATE_LOAD_BALANCER_SECURITY_GROUP)));
        awsvpcConfiguration.put("Subnets", subnets);

        List<Object> environment = new ArrayList<>();
        environment.add(environmentVariable("SFN_EXECUTION_NAME", "$$.Execution.Name"));
        environment.add(environmentVariable("SFN_STATE_NAME", "$$.State.Name"));
        environment.add(environmentVariable("SFN_STATE_MACHINE_NAME", "$$.StateMachine.Name"));
        environment.add(environmentVariable("TRACE_ID", "$.__trace.id"));
        environment.add(environmentVariable("TRACE_SOURCE", "$.__trace.source"));
        if (!INPUT_PATH.equals(getInvocation().getInputPath())) {
            environment.add(environmentVariable("SFN_INPUT_VALUE", getInvocation().getInputPath()));
        }

        Map<String, Object> containerOverride = new LinkedHashMap<>();
        containerOverride.put("Name", name);
        containerOverride.put("Environment", environment);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("LaunchType", "FARGATE");
        parameters.put("Cluster", ResourceNaming.placeholder(ResourceNaming.ECS_CLUSTER_ARN));
        parameters.put("TaskDefinition", ResourceNaming.placeholder(ResourceNaming.ecsTaskDefinition(name)));
        parameters.put("NetworkConfiguration", Collections.singletonMap("AwsvpcConfiguration", awsvpcConfiguration));
        parameters.put("Overrides", Collections.singletonMap("ContainerOverrides",
                                                             Collections.singletonList(containerOverride)));
        return parameters;
    }

    @Override
    public Set<String> getVariableNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(ResourceNaming.ECS_CLUSTER_ARN);
        names.add(ResourceNaming.ecsTaskDefinition(getInvocation().getDefinitionName()));
        names.add(ResourceNaming.DATABASE_SECURITY_GROUP);
        names.add(ResourceNaming.PRIVATE_LOAD_BALANCER_SECURITY_GROUP);
        for (int i = 0; i < ResourceNaming.SUBNET_COUNT; i++) {
            names.add(ResourceNaming.subnet(i));
        }
        return names;
    }
}
