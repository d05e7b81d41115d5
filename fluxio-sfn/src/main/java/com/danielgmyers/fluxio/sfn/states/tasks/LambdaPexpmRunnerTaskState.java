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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.util.ResourceNaming;

/**
 * Runs a packaged command through the shared package runner lambda. The package coordinates
 * are deployment placeholders; the execution metadata is passed as environment variables.
 */
public class LambdaPexpmRunnerTaskState extends LambdaTaskState {

    public LambdaPexpmRunnerTaskState(TaskInvocation invocation) {
        super(invocation);
    }

    @Override
    public Map<String, Object> getParameters() {
        String name = getInvocation().getDefinitionName();

        Map<String, Object> environment = new LinkedHashMap<>();
        environment.put("SFN_EXECUTION_NAME.$", "$$.Execution.Name");
        environment.put("SFN_STATE_NAME.$", "$$.State.Name");
        environment.put("SFN_STATE_MACHINE_NAME.$", "$$.StateMachine.Name");
        environment.put("TRACE_ID.$", "$.__trace.id");
        environment.put("TRACE_SOURCE.$", "$.__trace.source");
        environment.put("SFN_INPUT_VALUE.$", getInvocation().getInputPath());

        Map<String, Object> parameters = new LinkedHashMap<>();
        String packageName = ResourceNaming.placeholder(ResourceNaming.packageName(name));
        parameters.put("package_name", packageName);
        parameters.put("package_version", ResourceNaming.placeholder(ResourceNaming.packageVersion(name)));
        parameters.put("command", Arrays.asList(packageName, "run"));
        parameters.put("include_parent_environment", true);
        parameters.put("return_stdout", true);
        parameters.put("environment", environment);
        return parameters;
    }

    @Override
    public Set<String> getVariableNames() {
        String name = getInvocation().getDefinitionName();
        Set<String> names = new LinkedHashSet<>();
        names.add(getFunctionVariable());
        names.add(ResourceNaming.packageName(name));
        names.add(ResourceNaming.packageVersion(name));
        return names;
    }
}
