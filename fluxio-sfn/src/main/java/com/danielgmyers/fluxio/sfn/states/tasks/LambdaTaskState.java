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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.states.Retry;
import com.danielgmyers.fluxio.sfn.util.ResourceNaming;

/**
 * Invokes the work unit's lambda function directly.
 */
public class LambdaTaskState extends TaskState {

    /**
     * Transient lambda service errors are always retried.
     */
    public static final List<Retry> DEFAULT_RETRIES = Collections.singletonList(
            new Retry(Arrays.asList("Lambda.ServiceException", "Lambda.AWSLambdaException", "Lambda.SdkClientException"),
                      2, 6, 2));

    public LambdaTaskState(TaskInvocation invocation) {
        super(invocation);
    }

    protected String getFunctionVariable() {
        return ResourceNaming.lambdaFunction(getInvocation().getDefinitionName());
    }

    @Override
    public String getResource() {
        return ResourceNaming.placeholder(getFunctionVariable());
    }

    @Override
    public Map<String, Object> getParameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("meta", executionMetadata());
        parameters.put("data.$", getInvocation().getInputPath());
        return parameters;
    }

    @Override
    public Set<String> getVariableNames() {
        return Collections.singleton(getFunctionVariable());
    }

    @Override
    protected List<Retry> getDefaultRetries() {
        return DEFAULT_RETRIES;
    }
}
