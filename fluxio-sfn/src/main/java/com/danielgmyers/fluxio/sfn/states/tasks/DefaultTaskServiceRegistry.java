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

/**
 * The built-in service kinds. Additional kinds can be registered before compiling.
 */
public class DefaultTaskServiceRegistry implements TaskServiceRegistry {

    public static final String LAMBDA = "lambda";
    public static final String LAMBDA_CONTAINER = "lambda:container";
    public static final String LAMBDA_PEXPM_RUNNER = "lambda:pexpm-runner";
    public static final String ECS = "ecs";
    public static final String ECS_WORKER = "ecs:worker";
    public static final String CODEBUILD = "codebuild";

    private final Map<String, TaskStateFactory> factories = new LinkedHashMap<>();

    public DefaultTaskServiceRegistry() {
        register(LAMBDA, LambdaTaskState::new);
        register(LAMBDA_CONTAINER, LambdaTaskState::new);
        register(LAMBDA_PEXPM_RUNNER, LambdaPexpmRunnerTaskState::new);
        register(ECS, EcsTaskState::new);
        register(ECS_WORKER, EcsWorkerTaskState::new);
        register(CODEBUILD, CodeBuildTaskState.FACTORY);
    }

    public final void register(String serviceKind, TaskStateFactory factory) {
        if (serviceKind == null || factory == null) {
            throw new IllegalArgumentException("serviceKind and factory may not be null.");
        }
        factories.put(serviceKind, factory);
    }

    @Override
    public Set<String> getServiceKinds() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    @Override
    public TaskStateFactory getFactory(String serviceKind) {
        return factories.get(serviceKind);
    }
}
