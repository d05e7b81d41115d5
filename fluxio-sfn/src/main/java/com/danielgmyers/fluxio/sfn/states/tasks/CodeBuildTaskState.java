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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.CallableOption;
import com.danielgmyers.fluxio.options.ValueShape;
import com.danielgmyers.fluxio.sfn.util.ResourceNaming;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Starts a build of the work unit's CodeBuild project and waits for it to finish.
 *
 * Call sites may pass {@code env} (extra environment variables) and {@code build_arg_vars}
 * (a dict handed to the build as json in the BUILD_ARG_VARS variable).
 */
public class CodeBuildTaskState extends TaskState {

    public static final String RESOURCE = "arn:aws:states:::codebuild:startBuild.sync";

    public static final String ENV_OPTION = "env";
    public static final String BUILD_ARG_VARS_OPTION = "build_arg_vars";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final TaskStateFactory FACTORY = new TaskStateFactory() {
        @Override
        public TaskState create(TaskInvocation invocation) {
            return new CodeBuildTaskState(invocation);
        }

        @Override
        public Map<String, CallableOption> getAdditionalOptions() {
            Map<String, CallableOption> options = new LinkedHashMap<>();
            options.put(ENV_OPTION, CallableOption.builder("dict", ValueShape.DICT)
                                                  .defaultValue(Collections.emptyMap()).build());
            options.put(BUILD_ARG_VARS_OPTION, CallableOption.builder("dict", ValueShape.DICT)
                                                             .defaultValue(Collections.emptyMap()).build());
            return options;
        }
    };

    /**
     * Single-line json with a space after every separator, e.g. {@code {"count": 2, "tags": ["a", "b"]}}.
     */
    private static final class SpacedPrettyPrinter extends MinimalPrettyPrinter {

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }

    public CodeBuildTaskState(TaskInvocation invocation) {
        super(invocation);
    }

    @Override
    public String getResource() {
        return RESOURCE;
    }

    private static Map<String, Object> environmentVariable(String name, Object value) {
        Map<String, Object> variable = new LinkedHashMap<>();
        variable.put("Name", name);
        variable.put("Value", value);
        return variable;
    }

    private Map<String, Object> optionMap(String name) {
        if (!getInvocation().getOptions().contains(name)) {
            return Collections.emptyMap();
        }
        return getInvocation().getOptions().getMap(name);
    }

    @Override
    public Map<String, Object> getParameters() {
        List<Object> environment = new ArrayList<>();
        for (Map.Entry<String, Object> entry : optionMap(ENV_OPTION).entrySet()) {
            environment.add(environmentVariable(entry.getKey(), entry.getValue()));
        }
        String buildArgVars;
        try {
            buildArgVars = MAPPER.writer(new SpacedPrettyPrinter())
                                 .writeValueAsString(optionMap(BUILD_ARG_VARS_OPTION));
        } catch (JsonProcessingException e) {
            throw new WorkflowGraphBuildException("Unable to serialize build_arg_vars", getNode(), e);
        }
        environment.add(environmentVariable("BUILD_ARG_VARS", buildArgVars));

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("ProjectName",
                       ResourceNaming.placeholder(ResourceNaming.codeBuildProjectName(getInvocation().getDefinitionName())));
        parameters.put("SourceVersion.$", "$.source_version");
        parameters.put("EnvironmentVariablesOverride", environment);
        return parameters;
    }

    @Override
    public Set<String> getVariableNames() {
        return Collections.singleton(ResourceNaming.codeBuildProjectName(getInvocation().getDefinitionName()));
    }
}
