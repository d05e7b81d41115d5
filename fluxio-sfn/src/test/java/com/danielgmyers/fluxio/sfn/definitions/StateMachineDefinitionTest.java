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

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import com.danielgmyers.fluxio.sfn.CompiledScript;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskInvocation;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;
import static com.danielgmyers.fluxio.sfn.TestScripts.*;

public class StateMachineDefinitionTest {

    @Test
    public void testNames() {
        StateMachineDefinition definition = new StateMachineDefinition("nightly_sync", function("nightly_sync", ret()),
                                                                       WorkflowDecorators.NONE);
        Assertions.assertEquals("nightly_sync", definition.getName());
        Assertions.assertEquals("Nightly_Sync", definition.getNormalizedName());
        Assertions.assertEquals("Nightly_SyncStateMachineStack", definition.getLogicalId());
        Assertions.assertNull(definition.getSchedule());
        Assertions.assertTrue(definition.getSubscriptions().isEmpty());
        Assertions.assertTrue(definition.isFirstClass());
        Assertions.assertFalse(definition.isMapIterator());
    }

    @Test
    public void testGraphRequiredForRendering() {
        StateMachineDefinition definition = new StateMachineDefinition("main", main(ret()), WorkflowDecorators.NONE);
        Assertions.assertNull(definition.getGraph());
        Assertions.assertThrows(IllegalStateException.class, definition::toDocument);
        Assertions.assertThrows(IllegalStateException.class, definition::getVariableNames);
    }

    @Test
    public void testDemotion() {
        StateMachineDefinition iterator = new StateMachineDefinition("each", function("each", ret()),
                                                                     WorkflowDecorators.NONE);
        iterator.demoteToMapIterator();
        Assertions.assertFalse(iterator.isFirstClass());
        Assertions.assertTrue(iterator.isMapIterator());

        StateMachineDefinition branch = new StateMachineDefinition("side", function("side", ret()),
                                                                   WorkflowDecorators.NONE);
        branch.demoteToParallelBranch();
        Assertions.assertFalse(branch.isFirstClass());
        Assertions.assertFalse(branch.isMapIterator());
    }

    @Test
    public void testTaskStatesIncludeEmbeddedStateMachines() {
        CompiledScript script = compile(task("Charge"),
                                        task("Ship", assign(name("service"), str("ecs:worker"))),
                                        task("Build", assign(name("service"), str("codebuild"))),
                                        function("each", expr(call("Ship"))),
                                        function("side", expr(call("Build"))),
                                        function("report", ret()),
                                        main(expr(call("Charge")),
                                             expr(call("map", data("orders"), name("each"))),
                                             expr(call("parallel", name("side"))),
                                             expr(call("report"))));
        StateMachineDefinition main = script.getStateMachine("main");

        Assertions.assertEquals(Arrays.asList("Charge", "Ship", "Build", "report"),
                                main.getTaskStates().stream().map(TaskState::getInvocation)
                                    .map(TaskInvocation::getDefinitionName)
                                    .collect(Collectors.toList()));
        Assertions.assertEquals(Set.of("LambdaFunctionCharge", "QueueUrlShip", "CodeBuildProjectNameBuild",
                                       "StateMachinereport"),
                                main.getVariableNames());
        Assertions.assertEquals(Set.of("QueueUrlShip"), script.getStateMachine("each").getVariableNames());
        Assertions.assertTrue(script.getStateMachine("report").getVariableNames().isEmpty());
    }
}
