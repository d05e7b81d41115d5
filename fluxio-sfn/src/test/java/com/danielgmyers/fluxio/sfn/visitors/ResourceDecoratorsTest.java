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

package com.danielgmyers.fluxio.sfn.visitors;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.ResolvedOptions;
import com.danielgmyers.fluxio.sfn.TestScripts;
import com.danielgmyers.fluxio.sfn.definitions.StateMachineDefinition;
import com.danielgmyers.fluxio.sfn.definitions.WorkflowDecorators;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static com.danielgmyers.fluxio.ast.ScriptTrees.*;

public class ResourceDecoratorsTest {

    private static final Set<String> PROCESSORS = Collections.singleton("Notifier");

    private static WorkflowDecorators resolve(Expression... decorators) {
        FunctionDef function = function("main", Arrays.asList(decorators), ret());
        return ResourceDecorators.resolve(function, PROCESSORS);
    }

    private static void assertError(String expectedPrefix, Expression... decorators) {
        WorkflowGraphBuildException e = Assertions.assertThrows(WorkflowGraphBuildException.class,
                                                                () -> resolve(decorators));
        Assertions.assertTrue(e.getReason().startsWith(expectedPrefix),
                              "Unexpected reason: " + e.getReason());
    }

    @Test
    public void testNoDecorators() {
        WorkflowDecorators decorators = resolve();
        Assertions.assertNull(decorators.getSchedule());
        Assertions.assertNull(decorators.getExport());
        Assertions.assertNull(decorators.getEventProcessor());
        Assertions.assertTrue(decorators.getSubscriptions().isEmpty());
    }

    @Test
    public void testAllDecorators() {
        WorkflowDecorators decorators = resolve(
                call("schedule", Collections.emptyList(), keyword("expression", str("rate(1 hour)"))),
                call("export"),
                call("subscribe", Collections.emptyList(), keyword("project", str("billing"))),
                call("subscribe", Collections.emptyList(), keyword("topic_arn_import_value", str("AlertsTopic")),
                     keyword("status", str("failure"))),
                call("process_events", Collections.emptyList(), keyword("processor", name("Notifier"))));

        Assertions.assertEquals("rate(1 hour)", decorators.getSchedule().getString(ResourceDecorators.EXPRESSION));
        Assertions.assertEquals(true, decorators.getExport().getBoolean(ResourceDecorators.ENABLED));
        Assertions.assertEquals("Notifier", decorators.getEventProcessor().getString(ResourceDecorators.PROCESSOR));

        List<ResolvedOptions> subscriptions = decorators.getSubscriptions();
        Assertions.assertEquals(2, subscriptions.size());
        Assertions.assertEquals("billing", subscriptions.get(0).getString(ResourceDecorators.PROJECT));
        Assertions.assertEquals("main", subscriptions.get(0).getString(ResourceDecorators.STATE_MACHINE));
        Assertions.assertEquals("success", subscriptions.get(0).getString(ResourceDecorators.STATUS));
        Assertions.assertNull(subscriptions.get(0).get(ResourceDecorators.TOPIC_ARN_IMPORT_VALUE));
        Assertions.assertEquals("failure", subscriptions.get(1).getString(ResourceDecorators.STATUS));
    }

    @Test
    public void testStateMachineExposesDecorators() {
        FunctionDef function = function("nightly", Collections.singletonList(
                call("schedule", Collections.emptyList(), keyword("expression", str("cron(0 3 * * ? *)")))), ret());
        StateMachineDefinition definition = TestScripts.compile(function).getStateMachine("nightly");

        Assertions.assertEquals("cron(0 3 * * ? *)", definition.getSchedule().getString(ResourceDecorators.EXPRESSION));
        Assertions.assertNull(definition.getExport());
    }

    @Test
    public void testUnknownDecorator() {
        assertError("Supported resource decorators include: schedule, export, subscribe, process_events",
                    name("cache"));
        assertError("Supported resource decorators include:", call("retry"));
    }

    @Test
    public void testPositionalArguments() {
        assertError("The @schedule decorator only accepts keyword arguments", call("schedule", str("rate(1 day)")));
    }

    @Test
    public void testOptionErrors() {
        assertError("The following options are required but were not provided: expression", call("schedule"));
        assertError("Invalid keyword argument when", call("export", Collections.emptyList(),
                                                          keyword("when", str("now"))));
        assertError("Invalid data type for the enabled option: expected a boolean",
                    call("export", Collections.emptyList(), keyword("enabled", str("yes"))));
        assertError("Allowed values for the status option include",
                    call("subscribe", Collections.emptyList(), keyword("project", str("billing")),
                         keyword("status", str("pending"))));
    }

    @Test
    public void testSubscriptionNeedsSource() {
        assertError("The @subscribe decorator requires either topic_arn_import_value or project",
                    call("subscribe", Collections.emptyList(), keyword("state_machine", str("other"))));
    }

    @Test
    public void testRepeatedDecorators() {
        Expression schedule = call("schedule", Collections.emptyList(), keyword("expression", str("rate(1 hour)")));
        assertError("Only 1 @schedule decorators can be applied to a state machine function", schedule, schedule);
        assertError("Only 1 @export decorators can be applied", call("export"), call("export"));
    }

    @Test
    public void testUnknownEventProcessor() {
        assertError("Unknown event processor Other. Declared event processors: Notifier",
                    call("process_events", Collections.emptyList(), keyword("processor", name("Other"))));
    }
}
