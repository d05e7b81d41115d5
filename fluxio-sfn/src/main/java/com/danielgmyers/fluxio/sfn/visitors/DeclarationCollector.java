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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.ast.Assign;
import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.ExprStatement;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.If;
import com.danielgmyers.fluxio.ast.Import;
import com.danielgmyers.fluxio.ast.ImportFrom;
import com.danielgmyers.fluxio.ast.ModuleNode;
import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.ast.OpaqueStatement;
import com.danielgmyers.fluxio.ast.Pass;
import com.danielgmyers.fluxio.ast.Raise;
import com.danielgmyers.fluxio.ast.Return;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.ast.StatementVisitor;
import com.danielgmyers.fluxio.ast.Try;
import com.danielgmyers.fluxio.ast.With;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.OptionSchema;
import com.danielgmyers.fluxio.sfn.definitions.EventProcessorDefinition;
import com.danielgmyers.fluxio.sfn.definitions.ScriptDeclarations;
import com.danielgmyers.fluxio.sfn.definitions.StateMachineDefinition;
import com.danielgmyers.fluxio.sfn.definitions.TaskAttributes;
import com.danielgmyers.fluxio.sfn.definitions.TaskDefinition;
import com.danielgmyers.fluxio.sfn.definitions.WorkflowDecorators;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraphBuilder;
import com.danielgmyers.fluxio.sfn.states.MapState;
import com.danielgmyers.fluxio.sfn.states.ParallelState;
import com.danielgmyers.fluxio.sfn.states.StateMachineFragment;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskServiceRegistry;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the top-level declarations of a normalized script and builds the graph of every state machine function.
 *
 * Collection happens in two passes. The first registers every work unit, event processor and state machine
 * function, so a function can reference one declared further down the script. The second builds the graphs in
 * declaration order and then applies the demotions the builders reported.
 */
public class DeclarationCollector implements StatementVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(DeclarationCollector.class);

    private static final String UNSUPPORTED_STATEMENT
            = "Only class and function declarations are supported at the top level";

    private final TaskServiceRegistry serviceRegistry;
    private final OptionSchema taskAttributeSchema;

    private final Map<String, TaskDefinition> tasks = new LinkedHashMap<>();
    private final Map<String, EventProcessorDefinition> eventProcessors = new LinkedHashMap<>();
    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();
    private final Map<String, StateMachineDefinition> stateMachines = new LinkedHashMap<>();
    private final Set<String> declaredNames = new HashSet<>();

    private boolean collected = false;

    public DeclarationCollector(TaskServiceRegistry serviceRegistry) {
        this.serviceRegistry = serviceRegistry;
        this.taskAttributeSchema = TaskAttributes.schema(serviceRegistry.getServiceKinds());
    }

    /**
     * Collects every declaration of the module and builds each state machine's graph.
     */
    public void collect(ModuleNode module) {
        if (collected) {
            throw new IllegalStateException("A DeclarationCollector can only collect one script.");
        }
        collected = true;

        for (Statement statement : module.getBody()) {
            statement.accept(this);
        }
        for (Map.Entry<String, FunctionDef> entry : functions.entrySet()) {
            WorkflowDecorators decorators = ResourceDecorators.resolve(entry.getValue(), eventProcessors.keySet());
            stateMachines.put(entry.getKey(), new StateMachineDefinition(entry.getKey(), entry.getValue(), decorators));
        }

        buildGraphs();
    }

    private void buildGraphs() {
        ScriptDeclarations declarations = new ScriptDeclarations(tasks, stateMachines, serviceRegistry);
        List<StateMachineDefinition> mapIterators = new ArrayList<>();
        List<StateMachineDefinition> parallelBranches = new ArrayList<>();

        for (StateMachineDefinition definition : stateMachines.values()) {
            WorkflowGraphBuilder builder = new WorkflowGraphBuilder(definition, declarations);
            definition.setGraph(builder.build());
            mapIterators.addAll(builder.getMapIterators());
            parallelBranches.addAll(builder.getParallelBranches());
        }

        for (StateMachineDefinition iterator : mapIterators) {
            log.debug("Demoting {} to a map iterator.", iterator);
            iterator.demoteToMapIterator();
        }
        for (StateMachineDefinition branch : parallelBranches) {
            log.debug("Demoting {} to a parallel branch.", branch);
            branch.demoteToParallelBranch();
        }

        for (StateMachineDefinition definition : stateMachines.values()) {
            verifyNoLoops(definition, new HashSet<>());
        }
        // rendering surfaces duplicate state keys
        for (StateMachineDefinition definition : stateMachines.values()) {
            definition.toDocument();
        }
    }

    @VisibleForTesting
    static List<StateMachineDefinition> embedded(StateMachineDefinition definition) {
        List<StateMachineDefinition> result = new ArrayList<>();
        for (StateMachineFragment fragment : definition.getGraph().getFragments()) {
            if (fragment instanceof MapState) {
                result.add(((MapState)fragment).getIterator());
            } else if (fragment instanceof ParallelState) {
                result.addAll(((ParallelState)fragment).getBranches());
            }
        }
        return result;
    }

    private void verifyNoLoops(StateMachineDefinition definition, Set<StateMachineDefinition> visited) {
        visited.add(definition);

        for (StateMachineDefinition child : embedded(definition)) {
            if (visited.contains(child)) {
                throw new WorkflowGraphBuildException(
                        String.format("State machine %s cannot embed itself through a map or parallel state",
                                      child.getName()), definition.getNode());
            }
            verifyNoLoops(child, visited);
        }

        visited.remove(definition);
    }

    public Map<String, TaskDefinition> getTaskDefinitions() {
        return Collections.unmodifiableMap(tasks);
    }

    public Map<String, EventProcessorDefinition> getEventProcessors() {
        return Collections.unmodifiableMap(eventProcessors);
    }

    public Map<String, StateMachineDefinition> getStateMachines() {
        return Collections.unmodifiableMap(stateMachines);
    }

    private void declare(String name, Node node) {
        if (!declaredNames.add(name)) {
            throw new WorkflowGraphBuildException(String.format("%s is declared more than once", name), node);
        }
    }

    @Override
    public Void visitClassDef(ClassDef node) {
        if (BaseClasses.isTask(node)) {
            declare(node.getName(), node);
            tasks.put(node.getName(), new TaskClassVisitor(taskAttributeSchema).visit(node));
            log.debug("Collected work unit {}.", node.getName());
        } else if (BaseClasses.isEventProcessor(node)) {
            declare(node.getName(), node);
            eventProcessors.put(node.getName(), new EventProcessorVisitor().visit(node));
            log.debug("Collected event processor {}.", node.getName());
        } else {
            throw new WorkflowGraphBuildException("Only classes that inherit from Task or EventProcessor are supported",
                                                  node);
        }
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        if (node.isAsync()) {
            throw new WorkflowGraphBuildException("State machine functions cannot be declared with `async def`", node);
        }
        declare(node.getName(), node);
        functions.put(node.getName(), node);
        return null;
    }

    @Override
    public Void visitExprStatement(ExprStatement node) {
        if (!node.isDocstring()) {
            throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
        }
        return null;
    }

    @Override
    public Void visitImport(Import node) {
        return null;
    }

    @Override
    public Void visitImportFrom(ImportFrom node) {
        return null;
    }

    @Override
    public Void visitAssign(Assign node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitIf(If node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitRaise(Raise node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitReturn(Return node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitTry(Try node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitWith(With node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitPass(Pass node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }

    @Override
    public Void visitOpaqueStatement(OpaqueStatement node) {
        throw new WorkflowGraphBuildException(UNSUPPORTED_STATEMENT, node);
    }
}
