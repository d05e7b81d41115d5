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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.options.ResolvedOptions;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;
import com.danielgmyers.fluxio.sfn.states.MapState;
import com.danielgmyers.fluxio.sfn.states.ParallelState;
import com.danielgmyers.fluxio.sfn.states.State;
import com.danielgmyers.fluxio.sfn.states.StateMachineFragment;
import com.danielgmyers.fluxio.sfn.states.tasks.TaskState;
import com.danielgmyers.fluxio.sfn.util.ResourceNaming;

/**
 * A state machine declared by a top-level function.
 *
 * Every function starts out first-class, i.e. deployed as its own state machine. A function referenced as a map
 * iterator or a parallel branch is demoted and only ever embedded in the document of the state machine
 * referencing it.
 */
public final class StateMachineDefinition {

    public static final String START_AT = "StartAt";
    public static final String STATES = "States";

    private final String name;
    private final FunctionDef node;
    private final WorkflowDecorators decorators;
    private WorkflowGraph graph;
    private boolean firstClass = true;
    private boolean mapIterator = false;

    public StateMachineDefinition(String name, FunctionDef node, WorkflowDecorators decorators) {
        this.name = name;
        this.node = node;
        this.decorators = decorators;
    }

    public String getName() {
        return name;
    }

    public FunctionDef getNode() {
        return node;
    }

    public String getNormalizedName() {
        return ResourceNaming.normalizedName(name);
    }

    public String getLogicalId() {
        return ResourceNaming.stateMachineLogicalId(name);
    }

    public WorkflowDecorators getDecorators() {
        return decorators;
    }

    /**
     * The @schedule options, or null if the function has no schedule.
     */
    public ResolvedOptions getSchedule() {
        return decorators.getSchedule();
    }

    /**
     * The @export options, or null if the decorator was not applied.
     */
    public ResolvedOptions getExport() {
        return decorators.getExport();
    }

    public List<ResolvedOptions> getSubscriptions() {
        return decorators.getSubscriptions();
    }

    /**
     * The @process_events options, or null if no event processor is attached.
     */
    public ResolvedOptions getEventProcessor() {
        return decorators.getEventProcessor();
    }

    public WorkflowGraph getGraph() {
        return graph;
    }

    public void setGraph(WorkflowGraph graph) {
        if (this.graph != null) {
            throw new IllegalStateException(String.format("The graph of state machine %s was already built.", name));
        }
        this.graph = graph;
    }

    public boolean isFirstClass() {
        return firstClass;
    }

    public boolean isMapIterator() {
        return mapIterator;
    }

    public void demoteToMapIterator() {
        firstClass = false;
        mapIterator = true;
    }

    public void demoteToParallelBranch() {
        firstClass = false;
    }

    private WorkflowGraph requireGraph() {
        if (graph == null) {
            throw new IllegalStateException(String.format("The graph of state machine %s has not been built.", name));
        }
        return graph;
    }

    /**
     * Every task state of this state machine, including those of embedded map iterators and parallel branches.
     */
    public List<TaskState> getTaskStates() {
        List<TaskState> tasks = new ArrayList<>();
        for (StateMachineFragment fragment : requireGraph().getFragments()) {
            if (fragment instanceof TaskState) {
                tasks.add((TaskState)fragment);
            } else if (fragment instanceof MapState) {
                tasks.addAll(((MapState)fragment).getIterator().getTaskStates());
            } else if (fragment instanceof ParallelState) {
                for (StateMachineDefinition branch : ((ParallelState)fragment).getBranches()) {
                    tasks.addAll(branch.getTaskStates());
                }
            }
        }
        return tasks;
    }

    /**
     * The deployment placeholder names referenced anywhere in the document.
     */
    public Set<String> getVariableNames() {
        Set<String> names = new LinkedHashSet<>();
        for (TaskState task : getTaskStates()) {
            names.addAll(task.getVariableNames());
        }
        return names;
    }

    /**
     * Renders the state machine document. States appear in the order they were compiled.
     */
    public Map<String, Object> toDocument() {
        WorkflowGraph workflowGraph = requireGraph();
        StateMachineFragment startTarget = workflowGraph.startTarget();
        if (startTarget == null) {
            throw new WorkflowGraphBuildException("A state machine function must contain at least one state", node);
        }

        Map<String, Object> states = new LinkedHashMap<>();
        for (StateMachineFragment fragment : workflowGraph.getFragments()) {
            if (!(fragment instanceof State)) {
                continue;
            }
            Map<String, Object> rendered = ((State)fragment).render(workflowGraph);
            Object existing = states.get(fragment.getKey());
            if (existing != null && !existing.equals(rendered)) {
                throw new WorkflowGraphBuildException(
                        String.format("Duplicate state key %s. Provide a unique key to one of the calls with key=",
                                      fragment.getKey()), fragment.getNode());
            }
            states.put(fragment.getKey(), rendered);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(START_AT, startTarget.getKey());
        document.put(STATES, states);
        return document;
    }

    @Override
    public String toString() {
        return name;
    }
}
