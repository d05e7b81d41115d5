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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;
import com.danielgmyers.fluxio.sfn.states.Catch;
import com.danielgmyers.fluxio.sfn.states.Retry;
import com.danielgmyers.fluxio.sfn.states.State;
import com.danielgmyers.fluxio.sfn.states.StateMachineFragment;

/**
 * Invokes a work unit or a nested state machine. Subclasses supply the service-specific resource and parameters.
 */
public abstract class TaskState extends State {

    /**
     * Tasks always receive the whole input data; the invocation's input path is passed inside the parameters.
     */
    public static final String INPUT_PATH = "$";

    private final TaskInvocation invocation;
    private final List<Retry> retries = new ArrayList<>();
    private final List<Catch> catches = new ArrayList<>();

    protected TaskState(TaskInvocation invocation) {
        super(invocation.getKey(), invocation.getNode());
        this.invocation = invocation;
    }

    public TaskInvocation getInvocation() {
        return invocation;
    }

    public abstract String getResource();

    public abstract Map<String, Object> getParameters();

    /**
     * The deployment placeholders this task references.
     */
    public abstract Set<String> getVariableNames();

    /**
     * Retries that apply before any declared with a retry block.
     */
    protected List<Retry> getDefaultRetries() {
        return Collections.emptyList();
    }

    /**
     * Hook for service-specific top-level fields, added after TimeoutSeconds.
     */
    protected void putAdditionalFields(Map<String, Object> document) {
    }

    public void addRetry(Retry retry) {
        retries.add(retry);
    }

    public List<Retry> getRetries() {
        List<Retry> all = new ArrayList<>(getDefaultRetries());
        all.addAll(retries);
        return all;
    }

    public void addCatch(Catch handler) {
        catches.add(handler);
    }

    public List<Catch> getCatches() {
        return Collections.unmodifiableList(catches);
    }

    @Override
    public List<StateMachineFragment> getOwnedHeads() {
        return Collections.unmodifiableList(new ArrayList<>(catches));
    }

    /**
     * Execution metadata passed to lambda-based tasks.
     */
    protected static Map<String, Object> executionMetadata() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("sfn_execution_name.$", "$$.Execution.Name");
        meta.put("sfn_state_name.$", "$$.State.Name");
        meta.put("sfn_state_machine_name.$", "$$.StateMachine.Name");
        meta.put("trace_id.$", "$.__trace.id");
        meta.put("trace_source.$", "$.__trace.source");
        return meta;
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Task");
        document.put("Resource", getResource());
        document.put("Parameters", getParameters());
        document.put("InputPath", INPUT_PATH);
        document.put("ResultPath", invocation.getResultPath());
        document.put("TimeoutSeconds", invocation.getTimeoutSeconds());
        putAdditionalFields(document);
        putTransition(document, graph);

        if (!catches.isEmpty()) {
            List<Object> renderedCatches = new ArrayList<>();
            for (Catch handler : catches) {
                renderedCatches.add(handler.render(graph));
            }
            document.put("Catch", renderedCatches);
        }

        List<Retry> allRetries = getRetries();
        if (!allRetries.isEmpty()) {
            List<Object> renderedRetries = new ArrayList<>();
            for (Retry retry : allRetries) {
                renderedRetries.add(retry.render());
            }
            document.put("Retry", renderedRetries);
        }
        return document;
    }
}
