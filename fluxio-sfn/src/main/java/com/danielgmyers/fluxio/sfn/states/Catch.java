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

package com.danielgmyers.fluxio.sfn.states;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.ExceptHandler;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;

/**
 * An exception handler attached to a task. Heads the chain of states compiled from the handler's body.
 */
public final class Catch extends StateMachineFragment {

    /**
     * Where the caught error is written on the input data.
     */
    public static final String ERROR_RESULT_PATH = "$.error";

    private final List<String> errors;

    public Catch(String key, ExceptHandler node, List<String> errors) {
        super(key, node);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    public Map<String, Object> render(WorkflowGraph graph) {
        StateMachineFragment next = graph.next(this);
        if (next == null) {
            throw new WorkflowGraphBuildException("An exception handler must contain at least one statement", getNode());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("ErrorEquals", errors);
        document.put("ResultPath", ERROR_RESULT_PATH);
        document.put(State.NEXT, next.getKey());
        return document;
    }
}
