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
import java.util.Map;

import com.danielgmyers.fluxio.ast.Node;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;

public final class FailState extends State {

    private final String error;
    private final String cause;

    public FailState(String key, Node node, String error, String cause) {
        super(key, node);
        this.error = error;
        this.cause = cause;
    }

    public String getError() {
        return error;
    }

    public String getCause() {
        return cause;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Fail");
        document.put("Error", error);
        document.put("Cause", cause);
        return document;
    }
}
