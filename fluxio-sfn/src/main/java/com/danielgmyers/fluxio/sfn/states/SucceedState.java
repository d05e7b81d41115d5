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

public final class SucceedState extends State {

    public SucceedState(String key, Node node) {
        super(key, node);
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Succeed");
        return document;
    }
}
