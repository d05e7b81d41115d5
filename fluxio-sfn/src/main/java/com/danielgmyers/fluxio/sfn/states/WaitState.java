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

public final class WaitState extends State {

    public static final String SECONDS = "Seconds";
    public static final String SECONDS_PATH = "SecondsPath";
    public static final String TIMESTAMP = "Timestamp";
    public static final String TIMESTAMP_PATH = "TimestampPath";

    private final String field;
    private final Object value;

    /**
     * @param field One of Seconds, SecondsPath, Timestamp or TimestampPath.
     * @param value The literal value, or the input data path for the *Path fields.
     */
    public WaitState(String key, Node node, String field, Object value) {
        super(key, node);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Wait");
        document.put(field, value);
        putTransition(document, graph);
        return document;
    }
}
