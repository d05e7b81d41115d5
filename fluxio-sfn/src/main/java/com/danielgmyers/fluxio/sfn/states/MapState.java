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
import com.danielgmyers.fluxio.sfn.definitions.StateMachineDefinition;
import com.danielgmyers.fluxio.sfn.graph.WorkflowGraph;

/**
 * Runs another state machine function once per item of a list on the input data.
 *
 * The items reference is expected to point at a result object written by a task, which carries the items
 * themselves plus the table coordinates under which the per-item results are stored.
 */
public final class MapState extends State {

    private final StateMachineDefinition iterator;
    private final String inputPath;
    private final String resultPath;
    private final long maxConcurrency;

    public MapState(String key, Node node, StateMachineDefinition iterator, String inputPath, String resultPath,
                    long maxConcurrency) {
        super(key, node);
        this.iterator = iterator;
        this.inputPath = inputPath;
        this.resultPath = resultPath;
        this.maxConcurrency = maxConcurrency;
    }

    public StateMachineDefinition getIterator() {
        return iterator;
    }

    public String getInputPath() {
        return inputPath;
    }

    public String getResultPath() {
        return resultPath;
    }

    public long getMaxConcurrency() {
        return maxConcurrency;
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("__trace.$", "$.__trace");
        parameters.put("items_result_table_name.$", inputPath + ".table_name");
        parameters.put("items_result_partition_key.$", inputPath + ".partition_key");
        parameters.put("items_result_key.$", inputPath + ".key");
        parameters.put("context_index.$", "$$.Map.Item.Index");
        parameters.put("context_value.$", "$$.Map.Item.Value");

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Map");
        document.put("Parameters", parameters);
        document.put("Iterator", iterator.toDocument());
        document.put("ItemsPath", inputPath + ".items");
        document.put("ResultPath", resultPath);
        document.put("MaxConcurrency", maxConcurrency);
        putTransition(document, graph);
        return document;
    }
}
