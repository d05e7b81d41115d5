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

/**
 * Sets values on the input data, or does nothing at all.
 *
 * A Pass created from a bare {@code pass} statement is a placeholder: it keeps an otherwise empty path
 * non-empty and is collapsed away once a following statement gives it a successor.
 */
public final class PassState extends State {

    private final boolean placeholder;
    private final boolean hasResult;
    private final Object result;
    private final String inputPath;
    private final Map<String, Object> parameters;
    private final String resultPath;

    private PassState(String key, Node node, boolean placeholder, boolean hasResult, Object result, String inputPath,
                      Map<String, Object> parameters, String resultPath) {
        super(key, node);
        this.placeholder = placeholder;
        this.hasResult = hasResult;
        this.result = result;
        this.inputPath = inputPath;
        this.parameters = parameters;
        this.resultPath = resultPath;
    }

    public static PassState placeholder(String key, Node node) {
        return new PassState(key, node, true, false, null, null, null, null);
    }

    /**
     * Writes a literal value to the result path.
     */
    public static PassState withResult(String key, Node node, Object result, String resultPath) {
        return new PassState(key, node, false, true, result, null, null, resultPath);
    }

    /**
     * Copies the value at the input path to the result path.
     */
    public static PassState withInputPath(String key, Node node, String inputPath, String resultPath) {
        return new PassState(key, node, false, false, null, inputPath, null, resultPath);
    }

    /**
     * Writes a payload built from literal values and input data references to the result path.
     */
    public static PassState withParameters(String key, Node node, Map<String, Object> parameters,
                                           String resultPath) {
        return new PassState(key, node, false, false, null, null, parameters, resultPath);
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public String getResultPath() {
        return resultPath;
    }

    @Override
    public Map<String, Object> render(WorkflowGraph graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(TYPE, "Pass");
        if (inputPath != null) {
            document.put("InputPath", inputPath);
        }
        if (parameters != null) {
            document.put("Parameters", parameters);
        }
        if (hasResult) {
            document.put("Result", result);
        }
        if (resultPath != null) {
            document.put("ResultPath", resultPath);
        }
        putTransition(document, graph);
        return document;
    }
}
