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

package com.danielgmyers.fluxio.sfn.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.danielgmyers.fluxio.ast.Constant;
import com.danielgmyers.fluxio.ast.DictExpr;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.ListExpr;
import com.danielgmyers.fluxio.ast.TupleExpr;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;
import com.danielgmyers.fluxio.util.InputDataReferences;
import com.danielgmyers.fluxio.util.LiteralValues;

/**
 * Turns a dict literal that mixes constants and input data references into a Parameters payload.
 * A key whose value is a reference becomes {@code key.$} mapped to the reference's path, at any nesting depth:
 * <pre>
 * {"foo": data["foo"], "nested": {"bar": data["a"]["b"], "n": 1}}
 * </pre>
 * becomes
 * <pre>
 * {"foo.$": "$['foo']", "nested": {"bar.$": "$['a']['b']", "n": 1}}
 * </pre>
 */
public final class DataDictTransformer {

    private DataDictTransformer() {}

    /**
     * True if an input data reference appears anywhere in the expression.
     */
    public static boolean containsReferences(Expression expression) {
        if (InputDataReferences.isReference(expression) || InputDataReferences.isInputObject(expression)) {
            return true;
        } else if (expression instanceof DictExpr) {
            return ((DictExpr)expression).getValues().stream().anyMatch(DataDictTransformer::containsReferences);
        } else if (expression instanceof ListExpr) {
            return ((ListExpr)expression).getElements().stream().anyMatch(DataDictTransformer::containsReferences);
        } else if (expression instanceof TupleExpr) {
            return ((TupleExpr)expression).getElements().stream().anyMatch(DataDictTransformer::containsReferences);
        }
        return false;
    }

    public static Map<String, Object> transform(DictExpr dict) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < dict.getKeys().size(); i++) {
            Expression key = dict.getKeys().get(i);
            Expression value = dict.getValues().get(i);
            if (!(key instanceof Constant) || !((Constant)key).isString()) {
                throw new WorkflowGraphBuildException("Dictionary keys must be strings", key == null ? dict : key);
            }
            String name = (String)((Constant)key).getValue();
            if (InputDataReferences.isReference(value)) {
                result.put(name + ".$", InputDataReferences.toPath(value));
            } else if (InputDataReferences.isInputObject(value)) {
                result.put(name + ".$", InputDataReferences.ROOT_PATH);
            } else {
                result.put(name, transformValue(value));
            }
        }
        return result;
    }

    private static Object transformValue(Expression value) {
        if (value instanceof DictExpr) {
            return transform((DictExpr)value);
        } else if (value instanceof ListExpr || value instanceof TupleExpr) {
            List<Expression> elements = value instanceof ListExpr ? ((ListExpr)value).getElements()
                                                                  : ((TupleExpr)value).getElements();
            List<Object> result = new ArrayList<>();
            for (Expression element : elements) {
                if (InputDataReferences.isReference(element) || InputDataReferences.isInputObject(element)) {
                    throw new WorkflowGraphBuildException(
                            "References to `data` inside a list can only appear within a nested dict", element);
                }
                result.add(transformValue(element));
            }
            return result;
        }
        return LiteralValues.evaluate(value);
    }
}
