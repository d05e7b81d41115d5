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

package com.danielgmyers.fluxio.util;

import java.util.Set;

import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ast.SourceRenderer;
import com.danielgmyers.fluxio.ast.Subscript;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;

/**
 * Helpers for references into the execution's input data, i.e. subscripts of the {@code data} object.
 *
 * A reference such as {@code data["foo"]["bar"]} converts to the path {@code $['foo']['bar']}.
 */
public final class InputDataReferences {

    public static final String INPUT_OBJECT_NAME = "data";

    public static final String ROOT_PATH = "$";

    /**
     * Keys of the input data that are managed by the compiled state machine itself.
     */
    public static final Set<String> RESERVED_KEYS = Set.of("__trace");

    private InputDataReferences() {}

    /**
     * Returns true if the expression is {@code data[...]}, at any depth.
     */
    public static boolean isReference(Expression expression) {
        if (!(expression instanceof Subscript)) {
            return false;
        }
        Expression value = ((Subscript)expression).getValue();
        while (value instanceof Subscript) {
            value = ((Subscript)value).getValue();
        }
        return value instanceof Name && ((Name)value).is(INPUT_OBJECT_NAME);
    }

    /**
     * Returns true if the expression is the bare input object name.
     */
    public static boolean isInputObject(Expression expression) {
        return expression instanceof Name && ((Name)expression).is(INPUT_OBJECT_NAME);
    }

    public static String toPath(Expression expression) {
        if (!isReference(expression)) {
            throw new WorkflowGraphBuildException("Expected a reference to a key on `data`", expression);
        }
        return ROOT_PATH + SourceRenderer.render(expression).substring(INPUT_OBJECT_NAME.length());
    }

    /**
     * Returns true if the path names a reserved key anywhere in it.
     */
    public static boolean isReservedPath(String path) {
        for (String key : RESERVED_KEYS) {
            if (path.contains(key)) {
                return true;
            }
        }
        return false;
    }
}
