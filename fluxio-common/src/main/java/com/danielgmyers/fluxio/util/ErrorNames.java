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

import com.danielgmyers.fluxio.ast.Attribute;
import com.danielgmyers.fluxio.ast.Constant;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ex.WorkflowGraphBuildException;

/**
 * Converts exception class references into the error names used by Retry, Catch and Fail states.
 */
public final class ErrorNames {

    /**
     * Prefix of the built-in error names, e.g. {@code States.ALL} or {@code States.Timeout}.
     */
    public static final String STATES_PREFIX = "States";

    public static final String MATCH_ALL = STATES_PREFIX + ".ALL";

    private ErrorNames() {}

    public static String serialize(Expression expression) {
        if (expression instanceof Name) {
            return ((Name)expression).getId();
        } else if (expression instanceof Attribute) {
            Attribute attribute = (Attribute)expression;
            if (attribute.getValue() instanceof Name && ((Name)attribute.getValue()).is(STATES_PREFIX)) {
                return STATES_PREFIX + "." + attribute.getAttr();
            }
        } else if (expression instanceof Constant && ((Constant)expression).isString()) {
            return (String)((Constant)expression).getValue();
        }
        throw new WorkflowGraphBuildException(
                "Error handler must be a tuple of exception classes or a single exception class.", expression);
    }
}
