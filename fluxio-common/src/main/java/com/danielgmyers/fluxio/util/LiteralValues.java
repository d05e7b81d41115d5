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

/**
 * Literal evaluation of constant expressions into plain java values that jackson can serialize.
 * Dicts become LinkedHashMaps so that key order is preserved in the output.
 */
public final class LiteralValues {

    private LiteralValues() {}

    public static boolean isLiteral(Expression expression) {
        if (expression instanceof Constant) {
            return true;
        } else if (expression instanceof DictExpr) {
            DictExpr dict = (DictExpr)expression;
            for (Expression key : dict.getKeys()) {
                if (!(key instanceof Constant) || ((Constant)key).isNone()) {
                    return false;
                }
            }
            return dict.getValues().stream().allMatch(LiteralValues::isLiteral);
        } else if (expression instanceof ListExpr) {
            return ((ListExpr)expression).getElements().stream().allMatch(LiteralValues::isLiteral);
        } else if (expression instanceof TupleExpr) {
            return ((TupleExpr)expression).getElements().stream().allMatch(LiteralValues::isLiteral);
        }
        return false;
    }

    public static Object evaluate(Expression expression) {
        if (!isLiteral(expression)) {
            throw new WorkflowGraphBuildException("Value must be JSON-serializeable", expression);
        }
        return evaluateLiteral(expression);
    }

    private static Object evaluateLiteral(Expression expression) {
        if (expression instanceof Constant) {
            return ((Constant)expression).getValue();
        } else if (expression instanceof DictExpr) {
            DictExpr dict = (DictExpr)expression;
            Map<String, Object> result = new LinkedHashMap<>();
            for (int i = 0; i < dict.getKeys().size(); i++) {
                Object key = ((Constant)dict.getKeys().get(i)).getValue();
                result.put(String.valueOf(key), evaluateLiteral(dict.getValues().get(i)));
            }
            return result;
        }
        List<Expression> elements = expression instanceof ListExpr ? ((ListExpr)expression).getElements()
                                                                   : ((TupleExpr)expression).getElements();
        List<Object> result = new ArrayList<>();
        for (Expression element : elements) {
            result.add(evaluateLiteral(element));
        }
        return result;
    }
}
