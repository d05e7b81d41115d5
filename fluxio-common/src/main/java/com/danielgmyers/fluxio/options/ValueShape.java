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

package com.danielgmyers.fluxio.options;

import com.danielgmyers.fluxio.ast.Constant;
import com.danielgmyers.fluxio.ast.DictExpr;
import com.danielgmyers.fluxio.ast.Expression;
import com.danielgmyers.fluxio.ast.ListExpr;
import com.danielgmyers.fluxio.ast.Name;
import com.danielgmyers.fluxio.ast.TupleExpr;
import com.danielgmyers.fluxio.util.InputDataReferences;
import com.danielgmyers.fluxio.util.LiteralValues;

/**
 * The expression shapes an option value may take, and how a value of that shape is extracted.
 */
public enum ValueShape {
    STRING {
        @Override
        public boolean matches(Expression value) {
            return value instanceof Constant && ((Constant)value).isString();
        }
    },
    INTEGER {
        @Override
        public boolean matches(Expression value) {
            return value instanceof Constant && ((Constant)value).isInteger();
        }
    },
    NUMBER {
        @Override
        public boolean matches(Expression value) {
            return value instanceof Constant && ((Constant)value).isNumber();
        }
    },
    BOOLEAN {
        @Override
        public boolean matches(Expression value) {
            return value instanceof Constant && ((Constant)value).isBoolean();
        }
    },
    NONE {
        @Override
        public boolean matches(Expression value) {
            return value instanceof Constant && ((Constant)value).isNone();
        }
    },
    DICT {
        @Override
        public boolean matches(Expression value) {
            return value instanceof DictExpr;
        }

        @Override
        public Object extract(Expression value) {
            return LiteralValues.evaluate(value);
        }
    },
    LIST {
        @Override
        public boolean matches(Expression value) {
            return value instanceof ListExpr || value instanceof TupleExpr;
        }

        @Override
        public Object extract(Expression value) {
            return LiteralValues.evaluate(value);
        }
    },
    NAME {
        @Override
        public boolean matches(Expression value) {
            return value instanceof Name;
        }

        @Override
        public Object extract(Expression value) {
            return ((Name)value).getId();
        }
    },
    DATA_REFERENCE {
        @Override
        public boolean matches(Expression value) {
            return InputDataReferences.isReference(value);
        }

        @Override
        public Object extract(Expression value) {
            return InputDataReferences.toPath(value);
        }
    };

    public abstract boolean matches(Expression value);

    /**
     * Extracts the java value of an expression that matches this shape. Constants yield their literal value.
     */
    public Object extract(Expression value) {
        return ((Constant)value).getValue();
    }
}
