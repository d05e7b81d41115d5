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

package com.danielgmyers.fluxio.ast;

/**
 * A literal. The value is a String, Long, Double, Boolean, or null for {@code None}.
 */
public final class Constant extends Expression {

    private final Object value;

    public Constant(int line, int column, Object value) {
        super(line, column);
        if (value != null && !(value instanceof String) && !(value instanceof Long)
                && !(value instanceof Double) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isInteger() {
        return value instanceof Long;
    }

    public boolean isNumber() {
        return value instanceof Long || value instanceof Double;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public boolean isNone() {
        return value == null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
