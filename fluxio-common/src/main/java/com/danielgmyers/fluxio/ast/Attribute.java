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

public final class Attribute extends Expression {

    private final Expression value;
    private final String attr;

    public Attribute(int line, int column, Expression value, String attr) {
        super(line, column);
        this.value = value;
        this.attr = attr;
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}
