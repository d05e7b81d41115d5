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

import java.util.List;

/**
 * A comparison. The host grammar allows chains such as {@code a < b < c}, hence the parallel lists.
 */
public final class Compare extends Expression {

    private final Expression left;
    private final List<CompareOperator> operators;
    private final List<Expression> comparators;

    public Compare(int line, int column, Expression left, List<CompareOperator> operators,
                   List<Expression> comparators) {
        super(line, column);
        this.left = left;
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOperator> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }
}
