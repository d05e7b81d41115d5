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

public final class DictExpr extends Expression {

    private final List<Expression> keys;
    private final List<Expression> values;

    public DictExpr(int line, int column, List<Expression> keys, List<Expression> values) {
        super(line, column);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("A dict literal needs exactly one value per key.");
        }
        this.keys = List.copyOf(keys);
        this.values = List.copyOf(values);
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDict(this);
    }
}
