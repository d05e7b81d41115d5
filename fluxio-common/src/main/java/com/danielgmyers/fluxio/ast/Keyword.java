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
 * A {@code name=value} argument of a {@link Call}.
 */
public final class Keyword extends Node {

    private final String arg;
    private final Expression value;

    public Keyword(int line, int column, String arg, Expression value) {
        super(line, column);
        this.arg = arg;
        this.value = value;
    }

    /**
     * The keyword name, or null for a {@code **kwargs} expansion.
     */
    public String getArg() {
        return arg;
    }

    public Expression getValue() {
        return value;
    }
}
