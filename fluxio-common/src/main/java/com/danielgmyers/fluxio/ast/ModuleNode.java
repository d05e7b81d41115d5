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
 * The root of a parsed workflow script.
 */
public final class ModuleNode extends Node {

    private final List<Statement> body;

    public ModuleNode(List<Statement> body) {
        super(1, 0);
        this.body = List.copyOf(body);
    }

    public List<Statement> getBody() {
        return body;
    }
}
