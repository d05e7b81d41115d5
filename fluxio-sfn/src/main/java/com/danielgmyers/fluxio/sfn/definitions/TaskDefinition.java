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

package com.danielgmyers.fluxio.sfn.definitions;

import java.util.List;

import com.danielgmyers.fluxio.ast.ClassDef;
import com.danielgmyers.fluxio.ast.FunctionDef;
import com.danielgmyers.fluxio.ast.Statement;
import com.danielgmyers.fluxio.options.ResolvedOptions;

/**
 * A work unit declared by a class deriving from Task.
 *
 * The run method is payload: it is exposed, minus its top-level imports, for splicing into the unit's
 * generated entry point, and is never analyzed beyond that.
 */
public final class TaskDefinition {

    private final String name;
    private final ClassDef node;
    private final ResolvedOptions attributes;
    private final FunctionDef runMethod;
    private final List<Statement> imports;
    private final List<String> dependencies;

    public TaskDefinition(String name, ClassDef node, ResolvedOptions attributes, FunctionDef runMethod,
                          List<Statement> imports, List<String> dependencies) {
        this.name = name;
        this.node = node;
        this.attributes = attributes;
        this.runMethod = runMethod;
        this.imports = List.copyOf(imports);
        this.dependencies = List.copyOf(dependencies);
    }

    public String getName() {
        return name;
    }

    public ClassDef getNode() {
        return node;
    }

    /**
     * All supported class attributes, with defaults filled in.
     */
    public ResolvedOptions getAttributes() {
        return attributes;
    }

    /**
     * The run method with its top-level import statements removed.
     */
    public FunctionDef getRunMethod() {
        return runMethod;
    }

    /**
     * The import statements removed from the run method, in source order.
     */
    public List<Statement> getImports() {
        return imports;
    }

    /**
     * The distinct root module names imported by the run method, in source order.
     */
    public List<String> getDependencies() {
        return dependencies;
    }

    public String getServiceKind() {
        return attributes.getString(TaskAttributes.SERVICE);
    }

    public long getTimeout() {
        return attributes.getLong(TaskAttributes.TIMEOUT);
    }

    public Long getHeartbeatInterval() {
        return attributes.getLong(TaskAttributes.HEARTBEAT_INTERVAL);
    }
}
