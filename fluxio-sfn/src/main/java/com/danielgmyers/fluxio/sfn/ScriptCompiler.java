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

package com.danielgmyers.fluxio.sfn;

import com.danielgmyers.fluxio.ast.ModuleNode;
import com.danielgmyers.fluxio.ast.ScriptTreeReader;
import com.danielgmyers.fluxio.sfn.transform.ScriptNormalizer;
import com.danielgmyers.fluxio.sfn.visitors.DeclarationCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a parsed workflow script into Step Functions state machine definitions.
 *
 * Compilation is fail-fast: the first structural problem aborts it with a
 * {@link com.danielgmyers.fluxio.ex.WorkflowGraphBuildException}.
 */
public class ScriptCompiler {

    private static final Logger log = LoggerFactory.getLogger(ScriptCompiler.class);

    private final CompilerConfig config;

    public ScriptCompiler() {
        this(new CompilerConfig());
    }

    public ScriptCompiler(CompilerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config may not be null.");
        }
        this.config = config;
    }

    public CompiledScript compile(ModuleNode module) {
        ModuleNode normalized = new ScriptNormalizer(config.isReplaceEmptyExcept()).normalize(module);

        DeclarationCollector collector = new DeclarationCollector(config.getTaskServiceRegistry());
        collector.collect(normalized);

        log.info("Compiled {} work units, {} event processors and {} state machines.",
                 collector.getTaskDefinitions().size(), collector.getEventProcessors().size(),
                 collector.getStateMachines().size());
        return new CompiledScript(collector.getTaskDefinitions(), collector.getEventProcessors(),
                                  collector.getStateMachines(), config.isPrettyPrint());
    }

    /**
     * Compiles a script tree serialized as JSON.
     *
     * @throws com.danielgmyers.fluxio.ex.ScriptTreeFormatException if the JSON is not a valid script tree
     */
    public CompiledScript compileJson(String json) {
        return compile(ScriptTreeReader.read(json));
    }
}
