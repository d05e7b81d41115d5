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

import com.danielgmyers.fluxio.sfn.states.tasks.TaskServiceRegistry;

/**
 * Container for configuration data used by the compiler.
 */
public class CompilerConfig {

    private boolean replaceEmptyExcept = true;
    private TaskServiceRegistry taskServiceRegistry = TaskServiceRegistry.defaultRegistry();
    private boolean prettyPrint = true;

    public boolean isReplaceEmptyExcept() {
        return replaceEmptyExcept;
    }

    /**
     * Controls whether a bare {@code except:} handler is rewritten to catch {@code States.ALL}. When disabled,
     * a bare handler is rejected.
     *
     * Defaults to true.
     */
    public void setReplaceEmptyExcept(boolean replaceEmptyExcept) {
        this.replaceEmptyExcept = replaceEmptyExcept;
    }

    public TaskServiceRegistry getTaskServiceRegistry() {
        return taskServiceRegistry;
    }

    /**
     * Sets the registry mapping a work unit's service attribute to its task state variant.
     * The registered service kinds are also the allowed values of the attribute.
     *
     * This value may not be null; it defaults to the built-in AWS service variants.
     */
    public void setTaskServiceRegistry(TaskServiceRegistry taskServiceRegistry) {
        if (taskServiceRegistry == null) {
            throw new IllegalArgumentException("taskServiceRegistry may not be null.");
        }
        this.taskServiceRegistry = taskServiceRegistry;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    /**
     * Controls whether JSON output is indented. Defaults to true.
     */
    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }
}
