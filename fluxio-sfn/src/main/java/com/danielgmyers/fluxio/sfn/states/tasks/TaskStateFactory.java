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

package com.danielgmyers.fluxio.sfn.states.tasks;

import java.util.Collections;
import java.util.Map;

import com.danielgmyers.fluxio.options.CallableOption;

/**
 * Creates the task state variant for one service kind.
 */
public interface TaskStateFactory {

    TaskState create(TaskInvocation invocation);

    /**
     * Call options accepted in addition to {@code key} and {@code timeout}.
     */
    default Map<String, CallableOption> getAdditionalOptions() {
        return Collections.emptyMap();
    }
}
