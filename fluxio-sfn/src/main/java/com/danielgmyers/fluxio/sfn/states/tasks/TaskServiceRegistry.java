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

import java.util.Set;

/**
 * Maps the service kind declared by a work unit (its {@code service} attribute) to a task state variant.
 * The registered kinds are also the allowed values of that attribute.
 */
public interface TaskServiceRegistry {

    Set<String> getServiceKinds();

    /**
     * @return The factory for the given service kind, or null if the kind is not registered.
     */
    TaskStateFactory getFactory(String serviceKind);

    static TaskServiceRegistry defaultRegistry() {
        return new DefaultTaskServiceRegistry();
    }
}
