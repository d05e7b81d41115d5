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

import java.util.Collections;
import java.util.List;

import com.danielgmyers.fluxio.options.ResolvedOptions;

/**
 * The resolved workflow-level decorators of one state machine function. Absent decorators are null.
 */
public final class WorkflowDecorators {

    public static final WorkflowDecorators NONE = new WorkflowDecorators(null, null, Collections.emptyList(), null);

    private final ResolvedOptions schedule;
    private final ResolvedOptions export;
    private final List<ResolvedOptions> subscriptions;
    private final ResolvedOptions eventProcessor;

    public WorkflowDecorators(ResolvedOptions schedule, ResolvedOptions export, List<ResolvedOptions> subscriptions,
                              ResolvedOptions eventProcessor) {
        this.schedule = schedule;
        this.export = export;
        this.subscriptions = List.copyOf(subscriptions);
        this.eventProcessor = eventProcessor;
    }

    public ResolvedOptions getSchedule() {
        return schedule;
    }

    public ResolvedOptions getExport() {
        return export;
    }

    public List<ResolvedOptions> getSubscriptions() {
        return subscriptions;
    }

    public ResolvedOptions getEventProcessor() {
        return eventProcessor;
    }
}
