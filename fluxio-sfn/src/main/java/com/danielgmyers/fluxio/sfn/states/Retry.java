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

package com.danielgmyers.fluxio.sfn.states;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A retry policy attached to a task.
 */
public final class Retry {

    private final List<String> errors;
    private final long intervalSeconds;
    private final long maxAttempts;
    private final Number backoffRate;

    public Retry(List<String> errors, long intervalSeconds, long maxAttempts, Number backoffRate) {
        this.errors = List.copyOf(errors);
        this.intervalSeconds = intervalSeconds;
        this.maxAttempts = maxAttempts;
        this.backoffRate = backoffRate;
    }

    public List<String> getErrors() {
        return errors;
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public long getMaxAttempts() {
        return maxAttempts;
    }

    public Number getBackoffRate() {
        return backoffRate;
    }

    public Map<String, Object> render() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("ErrorEquals", errors);
        document.put("IntervalSeconds", intervalSeconds);
        document.put("MaxAttempts", maxAttempts);
        document.put("BackoffRate", backoffRate);
        return document;
    }
}
