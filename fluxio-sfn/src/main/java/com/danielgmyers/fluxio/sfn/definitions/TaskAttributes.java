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

import java.util.Set;

import com.danielgmyers.fluxio.options.CallableOption;
import com.danielgmyers.fluxio.options.OptionSchema;
import com.danielgmyers.fluxio.options.ValueShape;

/**
 * The class attributes a work unit may declare.
 */
public final class TaskAttributes {

    public static final String SERVICE = "service";
    public static final String TIMEOUT = "timeout";
    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String BUILD_SPEC = "build_spec";
    public static final String AUTOSCALING_MIN = "autoscaling_min";
    public static final String AUTOSCALING_MAX = "autoscaling_max";
    public static final String SPEC = "spec";
    public static final String CONCURRENCY = "concurrency";
    public static final String HEARTBEAT_INTERVAL = "heartbeat_interval";

    public static final String DEFAULT_SERVICE = "lambda";
    public static final long DEFAULT_TIMEOUT = 300;

    private TaskAttributes() {}

    /**
     * @param serviceKinds The service kinds a work unit may declare.
     */
    public static OptionSchema schema(Set<String> serviceKinds) {
        return new OptionSchema()
                .add(SERVICE, CallableOption.builder("string", ValueShape.STRING)
                                            .defaultValue(DEFAULT_SERVICE)
                                            .allowedValues(serviceKinds.toArray()).build())
                .add(TIMEOUT, integer(DEFAULT_TIMEOUT))
                .add(CPU, integer(1024L))
                .add(MEMORY, integer(2048L))
                .add(BUILD_SPEC, CallableOption.builder("dict", ValueShape.DICT).defaultValue(null).build())
                .add(AUTOSCALING_MIN, integer(0L))
                .add(AUTOSCALING_MAX, integer(10L))
                .add(SPEC, CallableOption.builder("string", ValueShape.STRING).defaultValue("").build())
                .add(CONCURRENCY, CallableOption.builder("integer", ValueShape.INTEGER)
                                                .defaultValue(1L)
                                                .allowedRange(1, 100).build())
                .add(HEARTBEAT_INTERVAL, integer(null));
    }

    private static CallableOption integer(Long defaultValue) {
        return CallableOption.builder("integer", ValueShape.INTEGER).defaultValue(defaultValue).build();
    }
}
