/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.nimbus.configuration;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

import java.time.Duration;

/** Configuration options for the scheduler backends. */
@PublicEvolving
public class SchedulerOptions {

    /**
     * The maximum number of cores requested for the application across the cluster. If not set,
     * the application takes whatever the cluster master offers and registration is not gated.
     */
    public static final ConfigOption<Integer> MAX_CORES =
            ConfigOptions.key("scheduler.cores.max")
                    .intType()
                    .noDefaultValue()
                    .withDescription(
                            "The maximum amount of cores to request for the application from across"
                                    + " the cluster. When not set, no cap is applied and the scheduler"
                                    + " does not wait for a minimum amount of registered cores.");

    public static final ConfigOption<Double> MIN_REGISTERED_RESOURCES_RATIO =
            ConfigOptions.key("scheduler.min-registered-resources-ratio")
                    .doubleType()
                    .defaultValue(0.0)
                    .withDescription(
                            "The minimum ratio of registered cores (registered cores / total expected"
                                    + " cores) to wait for before scheduling begins. Must be within"
                                    + " [0, 1]. Waiting is bounded by '"
                                    + "scheduler.max-registered-resources-waiting-time'.");

    public static final ConfigOption<Duration> MAX_REGISTERED_RESOURCES_WAITING_TIME =
            ConfigOptions.key("scheduler.max-registered-resources-waiting-time")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(30))
                    .withDescription(
                            "Maximum amount of time to wait for resources to register before"
                                    + " scheduling begins, regardless of the registered ratio.");

    /** Minimum value of {@link #MIN_REGISTERED_RESOURCES_RATIO}. */
    public static final double MIN_RATIO = 0.0;

    /** Maximum value of {@link #MIN_REGISTERED_RESOURCES_RATIO}. */
    public static final double MAX_RATIO = 1.0;

    // ------------------------------------------------------------------------

    /** Not intended to be instantiated. */
    private SchedulerOptions() {}
}
