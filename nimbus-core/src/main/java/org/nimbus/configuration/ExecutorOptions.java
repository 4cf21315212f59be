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
import org.apache.flink.configuration.MemorySize;

/** Configuration options for the executor processes launched on behalf of the application. */
@PublicEvolving
public class ExecutorOptions {

    /**
     * Prefix for passing custom environment variables to the executor processes. For example,
     * {@code executor.env.LD_LIBRARY_PATH: /opt/native} sets {@code LD_LIBRARY_PATH} for every
     * executor.
     */
    public static final String ENV_PREFIX = "executor.env.";

    public static final ConfigOption<MemorySize> MEMORY =
            ConfigOptions.key("executor.memory")
                    .memoryType()
                    .defaultValue(MemorySize.parse("1g"))
                    .withDescription("Amount of memory to use per executor process.");

    public static final ConfigOption<String> EXTRA_JAVA_OPTIONS =
            ConfigOptions.key("executor.extra-java-options")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Additional JVM options for the executor processes. Options are split"
                                    + " on whitespace; quoted sections are kept together.");

    public static final ConfigOption<String> EXTRA_CLASSPATH =
            ConfigOptions.key("executor.extra-classpath")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Extra class path entries, separated by the platform path separator,"
                                    + " to prepend to the class path of the executors.");

    public static final ConfigOption<String> EXTRA_LIBRARY_PATH =
            ConfigOptions.key("executor.extra-library-path")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Native library path entries, separated by the platform path"
                                    + " separator, to use when launching executors.");

    // ------------------------------------------------------------------------

    /** Not intended to be instantiated. */
    private ExecutorOptions() {}
}
