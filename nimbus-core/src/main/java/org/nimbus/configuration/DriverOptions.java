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

/** Configuration options of the driver process. */
@PublicEvolving
public class DriverOptions {

    public static final ConfigOption<String> APPLICATION_NAME =
            ConfigOptions.key("driver.application.name")
                    .stringType()
                    .defaultValue("nimbus-application")
                    .withDescription(
                            "The name under which the application registers with the master.");

    /** The address executors use to reach the driver. */
    public static final ConfigOption<String> HOST =
            ConfigOptions.key("driver.host")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Hostname or IP address of the driver. Executors connect back to the"
                                    + " driver through this address.");

    public static final ConfigOption<Integer> PORT =
            ConfigOptions.key("driver.port")
                    .intType()
                    .noDefaultValue()
                    .withDescription("The port the driver's scheduler endpoint listens on.");

    public static final ConfigOption<String> UI_ADDRESS =
            ConfigOptions.key("driver.ui.address")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Address of the driver's web UI, reported to the master so that it can"
                                    + " link to the application.");

    public static final ConfigOption<String> EVENT_LOG_DIR =
            ConfigOptions.key("driver.event-log.dir")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Directory the application's event log is written to, if any.");

    /** Only reported to the master together with {@link #EVENT_LOG_DIR}. */
    public static final ConfigOption<String> EVENT_LOG_COMPRESSION_CODEC =
            ConfigOptions.key("driver.event-log.compression-codec")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Short name of the codec used to compress the event log. The event log"
                                    + " is written uncompressed if unset.");

    // ------------------------------------------------------------------------

    /** Not intended to be instantiated. */
    private DriverOptions() {}
}
