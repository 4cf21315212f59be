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

package org.nimbus.runtime.deploy;

import org.apache.flink.configuration.MemorySize;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Optional;

import static org.apache.flink.util.Preconditions.checkNotNull;

/** Everything the cluster master needs to know to accept an application and launch executors. */
public class ApplicationDescription implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    /** Maximum number of cores across the cluster, or null if not capped. */
    @Nullable private final Integer maxCores;

    private final MemorySize memoryPerExecutor;

    private final ExecutorCommand command;

    private final String appUiAddress;

    @Nullable private final String eventLogDir;

    @Nullable private final String eventLogCodec;

    public ApplicationDescription(
            String name,
            @Nullable Integer maxCores,
            MemorySize memoryPerExecutor,
            ExecutorCommand command,
            String appUiAddress,
            @Nullable String eventLogDir,
            @Nullable String eventLogCodec) {
        this.name = checkNotNull(name);
        this.maxCores = maxCores;
        this.memoryPerExecutor = checkNotNull(memoryPerExecutor);
        this.command = checkNotNull(command);
        this.appUiAddress = checkNotNull(appUiAddress);
        this.eventLogDir = eventLogDir;
        this.eventLogCodec = eventLogCodec;
    }

    public String getName() {
        return name;
    }

    public Optional<Integer> getMaxCores() {
        return Optional.ofNullable(maxCores);
    }

    public MemorySize getMemoryPerExecutor() {
        return memoryPerExecutor;
    }

    public ExecutorCommand getCommand() {
        return command;
    }

    public String getAppUiAddress() {
        return appUiAddress;
    }

    public Optional<String> getEventLogDir() {
        return Optional.ofNullable(eventLogDir);
    }

    public Optional<String> getEventLogCodec() {
        return Optional.ofNullable(eventLogCodec);
    }

    @Override
    public String toString() {
        return "ApplicationDescription(" + name + ")";
    }
}
