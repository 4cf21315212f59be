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

package org.nimbus.runtime.scheduler.cluster;

import org.apache.flink.util.Preconditions;

/** Bookkeeping of an executor registered with a {@link CoarseGrainedSchedulerBackend}. */
public class ExecutorData {

    private final String executorId;

    private final String hostPort;

    private final int totalCores;

    public ExecutorData(String executorId, String hostPort, int totalCores) {
        this.executorId = Preconditions.checkNotNull(executorId);
        this.hostPort = Preconditions.checkNotNull(hostPort);
        Preconditions.checkArgument(totalCores > 0, "An executor needs at least one core.");
        this.totalCores = totalCores;
    }

    public String getExecutorId() {
        return executorId;
    }

    public String getHostPort() {
        return hostPort;
    }

    public int getTotalCores() {
        return totalCores;
    }

    @Override
    public String toString() {
        return "ExecutorData{"
                + "executorId='"
                + executorId
                + '\''
                + ", hostPort='"
                + hostPort
                + '\''
                + ", totalCores="
                + totalCores
                + '}';
    }
}
