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

package org.nimbus.runtime.scheduler;

/**
 * The task scheduler that owns a {@link SchedulerBackend}. The backend reports executor losses
 * and fatal cluster errors to it.
 */
public interface TaskScheduler {

    /**
     * Called when an executor is lost. Tasks running on it have to be rescheduled.
     *
     * @param executorId identifier of the lost executor
     * @param reason why the executor was lost
     */
    void executorLost(String executorId, ExecutorLossReason reason);

    /**
     * Called when the backend can no longer schedule any work, e.g. because the application was
     * killed by the cluster master. Fails all pending jobs with the given message.
     *
     * @param message description of the error
     */
    void error(String message);
}
