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
 * A backend that provides the {@link TaskScheduler} with executors on some cluster manager.
 */
public interface SchedulerBackend {

    /**
     * Starts the backend. Returns once the backend is able to receive executors.
     *
     * @throws Exception if the backend could not be started
     */
    void start() throws Exception;

    /** Stops the backend. Calling this method more than once, or before start, is allowed. */
    void stop();

    /**
     * Returns whether the backend has acquired enough resources for the scheduler to start
     * submitting work.
     */
    boolean isReady();

    /**
     * Returns the identifier the cluster manager assigned to the application. Never fails; if the
     * application has not been registered yet, a locally generated fallback is returned.
     */
    String applicationId();
}
