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

package org.nimbus.runtime.deploy.client;

import javax.annotation.Nullable;

/**
 * Callbacks invoked by a {@link StandaloneAppClient} when events happen on the cluster.
 *
 * <p>Callbacks are called from the client's own threads, possibly concurrently with each other.
 * Implementations must be thread safe.
 */
public interface StandaloneAppClientListener {

    /** The application was registered with the master under the given id. */
    void connected(String appId);

    /**
     * The connection to the master was lost. This may be temporary, e.g. while the master fails
     * over; {@link #connected(String)} is called again once the client reconnects.
     */
    void disconnected();

    /** The application was terminated by the master and cannot recover. */
    void dead(String reason);

    /**
     * The master granted an executor to the application. May be called more than once for the
     * same executor.
     *
     * @param fullId executor id in the form {@code <appId>/<executorNumber>}
     */
    void executorAdded(String fullId, String workerId, String hostPort, int cores, int memory);

    /**
     * An executor of the application was removed.
     *
     * @param fullId executor id in the form {@code <appId>/<executorNumber>}
     * @param message message describing the removal
     * @param exitStatus exit code of the executor process, or null if it is not known
     */
    void executorRemoved(String fullId, String message, @Nullable Integer exitStatus);
}
