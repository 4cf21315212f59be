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

/**
 * Client which registers an application with a standalone cluster master and relays the master's
 * events to a {@link StandaloneAppClientListener}.
 */
public interface StandaloneAppClient {

    /**
     * Starts registering the application with the master. Returns without waiting for the
     * registration; its outcome is reported to the listener.
     */
    void start() throws Exception;

    /** Unregisters the application and stops the client. */
    void stop();
}
