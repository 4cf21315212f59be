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

import org.nimbus.runtime.deploy.ApplicationDescription;

import org.apache.flink.configuration.Configuration;

import java.util.List;

/** Factory for {@link StandaloneAppClient}. */
@FunctionalInterface
public interface StandaloneAppClientFactory {

    /**
     * Creates a client that registers the described application with one of the given masters.
     *
     * @param masterUrls URLs of the masters to try
     * @param description the application to register
     * @param listener listener receiving the cluster events
     * @param configuration the driver configuration
     */
    StandaloneAppClient createClient(
            List<String> masterUrls,
            ApplicationDescription description,
            StandaloneAppClientListener listener,
            Configuration configuration);
}
