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

import org.apache.flink.annotation.VisibleForTesting;

import javax.annotation.concurrent.GuardedBy;

/**
 * A one-way gate that blocks callers of {@link #await()} until the registration of the
 * application with the cluster master has completed, either successfully or not.
 *
 * <p>The gate opens on the first call to {@link #signal()} and never closes again. Further calls
 * to {@link #signal()} have no effect. Calls to {@link #await()} made after the gate opened return
 * immediately. Everything a thread did before calling {@link #signal()} is visible to a thread
 * returning from {@link #await()}.
 *
 * <p>The gate imposes no timeout. It relies on the client that delivers the registration events
 * to eventually report either success or failure.
 */
public class RegistrationGate {

    /** The object that serves as lock for the done-flag. */
    private final Object lock;

    /** This flag indicates whether registration completed. */
    @GuardedBy("lock")
    private boolean done;

    public RegistrationGate() {
        this.lock = new Object();
        this.done = false;
    }

    /**
     * Blocks until the gate is opened by a call to {@link #signal()}. Returns immediately if the
     * gate is already open.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void await() throws InterruptedException {

        synchronized (lock) {

            while (!done) {
                lock.wait();
            }
        }
    }

    /**
     * Opens the gate and releases all threads waiting in {@link #await()}. Idempotent.
     *
     * @return true if this call opened the gate, false if it was already open
     */
    public boolean signal() {

        synchronized (lock) {

            if (done) {
                return false;
            }

            done = true;
            lock.notifyAll();
            return true;
        }
    }

    @VisibleForTesting
    boolean isDone() {
        synchronized (lock) {
            return done;
        }
    }
}
