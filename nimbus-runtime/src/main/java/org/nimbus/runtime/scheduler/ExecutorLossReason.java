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

import org.apache.flink.util.Preconditions;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Explanation for why an executor is no longer available to the application. There are exactly
 * two kinds of loss: the executor process exited with a known exit code ({@link ExecutorExited}),
 * or the executor was lost without one ({@link ConnectionLost}).
 *
 * <p>Use {@link #fromRemoval(Integer, String)} to classify a removal reported by the cluster
 * master.
 */
public abstract class ExecutorLossReason implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String message;

    // only the two subclasses in this package
    ExecutorLossReason(String message) {
        this.message = Preconditions.checkNotNull(message);
    }

    /** Human-readable description of the loss. */
    public String getMessage() {
        return message;
    }

    /**
     * Classifies an executor removal. A removal that carries an exit code always is an {@link
     * ExecutorExited}, one without is always a {@link ConnectionLost}.
     *
     * @param exitCode exit code of the executor process, or {@code null} if unknown
     * @param message message the cluster master attached to the removal
     */
    public static ExecutorLossReason fromRemoval(@Nullable Integer exitCode, String message) {
        if (exitCode != null) {
            return new ExecutorExited(exitCode);
        } else {
            return new ConnectionLost(message);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return message.equals(((ExecutorLossReason) o).message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), message);
    }

    @Override
    public String toString() {
        return message;
    }
}
