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
import org.apache.flink.util.Preconditions;

import java.util.function.IntSupplier;

/**
 * Decides whether enough resource units have registered to release work to the scheduler: the
 * registered units must reach the configured minimum ratio of the expected total.
 *
 * <p>The registered units are owned by the backend that counts them. This class only reads them
 * through the supplier, so the supplier must provide atomic reads of the current value.
 *
 * <p>An expected total of zero means "no cap was configured". The predicate is then always
 * satisfied.
 */
public class ResourceSufficiencyPredicate {

    private final IntSupplier registeredUnits;

    private final int expectedTotal;

    private final double minRatio;

    public ResourceSufficiencyPredicate(
            IntSupplier registeredUnits, int expectedTotal, double minRatio) {
        this.registeredUnits = Preconditions.checkNotNull(registeredUnits);
        Preconditions.checkArgument(
                expectedTotal >= 0, "The expected total must not be negative.");
        this.expectedTotal = expectedTotal;
        this.minRatio = minRatio;
    }

    public boolean isSufficient() {
        return registeredUnits.getAsInt() >= expectedTotal * minRatio;
    }

    @VisibleForTesting
    int getExpectedTotal() {
        return expectedTotal;
    }
}
