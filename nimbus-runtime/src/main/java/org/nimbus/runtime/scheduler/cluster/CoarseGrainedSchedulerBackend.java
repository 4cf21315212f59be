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

import org.nimbus.configuration.SchedulerOptions;
import org.nimbus.runtime.scheduler.ExecutorLossReason;
import org.nimbus.runtime.scheduler.SchedulerBackend;
import org.nimbus.runtime.scheduler.TaskScheduler;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.IllegalConfigurationException;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.clock.Clock;
import org.apache.flink.util.clock.SystemClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for scheduler backends that hold on to executors for the lifetime of the
 * application. Keeps track of the registered executors and their cores, and decides when enough
 * of them registered for the scheduler to start submitting work.
 *
 * <p>Subclasses connect to a concrete cluster manager and define what "enough" means by
 * overriding {@link #sufficientResourcesRegistered()}.
 */
public abstract class CoarseGrainedSchedulerBackend implements SchedulerBackend {

    private static final Logger LOG = LoggerFactory.getLogger(CoarseGrainedSchedulerBackend.class);

    /** Name of the endpoint executors connect to. */
    public static final String ENDPOINT_NAME = "CoarseGrainedScheduler";

    protected final Configuration configuration;

    protected final TaskScheduler scheduler;

    /** Total number of cores of all registered executors. */
    protected final AtomicInteger totalCoreCount;

    /** Minimum ratio of registered cores before the backend reports to be ready. */
    protected final double minRegisteredRatio;

    private final Map<String, ExecutorData> executorDataMap;

    private final long maxRegisteredWaitingTimeMillis;

    private final Clock clock;

    private final long createTimeMillis;

    private final String fallbackApplicationId;

    protected CoarseGrainedSchedulerBackend(TaskScheduler scheduler, Configuration configuration) {
        this(scheduler, configuration, SystemClock.getInstance());
    }

    @VisibleForTesting
    protected CoarseGrainedSchedulerBackend(
            TaskScheduler scheduler, Configuration configuration, Clock clock) {
        this.scheduler = Preconditions.checkNotNull(scheduler);
        this.configuration = Preconditions.checkNotNull(configuration);
        this.clock = Preconditions.checkNotNull(clock);

        this.minRegisteredRatio = getMinRegisteredRatio(configuration);
        this.maxRegisteredWaitingTimeMillis = getMaxRegisteredWaitingTime(configuration).toMillis();

        this.totalCoreCount = new AtomicInteger(0);
        this.executorDataMap = new ConcurrentHashMap<>();
        this.createTimeMillis = clock.relativeTimeMillis();
        this.fallbackApplicationId = "nimbus-application-" + clock.absoluteTimeMillis();
    }

    // ------------------------------------------------------------------------
    //  SchedulerBackend
    // ------------------------------------------------------------------------

    @Override
    public void start() throws Exception {
        LOG.info("Starting {}.", getClass().getSimpleName());
    }

    @Override
    public void stop() {
        LOG.info("Stopping {}.", getClass().getSimpleName());
        executorDataMap.clear();
        totalCoreCount.set(0);
    }

    @Override
    public boolean isReady() {
        if (sufficientResourcesRegistered()) {
            LOG.info(
                    "Ready for scheduling after reaching the registered resources ratio of {}.",
                    minRegisteredRatio);
            return true;
        }
        if (clock.relativeTimeMillis() - createTimeMillis >= maxRegisteredWaitingTimeMillis) {
            LOG.info(
                    "Ready for scheduling after waiting {} ms for resources to register.",
                    maxRegisteredWaitingTimeMillis);
            return true;
        }
        return false;
    }

    @Override
    public String applicationId() {
        return fallbackApplicationId;
    }

    /**
     * Returns whether enough resources registered to start scheduling. Backends without a notion
     * of expected resources are always sufficient.
     */
    protected boolean sufficientResourcesRegistered() {
        return true;
    }

    // ------------------------------------------------------------------------
    //  Executor bookkeeping
    // ------------------------------------------------------------------------

    /**
     * Registers an executor that connected back to the driver.
     *
     * @return true if the executor was registered, false if an executor with the same id is
     *     already registered
     */
    public boolean registerExecutor(String executorId, String hostPort, int cores) {
        final ExecutorData executorData = new ExecutorData(executorId, hostPort, cores);

        if (executorDataMap.putIfAbsent(executorId, executorData) != null) {
            LOG.warn("Ignoring duplicate registration of executor {}.", executorId);
            return false;
        }

        totalCoreCount.addAndGet(cores);
        LOG.info(
                "Registered executor {} on {} with {} cores, {} cores registered in total.",
                executorId,
                hostPort,
                cores,
                totalCoreCount.get());
        return true;
    }

    /**
     * Removes an executor and notifies the scheduler about the loss. Unknown executors are
     * ignored.
     */
    public void removeExecutor(String executorId, ExecutorLossReason reason) {
        final ExecutorData executorData = executorDataMap.remove(executorId);

        if (executorData == null) {
            LOG.warn("Asked to remove non-existent executor {}.", executorId);
            return;
        }

        totalCoreCount.addAndGet(-executorData.getTotalCores());
        LOG.info(
                "Lost executor {} on {}: {}",
                executorData.getExecutorId(),
                executorData.getHostPort(),
                reason);
        scheduler.executorLost(executorData.getExecutorId(), reason);
    }

    public int getNumRegisteredExecutors() {
        return executorDataMap.size();
    }

    public int getTotalCoreCount() {
        return totalCoreCount.get();
    }

    // ------------------------------------------------------------------------
    //  Configuration
    // ------------------------------------------------------------------------

    private static double getMinRegisteredRatio(Configuration configuration) {
        final double ratio = configuration.get(SchedulerOptions.MIN_REGISTERED_RESOURCES_RATIO);

        if (ratio < SchedulerOptions.MIN_RATIO || ratio > SchedulerOptions.MAX_RATIO) {
            throw new IllegalConfigurationException(
                    String.format(
                            "The value of '%s' must be within [%s, %s], but was %s.",
                            SchedulerOptions.MIN_REGISTERED_RESOURCES_RATIO.key(),
                            SchedulerOptions.MIN_RATIO,
                            SchedulerOptions.MAX_RATIO,
                            ratio));
        }
        return ratio;
    }

    private static Duration getMaxRegisteredWaitingTime(Configuration configuration) {
        final Duration waitingTime =
                configuration.get(SchedulerOptions.MAX_REGISTERED_RESOURCES_WAITING_TIME);

        if (waitingTime.isNegative()) {
            throw new IllegalConfigurationException(
                    String.format(
                            "The value of '%s' must not be negative, but was %s.",
                            SchedulerOptions.MAX_REGISTERED_RESOURCES_WAITING_TIME.key(),
                            waitingTime));
        }
        return waitingTime;
    }
}
