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

import org.nimbus.configuration.DriverOptions;
import org.nimbus.configuration.ExecutorOptions;
import org.nimbus.configuration.SchedulerOptions;
import org.nimbus.runtime.deploy.ApplicationDescription;
import org.nimbus.runtime.deploy.ExecutorCommand;
import org.nimbus.runtime.deploy.ExecutorCommandUtils;
import org.nimbus.runtime.deploy.client.ApplicationContainer;
import org.nimbus.runtime.deploy.client.StandaloneAppClient;
import org.nimbus.runtime.deploy.client.StandaloneAppClientFactory;
import org.nimbus.runtime.deploy.client.StandaloneAppClientListener;
import org.nimbus.runtime.scheduler.ExecutorLossReason;
import org.nimbus.runtime.scheduler.TaskScheduler;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.IllegalConfigurationException;
import org.apache.flink.configuration.MemorySize;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.clock.Clock;
import org.apache.flink.util.clock.SystemClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Scheduler backend for standalone clusters. Registers the application with the standalone
 * master through a {@link StandaloneAppClient} and reacts to the master's events.
 *
 * <p>{@link #start()} blocks until the master either accepted the application or terminated it.
 * Afterwards the backend tracks executor grants and losses for the lifetime of the application.
 * Losing the application on the master is fatal: the scheduler is failed and the application is
 * stopped.
 *
 * <p>All {@link StandaloneAppClientListener} callbacks may be called concurrently from the
 * client's threads.
 */
public class StandaloneSchedulerBackend extends CoarseGrainedSchedulerBackend
        implements StandaloneAppClientListener {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneSchedulerBackend.class);

    /** Name of the driver's actor system in the driver URL handed to executors. */
    static final String DRIVER_SYSTEM_NAME = "nimbusDriver";

    static final String DRIVER_PROTOCOL = "pekko.tcp";

    private final List<String> masterUrls;

    private final StandaloneAppClientFactory clientFactory;

    private final ApplicationContainer applicationContainer;

    /** Released once the master connected us or terminated the application. */
    private final RegistrationGate registrationGate;

    /** The id assigned by the master. Set at most once. */
    private final AtomicReference<String> appId;

    /** Set before the client is stopped, so the resulting callbacks are known to be expected. */
    private final AtomicBoolean stopping;

    @Nullable private final Integer maxCores;

    private final ResourceSufficiencyPredicate resourceSufficiency;

    @Nullable private volatile StandaloneAppClient client;

    @Nullable private volatile Consumer<StandaloneSchedulerBackend> shutdownCallback;

    /** Reason of an unexpected termination by the master, if any. */
    @Nullable private volatile String deathReason;

    public StandaloneSchedulerBackend(
            TaskScheduler scheduler,
            Configuration configuration,
            List<String> masterUrls,
            StandaloneAppClientFactory clientFactory,
            ApplicationContainer applicationContainer) {
        this(
                scheduler,
                configuration,
                masterUrls,
                clientFactory,
                applicationContainer,
                SystemClock.getInstance());
    }

    @VisibleForTesting
    StandaloneSchedulerBackend(
            TaskScheduler scheduler,
            Configuration configuration,
            List<String> masterUrls,
            StandaloneAppClientFactory clientFactory,
            ApplicationContainer applicationContainer,
            Clock clock) {
        super(scheduler, configuration, clock);

        Preconditions.checkNotNull(masterUrls);
        Preconditions.checkArgument(!masterUrls.isEmpty(), "At least one master URL is required.");
        this.masterUrls = new ArrayList<>(masterUrls);
        this.clientFactory = Preconditions.checkNotNull(clientFactory);
        this.applicationContainer = Preconditions.checkNotNull(applicationContainer);

        this.registrationGate = new RegistrationGate();
        this.appId = new AtomicReference<>();
        this.stopping = new AtomicBoolean(false);

        this.maxCores = getMaxCores(configuration).orElse(null);
        final int totalExpectedCores = maxCores != null ? maxCores : 0;
        this.resourceSufficiency =
                new ResourceSufficiencyPredicate(
                        totalCoreCount::get, totalExpectedCores, minRegisteredRatio);
    }

    // ------------------------------------------------------------------------
    //  SchedulerBackend
    // ------------------------------------------------------------------------

    @Override
    public void start() throws Exception {
        super.start();

        final ApplicationDescription description = createApplicationDescription();
        final StandaloneAppClient appClient =
                clientFactory.createClient(masterUrls, description, this, configuration);
        client = appClient;

        try {
            appClient.start();
        } catch (Exception e) {
            throw new SchedulerBackendException(
                    "Could not start the standalone application client.", e);
        }

        waitForRegistration();

        final String reason = deathReason;
        if (appId.get() == null && reason != null) {
            throw new SchedulerBackendException(
                    "Application was killed before it registered with the master. Reason: "
                            + reason);
        }
    }

    @Override
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }

        super.stop();

        final StandaloneAppClient appClient = client;
        if (appClient != null) {
            appClient.stop();
        }

        final Consumer<StandaloneSchedulerBackend> callback = shutdownCallback;
        if (callback != null) {
            callback.accept(this);
        }
    }

    @Override
    public String applicationId() {
        final String id = appId.get();
        if (id == null) {
            LOG.warn("Application ID is not initialized yet.");
            return super.applicationId();
        }
        return id;
    }

    @Override
    protected boolean sufficientResourcesRegistered() {
        return resourceSufficiency.isSufficient();
    }

    /**
     * Sets a callback that is invoked with this backend after the client has been stopped.
     *
     * @param shutdownCallback callback to invoke on stop, or null to remove it
     */
    public void setShutdownCallback(
            @Nullable Consumer<StandaloneSchedulerBackend> shutdownCallback) {
        this.shutdownCallback = shutdownCallback;
    }

    // ------------------------------------------------------------------------
    //  StandaloneAppClientListener
    // ------------------------------------------------------------------------

    @Override
    public void connected(String appId) {
        LOG.info("Connected to standalone cluster with app ID {}.", appId);

        if (!this.appId.compareAndSet(null, appId) && !appId.equals(this.appId.get())) {
            LOG.warn(
                    "Master reported app ID {} after reconnecting, keeping the app ID {}.",
                    appId,
                    this.appId.get());
        }

        registrationGate.signal();
    }

    @Override
    public void disconnected() {
        registrationGate.signal();

        if (!stopping.get()) {
            LOG.warn("Disconnected from standalone cluster! Waiting for reconnection...");
        }
    }

    @Override
    public void dead(String reason) {
        final boolean expected = stopping.get();
        if (!expected) {
            // must be visible to start() before the gate opens
            deathReason = reason;
        }

        registrationGate.signal();

        if (!expected) {
            LOG.error("Application has been killed. Reason: {}", reason);
            scheduler.error(reason);
            // we can no longer run jobs
            applicationContainer.stopApplication();
        }
    }

    @Override
    public void executorAdded(
            String fullId, String workerId, String hostPort, int cores, int memory) {
        LOG.info(
                "Granted executor ID {} on worker {} ({}) with {} cores, {} RAM.",
                fullId,
                workerId,
                hostPort,
                cores,
                MemorySize.ofMebiBytes(memory).toHumanReadableString());
    }

    @Override
    public void executorRemoved(String fullId, String message, @Nullable Integer exitStatus) {
        final ExecutorLossReason reason = ExecutorLossReason.fromRemoval(exitStatus, message);
        LOG.info("Executor {} removed: {}", fullId, message);
        removeExecutor(fullId.split("/")[1], reason);
    }

    // ------------------------------------------------------------------------
    //  Internal
    // ------------------------------------------------------------------------

    private void waitForRegistration() throws InterruptedException {
        registrationGate.await();
    }

    @VisibleForTesting
    ApplicationDescription createApplicationDescription() {
        final ExecutorCommand command =
                ExecutorCommandUtils.createExecutorCommand(configuration, getDriverUrl());

        final String eventLogDir =
                configuration.getOptional(DriverOptions.EVENT_LOG_DIR).orElse(null);
        // a codec without an event log has nothing to compress
        final String eventLogCodec =
                eventLogDir == null
                        ? null
                        : configuration
                                .getOptional(DriverOptions.EVENT_LOG_COMPRESSION_CODEC)
                                .orElse(null);

        return new ApplicationDescription(
                configuration.get(DriverOptions.APPLICATION_NAME),
                maxCores,
                configuration.get(ExecutorOptions.MEMORY),
                command,
                configuration.getOptional(DriverOptions.UI_ADDRESS).orElse(""),
                eventLogDir,
                eventLogCodec);
    }

    @VisibleForTesting
    String getDriverUrl() {
        final String host =
                configuration
                        .getOptional(DriverOptions.HOST)
                        .orElseThrow(() -> missingOption(DriverOptions.HOST.key()));
        final int port =
                configuration
                        .getOptional(DriverOptions.PORT)
                        .orElseThrow(() -> missingOption(DriverOptions.PORT.key()));

        return String.format(
                "%s://%s@%s:%d/user/%s",
                DRIVER_PROTOCOL, DRIVER_SYSTEM_NAME, host, port, ENDPOINT_NAME);
    }

    @VisibleForTesting
    boolean isStopping() {
        return stopping.get();
    }

    @VisibleForTesting
    ResourceSufficiencyPredicate getResourceSufficiency() {
        return resourceSufficiency;
    }

    private static IllegalConfigurationException missingOption(String key) {
        return new IllegalConfigurationException(
                "The standalone scheduler backend requires '" + key + "' to be configured.");
    }

    private static Optional<Integer> getMaxCores(Configuration configuration) {
        final Optional<Integer> maxCores = configuration.getOptional(SchedulerOptions.MAX_CORES);

        if (maxCores.isPresent() && maxCores.get() <= 0) {
            throw new IllegalConfigurationException(
                    String.format(
                            "The value of '%s' must be positive, but was %s.",
                            SchedulerOptions.MAX_CORES.key(),
                            maxCores.get()));
        }
        return maxCores;
    }
}
