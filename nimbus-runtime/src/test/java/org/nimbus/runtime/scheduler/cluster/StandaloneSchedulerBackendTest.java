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
import org.nimbus.runtime.deploy.client.StandaloneAppClientFactory;
import org.nimbus.runtime.deploy.client.TestingStandaloneAppClient;
import org.nimbus.runtime.scheduler.ConnectionLost;
import org.nimbus.runtime.scheduler.ExecutorExited;
import org.nimbus.runtime.scheduler.ExecutorLossReason;
import org.nimbus.runtime.scheduler.TestingTaskScheduler;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.IllegalConfigurationException;
import org.apache.flink.configuration.MemorySize;
import org.apache.flink.core.testutils.CheckedThread;
import org.apache.flink.core.testutils.OneShotLatch;
import org.apache.flink.testutils.logging.LoggerAuditingExtension;
import org.apache.flink.util.clock.ManualClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.slf4j.event.Level;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for the {@link StandaloneSchedulerBackend}. */
class StandaloneSchedulerBackendTest {

    private static final List<String> MASTER_URLS =
            Collections.singletonList("nimbus://master-1:7077");

    @RegisterExtension
    final LoggerAuditingExtension loggerAuditingExtension =
            new LoggerAuditingExtension(StandaloneSchedulerBackend.class, Level.WARN);

    private List<String> schedulerErrors;

    private Map<String, ExecutorLossReason> lostExecutors;

    private AtomicInteger applicationStops;

    private TestingTaskScheduler scheduler;

    private ManualClock clock;

    @BeforeEach
    void setup() {
        schedulerErrors = new CopyOnWriteArrayList<>();
        lostExecutors = new ConcurrentHashMap<>();
        applicationStops = new AtomicInteger();
        scheduler =
                TestingTaskScheduler.newBuilder()
                        .setErrorConsumer(schedulerErrors::add)
                        .setExecutorLostConsumer(lostExecutors::put)
                        .build();
        clock = new ManualClock();
    }

    // ------------------------------------------------------------------------
    //  Registration
    // ------------------------------------------------------------------------

    @Test
    void testStartBlocksUntilConnected() throws Exception {
        final OneShotLatch connectTrigger = new OneShotLatch();
        final AtomicReference<CheckedThread> clientThread = new AtomicReference<>();
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(
                                        listener -> {
                                            // the master answers from the client's own thread
                                            final CheckedThread thread =
                                                    new CheckedThread() {
                                                        @Override
                                                        public void go() throws Exception {
                                                            connectTrigger.await();
                                                            listener.connected("app-1");
                                                        }
                                                    };
                                            clientThread.set(thread);
                                            thread.start();
                                        })
                                .buildFactory());

        final AtomicBoolean started = new AtomicBoolean(false);
        final CheckedThread starter =
                new CheckedThread() {
                    @Override
                    public void go() throws Exception {
                        backend.start();
                        started.set(true);
                    }
                };
        starter.start();

        starter.join(100);
        assertThat(started.get()).isFalse();
        assertThat(starter.isAlive()).isTrue();

        connectTrigger.trigger();
        starter.sync();
        clientThread.get().sync();

        assertThat(started.get()).isTrue();
        assertThat(backend.applicationId()).isEqualTo("app-1");
        assertThat(schedulerErrors).isEmpty();
    }

    @Test
    void testConnectedBeforeWaitingDoesNotBlock() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(listener -> listener.connected("app-2"))
                                .buildFactory());

        backend.start();

        assertThat(backend.applicationId()).isEqualTo("app-2");
    }

    @Test
    void testDisconnectBeforeConnectReleasesStart() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(listener -> listener.disconnected())
                                .buildFactory());

        backend.start();

        assertThat(backend.applicationId()).startsWith("nimbus-application-");
        assertThat(schedulerErrors).isEmpty();
    }

    @Test
    void testDeadBeforeConnectFailsStart() {
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(
                                        listener -> listener.dead("Master removed our application"))
                                .buildFactory());

        assertThatThrownBy(backend::start)
                .isInstanceOf(SchedulerBackendException.class)
                .hasMessageContaining("Master removed our application");

        assertThat(schedulerErrors).containsExactly("Master removed our application");
        assertThat(applicationStops.get()).isOne();
    }

    @Test
    void testClientStartFailureFailsStart() {
        final IOException failure = new IOException("All masters are unresponsive");
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(
                                        listener -> {
                                            throw failure;
                                        })
                                .buildFactory());

        assertThatThrownBy(backend::start)
                .isInstanceOf(SchedulerBackendException.class)
                .hasCause(failure);
    }

    @Test
    void testMissingDriverAddressFailsStart() {
        final Configuration configuration = new Configuration();
        configuration.set(DriverOptions.PORT, 35000);
        final StandaloneSchedulerBackend backend =
                createBackend(
                        configuration, TestingStandaloneAppClient.newBuilder().buildFactory());

        assertThatThrownBy(backend::start)
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining(DriverOptions.HOST.key());
    }

    // ------------------------------------------------------------------------
    //  Lifecycle events
    // ------------------------------------------------------------------------

    @Test
    void testReconnectKeepsApplicationId() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(listener -> listener.connected("app-1"))
                                .buildFactory());
        backend.start();
        assertThat(backend.applicationId()).isEqualTo("app-1");

        backend.disconnected();
        assertThat(backend.applicationId()).isEqualTo("app-1");

        backend.connected("app-1");
        assertThat(backend.applicationId()).isEqualTo("app-1");

        assertThat(loggerAuditingExtension.getMessages())
                .singleElement()
                .asString()
                .contains("Disconnected");
        assertThat(schedulerErrors).isEmpty();
        assertThat(applicationStops.get()).isZero();
    }

    @Test
    void testApplicationIdIsNeverReassigned() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStartConsumer(listener -> listener.connected("app-1"))
                                .buildFactory());
        backend.start();

        backend.connected("app-2");

        assertThat(backend.applicationId()).isEqualTo("app-1");
    }

    @Test
    void testDeadReportsFatalError() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();

        backend.dead("Master removed our application: KILLED");

        assertThat(schedulerErrors).containsExactly("Master removed our application: KILLED");
        assertThat(applicationStops.get()).isOne();
    }

    @Test
    void testDeadAfterStopIsSuppressed() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();

        backend.stop();
        backend.dead("network partition");
        backend.disconnected();

        assertThat(schedulerErrors).isEmpty();
        assertThat(applicationStops.get()).isZero();
        assertThat(loggerAuditingExtension.getMessages()).isEmpty();
    }

    @Test
    void testCallbacksTriggeredByClientStopAreSuppressed() throws Exception {
        final AtomicBoolean stoppingWhenClientStopped = new AtomicBoolean(false);
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStopConsumer(
                                        listener -> {
                                            stoppingWhenClientStopped.set(
                                                    ((StandaloneSchedulerBackend) listener)
                                                            .isStopping());
                                            listener.disconnected();
                                            listener.dead("Application unregistered");
                                        })
                                .buildFactory());
        backend.start();

        backend.stop();

        assertThat(stoppingWhenClientStopped.get()).isTrue();
        assertThat(schedulerErrors).isEmpty();
        assertThat(applicationStops.get()).isZero();
        assertThat(loggerAuditingExtension.getMessages()).isEmpty();
    }

    @Test
    void testExecutorAddedIsTolerated() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();

        backend.executorAdded("app-1/0", "worker-7", "host-7:4040", 4, 2048);
        backend.executorAdded("app-1/0", "worker-7", "host-7:4040", 4, 2048);

        assertThat(backend.getNumRegisteredExecutors()).isZero();
    }

    @Test
    void testExecutorRemovedWithoutExitCode() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();
        backend.registerExecutor("3", "host-7:4040", 4);

        backend.executorRemoved("worker-7/3", "oom", null);

        assertThat(lostExecutors).containsOnlyKeys("3");
        assertThat(lostExecutors.get("3")).isEqualTo(new ConnectionLost("oom"));
        assertThat(backend.getTotalCoreCount()).isZero();
    }

    @Test
    void testExecutorRemovedWithExitCode() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();
        backend.registerExecutor("3", "host-7:4040", 4);

        backend.executorRemoved("worker-7/3", "exited", 137);

        assertThat(lostExecutors.get("3"))
                .isInstanceOfSatisfying(
                        ExecutorExited.class,
                        exited -> assertThat(exited.getExitCode()).isEqualTo(137));
    }

    @Test
    void testMalformedExecutorIdFails() throws Exception {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();

        assertThatThrownBy(() -> backend.executorRemoved("worker-7", "lost", null))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    // ------------------------------------------------------------------------
    //  Application id, stop
    // ------------------------------------------------------------------------

    @Test
    void testApplicationIdBeforeRegistration() {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());

        assertThat(backend.applicationId()).startsWith("nimbus-application-");
        assertThat(loggerAuditingExtension.getMessages())
                .containsExactly("Application ID is not initialized yet.");
    }

    @Test
    void testStopBeforeStart() {
        final AtomicInteger callbacks = new AtomicInteger();
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.setShutdownCallback(ignored -> callbacks.incrementAndGet());

        backend.stop();

        assertThat(backend.isStopping()).isTrue();
        assertThat(callbacks.get()).isOne();
    }

    @Test
    void testStopIsIdempotent() throws Exception {
        final AtomicInteger clientStops = new AtomicInteger();
        final AtomicReference<StandaloneSchedulerBackend> callbackBackend =
                new AtomicReference<>();
        final StandaloneSchedulerBackend backend =
                createBackend(
                        TestingStandaloneAppClient.newBuilder()
                                .setStopConsumer(ignored -> clientStops.incrementAndGet())
                                .buildFactory());
        backend.setShutdownCallback(callbackBackend::set);
        backend.start();

        backend.stop();
        backend.stop();

        assertThat(clientStops.get()).isOne();
        assertThat(callbackBackend.get()).isSameAs(backend);
    }

    // ------------------------------------------------------------------------
    //  Resources
    // ------------------------------------------------------------------------

    @Test
    void testReadyOnceMinimumRatioRegistered() throws Exception {
        final Configuration configuration = createConfiguration();
        configuration.set(SchedulerOptions.MAX_CORES, 100);
        configuration.set(SchedulerOptions.MIN_REGISTERED_RESOURCES_RATIO, 0.75);
        final StandaloneSchedulerBackend backend =
                createBackend(
                        configuration, TestingStandaloneAppClient.newBuilder().buildFactory());
        backend.start();

        backend.registerExecutor("0", "host-0:4040", 70);
        backend.registerExecutor("1", "host-1:4040", 4);
        assertThat(backend.getTotalCoreCount()).isEqualTo(74);
        assertThat(backend.isReady()).isFalse();

        backend.registerExecutor("2", "host-2:4040", 1);
        assertThat(backend.getTotalCoreCount()).isEqualTo(75);
        assertThat(backend.isReady()).isTrue();

        backend.executorRemoved("app-1/2", "Worker lost", null);
        assertThat(backend.isReady()).isFalse();
    }

    @Test
    void testNoMaxCoresMeansNoGating() throws Exception {
        final Configuration configuration = createConfiguration();
        configuration.set(SchedulerOptions.MIN_REGISTERED_RESOURCES_RATIO, 1.0);
        final StandaloneSchedulerBackend backend =
                createBackend(
                        configuration, TestingStandaloneAppClient.newBuilder().buildFactory());

        assertThat(backend.getResourceSufficiency().getExpectedTotal()).isZero();
        assertThat(backend.isReady()).isTrue();
    }

    @Test
    void testNonPositiveMaxCoresIsRejected() {
        final Configuration configuration = createConfiguration();
        configuration.set(SchedulerOptions.MAX_CORES, 0);

        assertThatThrownBy(
                        () ->
                                createBackend(
                                        configuration,
                                        TestingStandaloneAppClient.newBuilder().buildFactory()))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining(SchedulerOptions.MAX_CORES.key());
    }

    // ------------------------------------------------------------------------
    //  Application description
    // ------------------------------------------------------------------------

    @Test
    void testApplicationDescription() throws Exception {
        final Configuration configuration = createConfiguration();
        configuration.set(DriverOptions.APPLICATION_NAME, "word-count");
        configuration.set(DriverOptions.UI_ADDRESS, "http://driver-host:4040");
        configuration.set(SchedulerOptions.MAX_CORES, 16);
        configuration.set(ExecutorOptions.MEMORY, MemorySize.parse("2g"));
        final AtomicReference<ApplicationDescription> description = new AtomicReference<>();
        final StandaloneSchedulerBackend backend =
                createBackend(
                        configuration,
                        TestingStandaloneAppClient.newBuilder()
                                .setDescriptionConsumer(description::set)
                                .buildFactory());

        backend.start();

        assertThat(description.get().getName()).isEqualTo("word-count");
        assertThat(description.get().getMaxCores()).hasValue(16);
        assertThat(description.get().getMemoryPerExecutor()).isEqualTo(MemorySize.parse("2g"));
        assertThat(description.get().getAppUiAddress()).isEqualTo("http://driver-host:4040");
        assertThat(description.get().getEventLogDir()).isEmpty();
        assertThat(description.get().getEventLogCodec()).isEmpty();
        assertThat(description.get().getCommand().getArguments())
                .containsSubsequence(
                        "--driver-url",
                        "pekko.tcp://nimbusDriver@driver-host:35000/user/CoarseGrainedScheduler");
    }

    @Test
    void testApplicationDescriptionCarriesEventLogSettings() {
        final Configuration configuration = createConfiguration();
        configuration.set(DriverOptions.EVENT_LOG_DIR, "hdfs:///nimbus/events");
        configuration.set(DriverOptions.EVENT_LOG_COMPRESSION_CODEC, "lz4");
        final StandaloneSchedulerBackend backend =
                createBackend(
                        configuration, TestingStandaloneAppClient.newBuilder().buildFactory());

        final ApplicationDescription description = backend.createApplicationDescription();

        assertThat(description.getEventLogDir()).hasValue("hdfs:///nimbus/events");
        assertThat(description.getEventLogCodec()).hasValue("lz4");
    }

    @Test
    void testEventLogCodecIgnoredWithoutEventLogDir() {
        final Configuration configuration = createConfiguration();
        configuration.set(DriverOptions.EVENT_LOG_COMPRESSION_CODEC, "lz4");
        final StandaloneSchedulerBackend backend =
                createBackend(
                        configuration, TestingStandaloneAppClient.newBuilder().buildFactory());

        final ApplicationDescription description = backend.createApplicationDescription();

        assertThat(description.getEventLogDir()).isEmpty();
        assertThat(description.getEventLogCodec()).isEmpty();
    }

    @Test
    void testUncappedApplicationDescription() {
        final StandaloneSchedulerBackend backend =
                createBackend(TestingStandaloneAppClient.newBuilder().buildFactory());

        final ApplicationDescription description = backend.createApplicationDescription();

        assertThat(description.getMaxCores()).isEmpty();
        assertThat(description.getName()).isEqualTo(DriverOptions.APPLICATION_NAME.defaultValue());
        assertThat(description.getAppUiAddress()).isEmpty();
    }

    // ------------------------------------------------------------------------

    private static Configuration createConfiguration() {
        final Configuration configuration = new Configuration();
        configuration.set(DriverOptions.HOST, "driver-host");
        configuration.set(DriverOptions.PORT, 35000);
        return configuration;
    }

    private StandaloneSchedulerBackend createBackend(StandaloneAppClientFactory clientFactory) {
        return createBackend(createConfiguration(), clientFactory);
    }

    private StandaloneSchedulerBackend createBackend(
            Configuration configuration, StandaloneAppClientFactory clientFactory) {
        return new StandaloneSchedulerBackend(
                scheduler,
                configuration,
                MASTER_URLS,
                clientFactory,
                applicationStops::incrementAndGet,
                clock);
    }
}
