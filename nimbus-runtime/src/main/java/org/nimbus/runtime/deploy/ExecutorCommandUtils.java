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

package org.nimbus.runtime.deploy;

import org.nimbus.configuration.DriverOptions;
import org.nimbus.configuration.ExecutorOptions;

import org.apache.commons.text.StringTokenizer;
import org.apache.commons.text.matcher.StringMatcherFactory;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.ConfigurationUtils;

import javax.annotation.Nullable;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Utilities to assemble the command that launches executor processes. */
public class ExecutorCommandUtils {

    /** Main class of the executor processes. */
    public static final String EXECUTOR_MAIN_CLASS =
            "org.nimbus.runtime.executor.CoarseGrainedExecutorBackend";

    /**
     * If this system property is set, the driver's class path is handed down to the executors so
     * that they run against the same classes in tests.
     */
    public static final String TESTING_PROPERTY = "nimbus.testing";

    private static final String[] STARTUP_OPTION_PREFIXES = {"pekko.", "security."};

    private ExecutorCommandUtils() {}

    /**
     * Creates the command that workers use to launch executors for this driver.
     *
     * @param configuration the driver configuration
     * @param driverUrl URL under which the executors reach the driver's scheduler endpoint
     */
    public static ExecutorCommand createExecutorCommand(
            Configuration configuration, String driverUrl) {
        final List<String> arguments =
                Arrays.asList(
                        "--driver-url", driverUrl,
                        "--executor-id", "{{EXECUTOR_ID}}",
                        "--hostname", "{{HOSTNAME}}",
                        "--cores", "{{CORES}}",
                        "--app-id", "{{APP_ID}}",
                        "--worker-url", "{{WORKER_URL}}");

        final Map<String, String> environment =
                ConfigurationUtils.getPrefixedKeyValuePairs(
                        ExecutorOptions.ENV_PREFIX, configuration);

        final List<String> classPathEntries =
                new ArrayList<>(
                        splitPaths(
                                configuration
                                        .getOptional(ExecutorOptions.EXTRA_CLASSPATH)
                                        .orElse(null)));
        if (System.getProperty(TESTING_PROPERTY) != null) {
            classPathEntries.addAll(splitPaths(System.getProperty("java.class.path")));
        }

        final List<String> libraryPathEntries =
                splitPaths(
                        configuration.getOptional(ExecutorOptions.EXTRA_LIBRARY_PATH).orElse(null));

        final List<String> javaOptions = new ArrayList<>(getStartupJavaOptions(configuration));
        configuration
                .getOptional(ExecutorOptions.EXTRA_JAVA_OPTIONS)
                .ifPresent(options -> javaOptions.addAll(splitCommandString(options)));

        return new ExecutorCommand(
                EXECUTOR_MAIN_CLASS,
                arguments,
                environment,
                classPathEntries,
                libraryPathEntries,
                javaOptions);
    }

    /**
     * Returns the {@code -Dkey=value} options executors need to be able to connect back to the
     * driver, ordered by key.
     */
    static List<String> getStartupJavaOptions(Configuration configuration) {
        final Map<String, String> startupOptions = new TreeMap<>();
        for (Map.Entry<String, String> entry : configuration.toMap().entrySet()) {
            if (isExecutorStartupOption(entry.getKey())) {
                startupOptions.put(entry.getKey(), entry.getValue());
            }
        }

        final List<String> javaOptions = new ArrayList<>(startupOptions.size());
        startupOptions.forEach((key, value) -> javaOptions.add("-D" + key + "=" + value));
        return javaOptions;
    }

    static boolean isExecutorStartupOption(String key) {
        if (key.equals(DriverOptions.HOST.key()) || key.equals(DriverOptions.PORT.key())) {
            return true;
        }
        for (String prefix : STARTUP_OPTION_PREFIXES) {
            if (key.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** Splits a command line on whitespace, keeping single or double quoted parts together. */
    public static List<String> splitCommandString(String command) {
        final StringTokenizer tokenizer = new StringTokenizer(command);
        tokenizer.setDelimiterMatcher(StringMatcherFactory.INSTANCE.splitMatcher());
        tokenizer.setQuoteMatcher(StringMatcherFactory.INSTANCE.quoteMatcher());
        tokenizer.setIgnoreEmptyTokens(true);
        return tokenizer.getTokenList();
    }

    private static List<String> splitPaths(@Nullable String paths) {
        if (paths == null || paths.isEmpty()) {
            return Collections.emptyList();
        }

        final List<String> entries = new ArrayList<>();
        for (String entry : paths.split(File.pathSeparator)) {
            if (!entry.isEmpty()) {
                entries.add(entry);
            }
        }
        return entries;
    }
}
