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

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.apache.flink.util.Preconditions.checkNotNull;

/**
 * The command a worker runs to launch an executor process. Arguments may contain placeholders such
 * as {@code {{EXECUTOR_ID}}} which the worker substitutes before launching.
 */
public class ExecutorCommand implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String mainClass;

    private final List<String> arguments;

    private final Map<String, String> environment;

    private final List<String> classPathEntries;

    private final List<String> libraryPathEntries;

    private final List<String> javaOptions;

    public ExecutorCommand(
            String mainClass,
            List<String> arguments,
            Map<String, String> environment,
            List<String> classPathEntries,
            List<String> libraryPathEntries,
            List<String> javaOptions) {
        this.mainClass = checkNotNull(mainClass);
        this.arguments = Collections.unmodifiableList(checkNotNull(arguments));
        this.environment = Collections.unmodifiableMap(checkNotNull(environment));
        this.classPathEntries = Collections.unmodifiableList(checkNotNull(classPathEntries));
        this.libraryPathEntries = Collections.unmodifiableList(checkNotNull(libraryPathEntries));
        this.javaOptions = Collections.unmodifiableList(checkNotNull(javaOptions));
    }

    public String getMainClass() {
        return mainClass;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public List<String> getClassPathEntries() {
        return classPathEntries;
    }

    public List<String> getLibraryPathEntries() {
        return libraryPathEntries;
    }

    public List<String> getJavaOptions() {
        return javaOptions;
    }

    @Override
    public String toString() {
        return "ExecutorCommand{"
                + "mainClass='"
                + mainClass
                + '\''
                + ", arguments="
                + arguments
                + ", environment="
                + environment.keySet()
                + ", classPathEntries="
                + classPathEntries
                + ", libraryPathEntries="
                + libraryPathEntries
                + ", javaOptions="
                + javaOptions
                + '}';
    }
}
