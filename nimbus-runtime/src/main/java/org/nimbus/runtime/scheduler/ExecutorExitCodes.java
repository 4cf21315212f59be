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

/**
 * Exit codes used by executor processes, and their explanation for the driver's logs. Codes not
 * listed here are either user code calling {@code System.exit} or the process being killed.
 */
public final class ExecutorExitCodes {

    /** The default uncaught exception handler was reached. */
    public static final int UNCAUGHT_EXCEPTION = 50;

    /** The default uncaught exception handler was called and logging the exception failed. */
    public static final int UNCAUGHT_EXCEPTION_TWICE = 51;

    /** The default uncaught exception handler was reached with an {@link OutOfMemoryError}. */
    public static final int OOM = 52;

    /** The disk store failed to create a local temporary directory after many attempts. */
    public static final int DISK_STORE_FAILED_TO_CREATE_DIR = 53;

    /** The external block store failed to initialize after many attempts. */
    public static final int EXTERNAL_BLOCK_STORE_FAILED_TO_INITIALIZE = 54;

    /** The external block store failed to create a local temporary directory. */
    public static final int EXTERNAL_BLOCK_STORE_FAILED_TO_CREATE_DIR = 55;

    private static final int SIGNAL_EXIT_OFFSET = 128;

    private ExecutorExitCodes() {}

    public static String explain(int exitCode) {
        switch (exitCode) {
            case UNCAUGHT_EXCEPTION:
                return "Uncaught exception";
            case UNCAUGHT_EXCEPTION_TWICE:
                return "Uncaught exception, and logging the exception failed";
            case OOM:
                return "OutOfMemoryError";
            case DISK_STORE_FAILED_TO_CREATE_DIR:
                return "Failed to create local directory (bad local dir?)";
            case EXTERNAL_BLOCK_STORE_FAILED_TO_INITIALIZE:
                return "External block store failed to initialize.";
            case EXTERNAL_BLOCK_STORE_FAILED_TO_CREATE_DIR:
                return "External block store failed to create a local temporary directory.";
            default:
                final String unknown = "Unknown executor exit code (" + exitCode + ")";
                if (exitCode > SIGNAL_EXIT_OFFSET) {
                    // shells report death by signal N as 128 + N
                    return unknown
                            + " (died from signal "
                            + (exitCode - SIGNAL_EXIT_OFFSET)
                            + "?)";
                }
                return unknown;
        }
    }
}
