/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fanout.internal.logger;

import org.jetbrains.annotations.Nullable;

/**
 * Engine logger. Messages are patterns with {@code {}} anchors that are substituted by {@code params} only when the level is enabled.
 */
public interface FanoutLogger {
    /** Logs a lifecycle event. */
    void info(String msg, Object... params);

    /** Logs a recoverable problem, such as a forced stop. */
    void warn(String msg, Object... params);

    /** Logs a per-task event. */
    void debug(String msg, Object... params);

    /** Logs a per-task event together with its cause. */
    void debug(String msg, @Nullable Throwable th, Object... params);

    /** Logs a broken invariant or an uncaught failure together with its cause. */
    void error(String msg, @Nullable Throwable th, Object... params);

    /**
     * Checks whether per-task events are logged, so that callers can skip building arguments.
     *
     * @return {@code true} if the debug level is enabled.
     */
    boolean isDebugEnabled();
}
