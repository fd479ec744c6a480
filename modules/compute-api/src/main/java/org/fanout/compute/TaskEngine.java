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


package org.fanout.compute;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Futures-based task engine: accepts task submissions without blocking, runs a task on a bounded worker pool once every
 * future among its arguments has resolved, and hands results back through {@link FutureRef} handles.
 *
 * <p>An engine is explicitly owned: it is created by the code that uses it and released with {@link #close()}, which
 * drains in-flight tasks and stops the workers.
 */
public interface TaskEngine extends AutoCloseable {
    /**
     * Submits a task. Arguments may be literal values or handles returned by earlier calls to this engine; a handle argument
     * is replaced by its value before the payload runs. Never blocks on task execution.
     *
     * <p>A single {@link List} argument is taken as the argument list, see {@link #submit(RemoteFunction, List)}.
     *
     * @param function Function to run.
     * @param args Arguments.
     * @param <R> Result type.
     * @return Handle of the task result.
     * @throws ComputeException With {@code INVALID_SUBMISSION_ERR} if the submission is malformed, with {@code NODE_STOPPING_ERR}
     *         if the engine is stopping.
     */
    <R> FutureRef<R> submit(RemoteFunction<R> function, Object... args);

    /**
     * Submits a task with the given argument list.
     *
     * @param function Function to run.
     * @param args Arguments, literal values or handles.
     * @param <R> Result type.
     * @return Handle of the task result.
     * @throws ComputeException With {@code INVALID_SUBMISSION_ERR} if the submission is malformed, with {@code NODE_STOPPING_ERR}
     *         if the engine is stopping.
     */
    <R> FutureRef<R> submit(RemoteFunction<R> function, List<?> args);

    /**
     * Places a value into the engine, returning a ready handle that can be passed to later submissions.
     *
     * @param value Value.
     * @param <T> Value type.
     * @return Ready handle.
     */
    <T> FutureRef<T> put(T value);

    /**
     * Waits for the future and returns its value.
     *
     * @param ref Handle.
     * @param <T> Value type.
     * @return Value.
     * @throws TaskExecutionException If the task, or one of the tasks it depends on, failed.
     */
    <T> T get(FutureRef<T> ref);

    /**
     * Waits at most the given time for the future and returns its value. The task itself is not affected by the timeout.
     *
     * @param ref Handle.
     * @param timeout Maximum time to wait.
     * @param unit Time unit of the timeout.
     * @param <T> Value type.
     * @return Value.
     * @throws TaskExecutionException If the task, or one of the tasks it depends on, failed.
     * @throws ComputeException With {@code RESULT_TIMEOUT_ERR} if the future did not resolve in time.
     */
    <T> T get(FutureRef<T> ref, long timeout, TimeUnit unit);

    /**
     * Waits for all futures and returns their values in the order of the handles.
     *
     * @param refs Handles.
     * @param <T> Value type.
     * @return Values.
     * @throws TaskExecutionException If any of the tasks failed.
     */
    <T> List<T> getMany(List<FutureRef<T>> refs);

    /**
     * Returns a future completed with the value of the handle, or exceptionally with its {@link TaskExecutionException}.
     *
     * @param ref Handle.
     * @param <T> Value type.
     * @return Future.
     */
    <T> CompletableFuture<T> getAsync(FutureRef<T> ref);

    /**
     * Waits until at least {@code numReady} of the futures have resolved or failed, or until the timeout elapses.
     *
     * @param refs Handles.
     * @param numReady Number of resolved futures to wait for, between 1 and the number of handles.
     * @param timeout Maximum time to wait.
     * @param unit Time unit of the timeout.
     * @param <T> Value type.
     * @return At most {@code numReady} completed handles and the remaining ones, both in input order.
     */
    <T> WaitResult<T> waitFor(List<FutureRef<T>> refs, int numReady, long timeout, TimeUnit unit);

    /**
     * Returns the current state of the future without blocking.
     *
     * @param ref Handle.
     * @return State.
     */
    FutureState state(FutureRef<?> ref);

    /**
     * Returns a snapshot of the engine counters.
     *
     * @return Metrics.
     */
    EngineMetrics metrics();

    /**
     * Stops accepting submissions, waits for in-flight tasks to finish and releases the workers. Idempotent.
     */
    @Override
    void close();
}
