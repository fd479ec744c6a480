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


package org.fanout.internal.compute;

import static org.fanout.internal.util.ExceptionUtils.sneakyThrow;
import static org.fanout.internal.util.ExceptionUtils.unwrapCause;
import static org.fanout.lang.ErrorGroups.Common.INTERNAL_ERR;
import static org.fanout.lang.ErrorGroups.Compute.RESULT_TIMEOUT_ERR;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.fanout.compute.ComputeException;

/**
 * Blocking helpers shared by the engine internals.
 */
final class ComputeUtils {
    /**
     * Waits for the future and returns its result. The failure cause is rethrown as is, so every waiter of the same future
     * observes the same exception instance.
     *
     * @param future Future to wait for.
     * @param <T> Result type.
     * @return Future result.
     */
    static <T> T sync(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // Restore interrupt flag.

            throw new ComputeException(INTERNAL_ERR, "Interrupted while waiting for a future", e);
        } catch (ExecutionException e) {
            throw sneakyThrow(unwrapCause(e));
        }
    }

    /**
     * Waits at most the given time for the future and returns its result.
     *
     * @param future Future to wait for.
     * @param timeout Maximum time to wait.
     * @param unit Time unit of the timeout.
     * @param <T> Result type.
     * @return Future result.
     * @throws ComputeException With {@code RESULT_TIMEOUT_ERR} if the future did not complete in time.
     */
    static <T> T sync(CompletableFuture<T> future, long timeout, TimeUnit unit) {
        try {
            return future.get(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt(); // Restore interrupt flag.

            throw new ComputeException(INTERNAL_ERR, "Interrupted while waiting for a future", e);
        } catch (ExecutionException e) {
            throw sneakyThrow(unwrapCause(e));
        } catch (TimeoutException e) {
            throw new ComputeException(RESULT_TIMEOUT_ERR, "Future did not resolve in " + timeout + ' ' + unit, e);
        }
    }

    private ComputeUtils() {
    }
}
