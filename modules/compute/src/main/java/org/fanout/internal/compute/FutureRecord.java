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

import static org.fanout.compute.FutureState.FAILED;
import static org.fanout.compute.FutureState.PENDING;
import static org.fanout.compute.FutureState.READY;
import static org.fanout.lang.ErrorGroups.Compute.FUTURE_ALREADY_COMPLETED_ERR;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.fanout.compute.FutureState;
import org.fanout.internal.lang.FanoutInternalException;
import org.jetbrains.annotations.Nullable;

/**
 * State of one future. Subscription of dependent tasks and the transition out of {@link FutureState#PENDING} are done under
 * the record monitor, so a task either subscribes before the transition and is notified, or sees the final state.
 */
final class FutureRecord {
    private final FutureHandle<?> handle;

    /** Completed after the transition, outside of the monitor. */
    private final CompletableFuture<Object> result = new CompletableFuture<>();

    private FutureState state = PENDING;

    @Nullable
    private Object value;

    @Nullable
    private Throwable error;

    /** Tasks waiting for this future, {@code null} once the future has left the pending state. */
    @Nullable
    private List<TaskNode> subscribers = new ArrayList<>(2);

    /** Set when the engine failed the future on a forced stop. */
    private boolean abandoned;

    FutureRecord(FutureHandle<?> handle) {
        this.handle = handle;
    }

    FutureHandle<?> handle() {
        return handle;
    }

    long id() {
        return handle.id();
    }

    CompletableFuture<Object> result() {
        return result;
    }

    synchronized FutureState state() {
        return state;
    }

    @Nullable
    synchronized Object value() {
        return value;
    }

    @Nullable
    synchronized Throwable error() {
        return error;
    }

    /**
     * Subscribes a task to the completion of this future.
     *
     * @param task Dependent task.
     * @return {@code false} if the future has already left the pending state; the task is not subscribed then.
     */
    synchronized boolean subscribe(TaskNode task) {
        if (state != PENDING) {
            return false;
        }

        subscribers.add(task);

        return true;
    }

    /**
     * Moves the future to its final state.
     *
     * @param newState {@link FutureState#READY} or {@link FutureState#FAILED}.
     * @param value Value for a ready future.
     * @param error Error for a failed future.
     * @return Subscribed tasks to notify, or {@code null} if the future was abandoned and the completion is dropped.
     * @throws FanoutInternalException If the future is already completed.
     */
    @Nullable
    synchronized List<TaskNode> complete(FutureState newState, @Nullable Object value, @Nullable Throwable error) {
        assert newState != PENDING;

        if (state != PENDING) {
            if (abandoned) {
                return null;
            }

            throw new FanoutInternalException(
                    FUTURE_ALREADY_COMPLETED_ERR,
                    "Future is already completed [id={}, state={}, newState={}]",
                    handle.id(), state, newState
            );
        }

        state = newState;

        if (newState == READY) {
            this.value = value;
        } else {
            this.error = error;
        }

        List<TaskNode> res = subscribers;

        subscribers = null;

        return res;
    }

    /**
     * Fails the future if it is still pending and marks it abandoned, so that a late completion is dropped.
     *
     * @param error Error.
     * @return {@code true} if the future was pending.
     */
    synchronized boolean abandon(Throwable error) {
        if (state != PENDING) {
            return false;
        }

        state = FAILED;
        this.error = error;
        abandoned = true;
        subscribers = null;

        return true;
    }

    @Override
    public synchronized String toString() {
        return "FutureRecord [id=" + handle.id() + ", state=" + state + ", abandoned=" + abandoned + ']';
    }
}
