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
import static org.fanout.compute.FutureState.READY;
import static org.fanout.internal.compute.ComputeUtils.sync;
import static org.fanout.lang.ErrorGroups.Common.INTERNAL_ERR;
import static org.fanout.lang.ErrorGroups.Compute.UNKNOWN_FUTURE_ERR;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.fanout.compute.ComputeException;
import org.fanout.compute.FutureRef;
import org.fanout.compute.FutureState;
import org.fanout.internal.lang.FanoutInternalException;
import org.fanout.internal.logger.FanoutLogger;
import org.fanout.internal.logger.Loggers;
import org.jetbrains.annotations.Nullable;

/**
 * Holds the state and eventual value of every future of an engine in a table indexed by the handle. Handles carry the id of
 * the store that issued them, so a handle of another engine is never mistaken for a local one.
 *
 * <p>Completion is mutually exclusive per future and concurrent across futures. After the transition the
 * {@link CompletionListener} receives the tasks that subscribed to the future.
 */
class FutureStore {
    private static final FanoutLogger LOG = Loggers.forClass(FutureStore.class);

    private static final AtomicLong STORE_ID_GEN = new AtomicLong();

    private final long storeId = STORE_ID_GEN.incrementAndGet();

    /** Guarded by itself. */
    private final ObjectArrayList<FutureRecord> records = new ObjectArrayList<>();

    private final CompletionListener listener;

    FutureStore(CompletionListener listener) {
        this.listener = listener;
    }

    /**
     * Creates a pending future.
     *
     * @return Handle.
     */
    <T> FutureHandle<T> allocate() {
        synchronized (records) {
            FutureHandle<T> handle = new FutureHandle<>(storeId, records.size());

            records.add(new FutureRecord(handle));

            return handle;
        }
    }

    /**
     * Creates a future that is ready with the given value.
     *
     * @param value Value.
     * @return Handle.
     */
    <T> FutureHandle<T> allocateResolved(@Nullable T value) {
        FutureHandle<T> handle = allocate();

        resolve(handle, value);

        return handle;
    }

    void resolve(FutureRef<?> ref, @Nullable Object value) {
        complete(record(ref), READY, value, null);
    }

    void fail(FutureRef<?> ref, Throwable error) {
        complete(record(ref), FAILED, null, error);
    }

    /**
     * Fails a future without notifying the {@link CompletionListener}. The caller takes over the returned subscribers.
     *
     * @param ref Handle.
     * @param error Error.
     * @return Subscribed tasks, or {@code null} if the future was abandoned.
     */
    @Nullable
    List<TaskNode> failSilently(FutureRef<?> ref, Throwable error) {
        return transition(record(ref), FAILED, null, error);
    }

    private void complete(FutureRecord rec, FutureState state, @Nullable Object value, @Nullable Throwable error) {
        List<TaskNode> dependents = transition(rec, state, value, error);

        if (dependents != null) {
            listener.onCompleted(rec, dependents);
        }
    }

    @Nullable
    private List<TaskNode> transition(FutureRecord rec, FutureState state, @Nullable Object value, @Nullable Throwable error) {
        List<TaskNode> dependents;

        try {
            dependents = rec.complete(state, value, error);
        } catch (FanoutInternalException e) {
            LOG.error("Double resolution of a future [id={}, newState={}]", e, rec.id(), state);

            throw e;
        }

        if (dependents == null) {
            LOG.debug("Completion of an abandoned future is dropped [id={}, state={}]", rec.id(), state);

            return null;
        }

        if (state == READY) {
            rec.result().complete(value);
        } else {
            rec.result().completeExceptionally(error);
        }

        return dependents;
    }

    /**
     * Returns the record of the handle.
     *
     * @param ref Handle.
     * @return Record.
     * @throws ComputeException With {@code UNKNOWN_FUTURE_ERR} if the handle was not issued by this store.
     */
    FutureRecord record(@Nullable FutureRef<?> ref) {
        if (!(ref instanceof FutureHandle)) {
            throw new ComputeException(UNKNOWN_FUTURE_ERR, "Unknown future handle [ref=" + ref + ']');
        }

        FutureHandle<?> handle = (FutureHandle<?>) ref;

        if (handle.storeId() != storeId) {
            throw new ComputeException(UNKNOWN_FUTURE_ERR, "Future handle belongs to another engine [ref=" + ref + ']');
        }

        synchronized (records) {
            return records.get(handle.index());
        }
    }

    /**
     * Checks that the handle was issued by this store.
     *
     * @param ref Handle.
     * @return {@code true} if the handle is known.
     */
    boolean owns(@Nullable FutureRef<?> ref) {
        return ref instanceof FutureHandle && ((FutureHandle<?>) ref).storeId() == storeId;
    }

    /**
     * Returns the value of a ready future without blocking.
     *
     * @param ref Handle.
     * @return Value.
     * @throws FanoutInternalException If the future is not ready.
     */
    @Nullable
    Object valueOf(FutureRef<?> ref) {
        FutureRecord rec = record(ref);

        if (rec.state() != READY) {
            throw new FanoutInternalException(INTERNAL_ERR, "Dependency is not ready [id={}, state={}]", rec.id(), rec.state());
        }

        return rec.value();
    }

    @SuppressWarnings("unchecked")
    <T> T get(FutureRef<T> ref) {
        return (T) sync(record(ref).result());
    }

    @SuppressWarnings("unchecked")
    <T> T get(FutureRef<T> ref, long timeout, TimeUnit unit) {
        return (T) sync(record(ref).result(), timeout, unit);
    }

    /**
     * Waits for all futures. Every handle is checked before waiting starts.
     *
     * @param refs Handles.
     * @return Values in the order of the handles.
     */
    @SuppressWarnings("unchecked")
    <T> List<T> getMany(List<FutureRef<T>> refs) {
        List<FutureRecord> recs = new ArrayList<>(refs.size());

        for (FutureRef<T> ref : refs) {
            recs.add(record(ref));
        }

        List<T> values = new ArrayList<>(recs.size());

        for (FutureRecord rec : recs) {
            values.add((T) sync(rec.result()));
        }

        return values;
    }

    FutureState state(FutureRef<?> ref) {
        return record(ref).state();
    }

    /**
     * Returns a copy of the result future, so that callers cannot complete the record's own future.
     *
     * @param ref Handle.
     * @return Future.
     */
    @SuppressWarnings("unchecked")
    <T> CompletableFuture<T> resultAsync(FutureRef<T> ref) {
        return (CompletableFuture<T>) (CompletableFuture<?>) record(ref).result().copy();
    }

    /**
     * Fails every pending future with the given error. Dependents are not notified: they are pending themselves and get the
     * same error.
     *
     * @param error Error.
     * @return Number of abandoned futures.
     */
    int abandonPending(Throwable error) {
        List<FutureRecord> snapshot;

        synchronized (records) {
            snapshot = new ArrayList<>(records);
        }

        int abandoned = 0;

        for (FutureRecord rec : snapshot) {
            if (rec.abandon(error)) {
                rec.result().completeExceptionally(error);

                abandoned++;
            }
        }

        return abandoned;
    }

    int size() {
        synchronized (records) {
            return records.size();
        }
    }

    /**
     * Receives the tasks subscribed to a future once the future leaves the pending state.
     */
    @FunctionalInterface
    interface CompletionListener {
        void onCompleted(FutureRecord record, List<TaskNode> dependents);
    }
}
