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

import static org.fanout.internal.compute.ComputeUtils.sync;
import static org.fanout.lang.ErrorGroups.Common.ILLEGAL_ARGUMENT_ERR;
import static org.fanout.lang.ErrorGroups.Common.NODE_STOPPING_ERR;
import static org.fanout.lang.ErrorGroups.Compute.INVALID_SUBMISSION_ERR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import org.fanout.compute.ComputeException;
import org.fanout.compute.EngineMetrics;
import org.fanout.compute.FutureRef;
import org.fanout.compute.FutureState;
import org.fanout.compute.RemoteFunction;
import org.fanout.compute.TaskEngine;
import org.fanout.compute.WaitResult;
import org.fanout.internal.compute.configuration.ComputeConfiguration;
import org.fanout.internal.future.InFlightFutures;
import org.fanout.internal.logger.FanoutLogger;
import org.fanout.internal.logger.Loggers;
import org.fanout.internal.manager.FanoutComponent;
import org.fanout.internal.util.BusyLock;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

/**
 * Implementation of {@link TaskEngine}.
 *
 * <p>A submission allocates the result future, registers the task with the {@link DependencyTracker} and returns. The tracker
 * hands ready tasks to the {@link TaskScheduler}, which runs them in the {@link WorkerPool}. Completing a future in the
 * {@link FutureStore} notifies the tracker about the dependents.
 */
public class TaskEngineImpl implements TaskEngine, FanoutComponent {
    private static final FanoutLogger LOG = Loggers.forClass(TaskEngineImpl.class);

    private final String name;

    private final long drainTimeoutMillis;

    /** Busy lock to stop synchronously. */
    private final BusyLock busyLock = new BusyLock();

    /** Prevents double starting of the component. */
    private final AtomicBoolean startGuard = new AtomicBoolean();

    /** Prevents double stopping of the component. */
    private final AtomicBoolean stopGuard = new AtomicBoolean();

    /** Result futures of the submitted tasks that are not completed yet. */
    private final InFlightFutures inFlightFutures = new InFlightFutures();

    private final LongAdder submitted = new LongAdder();

    private final FutureStore store;

    private final DependencyTracker tracker;

    private final WorkerPool workerPool;

    private final TaskScheduler scheduler;

    private volatile boolean started;

    /**
     * Creates an engine. It accepts submissions once {@link #start()} is called.
     *
     * @param configuration Configuration.
     */
    public TaskEngineImpl(ComputeConfiguration configuration) {
        this.name = configuration.engineName();
        this.drainTimeoutMillis = configuration.drainTimeoutMillis();

        store = new FutureStore(this::onFutureCompleted);
        tracker = new DependencyTracker(store, this::onTaskReady);
        workerPool = new WorkerPool(name, configuration.effectivePoolSize(), store);
        scheduler = new TaskScheduler(workerPool);
    }

    @Override
    public void start() {
        if (!startGuard.compareAndSet(false, true)) {
            return;
        }

        workerPool.start();

        started = true;

        LOG.info("Task engine started [name={}, poolSize={}, drainTimeoutMillis={}]", name, workerPool.poolSize(), drainTimeoutMillis);
    }

    @Override
    public void stop() {
        if (!stopGuard.compareAndSet(false, true)) {
            return;
        }

        busyLock.block();

        boolean drained = inFlightFutures.allCompleted()
                .thenApply(unused -> true)
                .completeOnTimeout(false, drainTimeoutMillis, TimeUnit.MILLISECONDS)
                .join();

        if (!drained) {
            LOG.warn("Task engine did not drain in time, pending futures are failed [name={}, drainTimeoutMillis={}, inFlight={}]",
                    name, drainTimeoutMillis, inFlightFutures.size());

            int abandoned = store.abandonPending(
                    new ComputeException(NODE_STOPPING_ERR, "Task engine stopped before the task completed [name=" + name + ']')
            );

            LOG.debug("Abandoned pending futures [name={}, count={}]", name, abandoned);
        }

        List<TaskNode> dropped = scheduler.stop();

        if (!dropped.isEmpty()) {
            LOG.debug("Ready tasks are dropped on stop [name={}, count={}]", name, dropped.size());
        }

        workerPool.stop();

        LOG.info("Task engine stopped [name={}, submitted={}]", name, submitted.sum());
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public <R> FutureRef<R> submit(RemoteFunction<R> function, Object... args) {
        return submit(function, args == null ? null : Arrays.asList(args));
    }

    @Override
    public <R> FutureRef<R> submit(RemoteFunction<R> function, List<?> args) {
        Object[] argArray = validateSubmission(function, args);

        enterBusy();

        try {
            FutureHandle<R> handle = store.allocate();

            inFlightFutures.registerFuture(store.record(handle).result());
            submitted.increment();

            tracker.register(new TaskNode(handle, function, argArray));

            return handle;
        } finally {
            busyLock.leaveBusy();
        }
    }

    @Override
    public <T> FutureRef<T> put(@Nullable T value) {
        enterBusy();

        try {
            return store.allocateResolved(value);
        } finally {
            busyLock.leaveBusy();
        }
    }

    @Override
    public <T> T get(FutureRef<T> ref) {
        return store.get(ref);
    }

    @Override
    public <T> T get(FutureRef<T> ref, long timeout, TimeUnit unit) {
        return store.get(ref, timeout, unit);
    }

    @Override
    public <T> List<T> getMany(List<FutureRef<T>> refs) {
        if (refs == null) {
            throw new ComputeException(ILLEGAL_ARGUMENT_ERR, "Handles must not be null");
        }

        return store.getMany(refs);
    }

    @Override
    public <T> CompletableFuture<T> getAsync(FutureRef<T> ref) {
        return store.resultAsync(ref);
    }

    @Override
    public <T> WaitResult<T> waitFor(List<FutureRef<T>> refs, int numReady, long timeout, TimeUnit unit) {
        if (refs == null) {
            throw new ComputeException(ILLEGAL_ARGUMENT_ERR, "Handles must not be null");
        }

        if (numReady < 1 || numReady > refs.size()) {
            throw new ComputeException(
                    ILLEGAL_ARGUMENT_ERR,
                    "Number of futures to wait for is out of range [numReady=" + numReady + ", size=" + refs.size() + ']'
            );
        }

        List<CompletableFuture<Object>> results = new ArrayList<>(refs.size());

        for (FutureRef<T> ref : refs) {
            results.add(store.record(ref).result());
        }

        CompletableFuture<Void> enough = new CompletableFuture<>();
        AtomicInteger completed = new AtomicInteger();

        for (CompletableFuture<Object> result : results) {
            result.whenComplete((res, err) -> {
                if (completed.incrementAndGet() >= numReady) {
                    enough.complete(null);
                }
            });
        }

        sync(enough.completeOnTimeout(null, timeout, unit));

        List<FutureRef<T>> ready = new ArrayList<>(numReady);
        List<FutureRef<T>> notReady = new ArrayList<>(refs.size());

        for (int i = 0; i < refs.size(); i++) {
            if (ready.size() < numReady && results.get(i).isDone()) {
                ready.add(refs.get(i));
            } else {
                notReady.add(refs.get(i));
            }
        }

        return new WaitResult<>(ready, notReady);
    }

    @Override
    public FutureState state(FutureRef<?> ref) {
        return store.state(ref);
    }

    @Override
    public EngineMetrics metrics() {
        return EngineMetrics.builder()
                .submitted(submitted.sum())
                .completed(workerPool.completed())
                .failed(workerPool.failed())
                .skipped(tracker.skipped())
                .queued(scheduler.queued())
                .executing(workerPool.busySlots())
                .poolSize(workerPool.poolSize())
                .build();
    }

    /**
     * Returns the engine name.
     *
     * @return Name.
     */
    public String name() {
        return name;
    }

    @TestOnly
    FutureStore store() {
        return store;
    }

    @TestOnly
    int inFlightCount() {
        return inFlightFutures.size();
    }

    private void onFutureCompleted(FutureRecord record, List<TaskNode> dependents) {
        tracker.onResolved(record, dependents);
    }

    private void onTaskReady(TaskNode task) {
        scheduler.onReady(task);
    }

    private void enterBusy() {
        if (!started) {
            throw new ComputeException(NODE_STOPPING_ERR, "Task engine is not started [name=" + name + ']');
        }

        if (!busyLock.enterBusy()) {
            throw new ComputeException(NODE_STOPPING_ERR, "Task engine is stopping [name=" + name + ']');
        }
    }

    private Object[] validateSubmission(@Nullable RemoteFunction<?> function, @Nullable List<?> args) {
        if (function == null) {
            throw new ComputeException(INVALID_SUBMISSION_ERR, "Function must not be null");
        }

        if (args == null) {
            throw new ComputeException(INVALID_SUBMISSION_ERR, "Arguments must not be null [function=" + function.name() + ']');
        }

        function.checkArity(args.size());

        Object[] argArray = args.toArray();

        for (int i = 0; i < argArray.length; i++) {
            FutureRef<?> ref = TaskNode.asFuture(argArray[i]);

            if (ref != null && !store.owns(ref)) {
                throw new ComputeException(
                        INVALID_SUBMISSION_ERR,
                        "Argument is not a future of this engine [function=" + function.name() + ", index=" + i + ", arg=" + ref + ']'
                );
            }
        }

        return argArray;
    }
}
