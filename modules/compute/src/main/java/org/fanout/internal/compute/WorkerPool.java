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

import static org.fanout.internal.compute.TaskState.EXECUTING;
import static org.fanout.internal.compute.TaskState.FAILED;
import static org.fanout.internal.compute.TaskState.READY;
import static org.fanout.internal.compute.TaskState.RESOLVED;
import static org.fanout.internal.util.FanoutUtils.shutdownAndAwaitTermination;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import org.fanout.compute.TaskExecutionException;
import org.fanout.internal.logger.FanoutLogger;
import org.fanout.internal.logger.Loggers;
import org.fanout.internal.manager.FanoutComponent;
import org.fanout.internal.thread.NamedThreadFactory;
import org.jetbrains.annotations.Nullable;

/**
 * Fixed set of worker slots backed by a thread pool of the same size. A task runs only in a slot acquired with
 * {@link #tryAcquire()}, so at most {@link #poolSize()} tasks run at once.
 */
class WorkerPool implements FanoutComponent {
    private static final FanoutLogger LOG = Loggers.forClass(WorkerPool.class);

    /** Thread pool name. */
    static final String POOL_NAME = "fanout-worker";

    private static final long SHUTDOWN_TIMEOUT_MILLIS = 1_000;

    private final String engineName;

    private final WorkerSlot[] slots;

    private final FutureStore store;

    private final AtomicInteger busySlots = new AtomicInteger();

    private final LongAdder completed = new LongAdder();

    private final LongAdder failed = new LongAdder();

    private volatile ExecutorService executor;

    WorkerPool(String engineName, int poolSize, FutureStore store) {
        assert poolSize > 0 : poolSize;

        this.engineName = engineName;
        this.store = store;
        this.slots = new WorkerSlot[poolSize];

        for (int i = 0; i < poolSize; i++) {
            slots[i] = new WorkerSlot(i);
        }
    }

    @Override
    public void start() {
        executor = Executors.newFixedThreadPool(slots.length, NamedThreadFactory.create(engineName, POOL_NAME, LOG));
    }

    @Override
    public void stop() {
        ExecutorService executor0 = executor;

        if (executor0 != null) {
            shutdownAndAwaitTermination(executor0, SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Acquires a free slot.
     *
     * @return Slot, or {@code null} if every slot is busy.
     */
    @Nullable
    WorkerSlot tryAcquire() {
        for (WorkerSlot slot : slots) {
            if (slot.tryAcquire()) {
                busySlots.incrementAndGet();

                return slot;
            }
        }

        return null;
    }

    /**
     * Runs the task in the acquired slot on a pool thread. The slot is released when the task finishes, then
     * {@code onRelease} is called on the same thread.
     *
     * @param slot Acquired slot.
     * @param task Ready task.
     * @param onRelease Called after the slot is released.
     */
    void execute(WorkerSlot slot, TaskNode task, Runnable onRelease) {
        try {
            executor.execute(() -> {
                try {
                    run(task);
                } finally {
                    release(slot);

                    onRelease.run();
                }
            });
        } catch (RejectedExecutionException e) {
            release(slot);

            LOG.debug("Task is dropped, the worker pool is shut down [taskId={}]", task.id());
        }
    }

    private void run(TaskNode task) {
        boolean moved = task.transition(READY, EXECUTING);

        assert moved : task;

        Object result;

        try {
            result = task.function().call(task.resolveArgs(store));
        } catch (Throwable e) {
            boolean failedMoved = task.transition(EXECUTING, FAILED);

            assert failedMoved : task;

            failed.increment();

            if (LOG.isDebugEnabled()) {
                LOG.debug("Task failed [taskId={}, function={}]", e, task.id(), task.function().name());
            }

            store.fail(task.handle(), new TaskExecutionException(task.id(), task.function().name(), e));

            return;
        }

        boolean resolvedMoved = task.transition(EXECUTING, RESOLVED);

        assert resolvedMoved : task;

        completed.increment();

        store.resolve(task.handle(), result);
    }

    private void release(WorkerSlot slot) {
        busySlots.decrementAndGet();

        slot.release();
    }

    int poolSize() {
        return slots.length;
    }

    int busySlots() {
        return busySlots.get();
    }

    long completed() {
        return completed.sum();
    }

    long failed() {
        return failed.sum();
    }
}
