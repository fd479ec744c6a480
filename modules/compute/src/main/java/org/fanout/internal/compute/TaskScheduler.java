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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.fanout.internal.logger.FanoutLogger;
import org.fanout.internal.logger.Loggers;

/**
 * Feeds ready tasks to the worker pool in the order they became ready. The ready queue and slot acquisition form one critical
 * section; the tasks themselves are started outside of it.
 */
class TaskScheduler {
    private static final FanoutLogger LOG = Loggers.forClass(TaskScheduler.class);

    private final Object mux = new Object();

    private final WorkerPool workerPool;

    /** Guarded by {@link #mux}. */
    private final Deque<TaskNode> readyQueue = new ArrayDeque<>();

    /** Guarded by {@link #mux}. */
    private boolean stopped;

    TaskScheduler(WorkerPool workerPool) {
        this.workerPool = workerPool;
    }

    /**
     * Appends a ready task to the queue and starts as many queued tasks as there are free slots.
     *
     * @param task Ready task.
     */
    void onReady(TaskNode task) {
        synchronized (mux) {
            if (stopped) {
                LOG.debug("Ready task is dropped, the scheduler is stopped [taskId={}]", task.id());

                return;
            }

            readyQueue.addLast(task);
        }

        dispatch();
    }

    /**
     * Starts queued tasks while there are free slots. Called on intake and whenever a slot is released.
     */
    void dispatch() {
        while (true) {
            WorkerSlot slot;
            TaskNode task;

            synchronized (mux) {
                if (stopped || readyQueue.isEmpty()) {
                    return;
                }

                slot = workerPool.tryAcquire();

                if (slot == null) {
                    return;
                }

                task = readyQueue.pollFirst();
            }

            workerPool.execute(slot, task, this::dispatch);
        }
    }

    int queued() {
        synchronized (mux) {
            return readyQueue.size();
        }
    }

    /**
     * Stops dispatching.
     *
     * @return Tasks left in the queue.
     */
    List<TaskNode> stop() {
        synchronized (mux) {
            stopped = true;

            List<TaskNode> left = new ArrayList<>(readyQueue);

            readyQueue.clear();

            return left;
        }
    }
}
