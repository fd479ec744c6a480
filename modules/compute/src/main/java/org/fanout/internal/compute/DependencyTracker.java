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
import static org.fanout.internal.compute.TaskState.READY;
import static org.fanout.internal.compute.TaskState.REGISTERED;
import static org.fanout.internal.compute.TaskState.WAITING;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import org.fanout.compute.FutureRef;
import org.fanout.internal.logger.FanoutLogger;
import org.fanout.internal.logger.Loggers;

/**
 * Tracks which futures a task waits for and hands the task to the ready path once all of them are ready. A task that
 * depends on a failed future is failed with the same error without being executed.
 */
class DependencyTracker {
    private static final FanoutLogger LOG = Loggers.forClass(DependencyTracker.class);

    private final FutureStore store;

    private final Consumer<TaskNode> readyPath;

    private final LongAdder skipped = new LongAdder();

    DependencyTracker(FutureStore store, Consumer<TaskNode> readyPath) {
        this.store = store;
        this.readyPath = readyPath;
    }

    /**
     * Subscribes the task to each of its pending future arguments. A task without pending arguments goes to the ready path
     * right away.
     *
     * @param task Task.
     */
    void register(TaskNode task) {
        boolean moved = task.transition(REGISTERED, WAITING);

        assert moved : task;

        for (Object arg : task.args()) {
            FutureRef<?> ref = TaskNode.asFuture(arg);

            if (ref == null) {
                continue;
            }

            FutureRecord dependency = store.record(ref);

            task.addDependency();

            if (!dependency.subscribe(task)) {
                if (dependency.state() == FAILED) {
                    skipDependents(dependency, List.of(task));

                    return;
                }

                task.dependencyResolved();
            }
        }

        // Release the registration guard.
        if (task.dependencyResolved()) {
            markReady(task);
        }
    }

    /**
     * Notifies the tasks subscribed to a future that has left the pending state.
     *
     * @param dependency Completed future.
     * @param dependents Subscribed tasks, a task appears once per argument referring to the future.
     */
    void onResolved(FutureRecord dependency, List<TaskNode> dependents) {
        if (dependency.state() == FAILED) {
            skipDependents(dependency, dependents);

            return;
        }

        for (TaskNode task : dependents) {
            if (task.dependencyResolved()) {
                markReady(task);
            }
        }
    }

    long skipped() {
        return skipped.sum();
    }

    private void markReady(TaskNode task) {
        if (task.transition(WAITING, READY)) {
            readyPath.accept(task);
        }
    }

    /**
     * Fails the given tasks with the error of the failed future, then the tasks subscribed to their futures, and so on. The
     * walk keeps its own queue and does not recurse through the store, so the length of a chain is not bounded by the stack.
     *
     * @param failed Failed future.
     * @param dependents Tasks subscribed to it.
     */
    private void skipDependents(FutureRecord failed, List<TaskNode> dependents) {
        Throwable error = failed.error();

        ArrayDeque<TaskNode> queue = new ArrayDeque<>(dependents);

        TaskNode task;

        while ((task = queue.poll()) != null) {
            if (!task.transition(WAITING, TaskState.FAILED)) {
                continue;
            }

            skipped.increment();

            if (LOG.isDebugEnabled()) {
                LOG.debug("Task is skipped because of a failed dependency [taskId={}, function={}, failedFutureId={}]",
                        task.id(), task.function().name(), failed.id());
            }

            List<TaskNode> next = store.failSilently(task.handle(), error);

            if (next != null) {
                queue.addAll(next);
            }
        }
    }
}
