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

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.fanout.compute.FutureState;
import org.fanout.compute.RemoteFunction;
import org.fanout.internal.testframework.BaseFanoutAbstractTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class TaskSchedulerTest extends BaseFanoutAbstractTest {
    private final FutureStore store = new FutureStore((rec, dependents) -> {});

    private final List<Integer> executionOrder = new CopyOnWriteArrayList<>();

    private final CountDownLatch gate = new CountDownLatch(1);

    private WorkerPool workerPool;

    private TaskScheduler scheduler;

    @AfterEach
    void cleanup() {
        gate.countDown();

        if (workerPool != null) {
            workerPool.stop();
        }
    }

    @Test
    void dispatchesInReadinessOrder() {
        start(1);

        RemoteFunction<Integer> record = RemoteFunction.of("record", (Integer i) -> {
            if (i == 0) {
                gate.await();
            }

            executionOrder.add(i);

            return i;
        });

        for (int i = 0; i < 6; i++) {
            scheduler.onReady(readyTask(record, i));
        }

        assertThat(scheduler.queued(), is(5));
        assertThat(executionOrder, is(empty()));

        gate.countDown();

        await().until(() -> executionOrder, hasSize(6));

        assertThat(executionOrder, contains(0, 1, 2, 3, 4, 5));
        await().until(scheduler::queued, is(0));
    }

    @Test
    void neverRunsMoreTasksThanSlots() {
        start(2);

        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        RemoteFunction<Integer> busy = RemoteFunction.of("busy", (Integer i) -> {
            int now = running.incrementAndGet();

            maxRunning.accumulateAndGet(now, Math::max);

            Thread.sleep(10);

            running.decrementAndGet();

            return i;
        });

        List<TaskNode> tasks = new ArrayList<>();

        for (int i = 0; i < 20; i++) {
            TaskNode task = readyTask(busy, i);

            tasks.add(task);

            scheduler.onReady(task);

            assertThat(workerPool.busySlots(), is(lessThanOrEqualTo(2)));
        }

        for (TaskNode task : tasks) {
            await().until(() -> store.state(task.handle()), is(FutureState.READY));
        }

        assertThat(maxRunning.get(), is(lessThanOrEqualTo(2)));
        assertThat(workerPool.completed(), is(20L));
    }

    @Test
    void stopReturnsQueuedTasks() {
        start(1);

        RemoteFunction<Integer> blocking = RemoteFunction.of("blocking", (Integer i) -> {
            gate.await();

            return i;
        });

        TaskNode running = readyTask(blocking, 0);

        scheduler.onReady(running);

        TaskNode first = readyTask(blocking, 1);
        TaskNode second = readyTask(blocking, 2);

        scheduler.onReady(first);
        scheduler.onReady(second);

        assertThat(scheduler.stop(), contains(first, second));
        assertThat(scheduler.queued(), is(0));

        gate.countDown();

        await().until(() -> store.state(running.handle()), is(FutureState.READY));

        scheduler.onReady(readyTask(blocking, 3));

        assertThat(scheduler.queued(), is(0));
        assertThat(store.state(first.handle()), is(FutureState.PENDING));
        assertThat(workerPool.busySlots(), is(0));
    }

    private void start(int poolSize) {
        workerPool = new WorkerPool("test-engine", poolSize, store);
        scheduler = new TaskScheduler(workerPool);

        workerPool.start();
    }

    private TaskNode readyTask(RemoteFunction<?> function, Object... args) {
        TaskNode task = new TaskNode(store.allocate(), function, args);

        task.transition(TaskState.REGISTERED, TaskState.WAITING);
        task.transition(TaskState.WAITING, TaskState.READY);

        return task;
    }
}
