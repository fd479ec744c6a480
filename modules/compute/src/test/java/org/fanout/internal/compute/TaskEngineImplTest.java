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
import static org.fanout.internal.testframework.FanoutTestUtils.assertThrowsWithCode;
import static org.fanout.internal.testframework.FanoutTestUtils.runRace;
import static org.fanout.internal.testframework.matchers.CompletableFutureExceptionMatcher.willThrow;
import static org.fanout.internal.testframework.matchers.CompletableFutureExceptionMatcher.willThrowWithCode;
import static org.fanout.internal.testframework.matchers.CompletableFutureMatcher.willBe;
import static org.fanout.internal.testframework.matchers.CompletableFutureMatcher.willCompleteSuccessfully;
import static org.fanout.internal.testframework.matchers.CompletableFutureMatcher.willSucceedFast;
import static org.fanout.lang.ErrorGroups.Common.ILLEGAL_ARGUMENT_ERR;
import static org.fanout.lang.ErrorGroups.Common.NODE_STOPPING_ERR;
import static org.fanout.lang.ErrorGroups.Compute.INVALID_SUBMISSION_ERR;
import static org.fanout.lang.ErrorGroups.Compute.RESULT_TIMEOUT_ERR;
import static org.fanout.lang.ErrorGroups.Compute.UNKNOWN_FUTURE_ERR;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.fanout.compute.ComputeException;
import org.fanout.compute.EngineMetrics;
import org.fanout.compute.FutureRef;
import org.fanout.compute.FutureState;
import org.fanout.compute.RemoteFunction;
import org.fanout.compute.TaskExecutionException;
import org.fanout.compute.WaitResult;
import org.fanout.internal.compute.configuration.ComputeConfiguration;
import org.fanout.internal.testframework.BaseFanoutAbstractTest;
import org.fanout.internal.testframework.RunnableX;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(30)
class TaskEngineImplTest extends BaseFanoutAbstractTest {
    private static final RemoteFunction<Integer> INC = RemoteFunction.of("inc", (Integer x) -> x + 1);

    private static final RemoteFunction<Integer> ADD = RemoteFunction.of("add", (Integer a, Integer b) -> a + b);

    private final CountDownLatch gate = new CountDownLatch(1);

    private final RemoteFunction<Integer> blocked = RemoteFunction.of("blocked", (Integer x) -> {
        gate.await();

        return x;
    });

    private final List<TaskEngineImpl> engines = new ArrayList<>();

    @AfterEach
    void cleanup() {
        gate.countDown();

        engines.forEach(TaskEngineImpl::close);
    }

    @Test
    void submitReturnsBeforeDependenciesAreReady() {
        TaskEngineImpl engine = startEngine(1);

        FutureRef<Integer> first = engine.submit(blocked, 0);

        long start = System.nanoTime();

        List<FutureRef<Integer>> chain = new ArrayList<>();

        FutureRef<Integer> prev = first;

        for (int i = 0; i < 1_000; i++) {
            prev = engine.submit(INC, prev);

            chain.add(prev);
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs, is(lessThan(5_000L)));

        for (FutureRef<Integer> ref : chain) {
            assertThat(engine.state(ref), is(FutureState.PENDING));
        }

        assertThat(engine.metrics().submitted(), is(1_001L));

        gate.countDown();

        assertThat(engine.get(prev), is(1_000));
    }

    @Test
    void mapsEveryInput() {
        TaskEngineImpl engine = startEngine(4);

        List<FutureRef<Integer>> refs = new ArrayList<>();

        for (int i = 1; i <= 5; i++) {
            refs.add(engine.submit(INC, i));
        }

        assertThat(engine.getMany(refs), contains(2, 3, 4, 5, 6));
    }

    @Test
    void failurePropagatesToTransitiveDependents() {
        TaskEngineImpl engine = startEngine(2);

        AtomicInteger dependentCalls = new AtomicInteger();

        RemoteFunction<Integer> failing = RemoteFunction.of("failing", () -> {
            throw new IllegalStateException("boom");
        });

        RemoteFunction<Integer> counting = RemoteFunction.of("counting", (Integer x) -> {
            dependentCalls.incrementAndGet();

            return x;
        });

        FutureRef<Integer> root = engine.submit(failing);
        FutureRef<Integer> child = engine.submit(counting, root);
        FutureRef<Integer> grandChild = engine.submit(ADD, child, 1);
        FutureRef<Integer> unrelated = engine.submit(counting, 7);

        TaskExecutionException rootError = assertThrows(TaskExecutionException.class, () -> engine.get(root));
        TaskExecutionException grandChildError = assertThrows(TaskExecutionException.class, () -> engine.get(grandChild));

        assertThat(grandChildError, sameInstance(rootError));
        assertThat(rootError.getCause(), is(instanceOf(IllegalStateException.class)));
        assertThat(rootError.functionName(), is("failing"));
        assertThat(rootError.taskId(), is(root.id()));

        assertThat(engine.state(child), is(FutureState.FAILED));
        assertThat(engine.get(unrelated), is(7));
        assertThat(dependentCalls.get(), is(1));

        await().until(() -> engine.metrics().skipped(), is(2L));

        EngineMetrics metrics = engine.metrics();

        assertThat(metrics.failed(), is(1L));
        assertThat(metrics.completed(), is(1L));
    }

    @Test
    void failureOfChainHeadReachesEveryDependent() {
        TaskEngineImpl engine = startEngine(2);

        RemoteFunction<Integer> failingAfterGate = RemoteFunction.of("failingAfterGate", () -> {
            gate.await();

            throw new IllegalStateException("head failed");
        });

        FutureRef<Integer> head = engine.submit(failingAfterGate);

        List<FutureRef<Integer>> chain = new ArrayList<>();

        FutureRef<Integer> prev = head;

        for (int i = 0; i < 20_000; i++) {
            prev = engine.submit(ADD, prev, 1);

            chain.add(prev);
        }

        gate.countDown();

        FutureRef<Integer> last = chain.get(chain.size() - 1);

        TaskExecutionException lastError = assertThrows(TaskExecutionException.class, () -> engine.get(last, 10, TimeUnit.SECONDS));

        assertThat(lastError.taskId(), is(head.id()));

        for (FutureRef<Integer> ref : chain) {
            assertThat(engine.state(ref), is(FutureState.FAILED));
        }

        assertThat(engine.metrics().skipped(), is(20_000L));
        assertThat(engine.metrics().failed(), is(1L));
    }

    @Test
    void concurrentGettersObserveSameFailure() {
        TaskEngineImpl engine = startEngine(2);

        RemoteFunction<Integer> failing = RemoteFunction.of("failing", (Integer x) -> {
            gate.await();

            throw new IllegalArgumentException("bad input " + x);
        });

        FutureRef<Integer> root = engine.submit(failing, 1);
        FutureRef<Integer> dependent = engine.submit(INC, root);

        Set<Throwable> observed = ConcurrentHashMap.newKeySet();

        RunnableX getter = () -> observed.add(assertThrows(TaskExecutionException.class, () -> engine.get(dependent)));

        CompletableFuture<Void> releaser = CompletableFuture.runAsync(() -> {
            await().until(() -> engine.metrics().executing(), is(1));

            gate.countDown();
        });

        runRace(getter, getter, getter, getter);

        assertThat(releaser, willBe(nullValue()));
        assertThat(observed, hasSize(1));
        assertThat(observed.iterator().next(), sameInstance(assertThrows(TaskExecutionException.class, () -> engine.get(root))));
    }

    @Test
    void timedGetDoesNotCancelTask() {
        TaskEngineImpl engine = startEngine(1);

        FutureRef<Integer> ref = engine.submit(blocked, 5);

        assertThrowsWithCode(ComputeException.class, RESULT_TIMEOUT_ERR, () -> engine.get(ref, 50, TimeUnit.MILLISECONDS), null);

        assertThat(engine.state(ref), is(FutureState.PENDING));

        gate.countDown();

        assertThat(engine.get(ref, 10, TimeUnit.SECONDS), is(5));
    }

    @Test
    void putValuesFeedSubmissions() {
        TaskEngineImpl engine = startEngine(2);

        FutureRef<Integer> value = engine.put(41);
        FutureRef<Object> nothing = engine.put(null);

        assertThat(engine.state(value), is(FutureState.READY));
        assertThat(engine.getAsync(value), willSucceedFast());
        assertThat(engine.get(nothing), is(nullValue()));

        assertThat(engine.get(engine.submit(INC, value)), is(42));
        assertThat(engine.get(engine.submit(ADD, value, engine.submit(INC, value))), is(83));

        assertThat(engine.metrics().submitted(), is(3L));
    }

    @Test
    void getAsyncCompletesWithResult() {
        TaskEngineImpl engine = startEngine(2);

        FutureRef<Integer> ok = engine.submit(INC, 1);
        FutureRef<Integer> failed = engine.submit(RemoteFunction.of("failing", () -> {
            throw new IllegalStateException();
        }));

        assertThat(engine.getAsync(ok), willCompleteSuccessfully());
        assertThat(engine.getAsync(ok), willBe(2));
        assertThat(engine.getAsync(failed), willThrow(TaskExecutionException.class));
    }

    @Test
    void waitForReturnsReadyHandlesInInputOrder() {
        TaskEngineImpl engine = startEngine(2);

        FutureRef<Integer> slow = engine.submit(blocked, 0);
        FutureRef<Integer> second = engine.submit(INC, 1);
        FutureRef<Integer> third = engine.submit(INC, 2);

        List<FutureRef<Integer>> refs = List.of(slow, second, third);

        WaitResult<Integer> res = engine.waitFor(refs, 2, 10, TimeUnit.SECONDS);

        assertThat(res.ready(), contains(second, third));
        assertThat(res.notReady(), contains(slow));

        res = engine.waitFor(refs, 3, 100, TimeUnit.MILLISECONDS);

        assertThat(res.ready(), contains(second, third));
        assertThat(res.notReady(), contains(slow));

        gate.countDown();

        res = engine.waitFor(refs, 1, 10, TimeUnit.SECONDS);

        assertThat(res.ready(), hasSize(1));
        assertThat(res.notReady(), hasSize(2));

        res = engine.waitFor(refs, 3, 10, TimeUnit.SECONDS);

        assertThat(res.ready(), contains(slow, second, third));
        assertThat(res.notReady(), is(empty()));
    }

    @Test
    void waitForCountsFailedFuturesAsReady() {
        TaskEngineImpl engine = startEngine(2);

        FutureRef<Integer> failed = engine.submit(RemoteFunction.of("failing", () -> {
            throw new IllegalStateException();
        }));

        WaitResult<Integer> res = engine.waitFor(List.of(failed), 1, 10, TimeUnit.SECONDS);

        assertThat(res.ready(), contains(failed));
    }

    @Test
    void waitForRejectsInvalidCount() {
        TaskEngineImpl engine = startEngine(1);

        List<FutureRef<Integer>> refs = List.of(engine.put(1), engine.put(2));

        assertThrowsWithCode(ComputeException.class, ILLEGAL_ARGUMENT_ERR, () -> engine.waitFor(refs, 0, 1, TimeUnit.SECONDS), "out of range");
        assertThrowsWithCode(ComputeException.class, ILLEGAL_ARGUMENT_ERR, () -> engine.waitFor(refs, 3, 1, TimeUnit.SECONDS), "out of range");
        assertThrowsWithCode(ComputeException.class, ILLEGAL_ARGUMENT_ERR, () -> engine.waitFor(null, 1, 1, TimeUnit.SECONDS), null);
    }

    @Test
    void rejectsMalformedSubmissions() {
        TaskEngineImpl engine = startEngine(1);
        TaskEngineImpl other = startEngine(1);

        FutureRef<Integer> foreign = other.put(1);
        FutureRef<Integer> fake = () -> 0;

        assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> engine.submit(null, 1), "Function must not be null");
        assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> engine.submit(INC, (List<?>) null), null);
        assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> engine.submit(INC, 1, 2), "expected=1, actual=2");
        assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> engine.submit(ADD, 1), "expected=2, actual=1");
        assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> engine.submit(INC, foreign), "index=0");
        assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> engine.submit(ADD, 1, fake), "index=1");

        assertThat(engine.metrics().submitted(), is(0L));
        assertThat(engine.store().size(), is(0));
    }

    @Test
    void rejectsUnknownHandlesOnRetrieval() {
        TaskEngineImpl engine = startEngine(1);
        TaskEngineImpl other = startEngine(1);

        FutureRef<Integer> foreign = other.put(1);

        assertThrowsWithCode(ComputeException.class, UNKNOWN_FUTURE_ERR, () -> engine.get(foreign), null);
        assertThrowsWithCode(ComputeException.class, UNKNOWN_FUTURE_ERR, () -> engine.state(foreign), null);
        assertThrowsWithCode(ComputeException.class, UNKNOWN_FUTURE_ERR, () -> engine.getMany(List.of(engine.put(1), foreign)), null);
        assertThrowsWithCode(ComputeException.class, ILLEGAL_ARGUMENT_ERR, () -> engine.getMany(null), null);
    }

    @Test
    void neverRunsMoreTasksThanPoolSize() {
        TaskEngineImpl engine = startEngine(3);

        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        RemoteFunction<Integer> busy = RemoteFunction.of("busy", (Integer x) -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);

            try {
                Thread.sleep(20);
            } finally {
                running.decrementAndGet();
            }

            return x;
        });

        List<FutureRef<Integer>> refs = new ArrayList<>();

        for (int i = 0; i < 30; i++) {
            refs.add(engine.submit(busy, i));
        }

        while (refs.stream().anyMatch(ref -> engine.state(ref) == FutureState.PENDING)) {
            EngineMetrics metrics = engine.metrics();

            assertThat(metrics.executing(), is(lessThanOrEqualTo(3)));
            assertThat(metrics.queued() + metrics.executing(), is(lessThanOrEqualTo(30)));

            Thread.onSpinWait();
        }

        assertThat(engine.getMany(refs), hasSize(30));
        assertThat(maxRunning.get(), is(lessThanOrEqualTo(3)));
        assertThat(engine.metrics().completed(), is(30L));
    }

    @Test
    void concurrentSubmissionsFromManyThreads() {
        TaskEngineImpl engine = startEngine(4);

        List<FutureRef<Integer>> refs = new CopyOnWriteArrayList<>();

        RunnableX submitter = () -> {
            for (int i = 0; i < 100; i++) {
                refs.add(engine.submit(ADD, engine.submit(INC, i), 1));
            }
        };

        runRace(submitter, submitter, submitter, submitter);

        assertThat(refs, hasSize(400));
        assertThat(engine.getMany(refs).stream().mapToInt(Integer::intValue).sum(), is(4 * (4950 + 200)));
        assertThat(engine.metrics().submitted(), is(800L));
    }

    @Test
    void rejectsSubmissionsBeforeStart() {
        TaskEngineImpl engine = new TaskEngineImpl(ComputeConfiguration.builder().poolSize(1).build());

        engines.add(engine);

        assertThrowsWithCode(ComputeException.class, NODE_STOPPING_ERR, () -> engine.submit(INC, 1), "not started");
        assertThrowsWithCode(ComputeException.class, NODE_STOPPING_ERR, () -> engine.put(1), "not started");
    }

    @Test
    void stopDrainsInFlightTasks() {
        TaskEngineImpl engine = startEngine(2);

        RemoteFunction<Integer> slow = RemoteFunction.of("slow", (Integer x) -> {
            Thread.sleep(50);

            return x;
        });

        List<FutureRef<Integer>> refs = new ArrayList<>();

        for (int i = 0; i < 4; i++) {
            refs.add(engine.submit(ADD, engine.submit(slow, i), 1));
        }

        engine.stop();

        for (FutureRef<Integer> ref : refs) {
            assertThat(engine.state(ref), is(FutureState.READY));
        }

        assertThat(engine.inFlightCount(), is(0));
        assertThat(engine.getMany(refs), contains(1, 2, 3, 4));

        assertThrowsWithCode(ComputeException.class, NODE_STOPPING_ERR, () -> engine.submit(INC, 1), "stopping");
        assertThrowsWithCode(ComputeException.class, NODE_STOPPING_ERR, () -> engine.put(1), "stopping");

        // Second stop is a no-op.
        engine.close();
    }

    @Test
    void stopFailsPendingFuturesAfterDrainTimeout() {
        TaskEngineImpl engine = startEngine(ComputeConfiguration.builder()
                .engineName("draining")
                .poolSize(1)
                .drainTimeoutMillis(100)
                .build());

        FutureRef<Integer> stuck = engine.submit(blocked, 1);
        FutureRef<Integer> dependent = engine.submit(INC, stuck);

        await().until(() -> engine.metrics().executing(), is(1));

        engine.stop();

        ComputeException ex = assertThrowsWithCode(ComputeException.class, NODE_STOPPING_ERR, () -> engine.get(stuck), "draining");

        assertThat(assertThrows(ComputeException.class, () -> engine.get(dependent)), sameInstance(ex));
        assertThat(engine.state(dependent), is(FutureState.FAILED));
        assertThat(engine.getAsync(dependent), willThrowWithCode(ComputeException.class, NODE_STOPPING_ERR));
    }

    @Test
    void metricsReflectEngineActivity() {
        TaskEngineImpl engine = startEngine(2);

        FutureRef<Integer> stuck = engine.submit(blocked, 1);

        engine.submit(INC, stuck);

        await().until(() -> engine.metrics().executing(), is(1));

        EngineMetrics metrics = engine.metrics();

        assertThat(metrics.poolSize(), is(2));
        assertThat(metrics.submitted(), is(2L));
        assertThat(metrics.queued(), is(0));
        assertThat(metrics.completed(), is(0L));

        gate.countDown();

        await().until(() -> engine.metrics().completed(), is(2L));

        assertThat(engine.metrics().executing(), is(lessThanOrEqualTo(1)));
    }

    private TaskEngineImpl startEngine(int poolSize) {
        return startEngine(ComputeConfiguration.builder().engineName("test").poolSize(poolSize).build());
    }

    private TaskEngineImpl startEngine(ComputeConfiguration configuration) {
        TaskEngineImpl engine = new TaskEngineImpl(configuration);

        engines.add(engine);

        engine.start();

        return engine;
    }
}
