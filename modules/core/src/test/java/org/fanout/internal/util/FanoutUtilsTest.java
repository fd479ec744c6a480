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

package org.fanout.internal.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FanoutUtilsTest {
    @Mock
    private ExecutorService stuckExecutor;

    @Test
    void monotonicTimeDoesNotGoBackwards() {
        long first = FanoutUtils.monotonicMs();
        long second = FanoutUtils.monotonicMs();

        assertThat(second, greaterThanOrEqualTo(first));
    }

    @Test
    void shutdownWaitsForRunningTasks() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);

        executor.execute(() -> {
            started.countDown();

            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        started.await();

        assertThat(FanoutUtils.shutdownAndAwaitTermination(executor, 10, TimeUnit.SECONDS), is(true));
        assertThat(executor.isTerminated(), is(true));
    }

    @Test
    void shutdownForcesExecutorThatDoesNotTerminate() throws Exception {
        when(stuckExecutor.awaitTermination(anyLong(), eq(TimeUnit.NANOSECONDS))).thenReturn(false);

        assertThat(FanoutUtils.shutdownAndAwaitTermination(stuckExecutor, 10, TimeUnit.MILLISECONDS), is(false));

        verify(stuckExecutor).shutdown();
        verify(stuckExecutor).shutdownNow();
    }

    @Test
    void unwrapsCompletionWrappers() {
        IllegalStateException root = new IllegalStateException("root");

        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertThat(ExceptionUtils.unwrapCause(wrapped), is(root));
    }
}
