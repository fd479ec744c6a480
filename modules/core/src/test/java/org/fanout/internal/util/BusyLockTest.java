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
import static org.hamcrest.Matchers.is;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BusyLockTest {
    private final BusyLock busyLock = new BusyLock();

    @Test
    void entersUntilBlocked() {
        assertThat(busyLock.enterBusy(), is(true));

        busyLock.leaveBusy();
        busyLock.block();

        assertThat(busyLock.blocked(), is(true));
        assertThat(busyLock.enterBusy(), is(false));
    }

    @Test
    void blockWaitsForBusySection() throws Exception {
        assertThat(busyLock.enterBusy(), is(true));

        CountDownLatch blockStarted = new CountDownLatch(1);

        CompletableFuture<Void> blockFut = CompletableFuture.runAsync(() -> {
            blockStarted.countDown();

            busyLock.block();
        });

        blockStarted.await();

        Thread.sleep(100);

        assertThat(blockFut.isDone(), is(false));

        busyLock.leaveBusy();

        blockFut.get(10, TimeUnit.SECONDS);

        assertThat(busyLock.enterBusy(), is(false));
    }
}
