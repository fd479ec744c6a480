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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unit of execution capacity, owned by one task at a time.
 */
final class WorkerSlot {
    private final int index;

    private final AtomicBoolean busy = new AtomicBoolean();

    WorkerSlot(int index) {
        this.index = index;
    }

    int index() {
        return index;
    }

    boolean isBusy() {
        return busy.get();
    }

    boolean tryAcquire() {
        return busy.compareAndSet(false, true);
    }

    void release() {
        boolean released = busy.compareAndSet(true, false);

        assert released : "Slot is not busy [index=" + index + ']';
    }

    @Override
    public String toString() {
        return "WorkerSlot [index=" + index + ", busy=" + busy.get() + ']';
    }
}
