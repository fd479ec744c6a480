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

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Busy lock for stopping components synchronously. Operations run between {@link #enterBusy()} and {@link #leaveBusy()};
 * {@link #block()} waits for the operations in progress and makes every later {@link #enterBusy()} fail.
 *
 * <pre>
 *     if (!busyLock.enterBusy()) {
 *         throw new ...; // Component is stopping.
 *     }
 *
 *     try {
 *         ...
 *     } finally {
 *         busyLock.leaveBusy();
 *     }
 * </pre>
 */
public class BusyLock {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Guarded by the write lock for writes. */
    private volatile boolean blocked;

    /**
     * Enters the busy state.
     *
     * @return {@code true} if entered, {@code false} if the lock is blocked.
     */
    public boolean enterBusy() {
        lock.readLock().lock();

        if (blocked) {
            lock.readLock().unlock();

            return false;
        }

        return true;
    }

    /**
     * Leaves the busy state.
     */
    public void leaveBusy() {
        lock.readLock().unlock();
    }

    /**
     * Waits for all busy sections to finish and blocks the lock for good.
     */
    public void block() {
        lock.writeLock().lock();

        try {
            blocked = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns {@code true} once {@link #block()} has been called.
     *
     * @return Whether the lock is blocked.
     */
    public boolean blocked() {
        return blocked;
    }
}
