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


package org.fanout.compute;

import java.util.List;

/**
 * Outcome of {@link TaskEngine#waitFor}: the handles split into those that completed (successfully or not) and those still
 * pending, each list in the order of the input.
 *
 * @param <T> Type of the values.
 */
public final class WaitResult<T> {
    private final List<FutureRef<T>> ready;

    private final List<FutureRef<T>> notReady;

    /**
     * Constructor.
     *
     * @param ready Completed handles.
     * @param notReady Remaining handles.
     */
    public WaitResult(List<FutureRef<T>> ready, List<FutureRef<T>> notReady) {
        this.ready = List.copyOf(ready);
        this.notReady = List.copyOf(notReady);
    }

    public List<FutureRef<T>> ready() {
        return ready;
    }

    public List<FutureRef<T>> notReady() {
        return notReady;
    }

    @Override
    public String toString() {
        return "WaitResult [ready=" + ready.size() + ", notReady=" + notReady.size() + ']';
    }
}
