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


package org.fanout.internal.future;

import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains a collection of in-flight {@link CompletableFuture}s (futures that are not yet completed) so that they can be
 * awaited or failed all at once, for example when a component stops.
 */
public class InFlightFutures implements Iterable<CompletableFuture<?>> {
    private final Set<CompletableFuture<?>> inFlightFutures = ConcurrentHashMap.newKeySet();

    /**
     * Registers a future in the in-flight futures collection. When it completes (either normally or exceptionally), it is
     * removed from the collection.
     *
     * @param future The future to register.
     * @return The same future.
     */
    public <T> CompletableFuture<T> registerFuture(CompletableFuture<T> future) {
        inFlightFutures.add(future);

        future.whenComplete((result, ex) -> inFlightFutures.remove(future));

        return future;
    }

    /**
     * Returns a future that completes when every future registered so far has completed, successfully or not.
     *
     * @return Future.
     */
    public CompletableFuture<Void> allCompleted() {
        CompletableFuture<?>[] snapshot = inFlightFutures.toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(snapshot).handle((res, ex) -> null);
    }

    /**
     * Fails all in-flight futures.
     *
     * @param cause Exception with which to fail the in-flight futures.
     */
    public void failInFlightFutures(Exception cause) {
        for (CompletableFuture<?> future : this) {
            future.completeExceptionally(cause);
        }
    }

    /**
     * Returns the number of futures that are not completed yet.
     *
     * @return Number of in-flight futures.
     */
    public int size() {
        return inFlightFutures.size();
    }

    @Override
    public Iterator<CompletableFuture<?>> iterator() {
        return inFlightFutures.iterator();
    }
}
