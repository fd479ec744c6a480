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

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.fanout.compute.FutureRef;
import org.fanout.compute.RemoteFunction;
import org.jetbrains.annotations.Nullable;

/**
 * Deferred invocation of a remote function. The id of a task is the id of the future it produces.
 */
final class TaskNode {
    private final FutureHandle<?> handle;

    private final RemoteFunction<?> function;

    /** Literal values and future handles. */
    private final Object[] args;

    /**
     * Number of future arguments that are not ready, plus one while the task is being registered. The extra count keeps the
     * task from becoming ready before every argument is inspected.
     */
    private final AtomicInteger unresolved = new AtomicInteger(1);

    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.REGISTERED);

    TaskNode(FutureHandle<?> handle, RemoteFunction<?> function, Object[] args) {
        this.handle = handle;
        this.function = function;
        this.args = args;
    }

    long id() {
        return handle.id();
    }

    FutureHandle<?> handle() {
        return handle;
    }

    RemoteFunction<?> function() {
        return function;
    }

    Object[] args() {
        return args;
    }

    TaskState state() {
        return state.get();
    }

    /**
     * Moves the task from one state to another.
     *
     * @return {@code false} if the task was not in the expected state.
     */
    boolean transition(TaskState from, TaskState to) {
        return state.compareAndSet(from, to);
    }

    void addDependency() {
        unresolved.incrementAndGet();
    }

    /**
     * Counts one dependency, or the registration guard, as resolved.
     *
     * @return {@code true} if nothing is left unresolved.
     */
    boolean dependencyResolved() {
        int left = unresolved.decrementAndGet();

        assert left >= 0 : "Unresolved count below zero [taskId=" + id() + ']';

        return left == 0;
    }

    int unresolvedCount() {
        return unresolved.get();
    }

    /**
     * Replaces future handles among the arguments with their values. Every future argument must be ready.
     *
     * @param store Store that holds the futures.
     * @return Argument values.
     */
    Object[] resolveArgs(FutureStore store) {
        Object[] res = Arrays.copyOf(args, args.length);

        for (int i = 0; i < res.length; i++) {
            if (res[i] instanceof FutureRef) {
                res[i] = store.valueOf((FutureRef<?>) res[i]);
            }
        }

        return res;
    }

    @Override
    public String toString() {
        return "TaskNode [id=" + id() + ", function=" + function.name() + ", state=" + state.get() + ']';
    }

    @Nullable
    static FutureRef<?> asFuture(@Nullable Object arg) {
        return arg instanceof FutureRef ? (FutureRef<?>) arg : null;
    }
}
