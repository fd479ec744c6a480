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

import static org.fanout.lang.ErrorGroups.Compute.EMPTY_REDUCTION_ERR;
import static org.fanout.lang.ErrorGroups.Compute.INVALID_SUBMISSION_ERR;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Parallel map and reduce built on {@link TaskEngine} submissions. None of the methods block on task execution: they return
 * handles as soon as every task is submitted.
 *
 * <p>Inputs may mix literal values and handles produced by the same engine.
 */
public final class ParallelOps {
    /**
     * Submits one task per input.
     *
     * @param engine Engine.
     * @param function Function of one argument.
     * @param inputs Inputs.
     * @param <R> Result type.
     * @return Result handles in input order.
     */
    public static <R> List<FutureRef<R>> mapParallel(TaskEngine engine, RemoteFunction<R> function, List<?> inputs) {
        checkArguments(engine, function, inputs);
        function.checkArity(1);

        List<FutureRef<R>> results = new ArrayList<>(inputs.size());

        for (Object input : inputs) {
            results.add(engine.submit(function, input));
        }

        return results;
    }

    /**
     * Folds the inputs left to right. Every task depends on the previous one, so the critical path is {@code n - 1} tasks long.
     *
     * @param engine Engine.
     * @param function Combining function of two arguments.
     * @param inputs Inputs, not empty.
     * @param <T> Value type.
     * @return Handle of the reduced value. For a single input, a handle to that input; no task is submitted.
     * @throws ComputeException With {@code EMPTY_REDUCTION_ERR} if there are no inputs.
     */
    public static <T> FutureRef<T> reduceParallel(TaskEngine engine, RemoteFunction<T> function, List<?> inputs) {
        checkReduction(engine, function, inputs);

        Object acc = inputs.get(0);

        for (int i = 1; i < inputs.size(); i++) {
            acc = engine.submit(function, acc, inputs.get(i));
        }

        return asRef(engine, acc);
    }

    /**
     * Combines adjacent pairs level by level until one value remains. Tasks of the same level are independent, so the critical
     * path is {@code ceil(log2(n))} tasks long. An odd trailing element is carried to the next level unchanged.
     *
     * <p>The function must be associative and commutative.
     *
     * @param engine Engine.
     * @param function Combining function of two arguments.
     * @param inputs Inputs, not empty.
     * @param <T> Value type.
     * @return Handle of the reduced value. For a single input, a handle to that input; no task is submitted.
     * @throws ComputeException With {@code EMPTY_REDUCTION_ERR} if there are no inputs.
     */
    public static <T> FutureRef<T> reduceParallelTree(TaskEngine engine, RemoteFunction<T> function, List<?> inputs) {
        checkReduction(engine, function, inputs);

        List<Object> level = new ArrayList<>(inputs);

        while (level.size() > 1) {
            List<Object> next = new ArrayList<>((level.size() + 1) / 2);

            for (int i = 0; i + 1 < level.size(); i += 2) {
                next.add(engine.submit(function, level.get(i), level.get(i + 1)));
            }

            if (level.size() % 2 == 1) {
                next.add(level.get(level.size() - 1));
            }

            level = next;
        }

        return asRef(engine, level.get(0));
    }

    @SuppressWarnings("unchecked")
    private static <T> FutureRef<T> asRef(TaskEngine engine, @Nullable Object value) {
        if (value instanceof FutureRef) {
            return (FutureRef<T>) value;
        }

        return engine.put((T) value);
    }

    private static void checkReduction(@Nullable TaskEngine engine, @Nullable RemoteFunction<?> function, @Nullable List<?> inputs) {
        checkArguments(engine, function, inputs);
        function.checkArity(2);

        if (inputs.isEmpty()) {
            throw new ComputeException(EMPTY_REDUCTION_ERR, "Cannot reduce an empty sequence [function=" + function.name() + ']');
        }
    }

    private static void checkArguments(@Nullable TaskEngine engine, @Nullable RemoteFunction<?> function, @Nullable List<?> inputs) {
        if (engine == null) {
            throw new ComputeException(INVALID_SUBMISSION_ERR, "Engine must not be null");
        }

        if (function == null) {
            throw new ComputeException(INVALID_SUBMISSION_ERR, "Function must not be null");
        }

        if (inputs == null) {
            throw new ComputeException(INVALID_SUBMISSION_ERR, "Inputs must not be null [function=" + function.name() + ']');
        }
    }

    private ParallelOps() {
    }
}
