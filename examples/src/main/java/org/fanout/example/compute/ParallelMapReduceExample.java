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


package org.fanout.example.compute;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.fanout.Fanout;
import org.fanout.compute.FutureRef;
import org.fanout.compute.ParallelOps;
import org.fanout.compute.RemoteFunction;
import org.fanout.compute.TaskEngine;

/**
 * This example demonstrates the usage of the {@link ParallelOps} helpers: an element-wise map followed by a chain and a tree
 * reduction of the same inputs. Every combining step sleeps, so the printed times show the length of the critical path:
 * seven steps for the chain and three levels for the tree.
 *
 * <p>The optional first argument is the latency of one combining step in milliseconds.
 */
public class ParallelMapReduceExample {
    /** Number of worker slots. */
    private static final int POOL_SIZE = 4;

    /** Default latency of one combining step. */
    private static final long DEFAULT_STEP_MILLIS = 100;

    private static final RemoteFunction<Integer> INCREMENT = RemoteFunction.of("increment", (Integer x) -> x + 1);

    /**
     * Main method of the example.
     *
     * @param args The command line arguments.
     */
    public static void main(String[] args) {
        long stepMillis = args.length > 0 ? Long.parseLong(args[0]) : DEFAULT_STEP_MILLIS;

        RemoteFunction<Integer> slowAdd = RemoteFunction.of("slowAdd", (Integer a, Integer b) -> {
            Thread.sleep(stepMillis);

            return a + b;
        });

        //--------------------------------------------------------------------------------------
        //
        // Starting the engine.
        //
        //--------------------------------------------------------------------------------------

        System.out.println("\nStarting task engine...");

        try (TaskEngine engine = Fanout.start(POOL_SIZE)) {
            //--------------------------------------------------------------------------------------
            //
            // Mapping a function over the inputs.
            //
            //--------------------------------------------------------------------------------------

            List<FutureRef<Integer>> incremented = ParallelOps.mapParallel(engine, INCREMENT, List.of(1, 2, 3, 4, 5));

            System.out.println("\nIncremented values: " + engine.getMany(incremented) + ".");

            //--------------------------------------------------------------------------------------
            //
            // Reducing the same inputs as a chain and as a tree.
            //
            //--------------------------------------------------------------------------------------

            List<Integer> inputs = IntStream.rangeClosed(1, 8).boxed().collect(Collectors.toList());

            System.out.println("\nReducing " + inputs + " with a step latency of " + stepMillis + " ms...");

            long start = System.nanoTime();

            int chain = engine.get(ParallelOps.reduceParallel(engine, slowAdd, inputs));

            long chainMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            start = System.nanoTime();

            int tree = engine.get(ParallelOps.reduceParallelTree(engine, slowAdd, inputs));

            long treeMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            //--------------------------------------------------------------------------------------
            //
            // Printing the results.
            //
            //--------------------------------------------------------------------------------------

            System.out.println("\nChain reduction result: " + chain + " (" + chainMillis + " ms).");
            System.out.println("Tree reduction result: " + tree + " (" + treeMillis + " ms).");
        }

        System.out.println("\nTask engine stopped.");
    }
}
