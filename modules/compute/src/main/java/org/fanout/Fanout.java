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


package org.fanout;

import com.typesafe.config.Config;
import org.fanout.compute.TaskEngine;
import org.fanout.internal.compute.TaskEngineImpl;
import org.fanout.internal.compute.configuration.ComputeConfiguration;

/**
 * Entry point: creates and starts task engines. The caller owns the returned engine and must close it.
 *
 * <pre>
 *     try (TaskEngine engine = Fanout.start(4)) {
 *         ...
 *     }
 * </pre>
 */
public final class Fanout {
    /**
     * Starts an engine configured from {@code application.conf}, system properties and {@code reference.conf}.
     *
     * @return Started engine.
     */
    public static TaskEngine start() {
        return start(ComputeConfiguration.load());
    }

    /**
     * Starts an engine with the given number of worker slots and default settings otherwise.
     *
     * @param poolSize Number of worker slots, {@code 0} for the number of available processors.
     * @return Started engine.
     */
    public static TaskEngine start(int poolSize) {
        return start(ComputeConfiguration.builder().poolSize(poolSize).build());
    }

    /**
     * Starts an engine configured from the {@code fanout.compute} section of the given configuration.
     *
     * @param config Configuration.
     * @return Started engine.
     */
    public static TaskEngine start(Config config) {
        return start(ComputeConfiguration.fromConfig(config));
    }

    /**
     * Starts an engine with the given configuration.
     *
     * @param configuration Configuration.
     * @return Started engine.
     */
    public static TaskEngine start(ComputeConfiguration configuration) {
        TaskEngineImpl engine = new TaskEngineImpl(configuration);

        engine.start();

        return engine;
    }

    private Fanout() {
    }
}
