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


package org.fanout.internal.compute.configuration;

import static org.fanout.lang.ErrorGroups.Common.ILLEGAL_ARGUMENT_ERR;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.Objects;
import org.fanout.lang.FanoutException;

/**
 * Task engine settings, read from the {@code fanout.compute} section of a HOCON configuration.
 */
public final class ComputeConfiguration {
    /** Path of the settings section. */
    public static final String ROOT = "fanout.compute";

    /** Pool size value meaning "number of available processors". */
    public static final int AUTO_POOL_SIZE = 0;

    private final String engineName;

    private final int poolSize;

    private final long drainTimeoutMillis;

    private ComputeConfiguration(String engineName, int poolSize, long drainTimeoutMillis) {
        this.engineName = engineName;
        this.poolSize = poolSize;
        this.drainTimeoutMillis = drainTimeoutMillis;
    }

    /**
     * Loads the settings from the application configuration ({@code application.conf}, system properties) with the defaults
     * of {@code reference.conf}.
     *
     * @return Configuration.
     */
    public static ComputeConfiguration load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the settings from the given configuration. Missing settings are taken from {@code reference.conf}.
     *
     * @param config Configuration.
     * @return Configuration.
     * @throws FanoutException With {@code ILLEGAL_ARGUMENT_ERR} if a setting is malformed or out of range.
     */
    public static ComputeConfiguration fromConfig(Config config) {
        Objects.requireNonNull(config, "config");

        try {
            Config section = config.withFallback(ConfigFactory.defaultReference(ComputeConfiguration.class.getClassLoader()))
                    .resolve()
                    .getConfig(ROOT);

            return builder()
                    .engineName(section.getString("engineName"))
                    .poolSize(section.getInt("poolSize"))
                    .drainTimeoutMillis(section.getLong("drainTimeoutMillis"))
                    .build();
        } catch (ConfigException e) {
            throw new FanoutException(ILLEGAL_ARGUMENT_ERR, "Invalid compute configuration: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String engineName() {
        return engineName;
    }

    /**
     * Returns the configured number of worker slots, {@link #AUTO_POOL_SIZE} for auto.
     */
    public int poolSize() {
        return poolSize;
    }

    /**
     * Returns the number of worker slots to start: the configured value, or the number of available processors for auto.
     */
    public int effectivePoolSize() {
        return poolSize == AUTO_POOL_SIZE ? Math.max(1, Runtime.getRuntime().availableProcessors()) : poolSize;
    }

    public long drainTimeoutMillis() {
        return drainTimeoutMillis;
    }

    @Override
    public String toString() {
        return "ComputeConfiguration [engineName=" + engineName
                + ", poolSize=" + poolSize
                + ", drainTimeoutMillis=" + drainTimeoutMillis + ']';
    }

    /**
     * Builder, starts from the same defaults as {@code reference.conf}.
     */
    public static class Builder {
        private String engineName = "fanout";

        private int poolSize = AUTO_POOL_SIZE;

        private long drainTimeoutMillis = 10_000;

        public Builder engineName(String engineName) {
            this.engineName = engineName;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder drainTimeoutMillis(long drainTimeoutMillis) {
            this.drainTimeoutMillis = drainTimeoutMillis;
            return this;
        }

        /**
         * Validates the settings and builds the configuration.
         *
         * @return Configuration.
         * @throws FanoutException With {@code ILLEGAL_ARGUMENT_ERR} if a setting is out of range.
         */
        public ComputeConfiguration build() {
            if (engineName == null || engineName.isBlank()) {
                throw new FanoutException(ILLEGAL_ARGUMENT_ERR, "Engine name must not be blank");
            }

            if (poolSize < 0) {
                throw new FanoutException(ILLEGAL_ARGUMENT_ERR, "Pool size must not be negative [poolSize=" + poolSize + ']');
            }

            if (drainTimeoutMillis < 0) {
                throw new FanoutException(
                        ILLEGAL_ARGUMENT_ERR,
                        "Drain timeout must not be negative [drainTimeoutMillis=" + drainTimeoutMillis + ']'
                );
            }

            return new ComputeConfiguration(engineName, poolSize, drainTimeoutMillis);
        }
    }
}
