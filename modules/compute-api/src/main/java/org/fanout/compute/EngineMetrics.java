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

/**
 * Point-in-time counters of a task engine.
 */
public final class EngineMetrics {
    private final long submitted;

    private final long completed;

    private final long failed;

    private final long skipped;

    private final int queued;

    private final int executing;

    private final int poolSize;

    private EngineMetrics(Builder builder) {
        this.submitted = builder.submitted;
        this.completed = builder.completed;
        this.failed = builder.failed;
        this.skipped = builder.skipped;
        this.queued = builder.queued;
        this.executing = builder.executing;
        this.poolSize = builder.poolSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of accepted submissions. */
    public long submitted() {
        return submitted;
    }

    /** Number of tasks whose payload returned a value. */
    public long completed() {
        return completed;
    }

    /** Number of tasks whose payload threw. */
    public long failed() {
        return failed;
    }

    /** Number of tasks failed without execution because a dependency failed. */
    public long skipped() {
        return skipped;
    }

    /** Number of ready tasks waiting for a free worker slot. */
    public int queued() {
        return queued;
    }

    /** Number of busy worker slots. */
    public int executing() {
        return executing;
    }

    /** Number of worker slots. */
    public int poolSize() {
        return poolSize;
    }

    @Override
    public String toString() {
        return "EngineMetrics [submitted=" + submitted
                + ", completed=" + completed
                + ", failed=" + failed
                + ", skipped=" + skipped
                + ", queued=" + queued
                + ", executing=" + executing
                + ", poolSize=" + poolSize + ']';
    }

    /**
     * Builder.
     */
    public static class Builder {
        private long submitted;

        private long completed;

        private long failed;

        private long skipped;

        private int queued;

        private int executing;

        private int poolSize;

        public Builder submitted(long submitted) {
            this.submitted = submitted;
            return this;
        }

        public Builder completed(long completed) {
            this.completed = completed;
            return this;
        }

        public Builder failed(long failed) {
            this.failed = failed;
            return this;
        }

        public Builder skipped(long skipped) {
            this.skipped = skipped;
            return this;
        }

        public Builder queued(int queued) {
            this.queued = queued;
            return this;
        }

        public Builder executing(int executing) {
            this.executing = executing;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public EngineMetrics build() {
            return new EngineMetrics(this);
        }
    }
}
