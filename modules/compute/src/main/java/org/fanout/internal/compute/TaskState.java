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

/**
 * Task state. Transitions: {@code REGISTERED -> WAITING -> READY -> EXECUTING -> RESOLVED | FAILED}, or
 * {@code WAITING -> FAILED} when a dependency fails. No task re-enters an earlier state.
 */
enum TaskState {
    /** Created, dependencies are not inspected yet. */
    REGISTERED,

    /** Waiting for future arguments. */
    WAITING,

    /** All future arguments are ready, the task waits for a worker slot. */
    READY,

    /** Running in a worker slot. */
    EXECUTING,

    /** The payload returned a value. */
    RESOLVED,

    /** The payload threw, or a dependency failed. */
    FAILED
}
