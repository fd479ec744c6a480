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
 * Opaque handle to the eventual result of a task, or to a value placed with {@link TaskEngine#put(Object)}.
 *
 * <p>A handle is only meaningful to the engine that produced it. Handles may be passed as arguments of later submissions,
 * in which case the engine substitutes the resolved value before the dependent task runs.
 *
 * @param <T> Type of the value.
 */
public interface FutureRef<T> {
    /**
     * Returns the id of the future, unique within its engine. The id of a task's future is also the id of the task.
     *
     * @return Future id.
     */
    long id();
}
