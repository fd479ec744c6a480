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

import static org.fanout.lang.ErrorGroups.Compute.TASK_FAILED_ERR;

/**
 * Thrown on retrieval of a future whose task failed, or whose task was skipped because one of its dependencies failed.
 * The cause is the exception raised by the payload of the originating task. Every retrieval of the failed future, and of
 * all its transitive dependents, observes the same instance.
 */
public class TaskExecutionException extends ComputeException {
    private static final long serialVersionUID = 0L;

    /** Id of the task whose payload failed. */
    private final long taskId;

    /** Name of the remote function of the failed task. */
    private final String functionName;

    /**
     * Constructor.
     *
     * @param taskId Id of the task whose payload failed.
     * @param functionName Name of the remote function of the failed task.
     * @param cause Exception raised by the payload.
     */
    public TaskExecutionException(long taskId, String functionName, Throwable cause) {
        super(TASK_FAILED_ERR, "Task failed [taskId=" + taskId + ", function=" + functionName + "]: " + cause, cause);

        this.taskId = taskId;
        this.functionName = functionName;
    }

    /**
     * Returns the id of the task whose payload failed. For a dependent that was never executed this is the id of the failed
     * upstream task, not of the dependent itself.
     *
     * @return Task id.
     */
    public long taskId() {
        return taskId;
    }

    /**
     * Returns the name of the remote function whose execution failed.
     *
     * @return Function name.
     */
    public String functionName() {
        return functionName;
    }
}
