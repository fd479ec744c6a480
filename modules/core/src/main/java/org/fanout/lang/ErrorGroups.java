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

package org.fanout.lang;

/**
 * Defines error groups and its errors.
 */
@SuppressWarnings("PublicInnerClass")
public class ErrorGroups {
    /** Common error group. */
    public static class Common {
        /** Common error group. */
        public static final ErrorGroup COMMON_ERR_GROUP = ErrorGroup.newGroup("CMN", (short) 1);

        /** Unexpected error. */
        public static final int INTERNAL_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 1);

        /** Node (engine) stopping error. */
        public static final int NODE_STOPPING_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 2);

        /** Illegal argument or argument in a wrong format has been passed. */
        public static final int ILLEGAL_ARGUMENT_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 3);
    }

    /** Compute error group. */
    public static class Compute {
        /** Compute error group. */
        public static final ErrorGroup COMPUTE_ERR_GROUP = ErrorGroup.newGroup("COMPUTE", (short) 2);

        /** Task payload failed during execution. */
        public static final int TASK_FAILED_ERR = COMPUTE_ERR_GROUP.registerErrorCode((short) 1);

        /** Submission rejected synchronously: wrong arity, bad arguments or malformed function reference. */
        public static final int INVALID_SUBMISSION_ERR = COMPUTE_ERR_GROUP.registerErrorCode((short) 2);

        /** Future handle is not known to the engine. */
        public static final int UNKNOWN_FUTURE_ERR = COMPUTE_ERR_GROUP.registerErrorCode((short) 3);

        /** Attempt to complete a future that has already left the pending state. */
        public static final int FUTURE_ALREADY_COMPLETED_ERR = COMPUTE_ERR_GROUP.registerErrorCode((short) 4);

        /** Result was not available within the requested timeout. */
        public static final int RESULT_TIMEOUT_ERR = COMPUTE_ERR_GROUP.registerErrorCode((short) 5);

        /** Reduction over an empty sequence. */
        public static final int EMPTY_REDUCTION_ERR = COMPUTE_ERR_GROUP.registerErrorCode((short) 6);
    }
}
