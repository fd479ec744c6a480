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

package org.fanout.internal.lang;

import static org.fanout.lang.ErrorGroup.errorGroupByCode;
import static org.fanout.lang.ErrorGroup.errorMessage;
import static org.fanout.lang.ErrorGroup.extractErrorCode;
import static org.fanout.lang.ErrorGroup.extractGroupCode;
import static org.fanout.lang.util.TraceIdUtils.getOrCreateTraceId;

import java.util.UUID;
import org.fanout.lang.ErrorGroup;
import org.fanout.lang.TraceableException;
import org.jetbrains.annotations.Nullable;

/**
 * General internal exception. This exception is used to indicate a broken invariant within the engine.
 */
public class FanoutInternalException extends RuntimeException implements TraceableException {
    /** Serial version uid. */
    private static final long serialVersionUID = 0L;

    /** Name of the error group. */
    private final String groupName;

    /** Full error code, see {@link TraceableException#code()}. */
    private final int code;

    /** Unique identifier of this exception that should help locating the error message in a log file. */
    private final UUID traceId;

    /**
     * Creates a new exception with the given error code and detail message.
     *
     * @param code Full error code.
     * @param message Detail message.
     */
    public FanoutInternalException(int code, String message) {
        this(UUID.randomUUID(), code, message, null);
    }

    /**
     * Creates a new exception with the given error code, detail message and cause.
     *
     * @param code Full error code.
     * @param message Detail message.
     * @param cause Optional nested exception (can be {@code null}).
     */
    public FanoutInternalException(int code, String message, @Nullable Throwable cause) {
        this(getOrCreateTraceId(cause), code, message, cause);
    }

    /**
     * Creates a new exception with the given trace id, error code, detail message and cause.
     *
     * @param traceId Unique identifier of this exception.
     * @param code Full error code.
     * @param message Detail message.
     * @param cause Optional nested exception (can be {@code null}).
     */
    public FanoutInternalException(UUID traceId, int code, @Nullable String message, @Nullable Throwable cause) {
        super(message, cause);

        this.traceId = traceId;
        this.groupName = errorGroupByCode(code).name();
        this.code = code;
    }

    /**
     * Creates a new exception with the given error code and detail message.
     *
     * @param code Full error code.
     * @param messagePattern Error message pattern.
     * @param params Error message params.
     * @see FanoutStringFormatter#format(String, Object...)
     */
    public FanoutInternalException(int code, String messagePattern, Object... params) {
        this(code, FanoutStringFormatter.format(messagePattern, params));
    }

    /**
     * Returns a group name of this error.
     *
     * @return Group name.
     */
    public String groupName() {
        return groupName;
    }

    @Override
    public int code() {
        return code;
    }

    /**
     * Returns a human-readable string represents a full error code.
     * Returned string has the following format: FAN-XXX-nnn, where XXX is a group name and nnn is an unique error code within a group.
     *
     * @return Full error code in a human-readable format.
     */
    public String codeAsString() {
        return ErrorGroup.codeAsString(code);
    }

    @Override
    public short groupCode() {
        return extractGroupCode(code);
    }

    @Override
    public short errorCode() {
        return extractErrorCode(code);
    }

    @Override
    public UUID traceId() {
        return traceId;
    }

    /** {@inheritDoc} */
    @Override
    public String toString() {
        return getClass().getName() + ": " + errorMessage(traceId, code, getLocalizedMessage());
    }
}
