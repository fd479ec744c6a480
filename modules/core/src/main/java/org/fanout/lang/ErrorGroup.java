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

import it.unimi.dsi.fastutil.shorts.Short2ObjectMap;
import it.unimi.dsi.fastutil.shorts.Short2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.shorts.ShortOpenHashSet;
import it.unimi.dsi.fastutil.shorts.ShortSet;
import java.util.Locale;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * Named group of error codes owned by one engine component. A full error code packs the group code into the upper 16 bits and the
 * code within the group into the lower 16 bits; its printable form is {@code FAN-<GROUP>-<code>}.
 */
public class ErrorGroup {
    /** Prefix of the printable error code. */
    public static final String ERR_PREFIX = "FAN-";

    /** Groups by group code. Guarded by the class monitor. */
    private static final Short2ObjectMap<ErrorGroup> GROUPS = new Short2ObjectOpenHashMap<>();

    private final String name;

    private final short code;

    /** Codes registered within the group. Guarded by {@code this}. */
    private final ShortSet errorCodes = new ShortOpenHashSet();

    private ErrorGroup(String name, short code) {
        this.name = name;
        this.code = code;
    }

    /**
     * Registers a group under a unique upper-cased name and a unique positive code.
     *
     * @param groupName Group name.
     * @param groupCode Group code.
     * @return Registered group.
     * @throws IllegalArgumentException If the name is empty, the code is not positive, or either is taken.
     */
    public static synchronized ErrorGroup newGroup(String groupName, short groupCode) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("Group name is null or empty");
        }

        if (groupCode <= 0) {
            throw new IllegalArgumentException("Group code should be greater than 0 [groupName=" + groupName
                    + ", groupCode=" + groupCode + ']');
        }

        String name = groupName.toUpperCase(Locale.ENGLISH);

        for (ErrorGroup group : GROUPS.values()) {
            if (group.code == groupCode || group.name.equals(name)) {
                throw new IllegalArgumentException("Error group already registered [groupName=" + groupName + ", groupCode=" + groupCode
                        + ", registeredGroup=" + group + ']');
            }
        }

        ErrorGroup group = new ErrorGroup(name, groupCode);

        GROUPS.put(groupCode, group);

        return group;
    }

    /** Returns the group name. */
    public String name() {
        return name;
    }

    /** Returns the group code. */
    public short code() {
        return code;
    }

    /**
     * Registers a code within this group.
     *
     * @param errorCode Positive code, unique within the group.
     * @return Full error code.
     * @throws IllegalArgumentException If the code is not positive or is already registered.
     */
    public synchronized int registerErrorCode(short errorCode) {
        if (errorCode <= 0 || !errorCodes.add(errorCode)) {
            throw new IllegalArgumentException("Error code is not positive or already registered [errorCode=" + errorCode
                    + ", group=" + name + ']');
        }

        return (code << 16) | (errorCode & 0xFFFF);
    }

    /** Returns the group code of a full error code. */
    public static short extractGroupCode(int code) {
        return (short) (code >>> 16);
    }

    /** Returns the code within the group of a full error code. */
    public static short extractErrorCode(int code) {
        return (short) (code & 0xFFFF);
    }

    /**
     * Looks up the group of a full error code.
     *
     * @param code Full error code.
     * @return Error group.
     * @throws IllegalArgumentException If no group owns the code.
     */
    public static synchronized ErrorGroup errorGroupByCode(int code) {
        ErrorGroup group = GROUPS.get(extractGroupCode(code));

        if (group == null) {
            throw new IllegalArgumentException("Unknown error group [code=" + code + ", groupCode=" + extractGroupCode(code) + ']');
        }

        return group;
    }

    /**
     * Formats a full error code as {@code FAN-<GROUP>-<code>}.
     *
     * @param code Full error code.
     * @return Printable error code.
     */
    public static String codeAsString(int code) {
        return ERR_PREFIX + errorGroupByCode(code).name() + '-' + extractErrorCode(code);
    }

    /**
     * Builds the message of a coded exception: the printable code, the trace id and the detail message, if any.
     *
     * @param traceId Trace id of the exception.
     * @param code Full error code.
     * @param message Detail message.
     * @return Error message.
     */
    public static String errorMessage(UUID traceId, int code, @Nullable String message) {
        String prefix = codeAsString(code) + " TraceId:" + traceId;

        return message == null ? prefix : prefix + ' ' + message;
    }

    @Override
    public String toString() {
        return "ErrorGroup [name=" + name + ", code=" + code + ']';
    }
}
