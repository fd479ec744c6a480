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

import static org.fanout.lang.ErrorGroups.Compute.INVALID_SUBMISSION_ERR;

import java.util.Objects;

/**
 * Reference to a payload that can be submitted to a {@link TaskEngine}. Only instances of this class are accepted by the
 * submission methods, so a plain lambda cannot be submitted by accident.
 *
 * <p>Instances are created with the {@code of} factories for payloads of zero, one or two arguments, or with
 * {@link #ofVarargs(String, VarargsBody)} for payloads accepting any number of arguments:
 * <pre>
 *     RemoteFunction&lt;Integer&gt; increment = RemoteFunction.of("increment", (Integer x) -&gt; x + 1);
 *     RemoteFunction&lt;Integer&gt; add = RemoteFunction.of("add", (Integer a, Integer b) -&gt; a + b);
 * </pre>
 *
 * @param <R> Type of the result.
 */
public final class RemoteFunction<R> {
    /** Arity marker of a variadic function. */
    public static final int VARIADIC = -1;

    private final String name;

    private final int arity;

    private final VarargsBody<R> body;

    private RemoteFunction(String name, int arity, VarargsBody<R> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.arity = arity;
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * Creates a function without arguments.
     *
     * @param name Function name, used in logs and errors.
     * @param body Payload.
     * @return Remote function.
     */
    public static <R> RemoteFunction<R> of(String name, NoArgBody<R> body) {
        Objects.requireNonNull(body, "body");

        return new RemoteFunction<>(name, 0, args -> body.call());
    }

    /**
     * Creates a function of one argument.
     *
     * @param name Function name, used in logs and errors.
     * @param body Payload.
     * @return Remote function.
     */
    @SuppressWarnings("unchecked")
    public static <T, R> RemoteFunction<R> of(String name, UnaryBody<T, R> body) {
        Objects.requireNonNull(body, "body");

        return new RemoteFunction<>(name, 1, args -> body.call((T) args[0]));
    }

    /**
     * Creates a function of two arguments.
     *
     * @param name Function name, used in logs and errors.
     * @param body Payload.
     * @return Remote function.
     */
    @SuppressWarnings("unchecked")
    public static <T1, T2, R> RemoteFunction<R> of(String name, BinaryBody<T1, T2, R> body) {
        Objects.requireNonNull(body, "body");

        return new RemoteFunction<>(name, 2, args -> body.call((T1) args[0], (T2) args[1]));
    }

    /**
     * Creates a function accepting any number of arguments.
     *
     * @param name Function name, used in logs and errors.
     * @param body Payload.
     * @return Remote function.
     */
    public static <R> RemoteFunction<R> ofVarargs(String name, VarargsBody<R> body) {
        return new RemoteFunction<>(name, VARIADIC, body);
    }

    /**
     * Returns the function name.
     *
     * @return Name.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the number of arguments the function accepts, or {@link #VARIADIC}.
     *
     * @return Arity.
     */
    public int arity() {
        return arity;
    }

    /**
     * Checks that the function can be called with the given number of arguments.
     *
     * @param argCount Number of arguments of a submission.
     * @throws ComputeException With {@code INVALID_SUBMISSION_ERR} if the count does not match the arity.
     */
    public void checkArity(int argCount) {
        if (arity != VARIADIC && arity != argCount) {
            throw new ComputeException(
                    INVALID_SUBMISSION_ERR,
                    "Wrong number of arguments [function=" + name + ", expected=" + arity + ", actual=" + argCount + ']'
            );
        }
    }

    /**
     * Runs the payload with resolved argument values.
     *
     * @param args Resolved arguments.
     * @return Result of the payload.
     * @throws Exception Anything the payload throws.
     */
    public R call(Object... args) throws Exception {
        return body.call(args);
    }

    @Override
    public String toString() {
        return "RemoteFunction [name=" + name + ", arity=" + (arity == VARIADIC ? "*" : String.valueOf(arity)) + ']';
    }

    /** Payload without arguments. */
    @FunctionalInterface
    public interface NoArgBody<R> {
        R call() throws Exception;
    }

    /** Payload of one argument. */
    @FunctionalInterface
    public interface UnaryBody<T, R> {
        R call(T arg) throws Exception;
    }

    /** Payload of two arguments. */
    @FunctionalInterface
    public interface BinaryBody<T1, T2, R> {
        R call(T1 arg1, T2 arg2) throws Exception;
    }

    /** Payload accepting any number of arguments. */
    @FunctionalInterface
    public interface VarargsBody<R> {
        R call(Object... args) throws Exception;
    }
}
