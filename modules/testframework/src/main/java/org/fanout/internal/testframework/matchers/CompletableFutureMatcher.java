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


package org.fanout.internal.testframework.matchers;

import static org.hamcrest.Matchers.anything;
import static org.hamcrest.Matchers.equalTo;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/**
 * {@link Matcher} that awaits for the given future to complete and then forwards the result to the nested {@code matcher}.
 */
public class CompletableFutureMatcher<T> extends TypeSafeMatcher<CompletableFuture<? extends T>> {
    /** Default timeout in seconds. */
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    /** Matcher to forward the result of the completable future. */
    private final Matcher<T> matcher;

    /** Timeout. */
    private final int timeout;

    /** Time unit for timeout. */
    private final TimeUnit timeoutTimeUnit;

    /** Failure raised while waiting, kept for the mismatch description. */
    private Throwable failure;

    /**
     * Constructor.
     *
     * @param matcher Matcher to forward the result of the completable future.
     * @param timeout Timeout.
     * @param timeoutTimeUnit {@link TimeUnit} for timeout.
     */
    private CompletableFutureMatcher(Matcher<T> matcher, int timeout, TimeUnit timeoutTimeUnit) {
        this.matcher = matcher;
        this.timeout = timeout;
        this.timeoutTimeUnit = timeoutTimeUnit;
    }

    @Override
    protected boolean matchesSafely(CompletableFuture<? extends T> item) {
        try {
            return matcher.matches(item.get(timeout, timeoutTimeUnit));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            failure = e;

            return false;
        } catch (ExecutionException | TimeoutException e) {
            failure = e;

            return false;
        }
    }

    @Override
    public void describeTo(Description description) {
        description.appendText("is a future that completes successfully with ").appendDescriptionOf(matcher);
    }

    @Override
    protected void describeMismatchSafely(CompletableFuture<? extends T> item, Description mismatchDescription) {
        if (failure != null) {
            mismatchDescription.appendText("failed with ").appendValue(failure);
        } else {
            mismatchDescription.appendText("was ").appendValue(item.getNow(null));
        }
    }

    /**
     * Creates a matcher that matches a future that completes successfully with any result within the default timeout.
     *
     * @return matcher.
     */
    public static CompletableFutureMatcher<Object> willCompleteSuccessfully() {
        return willBe(anything());
    }

    /**
     * Creates a matcher that matches a future that completes successfully and decently fast.
     *
     * @return matcher.
     */
    public static CompletableFutureMatcher<Object> willSucceedFast() {
        return new CompletableFutureMatcher<>(anything(), 1, TimeUnit.SECONDS);
    }

    /**
     * Creates a matcher that matches a future that completes with a value equal to the given one.
     *
     * @param value Expected value.
     * @return matcher.
     */
    public static <T> CompletableFutureMatcher<T> willBe(T value) {
        return willBe(equalTo(value));
    }

    /**
     * Creates a matcher that matches a future that completes with a value matching the given matcher.
     *
     * @param matcher Matcher for the result.
     * @return matcher.
     */
    public static <T> CompletableFutureMatcher<T> willBe(Matcher<T> matcher) {
        return new CompletableFutureMatcher<>(matcher, DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
}
