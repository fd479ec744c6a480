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

import static org.hamcrest.Matchers.instanceOf;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.fanout.internal.util.ExceptionUtils;
import org.fanout.lang.FanoutException;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;
import org.jetbrains.annotations.Nullable;

/**
 * Matcher that awaits for the given future to fail and matches the unwrapped cause.
 */
public class CompletableFutureExceptionMatcher extends TypeSafeMatcher<CompletableFuture<?>> {
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final Matcher<? extends Throwable> matcher;

    private final int timeout;

    private final TimeUnit timeoutTimeUnit;

    @Nullable
    private final Integer expectedCode;

    private CompletableFutureExceptionMatcher(
            Matcher<? extends Throwable> matcher,
            @Nullable Integer expectedCode,
            int timeout,
            TimeUnit timeoutTimeUnit
    ) {
        this.matcher = matcher;
        this.expectedCode = expectedCode;
        this.timeout = timeout;
        this.timeoutTimeUnit = timeoutTimeUnit;
    }

    @Override
    protected boolean matchesSafely(CompletableFuture<?> item) {
        try {
            item.get(timeout, timeoutTimeUnit);

            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();

            return false;
        } catch (Throwable e) {
            Throwable cause = ExceptionUtils.unwrapCause(e);

            if (!matcher.matches(cause)) {
                return false;
            }

            return expectedCode == null || (cause instanceof FanoutException && ((FanoutException) cause).code() == expectedCode);
        }
    }

    @Override
    public void describeTo(Description description) {
        description.appendText("is a future that fails with ").appendDescriptionOf(matcher);

        if (expectedCode != null) {
            description.appendText(" and code ").appendValue(expectedCode);
        }
    }

    @Override
    protected void describeMismatchSafely(CompletableFuture<?> item, Description mismatchDescription) {
        if (!item.isDone()) {
            mismatchDescription.appendText("was not completed");
        } else if (item.isCompletedExceptionally()) {
            mismatchDescription.appendText("failed with ").appendValue(item.handle((r, e) -> ExceptionUtils.unwrapCause(e)).join());
        } else {
            mismatchDescription.appendText("was completed successfully with ").appendValue(item.join());
        }
    }

    /**
     * Creates a matcher that matches a future that completes exceptionally with the given error class.
     *
     * @param cls Expected exception class of the unwrapped cause.
     * @return matcher.
     */
    public static CompletableFutureExceptionMatcher willThrow(Class<? extends Throwable> cls) {
        return new CompletableFutureExceptionMatcher(instanceOf(cls), null, DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Creates a matcher that matches a future that completes exceptionally with a {@link FanoutException} of the given class
     * and error code.
     *
     * @param cls Expected exception class of the unwrapped cause.
     * @param code Expected full error code.
     * @return matcher.
     */
    public static CompletableFutureExceptionMatcher willThrowWithCode(Class<? extends FanoutException> cls, int code) {
        return new CompletableFutureExceptionMatcher(instanceOf(cls), code, DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Creates a matcher that matches a future that fails with the given error class within one second.
     *
     * @param cls Expected exception class of the unwrapped cause.
     * @return matcher.
     */
    public static CompletableFutureExceptionMatcher willThrowFast(Class<? extends Throwable> cls) {
        return new CompletableFutureExceptionMatcher(instanceOf(cls), null, 1, TimeUnit.SECONDS);
    }
}
