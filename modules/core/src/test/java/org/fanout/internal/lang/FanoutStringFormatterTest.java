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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import org.junit.jupiter.api.Test;

class FanoutStringFormatterTest {
    @Test
    void substitutesAnchorsInOrder() {
        assertThat(FanoutStringFormatter.format("Task {} failed on {}.", 7, "worker-1"), is("Task 7 failed on worker-1."));
    }

    @Test
    void leavesUnmatchedAnchors() {
        assertThat(FanoutStringFormatter.format("{} and {}", "one"), is("one and {}"));
    }

    @Test
    void ignoresExtraArguments() {
        assertThat(FanoutStringFormatter.format("only {}", 1, 2, 3), is("only 1"));
    }

    @Test
    void keepsEscapedAnchor() {
        assertThat(FanoutStringFormatter.format("literal \\{} then {}", "x"), is("literal {} then x"));
    }

    @Test
    void rendersArraysAndNulls() {
        assertThat(FanoutStringFormatter.format("{} {} {}", new int[] {1, 2}, new String[] {"a"}, null), is("[1, 2] [a] null"));
    }

    @Test
    void handlesNullPattern() {
        assertThat(FanoutStringFormatter.format(null, 1), is(nullValue()));
    }
}
