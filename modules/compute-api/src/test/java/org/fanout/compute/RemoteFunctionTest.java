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

import static org.fanout.internal.testframework.FanoutTestUtils.assertThrowsWithCode;
import static org.fanout.lang.ErrorGroups.Compute.INVALID_SUBMISSION_ERR;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class RemoteFunctionTest {
    @Test
    void callsPayloadsOfEveryArity() throws Exception {
        assertThat(RemoteFunction.of("answer", () -> 42).call(), is(42));
        assertThat(RemoteFunction.of("increment", (Integer x) -> x + 1).call(1), is(2));
        assertThat(RemoteFunction.of("concat", (String a, Integer b) -> a + b).call("a", 1), is("a1"));
        assertThat(RemoteFunction.ofVarargs("count", args -> args.length).call(1, 2, 3), is(3));
    }

    @Test
    void reportsArity() {
        assertThat(RemoteFunction.of("answer", () -> 42).arity(), is(0));
        assertThat(RemoteFunction.of("add", (Integer a, Integer b) -> a + b).arity(), is(2));
        assertThat(RemoteFunction.ofVarargs("sum", args -> Arrays.stream(args).mapToInt(a -> (Integer) a).sum()).arity(),
                is(RemoteFunction.VARIADIC));
    }

    @Test
    void rejectsWrongArgumentCount() {
        RemoteFunction<Integer> add = RemoteFunction.of("add", (Integer a, Integer b) -> a + b);

        add.checkArity(2);

        ComputeException ex = assertThrowsWithCode(ComputeException.class, INVALID_SUBMISSION_ERR, () -> add.checkArity(3), "expected=2");

        assertThat(ex.codeAsString(), is("FAN-COMPUTE-2"));
    }

    @Test
    void variadicFunctionAcceptsAnyCount() {
        RemoteFunction<Integer> count = RemoteFunction.ofVarargs("count", args -> args.length);

        count.checkArity(0);
        count.checkArity(17);
    }

    @Test
    void propagatesPayloadExceptions() {
        RemoteFunction<Integer> failing = RemoteFunction.of("failing", () -> {
            throw new IllegalStateException("boom");
        });

        IllegalStateException ex = assertThrows(IllegalStateException.class, failing::call);

        assertThat(ex.getMessage(), is("boom"));
    }
}
