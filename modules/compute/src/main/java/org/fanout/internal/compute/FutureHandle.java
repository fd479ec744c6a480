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


package org.fanout.internal.compute;

import org.fanout.compute.FutureRef;

/**
 * Future handle: an index into the record table of the store that issued it, checked against the id of that store.
 *
 * @param <T> Type of the value.
 */
final class FutureHandle<T> implements FutureRef<T> {
    /** Id of the issuing store. */
    private final long storeId;

    /** Index in the record table. */
    private final int index;

    FutureHandle(long storeId, int index) {
        this.storeId = storeId;
        this.index = index;
    }

    long storeId() {
        return storeId;
    }

    int index() {
        return index;
    }

    @Override
    public long id() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        FutureHandle<?> that = (FutureHandle<?>) o;

        return storeId == that.storeId && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(storeId) + index;
    }

    @Override
    public String toString() {
        return "FutureHandle [id=" + index + ']';
    }
}
