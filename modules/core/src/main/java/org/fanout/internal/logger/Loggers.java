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

package org.fanout.internal.logger;

import java.util.Objects;

/**
 * This class contains different static factory methods to create an instance of logger.
 */
public final class Loggers {
    /**
     * Creates logger for given class with system logger as a backend.
     *
     * @param cls The class for a logger.
     * @return Fanout logger.
     */
    public static FanoutLogger forClass(Class<?> cls) {
        return forName(Objects.requireNonNull(cls, "cls").getName());
    }

    /**
     * Creates logger with the given name and system logger as a backend.
     *
     * @param name The name for a logger.
     * @return Fanout logger.
     */
    public static FanoutLogger forName(String name) {
        var delegate = System.getLogger(Objects.requireNonNull(name, "name"));

        return new FanoutLoggerImpl(delegate);
    }

    /**
     * Creates the logger which outputs nothing.
     *
     * @return Void logger.
     */
    public static FanoutLogger voidLogger() {
        return VoidLogger.INSTANCE;
    }

    private Loggers() {
    }
}
