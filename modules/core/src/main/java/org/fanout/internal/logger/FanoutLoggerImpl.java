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

import java.lang.System.Logger.Level;
import org.fanout.internal.lang.FanoutStringFormatter;
import org.jetbrains.annotations.Nullable;

/**
 * {@link FanoutLogger} on top of a {@link System.Logger}, which routes records to whatever backend the JVM is configured with.
 */
class FanoutLoggerImpl implements FanoutLogger {
    final System.Logger delegate;

    FanoutLoggerImpl(System.Logger delegate) {
        this.delegate = delegate;
    }

    @Override
    public void info(String msg, Object... params) {
        log(Level.INFO, null, msg, params);
    }

    @Override
    public void warn(String msg, Object... params) {
        log(Level.WARNING, null, msg, params);
    }

    @Override
    public void debug(String msg, Object... params) {
        log(Level.DEBUG, null, msg, params);
    }

    @Override
    public void debug(String msg, @Nullable Throwable th, Object... params) {
        log(Level.DEBUG, th, msg, params);
    }

    @Override
    public void error(String msg, @Nullable Throwable th, Object... params) {
        log(Level.ERROR, th, msg, params);
    }

    @Override
    public boolean isDebugEnabled() {
        return delegate.isLoggable(Level.DEBUG);
    }

    private void log(Level level, @Nullable Throwable th, String msg, Object[] params) {
        if (!delegate.isLoggable(level)) {
            return;
        }

        String text = FanoutStringFormatter.format(msg, params);

        if (th == null) {
            delegate.log(level, text);
        } else {
            delegate.log(level, text, th);
        }
    }
}
