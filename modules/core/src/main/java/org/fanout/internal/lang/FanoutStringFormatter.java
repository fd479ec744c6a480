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

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats messages according to very simple substitution rules. Substitutions can be made 1, 2 or more arguments.
 *
 * <p>For example,
 * <pre>
 *     FanoutStringFormatter.format("Hi {}.", "there")
 * </pre>
 * will return the string "Hi there.".
 *
 * <p>The {} pair is called the <em>formatting anchor</em>. It serves to designate the location where arguments need to be substituted
 * within the message pattern. Anchors without a matching argument are left as is, extra arguments are ignored. A backslash
 * directly before an anchor escapes it.
 */
public final class FanoutStringFormatter {
    private static final String ANCHOR = "{}";

    private static final char ESCAPE_CHAR = '\\';

    /**
     * Performs the substitution of the formatting anchors with the given arguments.
     *
     * @param messagePattern The message pattern which will be parsed and formatted.
     * @param params The arguments to be substituted in place of the formatting anchors.
     * @return The formatted message.
     */
    public static String format(@Nullable String messagePattern, @Nullable Object... params) {
        if (messagePattern == null) {
            return null;
        }

        if (params == null || params.length == 0) {
            return messagePattern;
        }

        StringBuilder sb = new StringBuilder(messagePattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int anchorIdx = messagePattern.indexOf(ANCHOR, from);

            if (anchorIdx < 0) {
                break;
            }

            if (anchorIdx > 0 && messagePattern.charAt(anchorIdx - 1) == ESCAPE_CHAR) {
                sb.append(messagePattern, from, anchorIdx - 1).append(ANCHOR);
            } else {
                sb.append(messagePattern, from, anchorIdx);
                appendParameter(sb, params[paramIdx++]);
            }

            from = anchorIdx + ANCHOR.length();
        }

        sb.append(messagePattern, from, messagePattern.length());

        return sb.toString();
    }

    private static void appendParameter(StringBuilder sb, @Nullable Object param) {
        if (param == null) {
            sb.append("null");
        } else if (param instanceof Object[]) {
            sb.append(Arrays.deepToString((Object[]) param));
        } else if (param.getClass().isArray()) {
            // Primitive array: let deepToString pick the right overload and strip the wrapping brackets.
            String wrapped = Arrays.deepToString(new Object[] {param});

            sb.append(wrapped, 1, wrapped.length() - 1);
        } else {
            sb.append(param);
        }
    }

    private FanoutStringFormatter() {
    }
}
