/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.android.hwrunner.result;

import java.util.ArrayList;
import java.util.List;

/** A line of test output that starts with one of the sentinels. */
final class SentinelMatch {

    /** The sentinels, in matching priority order. */
    enum Sentinel {
        STARTING_SUBTEST(OutputStrings.STARTING_SUBTEST, false, false),
        SUBTEST_RESULT(OutputStrings.SUBTEST_RESULT, true, false),
        STARTING_DYNAMIC_SUBTEST(OutputStrings.STARTING_DYNAMIC_SUBTEST, false, true),
        DYNAMIC_SUBTEST_RESULT(OutputStrings.DYNAMIC_SUBTEST_RESULT, true, true);

        private final String mPrefix;
        private final boolean mResult;
        private final boolean mDynamic;

        Sentinel(String prefix, boolean result, boolean dynamic) {
            mPrefix = prefix;
            mResult = result;
            mDynamic = dynamic;
        }

        String getPrefix() {
            return mPrefix;
        }

        boolean isResult() {
            return mResult;
        }

        boolean isDynamic() {
            return mDynamic;
        }

        /**
         * Whether the line at {@code pos} is this sentinel. Result lines must continue with a
         * valid subtest name followed by ": ", so prose that happens to start with "Subtest " is
         * not mistaken for a result.
         */
        boolean matchesAt(String buf, int pos, int end) {
            if (end - pos < mPrefix.length() || !buf.startsWith(mPrefix, pos)) {
                return false;
            }
            return !mResult || isResultLine(buf, pos + mPrefix.length(), end);
        }

        private static boolean isResultLine(String buf, int pos, int end) {
            if (pos >= end || !isValidNameChar(buf.charAt(pos))) {
                return false;
            }
            while (pos < end && isValidNameChar(buf.charAt(pos))) {
                pos++;
            }
            if (pos >= end || buf.charAt(pos++) != ':') {
                return false;
            }
            return pos < end && buf.charAt(pos) == ' ';
        }

        private static boolean isValidNameChar(char c) {
            return c == '-'
                    || c == '_'
                    || (c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9');
        }
    }

    private final int mWhere;
    private final Sentinel mWhat;

    SentinelMatch(int where, Sentinel what) {
        mWhere = where;
        mWhat = what;
    }

    /** Offset of the start of the matched line. */
    int getWhere() {
        return mWhere;
    }

    Sentinel getWhat() {
        return mWhat;
    }

    /** Finds every sentinel line of {@code buf} between {@code start} and {@code end}. */
    static List<SentinelMatch> findAll(String buf, int start, int end) {
        List<SentinelMatch> matches = new ArrayList<>();
        int line = start;
        while (line >= 0 && line < end) {
            for (Sentinel sentinel : Sentinel.values()) {
                if (sentinel.matchesAt(buf, line, end)) {
                    matches.add(new SentinelMatch(line, sentinel));
                    break;
                }
            }
            line = nextLine(buf, line, end);
        }
        return matches;
    }

    /** Offset of the line after the one at {@code pos}, or -1 if there is none before end. */
    static int nextLine(String buf, int pos, int end) {
        int newline = buf.indexOf('\n', pos);
        if (newline < 0 || newline + 1 >= end) {
            return -1;
        }
        return newline + 1;
    }
}
