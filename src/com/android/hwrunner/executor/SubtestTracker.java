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
package com.android.hwrunner.executor;

import com.android.hwrunner.result.OutputStrings;

/**
 * Follows the stdout of a running job line by line and derives the journal records from the
 * subtest start and result lines: the name of every subtest that starts, and the name of a
 * subtest that reports a result without having started.
 */
public class SubtestTracker {

    private final StringBuilder mPartialLine = new StringBuilder();
    private String mCurrentSubtest = null;

    /**
     * Consumes a chunk of stdout.
     *
     * @return the text to append to the journal, possibly empty
     */
    public String feed(String chunk) {
        StringBuilder journal = new StringBuilder();
        mPartialLine.append(chunk);
        int newline;
        while ((newline = mPartialLine.indexOf("\n")) >= 0) {
            String line = mPartialLine.substring(0, newline);
            mPartialLine.delete(0, newline + 1);
            journal.append(onLine(line));
        }
        return journal.toString();
    }

    private String onLine(String line) {
        if (line.length() > OutputStrings.STARTING_SUBTEST.length()
                && line.startsWith(OutputStrings.STARTING_SUBTEST)) {
            return onSubtestStart(line.substring(OutputStrings.STARTING_SUBTEST.length()));
        }
        if (line.startsWith(OutputStrings.SUBTEST_RESULT)) {
            int delim = line.indexOf(':', OutputStrings.SUBTEST_RESULT.length());
            if (delim >= 0) {
                return onSubtestResult(
                        line.substring(OutputStrings.SUBTEST_RESULT.length(), delim));
            }
        }
        return "";
    }

    /** Records the start of a subtest; returns its journal line. */
    public String onSubtestStart(String name) {
        mCurrentSubtest = name;
        return name + "\n";
    }

    /**
     * Records the result of a subtest; returns a journal line only if the subtest never
     * announced its start.
     */
    public String onSubtestResult(String name) {
        if (name.equals(mCurrentSubtest)) {
            return "";
        }
        mCurrentSubtest = null;
        return name + "\n";
    }

    /** Name of the subtest that started last and has not been replaced, or null. */
    public String getCurrentSubtest() {
        return mCurrentSubtest;
    }
}
