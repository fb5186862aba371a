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

import com.android.hwrunner.log.LogUtil.CLog;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** The result kinds a test node can end up with. */
public enum TestStatus {
    /** Test passed */
    PASS("pass"),
    /** Test passed but printed unexpected output to stderr */
    WARN("warn"),
    /** Test skipped, did not run for a reason */
    SKIP("skip"),
    /** Test failed */
    FAIL("fail"),
    /** Test crashed */
    CRASH("crash"),
    /** Test was killed for inactivity */
    TIMEOUT("timeout"),
    /** Test started but not ended */
    INCOMPLETE("incomplete"),
    /** Test requested the whole run to be aborted */
    ABORT("abort"),
    /** Test was never executed */
    NOTRUN("notrun"),
    /** Test passed but the kernel logged warnings */
    DMESG_WARN("dmesg-warn"),
    /** Test failed and the kernel logged warnings */
    DMESG_FAIL("dmesg-fail");

    // Result words printed by the test binaries in their result lines.
    private static final Map<String, TestStatus> RESULT_WORDS =
            ImmutableMap.of(
                    "SUCCESS", PASS,
                    "SKIP", SKIP,
                    "FAIL", FAIL,
                    "CRASH", CRASH,
                    "TIMEOUT", TIMEOUT);

    private final String mName;

    TestStatus(String name) {
        mName = name;
    }

    /** The name used in the results document. */
    public String getName() {
        return mName;
    }

    /** Looks up a status by its results document name, null if unknown. */
    public static TestStatus fromName(String name) {
        for (TestStatus status : values()) {
            if (status.mName.equals(name)) {
                return status;
            }
        }
        return null;
    }

    /** Like {@link #fromName(String)} but unknown names become {@link #INCOMPLETE}. */
    public static TestStatus fromNameOrIncomplete(String name) {
        TestStatus status = fromName(name);
        if (status == null) {
            CLog.w("Unknown result '%s', using incomplete", name);
            return INCOMPLETE;
        }
        return status;
    }

    /**
     * Converts the result word of a result line ({@code SUCCESS}, {@code FAIL}, ...). Anything
     * unrecognized is {@link #INCOMPLETE}.
     */
    public static TestStatus fromResultWord(String word) {
        TestStatus status = RESULT_WORDS.get(word);
        return status == null ? INCOMPLETE : status;
    }

    /** The status implied by a process exit code when no result line says otherwise. */
    public static TestStatus fromExitCode(int exitCode) {
        switch (exitCode) {
            case ExitCodes.SKIP:
            case ExitCodes.INVALID:
                return SKIP;
            case ExitCodes.SUCCESS:
                return PASS;
            case ExitCodes.ABORT:
                return ABORT;
            case ExitCodes.INCOMPLETE:
                return INCOMPLETE;
            case ExitCodes.GRACEFUL:
                return NOTRUN;
            default:
                return FAIL;
        }
    }

    @Override
    public String toString() {
        return mName;
    }
}
