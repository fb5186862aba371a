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

/** Literal sentinels written by test binaries and by the executor. */
public final class OutputStrings {

    public static final String STARTING_SUBTEST = "Starting subtest: ";
    public static final String SUBTEST_RESULT = "Subtest ";
    public static final String STARTING_DYNAMIC_SUBTEST = "Starting dynamic subtest: ";
    public static final String DYNAMIC_SUBTEST_RESULT = "Dynamic subtest ";

    /** Markers the test binaries write into the kernel log. */
    public static final String STARTING_SUBTEST_DMESG = ": starting subtest ";

    public static final String STARTING_DYNAMIC_SUBTEST_DMESG = ": starting dynamic subtest ";

    public static final String IGT_VERSIONSTRING = "IGT-Version: ";

    /** Journal lines written at process exit. */
    public static final String EXECUTOR_EXIT = "exit:";

    public static final String EXECUTOR_TIMEOUT = "timeout:";

    private OutputStrings() {}
}
