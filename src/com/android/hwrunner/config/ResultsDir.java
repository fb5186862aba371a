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
package com.android.hwrunner.config;

import java.io.File;

/** Names of the batch level files of a results directory. */
public final class ResultsDir {

    public static final String UNAME_FILENAME = "uname.txt";
    public static final String STARTTIME_FILENAME = "starttime.txt";
    public static final String ENDTIME_FILENAME = "endtime.txt";
    /** Only present when the batch was aborted; holds the reason. */
    public static final String ABORTED_FILENAME = "aborted.txt";
    public static final String RESULTS_FILENAME = "results.json";

    private ResultsDir() {}

    /** The directory of the job at {@code index} of the job list. */
    public static File jobDir(File resultsDir, int index) {
        return new File(resultsDir, Integer.toString(index));
    }
}
