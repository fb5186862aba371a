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

import com.android.hwrunner.config.JobList;
import com.android.hwrunner.config.RunnerSettings;

/** Where a batch stands: its settings, its job list and the index of the next job to run. */
public class ExecuteState {

    private final RunnerSettings mSettings;
    private final JobList mJobList;
    private int mNext;

    public ExecuteState(RunnerSettings settings, JobList jobList, int next) {
        mSettings = settings;
        mJobList = jobList;
        mNext = next;
    }

    public RunnerSettings getSettings() {
        return mSettings;
    }

    public JobList getJobList() {
        return mJobList;
    }

    public int getNext() {
        return mNext;
    }

    public void setNext(int next) {
        mNext = next;
    }

    /** Whether every job has been run. */
    public boolean isDone() {
        return mNext >= mJobList.size();
    }
}
