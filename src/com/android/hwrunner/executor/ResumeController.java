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
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.config.ResultsDir;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.result.OutputStrings;
import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the state of an interrupted batch from its results directory. The last job that has
 * a directory is resumed: subtests its journal shows as already started are excluded from the
 * rerun, and a job whose journal ends with an exit record is considered done.
 */
public class ResumeController {

    /** Entry of the job list that matches every subtest, so exclusions can follow it. */
    @VisibleForTesting static final String ALL_SUBTESTS = "*";

    @VisibleForTesting static final String EXCLUDE_PREFIX = "!";

    private ResumeController() {}

    /** Loads the batch in {@code resultsDir} and finds where to continue. */
    public static ExecuteState resume(File resultsDir) throws IOException {
        RunnerSettings settings = RunnerSettings.deserialize(resultsDir);
        JobList jobList = JobList.deserialize(resultsDir);
        int next = findNext(resultsDir, jobList);
        CLog.i(
                "Resuming %s at job %d of %d",
                resultsDir,
                Math.min(next, jobList.size()),
                jobList.size());
        return new ExecuteState(settings, jobList, next);
    }

    /**
     * Finds the index of the job to run next, pruning the already attempted subtests of that job
     * from {@code jobList}.
     */
    @VisibleForTesting
    static int findNext(File resultsDir, JobList jobList) throws IOException {
        int index;
        for (index = jobList.size(); index >= 0; index--) {
            if (ResultsDir.jobDir(resultsDir, index).isDirectory()) {
                break;
            }
        }
        if (index < 0) {
            return 0;
        }
        if (index >= jobList.size()) {
            return index;
        }

        File journal = OutputFile.JOURNAL.in(ResultsDir.jobDir(resultsDir, index));
        if (!journal.exists()) {
            return index;
        }
        JournalPruning pruning =
                pruneFromJournal(
                        jobList.get(index),
                        FileUtil.readStringFromFile(journal, StandardCharsets.ISO_8859_1));
        if (pruning.isCompleted() || !pruning.isPruned()) {
            return index + 1;
        }
        jobList.set(index, pruning.getEntry());
        return index;
    }

    /** What the journal of a job says about the subtests left to run. */
    @VisibleForTesting
    static final class JournalPruning {
        private final JobListEntry mEntry;
        private final boolean mPruned;
        private final boolean mCompleted;

        JournalPruning(JobListEntry entry, boolean pruned, boolean completed) {
            mEntry = entry;
            mPruned = pruned;
            mCompleted = completed;
        }

        /** The job, with the subtests found in the journal excluded. */
        JobListEntry getEntry() {
            return mEntry;
        }

        boolean isPruned() {
            return mPruned;
        }

        /** Whether the journal records the exit of the test binary. */
        boolean isCompleted() {
            return mCompleted;
        }
    }

    @VisibleForTesting
    static JournalPruning pruneFromJournal(JobListEntry entry, String journal) {
        List<String> subtests = new ArrayList<>(entry.getSubtests());
        boolean pruned = false;
        boolean completed = false;
        List<String> tokens =
                Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().splitToList(journal);
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            boolean exit = token.startsWith(OutputStrings.EXECUTOR_EXIT);
            if (exit || token.startsWith(OutputStrings.EXECUTOR_TIMEOUT)) {
                completed |= exit;
                if (i + 1 < tokens.size() && tokens.get(i + 1).startsWith("(")) {
                    i++;
                }
                continue;
            }
            if (subtests.isEmpty()) {
                subtests.add(ALL_SUBTESTS);
            }
            subtests.add(EXCLUDE_PREFIX + token);
            pruned = true;
        }
        return new JournalPruning(entry.withSubtests(subtests), pruned, completed);
    }
}
