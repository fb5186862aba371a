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

import com.android.hwrunner.command.FatalHostError;
import com.android.hwrunner.config.JobList;
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.config.ResultsDir;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.error.InfraErrorIdentifier;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.log.LogUtil.LogLevel;
import com.android.hwrunner.result.ResultGenerator;
import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Drives a whole batch: prepares the results directory, runs the jobs one after the other,
 * resumes after a job is killed for inactivity, and produces the results document.
 */
public class BatchRunner {

    private static final ImmutableList<String> TOP_LEVEL_FILES =
            ImmutableList.of(
                    ResultsDir.UNAME_FILENAME,
                    ResultsDir.STARTTIME_FILENAME,
                    ResultsDir.ENDTIME_FILENAME,
                    ResultsDir.ABORTED_FILENAME,
                    ResultsDir.RESULTS_FILENAME);

    private final Supervisor mSupervisor;

    public BatchRunner(Supervisor supervisor) {
        mSupervisor = supervisor;
    }

    /**
     * Creates the results directory of a new batch and stores its settings and job list there.
     * With {@code overwrite}, the results of a previous batch are removed first.
     */
    public static ExecuteState initialize(RunnerSettings settings, JobList jobList)
            throws IOException {
        if (settings.getResultsPath() == null) {
            throw new HarnessRuntimeException(
                    "No results path given", InfraErrorIdentifier.INVALID_SETTINGS);
        }
        File resultsDir = new File(settings.getResultsPath());
        if (!resultsDir.isDirectory() && !resultsDir.mkdirs()) {
            throw new FatalHostError(
                    String.format("Creating results path %s failed", resultsDir),
                    InfraErrorIdentifier.RESULT_DIR_ERROR);
        }
        if (settings.isOverwrite()) {
            clearOldResults(resultsDir);
        }
        settings.serialize(resultsDir);
        jobList.serialize(resultsDir, settings.isOverwrite());
        return new ExecuteState(settings, jobList, 0);
    }

    /** Removes the files a previous batch left in {@code resultsDir}. */
    @VisibleForTesting
    static void clearOldResults(File resultsDir) {
        for (String name : TOP_LEVEL_FILES) {
            FileUtil.deleteFile(new File(resultsDir, name));
        }
        for (int i = 0; ; i++) {
            File jobDir = ResultsDir.jobDir(resultsDir, i);
            if (!jobDir.isDirectory()) {
                break;
            }
            for (OutputFile output : OutputFile.values()) {
                FileUtil.deleteFile(output.in(jobDir));
            }
            FileUtil.deleteFile(new File(jobDir, CommsListener.SOCKET_FILENAME));
            String[] remaining = jobDir.list();
            if (remaining != null && remaining.length > 0) {
                CLog.w("Results directory %s contains extra files, not removing it", jobDir);
                continue;
            }
            FileUtil.deleteFile(jobDir);
        }
    }

    /**
     * Runs the jobs of {@code state} from its next index on.
     *
     * @return false if the batch could not run or was aborted
     */
    public boolean execute(ExecuteState state) throws IOException {
        RunnerSettings settings = state.getSettings();
        File resultsDir = new File(settings.getResultsPath());
        File testRoot = new File(settings.getTestRoot());
        if (!testRoot.isDirectory()) {
            CLog.e("Test directory %s cannot be opened", testRoot);
            return false;
        }

        if (settings.isDryRun()) {
            JobList jobList = state.getJobList();
            for (int i = state.getNext(); i < jobList.size(); i++) {
                CLog.logAndDisplay(LogLevel.INFO, "%s", jobList.get(i));
            }
            return true;
        }

        FileUtil.writeToFile(readUname(), new File(resultsDir, ResultsDir.UNAME_FILENAME));
        File startTime = new File(resultsDir, ResultsDir.STARTTIME_FILENAME);
        if (!startTime.exists()) {
            writeTimestamp(startTime);
        }

        JobExecutor executor = mSupervisor.getExecutor();
        long deadline =
                settings.getOverallTimeout() > 0
                        ? System.nanoTime()
                                + TimeUnit.SECONDS.toNanos(settings.getOverallTimeout())
                        : Long.MAX_VALUE;
        ExecuteState current = state;
        try {
            while (!current.isDone()) {
                int index = current.getNext();
                JobList jobList = current.getJobList();
                JobListEntry entry = jobList.get(index);
                if (executor.isAbortRequested()) {
                    writeAborted(resultsDir, executor.getAbortReason(), entry);
                    return false;
                }
                if (System.nanoTime() - deadline > 0) {
                    CLog.logAndDisplay(
                            LogLevel.WARN, "Overall timeout time exceeded, stopping.");
                    break;
                }
                JobExecutor.Outcome outcome =
                        executor.execute(index, jobList.size(), entry, resultsDir);
                switch (outcome) {
                    case TIMEOUT:
                        CLog.i("%s timed out, resuming the batch", entry);
                        current = ResumeController.resume(resultsDir);
                        break;
                    case ABORTED:
                        writeAborted(resultsDir, executor.getAbortReason(), entry);
                        return false;
                    case SUCCESS:
                    default:
                        current.setNext(index + 1);
                        break;
                }
            }
            return true;
        } finally {
            mSupervisor.getWatchdogs().closeAll();
            writeTimestamp(new File(resultsDir, ResultsDir.ENDTIME_FILENAME));
        }
    }

    /** Writes {@code results.json} for the batch in {@code resultsDir}. */
    public File generateResults(File resultsDir) throws IOException {
        return new ResultGenerator(resultsDir, mSupervisor.getDmesgFilter()).writeResults();
    }

    private static void writeAborted(File resultsDir, String reason, JobListEntry entry)
            throws IOException {
        CLog.logAndDisplay(LogLevel.WARN, "Aborting the batch: %s", reason);
        FileUtil.writeToFile(
                String.format("%s\nTest being run: %s\n", reason, entry),
                new File(resultsDir, ResultsDir.ABORTED_FILENAME));
    }

    private static void writeTimestamp(File file) throws IOException {
        FileUtil.writeToFile(
                String.format(Locale.ROOT, "%.6f", System.currentTimeMillis() / 1000.0), file);
    }

    /** Returns {@code uname -a} of the host, or the OS properties of the JVM if it fails. */
    @VisibleForTesting
    static String readUname() {
        try {
            Process process =
                    new ProcessBuilder("uname", "-a").redirectErrorStream(true).start();
            byte[] output;
            try (InputStream stdout = process.getInputStream()) {
                output = ByteStreams.toByteArray(stdout);
            }
            if (process.waitFor() == 0 && output.length > 0) {
                return new String(output, StandardCharsets.UTF_8);
            }
            CLog.w("uname -a failed, using the JVM properties instead");
        } catch (IOException e) {
            CLog.w("Cannot run uname: %s", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CLog.w("Interrupted while running uname");
        }
        return String.format(
                "%s %s %s\n",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
    }
}
