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
package com.android.hwrunner.command;

import com.android.hwrunner.config.JobList;
import com.android.hwrunner.config.PruneMode;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.config.RunnerSettings.Verbosity;
import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.executor.BatchRunner;
import com.android.hwrunner.executor.ExecuteState;
import com.android.hwrunner.executor.ResumeController;
import com.android.hwrunner.executor.Supervisor;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.log.LogUtil.LogLevel;
import com.android.hwrunner.result.ResultGenerator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point.
 *
 * <pre>
 * hwrunner run [options] &lt;test-root&gt; &lt;results-dir&gt;
 * hwrunner resume &lt;results-dir&gt;
 * hwrunner results &lt;results-dir&gt;
 * </pre>
 */
public class RunnerMain {

    /** Process exit codes of the runner. */
    public enum ExitCode {
        SUCCESS(0),
        FAILURE(1),
        USAGE(2);

        private final int mCode;

        ExitCode(int code) {
            mCode = code;
        }

        public int code() {
            return mCode;
        }
    }

    /** Name of the job list looked up in the test root when none is given. */
    @VisibleForTesting static final String DEFAULT_TEST_LIST = "test-list.txt";

    private static final String USAGE =
            Joiner.on('\n')
                    .join(
                            "Usage:",
                            "  hwrunner run [options] <test-root> <results-dir>",
                            "  hwrunner resume <results-dir>",
                            "  hwrunner results <results-dir>",
                            "Options for run:",
                            "  -n, --name NAME             name of the test run",
                            "  -t, --test-list FILE        job list (default:"
                                    + " <test-root>/"
                                    + DEFAULT_TEST_LIST
                                    + ")",
                            "  -d, --dry-run               print the jobs without running them",
                            "  -s, --sync                  fsync every output write",
                            "  -l, --log-level LEVEL       quiet, normal or verbose",
                            "  -o, --overwrite             replace existing results",
                            "  -m, --multiple-mode         run all subtests of a binary in one"
                                    + " job",
                            "  -c, --inactivity-timeout S  kill a test after S silent seconds",
                            "  --overall-timeout S         start no job after S seconds",
                            "  --use-watchdog              feed the hardware watchdogs",
                            "  --piglit-style-dmesg        warn only on known graphics lines",
                            "  --dmesg-warn-level N        kernel log level counted as warning",
                            "  --prune-mode MODE           keep-dynamic, keep-subtests, keep-all"
                                    + " or keep-requested",
                            "  --socket-comms              receive structured events over a"
                                    + " socket");

    /** Bad command line. */
    @VisibleForTesting
    static class UsageException extends Exception {
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }

    public static void main(String[] args) {
        System.exit(new RunnerMain().run(args).code());
    }

    /** Runs a command and returns the exit code of the process. */
    public ExitCode run(String... args) {
        try {
            if (args.length == 0) {
                throw new UsageException("No command given");
            }
            List<String> rest = Arrays.asList(args).subList(1, args.length);
            switch (args[0]) {
                case "run":
                    return runBatch(rest);
                case "resume":
                    return resumeBatch(singleDirectory(rest));
                case "results":
                    File written = new ResultGenerator(singleDirectory(rest)).writeResults();
                    CLog.logAndDisplay(LogLevel.INFO, "Results written to %s", written);
                    return ExitCode.SUCCESS;
                default:
                    throw new UsageException("Unknown command: " + args[0]);
            }
        } catch (UsageException e) {
            CLog.logAndDisplay(LogLevel.ERROR, "%s\n%s", e.getMessage(), USAGE);
            return ExitCode.USAGE;
        } catch (HarnessRuntimeException e) {
            CLog.logAndDisplay(LogLevel.ERROR, "%s", e);
            return ExitCode.FAILURE;
        } catch (IOException e) {
            CLog.e(e);
            return ExitCode.FAILURE;
        }
    }

    private ExitCode runBatch(List<String> args) throws UsageException, IOException {
        List<String> positional = new ArrayList<>();
        RunnerSettings settings = new RunnerSettings();
        String testList = parseRunOptions(args, settings, positional);
        if (positional.size() != 2) {
            throw new UsageException("run needs a test root and a results directory");
        }
        File testRoot = new File(positional.get(0)).getAbsoluteFile();
        File resultsDir = new File(positional.get(1)).getAbsoluteFile();
        settings.setTestRoot(testRoot.getPath());
        settings.setResultsPath(resultsDir.getPath());

        File listFile =
                testList != null ? new File(testList) : new File(testRoot, DEFAULT_TEST_LIST);
        if (!listFile.isFile()) {
            CLog.logAndDisplay(LogLevel.ERROR, "Job list %s not found", listFile);
            return ExitCode.FAILURE;
        }
        JobList jobList = JobList.parse(listFile);
        if (jobList.size() == 0) {
            CLog.logAndDisplay(LogLevel.ERROR, "Job list %s is empty", listFile);
            return ExitCode.FAILURE;
        }

        ExecuteState state = BatchRunner.initialize(settings, jobList);
        return executeAndReport(state, resultsDir);
    }

    private ExitCode resumeBatch(File resultsDir) throws IOException {
        ExecuteState state = ResumeController.resume(resultsDir);
        return executeAndReport(state, resultsDir);
    }

    private ExitCode executeAndReport(ExecuteState state, File resultsDir) throws IOException {
        Supervisor supervisor = new Supervisor(state.getSettings());
        BatchRunner runner = new BatchRunner(supervisor);
        boolean completed;
        try (supervisor) {
            supervisor.open();
            completed = runner.execute(state);
        }
        if (state.getSettings().isDryRun()) {
            return completed ? ExitCode.SUCCESS : ExitCode.FAILURE;
        }
        File written = runner.generateResults(resultsDir);
        CLog.logAndDisplay(LogLevel.INFO, "Results written to %s", written);
        return completed ? ExitCode.SUCCESS : ExitCode.FAILURE;
    }

    /**
     * Applies the options of {@code run} to {@code settings}, collecting the other arguments in
     * {@code positional}.
     *
     * @return the job list file given with {@code --test-list}, or null
     */
    @VisibleForTesting
    static String parseRunOptions(
            List<String> args, RunnerSettings settings, List<String> positional)
            throws UsageException {
        String testList = null;
        Iterator<String> it = args.iterator();
        while (it.hasNext()) {
            String arg = it.next();
            switch (arg) {
                case "-n":
                case "--name":
                    settings.setName(value(arg, it));
                    break;
                case "-t":
                case "--test-list":
                    testList = value(arg, it);
                    break;
                case "-d":
                case "--dry-run":
                    settings.setDryRun(true);
                    break;
                case "-s":
                case "--sync":
                    settings.setSync(true);
                    break;
                case "-l":
                case "--log-level":
                    String level = value(arg, it);
                    try {
                        settings.setLogLevel(Verbosity.valueOf(level.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException("Unknown log level: " + level);
                    }
                    break;
                case "-o":
                case "--overwrite":
                    settings.setOverwrite(true);
                    break;
                case "-m":
                case "--multiple-mode":
                    settings.setMultipleMode(true);
                    break;
                case "-c":
                case "--inactivity-timeout":
                    settings.setInactivityTimeout(intValue(arg, it));
                    break;
                case "--overall-timeout":
                    settings.setOverallTimeout(intValue(arg, it));
                    break;
                case "--use-watchdog":
                    settings.setUseWatchdog(true);
                    break;
                case "--piglit-style-dmesg":
                    settings.setPiglitStyleDmesg(true);
                    break;
                case "--dmesg-warn-level":
                    settings.setDmesgWarnLevel(intValue(arg, it));
                    break;
                case "--prune-mode":
                    String mode = value(arg, it);
                    try {
                        settings.setPruneMode(PruneMode.fromName(mode));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                    break;
                case "--socket-comms":
                    settings.setSocketComms(true);
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                    break;
            }
        }
        return testList;
    }

    private static File singleDirectory(List<String> args) throws UsageException {
        if (args.size() != 1) {
            throw new UsageException("Expected exactly one results directory");
        }
        return new File(args.get(0)).getAbsoluteFile();
    }

    private static String value(String option, Iterator<String> it) throws UsageException {
        if (!it.hasNext()) {
            throw new UsageException("Missing value for " + option);
        }
        return it.next();
    }

    private static int intValue(String option, Iterator<String> it) throws UsageException {
        String value = value(option, it);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                throw new UsageException(option + " must not be negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException("Not a number for " + option + ": " + value);
        }
    }
}
