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
import com.android.hwrunner.comms.CommsDump;
import com.android.hwrunner.comms.RunnerPacket;
import com.android.hwrunner.comms.RunnerPacket.ExecPacket;
import com.android.hwrunner.comms.RunnerPacket.ExitPacket;
import com.android.hwrunner.comms.RunnerPacket.ResultOverridePacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestResultPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestStartPacket;
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.config.ResultsDir;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.config.RunnerSettings.Verbosity;
import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.error.InfraErrorIdentifier;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.log.LogUtil.LogLevel;
import com.android.hwrunner.result.ExitCodes;
import com.android.hwrunner.result.OutputStrings;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs a single job: spawns the test binary, streams its output into the job directory and
 * keeps the journal up to date, enforces the inactivity timeout with escalating signals, and
 * keeps the hardware watchdogs fed while the job makes progress.
 */
public class JobExecutor {

    /** How a job ended. */
    public enum Outcome {
        /** The test binary exited on its own. */
        SUCCESS,
        /** The test binary was killed for inactivity. */
        TIMEOUT,
        /** The batch is being aborted. */
        ABORTED
    }

    /** Asks the test binary to print its subtest markers on stderr as well. */
    @VisibleForTesting static final String SENTINEL_ENV = "IGT_SENTINEL_ON_STDERR";

    @VisibleForTesting static final String TIMEOUT_OVERRIDE = "timeout";

    private static final int WATCHDOG_EXTRA_SECONDS = 10;
    private static final int KILL_WAIT_SECONDS = 2;
    private static final int KILL_WATCHDOG_SECONDS = 20;
    private static final long COMMS_DRAIN_MILLIS = 5000;

    private enum KillStage {
        NONE,
        TERM,
        KILL
    }

    private final RunnerSettings mSettings;
    private final WatchdogManager mWatchdogs;
    private final KmsgMonitor mKmsg;

    private volatile BlockingQueue<MonitorEvent> mCurrentQueue = null;
    private volatile String mAbortReason = null;

    public JobExecutor(RunnerSettings settings, WatchdogManager watchdogs, KmsgMonitor kmsg) {
        mSettings = settings;
        mWatchdogs = watchdogs;
        mKmsg = kmsg;
    }

    /**
     * Asks the running job, if any, to stop; jobs started afterwards are aborted right away.
     * Safe to call from any thread.
     */
    public void requestAbort(String reason) {
        mAbortReason = reason;
        BlockingQueue<MonitorEvent> queue = mCurrentQueue;
        if (queue != null) {
            queue.add(MonitorEvent.abort(reason));
        }
    }

    public boolean isAbortRequested() {
        return mAbortReason != null;
    }

    public String getAbortReason() {
        return mAbortReason;
    }

    /**
     * Runs the job with the given index and waits until it is over.
     *
     * @param index position of the job in the job list
     * @param total number of jobs in the job list
     * @throws FatalHostError if the job directory is unusable or the child cannot be killed
     */
    public Outcome execute(int index, int total, JobListEntry entry, File resultsDir)
            throws IOException {
        File jobDir = ResultsDir.jobDir(resultsDir, index);
        if (!jobDir.isDirectory() && !jobDir.mkdirs()) {
            throw new FatalHostError(
                    String.format("Error accessing individual test result directory %s", jobDir),
                    InfraErrorIdentifier.RESULT_DIR_ERROR);
        }
        JobOutputs outputs;
        try {
            outputs = new JobOutputs(jobDir, mSettings.isSocketComms(), mSettings.isSync());
        } catch (IOException e) {
            throw new FatalHostError(
                    String.format("Error creating output files in %s", jobDir),
                    e,
                    InfraErrorIdentifier.FAIL_TO_CREATE_FILE);
        }

        BlockingQueue<MonitorEvent> queue = new LinkedBlockingQueue<>();
        mCurrentQueue = queue;
        CommsListener comms = null;
        try {
            if (mAbortReason != null) {
                return Outcome.ABORTED;
            }
            printProgress(index, total, entry);

            List<String> command = buildCommand(entry);
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.environment().put(SENTINEL_ENV, "1");
            if (mSettings.isSocketComms()) {
                comms = new CommsListener(jobDir, packet -> queue.add(MonitorEvent.packet(packet)));
                comms.start();
                builder.environment()
                        .put(CommsListener.SOCKET_PATH_ENV, comms.getPath().toString());
                outputs.write(
                        OutputFile.COMMS,
                        CommsDump.encodeWithCanary(new ExecPacket(Joiner.on(' ').join(command))));
            }
            mKmsg.setSink(record -> queue.add(MonitorEvent.data(MonitorEvent.Type.KMSG, record)));

            Process process;
            try {
                process = builder.start();
            } catch (IOException e) {
                CLog.e("Cannot execute %s: %s", command.get(0), e.getMessage());
                recordSpawnFailure(outputs, command.get(0), e);
                return Outcome.SUCCESS;
            }
            process.getOutputStream().close();
            new StreamPump(
                            process.getInputStream(),
                            MonitorEvent.Type.STDOUT,
                            MonitorEvent.Type.STDOUT_CLOSED,
                            queue)
                    .start("stdout-" + index);
            new StreamPump(
                            process.getErrorStream(),
                            MonitorEvent.Type.STDERR,
                            MonitorEvent.Type.STDERR_CLOSED,
                            queue)
                    .start("stderr-" + index);
            process.onExit()
                    .thenRun(() -> queue.add(MonitorEvent.of(MonitorEvent.Type.CHILD_EXITED)));
            if (mAbortReason != null) {
                queue.add(MonitorEvent.abort(mAbortReason));
            }

            return monitor(process, queue, outputs, comms);
        } finally {
            mCurrentQueue = null;
            mKmsg.setSink(null);
            if (comms != null) {
                comms.close();
            }
            outputs.close();
        }
    }

    @VisibleForTesting
    List<String> buildCommand(JobListEntry entry) {
        List<String> command = new ArrayList<>();
        command.add(new File(mSettings.getTestRoot(), entry.getBinary()).getPath());
        if (entry.hasSubtests()) {
            command.add("--run-subtest");
            command.add(entry.joinedSubtests());
        }
        return command;
    }

    private void printProgress(int index, int total, JobListEntry entry) {
        if (mSettings.getLogLevel() == Verbosity.QUIET) {
            return;
        }
        int width = String.valueOf(total).length();
        String format = "[%0" + width + "d/%0" + width + "d] %s";
        String line = String.format(format, index + 1, total, entry.getBinary());
        if (entry.hasSubtests()) {
            line += " (" + Joiner.on(", ").join(entry.getSubtests()) + ")";
        }
        CLog.logAndDisplay(LogLevel.INFO, "%s", line);
    }

    /** Records a binary that could not be started as if it had exited with an invalid usage. */
    private void recordSpawnFailure(JobOutputs outputs, String binary, IOException cause)
            throws IOException {
        outputs.write(
                OutputFile.ERR,
                String.format("Cannot execute %s: %s\n", binary, cause.getMessage()));
        if (outputs.has(OutputFile.COMMS)) {
            outputs.write(
                    OutputFile.COMMS,
                    CommsDump.encodeWithCanary(new ExitPacket(ExitCodes.INVALID, formatTime(0))));
        }
        outputs.write(OutputFile.JOURNAL, journalExitLine(false, ExitCodes.INVALID, 0));
    }

    private Outcome monitor(
            Process process,
            BlockingQueue<MonitorEvent> queue,
            JobOutputs outputs,
            CommsListener comms)
            throws IOException {
        long start = System.nanoTime();
        int timeout = mSettings.getInactivityTimeout();
        int intervals = 1;
        if (timeout > 0) {
            int extra = WATCHDOG_EXTRA_SECONDS;
            int watchdogTimeout = mWatchdogs.setTimeout(timeout + extra);
            if (watchdogTimeout < timeout + extra) {
                // The watchdogs fire sooner than the inactivity timeout; wait in smaller steps.
                if (watchdogTimeout - extra <= 0) {
                    extra = watchdogTimeout / 2;
                }
                intervals = Math.max(1, timeout / Math.max(1, watchdogTimeout - extra));
                timeout /= intervals;
                CLog.i(
                        "Watchdog timeout is %ds, waiting %d intervals of %ds",
                        watchdogTimeout,
                        intervals,
                        timeout);
            }
        }
        int intervalsLeft = intervals;

        KillStage killed = KillStage.NONE;
        boolean aborting = false;
        boolean stdoutOpen = true;
        boolean stderrOpen = true;
        boolean childAlive = true;
        boolean subtestsFromComms = false;
        int status = ExitCodes.INCOMPLETE;
        double time = 0;
        SubtestTracker tracker = new SubtestTracker();

        try {
            while (stdoutOpen || stderrOpen || childAlive) {
                MonitorEvent event =
                        timeout == 0 ? queue.take() : queue.poll(timeout, TimeUnit.SECONDS);
                if (event == null) {
                    mWatchdogs.ping();
                    if (--intervalsLeft > 0) {
                        continue;
                    }
                    switch (killed) {
                        case NONE:
                            CLog.logAndDisplay(
                                    LogLevel.WARN,
                                    "Timeout. Killing the current test with SIGTERM.");
                            signal(process, false);
                            if (comms != null) {
                                outputs.write(
                                        OutputFile.COMMS,
                                        CommsDump.encodeWithCanary(
                                                new ResultOverridePacket(TIMEOUT_OVERRIDE)));
                            }
                            killed = KillStage.TERM;
                            timeout = KILL_WAIT_SECONDS;
                            mWatchdogs.setTimeout(KILL_WATCHDOG_SECONDS);
                            break;
                        case TERM:
                            CLog.logAndDisplay(
                                    LogLevel.WARN,
                                    "Timeout. Killing the current test with SIGKILL.");
                            signal(process, true);
                            killed = KillStage.KILL;
                            break;
                        case KILL:
                        default:
                            CLog.logAndDisplay(LogLevel.ERROR, "Child refuses to die. Aborting.");
                            mWatchdogs.closeAll();
                            throw new FatalHostError(
                                    String.format("Child %d refuses to die", process.pid()),
                                    InfraErrorIdentifier.CHILD_REFUSES_TO_DIE);
                    }
                    intervals = 1;
                    intervalsLeft = 1;
                    continue;
                }

                intervalsLeft = intervals;
                mWatchdogs.ping();
                switch (event.getType()) {
                    case STDOUT:
                        outputs.write(OutputFile.OUT, event.getData());
                        String journal =
                                tracker.feed(
                                        new String(event.getData(), StandardCharsets.ISO_8859_1));
                        if (!subtestsFromComms && !journal.isEmpty()) {
                            writeJournal(outputs, journal);
                        }
                        break;
                    case STDERR:
                        outputs.write(OutputFile.ERR, event.getData());
                        break;
                    case STDOUT_CLOSED:
                        stdoutOpen = false;
                        break;
                    case STDERR_CLOSED:
                        stderrOpen = false;
                        break;
                    case KMSG:
                        outputs.write(OutputFile.DMESG, event.getData());
                        break;
                    case COMMS:
                        subtestsFromComms |= onPacket(event.getPacket(), outputs, tracker);
                        break;
                    case CHILD_EXITED:
                        childAlive = false;
                        status = ExitCodes.normalize(process.exitValue());
                        time = Math.max(0, (System.nanoTime() - start) / 1e9);
                        break;
                    case ABORT:
                        if (!aborting) {
                            CLog.logAndDisplay(
                                    LogLevel.WARN,
                                    "Aborting: %s. Terminating the current test.",
                                    event.getReason());
                            aborting = true;
                            if (childAlive) {
                                signal(process, false);
                                killed = KillStage.TERM;
                                timeout = KILL_WAIT_SECONDS;
                                intervals = 1;
                                intervalsLeft = 1;
                            }
                        }
                        break;
                    default:
                        break;
                }
            }

            mKmsg.drain();
            if (comms != null) {
                comms.awaitDisconnect(COMMS_DRAIN_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal(process, true);
            throw new HarnessRuntimeException(
                    "Interrupted while monitoring " + process.pid(),
                    e,
                    InfraErrorIdentifier.INTERRUPTED);
        }

        mKmsg.setSink(null);
        MonitorEvent late;
        while ((late = queue.poll()) != null) {
            switch (late.getType()) {
                case KMSG:
                    outputs.write(OutputFile.DMESG, late.getData());
                    break;
                case COMMS:
                    onPacket(late.getPacket(), outputs, tracker);
                    break;
                default:
                    break;
            }
        }

        // Exit records go last, after every packet the child sent.
        if (comms != null) {
            outputs.write(
                    OutputFile.COMMS,
                    CommsDump.encodeWithCanary(new ExitPacket(status, formatTime(time))));
        }
        if (!aborting) {
            outputs.write(
                    OutputFile.JOURNAL, journalExitLine(killed != KillStage.NONE, status, time));
        }
        if (mSettings.isSync()) {
            outputs.sync();
        }

        if (aborting) {
            return Outcome.ABORTED;
        }
        return killed != KillStage.NONE ? Outcome.TIMEOUT : Outcome.SUCCESS;
    }

    /**
     * Stores a comms packet and keeps the journal in step with the subtests it reports.
     *
     * @return whether the packet reported a subtest
     */
    private boolean onPacket(RunnerPacket packet, JobOutputs outputs, SubtestTracker tracker)
            throws IOException {
        outputs.write(OutputFile.COMMS, CommsDump.encodeWithCanary(packet));
        switch (packet.getType()) {
            case SUBTEST_START:
                writeJournal(
                        outputs, tracker.onSubtestStart(((SubtestStartPacket) packet).getName()));
                return true;
            case SUBTEST_RESULT:
                writeJournal(
                        outputs, tracker.onSubtestResult(((SubtestResultPacket) packet).getName()));
                return true;
            case DYNAMIC_SUBTEST_START:
            case DYNAMIC_SUBTEST_RESULT:
                return true;
            default:
                break;
        }
        return false;
    }

    private void writeJournal(JobOutputs outputs, String journal) throws IOException {
        if (journal.isEmpty()) {
            return;
        }
        outputs.write(OutputFile.JOURNAL, journal);
        if (mSettings.getLogLevel() == Verbosity.VERBOSE) {
            CLog.logAndDisplay(LogLevel.INFO, "%s", journal.trim());
        }
    }

    /** Sends SIGTERM, or SIGKILL if {@code force}, to the child and everything it spawned. */
    private static void signal(Process process, boolean force) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        for (ProcessHandle handle : descendants) {
            if (force) {
                handle.destroyForcibly();
            } else {
                handle.destroy();
            }
        }
        if (force) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
    }

    @VisibleForTesting
    static String journalExitLine(boolean killed, int status, double time) {
        return String.format(
                Locale.ROOT,
                "%s%d (%ss)\n",
                killed ? OutputStrings.EXECUTOR_TIMEOUT : OutputStrings.EXECUTOR_EXIT,
                status,
                formatTime(time));
    }

    private static String formatTime(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }
}
