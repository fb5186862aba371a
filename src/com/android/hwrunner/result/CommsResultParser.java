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

import com.android.hwrunner.comms.RunnerPacket;
import com.android.hwrunner.comms.RunnerPacket.ExecPacket;
import com.android.hwrunner.comms.RunnerPacket.ExitPacket;
import com.android.hwrunner.comms.RunnerPacket.LogPacket;
import com.android.hwrunner.comms.RunnerPacket.ResultOverridePacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestResultPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestStartPacket;
import com.android.hwrunner.comms.RunnerPacket.VersionStringPacket;
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.log.LogUtil.CLog;

import com.google.common.annotations.VisibleForTesting;

import java.util.List;

/**
 * Builds the result nodes of a job from the packets its test binary sent over the comms socket.
 *
 * <p>The packets are replayed through a state machine. Start and result lines are injected into
 * the collected stdout and stderr text so the captured output looks the same as when the binary
 * prints them itself. Packets that arrive out of turn never fail the parse: a warning line is
 * added to the stderr of the enclosing subtest instead.
 */
public class CommsResultParser {

    @VisibleForTesting
    enum State {
        INITIAL,
        AFTER_EXEC,
        SUBTEST_STARTED,
        DYNAMIC_SUBTEST_STARTED,
        BETWEEN_DYNAMIC_SUBTESTS,
        BETWEEN_SUBTESTS,
        EXITED
    }

    private final JobListEntry mEntry;
    private final String mBinary;
    private final SubtestList mSubtests;
    private final RunResults mResults;

    private State mState = State.INITIAL;

    private final StringBuilder mOut = new StringBuilder();
    private final StringBuilder mErr = new StringBuilder();
    private int mOutIdx = 0;
    private int mNextOutIdx = 0;
    private int mErrIdx = 0;
    private int mNextErrIdx = 0;
    private int mDynOutIdx = 0;
    private int mNextDynOutIdx = 0;
    private int mDynErrIdx = 0;
    private int mNextDynErrIdx = 0;

    private Subtest mSubtest = null;
    private TestResultNode mCurrentTest = null;
    private TestResultNode mCurrentDynamicTest = null;
    private String mCurrentSubtestName = null;
    private String mCurrentDynamicSubtestName = null;
    private TestStatus mSubtestResult = null;
    private TestStatus mDynamicSubtestResult = null;
    private String mIgtVersion = null;
    private boolean mTimedOut = false;

    public CommsResultParser(JobListEntry entry, SubtestList subtests, RunResults results) {
        mEntry = entry;
        mBinary = entry.getBinary();
        mSubtests = subtests;
        mResults = results;
    }

    /** Replays all packets and finalizes whatever is still open at the end. */
    public void parse(List<RunnerPacket> packets) {
        for (RunnerPacket packet : packets) {
            handle(packet);
        }
        if (mCurrentDynamicTest != null) {
            finishDynamicSubtest();
        }
        if (mCurrentTest != null) {
            finishSubtest();
        }
    }

    @VisibleForTesting
    State getState() {
        return mState;
    }

    private void handle(RunnerPacket packet) {
        switch (packet.getType()) {
            case LOG:
                handleLog((LogPacket) packet);
                break;
            case EXEC:
                handleExec((ExecPacket) packet);
                break;
            case EXIT:
                handleExit((ExitPacket) packet);
                break;
            case SUBTEST_START:
                handleSubtestStart((SubtestStartPacket) packet);
                break;
            case SUBTEST_RESULT:
                handleSubtestResult((SubtestResultPacket) packet);
                break;
            case DYNAMIC_SUBTEST_START:
                handleDynamicSubtestStart((SubtestStartPacket) packet);
                break;
            case DYNAMIC_SUBTEST_RESULT:
                handleDynamicSubtestResult((SubtestResultPacket) packet);
                break;
            case VERSIONSTRING:
                mIgtVersion = ((VersionStringPacket) packet).getText();
                break;
            case RESULT_OVERRIDE:
                handleResultOverride((ResultOverridePacket) packet);
                break;
            case INVALID:
            default:
                CLog.w("Ignoring comms packet of type %s", packet.getType());
                break;
        }
    }

    private void handleLog(LogPacket packet) {
        if (packet.getStream() == RunnerPacket.STREAM_STDOUT) {
            mOut.append(packet.getText());
        } else {
            mErr.append(packet.getText());
        }
    }

    private void handleExec(ExecPacket packet) {
        switch (mState) {
            case INITIAL:
                break;
            case AFTER_EXEC:
                // Resumes only happen for tests with subtests, the logs have no owner.
                CLog.w(
                        "Need to discard %d bytes of logs, no subtest data",
                        mOut.length() + mErr.length());
                mOut.setLength(0);
                mErr.setLength(0);
                mOutIdx = mErrIdx = mNextOutIdx = mNextErrIdx = 0;
                mDynOutIdx = mDynErrIdx = mNextDynOutIdx = mNextDynErrIdx = 0;
                break;
            default:
                // A resumed execution: close what the previous one left open.
                if (mCurrentDynamicTest != null) {
                    finishDynamicSubtest();
                }
                if (mCurrentTest != null) {
                    finishSubtest();
                }
                break;
        }
        CLog.d("Execution of %s", packet.getCmdline());
        mTimedOut = false;
        mState = State.AFTER_EXEC;
    }

    private void handleExit(ExitPacket packet) {
        int exitCode = packet.getExitCode();
        double time = JournalParser.parseLeadingDouble(packet.getTimeUsed());
        if (mState == State.AFTER_EXEC || mState == State.INITIAL) {
            String subtestName = null;
            if (mEntry.hasSubtests()) {
                subtestName = mEntry.getSubtests().get(0);
                mSubtests.add(subtestName);
            }
            mCurrentTest = mResults.getOrCreateTest(TestNames.of(mBinary, subtestName));
            if (subtestName == null) {
                mCurrentTest.addRuntime(time);
            }
            // An override that arrived before the exit wins over the exit code.
            if (mSubtestResult == null) {
                mSubtestResult = TestStatus.fromExitCode(exitCode);
            }
        } else if (exitCode == ExitCodes.ABORT || exitCode == ExitCodes.GRACEFUL) {
            TestStatus result = exitCode == ExitCodes.ABORT ? TestStatus.ABORT : TestStatus.NOTRUN;
            mSubtestResult = result;
            mDynamicSubtestResult = result;
        } else if (mTimedOut && mCurrentTest != null) {
            // The subtest that was killed ran for the whole execution, as in the journal.
            mCurrentTest.setRuntime(time);
        }
        mResults.addRuntime(TestNames.of(mBinary, null), time);
        mState = State.EXITED;
    }

    private void handleSubtestStart(SubtestStartPacket packet) {
        String name = packet.getName();
        switch (mState) {
            case EXITED:
                CLog.w("Unexpected start of subtest %s, binary is not running", name);
                return;
            case INITIAL:
                CLog.w("Subtest %s started before the execution was recorded", name);
                break;
            case SUBTEST_STARTED:
            case DYNAMIC_SUBTEST_STARTED:
            case BETWEEN_DYNAMIC_SUBTESTS:
                mErr.append(
                        String.format(
                                "\nrunner: Subtest %s already running when subtest %s starts."
                                        + " This is a test bug.\n",
                                mCurrentSubtestName, name));
                if (mCurrentDynamicTest != null) {
                    finishDynamicSubtest();
                }
                finishSubtest();
                break;
            case BETWEEN_SUBTESTS:
                if (mCurrentDynamicTest != null) {
                    finishDynamicSubtest();
                }
                finishSubtest();
                break;
            case AFTER_EXEC:
            default:
                break;
        }
        addNewSubtest(name);
        injectStartLine(OutputStrings.STARTING_SUBTEST, name);
        mState = State.SUBTEST_STARTED;
    }

    private void handleSubtestResult(SubtestResultPacket packet) {
        String name = packet.getName();
        switch (mState) {
            case EXITED:
                CLog.w("Unexpected result of subtest %s, binary is not running", name);
                return;
            case DYNAMIC_SUBTEST_STARTED:
                mErr.append(
                        String.format(
                                "\nrunner: Dynamic subtest %s still running when subtest %s"
                                        + " ended. This is a test bug.\n",
                                mCurrentDynamicSubtestName, name));
                finishDynamicSubtest();
                break;
            case BETWEEN_SUBTESTS:
                // Result without a start while a previous subtest still collects output.
                finishSubtest();
                addNewSubtest(name);
                break;
            case INITIAL:
                CLog.w("Result of subtest %s before the execution was recorded", name);
                addNewSubtest(name);
                break;
            case AFTER_EXEC:
                // Result without a start comes from a fixture.
                addNewSubtest(name);
                break;
            case SUBTEST_STARTED:
            case BETWEEN_DYNAMIC_SUBTESTS:
            default:
                break;
        }

        injectResultLine(OutputStrings.SUBTEST_RESULT, packet);
        mNextOutIdx = mOut.length();
        mNextErrIdx = mErr.length();

        // An existing result came from an override and wins.
        if (mSubtestResult == null) {
            mSubtestResult = TextOutputParser.parseResultString(packet.getResult()).mStatus;
        }
        mCurrentTest.setRuntime(JournalParser.parseLeadingDouble(packet.getTimeUsed()));
        mState = State.BETWEEN_SUBTESTS;
    }

    private void handleDynamicSubtestStart(SubtestStartPacket packet) {
        String name = packet.getName();
        switch (mState) {
            case INITIAL:
            case EXITED:
                CLog.w("Unexpected start of dynamic subtest %s, binary is not running", name);
                return;
            case AFTER_EXEC:
                CLog.w("Unexpected start of dynamic subtest %s, no subtest is running", name);
                return;
            case BETWEEN_SUBTESTS:
                mErr.append(
                        String.format(
                                "\nrunner: Dynamic subtest %s started when not inside a subtest."
                                        + " This is a test bug.\n",
                                name));
                return;
            case DYNAMIC_SUBTEST_STARTED:
                mErr.append(
                        String.format(
                                "\nrunner: Dynamic subtest %s already running when dynamic"
                                        + " subtest %s starts. This is a test bug.\n",
                                mCurrentDynamicSubtestName, name));
                finishDynamicSubtest();
                break;
            case BETWEEN_DYNAMIC_SUBTESTS:
                finishDynamicSubtest();
                break;
            case SUBTEST_STARTED:
            default:
                break;
        }
        addNewDynamicSubtest(name);
        injectStartLine(OutputStrings.STARTING_DYNAMIC_SUBTEST, name);
        mState = State.DYNAMIC_SUBTEST_STARTED;
    }

    private void handleDynamicSubtestResult(SubtestResultPacket packet) {
        String name = packet.getName();
        switch (mState) {
            case INITIAL:
            case EXITED:
                CLog.w("Unexpected result of dynamic subtest %s, binary is not running", name);
                return;
            case AFTER_EXEC:
                CLog.w("Unexpected result of dynamic subtest %s, no subtest is running", name);
                return;
            case BETWEEN_SUBTESTS:
                mErr.append(
                        String.format(
                                "\nrunner: Dynamic subtest %s result when not inside a subtest."
                                        + " This is a test bug.\n",
                                name));
                return;
            case BETWEEN_DYNAMIC_SUBTESTS:
                finishDynamicSubtest();
                addNewDynamicSubtest(name);
                break;
            case SUBTEST_STARTED:
                addNewDynamicSubtest(name);
                break;
            case DYNAMIC_SUBTEST_STARTED:
            default:
                break;
        }

        injectResultLine(OutputStrings.DYNAMIC_SUBTEST_RESULT, packet);
        mNextDynOutIdx = mOut.length();
        mNextDynErrIdx = mErr.length();

        if (mDynamicSubtestResult == null) {
            mDynamicSubtestResult = TextOutputParser.parseResultString(packet.getResult()).mStatus;
        }
        mCurrentDynamicTest.setRuntime(JournalParser.parseLeadingDouble(packet.getTimeUsed()));
        mState = State.BETWEEN_DYNAMIC_SUBTESTS;
    }

    private void handleResultOverride(ResultOverridePacket packet) {
        TestStatus result = TestStatus.fromNameOrIncomplete(packet.getResult());
        mTimedOut |= result == TestStatus.TIMEOUT;
        if (mCurrentDynamicTest != null) {
            mDynamicSubtestResult = result;
        }
        mSubtestResult = result;
    }

    private void addNewSubtest(String name) {
        mSubtest = mSubtests.add(name);
        mCurrentTest = mResults.getOrCreateTest(TestNames.of(mBinary, name));
        mCurrentSubtestName = name;
        // Dynamic subtests partition the output of their parent.
        mDynOutIdx = mNextDynOutIdx = mOutIdx;
        mDynErrIdx = mNextDynErrIdx = mErrIdx;
    }

    private void addNewDynamicSubtest(String name) {
        mSubtest.addDynamicSubtest(name);
        mCurrentDynamicTest =
                mResults.getOrCreateTest(
                        TestNames.dynamic(TestNames.of(mBinary, mCurrentSubtestName), name));
        mCurrentDynamicSubtestName = name;
    }

    private void finishSubtest() {
        mCurrentTest.setOut(mOut.substring(mOutIdx));
        mCurrentTest.setErr(mErr.substring(mErrIdx));
        mCurrentTest.setIgtVersion(mIgtVersion);
        if (mSubtestResult == null) {
            mCurrentTest.setResult(TestStatus.INCOMPLETE);
            // Same as a subtest without a result line in the text output.
            if (mCurrentTest.getRuntime() == null) {
                mCurrentTest.setRuntime(0.0);
            }
        } else {
            mCurrentTest.setResult(mSubtestResult);
        }

        mSubtestResult = null;
        mCurrentTest = null;
        mOutIdx = mNextOutIdx;
        mErrIdx = mNextErrIdx;
    }

    private void finishDynamicSubtest() {
        mCurrentDynamicTest.setOut(mOut.substring(mDynOutIdx));
        mCurrentDynamicTest.setErr(mErr.substring(mDynErrIdx));
        mCurrentDynamicTest.setIgtVersion(mIgtVersion);
        mCurrentDynamicTest.setResult(
                mDynamicSubtestResult == null ? TestStatus.INCOMPLETE : mDynamicSubtestResult);
        if (mCurrentDynamicTest.getRuntime() == null) {
            mCurrentDynamicTest.setRuntime(0.0);
        }

        mDynamicSubtestResult = null;
        mCurrentDynamicTest = null;
        mDynOutIdx = mNextDynOutIdx;
        mDynErrIdx = mNextDynErrIdx;
    }

    private void injectStartLine(String prefix, String name) {
        String line = prefix + name + "\n";
        mOut.append(line);
        mErr.append(line);
    }

    private void injectResultLine(String prefix, SubtestResultPacket packet) {
        String line =
                String.format(
                        "%s%s: %s (%ss)\n",
                        prefix, packet.getName(), packet.getResult(), packet.getTimeUsed());
        mOut.append(line);
        mErr.append(line);
    }
}
