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

import static com.google.common.truth.Truth.assertThat;

import com.android.hwrunner.comms.RunnerPacket;
import com.android.hwrunner.comms.RunnerPacket.ExecPacket;
import com.android.hwrunner.comms.RunnerPacket.ExitPacket;
import com.android.hwrunner.comms.RunnerPacket.LogPacket;
import com.android.hwrunner.comms.RunnerPacket.ResultOverridePacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestResultPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestStartPacket;
import com.android.hwrunner.comms.RunnerPacket.VersionStringPacket;
import com.android.hwrunner.config.JobListEntry;

import com.google.common.collect.ImmutableList;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.List;

/** Unit tests for {@link CommsResultParser}. */
@RunWith(JUnit4.class)
public class CommsResultParserTest {

    private SubtestList mSubtests;
    private RunResults mResults;

    @Before
    public void setUp() {
        mSubtests = new SubtestList();
        mResults = new RunResults();
    }

    private CommsResultParser parse(JobListEntry entry, List<RunnerPacket> packets) {
        CommsResultParser parser = new CommsResultParser(entry, mSubtests, mResults);
        parser.parse(packets);
        return parser;
    }

    private static RunnerPacket stdout(String text) {
        return new LogPacket(RunnerPacket.STREAM_STDOUT, text);
    }

    private static RunnerPacket stderr(String text) {
        return new LogPacket(RunnerPacket.STREAM_STDERR, text);
    }

    private static RunnerPacket start(String name) {
        return new SubtestStartPacket(name, false);
    }

    private static RunnerPacket result(String name, String result, String time) {
        return new SubtestResultPacket(name, result, time, "", false);
    }

    private static RunnerPacket dynamicStart(String name) {
        return new SubtestStartPacket(name, true);
    }

    private static RunnerPacket dynamicResult(String name, String result, String time) {
        return new SubtestResultPacket(name, result, time, "", true);
    }

    @Test
    public void testParse_twoSubtests() {
        CommsResultParser parser =
                parse(
                        new JobListEntry("kms_flip"),
                        ImmutableList.of(
                                new ExecPacket("/tests/kms_flip"),
                                new VersionStringPacket("IGT-Version: 1.28"),
                                start("A"),
                                stdout("foo\n"),
                                result("A", "SUCCESS", "0.500"),
                                start("B"),
                                stdout("bar\n"),
                                result("B", "FAIL", "1.000"),
                                new ExitPacket(98, "1.600")));

        assertThat(parser.getState()).isEqualTo(CommsResultParser.State.EXITED);
        TestResultNode a = mResults.getTest("kms_flip@A");
        assertThat(a.getResult()).isEqualTo(TestStatus.PASS);
        assertThat(a.getRuntime()).isWithin(1e-9).of(0.5);
        assertThat(a.getOut()).isEqualTo("Starting subtest: A\nfoo\nSubtest A: SUCCESS (0.500s)\n");
        assertThat(a.getErr()).isEqualTo("Starting subtest: A\nSubtest A: SUCCESS (0.500s)\n");
        assertThat(a.getIgtVersion()).isEqualTo("IGT-Version: 1.28");
        TestResultNode b = mResults.getTest("kms_flip@B");
        assertThat(b.getResult()).isEqualTo(TestStatus.FAIL);
        assertThat(b.getOut()).isEqualTo("Starting subtest: B\nbar\nSubtest B: FAIL (1.000s)\n");
        assertThat(mResults.getRuntime("kms_flip")).isWithin(1e-9).of(1.6);
        assertThat(mSubtests.size()).isEqualTo(2);
    }

    @Test
    public void testParse_sameIdsAsTextParsing() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("A"),
                        result("A", "SUCCESS", "0.500"),
                        start("B"),
                        result("B", "FAIL", "1.000"),
                        new ExitPacket(98, "1.600")));
        RunResults textResults = new RunResults();
        SubtestList textSubtests = new SubtestList();
        JournalParser.parse(
                "A\nB\nexit:98 (1.600s)\n",
                new JobListEntry("kms_flip"),
                textSubtests,
                textResults);
        new TextOutputParser("kms_flip", textResults)
                .parse(
                        "Starting subtest: A\nSubtest A: SUCCESS (0.500s)\n"
                                + "Starting subtest: B\nSubtest B: FAIL (1.000s)\n",
                        OutputKind.OUT,
                        textSubtests);

        assertThat(mResults.getTests().keySet())
                .containsExactlyElementsIn(textResults.getTests().keySet());
        for (String name : textResults.getTests().keySet()) {
            assertThat(mResults.getTest(name).getResult())
                    .isEqualTo(textResults.getTest(name).getResult());
        }
    }

    @Test
    public void testParse_timeoutOverride() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("A"),
                        stdout("spinning\n"),
                        new ResultOverridePacket("timeout"),
                        new ExitPacket(-15, "10.000")));

        TestResultNode node = mResults.getTest("kms_flip@A");
        assertThat(node.getResult()).isEqualTo(TestStatus.TIMEOUT);
        assertThat(node.getRuntime()).isWithin(1e-9).of(10.0);
        assertThat(mResults.getRuntime("kms_flip")).isWithin(1e-9).of(10.0);
    }

    @Test
    public void testParse_timeoutAfterResultTakesExitTime() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("A"),
                        result("A", "SUCCESS", "0.500"),
                        new ResultOverridePacket("timeout"),
                        new ExitPacket(-9, "12.000")));

        TestResultNode node = mResults.getTest("kms_flip@A");
        assertThat(node.getResult()).isEqualTo(TestStatus.TIMEOUT);
        assertThat(node.getRuntime()).isWithin(1e-9).of(12.0);
    }

    @Test
    public void testParse_abortExitMarksRunningSubtest() {
        parse(
                new JobListEntry("gem_exec"),
                ImmutableList.of(
                        new ExecPacket("/tests/gem_exec"),
                        start("A"),
                        new ExitPacket(112, "0.300")));

        assertThat(mResults.getTest("gem_exec@A").getResult()).isEqualTo(TestStatus.ABORT);
    }

    @Test
    public void testParse_subtestStartedTwice() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("A"),
                        start("B"),
                        result("B", "SUCCESS", "0.100"),
                        new ExitPacket(0, "0.200")));

        TestResultNode a = mResults.getTest("kms_flip@A");
        assertThat(a.getResult()).isEqualTo(TestStatus.INCOMPLETE);
        assertThat(a.getErr())
                .contains("runner: Subtest A already running when subtest B starts.");
        assertThat(mResults.getTest("kms_flip@B").getResult()).isEqualTo(TestStatus.PASS);
    }

    @Test
    public void testParse_exitWithoutSubtests() {
        parse(
                new JobListEntry("core_auth"),
                ImmutableList.of(
                        new ExecPacket("/tests/core_auth"),
                        stdout("hello\n"),
                        stderr("careful\n"),
                        new ExitPacket(0, "0.200")));

        TestResultNode node = mResults.getTest("core_auth");
        assertThat(node.getResult()).isEqualTo(TestStatus.PASS);
        assertThat(node.getOut()).isEqualTo("hello\n");
        assertThat(node.getErr()).isEqualTo("careful\n");
        assertThat(node.getRuntime()).isWithin(1e-9).of(0.2);
        assertThat(mSubtests.isEmpty()).isTrue();
    }

    @Test
    public void testParse_exitBeforeRequestedSubtest() {
        parse(
                new JobListEntry("kms_flip", ImmutableList.of("basic")),
                ImmutableList.of(new ExecPacket("/tests/kms_flip"), new ExitPacket(77, "0.010")));

        assertThat(mResults.getTest("kms_flip@basic").getResult()).isEqualTo(TestStatus.SKIP);
        assertThat(mSubtests.find("basic")).isNotNull();
    }

    @Test
    public void testParse_dynamicSubtests() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("flip"),
                        dynamicStart("pipe-A"),
                        stdout("a\n"),
                        dynamicResult("pipe-A", "SUCCESS", "0.100"),
                        dynamicStart("pipe-B"),
                        stdout("b\n"),
                        dynamicResult("pipe-B", "FAIL", "0.200"),
                        result("flip", "FAIL", "0.400"),
                        new ExitPacket(98, "0.500")));

        assertThat(mSubtests.find("flip").getDynamicSubtests())
                .containsExactly("pipe-A", "pipe-B")
                .inOrder();
        assertThat(mResults.getTest("kms_flip@flip").getResult()).isEqualTo(TestStatus.FAIL);
        TestResultNode pipeA = mResults.getTest("kms_flip@flip@pipe-A");
        assertThat(pipeA.getResult()).isEqualTo(TestStatus.PASS);
        assertThat(pipeA.getRuntime()).isWithin(1e-9).of(0.1);
        assertThat(pipeA.getOut()).contains("a\nDynamic subtest pipe-A: SUCCESS (0.100s)\n");
        assertThat(mResults.getTest("kms_flip@flip@pipe-B").getResult())
                .isEqualTo(TestStatus.FAIL);
    }

    @Test
    public void testParse_dynamicOutsideSubtestIsTestBug() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("A"),
                        result("A", "SUCCESS", "0.100"),
                        dynamicStart("stray"),
                        new ExitPacket(0, "0.200")));

        TestResultNode a = mResults.getTest("kms_flip@A");
        assertThat(a.getErr()).contains("Dynamic subtest stray started when not inside a subtest");
        assertThat(mResults.getTest("kms_flip@A@stray")).isNull();
    }

    @Test
    public void testParse_packetsAfterExitIgnored() {
        parse(
                new JobListEntry("kms_flip"),
                ImmutableList.of(
                        new ExecPacket("/tests/kms_flip"),
                        start("A"),
                        result("A", "SUCCESS", "0.100"),
                        new ExitPacket(0, "0.200"),
                        start("late")));

        assertThat(mResults.getTest("kms_flip@late")).isNull();
        assertThat(mSubtests.size()).isEqualTo(1);
    }
}
