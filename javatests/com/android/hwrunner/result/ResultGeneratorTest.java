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
import static org.junit.Assert.assertThrows;

import com.android.hwrunner.comms.CommsDump;
import com.android.hwrunner.comms.RunnerPacket;
import com.android.hwrunner.comms.RunnerPacket.ExecPacket;
import com.android.hwrunner.comms.RunnerPacket.ExitPacket;
import com.android.hwrunner.comms.RunnerPacket.LogPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestResultPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestStartPacket;
import com.android.hwrunner.config.JobList;
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.config.PruneMode;
import com.android.hwrunner.config.ResultsDir;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.error.InfraErrorIdentifier;
import com.android.hwrunner.util.FileUtil;

import com.google.common.collect.ImmutableList;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/** Unit tests for {@link ResultGenerator}. */
@RunWith(JUnit4.class)
public class ResultGeneratorTest {

    @Rule public TemporaryFolder mFolder = new TemporaryFolder();

    private File mResultsDir;
    private RunnerSettings mSettings;

    @Before
    public void setUp() throws IOException {
        mResultsDir = mFolder.newFolder("results");
        mSettings = new RunnerSettings();
        mSettings.setName("nightly");
        mSettings.setTestRoot("/opt/tests");
        mSettings.setResultsPath(mResultsDir.getAbsolutePath());
    }

    private void writeMetadata(JobList jobList) throws IOException {
        mSettings.serialize(mResultsDir);
        jobList.serialize(mResultsDir, false);
    }

    private File writeJob(int index, String journal, String out, String err, String dmesg)
            throws IOException {
        File jobDir = ResultsDir.jobDir(mResultsDir, index);
        assertThat(jobDir.mkdirs()).isTrue();
        FileUtil.writeToFile(journal, OutputFile.JOURNAL.in(jobDir));
        FileUtil.writeToFile(out, OutputFile.OUT.in(jobDir));
        FileUtil.writeToFile(err, OutputFile.ERR.in(jobDir));
        FileUtil.writeToFile(dmesg, OutputFile.DMESG.in(jobDir));
        return jobDir;
    }

    private static JSONObject test(JSONObject root, String name) {
        return root.getJSONObject("tests").getJSONObject(name);
    }

    private static int total(JSONObject root, String scope, String result) {
        return root.getJSONObject("totals").getJSONObject(scope).getInt(result);
    }

    @Test
    public void testGenerate_textOutputsAndNotrunJob() throws IOException {
        writeMetadata(
                new JobList(
                        ImmutableList.of(
                                new JobListEntry("kms_flip"),
                                new JobListEntry(
                                        "core_auth", ImmutableList.of("basic", "other")))));
        writeJob(
                0,
                "A\nB\nexit:98 (1.600s)\n",
                "Starting subtest: A\nfoo\nSubtest A: SUCCESS (0.500s)\n"
                        + "Starting subtest: B\nbar\nSubtest B: FAIL (1.000s)\n",
                "Starting subtest: A\nSubtest A: SUCCESS (0.500s)\n"
                        + "Starting subtest: B\nSubtest B: FAIL (1.000s)\n",
                "");
        FileUtil.writeToFile(
                "Linux host 6.1.0\n", new File(mResultsDir, ResultsDir.UNAME_FILENAME));
        FileUtil.writeToFile("100.000000", new File(mResultsDir, ResultsDir.STARTTIME_FILENAME));
        FileUtil.writeToFile("160.500000", new File(mResultsDir, ResultsDir.ENDTIME_FILENAME));

        JSONObject root = new ResultGenerator(mResultsDir).generate();

        assertThat(root.getString("__type__")).isEqualTo(ResultGenerator.TESTRUN_RESULT_TYPE);
        assertThat(root.getInt("results_version")).isEqualTo(ResultGenerator.RESULTS_VERSION);
        assertThat(root.getString("name")).isEqualTo("nightly");
        assertThat(root.getString("uname")).isEqualTo("Linux host 6.1.0");
        JSONObject elapsed = root.getJSONObject("time_elapsed");
        assertThat(elapsed.getDouble("start")).isWithin(1e-9).of(100.0);
        assertThat(elapsed.getDouble("end")).isWithin(1e-9).of(160.5);

        assertThat(test(root, "kms_flip@A").getString("result")).isEqualTo("pass");
        assertThat(test(root, "kms_flip@B").getString("result")).isEqualTo("fail");
        assertThat(test(root, "kms_flip@A").getString("dmesg")).isEmpty();
        assertThat(test(root, "core_auth@basic").getString("result")).isEqualTo("notrun");
        assertThat(test(root, "core_auth@other").getString("result")).isEqualTo("notrun");

        assertThat(total(root, RunResults.SCOPE_ALL, "pass")).isEqualTo(1);
        assertThat(total(root, RunResults.SCOPE_ALL, "fail")).isEqualTo(1);
        assertThat(total(root, RunResults.SCOPE_ALL, "notrun")).isEqualTo(2);
        assertThat(total(root, RunResults.SCOPE_ROOT, "notrun")).isEqualTo(2);
        assertThat(total(root, "kms_flip", "pass")).isEqualTo(1);
        assertThat(total(root, "core_auth", "pass")).isEqualTo(0);
        assertThat(
                        root.getJSONObject("runtimes")
                                .getJSONObject("kms_flip")
                                .getDouble("end"))
                .isWithin(1e-9)
                .of(1.6);
    }

    @Test
    public void testGenerate_multipleModeJobWithoutSubtestsNotListed() throws IOException {
        mSettings.setMultipleMode(true);
        writeMetadata(new JobList(ImmutableList.of(new JobListEntry("kms_flip"))));

        JSONObject root = new ResultGenerator(mResultsDir).generate();

        assertThat(root.getJSONObject("tests").length()).isEqualTo(0);
    }

    @Test
    public void testGenerate_abortedRun() throws IOException {
        writeMetadata(new JobList(ImmutableList.of(new JobListEntry("kms_flip"))));
        FileUtil.writeToFile(
                "Aborting.\nTest being run: kms_flip\n",
                new File(mResultsDir, ResultsDir.ABORTED_FILENAME));

        JSONObject root = new ResultGenerator(mResultsDir).generate();

        JSONObject aborted = test(root, "runner@aborted");
        assertThat(aborted.getString("result")).isEqualTo("fail");
        assertThat(aborted.getString("out")).contains("Test being run: kms_flip");
        assertThat(total(root, ResultGenerator.RUNNER_BINARY, "fail")).isEqualTo(1);
        assertThat(total(root, RunResults.SCOPE_ALL, "notrun")).isEqualTo(1);
    }

    @Test
    public void testGenerate_prefersComms() throws IOException {
        writeMetadata(new JobList(ImmutableList.of(new JobListEntry("kms_flip"))));
        // Text outputs would report nothing; only the packets carry the subtest.
        File jobDir = writeJob(0, "exit:0 (0.200s)\n", "", "", "");
        try (OutputStream out = new FileOutputStream(OutputFile.COMMS.in(jobDir))) {
            for (RunnerPacket packet :
                    ImmutableList.<RunnerPacket>of(
                            new ExecPacket("/opt/tests/kms_flip"),
                            new SubtestStartPacket("A", false),
                            new LogPacket(RunnerPacket.STREAM_STDOUT, "hello\n"),
                            new SubtestResultPacket("A", "SUCCESS", "0.100", "", false),
                            new ExitPacket(0, "0.200"))) {
                CommsDump.writePacket(out, packet);
            }
        }

        JSONObject root = new ResultGenerator(mResultsDir).generate();

        JSONObject a = test(root, "kms_flip@A");
        assertThat(a.getString("result")).isEqualTo("pass");
        assertThat(a.getString("out")).contains("hello\n");
        assertThat(root.getJSONObject("tests").has("kms_flip")).isFalse();
    }

    @Test
    public void testGenerate_missingOutputFile() throws IOException {
        writeMetadata(new JobList(ImmutableList.of(new JobListEntry("kms_flip"))));
        File jobDir = writeJob(0, "exit:0 (0.200s)\n", "", "", "");
        assertThat(OutputFile.OUT.in(jobDir).delete()).isTrue();

        HarnessRuntimeException e =
                assertThrows(
                        HarnessRuntimeException.class,
                        () -> new ResultGenerator(mResultsDir).generate());

        assertThat(e.getErrorId()).isEqualTo(InfraErrorIdentifier.RESULT_PARSE_FAILED);
    }

    @Test
    public void testGenerate_notADirectory() throws IOException {
        File file = mFolder.newFile("plain");

        assertThrows(HarnessRuntimeException.class, () -> new ResultGenerator(file).generate());
    }

    @Test
    public void testWriteResults_isRepeatable() throws IOException {
        writeMetadata(new JobList(ImmutableList.of(new JobListEntry("kms_flip"))));
        writeJob(0, "exit:0 (0.300s)\n", "all good\n", "", "");

        File first = new ResultGenerator(mResultsDir).writeResults();
        String firstText = FileUtil.readStringFromFile(first);
        File second = new ResultGenerator(mResultsDir).writeResults();

        assertThat(second).isEqualTo(first);
        assertThat(FileUtil.readStringFromFile(second)).isEqualTo(firstText);
        JSONObject root = new JSONObject(firstText);
        assertThat(test(root, "kms_flip").getString("result")).isEqualTo("pass");
        assertThat(test(root, "kms_flip").getJSONObject("time").getDouble("end"))
                .isWithin(1e-9)
                .of(0.3);
    }

    private static RunResults dynamicResults(SubtestList subtests) {
        subtests.add("flip").addDynamicSubtest("pipe-A");
        RunResults results = new RunResults();
        results.getOrCreateTest("kms_flip@flip").setResult(TestStatus.PASS);
        results.getOrCreateTest("kms_flip@flip@pipe-A").setResult(TestStatus.PASS);
        return results;
    }

    @Test
    public void testPrune_modes() {
        JobListEntry entry = new JobListEntry("kms_flip", ImmutableList.of("flip"));

        SubtestList subtests = new SubtestList();
        RunResults all = dynamicResults(subtests);
        ResultGenerator.prune(PruneMode.KEEP_ALL, entry, subtests, all);
        assertThat(all.getTests().keySet())
                .containsExactly("kms_flip@flip", "kms_flip@flip@pipe-A");

        subtests = new SubtestList();
        RunResults dynamic = dynamicResults(subtests);
        ResultGenerator.prune(PruneMode.KEEP_DYNAMIC, entry, subtests, dynamic);
        assertThat(dynamic.getTests().keySet()).containsExactly("kms_flip@flip@pipe-A");

        subtests = new SubtestList();
        RunResults subtestsOnly = dynamicResults(subtests);
        ResultGenerator.prune(PruneMode.KEEP_SUBTESTS, entry, subtests, subtestsOnly);
        assertThat(subtestsOnly.getTests().keySet()).containsExactly("kms_flip@flip");

        subtests = new SubtestList();
        RunResults requested = dynamicResults(subtests);
        ResultGenerator.prune(
                PruneMode.KEEP_REQUESTED,
                new JobListEntry("kms_flip", ImmutableList.of("flip@pipe-A")),
                subtests,
                requested);
        assertThat(requested.getTests().keySet()).containsExactly("kms_flip@flip@pipe-A");
    }
}
