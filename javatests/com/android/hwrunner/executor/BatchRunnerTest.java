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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.android.hwrunner.config.JobList;
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.config.ResultsDir;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.config.RunnerSettings.Verbosity;
import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.error.InfraErrorIdentifier;
import com.android.hwrunner.util.FileUtil;

import com.google.common.collect.ImmutableList;

import org.json.JSONObject;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.File;
import java.io.IOException;

/** Unit tests for {@link BatchRunner}. */
@RunWith(JUnit4.class)
public class BatchRunnerTest {

    @Rule public TemporaryFolder mFolder = new TemporaryFolder();

    private File mTestRoot;
    private File mResultsDir;
    private RunnerSettings mSettings;
    private Supervisor mSupervisor;
    private BatchRunner mRunner;

    @Before
    public void setUp() throws IOException {
        mTestRoot = mFolder.newFolder("tests");
        mResultsDir = new File(mFolder.getRoot(), "results");
        mSettings = new RunnerSettings();
        mSettings.setName("batch");
        mSettings.setTestRoot(mTestRoot.getAbsolutePath());
        mSettings.setResultsPath(mResultsDir.getAbsolutePath());
        mSettings.setLogLevel(Verbosity.QUIET);
        mSupervisor =
                new Supervisor(
                        mSettings,
                        new WatchdogManager(index -> null),
                        new KmsgMonitor(new File(mFolder.getRoot(), "no-kmsg"), () -> 0L));
        mRunner = new BatchRunner(mSupervisor);
    }

    @After
    public void tearDown() throws IOException {
        mSupervisor.close();
    }

    private void writeScript(String name, String body) throws IOException {
        File script = new File(mTestRoot, name);
        FileUtil.writeToFile("#!/bin/sh\n" + body, script);
        assertThat(script.setExecutable(true)).isTrue();
    }

    private static JobList jobs(JobListEntry... entries) {
        return new JobList(ImmutableList.copyOf(entries));
    }

    @Test
    public void testInitialize_writesMetadata() throws IOException {
        ExecuteState state = BatchRunner.initialize(mSettings, jobs(new JobListEntry("a")));

        assertThat(state.getNext()).isEqualTo(0);
        assertThat(RunnerSettings.deserialize(mResultsDir)).isEqualTo(mSettings);
        assertThat(JobList.deserialize(mResultsDir).get(0).getBinary()).isEqualTo("a");
    }

    @Test
    public void testInitialize_noResultsPath() {
        mSettings.setResultsPath(null);

        HarnessRuntimeException e =
                assertThrows(
                        HarnessRuntimeException.class,
                        () -> BatchRunner.initialize(mSettings, jobs(new JobListEntry("a"))));

        assertThat(e.getErrorId()).isEqualTo(InfraErrorIdentifier.INVALID_SETTINGS);
    }

    @Test
    public void testInitialize_existingResults() throws IOException {
        BatchRunner.initialize(mSettings, jobs(new JobListEntry("a")));

        assertThrows(
                HarnessRuntimeException.class,
                () -> BatchRunner.initialize(mSettings, jobs(new JobListEntry("b"))));

        mSettings.setOverwrite(true);
        BatchRunner.initialize(mSettings, jobs(new JobListEntry("b")));
        assertThat(JobList.deserialize(mResultsDir).get(0).getBinary()).isEqualTo("b");
    }

    @Test
    public void testClearOldResults() throws IOException {
        assertThat(mResultsDir.mkdirs()).isTrue();
        FileUtil.writeToFile("Linux\n", new File(mResultsDir, ResultsDir.UNAME_FILENAME));
        FileUtil.writeToFile("{}", new File(mResultsDir, ResultsDir.RESULTS_FILENAME));
        File clean = ResultsDir.jobDir(mResultsDir, 0);
        assertThat(clean.mkdirs()).isTrue();
        FileUtil.writeToFile("exit:0 (0.1s)\n", OutputFile.JOURNAL.in(clean));
        FileUtil.writeToFile("", OutputFile.OUT.in(clean));
        File dirty = ResultsDir.jobDir(mResultsDir, 1);
        assertThat(dirty.mkdirs()).isTrue();
        FileUtil.writeToFile("A\n", OutputFile.JOURNAL.in(dirty));
        FileUtil.writeToFile("keep", new File(dirty, "core.dump"));
        File unrelated = new File(mResultsDir, "notes.txt");
        FileUtil.writeToFile("mine", unrelated);

        BatchRunner.clearOldResults(mResultsDir);

        assertThat(new File(mResultsDir, ResultsDir.UNAME_FILENAME).exists()).isFalse();
        assertThat(new File(mResultsDir, ResultsDir.RESULTS_FILENAME).exists()).isFalse();
        assertThat(clean.exists()).isFalse();
        assertThat(dirty.exists()).isTrue();
        assertThat(OutputFile.JOURNAL.in(dirty).exists()).isFalse();
        assertThat(new File(dirty, "core.dump").exists()).isTrue();
        assertThat(unrelated.exists()).isTrue();
    }

    @Test
    public void testExecute_runsEveryJob() throws IOException {
        writeScript(
                "kms_flip",
                "echo 'Starting subtest: A'\necho 'Subtest A: SUCCESS (0.000s)'\nexit 0\n");
        writeScript("core_auth", "echo 'not supported here'\nexit 77\n");
        JobList jobList = jobs(new JobListEntry("kms_flip"), new JobListEntry("core_auth"));
        ExecuteState state = BatchRunner.initialize(mSettings, jobList);

        assertThat(mRunner.execute(state)).isTrue();
        File written = mRunner.generateResults(mResultsDir);

        assertThat(state.isDone()).isTrue();
        assertThat(new File(mResultsDir, ResultsDir.UNAME_FILENAME).length()).isGreaterThan(0L);
        assertThat(new File(mResultsDir, ResultsDir.STARTTIME_FILENAME).exists()).isTrue();
        assertThat(new File(mResultsDir, ResultsDir.ENDTIME_FILENAME).exists()).isTrue();
        assertThat(new File(mResultsDir, ResultsDir.ABORTED_FILENAME).exists()).isFalse();
        JSONObject tests =
                new JSONObject(FileUtil.readStringFromFile(written)).getJSONObject("tests");
        assertThat(tests.getJSONObject("kms_flip@A").getString("result")).isEqualTo("pass");
        assertThat(tests.getJSONObject("core_auth").getString("result")).isEqualTo("skip");
    }

    @Test
    public void testExecute_resumesAfterTimeout() throws IOException {
        mSettings.setInactivityTimeout(1);
        // On the retry only the subtests that were not started yet are requested.
        writeScript(
                "kms_hang",
                "if [ \"$2\" = '*,!A' ]; then\n"
                        + "  echo 'Starting subtest: B'\n"
                        + "  echo 'Subtest B: SUCCESS (0.000s)'\n"
                        + "  exit 0\n"
                        + "fi\n"
                        + "echo 'Starting subtest: A'\n"
                        + "exec sleep 30\n");
        ExecuteState state = BatchRunner.initialize(mSettings, jobs(new JobListEntry("kms_hang")));

        assertThat(mRunner.execute(state)).isTrue();

        String journal =
                FileUtil.readStringFromFile(
                        OutputFile.JOURNAL.in(ResultsDir.jobDir(mResultsDir, 0)));
        assertThat(journal).matches("A\ntimeout:-15 \\([0-9.]+s\\)\nB\nexit:0 \\([0-9.]+s\\)\n");
        JSONObject tests =
                new JSONObject(FileUtil.readStringFromFile(mRunner.generateResults(mResultsDir)))
                        .getJSONObject("tests");
        assertThat(tests.getJSONObject("kms_hang@A").getString("result")).isEqualTo("timeout");
        assertThat(tests.getJSONObject("kms_hang@B").getString("result")).isEqualTo("pass");
    }

    @Test
    public void testExecute_abortRequested() throws IOException {
        writeScript("kms_flip", "exit 0\n");
        ExecuteState state = BatchRunner.initialize(mSettings, jobs(new JobListEntry("kms_flip")));
        mSupervisor.getExecutor().requestAbort("Stopped by test");

        assertThat(mRunner.execute(state)).isFalse();

        String aborted =
                FileUtil.readStringFromFile(new File(mResultsDir, ResultsDir.ABORTED_FILENAME));
        assertThat(aborted).isEqualTo("Stopped by test\nTest being run: kms_flip\n");
        assertThat(new File(mResultsDir, ResultsDir.ENDTIME_FILENAME).exists()).isTrue();
    }

    @Test
    public void testExecute_dryRun() throws IOException {
        mSettings.setDryRun(true);
        ExecuteState state = BatchRunner.initialize(mSettings, jobs(new JobListEntry("kms_flip")));

        assertThat(mRunner.execute(state)).isTrue();

        assertThat(ResultsDir.jobDir(mResultsDir, 0).exists()).isFalse();
        assertThat(new File(mResultsDir, ResultsDir.STARTTIME_FILENAME).exists()).isFalse();
    }

    @Test
    public void testExecute_missingTestRoot() throws IOException {
        ExecuteState state = BatchRunner.initialize(mSettings, jobs(new JobListEntry("kms_flip")));
        FileUtil.deleteFile(mTestRoot);

        assertThat(mRunner.execute(state)).isFalse();
    }

    @Test
    public void testReadUname() {
        assertThat(BatchRunner.readUname()).isNotEmpty();
    }
}
