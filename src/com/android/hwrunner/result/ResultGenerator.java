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

import com.android.hwrunner.comms.CommsDump;
import com.android.hwrunner.config.JobList;
import com.android.hwrunner.config.JobListEntry;
import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.config.PruneMode;
import com.android.hwrunner.config.ResultsDir;
import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.dmesg.DmesgFilter;
import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.error.InfraErrorIdentifier;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a results directory into the results document: parses every job directory, synthesizes
 * results for jobs that never ran, and writes {@code results.json}.
 */
public class ResultGenerator {

    @VisibleForTesting static final String TESTRUN_RESULT_TYPE = "TestrunResult";
    @VisibleForTesting static final int RESULTS_VERSION = 10;

    /** Binary name of the synthetic test recording an aborted batch. */
    public static final String RUNNER_BINARY = "runner";

    private static final String ABORTED_SUBTEST = "aborted";

    private final File mResultsDir;
    private final DmesgFilter mDmesgFilter;

    /** Creates a generator whose dmesg classification follows the stored settings. */
    public ResultGenerator(File resultsDir) {
        this(resultsDir, null);
    }

    /** Creates a generator using an already compiled dmesg filter. */
    public ResultGenerator(File resultsDir, DmesgFilter dmesgFilter) {
        mResultsDir = resultsDir;
        mDmesgFilter = dmesgFilter;
    }

    /**
     * Generates the document and writes it to {@code results.json}.
     *
     * @return the written file
     */
    public File writeResults() throws IOException {
        JSONObject document = generate();
        File resultsFile = new File(mResultsDir, ResultsDir.RESULTS_FILENAME);
        FileUtil.writeToFile(document.toString(4), resultsFile);
        CLog.i("Results written to %s", resultsFile.getAbsolutePath());
        return resultsFile;
    }

    /** Builds the results document from the directory contents. */
    public JSONObject generate() throws IOException {
        if (!mResultsDir.isDirectory()) {
            throw new HarnessRuntimeException(
                    String.format("%s is not a directory", mResultsDir),
                    InfraErrorIdentifier.RESULT_DIR_ERROR);
        }
        RunnerSettings settings = RunnerSettings.deserialize(mResultsDir);
        JobList jobList = JobList.deserialize(mResultsDir);
        DmesgFilter filter =
                mDmesgFilter != null
                        ? mDmesgFilter
                        : new DmesgFilter(
                                settings.isPiglitStyleDmesg(), settings.getDmesgWarnLevel());

        JSONObject root = new JSONObject();
        root.put("__type__", TESTRUN_RESULT_TYPE);
        root.put("results_version", RESULTS_VERSION);
        root.put("name", settings.getName() == null ? "" : settings.getName());

        File uname = new File(mResultsDir, ResultsDir.UNAME_FILENAME);
        if (uname.exists()) {
            String text = FileUtil.readStringFromFile(uname);
            root.put("uname", text.endsWith("\n") ? text.substring(0, text.length() - 1) : text);
        }

        JSONObject elapsed = new JSONObject();
        elapsed.put("__type__", "TimeAttribute");
        readTimestamp(ResultsDir.STARTTIME_FILENAME, "start", elapsed);
        readTimestamp(ResultsDir.ENDTIME_FILENAME, "end", elapsed);
        root.put("time_elapsed", elapsed);

        RunResults results = new RunResults();
        DmesgParser dmesgParser = new DmesgParser(filter);
        for (int i = 0; i < jobList.size(); i++) {
            File jobDir = ResultsDir.jobDir(mResultsDir, i);
            if (!jobDir.isDirectory()) {
                addNotrunResults(jobList.get(i), settings, results);
                continue;
            }
            parseJobDirectory(jobDir, jobList.get(i), settings, dmesgParser, results);
        }

        File aborted = new File(mResultsDir, ResultsDir.ABORTED_FILENAME);
        if (aborted.exists()) {
            String name = TestNames.of(RUNNER_BINARY, ABORTED_SUBTEST);
            TestResultNode node = results.getOrCreateTest(name);
            node.setOut(FileUtil.readStringFromFile(aborted, StandardCharsets.ISO_8859_1));
            node.setErr("");
            node.setDmesg("", null);
            node.setResult(TestStatus.FAIL);
            results.addToTotals(RUNNER_BINARY, ImmutableList.of(name));
        }

        results.writeTo(root);
        return root;
    }

    /** Parses the output files of one job into {@code results}. */
    @VisibleForTesting
    void parseJobDirectory(
            File jobDir,
            JobListEntry entry,
            RunnerSettings settings,
            DmesgParser dmesgParser,
            RunResults results)
            throws IOException {
        String binary = entry.getBinary();
        SubtestList subtests = new SubtestList();

        CommsDump.ReadResult comms = CommsDump.read(OutputFile.COMMS.in(jobDir));
        if (comms.getStatus() == CommsDump.Status.SUCCESS) {
            new CommsResultParser(entry, subtests, results).parse(comms.getPackets());
        } else {
            if (comms.getStatus() == CommsDump.Status.ERROR) {
                CLog.w("Comms of %s are damaged, using the text output instead", jobDir);
            }
            JournalParser.parse(readOutput(jobDir, OutputFile.JOURNAL), entry, subtests, results);
            TextOutputParser textParser = new TextOutputParser(binary, results);
            textParser.parse(readOutput(jobDir, OutputFile.OUT), OutputKind.OUT, subtests);
            textParser.parse(readOutput(jobDir, OutputFile.ERR), OutputKind.ERR, subtests);
        }

        dmesgParser.parse(readOutput(jobDir, OutputFile.DMESG), binary, subtests, results);
        ResultOverrides.apply(binary, subtests, results);
        prune(settings.getPruneMode(), entry, subtests, results);
        results.addToTotals(binary, testNames(binary, subtests));
    }

    /** Removes the nodes the prune mode does not want in the document. */
    @VisibleForTesting
    static void prune(
            PruneMode mode, JobListEntry entry, SubtestList subtests, RunResults results) {
        if (mode == PruneMode.KEEP_ALL) {
            return;
        }
        for (Subtest subtest : subtests.getSubtests()) {
            String name = TestNames.of(entry.getBinary(), subtest.getName());
            if (mode == PruneMode.KEEP_DYNAMIC) {
                if (subtest.hasDynamicSubtests()) {
                    results.removeTest(name);
                }
                continue;
            }
            if (mode == PruneMode.KEEP_REQUESTED && !isRequested(entry, subtest.getName())) {
                results.removeTest(name);
            }
            for (String dynamic : subtest.getDynamicSubtests()) {
                if (mode == PruneMode.KEEP_SUBTESTS
                        || !isRequested(
                                entry, subtest.getName() + TestNames.SEPARATOR + dynamic)) {
                    results.removeTest(TestNames.dynamic(name, dynamic));
                }
            }
        }
    }

    private static boolean isRequested(JobListEntry entry, String name) {
        return entry.getSubtests().contains(name);
    }

    /** Synthesizes {@code notrun} nodes for a job whose directory does not exist. */
    @VisibleForTesting
    static void addNotrunResults(JobListEntry entry, RunnerSettings settings, RunResults results) {
        List<String> names = new ArrayList<>();
        if (!entry.hasSubtests()) {
            // Without a subtest list multiple mode cannot tell which subtests would have run.
            if (settings.isMultipleMode()) {
                return;
            }
            names.add(TestNames.of(entry.getBinary(), null));
        }
        for (String subtest : entry.getSubtests()) {
            names.add(TestNames.of(entry.getBinary(), subtest));
        }
        for (String name : names) {
            TestResultNode node = results.getOrCreateTest(name);
            node.setOut("");
            node.setErr("");
            node.setDmesg("", null);
            node.setResult(TestStatus.NOTRUN);
        }
        results.addToTotals(entry.getBinary(), names);
    }

    /** Names of the nodes counted in the totals, in document order. */
    private static List<String> testNames(String binary, SubtestList subtests) {
        List<String> names = new ArrayList<>();
        if (subtests.isEmpty()) {
            names.add(TestNames.of(binary, null));
            return names;
        }
        for (Subtest subtest : subtests.getSubtests()) {
            String name = TestNames.of(binary, subtest.getName());
            names.add(name);
            for (String dynamic : subtest.getDynamicSubtests()) {
                names.add(TestNames.dynamic(name, dynamic));
            }
        }
        return names;
    }

    private String readOutput(File jobDir, OutputFile output) throws IOException {
        File file = output.in(jobDir);
        if (!file.exists()) {
            throw new HarnessRuntimeException(
                    String.format("Missing %s in %s", output.getFileName(), jobDir),
                    InfraErrorIdentifier.RESULT_PARSE_FAILED);
        }
        return FileUtil.readStringFromFile(file, StandardCharsets.ISO_8859_1);
    }

    private void readTimestamp(String fileName, String key, JSONObject elapsed)
            throws IOException {
        File file = new File(mResultsDir, fileName);
        if (file.exists()) {
            elapsed.put(
                    key,
                    JournalParser.parseLeadingDouble(
                            FileUtil.readStringFromFile(file, StandardCharsets.ISO_8859_1)));
        }
    }
}
