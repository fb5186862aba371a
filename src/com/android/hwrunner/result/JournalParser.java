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

import com.android.hwrunner.config.JobListEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a job journal: the subtests that were entered, in order, and the exit or timeout records
 * of every process that ran the job.
 */
public class JournalParser {

    private JournalParser() {}

    /**
     * Fills {@code subtests} from the journal text and records timeouts, runtimes and the results
     * that can only be derived from the exit code.
     */
    public static void parse(
            String journal, JobListEntry entry, SubtestList subtests, RunResults results) {
        String binaryName = TestNames.of(entry.getBinary(), null);
        int exitCode = ExitCodes.INCOMPLETE;
        boolean hasTimeout = false;

        for (String line : splitLines(journal)) {
            if (line.startsWith(OutputStrings.EXECUTOR_EXIT)) {
                exitCode = parseLeadingInt(line.substring(OutputStrings.EXECUTOR_EXIT.length()));
                double time = parseTime(line);
                results.addRuntime(binaryName, time);
                // Without subtests the test node itself gets the runtime.
                if (subtests.isEmpty() && !entry.hasSubtests()) {
                    results.getOrCreateTest(binaryName).addRuntime(time);
                }
            } else if (line.startsWith(OutputStrings.EXECUTOR_TIMEOUT)) {
                hasTimeout = true;
                if (!subtests.isEmpty()) {
                    double time = parseTime(line);
                    TestResultNode node =
                            results.getOrCreateTest(
                                    TestNames.of(entry.getBinary(), subtests.last().getName()));
                    node.setResult(TestStatus.TIMEOUT);
                    node.addRuntime(time);
                    results.addRuntime(binaryName, time);
                }
            } else if (!line.isEmpty()) {
                subtests.add(line);
            }
        }

        if (!subtests.isEmpty()
                && (exitCode == ExitCodes.ABORT || exitCode == ExitCodes.GRACEFUL)) {
            results.getOrCreateTest(TestNames.of(entry.getBinary(), subtests.last().getName()))
                    .setResult(
                            exitCode == ExitCodes.ABORT ? TestStatus.ABORT : TestStatus.NOTRUN);
        }

        if (subtests.isEmpty()) {
            TestStatus result = hasTimeout ? TestStatus.TIMEOUT : TestStatus.fromExitCode(exitCode);
            String subtestName = null;
            // Killed before the first subtest started: attribute to the expected subtest.
            if (entry.hasSubtests()) {
                subtestName = entry.getSubtests().get(0);
                subtests.add(subtestName);
            }
            results.getOrCreateTest(TestNames.of(entry.getBinary(), subtestName))
                    .setResult(result);
        }
    }

    /** Splits on newlines; a final line without newline is kept, a trailing empty one is not. */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                lines.add(text.substring(start));
                break;
            }
            lines.add(text.substring(start, end));
            start = end + 1;
        }
        return lines;
    }

    /** Parses the optional leading integer of a string, 0 if there is none. */
    static int parseLeadingInt(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        int start = i;
        if (i < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')) {
            i++;
        }
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
        }
        try {
            return Integer.parseInt(text.substring(start, i));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** Parses the {@code (<seconds>s)} part of a journal line, 0.0 when absent. */
    static double parseTime(String line) {
        int paren = line.indexOf('(');
        if (paren < 0) {
            return 0.0;
        }
        return parseLeadingDouble(line.substring(paren + 1));
    }

    /** Parses the longest leading decimal number of a string, 0.0 if there is none. */
    static double parseLeadingDouble(String text) {
        if (text == null) {
            return 0.0;
        }
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        int start = i;
        if (i < text.length() && (text.charAt(i) == '-' || text.charAt(i) == '+')) {
            i++;
        }
        while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
            i++;
        }
        try {
            return Double.parseDouble(text.substring(start, i));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
