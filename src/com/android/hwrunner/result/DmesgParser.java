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

import com.android.hwrunner.dmesg.DmesgFilter;
import com.android.hwrunner.dmesg.KmsgRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the kernel log captured for a job between its subtests, using the start markers the
 * test binary writes into the kernel log, and collects the warnings of each.
 */
public class DmesgParser {

    private final DmesgFilter mFilter;

    public DmesgParser(DmesgFilter filter) {
        mFilter = filter;
    }

    /** Fills {@code dmesg} and {@code dmesg-warnings} from the raw records of {@code kmsg}. */
    public void parse(String kmsg, String binary, SubtestList subtests, RunResults results) {
        StringBuilder dmesg = new StringBuilder();
        StringBuilder warnings = new StringBuilder();
        StringBuilder dynamicDmesg = new StringBuilder();
        StringBuilder dynamicWarnings = new StringBuilder();
        TestResultNode currentTest = null;
        TestResultNode currentDynamicTest = null;
        String currentName = null;

        for (String line : splitRecords(kmsg)) {
            KmsgRecord record = KmsgRecord.parse(line);
            if (record == null) {
                continue;
            }
            String formatted = record.format();
            String message = record.getMessage();

            String subtest = markedName(message, OutputStrings.STARTING_SUBTEST_DMESG);
            if (subtest != null) {
                if (currentTest != null) {
                    fileUp(currentTest, dmesg, warnings);
                    dmesg.setLength(0);
                    warnings.setLength(0);
                    if (currentDynamicTest != null) {
                        fileUp(currentDynamicTest, dynamicDmesg, dynamicWarnings);
                    }
                    dynamicDmesg.setLength(0);
                    dynamicWarnings.setLength(0);
                    currentDynamicTest = null;
                }
                currentName = TestNames.of(binary, subtest);
                currentTest = results.getOrCreateTest(currentName);
            }

            String dynamic =
                    currentTest == null
                            ? null
                            : markedName(message, OutputStrings.STARTING_DYNAMIC_SUBTEST_DMESG);
            if (dynamic != null) {
                if (currentDynamicTest != null) {
                    fileUp(currentDynamicTest, dynamicDmesg, dynamicWarnings);
                    dynamicDmesg.setLength(0);
                    dynamicWarnings.setLength(0);
                }
                currentDynamicTest =
                        results.getOrCreateTest(TestNames.dynamic(currentName, dynamic));
            }

            if (mFilter.isWarning(record)) {
                warnings.append(formatted);
                if (currentTest != null) {
                    dynamicWarnings.append(formatted);
                }
            }
            dmesg.append(formatted);
            dynamicDmesg.append(formatted);
        }

        if (currentTest != null) {
            fileUp(currentTest, dmesg, warnings);
            if (currentDynamicTest != null) {
                fileUp(currentDynamicTest, dynamicDmesg, dynamicWarnings);
            }
        } else if (subtests.isEmpty()) {
            fileUp(results.getOrCreateTest(TestNames.of(binary, null)), dmesg, warnings);
        } else {
            // No markers at all: every subtest sees the whole log, without warnings.
            for (Subtest sub : subtests.getSubtests()) {
                results.getOrCreateTest(TestNames.of(binary, sub.getName()))
                        .setDmesg(dmesg.toString(), null);
            }
        }

        addEmptyDmesgWhereMissing(binary, subtests, results);
    }

    private static void fileUp(TestResultNode node, StringBuilder dmesg, StringBuilder warnings) {
        node.setDmesg(dmesg.toString(), warnings.length() == 0 ? null : warnings.toString());
    }

    private static void addEmptyDmesgWhereMissing(
            String binary, SubtestList subtests, RunResults results) {
        for (Subtest sub : subtests.getSubtests()) {
            String name = TestNames.of(binary, sub.getName());
            TestResultNode node = results.getOrCreateTest(name);
            if (!node.hasDmesg()) {
                node.setDmesg("", null);
            }
            for (String dynamic : sub.getDynamicSubtests()) {
                TestResultNode dynamicNode =
                        results.getOrCreateTest(TestNames.dynamic(name, dynamic));
                if (!dynamicNode.hasDmesg()) {
                    dynamicNode.setDmesg("", null);
                }
            }
        }
    }

    /** The name following {@code marker} in a message, or null if the marker is absent. */
    private static String markedName(String message, String marker) {
        int at = message.indexOf(marker);
        if (at < 0) {
            return null;
        }
        return message.substring(at + marker.length()).stripTrailing();
    }

    /** Record lines, each keeping its newline. */
    private static List<String> splitRecords(String kmsg) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < kmsg.length()) {
            int end = kmsg.indexOf('\n', start);
            if (end < 0) {
                lines.add(kmsg.substring(start));
                break;
            }
            lines.add(kmsg.substring(start, end + 1));
            start = end + 1;
        }
        return lines;
    }
}
