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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import java.util.List;

/**
 * Final adjustments of the result of each node once all logs are merged: stderr chatter turns a
 * pass into a warn, kernel warnings turn results into their dmesg variants, and a node without
 * any output at all becomes incomplete.
 */
public class ResultOverrides {

    @VisibleForTesting
    static final String NO_OUTPUT_MESSAGE =
            "This test didn't produce any output. The machine probably rebooted ungracefully.\n";

    private ResultOverrides() {}

    /** Applies the overrides to the binary node, or to every subtest and dynamic subtest. */
    public static void apply(String binary, SubtestList subtests, RunResults results) {
        if (subtests.isEmpty()) {
            overrideSingle(results.getOrCreateTest(TestNames.of(binary, null)));
            return;
        }
        for (Subtest subtest : subtests.getSubtests()) {
            String name = TestNames.of(binary, subtest.getName());
            overrideSingle(results.getOrCreateTest(name));
            for (String dynamic : subtest.getDynamicSubtests()) {
                overrideSingle(results.getOrCreateTest(TestNames.dynamic(name, dynamic)));
            }
        }
    }

    @VisibleForTesting
    static void overrideSingle(TestResultNode node) {
        TestStatus result = node.getResult();
        if (result == TestStatus.PASS && stderrContainsWarnings(node.getErr())) {
            result = TestStatus.WARN;
            node.setResult(result);
        }
        if (node.getDmesgWarnings() != null) {
            if (result == TestStatus.PASS || result == TestStatus.WARN) {
                node.setResult(TestStatus.DMESG_WARN);
            } else if (result == TestStatus.FAIL) {
                node.setResult(TestStatus.DMESG_FAIL);
            }
        }
        if (Strings.isNullOrEmpty(node.getOut())
                && Strings.isNullOrEmpty(node.getErr())
                && Strings.isNullOrEmpty(node.getDmesg())) {
            node.setOut(NO_OUTPUT_MESSAGE);
            node.setResult(TestStatus.INCOMPLETE);
        }
    }

    /** Whether stderr has any line that is not one of the sentinel lines. */
    @VisibleForTesting
    static boolean stderrContainsWarnings(String err) {
        if (Strings.isNullOrEmpty(err)) {
            return false;
        }
        List<SentinelMatch> matches = SentinelMatch.findAll(err, 0, err.length());
        int line = 0;
        int next = 0;
        while (line >= 0 && line < err.length()) {
            if (next >= matches.size() || matches.get(next).getWhere() != line) {
                return true;
            }
            next++;
            line = SentinelMatch.nextLine(err, line, err.length());
        }
        return false;
    }
}
