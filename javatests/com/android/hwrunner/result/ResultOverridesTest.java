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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link ResultOverrides}. */
@RunWith(JUnit4.class)
public class ResultOverridesTest {

    private static TestResultNode node(TestStatus result, String out, String err) {
        TestResultNode node = new TestResultNode();
        node.setResult(result);
        node.setOut(out);
        node.setErr(err);
        node.setDmesg("", null);
        return node;
    }

    @Test
    public void testOverride_stderrNoiseMakesWarn() {
        TestResultNode node =
                node(
                        TestStatus.PASS,
                        "ok\n",
                        "Starting subtest: A\n(kms_flip:123) WARNING: slow vblank\n"
                                + "Subtest A: SUCCESS (0.100s)\n");

        ResultOverrides.overrideSingle(node);

        assertThat(node.getResult()).isEqualTo(TestStatus.WARN);
    }

    @Test
    public void testOverride_sentinelOnlyStderrStaysPass() {
        TestResultNode node =
                node(
                        TestStatus.PASS,
                        "ok\n",
                        "Starting subtest: A\nSubtest A: SUCCESS (0.100s)\n");

        ResultOverrides.overrideSingle(node);

        assertThat(node.getResult()).isEqualTo(TestStatus.PASS);
    }

    @Test
    public void testOverride_noiseAfterResultLine() {
        assertThat(
                        ResultOverrides.stderrContainsWarnings(
                                "Subtest A: SUCCESS (0.100s)\nleaked\n"))
                .isTrue();
        assertThat(ResultOverrides.stderrContainsWarnings("")).isFalse();
        assertThat(ResultOverrides.stderrContainsWarnings(null)).isFalse();
    }

    @Test
    public void testOverride_dmesgWarnings() {
        TestResultNode pass = node(TestStatus.PASS, "ok\n", "");
        pass.setDmesg("<3> [1.0] bad\n", "<3> [1.0] bad\n");
        TestResultNode warn = node(TestStatus.PASS, "ok\n", "noise\n");
        warn.setDmesg("<3> [1.0] bad\n", "<3> [1.0] bad\n");
        TestResultNode fail = node(TestStatus.FAIL, "ok\n", "");
        fail.setDmesg("<3> [1.0] bad\n", "<3> [1.0] bad\n");
        TestResultNode skip = node(TestStatus.SKIP, "ok\n", "");
        skip.setDmesg("<3> [1.0] bad\n", "<3> [1.0] bad\n");

        ResultOverrides.overrideSingle(pass);
        ResultOverrides.overrideSingle(warn);
        ResultOverrides.overrideSingle(fail);
        ResultOverrides.overrideSingle(skip);

        assertThat(pass.getResult()).isEqualTo(TestStatus.DMESG_WARN);
        assertThat(warn.getResult()).isEqualTo(TestStatus.DMESG_WARN);
        assertThat(fail.getResult()).isEqualTo(TestStatus.DMESG_FAIL);
        assertThat(skip.getResult()).isEqualTo(TestStatus.SKIP);
    }

    @Test
    public void testOverride_noOutputIsIncomplete() {
        TestResultNode node = node(TestStatus.PASS, "", "");

        ResultOverrides.overrideSingle(node);

        assertThat(node.getResult()).isEqualTo(TestStatus.INCOMPLETE);
        assertThat(node.getOut()).isEqualTo(ResultOverrides.NO_OUTPUT_MESSAGE);
    }

    @Test
    public void testApply_coversDynamicSubtests() {
        RunResults results = new RunResults();
        SubtestList subtests = new SubtestList();
        subtests.add("flip").addDynamicSubtest("pipe-A");
        results.getOrCreateTest("kms_flip@flip").setResult(TestStatus.PASS);
        results.getOrCreateTest("kms_flip@flip").setOut("out\n");
        TestResultNode dynamic = results.getOrCreateTest("kms_flip@flip@pipe-A");
        dynamic.setResult(TestStatus.PASS);
        dynamic.setOut("out\n");
        dynamic.setErr("warning: odd\n");

        ResultOverrides.apply("kms_flip", subtests, results);

        assertThat(results.getTest("kms_flip@flip").getResult()).isEqualTo(TestStatus.PASS);
        assertThat(dynamic.getResult()).isEqualTo(TestStatus.WARN);
    }
}
