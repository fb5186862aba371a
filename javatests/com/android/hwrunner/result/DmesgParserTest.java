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

import com.android.hwrunner.dmesg.DmesgFilter;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link DmesgParser}. */
@RunWith(JUnit4.class)
public class DmesgParserTest {

    private static final String KMSG =
            "6,100,1000000,-;[IGT] kms_flip: executing\n"
                    + "6,101,1100000,-;[IGT] kms_flip: starting subtest A\n"
                    + "3,102,1200000,-;i915 0000:00:02.0: [drm] *ERROR* flip timed out\n"
                    + " SUBSYSTEM=pci\n"
                    + "6,103,1300000,-;[IGT] kms_flip: starting subtest B\n"
                    + "6,104,1400000,-;[IGT] kms_flip: exiting, ret=0\n";

    private SubtestList mSubtests;
    private RunResults mResults;
    private DmesgParser mParser;

    @Before
    public void setUp() {
        mSubtests = new SubtestList();
        mResults = new RunResults();
        mParser = new DmesgParser(new DmesgFilter(false, 4));
    }

    @Test
    public void testParse_splitsBySubtestMarker() {
        mSubtests.add("A");
        mSubtests.add("B");

        mParser.parse(KMSG, "kms_flip", mSubtests, mResults);

        TestResultNode a = mResults.getTest("kms_flip@A");
        assertThat(a.getDmesg()).contains("<6> [1.100000] [IGT] kms_flip: starting subtest A\n");
        assertThat(a.getDmesg()).contains("flip timed out");
        assertThat(a.getDmesg()).doesNotContain("starting subtest B");
        assertThat(a.getDmesgWarnings())
                .isEqualTo("<3> [1.200000] i915 0000:00:02.0: [drm] *ERROR* flip timed out\n");
        TestResultNode b = mResults.getTest("kms_flip@B");
        assertThat(b.getDmesg()).startsWith("<6> [1.300000] [IGT] kms_flip: starting subtest B\n");
        assertThat(b.getDmesgWarnings()).isNull();
    }

    @Test
    public void testParse_dmesgWarnOverridesPass() {
        mSubtests.add("A");
        mSubtests.add("B");
        mResults.getOrCreateTest("kms_flip@A").setResult(TestStatus.PASS);
        mResults.getOrCreateTest("kms_flip@A").setOut("ok\n");
        mResults.getOrCreateTest("kms_flip@B").setResult(TestStatus.PASS);
        mResults.getOrCreateTest("kms_flip@B").setOut("ok\n");

        mParser.parse(KMSG, "kms_flip", mSubtests, mResults);
        ResultOverrides.apply("kms_flip", mSubtests, mResults);

        assertThat(mResults.getTest("kms_flip@A").getResult()).isEqualTo(TestStatus.DMESG_WARN);
        assertThat(mResults.getTest("kms_flip@B").getResult()).isEqualTo(TestStatus.PASS);
    }

    @Test
    public void testParse_binaryWithoutSubtests() {
        mParser.parse(KMSG, "kms_flip", mSubtests, mResults);

        TestResultNode node = mResults.getTest("kms_flip@A");
        // Markers still split the log even when the journal saw no subtests.
        assertThat(node).isNotNull();
        assertThat(mResults.getTest("kms_flip")).isNull();
    }

    @Test
    public void testParse_noMarkersWithSubtests() {
        mSubtests.add("A");
        mSubtests.add("B");
        String kmsg = "3,1,1000000,-;i915: GPU hang\n";

        mParser.parse(kmsg, "gem_exec", mSubtests, mResults);

        for (String name : new String[] {"gem_exec@A", "gem_exec@B"}) {
            TestResultNode node = mResults.getTest(name);
            assertThat(node.getDmesg()).isEqualTo("<3> [1.000000] i915: GPU hang\n");
            assertThat(node.getDmesgWarnings()).isNull();
        }
    }

    @Test
    public void testParse_noMarkersNoSubtests() {
        String kmsg = "3,1,1000000,-;i915: GPU hang\n6,2,1000001,-;info\n";

        mParser.parse(kmsg, "core_auth", mSubtests, mResults);

        TestResultNode node = mResults.getTest("core_auth");
        assertThat(node.getDmesg())
                .isEqualTo("<3> [1.000000] i915: GPU hang\n<6> [1.000001] info\n");
        assertThat(node.getDmesgWarnings()).isEqualTo("<3> [1.000000] i915: GPU hang\n");
    }

    @Test
    public void testParse_dynamicMarkers() {
        mSubtests.add("flip").addDynamicSubtest("pipe-A");
        String kmsg =
                "6,1,1000000,-;[IGT] kms_flip: starting subtest flip\n"
                        + "6,2,1100000,-;[IGT] kms_flip: starting dynamic subtest pipe-A\n"
                        + "3,3,1200000,-;i915: underrun\n";

        mParser.parse(kmsg, "kms_flip", mSubtests, mResults);

        TestResultNode dynamic = mResults.getTest("kms_flip@flip@pipe-A");
        assertThat(dynamic.getDmesg()).contains("starting dynamic subtest pipe-A");
        assertThat(dynamic.getDmesgWarnings()).isEqualTo("<3> [1.200000] i915: underrun\n");
        assertThat(mResults.getTest("kms_flip@flip").getDmesgWarnings())
                .isEqualTo("<3> [1.200000] i915: underrun\n");
    }

    @Test
    public void testParse_emptyLog() {
        mSubtests.add("A").addDynamicSubtest("d");

        mParser.parse("", "kms_flip", mSubtests, mResults);

        assertThat(mResults.getTest("kms_flip@A").getDmesg()).isEmpty();
        assertThat(mResults.getTest("kms_flip@A@d").getDmesg()).isEmpty();
    }
}
