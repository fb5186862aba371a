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

import com.android.hwrunner.log.LogUtil.CLog;

import org.json.JSONObject;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** The tests, totals and runtimes sections of a results document, in construction. */
public class RunResults {

    /** Totals scope counting every test. */
    public static final String SCOPE_ALL = "";

    /** Totals scope counting every top level test. */
    public static final String SCOPE_ROOT = "root";

    private final Map<String, TestResultNode> mTests = new LinkedHashMap<>();
    private final Map<String, EnumMap<TestStatus, Integer>> mTotals = new LinkedHashMap<>();
    private final Map<String, Double> mRuntimes = new LinkedHashMap<>();

    /** Returns the node for {@code name}, creating an empty one if needed. */
    public TestResultNode getOrCreateTest(String name) {
        TestResultNode node = mTests.get(name);
        if (node == null) {
            node = new TestResultNode();
            mTests.put(name, node);
        }
        return node;
    }

    /** Returns the node for {@code name} or null. */
    public TestResultNode getTest(String name) {
        return mTests.get(name);
    }

    public void removeTest(String name) {
        mTests.remove(name);
    }

    public Map<String, TestResultNode> getTests() {
        return Collections.unmodifiableMap(mTests);
    }

    /** Adds to the accumulated runtime of a binary. */
    public void addRuntime(String binaryName, double seconds) {
        Double old = mRuntimes.get(binaryName);
        mRuntimes.put(binaryName, old == null ? seconds : old + seconds);
    }

    /** Accumulated runtime of a binary, null if it never ran. */
    public Double getRuntime(String binaryName) {
        return mRuntimes.get(binaryName);
    }

    /** Returns the counters of a totals scope, every kind starting at zero. */
    public Map<TestStatus, Integer> getTotals(String scope) {
        EnumMap<TestStatus, Integer> totals = mTotals.get(scope);
        if (totals == null) {
            totals = new EnumMap<>(TestStatus.class);
            for (TestStatus status : TestStatus.values()) {
                totals.put(status, 0);
            }
            mTotals.put(scope, totals);
        }
        return totals;
    }

    /**
     * Counts the results of the given tests in the grand total, the root scope and the scope of
     * {@code binary}. Names without a node are skipped; counting stops at a node without a result.
     */
    public void addToTotals(String binary, Iterable<String> testNames) {
        Map<TestStatus, Integer> all = getTotals(SCOPE_ALL);
        Map<TestStatus, Integer> root = getTotals(SCOPE_ROOT);
        Map<TestStatus, Integer> binaryTotals = getTotals(binary);
        for (String name : testNames) {
            TestResultNode node = mTests.get(name);
            if (node == null) {
                continue;
            }
            if (!node.hasResult()) {
                CLog.w("No results set for %s", name);
                return;
            }
            TestStatus result = node.getResult();
            all.merge(result, 1, Integer::sum);
            root.merge(result, 1, Integer::sum);
            binaryTotals.merge(result, 1, Integer::sum);
        }
    }

    /** Adds the {@code tests}, {@code totals} and {@code runtimes} sections to {@code root}. */
    public void writeTo(JSONObject root) {
        JSONObject tests = new JSONObject();
        for (Map.Entry<String, TestResultNode> entry : mTests.entrySet()) {
            tests.put(entry.getKey(), entry.getValue().toJson());
        }
        root.put("tests", tests);

        JSONObject totals = new JSONObject();
        for (Map.Entry<String, EnumMap<TestStatus, Integer>> entry : mTotals.entrySet()) {
            JSONObject counts = new JSONObject();
            for (Map.Entry<TestStatus, Integer> count : entry.getValue().entrySet()) {
                counts.put(count.getKey().getName(), count.getValue().intValue());
            }
            totals.put(entry.getKey(), counts);
        }
        root.put("totals", totals);

        JSONObject runtimes = new JSONObject();
        for (Map.Entry<String, Double> entry : mRuntimes.entrySet()) {
            runtimes.put(entry.getKey(), TestResultNode.timeAttribute(entry.getValue()));
        }
        root.put("runtimes", runtimes);
    }
}
