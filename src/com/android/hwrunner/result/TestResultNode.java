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

import org.json.JSONObject;

import java.nio.charset.StandardCharsets;

/**
 * Result of one test, subtest or dynamic subtest. Every field is optional until the result
 * generator fills it in; absent fields are left out of the JSON form.
 */
public class TestResultNode {

    static final String KEY_RESULT = "result";
    static final String KEY_OUT = "out";
    static final String KEY_ERR = "err";
    static final String KEY_DMESG = "dmesg";
    static final String KEY_DMESG_WARNINGS = "dmesg-warnings";
    static final String KEY_IGT_VERSION = "igt-version";
    static final String KEY_TIME = "time";

    private TestStatus mResult = null;
    private String mOut = null;
    private String mErr = null;
    private String mDmesg = null;
    private String mDmesgWarnings = null;
    private String mIgtVersion = null;
    private Double mRuntime = null;

    public TestStatus getResult() {
        return mResult;
    }

    public boolean hasResult() {
        return mResult != null;
    }

    /** Sets the result, replacing any previous one. A null status is ignored. */
    public void setResult(TestStatus result) {
        if (result != null) {
            mResult = result;
        }
    }

    public String getOut() {
        return mOut;
    }

    public void setOut(String out) {
        mOut = out;
    }

    public String getErr() {
        return mErr;
    }

    public void setErr(String err) {
        mErr = err;
    }

    /** Sets {@code out} or {@code err} depending on which stream the text came from. */
    public void setOutput(OutputKind kind, String text) {
        if (kind == OutputKind.OUT) {
            mOut = text;
        } else {
            mErr = text;
        }
    }

    public String getDmesg() {
        return mDmesg;
    }

    public boolean hasDmesg() {
        return mDmesg != null;
    }

    /** Sets the kernel log excerpt and, when not null, the warnings found in it. */
    public void setDmesg(String dmesg, String warnings) {
        mDmesg = dmesg;
        if (warnings != null) {
            mDmesgWarnings = warnings;
        }
    }

    public String getDmesgWarnings() {
        return mDmesgWarnings;
    }

    public String getIgtVersion() {
        return mIgtVersion;
    }

    public void setIgtVersion(String igtVersion) {
        if (igtVersion != null) {
            mIgtVersion = igtVersion;
        }
    }

    /** Runtime in seconds, null if never recorded. */
    public Double getRuntime() {
        return mRuntime;
    }

    public void setRuntime(double seconds) {
        mRuntime = seconds;
    }

    /** Adds to the runtime, for tests whose execution spans several processes. */
    public void addRuntime(double seconds) {
        mRuntime = mRuntime == null ? seconds : mRuntime + seconds;
    }

    /** Converts the node into its results document form. */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (mResult != null) {
            json.put(KEY_RESULT, mResult.getName());
        }
        if (mOut != null) {
            json.put(KEY_OUT, decodeBytes(mOut));
        }
        if (mErr != null) {
            json.put(KEY_ERR, decodeBytes(mErr));
        }
        if (mDmesg != null) {
            json.put(KEY_DMESG, decodeBytes(mDmesg));
        }
        if (mDmesgWarnings != null) {
            json.put(KEY_DMESG_WARNINGS, decodeBytes(mDmesgWarnings));
        }
        if (mIgtVersion != null) {
            json.put(KEY_IGT_VERSION, decodeBytes(mIgtVersion));
        }
        if (mRuntime != null) {
            json.put(KEY_TIME, timeAttribute(mRuntime));
        }
        return json;
    }

    /**
     * Output is kept one char per byte while parsing; the document carries the text the bytes
     * encode.
     */
    private static String decodeBytes(String text) {
        return new String(text.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
    }

    /** The {@code TimeAttribute} object used for every duration in the results document. */
    static JSONObject timeAttribute(double end) {
        JSONObject time = new JSONObject();
        time.put("__type__", "TimeAttribute");
        time.put("start", 0.0);
        time.put("end", end);
        return time;
    }
}
