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
package com.android.hwrunner.config;

import com.android.hwrunner.error.HarnessRuntimeException;
import com.android.hwrunner.error.InfraErrorIdentifier;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide configuration of one batch run. Stored next to the results as {@code metadata.txt}
 * so that a resumed run and the result generator see exactly the configuration the batch was
 * started with.
 */
public class RunnerSettings {

    public static final String METADATA_FILENAME = "metadata.txt";

    /** Default kernel log level at or above which dmesg lines are warnings (KERN_WARNING). */
    public static final int DEFAULT_DMESG_WARN_LEVEL = 4;

    /** How chatty the runner is on the console. */
    public enum Verbosity {
        QUIET,
        NORMAL,
        VERBOSE
    }

    @VisibleForTesting static final String KEY_NAME = "name";
    @VisibleForTesting static final String KEY_DRY_RUN = "dry_run";
    @VisibleForTesting static final String KEY_SYNC = "sync";
    @VisibleForTesting static final String KEY_LOG_LEVEL = "log_level";
    @VisibleForTesting static final String KEY_OVERWRITE = "overwrite";
    @VisibleForTesting static final String KEY_MULTIPLE_MODE = "multiple_mode";
    @VisibleForTesting static final String KEY_INACTIVITY_TIMEOUT = "inactivity_timeout";
    @VisibleForTesting static final String KEY_OVERALL_TIMEOUT = "overall_timeout";
    @VisibleForTesting static final String KEY_USE_WATCHDOG = "use_watchdog";
    @VisibleForTesting static final String KEY_PIGLIT_STYLE_DMESG = "piglit_style_dmesg";
    @VisibleForTesting static final String KEY_DMESG_WARN_LEVEL = "dmesg_warn_level";
    @VisibleForTesting static final String KEY_PRUNE_MODE = "prune_mode";
    @VisibleForTesting static final String KEY_TEST_ROOT = "test_root";
    @VisibleForTesting static final String KEY_RESULTS_PATH = "results_path";
    @VisibleForTesting static final String KEY_SOCKET_COMMS = "socket_comms";

    private static final String SEPARATOR = " : ";

    private String mName = null;
    private boolean mDryRun = false;
    private boolean mSync = false;
    private Verbosity mLogLevel = Verbosity.NORMAL;
    private boolean mOverwrite = false;
    private boolean mMultipleMode = false;
    private int mInactivityTimeout = 0;
    private int mOverallTimeout = 0;
    private boolean mUseWatchdog = false;
    private boolean mPiglitStyleDmesg = false;
    private int mDmesgWarnLevel = DEFAULT_DMESG_WARN_LEVEL;
    private PruneMode mPruneMode = PruneMode.KEEP_DYNAMIC;
    private String mTestRoot = null;
    private String mResultsPath = null;
    private boolean mSocketComms = false;

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    public boolean isDryRun() {
        return mDryRun;
    }

    public void setDryRun(boolean dryRun) {
        mDryRun = dryRun;
    }

    /** Whether every write to the result files is followed by an fsync. */
    public boolean isSync() {
        return mSync;
    }

    public void setSync(boolean sync) {
        mSync = sync;
    }

    public Verbosity getLogLevel() {
        return mLogLevel;
    }

    public void setLogLevel(Verbosity logLevel) {
        mLogLevel = logLevel;
    }

    public boolean isOverwrite() {
        return mOverwrite;
    }

    public void setOverwrite(boolean overwrite) {
        mOverwrite = overwrite;
    }

    /**
     * In multiple mode one job runs many subtests of a binary at once, and a job without any
     * subtest selection means the subtest set is unknown.
     */
    public boolean isMultipleMode() {
        return mMultipleMode;
    }

    public void setMultipleMode(boolean multipleMode) {
        mMultipleMode = multipleMode;
    }

    /** Seconds without any output before a job is considered hung. 0 disables. */
    public int getInactivityTimeout() {
        return mInactivityTimeout;
    }

    public void setInactivityTimeout(int inactivityTimeout) {
        mInactivityTimeout = inactivityTimeout;
    }

    /** Seconds after which no new job is started. 0 disables. */
    public int getOverallTimeout() {
        return mOverallTimeout;
    }

    public void setOverallTimeout(int overallTimeout) {
        mOverallTimeout = overallTimeout;
    }

    public boolean isUseWatchdog() {
        return mUseWatchdog;
    }

    public void setUseWatchdog(boolean useWatchdog) {
        mUseWatchdog = useWatchdog;
    }

    public boolean isPiglitStyleDmesg() {
        return mPiglitStyleDmesg;
    }

    public void setPiglitStyleDmesg(boolean piglitStyleDmesg) {
        mPiglitStyleDmesg = piglitStyleDmesg;
    }

    public int getDmesgWarnLevel() {
        return mDmesgWarnLevel;
    }

    public void setDmesgWarnLevel(int dmesgWarnLevel) {
        mDmesgWarnLevel = dmesgWarnLevel;
    }

    public PruneMode getPruneMode() {
        return mPruneMode;
    }

    public void setPruneMode(PruneMode pruneMode) {
        mPruneMode = pruneMode;
    }

    public String getTestRoot() {
        return mTestRoot;
    }

    public void setTestRoot(String testRoot) {
        mTestRoot = testRoot;
    }

    public String getResultsPath() {
        return mResultsPath;
    }

    public void setResultsPath(String resultsPath) {
        mResultsPath = resultsPath;
    }

    /** Whether jobs get a structured event socket in addition to their stdout/stderr pipes. */
    public boolean isSocketComms() {
        return mSocketComms;
    }

    public void setSocketComms(boolean socketComms) {
        mSocketComms = socketComms;
    }

    /**
     * Writes the settings into {@code metadata.txt} of the given directory.
     *
     * @throws HarnessRuntimeException if metadata already exists and overwrite is not set
     */
    public void serialize(File resultsDir) throws IOException {
        File metadata = new File(resultsDir, METADATA_FILENAME);
        if (metadata.exists() && !mOverwrite) {
            throw new HarnessRuntimeException(
                    String.format(
                            "%s already exists and overwrite is not set",
                            metadata.getAbsolutePath()),
                    InfraErrorIdentifier.RESULT_DIR_ERROR);
        }
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, String> entry : toMap().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            builder.append(entry.getKey()).append(SEPARATOR).append(entry.getValue()).append('\n');
        }
        FileUtil.writeToFile(builder.toString(), metadata);
    }

    /** Reads settings previously written by {@link #serialize(File)}. */
    public static RunnerSettings deserialize(File resultsDir) throws IOException {
        File metadata = new File(resultsDir, METADATA_FILENAME);
        RunnerSettings settings = new RunnerSettings();
        for (String line : FileUtil.readStringFromFile(metadata).split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            int sep = line.indexOf(SEPARATOR);
            if (sep < 0) {
                throw new HarnessRuntimeException(
                        String.format("Malformed line in %s: '%s'", metadata, line),
                        InfraErrorIdentifier.INVALID_SETTINGS);
            }
            settings.apply(line.substring(0, sep), line.substring(sep + SEPARATOR.length()));
        }
        return settings;
    }

    private Map<String, String> toMap() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(KEY_NAME, mName);
        values.put(KEY_DRY_RUN, Boolean.toString(mDryRun));
        values.put(KEY_SYNC, Boolean.toString(mSync));
        values.put(KEY_LOG_LEVEL, mLogLevel.name().toLowerCase());
        values.put(KEY_OVERWRITE, Boolean.toString(mOverwrite));
        values.put(KEY_MULTIPLE_MODE, Boolean.toString(mMultipleMode));
        values.put(KEY_INACTIVITY_TIMEOUT, Integer.toString(mInactivityTimeout));
        values.put(KEY_OVERALL_TIMEOUT, Integer.toString(mOverallTimeout));
        values.put(KEY_USE_WATCHDOG, Boolean.toString(mUseWatchdog));
        values.put(KEY_PIGLIT_STYLE_DMESG, Boolean.toString(mPiglitStyleDmesg));
        values.put(KEY_DMESG_WARN_LEVEL, Integer.toString(mDmesgWarnLevel));
        values.put(KEY_PRUNE_MODE, mPruneMode.getName());
        values.put(KEY_TEST_ROOT, mTestRoot);
        values.put(KEY_RESULTS_PATH, mResultsPath);
        values.put(KEY_SOCKET_COMMS, Boolean.toString(mSocketComms));
        return values;
    }

    private void apply(String key, String value) {
        try {
            switch (key) {
                case KEY_NAME:
                    mName = value;
                    break;
                case KEY_DRY_RUN:
                    mDryRun = Boolean.parseBoolean(value);
                    break;
                case KEY_SYNC:
                    mSync = Boolean.parseBoolean(value);
                    break;
                case KEY_LOG_LEVEL:
                    mLogLevel = Verbosity.valueOf(value.toUpperCase());
                    break;
                case KEY_OVERWRITE:
                    mOverwrite = Boolean.parseBoolean(value);
                    break;
                case KEY_MULTIPLE_MODE:
                    mMultipleMode = Boolean.parseBoolean(value);
                    break;
                case KEY_INACTIVITY_TIMEOUT:
                    mInactivityTimeout = Integer.parseInt(value);
                    break;
                case KEY_OVERALL_TIMEOUT:
                    mOverallTimeout = Integer.parseInt(value);
                    break;
                case KEY_USE_WATCHDOG:
                    mUseWatchdog = Boolean.parseBoolean(value);
                    break;
                case KEY_PIGLIT_STYLE_DMESG:
                    mPiglitStyleDmesg = Boolean.parseBoolean(value);
                    break;
                case KEY_DMESG_WARN_LEVEL:
                    mDmesgWarnLevel = Integer.parseInt(value);
                    break;
                case KEY_PRUNE_MODE:
                    mPruneMode = PruneMode.fromName(value);
                    break;
                case KEY_TEST_ROOT:
                    mTestRoot = value;
                    break;
                case KEY_RESULTS_PATH:
                    mResultsPath = value;
                    break;
                case KEY_SOCKET_COMMS:
                    mSocketComms = Boolean.parseBoolean(value);
                    break;
                default:
                    CLog.w("Ignoring unknown setting '%s'", key);
                    break;
            }
        } catch (IllegalArgumentException e) {
            throw new HarnessRuntimeException(
                    String.format("Invalid value '%s' for setting '%s'", value, key),
                    e,
                    InfraErrorIdentifier.INVALID_SETTINGS);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunnerSettings)) {
            return false;
        }
        return toMap().equals(((RunnerSettings) o).toMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toMap());
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
