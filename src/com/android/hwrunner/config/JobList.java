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
import com.android.hwrunner.util.FileUtil;

import com.google.common.base.Splitter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The ordered list of jobs of a batch, serialized as {@code joblist.txt}. */
public class JobList {

    public static final String JOBLIST_FILENAME = "joblist.txt";

    private final List<JobListEntry> mEntries = new ArrayList<>();

    public JobList() {}

    public JobList(List<JobListEntry> entries) {
        mEntries.addAll(entries);
    }

    public List<JobListEntry> getEntries() {
        return Collections.unmodifiableList(mEntries);
    }

    public JobListEntry get(int index) {
        return mEntries.get(index);
    }

    public int size() {
        return mEntries.size();
    }

    public void add(JobListEntry entry) {
        mEntries.add(entry);
    }

    /** Replaces the entry at {@code index}; used when narrowing the selection of a resumed job. */
    public void set(int index, JobListEntry entry) {
        mEntries.set(index, entry);
    }

    /** Writes the list into {@code joblist.txt} of the given directory. */
    public void serialize(File resultsDir, boolean overwrite) throws IOException {
        File file = new File(resultsDir, JOBLIST_FILENAME);
        if (file.exists() && !overwrite) {
            throw new HarnessRuntimeException(
                    String.format("%s already exists and overwrite is not set", file),
                    InfraErrorIdentifier.RESULT_DIR_ERROR);
        }
        StringBuilder builder = new StringBuilder();
        for (JobListEntry entry : mEntries) {
            builder.append(entry.toString()).append('\n');
        }
        FileUtil.writeToFile(builder.toString(), file);
    }

    /** Reads the list written by {@link #serialize(File, boolean)}. */
    public static JobList deserialize(File resultsDir) throws IOException {
        return parse(new File(resultsDir, JOBLIST_FILENAME));
    }

    /**
     * Parses a job list file: one job per line, {@code binary} or {@code binary sub1,sub2}. Empty
     * lines and lines starting with {@code #} are ignored.
     */
    public static JobList parse(File file) throws IOException {
        JobList list = new JobList();
        for (String line : FileUtil.readStringFromFile(file).split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            List<String> parts = Splitter.on(' ').omitEmptyStrings().splitToList(trimmed);
            if (parts.size() > 2) {
                throw new HarnessRuntimeException(
                        String.format("Malformed job list line in %s: '%s'", file, line),
                        InfraErrorIdentifier.INVALID_JOB_LIST);
            }
            if (parts.size() == 1) {
                list.add(new JobListEntry(parts.get(0)));
            } else {
                list.add(
                        new JobListEntry(
                                parts.get(0),
                                Splitter.on(',').omitEmptyStrings().splitToList(parts.get(1))));
            }
        }
        return list;
    }
}
