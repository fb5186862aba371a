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

import java.io.File;

/** The files written for every job into its numbered directory. */
public enum OutputFile {
    OUT("out.txt"),
    ERR("err.txt"),
    JOURNAL("journal.txt"),
    DMESG("dmesg.txt"),
    /** Packets received over the comms socket, only present when comms are enabled. */
    COMMS("comms");

    private final String mFileName;

    OutputFile(String fileName) {
        mFileName = fileName;
    }

    public String getFileName() {
        return mFileName;
    }

    /** The file inside {@code jobDir}. */
    public File in(File jobDir) {
        return new File(jobDir, mFileName);
    }
}
