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

/** Controls which levels of the subtest hierarchy end up in the results document. */
public enum PruneMode {
    /** Drop a subtest node when it has dynamic subtests; keep the dynamic ones. */
    KEEP_DYNAMIC("keep-dynamic"),
    /** Drop the dynamic subtest nodes, keep the subtests. */
    KEEP_SUBTESTS("keep-subtests"),
    /** Keep everything. */
    KEEP_ALL("keep-all"),
    /** Keep only the nodes that were explicitly requested in the job list. */
    KEEP_REQUESTED("keep-requested");

    private final String mName;

    PruneMode(String name) {
        mName = name;
    }

    public String getName() {
        return mName;
    }

    /** Looks up a prune mode from its command line / serialized name. */
    public static PruneMode fromName(String name) {
        for (PruneMode mode : values()) {
            if (mode.mName.equals(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown prune mode: " + name);
    }
}
