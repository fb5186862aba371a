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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered, duplicate free list of the subtests of one job. */
public class SubtestList {

    private final List<Subtest> mSubtests = new ArrayList<>();

    /** Returns the subtest with the given name, adding it at the end if not present yet. */
    public Subtest add(String name) {
        Subtest existing = find(name);
        if (existing != null) {
            return existing;
        }
        Subtest subtest = new Subtest(name);
        mSubtests.add(subtest);
        return subtest;
    }

    public Subtest find(String name) {
        for (Subtest subtest : mSubtests) {
            if (subtest.getName().equals(name)) {
                return subtest;
            }
        }
        return null;
    }

    /** The most recently added subtest, null when empty. */
    public Subtest last() {
        return mSubtests.isEmpty() ? null : mSubtests.get(mSubtests.size() - 1);
    }

    public List<Subtest> getSubtests() {
        return Collections.unmodifiableList(mSubtests);
    }

    public int size() {
        return mSubtests.size();
    }

    public boolean isEmpty() {
        return mSubtests.isEmpty();
    }
}
