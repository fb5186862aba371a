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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * One job of a batch: a test binary, optionally restricted to a list of subtest selectors. A
 * selector may be a plain name, a glob, or a negated name ({@code !name}).
 */
public final class JobListEntry {

    private final String mBinary;
    private final ImmutableList<String> mSubtests;

    public JobListEntry(String binary, List<String> subtests) {
        mBinary = Objects.requireNonNull(binary);
        mSubtests = ImmutableList.copyOf(subtests);
    }

    public JobListEntry(String binary) {
        this(binary, ImmutableList.of());
    }

    public String getBinary() {
        return mBinary;
    }

    public ImmutableList<String> getSubtests() {
        return mSubtests;
    }

    public boolean hasSubtests() {
        return !mSubtests.isEmpty();
    }

    /** Returns a copy of this entry with the given subtest selectors. */
    public JobListEntry withSubtests(List<String> subtests) {
        return new JobListEntry(mBinary, subtests);
    }

    /** The selector list as passed to the test binary. */
    public String joinedSubtests() {
        return Joiner.on(',').join(mSubtests);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobListEntry)) {
            return false;
        }
        JobListEntry other = (JobListEntry) o;
        return mBinary.equals(other.mBinary) && mSubtests.equals(other.mSubtests);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mBinary, mSubtests);
    }

    @Override
    public String toString() {
        return mSubtests.isEmpty() ? mBinary : mBinary + " " + joinedSubtests();
    }
}
