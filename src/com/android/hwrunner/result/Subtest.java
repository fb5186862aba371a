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

/** A subtest seen while parsing a job, with the dynamic subtests found inside it. */
public class Subtest {

    private final String mName;
    private final List<String> mDynamicSubtests = new ArrayList<>();

    public Subtest(String name) {
        mName = name;
    }

    public String getName() {
        return mName;
    }

    public List<String> getDynamicSubtests() {
        return Collections.unmodifiableList(mDynamicSubtests);
    }

    /** Records a dynamic subtest; names already present are ignored. */
    public void addDynamicSubtest(String name) {
        if (!mDynamicSubtests.contains(name)) {
            mDynamicSubtests.add(name);
        }
    }

    public boolean hasDynamicSubtests() {
        return !mDynamicSubtests.isEmpty();
    }
}
