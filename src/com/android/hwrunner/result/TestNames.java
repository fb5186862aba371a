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

/** Builds the flattened identifiers of the results document. */
public final class TestNames {

    public static final String SEPARATOR = "@";

    private TestNames() {}

    /** {@code binary} or {@code binary@subtest} when a subtest is given. */
    public static String of(String binary, String subtest) {
        if (subtest == null) {
            return binary;
        }
        return binary + SEPARATOR + subtest;
    }

    /** {@code binary@subtest@dynamic}, given the identifier of the parent subtest. */
    public static String dynamic(String parentName, String dynamicSubtest) {
        return parentName + SEPARATOR + dynamicSubtest;
    }
}
