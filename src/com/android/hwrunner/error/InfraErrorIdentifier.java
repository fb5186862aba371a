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
package com.android.hwrunner.error;

/** Error Identifiers from the runner infrastructure and the host it runs on. */
public enum InfraErrorIdentifier implements ErrorIdentifier {

    // 500_001 - 500_500: General errors
    INTERRUPTED(500_001),

    // 500_501 - 501_000: Host file system errors
    FAIL_TO_CREATE_FILE(500_501),
    RESULT_DIR_ERROR(500_502),

    // 501_001 - 501_500: Configuration errors
    INVALID_SETTINGS(501_001),
    INVALID_JOB_LIST(501_002),

    // 501_501 - 502_000: Test process supervision errors
    CHILD_REFUSES_TO_DIE(501_501),

    // 502_001 - 502_500: Result generation errors
    RESULT_PARSE_FAILED(502_001);

    private final long mCode;

    InfraErrorIdentifier(int code) {
        mCode = code;
    }

    @Override
    public long code() {
        return mCode;
    }
}
