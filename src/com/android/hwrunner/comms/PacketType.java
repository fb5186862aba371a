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
package com.android.hwrunner.comms;

/** Types of the packets a test binary and the runner exchange over the comms socket. */
public enum PacketType {
    /** No data. Only used on parse failures. */
    INVALID(0),
    /** Log text. u8 stream (1 = stdout, 2 = stderr), cstring text. */
    LOG(1),
    /** Command line executed, written by the runner before starting the test. */
    EXEC(2),
    /** Process exit, written by the runner. i32 exit code, cstring time used. */
    EXIT(3),
    /** cstring subtest name. */
    SUBTEST_START(4),
    /** cstring name, cstring result, cstring time used, cstring reason. */
    SUBTEST_RESULT(5),
    /** cstring dynamic subtest name. */
    DYNAMIC_SUBTEST_START(6),
    /** cstring name, cstring result, cstring time used, cstring reason. */
    DYNAMIC_SUBTEST_RESULT(7),
    /** cstring version text. */
    VERSIONSTRING(8),
    /** cstring result that replaces whatever the current (dynamic) subtest reports. */
    RESULT_OVERRIDE(9);

    private final int mCode;

    PacketType(int code) {
        mCode = code;
    }

    public int getCode() {
        return mCode;
    }

    /** Returns the type for a wire code, {@link #INVALID} for unknown codes. */
    public static PacketType fromCode(int code) {
        for (PacketType type : values()) {
            if (type.mCode == code) {
                return type;
            }
        }
        return INVALID;
    }
}
