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

/** Exit codes of test binaries, and the sentinel codes the runner uses in their place. */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int SKIP = 77;
    public static final int INVALID = 79;
    public static final int ABORT = 112;

    /** The process never reported an exit. */
    public static final int INCOMPLETE = -1234;

    /** The process was stopped gracefully with SIGHUP. */
    public static final int GRACEFUL = -1;

    private ExitCodes() {}

    /**
     * Normalizes a process exit value into the journal representation: values of 128 and more
     * are folded negative. As the JVM reports a death by signal N as 128 + N, such deaths end up
     * as -N.
     */
    public static int normalize(int exitValue) {
        if (exitValue >= 128) {
            return 128 - exitValue;
        }
        return exitValue;
    }
}
