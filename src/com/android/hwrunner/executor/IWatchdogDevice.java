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
package com.android.hwrunner.executor;

import java.io.IOException;

/** A hardware watchdog that reboots the host unless it is kept alive. */
public interface IWatchdogDevice {

    /** Human readable name of the device, for logging. */
    String getName();

    /**
     * Requests a timeout.
     *
     * @param seconds the requested timeout
     * @return the timeout the device actually uses, never more than requested
     * @throws IOException if the device rejects the request
     */
    int setTimeout(int seconds) throws IOException;

    /** Restarts the countdown of the device. */
    void ping() throws IOException;

    /** Disarms the device with the magic close character and releases it. */
    void disarm() throws IOException;
}
