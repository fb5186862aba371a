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

import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * A {@code /dev/watchdogN} device. Opening the node arms the watchdog. The timeout the device
 * accepts is read from {@code /sys/class/watchdog/watchdogN/timeout}.
 */
public class SysfsWatchdogDevice implements IWatchdogDevice {

    private static final String DEV_PATTERN = "/dev/watchdog%d";
    private static final String SYSFS_TIMEOUT_PATTERN = "/sys/class/watchdog/watchdog%d/timeout";

    private final String mName;
    private final File mSysfsTimeout;
    private FileOutputStream mStream;

    @VisibleForTesting
    SysfsWatchdogDevice(String name, FileOutputStream stream, File sysfsTimeout) {
        mName = name;
        mStream = stream;
        mSysfsTimeout = sysfsTimeout;
    }

    /**
     * Opens {@code /dev/watchdog<index>}.
     *
     * @return the armed device, or null if there is no such device or it cannot be opened
     */
    public static SysfsWatchdogDevice open(int index) {
        File node = new File(String.format(DEV_PATTERN, index));
        try {
            return new SysfsWatchdogDevice(
                    node.getPath(),
                    new FileOutputStream(node),
                    new File(String.format(SYSFS_TIMEOUT_PATTERN, index)));
        } catch (FileNotFoundException e) {
            return null;
        }
    }

    @Override
    public String getName() {
        return mName;
    }

    @Override
    public int setTimeout(int seconds) throws IOException {
        int supported;
        try {
            supported =
                    Integer.parseInt(
                            FileUtil.readStringFromFile(mSysfsTimeout, StandardCharsets.US_ASCII)
                                    .trim());
        } catch (NumberFormatException e) {
            throw new IOException(
                    String.format("Unreadable timeout in %s", mSysfsTimeout.getPath()), e);
        }
        if (supported <= 0) {
            throw new IOException(String.format("%s reports no usable timeout", mName));
        }
        return Math.min(seconds, supported);
    }

    @Override
    public void ping() throws IOException {
        if (mStream != null) {
            mStream.write(0);
            mStream.flush();
        }
    }

    @Override
    public void disarm() throws IOException {
        if (mStream == null) {
            return;
        }
        try {
            mStream.write('V');
            mStream.flush();
        } finally {
            mStream.close();
            mStream = null;
        }
    }
}
