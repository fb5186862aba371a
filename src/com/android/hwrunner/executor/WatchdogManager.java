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

import com.android.hwrunner.config.RunnerSettings;
import com.android.hwrunner.log.LogUtil.CLog;

import com.google.common.annotations.VisibleForTesting;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Keeps the hardware watchdogs of the host alive while a batch runs, so a hung test is killed by
 * the executor and not by a host reboot. All devices share one timeout.
 */
public class WatchdogManager {

    private final IntFunction<IWatchdogDevice> mOpener;
    private final List<IWatchdogDevice> mDevices = new ArrayList<>();

    public WatchdogManager() {
        this(SysfsWatchdogDevice::open);
    }

    /** @param opener returns the device with the given index, or null when there is none */
    @VisibleForTesting
    WatchdogManager(IntFunction<IWatchdogDevice> opener) {
        mOpener = opener;
    }

    /**
     * Opens devices 0, 1, ... until one cannot be opened. Does nothing unless the settings enable
     * watchdogs and an inactivity timeout.
     */
    public void init(RunnerSettings settings) {
        if (!settings.isUseWatchdog() || settings.getInactivityTimeout() <= 0) {
            return;
        }
        CLog.d("Initializing watchdogs");
        for (int i = 0; ; i++) {
            IWatchdogDevice device = mOpener.apply(i);
            if (device == null) {
                break;
            }
            CLog.d(" %s", device.getName());
            mDevices.add(device);
        }
    }

    /** Number of devices currently armed. */
    public int getDeviceCount() {
        return mDevices.size();
    }

    /**
     * Applies a timeout to every device. A device rejecting it is disarmed and dropped. When a
     * device only supports a shorter timeout, that one is applied to all.
     *
     * @return the timeout now in effect; {@code seconds} itself if there are no devices
     */
    public int setTimeout(int seconds) {
        Iterator<IWatchdogDevice> it = mDevices.iterator();
        while (it.hasNext()) {
            IWatchdogDevice device = it.next();
            int accepted;
            try {
                accepted = device.setTimeout(seconds);
            } catch (IOException e) {
                CLog.w("%s rejected a timeout of %ds: %s", device.getName(), seconds, e);
                safeDisarm(device);
                it.remove();
                continue;
            }
            if (accepted < seconds) {
                return setTimeout(accepted);
            }
        }
        return seconds;
    }

    /** Keeps every device alive. */
    public void ping() {
        for (IWatchdogDevice device : mDevices) {
            try {
                device.ping();
            } catch (IOException e) {
                CLog.w("Failed to ping %s: %s", device.getName(), e);
            }
        }
    }

    /** Disarms and releases every device. */
    public void closeAll() {
        if (mDevices.isEmpty()) {
            return;
        }
        CLog.d("Closing watchdogs");
        for (IWatchdogDevice device : mDevices) {
            safeDisarm(device);
        }
        mDevices.clear();
    }

    private static void safeDisarm(IWatchdogDevice device) {
        try {
            device.disarm();
        } catch (IOException e) {
            CLog.e("Failed to disarm %s: %s", device.getName(), e);
        }
    }
}
