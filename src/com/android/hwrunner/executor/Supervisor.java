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
import com.android.hwrunner.dmesg.DmesgFilter;
import com.android.hwrunner.log.LogUtil.CLog;

import com.google.common.annotations.VisibleForTesting;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Everything a batch holds for its whole run: the armed watchdogs, the kernel log monitor, the
 * dmesg classification and the executor of the jobs. Opened once per batch and closed on every
 * exit path, including JVM shutdown.
 */
public class Supervisor implements Closeable {

    @VisibleForTesting static final String SHUTDOWN_REASON = "Runner received a termination signal";

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final RunnerSettings mSettings;
    private final WatchdogManager mWatchdogs;
    private final KmsgMonitor mKmsg;
    private final DmesgFilter mDmesgFilter;
    private final JobExecutor mExecutor;
    private final CountDownLatch mClosed = new CountDownLatch(1);
    private Thread mShutdownHook = null;

    public Supervisor(RunnerSettings settings) {
        this(settings, new WatchdogManager(), new KmsgMonitor());
    }

    @VisibleForTesting
    Supervisor(RunnerSettings settings, WatchdogManager watchdogs, KmsgMonitor kmsg) {
        mSettings = settings;
        mWatchdogs = watchdogs;
        mKmsg = kmsg;
        mDmesgFilter = new DmesgFilter(settings.isPiglitStyleDmesg(), settings.getDmesgWarnLevel());
        mExecutor = new JobExecutor(settings, watchdogs, kmsg);
    }

    /** Arms the watchdogs, starts following the kernel log and registers the shutdown hook. */
    public void open() {
        mWatchdogs.init(mSettings);
        mKmsg.start();
        mShutdownHook = new Thread(this::onShutdown, "hwrunner-shutdown");
        Runtime.getRuntime().addShutdownHook(mShutdownHook);
    }

    public WatchdogManager getWatchdogs() {
        return mWatchdogs;
    }

    public DmesgFilter getDmesgFilter() {
        return mDmesgFilter;
    }

    public JobExecutor getExecutor() {
        return mExecutor;
    }

    /** Aborts the running job and waits a while for the batch to wind down. */
    @VisibleForTesting
    void onShutdown() {
        if (mClosed.getCount() == 0) {
            return;
        }
        mExecutor.requestAbort(SHUTDOWN_REASON);
        try {
            if (!mClosed.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                CLog.e("Batch did not stop within %ds, disarming watchdogs", SHUTDOWN_WAIT_SECONDS);
                mWatchdogs.closeAll();
            }
        } catch (InterruptedException e) {
            CLog.e("Interrupted while waiting for the batch to stop");
            mWatchdogs.closeAll();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() throws IOException {
        try {
            mWatchdogs.closeAll();
            mKmsg.close();
        } finally {
            mClosed.countDown();
            removeShutdownHook();
        }
    }

    private void removeShutdownHook() {
        if (mShutdownHook == null || Thread.currentThread() == mShutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(mShutdownHook);
        } catch (IllegalStateException e) {
            CLog.d("JVM is shutting down, keeping the shutdown hook: %s", e.getMessage());
        }
        mShutdownHook = null;
    }
}
