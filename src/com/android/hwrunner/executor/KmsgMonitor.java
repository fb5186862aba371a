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

import com.android.hwrunner.dmesg.KmsgRecord;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;

import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Follows the kernel log for the whole batch and hands every new record to the job currently
 * running. Records logged before the monitor was started are skipped.
 */
public class KmsgMonitor implements Closeable {

    private static final File KMSG_DEVICE = new File("/dev/kmsg");
    private static final File UPTIME = new File("/proc/uptime");
    private static final int BUFFER_SIZE = 8192;

    @VisibleForTesting static final long QUIET_PERIOD_MS = 250;

    private final File mDevice;
    private final LongSupplier mClockUsec;
    private final Object mLock = new Object();

    private volatile Consumer<byte[]> mSink = null;
    private volatile boolean mClosed = false;
    private FileInputStream mStream = null;
    private Thread mReader = null;
    private long mAttachUsec;

    // Guarded by mLock.
    private long mLastTimestampUsec = -1;
    private long mLastRecordNanos;
    private boolean mFinished = false;

    public KmsgMonitor() {
        this(KMSG_DEVICE, KmsgMonitor::readUptimeUsec);
    }

    /**
     * @param device the kernel log to follow
     * @param clockUsec the current time on the clock of the kernel log, in microseconds
     */
    @VisibleForTesting
    KmsgMonitor(File device, LongSupplier clockUsec) {
        mDevice = device;
        mClockUsec = clockUsec;
    }

    /**
     * Starts following the kernel log. A missing or unreadable log is only a warning.
     *
     * @return whether the log is being followed
     */
    public boolean start() {
        try {
            mStream = new FileInputStream(mDevice);
        } catch (FileNotFoundException e) {
            CLog.w("Cannot open %s: %s", mDevice, e.getMessage());
            return false;
        }
        mAttachUsec = mClockUsec.getAsLong();
        synchronized (mLock) {
            mLastRecordNanos = System.nanoTime();
        }
        mReader = new Thread(this::readLoop, "kmsg-monitor");
        mReader.setDaemon(true);
        mReader.start();
        return true;
    }

    public boolean isActive() {
        return mReader != null && !mClosed;
    }

    /** Sets where new records go; records arriving without a sink are dropped. */
    public void setSink(Consumer<byte[]> sink) {
        mSink = sink;
    }

    /**
     * Waits until the records logged so far have been handed to the sink: until a record at or
     * after the current time arrives, the log stays quiet for a while, or the log ends.
     */
    public void drain() throws InterruptedException {
        if (mReader == null) {
            return;
        }
        long fence = mClockUsec.getAsLong();
        long quietNanos = TimeUnit.MILLISECONDS.toNanos(QUIET_PERIOD_MS);
        synchronized (mLock) {
            while (!mFinished && mLastTimestampUsec < fence) {
                long idle = System.nanoTime() - mLastRecordNanos;
                if (idle >= quietNanos) {
                    break;
                }
                TimeUnit.NANOSECONDS.timedWait(mLock, quietNanos - idle);
            }
        }
    }

    private void readLoop() {
        byte[] buffer = new byte[BUFFER_SIZE];
        StringBuilder partial = new StringBuilder();
        boolean accepting = false;
        while (!mClosed) {
            int read;
            try {
                read = mStream.read(buffer);
            } catch (IOException e) {
                String message = String.valueOf(e.getMessage());
                if (message.contains("Broken pipe")) {
                    // Records were overwritten before we read them; continue with the next.
                    continue;
                }
                if (message.contains("Invalid argument")) {
                    CLog.w("Buffer too small for kernel log record, record lost.");
                    continue;
                }
                if (!mClosed) {
                    CLog.w("Error reading from kmsg, stopping monitoring: %s", message);
                }
                break;
            }
            if (read < 0) {
                break;
            }
            partial.append(new String(buffer, 0, read, StandardCharsets.ISO_8859_1));
            int newline;
            while ((newline = partial.indexOf("\n")) >= 0) {
                String line = partial.substring(0, newline + 1);
                partial.delete(0, newline + 1);
                accepting = onLine(line, accepting);
            }
        }
        synchronized (mLock) {
            mFinished = true;
            mLock.notifyAll();
        }
    }

    /** Handles one line and returns whether the lines following it belong to a new record. */
    private boolean onLine(String line, boolean accepting) {
        KmsgRecord record = line.startsWith(" ") ? null : KmsgRecord.parse(line);
        if (record != null) {
            accepting = record.getTimestampUsec() >= mAttachUsec;
        }
        Consumer<byte[]> sink = mSink;
        if (accepting && sink != null) {
            sink.accept(line.getBytes(StandardCharsets.ISO_8859_1));
        }
        // Only advertised once delivered, so drain() never returns ahead of the sink.
        if (record != null) {
            synchronized (mLock) {
                mLastTimestampUsec = Math.max(mLastTimestampUsec, record.getTimestampUsec());
                mLastRecordNanos = System.nanoTime();
                mLock.notifyAll();
            }
        }
        return accepting;
    }

    @Override
    public void close() throws IOException {
        mClosed = true;
        mSink = null;
        if (mStream != null) {
            mStream.close();
        }
    }

    /** Reads the time since boot from {@code /proc/uptime}, in microseconds. */
    private static long readUptimeUsec() {
        try {
            String uptime = FileUtil.readStringFromFile(UPTIME, StandardCharsets.US_ASCII);
            String seconds = uptime.trim().split("\\s+")[0];
            return (long) (Double.parseDouble(seconds) * 1_000_000L);
        } catch (IOException | NumberFormatException e) {
            CLog.w("Cannot read %s, keeping the whole kernel log: %s", UPTIME, e);
            return 0;
        }
    }
}
