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

import com.android.hwrunner.log.LogUtil.CLog;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;

/** Moves the bytes of a child pipe into the monitor queue, then reports end of file. */
class StreamPump implements Runnable {

    private static final int BUFFER_SIZE = 2048;

    private final InputStream mInput;
    private final MonitorEvent.Type mDataType;
    private final MonitorEvent.Type mClosedType;
    private final BlockingQueue<MonitorEvent> mQueue;

    StreamPump(
            InputStream input,
            MonitorEvent.Type dataType,
            MonitorEvent.Type closedType,
            BlockingQueue<MonitorEvent> queue) {
        mInput = input;
        mDataType = dataType;
        mClosedType = closedType;
        mQueue = queue;
    }

    /** Starts pumping on a daemon thread. */
    Thread start(String name) {
        Thread thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            int read;
            while ((read = mInput.read(buffer)) >= 0) {
                if (read > 0) {
                    mQueue.add(MonitorEvent.data(mDataType, Arrays.copyOf(buffer, read)));
                }
            }
        } catch (IOException e) {
            CLog.e("Error reading test's %s: %s", mDataType.name().toLowerCase(), e.getMessage());
        } finally {
            try {
                mInput.close();
            } catch (IOException e) {
                CLog.w("Failed to close %s pipe: %s", mDataType.name().toLowerCase(), e);
            }
            mQueue.add(MonitorEvent.of(mClosedType));
        }
    }
}
