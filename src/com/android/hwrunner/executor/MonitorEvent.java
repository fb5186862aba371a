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

import com.android.hwrunner.comms.RunnerPacket;

/** Something the monitor of a running job has to react to. */
final class MonitorEvent {

    enum Type {
        /** Bytes read from the stdout pipe of the child. */
        STDOUT,
        /** Bytes read from the stderr pipe of the child. */
        STDERR,
        /** The stdout pipe reached end of file. */
        STDOUT_CLOSED,
        /** The stderr pipe reached end of file. */
        STDERR_CLOSED,
        /** A kernel log record. */
        KMSG,
        /** A packet received on the comms socket. */
        COMMS,
        /** The child process terminated. */
        CHILD_EXITED,
        /** The operator asked to stop the batch. */
        ABORT
    }

    private final Type mType;
    private final byte[] mData;
    private final RunnerPacket mPacket;
    private final String mReason;

    private MonitorEvent(Type type, byte[] data, RunnerPacket packet, String reason) {
        mType = type;
        mData = data;
        mPacket = packet;
        mReason = reason;
    }

    static MonitorEvent data(Type type, byte[] data) {
        return new MonitorEvent(type, data, null, null);
    }

    static MonitorEvent of(Type type) {
        return new MonitorEvent(type, null, null, null);
    }

    static MonitorEvent packet(RunnerPacket packet) {
        return new MonitorEvent(Type.COMMS, null, packet, null);
    }

    static MonitorEvent abort(String reason) {
        return new MonitorEvent(Type.ABORT, null, null, reason);
    }

    Type getType() {
        return mType;
    }

    byte[] getData() {
        return mData;
    }

    RunnerPacket getPacket() {
        return mPacket;
    }

    String getReason() {
        return mReason;
    }
}
