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

/**
 * A decoded comms packet. Each {@link PacketType} has its own subclass carrying the payload of
 * that type; consumers switch over {@link #getType()} and cast.
 */
public abstract class RunnerPacket {

    /** Stream identifiers of {@link LogPacket}. */
    public static final int STREAM_STDOUT = 1;

    public static final int STREAM_STDERR = 2;

    private int mSenderPid = 0;
    private int mSenderTid = 0;

    public abstract PacketType getType();

    public int getSenderPid() {
        return mSenderPid;
    }

    public int getSenderTid() {
        return mSenderTid;
    }

    /** Sets the sender of the packet; returns this packet for chaining. */
    public RunnerPacket setSender(int pid, int tid) {
        mSenderPid = pid;
        mSenderTid = tid;
        return this;
    }

    /** A packet whose payload could not be read. */
    public static final class InvalidPacket extends RunnerPacket {
        private final int mRawType;

        public InvalidPacket(int rawType) {
            mRawType = rawType;
        }

        public int getRawType() {
            return mRawType;
        }

        @Override
        public PacketType getType() {
            return PacketType.INVALID;
        }
    }

    public static final class LogPacket extends RunnerPacket {
        private final int mStream;
        private final String mText;

        public LogPacket(int stream, String text) {
            mStream = stream;
            mText = text;
        }

        public int getStream() {
            return mStream;
        }

        public String getText() {
            return mText;
        }

        @Override
        public PacketType getType() {
            return PacketType.LOG;
        }
    }

    public static final class ExecPacket extends RunnerPacket {
        private final String mCmdline;

        public ExecPacket(String cmdline) {
            mCmdline = cmdline;
        }

        public String getCmdline() {
            return mCmdline;
        }

        @Override
        public PacketType getType() {
            return PacketType.EXEC;
        }
    }

    public static final class ExitPacket extends RunnerPacket {
        private final int mExitCode;
        private final String mTimeUsed;

        public ExitPacket(int exitCode, String timeUsed) {
            mExitCode = exitCode;
            mTimeUsed = timeUsed;
        }

        public int getExitCode() {
            return mExitCode;
        }

        /** Time used as text, may be null when the sender did not provide it. */
        public String getTimeUsed() {
            return mTimeUsed;
        }

        @Override
        public PacketType getType() {
            return PacketType.EXIT;
        }
    }

    public static final class SubtestStartPacket extends RunnerPacket {
        private final String mName;
        private final boolean mDynamic;

        public SubtestStartPacket(String name, boolean dynamic) {
            mName = name;
            mDynamic = dynamic;
        }

        public String getName() {
            return mName;
        }

        @Override
        public PacketType getType() {
            return mDynamic ? PacketType.DYNAMIC_SUBTEST_START : PacketType.SUBTEST_START;
        }
    }

    public static final class SubtestResultPacket extends RunnerPacket {
        private final String mName;
        private final String mResult;
        private final String mTimeUsed;
        private final String mReason;
        private final boolean mDynamic;

        public SubtestResultPacket(
                String name, String result, String timeUsed, String reason, boolean dynamic) {
            mName = name;
            mResult = result;
            mTimeUsed = timeUsed;
            mReason = reason;
            mDynamic = dynamic;
        }

        public String getName() {
            return mName;
        }

        public String getResult() {
            return mResult;
        }

        public String getTimeUsed() {
            return mTimeUsed;
        }

        public String getReason() {
            return mReason;
        }

        @Override
        public PacketType getType() {
            return mDynamic ? PacketType.DYNAMIC_SUBTEST_RESULT : PacketType.SUBTEST_RESULT;
        }
    }

    public static final class VersionStringPacket extends RunnerPacket {
        private final String mText;

        public VersionStringPacket(String text) {
            mText = text;
        }

        public String getText() {
            return mText;
        }

        @Override
        public PacketType getType() {
            return PacketType.VERSIONSTRING;
        }
    }

    public static final class ResultOverridePacket extends RunnerPacket {
        private final String mResult;

        public ResultOverridePacket(String result) {
            mResult = result;
        }

        public String getResult() {
            return mResult;
        }

        @Override
        public PacketType getType() {
            return PacketType.RESULT_OVERRIDE;
        }
    }
}
