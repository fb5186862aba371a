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

import com.android.hwrunner.comms.RunnerPacket.InvalidPacket;
import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.util.FileUtil;

import com.google.common.annotations.VisibleForTesting;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The on-disk form of a job's comms stream: every packet is preceded by a 32 bit canary so a
 * corrupted or truncated dump is detected instead of misparsed.
 */
public class CommsDump {

    public static final String COMMS_FILENAME = "comms";

    /** 'IGT1' as a little-endian u32. */
    public static final int CANARY = ('I' << 24) | ('G' << 16) | ('T' << 8) | '1';

    /** Outcome of reading a dump. */
    public enum Status {
        /** The test used comms: at least one packet sent by the test binary itself. */
        SUCCESS,
        /** No dump, an empty dump, or only the packets the runner writes itself. */
        EMPTY,
        /** Bad canary or truncated data. */
        ERROR
    }

    /** Packets read from a dump together with the overall status. */
    public static class ReadResult {
        private final Status mStatus;
        private final List<RunnerPacket> mPackets;

        ReadResult(Status status, List<RunnerPacket> packets) {
            mStatus = status;
            mPackets = Collections.unmodifiableList(packets);
        }

        public Status getStatus() {
            return mStatus;
        }

        public List<RunnerPacket> getPackets() {
            return mPackets;
        }
    }

    private CommsDump() {}

    /** Appends a canary and the encoded packet to the stream. */
    public static void writePacket(OutputStream out, RunnerPacket packet) throws IOException {
        out.write(encodeWithCanary(packet));
    }

    /** Returns the bytes {@link #writePacket} would write. */
    public static byte[] encodeWithCanary(RunnerPacket packet) {
        byte[] encoded = PacketCodec.encode(packet);
        ByteBuffer buffer =
                ByteBuffer.allocate(Integer.BYTES + encoded.length)
                        .order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(CANARY);
        buffer.put(encoded);
        return buffer.array();
    }

    /** Reads the dump in {@code file}; a missing file reads as {@link Status#EMPTY}. */
    public static ReadResult read(File file) throws IOException {
        if (file == null || !file.exists()) {
            return new ReadResult(Status.EMPTY, new ArrayList<>());
        }
        return parse(FileUtil.readBytesFromFile(file));
    }

    @VisibleForTesting
    static ReadResult parse(byte[] data) {
        List<RunnerPacket> packets = new ArrayList<>();
        Status status = Status.EMPTY;
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        while (buffer.hasRemaining()) {
            if (buffer.remaining() < Integer.BYTES) {
                CLog.e("Error parsing comms: truncated canary at offset %d", buffer.position());
                return new ReadResult(Status.ERROR, packets);
            }
            int canary = buffer.getInt();
            if (canary != CANARY) {
                CLog.e(
                        "Invalid canary while parsing comms: %d, expected %d",
                        Integer.toUnsignedLong(canary), CANARY);
                return new ReadResult(Status.ERROR, packets);
            }
            if (buffer.remaining() < PacketCodec.HEADER_SIZE) {
                CLog.e("Error parsing comms: Expected packet after canary, truncated file?");
                return new ReadResult(Status.ERROR, packets);
            }
            long size = Integer.toUnsignedLong(buffer.getInt(buffer.position()));
            if (size < PacketCodec.HEADER_SIZE || buffer.remaining() < size) {
                CLog.e("Error parsing comms: Unexpected end of file, truncated file?");
                return new ReadResult(Status.ERROR, packets);
            }
            RunnerPacket packet = PacketCodec.decode(buffer);
            buffer.position(buffer.position() + (int) size);

            int rawType = buffer.getInt(buffer.position() - (int) size + Integer.BYTES);
            if (!isWrittenByRunner(rawType)) {
                status = Status.SUCCESS;
            }
            if (packet.getType() == PacketType.INVALID) {
                CLog.w(
                        "Skipping invalid comms packet of type %d",
                        ((InvalidPacket) packet).getRawType());
                continue;
            }
            packets.add(packet);
        }
        return new ReadResult(status, packets);
    }

    /**
     * Whether packets of this type are written into the dump by the runner: EXEC before the
     * spawn, RESULT_OVERRIDE on a timeout and EXIT once the child is gone. Only the other types
     * show that the test binary talked to the socket.
     */
    @VisibleForTesting
    static boolean isWrittenByRunner(int rawType) {
        return rawType == PacketType.EXEC.getCode()
                || rawType == PacketType.RESULT_OVERRIDE.getCode()
                || rawType == PacketType.EXIT.getCode();
    }
}
