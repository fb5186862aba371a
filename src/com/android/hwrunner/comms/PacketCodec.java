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

import com.android.hwrunner.comms.RunnerPacket.ExecPacket;
import com.android.hwrunner.comms.RunnerPacket.ExitPacket;
import com.android.hwrunner.comms.RunnerPacket.InvalidPacket;
import com.android.hwrunner.comms.RunnerPacket.LogPacket;
import com.android.hwrunner.comms.RunnerPacket.ResultOverridePacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestResultPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestStartPacket;
import com.android.hwrunner.comms.RunnerPacket.VersionStringPacket;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Binary encoding of {@link RunnerPacket}s.
 *
 * <p>A packet is a 16 byte header followed by the payload: u32 full size of the packet in
 * octets, u32 type, i32 sender pid, i32 sender tid. All integers are little-endian and strings
 * are NUL-terminated. Strings are mapped byte-per-char (ISO-8859-1) so that arbitrary test output
 * survives decoding unchanged.
 */
public class PacketCodec {

    public static final int HEADER_SIZE = 16;

    private PacketCodec() {}

    /** Encodes a packet, header included. */
    public static byte[] encode(RunnerPacket packet) {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        switch (packet.getType()) {
            case LOG:
                LogPacket log = (LogPacket) packet;
                payload.write(log.getStream());
                writeCString(payload, log.getText());
                break;
            case EXEC:
                writeCString(payload, ((ExecPacket) packet).getCmdline());
                break;
            case EXIT:
                ExitPacket exit = (ExitPacket) packet;
                writeInt(payload, exit.getExitCode());
                writeCString(payload, exit.getTimeUsed());
                break;
            case SUBTEST_START:
            case DYNAMIC_SUBTEST_START:
                writeCString(payload, ((SubtestStartPacket) packet).getName());
                break;
            case SUBTEST_RESULT:
            case DYNAMIC_SUBTEST_RESULT:
                SubtestResultPacket result = (SubtestResultPacket) packet;
                writeCString(payload, result.getName());
                writeCString(payload, result.getResult());
                writeCString(payload, result.getTimeUsed());
                writeCString(payload, result.getReason());
                break;
            case VERSIONSTRING:
                writeCString(payload, ((VersionStringPacket) packet).getText());
                break;
            case RESULT_OVERRIDE:
                writeCString(payload, ((ResultOverridePacket) packet).getResult());
                break;
            case INVALID:
            default:
                break;
        }
        byte[] data = payload.toByteArray();
        ByteBuffer buffer =
                ByteBuffer.allocate(HEADER_SIZE + data.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(HEADER_SIZE + data.length);
        buffer.putInt(packet.getType().getCode());
        buffer.putInt(packet.getSenderPid());
        buffer.putInt(packet.getSenderTid());
        buffer.put(data);
        return buffer.array();
    }

    /**
     * Decodes one packet. The buffer must be positioned at the packet header and hold at least
     * the number of bytes announced by the header. A payload missing a mandatory field decodes as
     * an {@link InvalidPacket}.
     */
    public static RunnerPacket decode(ByteBuffer buffer) {
        ByteBuffer packet = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
        int size = packet.getInt();
        int rawType = packet.getInt();
        int pid = packet.getInt();
        int tid = packet.getInt();
        if (size < HEADER_SIZE) {
            return new InvalidPacket(rawType);
        }
        packet.limit(size);
        RunnerPacket decoded = decodePayload(PacketType.fromCode(rawType), rawType, packet);
        return decoded.setSender(pid, tid);
    }

    private static RunnerPacket decodePayload(PacketType type, int rawType, ByteBuffer data) {
        switch (type) {
            case LOG:
                {
                    int stream = data.remaining() >= 1 ? (data.get() & 0xff) : 0;
                    String text = readCString(data);
                    return text == null ? new InvalidPacket(rawType) : new LogPacket(stream, text);
                }
            case EXEC:
                {
                    String cmdline = readCString(data);
                    return cmdline == null ? new InvalidPacket(rawType) : new ExecPacket(cmdline);
                }
            case EXIT:
                {
                    int exitCode = data.remaining() >= 4 ? data.getInt() : 0;
                    return new ExitPacket(exitCode, readCString(data));
                }
            case SUBTEST_START:
            case DYNAMIC_SUBTEST_START:
                {
                    String name = readCString(data);
                    return name == null
                            ? new InvalidPacket(rawType)
                            : new SubtestStartPacket(
                                    name, type == PacketType.DYNAMIC_SUBTEST_START);
                }
            case SUBTEST_RESULT:
            case DYNAMIC_SUBTEST_RESULT:
                {
                    String name = readCString(data);
                    String result = readCString(data);
                    String timeUsed = readCString(data);
                    String reason = readCString(data);
                    if (name == null || result == null) {
                        return new InvalidPacket(rawType);
                    }
                    return new SubtestResultPacket(
                            name,
                            result,
                            timeUsed,
                            reason,
                            type == PacketType.DYNAMIC_SUBTEST_RESULT);
                }
            case VERSIONSTRING:
                {
                    String text = readCString(data);
                    return text == null
                            ? new InvalidPacket(rawType)
                            : new VersionStringPacket(text);
                }
            case RESULT_OVERRIDE:
                {
                    String result = readCString(data);
                    return result == null
                            ? new InvalidPacket(rawType)
                            : new ResultOverridePacket(result);
                }
            case INVALID:
            default:
                return new InvalidPacket(rawType);
        }
    }

    /** Reads a NUL-terminated string, or returns null without consuming if there is none. */
    private static String readCString(ByteBuffer data) {
        int start = data.position();
        for (int i = start; i < data.limit(); i++) {
            if (data.get(i) == 0) {
                byte[] bytes = new byte[i - start];
                data.get(bytes);
                data.get();
                return new String(bytes, StandardCharsets.ISO_8859_1);
            }
        }
        return null;
    }

    private static void writeCString(ByteArrayOutputStream out, String value) {
        if (value == null) {
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.ISO_8859_1);
        out.write(bytes, 0, bytes.length);
        out.write(0);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write(value & 0xff);
        out.write((value >> 8) & 0xff);
        out.write((value >> 16) & 0xff);
        out.write((value >> 24) & 0xff);
    }
}
