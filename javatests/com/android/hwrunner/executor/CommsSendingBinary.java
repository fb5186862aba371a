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

import com.android.hwrunner.comms.PacketCodec;
import com.android.hwrunner.comms.RunnerPacket;
import com.android.hwrunner.comms.RunnerPacket.LogPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestResultPacket;
import com.android.hwrunner.comms.RunnerPacket.SubtestStartPacket;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;

/**
 * A test binary for the executor tests: runs subtest {@code A} over the comms socket, sending
 * {@code args[0]} log packets before the result, and exits right after the last write.
 */
public final class CommsSendingBinary {

    private CommsSendingBinary() {}

    public static void main(String[] args) throws IOException {
        int logs = Integer.parseInt(args[0]);
        String path = System.getenv(CommsListener.SOCKET_PATH_ENV);
        int pid = (int) ProcessHandle.current().pid();
        try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            channel.connect(UnixDomainSocketAddress.of(path));
            send(channel, new SubtestStartPacket("A", false), pid);
            for (int i = 0; i < logs; i++) {
                send(
                        channel,
                        new LogPacket(RunnerPacket.STREAM_STDOUT, "line " + i + "\n"),
                        pid);
            }
            send(channel, new SubtestResultPacket("A", "SUCCESS", "0.250", "", false), pid);
        }
    }

    private static void send(SocketChannel channel, RunnerPacket packet, int pid)
            throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(PacketCodec.encode(packet.setSender(pid, pid)));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}
