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
import com.android.hwrunner.log.LogUtil.CLog;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * The Unix domain socket a test binary sends its structured events to. Every connection carries
 * a stream of encoded packets; each decoded packet is handed to the sink.
 */
public class CommsListener implements Closeable {

    /** Environment variable telling the test binary where to connect. */
    public static final String SOCKET_PATH_ENV = "IGT_RUNNER_SOCKET_PATH";

    public static final String SOCKET_FILENAME = "comms.sock";

    private static final int MAX_PACKET_SIZE = 64 * 1024 * 1024;

    private final Path mPath;
    private final Consumer<RunnerPacket> mSink;
    private final List<SocketChannel> mClients = new ArrayList<>();
    private final List<Thread> mReaders = new ArrayList<>();
    private ServerSocketChannel mServer;
    private Selector mSelector;
    private Thread mAcceptor;
    private volatile boolean mDraining = false;
    private volatile boolean mClosed = false;

    public CommsListener(File jobDir, Consumer<RunnerPacket> sink) {
        mPath = new File(jobDir, SOCKET_FILENAME).toPath();
        mSink = sink;
    }

    public Path getPath() {
        return mPath;
    }

    /** Binds the socket and starts accepting connections. */
    public void start() throws IOException {
        Files.deleteIfExists(mPath);
        mServer = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        mServer.bind(UnixDomainSocketAddress.of(mPath));
        mServer.configureBlocking(false);
        mSelector = Selector.open();
        mServer.register(mSelector, SelectionKey.OP_ACCEPT);
        mAcceptor = new Thread(this::acceptLoop, "comms-acceptor");
        mAcceptor.setDaemon(true);
        mAcceptor.start();
    }

    /**
     * Accepts connections until closed. Once draining starts, one last pass takes whatever is
     * still in the backlog.
     */
    private void acceptLoop() {
        try {
            while (!mClosed) {
                boolean last = mDraining;
                if (last) {
                    mSelector.selectNow();
                } else {
                    mSelector.select();
                }
                mSelector.selectedKeys().clear();
                SocketChannel client;
                while ((client = mServer.accept()) != null) {
                    startReader(client);
                }
                if (last) {
                    return;
                }
            }
        } catch (ClosedChannelException | ClosedSelectorException e) {
            CLog.d("Comms socket %s closed", mPath);
        } catch (IOException e) {
            if (!mClosed) {
                CLog.w("Cannot accept comms connection on %s: %s", mPath, e);
            }
        }
    }

    private void startReader(SocketChannel client) {
        Thread reader = new Thread(() -> readLoop(client), "comms-reader");
        reader.setDaemon(true);
        synchronized (mClients) {
            mClients.add(client);
            mReaders.add(reader);
        }
        reader.start();
    }

    private void readLoop(SocketChannel client) {
        ByteBuffer header =
                ByteBuffer.allocate(PacketCodec.HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        try {
            while (true) {
                header.clear();
                if (!readFully(client, header)) {
                    return;
                }
                int size = header.getInt(0);
                if (size < PacketCodec.HEADER_SIZE || size > MAX_PACKET_SIZE) {
                    CLog.w("Dropping comms connection: bad packet size %d", size);
                    return;
                }
                ByteBuffer packet = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
                header.flip();
                packet.put(header);
                if (!readFully(client, packet)) {
                    CLog.w("Comms connection closed in the middle of a packet");
                    return;
                }
                packet.flip();
                mSink.accept(PacketCodec.decode(packet));
            }
        } catch (ClosedChannelException e) {
            CLog.d("Comms connection closed");
        } catch (IOException e) {
            if (!mClosed) {
                CLog.w("Error reading comms: %s", e);
            }
        } finally {
            try {
                client.close();
            } catch (IOException e) {
                CLog.w("Failed to close comms connection: %s", e);
            }
        }
    }

    /** Fills the buffer; returns false if the stream ends first. */
    private static boolean readFully(SocketChannel client, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            if (client.read(buffer) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Stops accepting connections and waits until every accepted connection has been read to its
     * end, so all packets the child sent have reached the sink.
     *
     * @return false if some connection was still open when the wait ran out
     */
    public boolean awaitDisconnect(long timeoutMillis) throws IOException, InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        mDraining = true;
        if (mAcceptor != null) {
            mSelector.wakeup();
            mAcceptor.join(remainingMillis(deadline));
        }
        if (mServer != null) {
            mServer.close();
        }
        List<Thread> readers;
        synchronized (mClients) {
            readers = new ArrayList<>(mReaders);
        }
        boolean done = true;
        for (Thread reader : readers) {
            reader.join(remainingMillis(deadline));
            if (reader.isAlive()) {
                done = false;
            }
        }
        if (!done) {
            CLog.w("Comms connections on %s still open after %dms", mPath, timeoutMillis);
        }
        return done;
    }

    /** Milliseconds left until the deadline, at least 1 so join never waits forever. */
    private static long remainingMillis(long deadline) {
        return Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
    }

    @Override
    public void close() throws IOException {
        mClosed = true;
        if (mSelector != null) {
            mSelector.close();
        }
        if (mServer != null) {
            mServer.close();
        }
        synchronized (mClients) {
            for (SocketChannel client : mClients) {
                client.close();
            }
            mClients.clear();
            mReaders.clear();
        }
        Files.deleteIfExists(mPath);
    }
}
