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

import com.android.hwrunner.config.OutputFile;
import com.android.hwrunner.util.FileUtil;

import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * The output files of a running job, opened for appending so that a resumed job continues the
 * files of its previous attempts. A file left without a final newline gets one first, so new
 * records always start on a line of their own.
 */
public class JobOutputs implements Closeable {

    private final Map<OutputFile, FileOutputStream> mStreams = new EnumMap<>(OutputFile.class);
    private final boolean mSync;

    /**
     * Opens the output files in {@code jobDir}.
     *
     * @param withComms whether the comms dump is opened as well
     * @param sync whether every write is forced to disk
     */
    public JobOutputs(File jobDir, boolean withComms, boolean sync) throws IOException {
        mSync = sync;
        try {
            for (OutputFile output : OutputFile.values()) {
                if (output == OutputFile.COMMS && !withComms) {
                    continue;
                }
                mStreams.put(output, openAtEnd(output.in(jobDir)));
            }
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    private static FileOutputStream openAtEnd(File file) throws IOException {
        boolean needsNewline = file.exists() && !FileUtil.endsWithNewline(file);
        FileOutputStream stream = new FileOutputStream(file, true);
        if (needsNewline) {
            stream.write('\n');
        }
        return stream;
    }

    /** Whether {@code output} was opened. */
    public boolean has(OutputFile output) {
        return mStreams.containsKey(output);
    }

    /** Appends raw bytes. */
    public void write(OutputFile output, byte[] data) throws IOException {
        write(output, data, 0, data.length);
    }

    public void write(OutputFile output, byte[] data, int offset, int length) throws IOException {
        FileOutputStream stream = mStreams.get(output);
        if (stream == null) {
            return;
        }
        stream.write(data, offset, length);
        if (mSync) {
            stream.getFD().sync();
        }
    }

    /** Appends text; test output text maps one char per byte. */
    public void write(OutputFile output, String text) throws IOException {
        write(output, text.getBytes(StandardCharsets.ISO_8859_1));
    }

    /** Forces every file to disk. */
    public void sync() throws IOException {
        for (FileOutputStream stream : mStreams.values()) {
            stream.getFD().sync();
        }
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (FileOutputStream stream : mStreams.values()) {
            try {
                stream.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        mStreams.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
