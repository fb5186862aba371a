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
package com.android.hwrunner.util;

import com.android.hwrunner.log.LogUtil.CLog;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/** A helper class for file related operations. */
public class FileUtil {

    private FileUtil() {}

    /** Deletes a file, logging when the deletion fails. Does nothing for a null or absent file. */
    public static void deleteFile(File file) {
        if (file != null && file.exists() && !file.delete()) {
            CLog.w("Failed to delete %s", file.getAbsolutePath());
        }
    }

    /**
     * A helper method for writing string data to file
     *
     * @param inputString the input {@link String}
     * @param destFile the destination file to write to
     */
    public static void writeToFile(String inputString, File destFile) throws IOException {
        writeToFile(inputString, destFile, false);
    }

    /**
     * A helper method for writing or appending string data to file
     *
     * @param inputString the input {@link String}
     * @param destFile the destination file to write or append to
     * @param append append to end of file if true, overwrite otherwise
     */
    public static void writeToFile(String inputString, File destFile, boolean append)
            throws IOException {
        try (OutputStream out = new FileOutputStream(destFile, append)) {
            out.write(inputString.getBytes(StandardCharsets.UTF_8));
        }
    }

    /** Reads the whole file as a UTF-8 string. */
    public static String readStringFromFile(File sourceFile) throws IOException {
        return new String(Files.readAllBytes(sourceFile.toPath()), StandardCharsets.UTF_8);
    }

    /**
     * Reads the whole file in the given charset. Test output is read as ISO-8859-1 so every byte
     * maps to exactly one char.
     */
    public static String readStringFromFile(File sourceFile, Charset charset) throws IOException {
        return new String(Files.readAllBytes(sourceFile.toPath()), charset);
    }

    /** Reads the whole file as raw bytes. */
    public static byte[] readBytesFromFile(File sourceFile) throws IOException {
        return Files.readAllBytes(sourceFile.toPath());
    }

    /**
     * Returns true if the file is empty or ends with a newline. Used before appending to a file
     * left behind by an interrupted run, so that new records always start on their own line.
     */
    public static boolean endsWithNewline(File file) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
            long length = raf.length();
            if (length == 0) {
                return true;
            }
            raf.seek(length - 1);
            return raf.read() == '\n';
        }
    }
}
