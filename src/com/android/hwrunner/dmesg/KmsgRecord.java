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
package com.android.hwrunner.dmesg;

import com.android.hwrunner.log.LogUtil.CLog;

/**
 * One record of the kernel log as read from {@code /dev/kmsg}: {@code
 * <flags>,<seq>,<usec>,<cont>[,...];<message>}. Continuation lines of a record start with a space
 * and carry machine readable key/value pairs; they are not records of their own.
 */
public final class KmsgRecord {

    private final int mFlags;
    private final long mSequence;
    private final long mTimestampUsec;
    private final char mContinuation;
    private final String mMessage;

    KmsgRecord(int flags, long sequence, long timestampUsec, char continuation, String message) {
        mFlags = flags;
        mSequence = sequence;
        mTimestampUsec = timestampUsec;
        mContinuation = continuation;
        mMessage = message;
    }

    /** The syslog priority of the record, 0 (emergency) to 7 (debug). */
    public int getLevel() {
        return mFlags & 0x07;
    }

    public long getSequence() {
        return mSequence;
    }

    /** Microseconds of CLOCK_MONOTONIC when the record was logged. */
    public long getTimestampUsec() {
        return mTimestampUsec;
    }

    /** True for a fragment continuing a previous record. */
    public boolean isContinuation() {
        return mContinuation == 'c';
    }

    /** The message text, including its newline if the record line had one. */
    public String getMessage() {
        return mMessage;
    }

    /**
     * Parses a record line. Returns null for lines that are not records; key/value lines
     * (starting with a space) are skipped quietly, anything else is logged.
     */
    public static KmsgRecord parse(String line) {
        int semicolon = line.indexOf(';');
        String[] fields =
                semicolon < 0 ? new String[0] : line.substring(0, semicolon).split(",", 5);
        if (fields.length < 4 || fields[3].isEmpty()) {
            if (!line.startsWith(" ")) {
                CLog.w("Cannot parse kmsg record: %s", line.trim());
            }
            return null;
        }
        try {
            return new KmsgRecord(
                    (int) Long.parseLong(fields[0].trim()),
                    Long.parseLong(fields[1].trim()),
                    Long.parseLong(fields[2].trim()),
                    fields[3].charAt(0),
                    line.substring(semicolon + 1));
        } catch (NumberFormatException e) {
            if (!line.startsWith(" ")) {
                CLog.w("Cannot parse kmsg record: %s (%s)", line.trim(), e.getMessage());
            }
            return null;
        }
    }

    /**
     * The human readable form of the record: {@code <level> [sec.usec] message}, with the
     * {@code \xHH} escapes the kernel applies to unprintable bytes decoded back where the byte is
     * printable or whitespace.
     */
    public String format() {
        StringBuilder formatted =
                new StringBuilder(
                        String.format(
                                "<%d> [%d.%06d] ",
                                getLevel(),
                                mTimestampUsec / 1000000,
                                mTimestampUsec % 1000000));
        String message = mMessage;
        int length = message.length();
        for (int p = 0; p < length; p++) {
            char c = message.charAt(p);
            if (p + 4 < length && c == '\\' && message.charAt(p + 1) == 'x') {
                int decoded = parseHexByte(message, p + 2);
                if (decoded >= 0 && (isPrint(decoded) || isSpace(decoded))) {
                    formatted.append((char) decoded);
                    p += 3;
                    continue;
                }
            }
            formatted.append(c);
        }
        return formatted.toString();
    }

    private static int parseHexByte(String text, int pos) {
        int first = Character.digit(text.charAt(pos), 16);
        if (first < 0) {
            return -1;
        }
        int second = Character.digit(text.charAt(pos + 1), 16);
        // A single hex digit is a valid escape as well.
        return second < 0 ? first : first * 16 + second;
    }

    private static boolean isPrint(int c) {
        return c >= 0x20 && c < 0x7f;
    }

    private static boolean isSpace(int c) {
        return c == ' ' || (c >= '\t' && c <= '\r');
    }
}
