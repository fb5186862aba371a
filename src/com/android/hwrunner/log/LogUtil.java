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
package com.android.hwrunner.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.io.PrintStream;
import java.util.Optional;

/** A logging utility class shared by the runner components. */
public class LogUtil {

    /** Log severities understood by {@link CLog#logAndDisplay}. */
    public enum LogLevel {
        VERBOSE,
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    private LogUtil() {}

    /**
     * Class for host-side logging. Every message is tagged with the simple name of the class that
     * issued it, and routed to the SLF4J logger of that class.
     */
    public static class CLog {

        /**
         * Marks the records of {@link #logAndDisplay}. Console appenders filter them out since the
         * message is already on the display stream.
         */
        public static final Marker DISPLAY_MARKER = MarkerFactory.getMarker("DISPLAY");

        private static final StackWalker WALKER =
                StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

        private static final PrintStream DISPLAY_STREAM = System.out;

        private CLog() {}

        /** Log a verbose message. */
        public static void v(String format, Object... args) {
            Logger logger = getLogger();
            if (logger.isTraceEnabled()) {
                logger.trace(format(format, args));
            }
        }

        /** Log a debug message. */
        public static void d(String format, Object... args) {
            Logger logger = getLogger();
            if (logger.isDebugEnabled()) {
                logger.debug(format(format, args));
            }
        }

        /** Log an info message. */
        public static void i(String format, Object... args) {
            getLogger().info(format(format, args));
        }

        /** Log a warning message. */
        public static void w(String format, Object... args) {
            getLogger().warn(format(format, args));
        }

        /** Log an error message. */
        public static void e(String format, Object... args) {
            getLogger().error(format(format, args));
        }

        /** Log the stack trace of a {@link Throwable} at error level. */
        public static void e(Throwable t) {
            getLogger().error(t.getMessage(), t);
        }

        /**
         * Log a message and also print it on the display stream, for lines the operator must see
         * regardless of the logging configuration.
         */
        public static void logAndDisplay(LogLevel level, String format, Object... args) {
            String message = format(format, args);
            Logger logger = getLogger();
            switch (level) {
                case VERBOSE:
                    logger.trace(DISPLAY_MARKER, message);
                    break;
                case DEBUG:
                    logger.debug(DISPLAY_MARKER, message);
                    break;
                case INFO:
                    logger.info(DISPLAY_MARKER, message);
                    break;
                case WARN:
                    logger.warn(DISPLAY_MARKER, message);
                    break;
                case ERROR:
                default:
                    logger.error(DISPLAY_MARKER, message);
                    break;
            }
            DISPLAY_STREAM.println(message);
            DISPLAY_STREAM.flush();
        }

        private static String format(String format, Object... args) {
            if (args == null || args.length == 0) {
                return format;
            }
            return String.format(format, args);
        }

        private static Logger getLogger() {
            Optional<Class<?>> caller =
                    WALKER.walk(
                            frames ->
                                    frames.map(StackWalker.StackFrame::getDeclaringClass)
                                            .filter(c -> c != CLog.class)
                                            .findFirst());
            return LoggerFactory.getLogger(caller.isPresent() ? caller.get() : CLog.class);
        }
    }
}
