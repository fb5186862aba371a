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

import static com.google.common.truth.Truth.assertThat;

import com.android.hwrunner.log.LogUtil.CLog;
import com.android.hwrunner.log.LogUtil.LogLevel;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.read.ListAppender;
import ch.qos.logback.core.spi.FilterReply;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.slf4j.LoggerFactory;

/** Unit tests for {@link LogUtil}. */
@RunWith(JUnit4.class)
public class LogUtilTest {

    private Logger mLogger;
    private ListAppender<ILoggingEvent> mAppender;

    @Before
    public void setUp() {
        mLogger = (Logger) LoggerFactory.getLogger(LogUtilTest.class);
        mAppender = new ListAppender<>();
        mAppender.setContext(mLogger.getLoggerContext());
        mAppender.start();
        mLogger.addAppender(mAppender);
    }

    @After
    public void tearDown() {
        mLogger.detachAppender(mAppender);
        mAppender.stop();
    }

    @Test
    public void testLog_routedToCallerLogger() {
        CLog.w("disk %s is %d%% full", "sda", 93);

        assertThat(mAppender.list).hasSize(1);
        ILoggingEvent event = mAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getFormattedMessage()).isEqualTo("disk sda is 93% full");
        assertThat(event.getMarkerList() == null || event.getMarkerList().isEmpty()).isTrue();
    }

    @Test
    public void testLogAndDisplay_marksRecord() {
        CLog.logAndDisplay(LogLevel.ERROR, "Child refuses to die");

        assertThat(mAppender.list).hasSize(1);
        assertThat(mAppender.list.get(0).getMarkerList()).containsExactly(CLog.DISPLAY_MARKER);
    }

    @Test
    public void testConsoleAppender_skipsDisplayedRecords() throws Exception {
        LoggerContext context = new LoggerContext();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(LogUtilTest.class.getResource("/logback.xml"));
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Appender<ILoggingEvent> console = root.getAppender("STDERR");

        LoggingEvent displayed =
                new LoggingEvent(
                        CLog.class.getName(), root, Level.WARN, "Timeout.", null, null);
        displayed.addMarker(CLog.DISPLAY_MARKER);
        LoggingEvent logged =
                new LoggingEvent(
                        CLog.class.getName(), root, Level.WARN, "Timeout.", null, null);

        assertThat(console.getFilterChainDecision(displayed)).isEqualTo(FilterReply.DENY);
        assertThat(console.getFilterChainDecision(logged)).isEqualTo(FilterReply.NEUTRAL);
        context.stop();
    }
}
