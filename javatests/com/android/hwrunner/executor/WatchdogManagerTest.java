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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.android.hwrunner.config.RunnerSettings;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/** Unit tests for {@link WatchdogManager}. */
@RunWith(JUnit4.class)
public class WatchdogManagerTest {

    private IWatchdogDevice mFirst;
    private IWatchdogDevice mSecond;
    private AtomicInteger mOpened;
    private WatchdogManager mManager;
    private RunnerSettings mSettings;

    @Before
    public void setUp() throws IOException {
        mFirst = mock(IWatchdogDevice.class);
        mSecond = mock(IWatchdogDevice.class);
        when(mFirst.getName()).thenReturn("/dev/watchdog0");
        when(mSecond.getName()).thenReturn("/dev/watchdog1");
        when(mFirst.setTimeout(anyInt())).thenAnswer(invocation -> invocation.getArgument(0));
        when(mSecond.setTimeout(anyInt())).thenAnswer(invocation -> invocation.getArgument(0));
        final IWatchdogDevice[] devices = {mFirst, mSecond};
        mOpened = new AtomicInteger();
        mManager =
                new WatchdogManager(
                        index -> {
                            mOpened.incrementAndGet();
                            return index < devices.length ? devices[index] : null;
                        });
        mSettings = new RunnerSettings();
        mSettings.setUseWatchdog(true);
        mSettings.setInactivityTimeout(60);
    }

    @Test
    public void testInit_opensUntilMissing() {
        mManager.init(mSettings);

        assertThat(mManager.getDeviceCount()).isEqualTo(2);
        assertThat(mOpened.get()).isEqualTo(3);
    }

    @Test
    public void testInit_disabled() {
        mSettings.setUseWatchdog(false);
        mManager.init(mSettings);

        assertThat(mManager.getDeviceCount()).isEqualTo(0);
        assertThat(mOpened.get()).isEqualTo(0);
    }

    @Test
    public void testInit_noInactivityTimeout() {
        mSettings.setInactivityTimeout(0);
        mManager.init(mSettings);

        assertThat(mManager.getDeviceCount()).isEqualTo(0);
    }

    @Test
    public void testSetTimeout_noDevices() {
        assertThat(mManager.setTimeout(70)).isEqualTo(70);
    }

    @Test
    public void testSetTimeout_shorterTimeoutAppliedToAll() throws IOException {
        when(mSecond.setTimeout(70)).thenReturn(30);
        mManager.init(mSettings);

        assertThat(mManager.setTimeout(70)).isEqualTo(30);

        verify(mFirst).setTimeout(70);
        verify(mFirst).setTimeout(30);
        verify(mSecond).setTimeout(30);
    }

    @Test
    public void testSetTimeout_rejectingDeviceDropped() throws IOException {
        when(mFirst.setTimeout(anyInt())).thenThrow(new IOException("EINVAL"));
        mManager.init(mSettings);

        assertThat(mManager.setTimeout(70)).isEqualTo(70);

        verify(mFirst).disarm();
        assertThat(mManager.getDeviceCount()).isEqualTo(1);
    }

    @Test
    public void testPing_continuesAfterFailure() throws IOException {
        doThrow(new IOException("gone")).when(mFirst).ping();
        mManager.init(mSettings);

        mManager.ping();

        verify(mSecond).ping();
    }

    @Test
    public void testCloseAll() throws IOException {
        doThrow(new IOException("busy")).when(mFirst).disarm();
        mManager.init(mSettings);

        mManager.closeAll();
        mManager.closeAll();

        verify(mFirst).disarm();
        verify(mSecond).disarm();
        assertThat(mManager.getDeviceCount()).isEqualTo(0);
    }

    @Test
    public void testCloseAll_neverInitialized() throws IOException {
        mManager.closeAll();

        verify(mFirst, never()).disarm();
    }
}
