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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.regex.Pattern;

/**
 * Decides which kernel log records are warnings worth reporting against a test.
 *
 * <p>In the default mode every record at or above the warning level is a warning unless it matches
 * one of the known harmless messages. In piglit style mode only records that match the graphics
 * driver prefixes are warnings.
 */
public class DmesgFilter {

    private static final ImmutableList<String> KNOWN_HARMLESS =
            ImmutableList.of(
                    "ACPI: button: The lid device is not compliant to SW_LID",
                    "ACPI: .*: Unable to dock!",
                    "IRQ [0-9]+: no longer affine to CPU[0-9]+",
                    "IRQ fixup: irq [0-9]+ move in progress, old vector [0-9]+",
                    // Tests set module options on purpose.
                    "Setting dangerous option [a-z_]+ - tainting kernel",
                    // Raw printk() at the default level.
                    "Suspending console\\(s\\) \\(use no_console_suspend to debug\\)",
                    "atkbd serio[0-9]+: Failed to (deactivate|enable) keyboard on"
                            + " isa[0-9]+/serio[0-9]+",
                    "cache: parent cpu[0-9]+ should not be sleeping",
                    "hpet[0-9]+: lost [0-9]+ rtc interrupts",
                    // Selftests end with ENODEV from the module load.
                    "i915: probe of [0-9a-fA-F:.]+ failed with error -25",
                    "mock: DMA: Out of SW-IOMMU space for [0-9]+ bytes",
                    "usb usb[0-9]+: root hub lost power or was reset");

    private static final String PIGLIT_STYLE_BLACKLIST = "(\\[drm:|drm_|intel_|i915_|\\[drm\\])";

    private final Pattern mPattern;
    private final boolean mPiglitStyle;
    private final int mWarnLevel;

    public DmesgFilter(boolean piglitStyle, int warnLevel) {
        mPiglitStyle = piglitStyle;
        mWarnLevel = warnLevel;
        mPattern =
                Pattern.compile(
                        piglitStyle ? PIGLIT_STYLE_BLACKLIST : Joiner.on('|').join(KNOWN_HARMLESS));
    }

    /** Whether {@code record} should be reported as a warning. */
    public boolean isWarning(KmsgRecord record) {
        if (record.getLevel() > mWarnLevel || record.isContinuation()) {
            return false;
        }
        boolean matches = mPattern.matcher(record.getMessage()).find();
        return mPiglitStyle ? matches : !matches;
    }
}
