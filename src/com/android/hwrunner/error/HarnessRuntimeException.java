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
package com.android.hwrunner.error;

/** Runtime version of the runner exceptions, carrying an {@link ErrorIdentifier}. */
public class HarnessRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorIdentifier mErrorId;

    /**
     * Constructor for the exception.
     *
     * @param message The message associated with the exception
     * @param errorId The {@link ErrorIdentifier} categorizing the exception.
     */
    public HarnessRuntimeException(String message, ErrorIdentifier errorId) {
        super(message);
        mErrorId = errorId;
    }

    /**
     * Constructor for the exception.
     *
     * @param message The message associated with the exception
     * @param cause The cause of the exception
     * @param errorId The {@link ErrorIdentifier} categorizing the exception.
     */
    public HarnessRuntimeException(String message, Throwable cause, ErrorIdentifier errorId) {
        super(message, cause);
        mErrorId = errorId;
    }

    /** Returns the {@link ErrorIdentifier} associated with the exception. Can be null. */
    public ErrorIdentifier getErrorId() {
        return mErrorId;
    }

    @Override
    public String toString() {
        if (mErrorId == null) {
            return super.toString();
        }
        return String.format("%s [%s|%d]", super.toString(), mErrorId.name(), mErrorId.code());
    }
}
