/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.mediabridge.sync.pipeline;

/**
 * Thrown to a caller waiting synchronously on an upload that failed or was cancelled.
 */
public class UploadException extends Exception {
    private final boolean cancelled;

    public static UploadException cancelled(String deviceAssetId) {
        return new UploadException("upload cancelled (" + deviceAssetId + ")", null, true);
    }

    public UploadException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private UploadException(String message, Throwable cause, boolean cancelled) {
        super(message, cause);
        this.cancelled = cancelled;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
