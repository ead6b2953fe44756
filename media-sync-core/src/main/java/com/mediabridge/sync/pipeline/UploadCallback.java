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
 * Completion hooks for one upload work item. Invoked on pipeline worker threads.
 */
public interface UploadCallback {
    UploadCallback NONE = new UploadCallback() {
    };

    /**
     * @param remoteId id of the asset on the server; null when the upload was skipped because the device asset id
     *                 already exists remotely
     */
    default void onSuccess(UploadWorkItem item, String remoteId) {
    }

    default void onFailure(UploadWorkItem item, Throwable error) {
    }
}
