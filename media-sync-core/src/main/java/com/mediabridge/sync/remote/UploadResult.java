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
package com.mediabridge.sync.remote;

public class UploadResult {
    public static final String STATUS_DUPLICATE = "duplicate";

    private String id;
    private String status;

    public UploadResult() {
    }

    public UploadResult(String id, String status) {
        this.id = id;
        this.status = status;
    }

    public String getId() {
        return id;
    }

    /**
     * "created" or "duplicate"
     */
    public String getStatus() {
        return status;
    }

    public boolean isDuplicate() {
        return STATUS_DUPLICATE.equalsIgnoreCase(status);
    }
}
