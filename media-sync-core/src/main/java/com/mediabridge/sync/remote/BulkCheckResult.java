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

public class BulkCheckResult {
    public static final String ACTION_ACCEPT = "accept";
    public static final String ACTION_REJECT = "reject";
    public static final String REASON_DUPLICATE = "duplicate";

    private String id;
    private String action;
    private String reason;
    private String assetId;

    public BulkCheckResult() {
    }

    public BulkCheckResult(String id, String action, String reason, String assetId) {
        this.id = id;
        this.action = action;
        this.reason = reason;
        this.assetId = assetId;
    }

    /**
     * true when the server already holds byte-identical content
     */
    public boolean isDuplicate() {
        return ACTION_REJECT.equalsIgnoreCase(action) && REASON_DUPLICATE.equalsIgnoreCase(reason);
    }

    public String getId() {
        return id;
    }

    public String getAction() {
        return action;
    }

    public String getReason() {
        return reason;
    }

    /**
     * id of the existing asset on the server, for duplicates
     */
    public String getAssetId() {
        return assetId;
    }

    @Override
    public String toString() {
        return id + ": " + action + (reason == null ? "" : " (" + reason + ")");
    }
}
