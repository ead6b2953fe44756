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

public class RemoteAsset {
    private String id;
    private String deviceId;
    private String deviceAssetId;
    private String originalFileName;
    private String checksum;
    private boolean isFavorite;
    private String description;

    public RemoteAsset() {
    }

    public RemoteAsset(String id, String deviceId, String deviceAssetId) {
        this.id = id;
        this.deviceId = deviceId;
        this.deviceAssetId = deviceAssetId;
    }

    public String getId() {
        return id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getDeviceAssetId() {
        return deviceAssetId;
    }

    public String getOriginalFileName() {
        return originalFileName;
    }

    public String getChecksum() {
        return checksum;
    }

    public boolean isFavorite() {
        return isFavorite;
    }

    public String getDescription() {
        return description;
    }
}
