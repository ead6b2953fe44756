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

import java.io.File;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything sent with one multipart asset upload.
 */
public class UploadRequest {
    private File file;
    private String deviceId;
    private String deviceAssetId;
    private Instant fileCreatedAt;
    private Instant fileModifiedAt;
    private String filename;
    private Double durationSeconds;
    private Boolean favorite;
    private String livePhotoVideoId;
    private List<Map<String, Object>> metadata;
    private String checksum;

    public File getFile() {
        return file;
    }

    public void setFile(File file) {
        this.file = file;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public String getDeviceAssetId() {
        return deviceAssetId;
    }

    public void setDeviceAssetId(String deviceAssetId) {
        this.deviceAssetId = deviceAssetId;
    }

    public Instant getFileCreatedAt() {
        return fileCreatedAt;
    }

    public void setFileCreatedAt(Instant fileCreatedAt) {
        this.fileCreatedAt = fileCreatedAt;
    }

    public Instant getFileModifiedAt() {
        return fileModifiedAt;
    }

    public void setFileModifiedAt(Instant fileModifiedAt) {
        this.fileModifiedAt = fileModifiedAt;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public Boolean getFavorite() {
        return favorite;
    }

    public void setFavorite(Boolean favorite) {
        this.favorite = favorite;
    }

    public String getLivePhotoVideoId() {
        return livePhotoVideoId;
    }

    public void setLivePhotoVideoId(String livePhotoVideoId) {
        this.livePhotoVideoId = livePhotoVideoId;
    }

    public List<Map<String, Object>> getMetadata() {
        return metadata;
    }

    public void setMetadata(List<Map<String, Object>> metadata) {
        this.metadata = metadata;
    }

    /**
     * hex SHA-1 of the file, sent as a request header when known
     */
    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    @Override
    public String toString() {
        return "UploadRequest{" + deviceAssetId + ", " + filename + "}";
    }
}
