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

import java.io.File;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One upload handed to the {@link UploadPipeline}.
 */
public class UploadWorkItem {
    private final File file;
    private final String deviceAssetId;
    private File deleteAfterUpload;
    private String filename;
    private Instant fileCreatedAt;
    private Instant fileModifiedAt;
    private Double durationSeconds;
    private Boolean favorite;
    private String livePhotoVideoId;
    private List<Map<String, Object>> metadata;
    private boolean awaitResult;
    private UploadCallback callback = UploadCallback.NONE;
    private volatile boolean skippedExisting;

    public UploadWorkItem(File file, String deviceAssetId) {
        this.file = Objects.requireNonNull(file, "file");
        this.deviceAssetId = Objects.requireNonNull(deviceAssetId, "deviceAssetId");
        this.filename = file.getName();
    }

    public File getFile() {
        return file;
    }

    /**
     * stable caller-assigned remote identifier
     */
    public String getDeviceAssetId() {
        return deviceAssetId;
    }

    /**
     * caller-owned temp file the pipeline deletes once it is done with the item, or null
     */
    public File getDeleteAfterUpload() {
        return deleteAfterUpload;
    }

    public String getFilename() {
        return filename;
    }

    public Instant getFileCreatedAt() {
        return fileCreatedAt;
    }

    public Instant getFileModifiedAt() {
        return fileModifiedAt;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public Boolean getFavorite() {
        return favorite;
    }

    public String getLivePhotoVideoId() {
        return livePhotoVideoId;
    }

    public List<Map<String, Object>> getMetadata() {
        return metadata;
    }

    /**
     * when true, {@link UploadPipeline#enqueue(UploadWorkItem)} blocks until the remote id is known
     */
    public boolean isAwaitResult() {
        return awaitResult;
    }

    public UploadCallback getCallback() {
        return callback;
    }

    /**
     * true once the pipeline dropped this item because its id already exists on the server
     */
    public boolean isSkippedExisting() {
        return skippedExisting;
    }

    void markSkippedExisting() {
        this.skippedExisting = true;
    }

    public UploadWorkItem withDeleteAfterUpload(File deleteAfterUpload) {
        this.deleteAfterUpload = deleteAfterUpload;
        return this;
    }

    public UploadWorkItem withFilename(String filename) {
        this.filename = filename;
        return this;
    }

    public UploadWorkItem withFileCreatedAt(Instant fileCreatedAt) {
        this.fileCreatedAt = fileCreatedAt;
        return this;
    }

    public UploadWorkItem withFileModifiedAt(Instant fileModifiedAt) {
        this.fileModifiedAt = fileModifiedAt;
        return this;
    }

    public UploadWorkItem withDurationSeconds(Double durationSeconds) {
        this.durationSeconds = durationSeconds;
        return this;
    }

    public UploadWorkItem withFavorite(Boolean favorite) {
        this.favorite = favorite;
        return this;
    }

    public UploadWorkItem withLivePhotoVideoId(String livePhotoVideoId) {
        this.livePhotoVideoId = livePhotoVideoId;
        return this;
    }

    public UploadWorkItem withMetadata(List<Map<String, Object>> metadata) {
        this.metadata = metadata;
        return this;
    }

    public UploadWorkItem withAwaitResult(boolean awaitResult) {
        this.awaitResult = awaitResult;
        return this;
    }

    public UploadWorkItem withCallback(UploadCallback callback) {
        this.callback = callback == null ? UploadCallback.NONE : callback;
        return this;
    }

    @Override
    public String toString() {
        return "UploadWorkItem{" + deviceAssetId + ", " + filename + "}";
    }
}
