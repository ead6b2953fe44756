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
package com.mediabridge.sync.config;

import com.mediabridge.sync.config.annotation.Option;

import javax.xml.bind.annotation.XmlRootElement;

/**
 * Settings for the remote photo server sink. A run uploads only when this object is present in the job config.
 */
@XmlRootElement
public class UploadOptions {
    public static final String DEFAULT_DEVICE_ID = "media-sync";
    public static final int DEFAULT_BATCH_SIZE = 5000;
    public static final int DEFAULT_EXIST_CHECK_CONCURRENCY = 6;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;
    public static final int MIN_IN_FLIGHT = 8;

    public static int defaultConcurrency() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    private String serverUrl;
    private String apiKey;
    private String deviceId = DEFAULT_DEVICE_ID;
    private int uploadConcurrency = defaultConcurrency();
    private int hashConcurrency = defaultConcurrency();
    private int existCheckConcurrency = DEFAULT_EXIST_CHECK_CONCURRENCY;
    private int bulkCheckBatchSize = DEFAULT_BATCH_SIZE;
    private int existBatchSize = DEFAULT_BATCH_SIZE;
    private int maxInFlight;
    private boolean checksumPrecheck = true;
    private boolean skipHash;
    private boolean syncAlbums;
    private boolean updateChangedAssets;
    private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;

    @Option(orderIndex = 10, required = true, valueHint = "url", description = "Base URL of the remote photo server (the /api suffix is optional). Enables uploading")
    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    @Option(orderIndex = 20, required = true, sensitive = true, description = "API key sent with every request to the remote server")
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    @Option(orderIndex = 30, description = "Device id that owns the uploaded assets. Default is " + DEFAULT_DEVICE_ID)
    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    @Option(orderIndex = 40, description = "Maximum number of simultaneous uploads. Default is the number of processors minus one")
    public int getUploadConcurrency() {
        return uploadConcurrency;
    }

    public void setUploadConcurrency(int uploadConcurrency) {
        this.uploadConcurrency = uploadConcurrency;
    }

    @Option(orderIndex = 50, advanced = true, description = "Maximum number of files hashed at the same time. Default is the number of processors minus one")
    public int getHashConcurrency() {
        return hashConcurrency;
    }

    public void setHashConcurrency(int hashConcurrency) {
        this.hashConcurrency = hashConcurrency;
    }

    @Option(orderIndex = 60, advanced = true, description = "Maximum number of existence-check batches sent at the same time during the up-front sweep (never more than the upload concurrency). Default is " + DEFAULT_EXIST_CHECK_CONCURRENCY)
    public int getExistCheckConcurrency() {
        return existCheckConcurrency;
    }

    public void setExistCheckConcurrency(int existCheckConcurrency) {
        this.existCheckConcurrency = existCheckConcurrency;
    }

    @Option(orderIndex = 70, advanced = true, description = "Number of checksums sent in one bulk duplicate check. Default is " + DEFAULT_BATCH_SIZE)
    public int getBulkCheckBatchSize() {
        return bulkCheckBatchSize;
    }

    public void setBulkCheckBatchSize(int bulkCheckBatchSize) {
        this.bulkCheckBatchSize = bulkCheckBatchSize;
    }

    @Option(orderIndex = 80, advanced = true, description = "Number of ids sent in one existence check. Default is " + DEFAULT_BATCH_SIZE)
    public int getExistBatchSize() {
        return existBatchSize;
    }

    public void setExistBatchSize(int existBatchSize) {
        this.existBatchSize = existBatchSize;
    }

    @Option(orderIndex = 90, advanced = true, description = "Maximum number of files accepted by the upload pipeline but not yet finished. 0 (default) means the larger of " + MIN_IN_FLIGHT + " and four times the upload concurrency")
    public int getMaxInFlight() {
        return maxInFlight;
    }

    public void setMaxInFlight(int maxInFlight) {
        this.maxInFlight = maxInFlight;
    }

    @Option(orderIndex = 100, cliInverted = true, cliName = "no-checksum-precheck", description = "By default, file checksums are checked against the server in bulk before uploading so that content the server already holds is never sent twice. Use this option to disable the precheck")
    public boolean isChecksumPrecheck() {
        return checksumPrecheck;
    }

    public void setChecksumPrecheck(boolean checksumPrecheck) {
        this.checksumPrecheck = checksumPrecheck;
    }

    @Option(orderIndex = 110, advanced = true, description = "Upload without computing a checksum first (also disables the checksum precheck)")
    public boolean isSkipHash() {
        return skipHash;
    }

    public void setSkipHash(boolean skipHash) {
        this.skipHash = skipHash;
    }

    @Option(orderIndex = 120, description = "Recreate source albums on the remote server and add the uploaded assets to them")
    public boolean isSyncAlbums() {
        return syncAlbums;
    }

    public void setSyncAlbums(boolean syncAlbums) {
        this.syncAlbums = syncAlbums;
    }

    @Option(orderIndex = 130, advanced = true, description = "When an item that already exists remotely has changed content, delete the remote copy and upload it again. Note that this is not atomic: a crash between the delete and the upload leaves the asset missing until the next run")
    public boolean isUpdateChangedAssets() {
        return updateChangedAssets;
    }

    public void setUpdateChangedAssets(boolean updateChangedAssets) {
        this.updateChangedAssets = updateChangedAssets;
    }

    @Option(orderIndex = 140, advanced = true, description = "Seconds to wait for a connection to the remote server. Default is " + DEFAULT_CONNECT_TIMEOUT_SECONDS)
    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int effectiveMaxInFlight() {
        if (maxInFlight > 0) return maxInFlight;
        return Math.max(MIN_IN_FLIGHT, uploadConcurrency * 4);
    }

    public int effectiveExistCheckConcurrency() {
        return Math.max(1, Math.min(uploadConcurrency, existCheckConcurrency));
    }

    public UploadOptions withServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
        return this;
    }

    public UploadOptions withApiKey(String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    public UploadOptions withDeviceId(String deviceId) {
        this.deviceId = deviceId;
        return this;
    }

    public UploadOptions withUploadConcurrency(int uploadConcurrency) {
        this.uploadConcurrency = uploadConcurrency;
        return this;
    }

    public UploadOptions withHashConcurrency(int hashConcurrency) {
        this.hashConcurrency = hashConcurrency;
        return this;
    }

    public UploadOptions withExistCheckConcurrency(int existCheckConcurrency) {
        this.existCheckConcurrency = existCheckConcurrency;
        return this;
    }

    public UploadOptions withBulkCheckBatchSize(int bulkCheckBatchSize) {
        this.bulkCheckBatchSize = bulkCheckBatchSize;
        return this;
    }

    public UploadOptions withExistBatchSize(int existBatchSize) {
        this.existBatchSize = existBatchSize;
        return this;
    }

    public UploadOptions withMaxInFlight(int maxInFlight) {
        this.maxInFlight = maxInFlight;
        return this;
    }

    public UploadOptions withChecksumPrecheck(boolean checksumPrecheck) {
        this.checksumPrecheck = checksumPrecheck;
        return this;
    }

    public UploadOptions withSkipHash(boolean skipHash) {
        this.skipHash = skipHash;
        return this;
    }

    public UploadOptions withSyncAlbums(boolean syncAlbums) {
        this.syncAlbums = syncAlbums;
        return this;
    }

    public UploadOptions withUpdateChangedAssets(boolean updateChangedAssets) {
        this.updateChangedAssets = updateChangedAssets;
        return this;
    }

    public UploadOptions withConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        return this;
    }
}
