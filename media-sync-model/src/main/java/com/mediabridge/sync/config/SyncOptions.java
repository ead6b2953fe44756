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

@XmlRootElement
public class SyncOptions {
    public static final int DEFAULT_RETRY_ATTEMPTS = 3; // 4 total attempts
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 30000;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;
    public static final double DEFAULT_SLOW_FETCH_TIMEOUT_MULTIPLIER = 2.0;

    private BackupMode backupMode = BackupMode.smartIncremental;
    private ExportMode exportMode = ExportMode.originals;
    private MediaFilter mediaFilter = MediaFilter.all;
    private SortOrder sortOrder = SortOrder.oldestFirst;
    private String since;
    private int limit;
    private String destination;
    private boolean dryRun;
    private boolean includeAdjustmentData;

    private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
    private long retryBaseDelayMs = DEFAULT_RETRY_BASE_DELAY_MS;
    private long retryMaxDelayMs = DEFAULT_RETRY_MAX_DELAY_MS;
    private int requestTimeoutSeconds = DEFAULT_REQUEST_TIMEOUT_SECONDS;
    private double slowFetchTimeoutMultiplier = DEFAULT_SLOW_FETCH_TIMEOUT_MULTIPLIER;

    private String workDir;
    private String failureArchiveDir;
    private boolean includeHiddenFiles;
    private boolean followSymlinks;

    @Option(orderIndex = 10, valueList = {"full", "smartIncremental", "mirror"}, description = "Determines how previously backed up items are treated. full exports everything again, smartIncremental skips items whose manifest entry is unchanged and mirror additionally deletes backed up files whose source item is gone. Default is smartIncremental")
    public BackupMode getBackupMode() {
        return backupMode;
    }

    public void setBackupMode(BackupMode backupMode) {
        this.backupMode = backupMode;
    }

    @Option(orderIndex = 20, valueList = {"originals", "edited", "both"}, description = "Which renditions of each item to export. Default is originals")
    public ExportMode getExportMode() {
        return exportMode;
    }

    public void setExportMode(ExportMode exportMode) {
        this.exportMode = exportMode;
    }

    @Option(orderIndex = 30, valueList = {"all", "images", "videos"}, description = "Restricts the run to one kind of media. Default is all")
    public MediaFilter getMediaFilter() {
        return mediaFilter;
    }

    public void setMediaFilter(MediaFilter mediaFilter) {
        this.mediaFilter = mediaFilter;
    }

    @Option(orderIndex = 40, valueList = {"oldestFirst", "newestFirst"}, description = "Order in which items are processed, by capture time. Default is oldestFirst")
    public SortOrder getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(SortOrder sortOrder) {
        this.sortOrder = sortOrder;
    }

    @Option(orderIndex = 50, valueHint = "yyyy-MM-dd", description = "Only process items captured on or after this date (yyyy-MM-dd or an ISO-8601 instant)")
    public String getSince() {
        return since;
    }

    public void setSince(String since) {
        this.since = since;
    }

    @Option(orderIndex = 60, description = "Process at most this many items (after filtering and sorting). 0 means no limit")
    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    @Option(orderIndex = 70, valueHint = "folder", description = "Local folder that receives the exported files. At least one of a destination folder or a remote server is required")
    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    @Option(orderIndex = 80, description = "Walks through the run without exporting, placing or uploading anything")
    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    @Option(orderIndex = 90, description = "Also export sidecar adjustment data alongside originals")
    public boolean isIncludeAdjustmentData() {
        return includeAdjustmentData;
    }

    public void setIncludeAdjustmentData(boolean includeAdjustmentData) {
        this.includeAdjustmentData = includeAdjustmentData;
    }

    @Option(orderIndex = 100, advanced = true, description = "Specifies how many times a retryable export failure is retried. Default is 3 retries (total of 4 attempts)")
    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    @Option(orderIndex = 110, advanced = true, description = "Base delay (ms) before the first retry; doubles with every further attempt. Default is " + DEFAULT_RETRY_BASE_DELAY_MS)
    public long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    @Option(orderIndex = 120, advanced = true, description = "Upper bound (ms) of the retry delay before jitter is added. Default is " + DEFAULT_RETRY_MAX_DELAY_MS)
    public long getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public void setRetryMaxDelayMs(long retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
    }

    @Option(orderIndex = 130, advanced = true, description = "Seconds an export may take before it is abandoned as timed out. Default is " + DEFAULT_REQUEST_TIMEOUT_SECONDS)
    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    @Option(orderIndex = 140, advanced = true, description = "When an export reports partial download progress, its timeout is extended to the request timeout times this factor. Default is 2.0")
    public double getSlowFetchTimeoutMultiplier() {
        return slowFetchTimeoutMultiplier;
    }

    public void setSlowFetchTimeoutMultiplier(double slowFetchTimeoutMultiplier) {
        this.slowFetchTimeoutMultiplier = slowFetchTimeoutMultiplier;
    }

    @Option(orderIndex = 150, advanced = true, valueHint = "folder", description = "Folder for temporary export files. Defaults to a hidden folder inside the destination, or the system temp folder when there is no destination")
    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    @Option(orderIndex = 160, advanced = true, valueHint = "folder", description = "When set, a small JSON record (metadata only) is written here for every failed upload")
    public String getFailureArchiveDir() {
        return failureArchiveDir;
    }

    public void setFailureArchiveDir(String failureArchiveDir) {
        this.failureArchiveDir = failureArchiveDir;
    }

    @Option(orderIndex = 170, advanced = true, description = "Folder backups only: include hidden files and folders")
    public boolean isIncludeHiddenFiles() {
        return includeHiddenFiles;
    }

    public void setIncludeHiddenFiles(boolean includeHiddenFiles) {
        this.includeHiddenFiles = includeHiddenFiles;
    }

    @Option(orderIndex = 180, advanced = true, description = "Folder backups only: follow symbolic links instead of skipping them")
    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public void setFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public SyncOptions withBackupMode(BackupMode backupMode) {
        this.backupMode = backupMode;
        return this;
    }

    public SyncOptions withExportMode(ExportMode exportMode) {
        this.exportMode = exportMode;
        return this;
    }

    public SyncOptions withMediaFilter(MediaFilter mediaFilter) {
        this.mediaFilter = mediaFilter;
        return this;
    }

    public SyncOptions withSortOrder(SortOrder sortOrder) {
        this.sortOrder = sortOrder;
        return this;
    }

    public SyncOptions withSince(String since) {
        this.since = since;
        return this;
    }

    public SyncOptions withLimit(int limit) {
        this.limit = limit;
        return this;
    }

    public SyncOptions withDestination(String destination) {
        this.destination = destination;
        return this;
    }

    public SyncOptions withDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    public SyncOptions withIncludeAdjustmentData(boolean includeAdjustmentData) {
        this.includeAdjustmentData = includeAdjustmentData;
        return this;
    }

    public SyncOptions withRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
        return this;
    }

    public SyncOptions withRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
        return this;
    }

    public SyncOptions withRetryMaxDelayMs(long retryMaxDelayMs) {
        this.retryMaxDelayMs = retryMaxDelayMs;
        return this;
    }

    public SyncOptions withRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
        return this;
    }

    public SyncOptions withSlowFetchTimeoutMultiplier(double slowFetchTimeoutMultiplier) {
        this.slowFetchTimeoutMultiplier = slowFetchTimeoutMultiplier;
        return this;
    }

    public SyncOptions withWorkDir(String workDir) {
        this.workDir = workDir;
        return this;
    }

    public SyncOptions withFailureArchiveDir(String failureArchiveDir) {
        this.failureArchiveDir = failureArchiveDir;
        return this;
    }

    public SyncOptions withIncludeHiddenFiles(boolean includeHiddenFiles) {
        this.includeHiddenFiles = includeHiddenFiles;
        return this;
    }

    public SyncOptions withFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
        return this;
    }
}
