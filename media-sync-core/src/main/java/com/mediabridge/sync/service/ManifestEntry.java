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
package com.mediabridge.sync.service;

import java.util.Objects;

/**
 * One exported variant as last recorded. An entry with a {@link #getDeletedAt() deletedAt} is inert.
 */
public class ManifestEntry {
    private final String key;
    private final String relPath;
    private final String signature;
    private final long size;
    private final double mtime;
    private final String lastSeenRunId;
    private final Double deletedAt;

    public ManifestEntry(String key, String relPath, String signature, long size, double mtime, String lastSeenRunId) {
        this(key, relPath, signature, size, mtime, lastSeenRunId, null);
    }

    public ManifestEntry(String key, String relPath, String signature, long size, double mtime, String lastSeenRunId,
                         Double deletedAt) {
        this.key = Objects.requireNonNull(key, "key");
        this.relPath = relPath;
        this.signature = signature;
        this.size = size;
        this.mtime = mtime;
        this.lastSeenRunId = lastSeenRunId;
        this.deletedAt = deletedAt;
    }

    public ManifestEntry touch(String runId) {
        return new ManifestEntry(key, relPath, signature, size, mtime, runId, null);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public String getKey() {
        return key;
    }

    public String getRelPath() {
        return relPath;
    }

    public String getSignature() {
        return signature;
    }

    public long getSize() {
        return size;
    }

    /**
     * file modification time in epoch seconds
     */
    public double getMtime() {
        return mtime;
    }

    public String getLastSeenRunId() {
        return lastSeenRunId;
    }

    /**
     * soft-delete time in epoch seconds, or null while active
     */
    public Double getDeletedAt() {
        return deletedAt;
    }

    @Override
    public String toString() {
        return "ManifestEntry{" + key + " -> " + relPath + ", run=" + lastSeenRunId
                + (deletedAt == null ? "" : ", deleted") + "}";
    }
}
