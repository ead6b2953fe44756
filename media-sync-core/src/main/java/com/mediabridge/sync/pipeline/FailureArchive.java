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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;

/**
 * Writes a small JSON record per failed upload ({@code {epochMillis}-{sanitizedId}.json}) for later inspection.
 * Only metadata is written, never media bytes. Best effort: write failures are logged and otherwise ignored.
 */
public class FailureArchive {
    private static final Logger log = LoggerFactory.getLogger(FailureArchive.class);

    private static final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    private final File directory;

    public FailureArchive(File directory) {
        this.directory = directory;
    }

    public File archive(UploadWorkItem item, String checksum, Throwable error) {
        FailureRecord record = new FailureRecord();
        record.deviceAssetId = item.getDeviceAssetId();
        record.filename = item.getFilename();
        record.fileCreatedAt = toString(item.getFileCreatedAt());
        record.fileModifiedAt = toString(item.getFileModifiedAt());
        record.checksum = checksum;
        record.error = error == null ? null : SyncUtil.summarize(error);
        record.failedAt = Instant.now().toString();

        File file = new File(directory, System.currentTimeMillis() + "-" + sanitize(item.getDeviceAssetId()) + ".json");
        try {
            SyncUtil.ensureDir(directory);
            try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
                gson.toJson(record, writer);
            }
            log.debug("archived failed upload of {} to {}", item.getDeviceAssetId(), file);
            return file;
        } catch (IOException | RuntimeException e) {
            log.warn("could not write failure record {}: {}", file, e.toString());
            return null;
        }
    }

    static String sanitize(String id) {
        String sanitized = id.replaceAll("[^A-Za-z0-9._-]+", "_");
        return SyncUtil.truncate(sanitized, 120);
    }

    private static String toString(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    public File getDirectory() {
        return directory;
    }

    static class FailureRecord {
        String deviceAssetId;
        String filename;
        String fileCreatedAt;
        String fileModifiedAt;
        String checksum;
        String error;
        String failedAt;
    }
}
