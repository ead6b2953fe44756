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
package com.mediabridge.sync.session;

import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.config.UploadOptions;

import javax.xml.bind.DatatypeConverter;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Identifies the parts of a configuration that decide which items a run visits and where they go. A saved session
 * only resumes into a configuration with the same fingerprint.
 */
public final class ConfigFingerprint {
    public static String of(SyncConfig config) {
        SyncOptions options = config.getOptions();
        UploadOptions upload = config.getUpload();
        StringBuilder sb = new StringBuilder();
        sb.append("mode=").append(options.getBackupMode());
        sb.append(";export=").append(options.getExportMode());
        sb.append(";filter=").append(options.getMediaFilter());
        sb.append(";sort=").append(options.getSortOrder());
        sb.append(";since=").append(options.getSince());
        sb.append(";limit=").append(options.getLimit());
        sb.append(";adjustments=").append(options.isIncludeAdjustmentData());
        sb.append(";destination=").append(options.getDestination() == null ? null
                : new File(options.getDestination()).getAbsolutePath());
        sb.append(";sources=").append(config.getSources());
        if (upload != null) sb.append(";upload=").append(upload.getServerUrl()).append('|').append(upload.getDeviceId());
        return sha256(sb.toString());
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return DatatypeConverter.printHexBinary(digest.digest(value.getBytes(StandardCharsets.UTF_8))).toLowerCase();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private ConfigFingerprint() {
    }
}
