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

import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.VariantType;

import java.time.Instant;

/**
 * Key and signature formats. Photo keys look like {@code photo:{itemId}:{variant}}, folder backup keys like
 * {@code file:{relPath}}.
 */
public final class ManifestKeys {
    public static final String PHOTO_PREFIX = "photo:";
    public static final String FILE_PREFIX = "file:";

    public static String photoKey(String itemId, VariantType variant) {
        return PHOTO_PREFIX + itemId + ":" + variant.name();
    }

    public static String fileKey(String relPath) {
        return FILE_PREFIX + relPath;
    }

    /**
     * Cheap change detector for a variant: modification and creation time, variant and resource name.
     */
    public static String photoSignature(CandidateItem item, VariantType variant, String resourceName) {
        return "v:" + variant.name()
                + ";mod:" + epochSeconds(item.getModifiedAt())
                + ";created:" + epochSeconds(item.getCreatedAt())
                + ";name:" + (resourceName == null ? "" : resourceName);
    }

    public static String fileSignature(long size, long mtimeMillis) {
        return "size:" + size + ";mtime:" + mtimeMillis / 1000;
    }

    private static long epochSeconds(Instant instant) {
        return instant == null ? 0 : instant.getEpochSecond();
    }

    private ManifestKeys() {
    }
}
