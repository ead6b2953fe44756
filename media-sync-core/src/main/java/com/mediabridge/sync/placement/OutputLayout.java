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
package com.mediabridge.sync.placement;

import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.Variant;
import com.mediabridge.sync.model.VariantType;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Naming policy for exported variants: a {@code yyyy/MM/dd} folder from the capture date and a
 * {@code yyyy-MM-dd_HH-mm-ss_{shortId}} base name with a per-variant suffix.
 */
public class OutputLayout {
    public static final String UNKNOWN_DATE_FOLDER = "Unknown Date";
    public static final int MIN_PLAUSIBLE_YEAR = 1900;
    public static final int MAX_SHORT_ID_LENGTH = 10;

    private static final DateTimeFormatter FOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT);
    private static final DateTimeFormatter BASE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss", Locale.ROOT);

    private final ZoneId zone;

    public OutputLayout() {
        this(ZoneId.systemDefault());
    }

    public OutputLayout(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @return the capture time as a zoned date, or null when missing or before {@value #MIN_PLAUSIBLE_YEAR}
     */
    public ZonedDateTime usableCaptureDate(Instant createdAt) {
        if (createdAt == null) return null;
        ZonedDateTime date = createdAt.atZone(zone);
        return date.getYear() >= MIN_PLAUSIBLE_YEAR ? date : null;
    }

    public String folderFor(Instant createdAt) {
        ZonedDateTime date = usableCaptureDate(createdAt);
        return date == null ? UNKNOWN_DATE_FOLDER : FOLDER_FORMAT.format(date);
    }

    public String baseName(Instant createdAt, String itemId) {
        ZonedDateTime date = usableCaptureDate(createdAt);
        String shortId = shortId(itemId);
        return date == null ? "unknown_" + shortId : BASE_FORMAT.format(date) + "_" + shortId;
    }

    public String fileName(CandidateItem item, Variant variant) {
        String base = baseName(item.getCreatedAt(), item.getId());
        String name = variant.getResourceName();
        switch (variant.getType()) {
            case pairedVideo:
                return base + "_live." + extension(name, "mov");
            case adjustments:
                return base + "_adjustments." + extension(name, "aae");
            case video:
                return base + (item.isLive() ? "_live." : ".") + extension(name, "mov");
            case edited:
                return base + "_edited." + extension(name, "jpg");
            default:
                return base + "." + extension(name, "bin");
        }
    }

    /**
     * desired path of a variant relative to the destination root, always with forward slashes
     */
    public String relativePath(CandidateItem item, Variant variant) {
        return folderFor(item.getCreatedAt()) + "/" + fileName(item, variant);
    }

    public String relativePath(CandidateItem item, VariantType type, String resourceName) {
        return relativePath(item, new Variant(type, resourceName));
    }

    public static String shortId(String itemId) {
        String first = itemId;
        int slash = itemId.indexOf('/');
        if (slash >= 0) first = itemId.substring(0, slash);
        String cleaned = first.replaceAll("[^A-Za-z0-9]+", "");
        if (cleaned.length() > MAX_SHORT_ID_LENGTH) cleaned = cleaned.substring(0, MAX_SHORT_ID_LENGTH);
        return cleaned.isEmpty() ? "asset" : cleaned;
    }

    /**
     * lower-cased extension of a file name, or the fallback when there is none
     */
    public static String extension(String name, String fallback) {
        if (name == null) return fallback;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String fileName = name.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return fallback;
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public ZoneId getZone() {
        return zone;
    }
}
