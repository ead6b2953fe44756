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
package com.mediabridge.sync.event;

import java.text.MessageFormat;

/**
 * One entry of the tagged progress stream. Which fields are populated depends on the {@link Type}.
 */
public final class SyncEvent {
    public enum Type {
        Scanning, WillExport, Exporting, Downloading, Retrying, ExistenceCheck, Paused, Message,
        FileScanning, FileWillCopy, FileCopying
    }

    public static SyncEvent scanning() {
        return new SyncEvent(Type.Scanning, 0, 0, null, null, 0);
    }

    public static SyncEvent willExport(int total) {
        return new SyncEvent(Type.WillExport, 0, total, null, null, 0);
    }

    public static SyncEvent exporting(int index, int total, String itemId, String baseName) {
        return new SyncEvent(Type.Exporting, index, total, itemId, baseName, 0);
    }

    public static SyncEvent downloading(String itemId, double progress) {
        return new SyncEvent(Type.Downloading, 0, 0, itemId, null, progress);
    }

    public static SyncEvent retrying(int attempt, int maxAttempts, String itemId, String reason) {
        return new SyncEvent(Type.Retrying, attempt, maxAttempts, itemId, reason, 0);
    }

    public static SyncEvent existenceCheck(int checked, int total) {
        return new SyncEvent(Type.ExistenceCheck, checked, total, null, null, 0);
    }

    public static SyncEvent paused(int index, int total) {
        return new SyncEvent(Type.Paused, index, total, null, null, 0);
    }

    public static SyncEvent message(String message) {
        return new SyncEvent(Type.Message, 0, 0, null, message, 0);
    }

    public static SyncEvent fileScanning() {
        return new SyncEvent(Type.FileScanning, 0, 0, null, null, 0);
    }

    public static SyncEvent fileWillCopy(int total) {
        return new SyncEvent(Type.FileWillCopy, 0, total, null, null, 0);
    }

    public static SyncEvent fileCopying(int index, int total, String relPath) {
        return new SyncEvent(Type.FileCopying, index, total, relPath, null, 0);
    }

    private final Type type;
    private final int index;
    private final int total;
    private final String subject;
    private final String text;
    private final double progress;

    private SyncEvent(Type type, int index, int total, String subject, String text, double progress) {
        this.type = type;
        this.index = index;
        this.total = total;
        this.subject = subject;
        this.text = text;
        this.progress = progress;
    }

    public Type getType() {
        return type;
    }

    /**
     * 1-based item index for exporting/copying, attempt number for retrying, checked count for existence checks,
     * stop index for paused
     */
    public int getIndex() {
        return index;
    }

    /**
     * item total, or the maximum attempt count for retrying
     */
    public int getTotal() {
        return total;
    }

    /**
     * item id or relative path the event refers to
     */
    public String getSubject() {
        return subject;
    }

    /**
     * message text, base name (exporting) or retry reason
     */
    public String getText() {
        return text;
    }

    /**
     * fraction 0..1 (downloading only)
     */
    public double getProgress() {
        return progress;
    }

    public boolean isError() {
        return type == Type.Message && text != null && text.startsWith("ERROR");
    }

    @Override
    public String toString() {
        switch (type) {
            case Scanning:
                return "Scanning source...";
            case WillExport:
                return MessageFormat.format("Found {0} item(s) to process", total);
            case Exporting:
                return MessageFormat.format("[{0}/{1}] {2}", index, total, text);
            case Downloading:
                return MessageFormat.format("Downloading {0}: {1,number,#}%", subject, progress * 100);
            case Retrying:
                return MessageFormat.format("Retrying {0} (attempt {1}/{2}): {3}", subject, index, total, text);
            case ExistenceCheck:
                return MessageFormat.format("Checking server: {0}/{1}", index, total);
            case Paused:
                return MessageFormat.format("Paused at {0}/{1}", index, total);
            case FileScanning:
                return "Scanning folders...";
            case FileWillCopy:
                return MessageFormat.format("Found {0} file(s) to copy", total);
            case FileCopying:
                return MessageFormat.format("[{0}/{1}] {2}", index, total, subject);
            default:
                return text;
        }
    }
}
