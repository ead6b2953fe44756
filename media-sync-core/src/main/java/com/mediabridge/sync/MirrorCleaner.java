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
package com.mediabridge.sync;

import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.service.ManifestEntry;
import com.mediabridge.sync.service.ManifestService;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.function.BooleanSupplier;

/**
 * Deletes local outputs whose manifest entries were not touched by the current run, then soft-deletes the entries.
 * Never touches the remote store or the source.
 */
public class MirrorCleaner {
    private static final Logger log = LoggerFactory.getLogger(MirrorCleaner.class);

    private final ManifestService manifest;
    private final File destination;
    private final SyncListener listener;
    private final BooleanSupplier cancelCheck;

    private int deletedFiles;
    private int removedEntries;
    private int errors;

    public MirrorCleaner(ManifestService manifest, File destination, SyncListener listener, BooleanSupplier cancelCheck) {
        this.manifest = manifest;
        this.destination = destination;
        this.listener = listener;
        this.cancelCheck = cancelCheck;
    }

    /**
     * @param keyPrefix only keys with this prefix are considered
     */
    public void clean(String runId, String keyPrefix) {
        for (String key : manifest.keysNotTouchedByRun(runId)) {
            if (cancelCheck.getAsBoolean()) break;
            if (!key.startsWith(keyPrefix)) continue;

            ManifestEntry entry = manifest.get(key);
            if (entry == null || entry.isDeleted()) continue;

            File file = new File(destination, entry.getRelPath());
            if (file.exists()) {
                try {
                    Files.delete(file.toPath());
                    deletedFiles++;
                    manifest.markDeleted(key);
                    removedEntries++;
                    log.info("mirror: deleted {}", entry.getRelPath());
                } catch (IOException | RuntimeException e) {
                    errors++;
                    String message = "ERROR mirror: failed to delete " + entry.getRelPath() + ": " + SyncUtil.summarize(e);
                    log.warn(message);
                    listener.onEvent(SyncEvent.message(message));
                }
            } else {
                manifest.markDeleted(key);
                removedEntries++;
                log.debug("mirror: {} already gone", entry.getRelPath());
            }
        }
    }

    public int getDeletedFiles() {
        return deletedFiles;
    }

    /**
     * entries soft-deleted, whether or not their file still existed
     */
    public int getRemovedEntries() {
        return removedEntries;
    }

    public int getErrors() {
        return errors;
    }
}
