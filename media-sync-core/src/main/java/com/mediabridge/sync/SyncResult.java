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

import com.mediabridge.sync.session.RunSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one media run.
 */
public class SyncResult {
    private int attempted;
    private int completed;
    private int skipped;
    private int errors;
    private boolean paused;
    private boolean cancelled;
    private Integer pauseIndex;
    private Set<String> processedIds = new LinkedHashSet<>();
    private Set<String> errorIds = new LinkedHashSet<>();
    private List<FailedItem> failedItems = new ArrayList<>();
    private int mirrorDeleted;
    private long uploaded;
    private long duplicates;
    private long skippedExisting;
    private long replaced;
    private int albumsSynced;
    private RunSession session;

    public int getAttempted() {
        return attempted;
    }

    public void setAttempted(int attempted) {
        this.attempted = attempted;
    }

    public int getCompleted() {
        return completed;
    }

    public void setCompleted(int completed) {
        this.completed = completed;
    }

    public int getSkipped() {
        return skipped;
    }

    public void setSkipped(int skipped) {
        this.skipped = skipped;
    }

    /**
     * variant errors plus failed fire-and-forget uploads
     */
    public int getErrors() {
        return errors;
    }

    public void setErrors(int errors) {
        this.errors = errors;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    public Integer getPauseIndex() {
        return pauseIndex;
    }

    public void setPauseIndex(Integer pauseIndex) {
        this.pauseIndex = pauseIndex;
    }

    public Set<String> getProcessedIds() {
        return Collections.unmodifiableSet(processedIds);
    }

    public void setProcessedIds(Set<String> processedIds) {
        this.processedIds = new LinkedHashSet<>(processedIds);
    }

    public Set<String> getErrorIds() {
        return Collections.unmodifiableSet(errorIds);
    }

    public void setErrorIds(Set<String> errorIds) {
        this.errorIds = new LinkedHashSet<>(errorIds);
    }

    public List<FailedItem> getFailedItems() {
        return failedItems;
    }

    public void setFailedItems(List<FailedItem> failedItems) {
        this.failedItems = failedItems;
    }

    public int getMirrorDeleted() {
        return mirrorDeleted;
    }

    public void setMirrorDeleted(int mirrorDeleted) {
        this.mirrorDeleted = mirrorDeleted;
    }

    public long getUploaded() {
        return uploaded;
    }

    public void setUploaded(long uploaded) {
        this.uploaded = uploaded;
    }

    public long getDuplicates() {
        return duplicates;
    }

    public void setDuplicates(long duplicates) {
        this.duplicates = duplicates;
    }

    public long getSkippedExisting() {
        return skippedExisting;
    }

    public void setSkippedExisting(long skippedExisting) {
        this.skippedExisting = skippedExisting;
    }

    public long getReplaced() {
        return replaced;
    }

    public void setReplaced(long replaced) {
        this.replaced = replaced;
    }

    public int getAlbumsSynced() {
        return albumsSynced;
    }

    public void setAlbumsSynced(int albumsSynced) {
        this.albumsSynced = albumsSynced;
    }

    /**
     * the session to resume from when the run was paused, otherwise null
     */
    public RunSession getSession() {
        return session;
    }

    public void setSession(RunSession session) {
        this.session = session;
    }

    @Override
    public String toString() {
        return "SyncResult{attempted=" + attempted + ", completed=" + completed + ", skipped=" + skipped
                + ", errors=" + errors + (paused ? ", paused at " + pauseIndex : "")
                + (cancelled ? ", cancelled" : "") + "}";
    }
}
