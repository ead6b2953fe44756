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

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of a paused run, enough to resume it later, possibly in another process.
 */
public class RunSession {
    private String sessionId = UUID.randomUUID().toString();
    private long startedAt;
    private Long pausedAt;
    private String fingerprint;
    private Set<String> processedIds = new LinkedHashSet<>();
    private Set<String> errorIds = new LinkedHashSet<>();
    private int pauseIndex;
    private int attempted;
    private int completed;
    private int skipped;
    private int errors;

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * epoch millis
     */
    public long getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(long startedAt) {
        this.startedAt = startedAt;
    }

    /**
     * epoch millis of the pause, null if the session was never paused
     */
    public Long getPausedAt() {
        return pausedAt;
    }

    public void setPausedAt(Long pausedAt) {
        this.pausedAt = pausedAt;
    }

    /**
     * @see ConfigFingerprint
     */
    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public Set<String> getProcessedIds() {
        return processedIds;
    }

    public void setProcessedIds(Set<String> processedIds) {
        this.processedIds = processedIds;
    }

    public Set<String> getErrorIds() {
        return errorIds;
    }

    public void setErrorIds(Set<String> errorIds) {
        this.errorIds = errorIds;
    }

    /**
     * index into the (possibly reordered) candidate list at which the run stopped
     */
    public int getPauseIndex() {
        return pauseIndex;
    }

    public void setPauseIndex(int pauseIndex) {
        this.pauseIndex = pauseIndex;
    }

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

    public int getErrors() {
        return errors;
    }

    public void setErrors(int errors) {
        this.errors = errors;
    }

    @Override
    public String toString() {
        return "RunSession{" + sessionId + ", paused at " + pauseIndex + ", " + processedIds.size() + " processed}";
    }
}
