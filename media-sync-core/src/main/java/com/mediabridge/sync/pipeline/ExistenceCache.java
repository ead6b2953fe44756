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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * What the pipeline knows about remote existence of device asset ids.
 * <p>
 * {@code existing} is always a subset of {@code known}, and an id is never pending and known at the same time.
 * Pending ids are either queued (in submission order) or part of a batch being checked. Once {@link #markComplete() complete}, membership answers are final for
 * the run.
 * <p>
 * Not thread-safe: every access is guarded by the owning {@link UploadPipeline}'s lock.
 */
public class ExistenceCache {
    private final Set<String> known = new HashSet<>();
    private final Set<String> existing = new HashSet<>();
    private final LinkedHashSet<String> queued = new LinkedHashSet<>();
    private final Set<String> checking = new HashSet<>();
    private final Map<String, List<CountDownLatch>> waiters = new HashMap<>();
    private boolean complete;

    /**
     * Queues an id for a background check unless it is already known or queued.
     *
     * @return true if the id was added
     */
    public boolean submit(String id) {
        if (known.contains(id) || isPending(id)) return false;
        return queued.add(id);
    }

    /**
     * Dequeues up to {@code max} queued ids in FIFO order. They stay pending until
     * {@link #markChecked(Collection, Collection)} is called for them.
     */
    public List<String> takeBatch(int max) {
        List<String> batch = new ArrayList<>(Math.min(max, queued.size()));
        Iterator<String> i = queued.iterator();
        while (i.hasNext() && batch.size() < max) {
            String id = i.next();
            i.remove();
            checking.add(id);
            batch.add(id);
        }
        return batch;
    }

    /**
     * Records the answer for a batch and releases anyone waiting on those ids. Ids of a failed batch are passed with
     * an empty {@code existingIds}, so they count as known but not existing.
     */
    public void markChecked(Collection<String> ids, Collection<String> existingIds) {
        for (String id : ids) {
            queued.remove(id);
            checking.remove(id);
            known.add(id);
            if (existingIds.contains(id)) existing.add(id);
            List<CountDownLatch> latches = waiters.remove(id);
            if (latches != null) latches.forEach(CountDownLatch::countDown);
        }
    }

    /**
     * @return a latch released when the id becomes known
     */
    public CountDownLatch addWaiter(String id) {
        CountDownLatch latch = new CountDownLatch(1);
        if (known.contains(id)) latch.countDown();
        else waiters.computeIfAbsent(id, k -> new ArrayList<>()).add(latch);
        return latch;
    }

    public void markComplete() {
        complete = true;
        // nobody can learn anything more; let them all go
        for (List<CountDownLatch> latches : waiters.values()) {
            latches.forEach(CountDownLatch::countDown);
        }
        waiters.clear();
    }

    public void reset() {
        complete = false;
    }

    public boolean isComplete() {
        return complete;
    }

    public boolean isKnown(String id) {
        return known.contains(id);
    }

    public boolean exists(String id) {
        return existing.contains(id);
    }

    public boolean isPending(String id) {
        return queued.contains(id) || checking.contains(id);
    }

    public int knownCount() {
        return known.size();
    }

    public int existingCount() {
        return existing.size();
    }

    /**
     * queued plus in-check ids
     */
    public int pendingCount() {
        return queued.size() + checking.size();
    }

    public int queuedCount() {
        return queued.size();
    }
}
