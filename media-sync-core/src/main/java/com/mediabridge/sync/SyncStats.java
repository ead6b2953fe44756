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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Running tallies for one run. Safe to update from pipeline worker threads.
 */
public class SyncStats {
    // itemsCompleted + itemsSkipped = items that reached a decision (stopped items are in neither)
    private long itemsAttempted;
    private long itemsCompleted;
    private long itemsSkipped;
    private long variantsExported;
    private long variantsSkipped;
    private long errors;
    private long bytesExported;
    private long startTime, stopTime;
    private final SortedSet<FailedItem> failedItems = Collections.synchronizedSortedSet(new TreeSet<>());

    public synchronized void start() {
        startTime = System.currentTimeMillis();
        stopTime = 0;
    }

    public synchronized void stop() {
        stopTime = System.currentTimeMillis();
    }

    public synchronized void incItemsAttempted() {
        itemsAttempted++;
    }

    public synchronized void incItemsCompleted() {
        itemsCompleted++;
    }

    public synchronized void incItemsSkipped() {
        itemsSkipped++;
    }

    public synchronized void incVariantsExported(long bytes) {
        variantsExported++;
        bytesExported += bytes;
    }

    public synchronized void incVariantsSkipped() {
        variantsSkipped++;
    }

    public synchronized void incErrors(long count) {
        errors += count;
    }

    public void addFailedItem(FailedItem failedItem) {
        failedItems.add(failedItem);
    }

    public long getTotalRunTime() {
        if (startTime == 0) return 0;
        long last = stopTime > 0 ? stopTime : System.currentTimeMillis();
        return last - startTime;
    }

    public synchronized String getStatsString() {
        long secs = getTotalRunTime() / 1000L;
        if (secs == 0) secs = 1;
        double itemRate = (double) itemsCompleted / secs;

        return MessageFormat.format("Exported {0} variant(s), {1} bytes in {2} seconds - skipped {3} variant(s)\n",
                variantsExported, bytesExported, secs, variantsSkipped) +
                MessageFormat.format("Completed items: {0} ({1,number,#.##}/s) Skipped items: {2} Errors: {3}\n",
                        itemsCompleted, itemRate, itemsSkipped, errors) +
                MessageFormat.format("Failed items: {0}\n", getFailedItems());
    }

    public synchronized long getItemsAttempted() {
        return itemsAttempted;
    }

    public synchronized long getItemsCompleted() {
        return itemsCompleted;
    }

    public synchronized long getItemsSkipped() {
        return itemsSkipped;
    }

    public synchronized long getVariantsExported() {
        return variantsExported;
    }

    public synchronized long getVariantsSkipped() {
        return variantsSkipped;
    }

    public synchronized long getErrors() {
        return errors;
    }

    public synchronized long getBytesExported() {
        return bytesExported;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getStopTime() {
        return stopTime;
    }

    public List<FailedItem> getFailedItems() {
        synchronized (failedItems) {
            return new ArrayList<>(failedItems);
        }
    }
}
