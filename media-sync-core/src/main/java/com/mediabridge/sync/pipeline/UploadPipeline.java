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

import com.mediabridge.sync.config.UploadOptions;
import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.remote.BulkCheckItem;
import com.mediabridge.sync.remote.BulkCheckResult;
import com.mediabridge.sync.remote.RemoteAsset;
import com.mediabridge.sync.remote.RemoteStore;
import com.mediabridge.sync.remote.UploadRequest;
import com.mediabridge.sync.remote.UploadResult;
import com.mediabridge.sync.util.EnhancedThreadPoolExecutor;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Asynchronous, deduplicating uploader.
 * <p>
 * Work items pass through an optional fast existence skip, a hash stage, an optional batched checksum pre-check, an
 * optional replace stage and finally the upload stage. Hashing, network checks and uploads run on separate pools
 * with independent bounds, and the number of items in flight is capped so a fast producer blocks in
 * {@link #enqueue(UploadWorkItem)}.
 * <p>
 * Independently, device asset ids are checked for existence in FIFO batches that flush on size or after a short
 * idle delay. All mutable batching state (the {@link ExistenceCache}, the pending checksum batch, in-progress flags
 * and flush timers) is guarded by a single lock.
 * <p>
 * The replace stage deletes the old server asset before uploading the new one. It is not atomic: if the process
 * dies in between, the asset is missing remotely until the next run uploads it again.
 */
public class UploadPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UploadPipeline.class);

    public static final long EXIST_WAIT_MS = 250;
    public static final long FLUSH_DELAY_MS = 1000;
    static final int EXIST_REPORT_CHECKED_DELTA = 200;
    static final int EXIST_REPORT_TOTAL_DELTA = 500;

    private final UploadOptions options;
    private final RemoteStore store;
    private final SyncListener listener;
    private final BooleanSupplier cancelCheck;
    private final ContentHasher hasher;
    private final FailureArchive failureArchive;

    private final Semaphore inFlightLimiter;
    private final Semaphore hashLimiter;
    private final Semaphore uploadLimiter;
    private final EnhancedThreadPoolExecutor hashExecutor;
    private final EnhancedThreadPoolExecutor uploadExecutor;
    private final EnhancedThreadPoolExecutor networkExecutor;
    private final ScheduledExecutorService timer;
    private final WorkGroup group = new WorkGroup();

    private final Object lock = new Object();
    // everything below up to the counters is guarded by lock
    private final ExistenceCache cache = new ExistenceCache();
    private boolean existInProgress;
    private ScheduledFuture<?> existFlushTimer;
    private int lastExistReportChecked = -1;
    private int lastExistReportTotal = -1;
    private boolean announcedBackgroundExist;
    private final ArrayDeque<PendingCheck> pendingBulk = new ArrayDeque<>();
    private boolean bulkInProgress;
    private ScheduledFuture<?> bulkFlushTimer;
    private boolean draining;
    private boolean closed;

    private final AtomicLong uploaded = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong skippedExisting = new AtomicLong();
    private final AtomicLong replaced = new AtomicLong();
    private final AtomicLong uploadFailures = new AtomicLong();

    public UploadPipeline(UploadOptions options, RemoteStore store, SyncListener listener, BooleanSupplier cancelCheck,
                          ContentHasher hasher, FailureArchive failureArchive) {
        this.options = options;
        this.store = store;
        this.listener = listener == null ? event -> {
        } : listener;
        this.cancelCheck = cancelCheck == null ? () -> false : cancelCheck;
        this.hasher = hasher == null ? ContentHasher.SHA1 : hasher;
        this.failureArchive = failureArchive;

        int hashConcurrency = Math.max(1, options.getHashConcurrency());
        int uploadConcurrency = Math.max(1, options.getUploadConcurrency());
        this.inFlightLimiter = new Semaphore(options.effectiveMaxInFlight());
        this.hashLimiter = new Semaphore(hashConcurrency);
        this.uploadLimiter = new Semaphore(uploadConcurrency);
        this.hashExecutor = new EnhancedThreadPoolExecutor(hashConcurrency, "hash-pool");
        this.uploadExecutor = new EnhancedThreadPoolExecutor(uploadConcurrency, "upload-pool");
        this.networkExecutor = new EnhancedThreadPoolExecutor(Math.max(2, options.getExistCheckConcurrency()),
                "network-pool");
        this.timer = Executors.newSingleThreadScheduledExecutor(
                new EnhancedThreadPoolExecutor.NamedThreadFactory("pipeline-timer"));
    }

    /**
     * Queues device asset ids for a background existence check. Ignored once a full sweep has completed.
     */
    public void submitExistChecks(Collection<String> deviceAssetIds) {
        if (deviceAssetIds.isEmpty()) return;
        synchronized (lock) {
            if (cache.isComplete()) return;
            if (!announcedBackgroundExist) {
                announcedBackgroundExist = true;
                emit("Checking existing assets on server (background)...");
            }
            for (String id : deviceAssetIds) {
                cache.submit(id);
            }
            reportExistProgress(false);
            scheduleExistFlush();
            maybeStartExistCheck(false);
        }
    }

    /**
     * Synchronously checks every listed id with bounded parallelism, then marks the existence cache complete so the
     * fast skip never blocks again. The ids of one item are never split across batches.
     *
     * @param idsPerItem device asset ids grouped by source item
     */
    public void sweepExisting(List<List<String>> idsPerItem) {
        List<SweepBatch> batches = buildSweepBatches(idsPerItem, Math.max(1, options.getExistBatchSize()));
        int total = idsPerItem.size();
        synchronized (lock) {
            cache.reset();
            announcedBackgroundExist = true;
        }
        emit("Checking existing assets on server...");
        listener.onEvent(SyncEvent.existenceCheck(0, total));

        Semaphore limiter = new Semaphore(options.effectiveExistCheckConcurrency());
        AtomicInteger checked = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (SweepBatch batch : batches) {
            if (cancelCheck.getAsBoolean()) break;
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            futures.add(networkExecutor.submit(() -> {
                try {
                    Set<String> existing = store.checkExisting(options.getDeviceId(), batch.ids);
                    synchronized (lock) {
                        cache.markChecked(batch.ids, existing);
                    }
                } catch (RuntimeException e) {
                    log.warn("existence sweep batch of {} id(s) failed", batch.ids.size(), e);
                    emit("ERROR existence check batch failed (" + batch.ids.size() + " ids): " + SyncUtil.summarize(e));
                    synchronized (lock) {
                        cache.markChecked(batch.ids, Collections.emptySet());
                    }
                } finally {
                    limiter.release();
                    listener.onEvent(SyncEvent.existenceCheck(Math.min(checked.addAndGet(batch.units), total), total));
                }
            }));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.warn("unexpected error in existence sweep", e.getCause());
            }
        }

        int existingCount;
        synchronized (lock) {
            cache.markComplete();
            existingCount = cache.existingCount();
        }
        listener.onEvent(SyncEvent.existenceCheck(total, total));
        emit("Existence check complete (" + existingCount + " already on server)");
    }

    static List<SweepBatch> buildSweepBatches(List<List<String>> idsPerItem, int batchSize) {
        List<SweepBatch> batches = new ArrayList<>();
        SweepBatch current = new SweepBatch();
        for (List<String> ids : idsPerItem) {
            if (ids.isEmpty()) continue;
            if (!current.ids.isEmpty() && current.ids.size() + ids.size() > batchSize) {
                batches.add(current);
                current = new SweepBatch();
            }
            current.ids.addAll(ids);
            current.units++;
        }
        if (!current.ids.isEmpty()) batches.add(current);
        return batches;
    }

    /**
     * Hands one item to the pipeline. Blocks while the in-flight cap is reached, and, for items that
     * {@link UploadWorkItem#isAwaitResult() await their result}, until the remote id is known.
     *
     * @return the remote asset id for awaited items (null if the upload was skipped because the id already exists);
     * always null otherwise
     * @throws UploadException if the run is cancelled or an awaited upload fails
     */
    public String enqueue(UploadWorkItem work) throws UploadException {
        String id = work.getDeviceAssetId();
        if (cancelCheck.getAsBoolean()) {
            SyncUtil.deleteQuietly(work.getDeleteAfterUpload());
            throw UploadException.cancelled(id);
        }

        if (isFastExistSkipEnabled() && shouldSkipBecauseExists(id)) {
            log.debug("{} exists on server, skipping upload", id);
            skippedExisting.incrementAndGet();
            work.markSkippedExisting();
            SyncUtil.deleteQuietly(work.getDeleteAfterUpload());
            try {
                work.getCallback().onSuccess(work, null);
            } catch (RuntimeException e) {
                log.warn("upload callback failed for {}", id, e);
            }
            return null;
        }

        try {
            inFlightLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            SyncUtil.deleteQuietly(work.getDeleteAfterUpload());
            throw UploadException.cancelled(id);
        }
        group.enter();

        Job job = new Job(work, work.isAwaitResult() ? new CompletableFuture<>() : null);
        try {
            if (options.isSkipHash()) {
                startUpload(job, null);
            } else {
                startHash(job);
            }
        } catch (RuntimeException e) {
            finish(job, null, e);
        }

        if (job.result == null) return null;
        try {
            return job.result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw UploadException.cancelled(id);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UploadException) throw (UploadException) cause;
            throw new UploadException("upload failed (" + id + "): " + SyncUtil.summarize(cause), cause);
        }
    }

    /**
     * Flushes all partial batches and waits until every enqueued item has finished.
     */
    public void finishAndWait() {
        synchronized (lock) {
            draining = true;
            maybeStartBulkCheck(true);
            maybeStartExistCheck(true);
            reportExistProgress(true);
        }
        try {
            group.await();
        } catch (InterruptedException e) {
            log.warn("interrupted while waiting for uploads to finish");
            Thread.currentThread().interrupt();
        }
    }

    boolean isFastExistSkipEnabled() {
        return !(options.isSyncAlbums() || options.isUpdateChangedAssets()) && !options.isChecksumPrecheck();
    }

    private boolean shouldSkipBecauseExists(String id) {
        CountDownLatch latch;
        synchronized (lock) {
            if (cache.isComplete() || cache.isKnown(id)) return cache.exists(id);
            if (cache.submit(id)) {
                scheduleExistFlush();
                maybeStartExistCheck(false);
            }
            latch = cache.addWaiter(id);
        }

        // give a background batch a short chance to answer before committing to hash and upload
        try {
            latch.await(EXIST_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        synchronized (lock) {
            return cache.isKnown(id) && cache.exists(id);
        }
    }

    private void startHash(Job job) {
        try {
            hashLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(job, null, UploadException.cancelled(job.work.getDeviceAssetId()));
            return;
        }
        try {
            hashExecutor.submit(() -> {
                String checksum = null;
                Throwable failure = null;
                try {
                    checksum = hasher.hash(job.work.getFile());
                } catch (Exception e) {
                    failure = e;
                } finally {
                    hashLimiter.release();
                }

                if (failure != null) {
                    finish(job, null, failure);
                } else if (!options.isChecksumPrecheck()) {
                    startUpload(job, checksum);
                } else {
                    synchronized (lock) {
                        pendingBulk.add(new PendingCheck(job, checksum));
                        // a caller waiting on this id should not wait for a full batch
                        maybeStartBulkCheck(job.work.isAwaitResult() || draining);
                        scheduleBulkFlush();
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            hashLimiter.release();
            finish(job, null, e);
        }
    }

    // must hold lock
    private void maybeStartBulkCheck(boolean force) {
        if (bulkInProgress || pendingBulk.isEmpty() || closed) return;
        int batchSize = Math.max(1, options.getBulkCheckBatchSize());
        if (!force && pendingBulk.size() < batchSize) return;

        bulkInProgress = true;
        cancelBulkFlushTimer();
        List<PendingCheck> batch = new ArrayList<>();
        while (!pendingBulk.isEmpty() && batch.size() < batchSize) {
            batch.add(pendingBulk.poll());
        }

        networkExecutor.submit(() -> {
            try {
                runBulkCheck(batch);
            } finally {
                synchronized (lock) {
                    bulkInProgress = false;
                    scheduleBulkFlush();
                    maybeStartBulkCheck(draining || anyAwaitingBulk());
                }
            }
        });
    }

    private void runBulkCheck(List<PendingCheck> batch) {
        List<BulkCheckItem> items = new ArrayList<>();
        for (PendingCheck check : batch) {
            items.add(new BulkCheckItem(check.job.work.getDeviceAssetId(), check.checksum));
        }

        Map<String, BulkCheckResult> resultsById = new HashMap<>();
        long start = System.currentTimeMillis();
        try {
            for (BulkCheckResult result : store.bulkUploadCheck(items)) {
                resultsById.putIfAbsent(result.getId(), result);
            }
            log.debug("bulk upload check of {} item(s) took {}ms", items.size(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            // treat the whole batch as not duplicate; the server still dedups on upload
            log.warn("bulk upload check of {} item(s) failed", items.size(), e);
            emit("ERROR bulk upload check failed (" + items.size() + " ids): " + SyncUtil.summarize(e));
        }

        for (PendingCheck check : batch) {
            String id = check.job.work.getDeviceAssetId();
            try {
                BulkCheckResult result = resultsById.get(id);
                if (result != null && result.isDuplicate()) {
                    log.debug("{} is a duplicate of server asset {}, skipping upload", id, result.getAssetId());
                    duplicates.incrementAndGet();
                    finish(check.job, result.getAssetId(), null);
                } else {
                    startUpload(check.job, check.checksum);
                }
            } catch (RuntimeException e) {
                finish(check.job, null, e);
            }
        }
    }

    // must hold lock
    private boolean anyAwaitingBulk() {
        for (PendingCheck check : pendingBulk) {
            if (check.job.work.isAwaitResult()) return true;
        }
        return false;
    }

    // must hold lock
    private void scheduleBulkFlush() {
        if (bulkFlushTimer != null || bulkInProgress || pendingBulk.isEmpty() || closed) return;
        if (pendingBulk.size() >= options.getBulkCheckBatchSize()) return;
        bulkFlushTimer = timer.schedule(() -> {
            synchronized (lock) {
                bulkFlushTimer = null;
                maybeStartBulkCheck(true);
            }
        }, FLUSH_DELAY_MS, TimeUnit.MILLISECONDS);
    }

    // must hold lock
    private void cancelBulkFlushTimer() {
        if (bulkFlushTimer != null) bulkFlushTimer.cancel(false);
        bulkFlushTimer = null;
    }

    // must hold lock
    private void maybeStartExistCheck(boolean force) {
        if (existInProgress || cache.queuedCount() == 0 || closed) return;
        int batchSize = Math.max(1, options.getExistBatchSize());
        if (!force && cache.queuedCount() < batchSize) return;

        existInProgress = true;
        cancelExistFlushTimer();
        List<String> batch = cache.takeBatch(batchSize);
        log.debug("existence check batch starting ({} ids)", batch.size());

        networkExecutor.submit(() -> {
            long start = System.currentTimeMillis();
            Set<String> existing = Collections.emptySet();
            try {
                existing = store.checkExisting(options.getDeviceId(), batch);
                log.debug("existence check batch complete ({} ids, {}ms)", batch.size(),
                        System.currentTimeMillis() - start);
            } catch (RuntimeException e) {
                // known but not existing, so nothing stalls waiting on these ids
                log.warn("existence check batch of {} id(s) failed", batch.size(), e);
                emit("ERROR existence check batch failed (" + batch.size() + " ids, "
                        + (System.currentTimeMillis() - start) + "ms): " + SyncUtil.summarize(e));
            } finally {
                synchronized (lock) {
                    cache.markChecked(batch, existing);
                    reportExistProgress(false);
                    existInProgress = false;
                    scheduleExistFlush();
                    maybeStartExistCheck(draining);
                }
            }
        });
    }

    // must hold lock
    private void reportExistProgress(boolean force) {
        int checked = cache.knownCount();
        int total = checked + cache.pendingCount();
        if (total == 0) return;

        boolean firstReport = lastExistReportChecked < 0 || lastExistReportTotal < 0;
        if (!force && !firstReport
                && Math.abs(checked - lastExistReportChecked) < EXIST_REPORT_CHECKED_DELTA
                && Math.abs(total - lastExistReportTotal) < EXIST_REPORT_TOTAL_DELTA) return;

        lastExistReportChecked = checked;
        lastExistReportTotal = total;
        listener.onEvent(SyncEvent.existenceCheck(checked, total));
    }

    // must hold lock
    private void scheduleExistFlush() {
        if (existFlushTimer != null || existInProgress || cache.queuedCount() == 0 || closed) return;
        if (cache.queuedCount() >= options.getExistBatchSize()) return;
        existFlushTimer = timer.schedule(() -> {
            synchronized (lock) {
                existFlushTimer = null;
                maybeStartExistCheck(true);
            }
        }, FLUSH_DELAY_MS, TimeUnit.MILLISECONDS);
    }

    // must hold lock
    private void cancelExistFlushTimer() {
        if (existFlushTimer != null) existFlushTimer.cancel(false);
        existFlushTimer = null;
    }

    private void startUpload(Job job, String checksum) {
        try {
            uploadLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(job, null, UploadException.cancelled(job.work.getDeviceAssetId()));
            return;
        }
        try {
            uploadExecutor.submit(() -> {
                String remoteId = null;
                Throwable failure = null;
                try {
                    remoteId = upload(job.work, checksum);
                } catch (Throwable t) {
                    failure = t;
                    if (failureArchive != null) failureArchive.archive(job.work, checksum, t);
                } finally {
                    uploadLimiter.release();
                }
                finish(job, remoteId, failure);
            });
        } catch (RejectedExecutionException e) {
            uploadLimiter.release();
            finish(job, null, e);
        }
    }

    private String upload(UploadWorkItem work, String checksum) {
        String id = work.getDeviceAssetId();
        boolean replace;
        synchronized (lock) {
            replace = options.isUpdateChangedAssets() && cache.exists(id);
        }
        if (replace) replaceExisting(work);

        UploadRequest request = new UploadRequest();
        Instant createdAt = work.getFileCreatedAt() == null ? Instant.now() : work.getFileCreatedAt();
        request.setFile(work.getFile());
        request.setDeviceId(options.getDeviceId());
        request.setDeviceAssetId(id);
        request.setFileCreatedAt(createdAt);
        request.setFileModifiedAt(work.getFileModifiedAt() == null ? createdAt : work.getFileModifiedAt());
        request.setFilename(work.getFilename());
        request.setDurationSeconds(work.getDurationSeconds());
        request.setFavorite(work.getFavorite());
        request.setLivePhotoVideoId(work.getLivePhotoVideoId());
        request.setMetadata(work.getMetadata());
        request.setChecksum(checksum);

        UploadResult result = store.upload(request);
        uploaded.incrementAndGet();
        log.debug("upload {} ({} -> {})", result.getStatus(), id, result.getId());
        return result.getId();
    }

    private void replaceExisting(UploadWorkItem work) {
        String id = work.getDeviceAssetId();
        try {
            RemoteAsset existing = store.findByDeviceAssetId(options.getDeviceId(), id);
            if (existing != null && existing.getId() != null) {
                emit("Replacing existing server asset (" + id + ")");
                store.deleteAssets(Collections.singletonList(existing.getId()));
                replaced.incrementAndGet();
            } else {
                emit("ERROR could not resolve existing server asset id (" + id + "); uploading anyway");
            }
        } catch (RuntimeException e) {
            emit("ERROR could not delete existing server asset (" + id + "): " + SyncUtil.summarize(e));
        }
    }

    private void finish(Job job, String remoteId, Throwable error) {
        UploadWorkItem work = job.work;
        try {
            SyncUtil.deleteQuietly(work.getDeleteAfterUpload());
            if (error == null) {
                work.getCallback().onSuccess(work, remoteId);
            } else {
                emit("ERROR upload failed (" + work.getDeviceAssetId() + "): " + SyncUtil.summarize(error));
                // awaited failures surface to the caller, which counts them itself
                if (!work.isAwaitResult()) uploadFailures.incrementAndGet();
                work.getCallback().onFailure(work, error);
            }
        } catch (RuntimeException e) {
            log.warn("upload callback failed for {}", work.getDeviceAssetId(), e);
        } finally {
            if (job.result != null) {
                if (error == null) job.result.complete(remoteId);
                else job.result.completeExceptionally(error);
            }
            group.leave();
            inFlightLimiter.release();
        }
    }

    private void emit(String message) {
        if (message.startsWith("ERROR")) log.warn(message);
        else log.info(message);
        listener.onEvent(SyncEvent.message(message));
    }

    /**
     * Uploads that failed without a synchronous caller to report to
     */
    public long getUploadFailureCount() {
        return uploadFailures.get();
    }

    public long getUploadedCount() {
        return uploaded.get();
    }

    public long getDuplicateCount() {
        return duplicates.get();
    }

    public long getSkippedExistingCount() {
        return skippedExisting.get();
    }

    public long getReplacedCount() {
        return replaced.get();
    }

    public int getInFlightCount() {
        return group.size();
    }

    public boolean existsRemotely(String deviceAssetId) {
        synchronized (lock) {
            return cache.exists(deviceAssetId);
        }
    }

    public boolean isExistenceCheckComplete() {
        synchronized (lock) {
            return cache.isComplete();
        }
    }

    /**
     * Stops all pools. Items still buffered for a checksum check (only possible after a cancel) are dropped and
     * their temp files removed.
     */
    @Override
    public void close() {
        List<PendingCheck> dropped;
        synchronized (lock) {
            closed = true;
            cancelBulkFlushTimer();
            cancelExistFlushTimer();
            dropped = new ArrayList<>(pendingBulk);
            pendingBulk.clear();
        }
        for (PendingCheck check : dropped) {
            SyncUtil.deleteQuietly(check.job.work.getDeleteAfterUpload());
            if (check.job.result != null)
                check.job.result.completeExceptionally(UploadException.cancelled(check.job.work.getDeviceAssetId()));
            group.leave();
            inFlightLimiter.release();
        }
        if (!dropped.isEmpty()) log.info("dropped {} upload(s) waiting for a checksum check", dropped.size());

        timer.shutdownNow();
        hashExecutor.shutdownAndWait(30, TimeUnit.SECONDS);
        uploadExecutor.shutdownAndWait(30, TimeUnit.SECONDS);
        networkExecutor.shutdownAndWait(30, TimeUnit.SECONDS);
    }

    static class SweepBatch {
        final List<String> ids = new ArrayList<>();
        int units;
    }

    private static class Job {
        final UploadWorkItem work;
        final CompletableFuture<String> result;

        Job(UploadWorkItem work, CompletableFuture<String> result) {
            this.work = work;
            this.result = result;
        }
    }

    private static class PendingCheck {
        final Job job;
        final String checksum;

        PendingCheck(Job job, String checksum) {
            this.job = job;
            this.checksum = checksum;
        }
    }

    /**
     * Counts items between enqueue and finish
     */
    private static class WorkGroup {
        private int count;

        synchronized void enter() {
            count++;
        }

        synchronized void leave() {
            if (--count <= 0) {
                count = 0;
                notifyAll();
            }
        }

        synchronized void await() throws InterruptedException {
            while (count > 0) wait();
        }

        synchronized int size() {
            return count;
        }
    }
}
