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
package com.mediabridge.sync.retry;

import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.Variant;
import com.mediabridge.sync.source.AssetSource;
import com.mediabridge.sync.source.ExportException;
import com.mediabridge.sync.util.EnhancedThreadPoolExecutor;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Runs single export attempts with classified retry and an adaptive timeout.
 * <p>
 * Each attempt writes into a fresh temp file in the work directory and runs on a worker thread while the calling
 * thread polls in fixed ticks. On every tick the stop check is consulted, and the timeout is extended to
 * {@link RetryPolicy#extendedTimeoutMs()} once the source has reported partial progress. Failed attempts are
 * cleaned up before the next one starts: a cancelled attempt is given up to {@link #CANCEL_GRACE_MS} to stop, and
 * whatever it still writes after that is deleted when it finally returns.
 */
public class RetryController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    public static final String TEMP_PREFIX = ".tmp-";
    public static final int EXPORT_POOL_SIZE = 2;
    public static final long CANCEL_GRACE_MS = 2000;

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final BooleanSupplier stopCheck;
    private final SyncListener listener;
    private final EnhancedThreadPoolExecutor exportExecutor;

    public RetryController(RetryPolicy policy, Sleeper sleeper, BooleanSupplier stopCheck, SyncListener listener) {
        this.policy = policy;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.stopCheck = stopCheck == null ? () -> false : stopCheck;
        this.listener = listener == null ? event -> {
        } : listener;
        this.exportExecutor = new EnhancedThreadPoolExecutor(EXPORT_POOL_SIZE, "export-pool");
    }

    /**
     * Materializes one variant into a new temp file under {@code workDir}. The returned file belongs to the caller.
     *
     * @throws ExportException when the failure is not retryable or all attempts are used up; a
     *                         {@link ExportException.Type#Cancelled} outcome means the run was stopped by the user
     */
    public File export(AssetSource source, CandidateItem item, Variant variant, File workDir) throws ExportException {
        int attempt = 0;
        while (true) {
            if (stopCheck.getAsBoolean()) throw stopped();

            File temp = new File(workDir, TEMP_PREFIX + UUID.randomUUID());
            try {
                runAttempt(source, item, variant, temp);
                return temp;
            } catch (ExportException e) {
                SyncUtil.deleteQuietly(temp);
                if (!e.isRetryable() || attempt >= policy.getMaxRetries()) throw e;

                long delay = policy.delayFor(attempt);
                attempt++;
                log.info("{} {} failed ({}), retrying in {}ms [attempt {}/{}]", item.getId(), variant.getType(),
                        e.getMessage(), delay, attempt + 1, policy.getMaxAttempts());
                listener.onEvent(SyncEvent.retrying(attempt + 1, policy.getMaxAttempts(), item.getId(), e.getMessage()));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ExportException(ExportException.Type.Cancelled, "interrupted while waiting to retry", ie);
                }
            }
        }
    }

    void runAttempt(AssetSource source, CandidateItem item, Variant variant, File temp) throws ExportException {
        AtomicReference<Double> progress = new AtomicReference<>();
        Attempt attempt = new Attempt();
        attempt.future = exportExecutor.submit(() -> {
            attempt.started = true;
            try {
                source.export(item, variant, temp, fraction -> {
                    progress.set(fraction);
                    listener.onEvent(SyncEvent.downloading(item.getId(), fraction));
                });
                return null;
            } finally {
                if (attempt.abandoned) SyncUtil.deleteQuietly(temp);
                attempt.done.countDown();
            }
        });
        Future<Void> future = attempt.future;

        long timeout = policy.getTimeoutMs();
        long start = System.currentTimeMillis();
        while (true) {
            try {
                future.get(policy.getTickMs(), TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                // still running
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ExportException) throw (ExportException) cause;
                throw new ExportException(ExportException.Type.Failed, SyncUtil.summarize(cause), cause);
            } catch (InterruptedException e) {
                abandon(attempt, item, variant);
                Thread.currentThread().interrupt();
                throw new ExportException(ExportException.Type.Cancelled, "interrupted during export", e);
            }

            if (stopCheck.getAsBoolean()) {
                abandon(attempt, item, variant);
                throw stopped();
            }

            Double fraction = progress.get();
            if (fraction != null && fraction < 1.0 && policy.extendedTimeoutMs() > timeout) {
                timeout = policy.extendedTimeoutMs();
                log.debug("{} {} is still transferring ({}%), timeout extended to {}ms", item.getId(),
                        variant.getType(), Math.round(fraction * 100), timeout);
            }

            if (System.currentTimeMillis() - start >= timeout) {
                abandon(attempt, item, variant);
                throw new ExportException(ExportException.Type.Timeout, "export timed out after " + timeout + "ms");
            }
        }
    }

    /**
     * Cancels the attempt and waits for its worker to return, so a source that ignores interrupts does not overlap
     * the next attempt.
     */
    private void abandon(Attempt attempt, CandidateItem item, Variant variant) {
        attempt.abandoned = true;
        attempt.future.cancel(true);
        // a task cancelled before it started never runs
        if (!attempt.started) return;
        boolean interrupted = Thread.interrupted();
        try {
            if (!attempt.done.await(CANCEL_GRACE_MS, TimeUnit.MILLISECONDS))
                log.warn("{} {} did not stop within {}ms of being cancelled; its output will be discarded",
                        item.getId(), variant.getType(), CANCEL_GRACE_MS);
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private ExportException stopped() {
        return new ExportException(ExportException.Type.Cancelled, "stopped by user");
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    @Override
    public void close() {
        exportExecutor.shutdownNow();
    }

    private static class Attempt {
        final CountDownLatch done = new CountDownLatch(1);
        volatile Future<Void> future;
        volatile boolean started;
        volatile boolean abandoned;
    }
}
