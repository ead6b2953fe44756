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

import com.mediabridge.sync.album.AlbumCollector;
import com.mediabridge.sync.album.AlbumSync;
import com.mediabridge.sync.config.BackupMode;
import com.mediabridge.sync.config.ConfigurationException;
import com.mediabridge.sync.config.ExportMode;
import com.mediabridge.sync.config.MediaFilter;
import com.mediabridge.sync.config.SortOrder;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.config.UploadOptions;
import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.MediaKind;
import com.mediabridge.sync.model.SourceAlbum;
import com.mediabridge.sync.model.Variant;
import com.mediabridge.sync.model.VariantType;
import com.mediabridge.sync.pipeline.ContentHasher;
import com.mediabridge.sync.pipeline.FailureArchive;
import com.mediabridge.sync.pipeline.UploadCallback;
import com.mediabridge.sync.pipeline.UploadException;
import com.mediabridge.sync.pipeline.UploadPipeline;
import com.mediabridge.sync.pipeline.UploadWorkItem;
import com.mediabridge.sync.placement.FilePlacer;
import com.mediabridge.sync.placement.OutputLayout;
import com.mediabridge.sync.placement.PlacementResult;
import com.mediabridge.sync.remote.RemoteStore;
import com.mediabridge.sync.remote.ServerStats;
import com.mediabridge.sync.retry.RetryController;
import com.mediabridge.sync.retry.RetryPolicy;
import com.mediabridge.sync.retry.Sleeper;
import com.mediabridge.sync.service.ManifestEntry;
import com.mediabridge.sync.service.ManifestKeys;
import com.mediabridge.sync.service.ManifestService;
import com.mediabridge.sync.service.SqliteManifestService;
import com.mediabridge.sync.session.ConfigFingerprint;
import com.mediabridge.sync.session.RunSession;
import com.mediabridge.sync.source.AssetSource;
import com.mediabridge.sync.source.ExportException;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Runs one media backup: enumerates the source, decides per variant whether work is needed, exports with retries,
 * places files in the destination, hands them to the upload pipeline, syncs albums and finally prunes mirrored
 * outputs. A run is single-use; create a new instance for the next one.
 * <p>
 * Pause and cancel requests are observed between items (and, for cancel, inside exports and uploads). A paused run
 * leaves a {@link RunSession} in its result that can be passed to a later run via {@link #setResumeSession}.
 */
public class MediaSync implements Runnable, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MediaSync.class);

    public static final String MANIFEST_DIR = ".media-sync";
    public static final String MANIFEST_FILE = "manifest.sqlite";
    public static final String WORK_DIR = ".media-sync-tmp";
    public static final String METADATA_KEY = "mobile-app";

    private volatile boolean closed;
    private final SyncStats stats = new SyncStats();

    private SyncConfig syncConfig;
    private AssetSource source;
    private RemoteStore remoteStore;
    private ManifestService manifest;
    private boolean ownsManifest;
    private SyncListener listener;
    private RunControl runControl = new RunControl();
    private RunSession resumeSession;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private ContentHasher hasher = ContentHasher.SHA1;
    private OutputLayout layout = new OutputLayout();
    private RetryPolicy retryPolicy;
    private final FilePlacer placer = new FilePlacer();

    private String runId;
    private SyncResult result;
    private Throwable runError;

    // per-run state
    private RetryController retryController;
    private UploadPipeline pipeline;
    private AlbumCollector albumCollector;
    private File destination;
    private File workDir;
    private boolean ownsWorkDir;
    private final Set<String> errorIds = ConcurrentHashMap.newKeySet();

    public synchronized void run() {
        try {
            assert !closed : "this instance has been closed";
            assert syncConfig != null : "syncConfig is null";
            assert source != null : "source is null";

            final SyncOptions options = syncConfig.getOptions();
            final UploadOptions upload = syncConfig.getUpload();
            if (listener == null) listener = event -> {
            };

            if (options.getDestination() == null && upload == null)
                throw new ConfigurationException("at least one of a destination folder or an upload server is required");
            if (upload != null && remoteStore == null)
                throw new ConfigurationException("upload is configured but no remote store was provided");

            runId = UUID.randomUUID().toString();
            stats.start();
            log.info("starting run {} ({} mode, {} export{})", runId, options.getBackupMode(), options.getExportMode(),
                    options.isDryRun() ? ", dry run" : "");

            prepareDirectories(options);
            if (manifest == null && destination != null && options.getBackupMode() != BackupMode.full) {
                manifest = openManifest(destination);
                ownsManifest = true;
            }

            // enumerate and narrow the candidate list
            listener.onEvent(SyncEvent.scanning());
            List<CandidateItem> items;
            try {
                items = source.listItems();
            } catch (ExportException e) {
                throw new RuntimeException("could not enumerate source " + source.getName() + ": " + e.getMessage(), e);
            }
            int listed = items.size();
            items = filterItems(items, options);
            log.info("{} of {} source item(s) selected", items.size(), listed);

            if (upload != null && upload.isSyncAlbums()) prepareAlbums(items);

            // resume
            String fingerprint = ConfigFingerprint.of(syncConfig);
            RunSession session = acceptResumeSession(fingerprint);
            Set<String> processedIds = new LinkedHashSet<>();
            if (session != null) {
                processedIds.addAll(session.getProcessedIds());
                errorIds.addAll(session.getErrorIds());
                touchProcessedItems(items, processedIds);
                items = reorderForResume(items, session, processedIds);
            }

            int total = items.size();
            listener.onEvent(SyncEvent.willExport(total));

            retryController = new RetryController(retryPolicy != null ? retryPolicy : RetryPolicy.fromOptions(options),
                    sleeper, runControl::isCancelled, listener);

            if (upload != null && !options.isDryRun()) startPipeline(options, upload, items);

            // main loop
            boolean paused = false, cancelled = false;
            Integer pauseIndex = null;
            for (int i = 0; i < total; i++) {
                RunState state = runControl.getState();
                if (state == RunState.cancelled) {
                    cancelled = true;
                    break;
                }
                if (state == RunState.paused) {
                    paused = true;
                    pauseIndex = i;
                    listener.onEvent(SyncEvent.paused(i, total));
                    break;
                }

                CandidateItem item = items.get(i);
                stats.incItemsAttempted();
                ItemTally tally = processItem(item, i, total, options);

                if (tally.stopped) {
                    // partial progress for this item is discarded
                    cancelled = true;
                    break;
                }
                processedIds.add(item.getId());
                if (!tally.hadWork) {
                    stats.incItemsSkipped();
                } else if (tally.errors > 0) {
                    stats.incItemsCompleted();
                    stats.incErrors(tally.errors);
                    errorIds.add(item.getId());
                } else if (!tally.changed) {
                    stats.incItemsSkipped();
                } else {
                    stats.incItemsCompleted();
                }
            }
            if (!cancelled && runControl.isCancelled()) cancelled = true;

            if (pipeline != null && !cancelled) {
                emit("Waiting for uploads to finish...");
                pipeline.finishAndWait();
            }

            int albumsSynced = 0;
            if (albumCollector != null && pipeline != null && !cancelled) {
                albumsSynced = new AlbumSync(remoteStore, listener, runControl::isCancelled).sync(albumCollector);
            }

            int mirrorDeleted = 0;
            if (options.getBackupMode() == BackupMode.mirror && !paused && !cancelled && !options.isDryRun()
                    && manifest != null && destination != null) {
                MirrorCleaner cleaner = new MirrorCleaner(manifest, destination, listener, runControl::isCancelled);
                cleaner.clean(runId, ManifestKeys.PHOTO_PREFIX);
                mirrorDeleted = cleaner.getDeletedFiles();
                stats.incErrors(cleaner.getErrors());
                if (mirrorDeleted > 0) emit("Mirror: deleted " + mirrorDeleted + " file(s)");
            }

            if (pipeline != null) stats.incErrors(pipeline.getUploadFailureCount());

            result = buildResult(processedIds, paused, cancelled, pauseIndex, mirrorDeleted, albumsSynced);
            if (paused) result.setSession(buildSession(session, fingerprint, processedIds, pauseIndex));

            log.info("run {} finished: {}", runId, result);
            log.info(stats.getStatsString());
        } catch (Throwable t) {
            log.error("unexpected exception", t);
            runError = t;
            throw t;
        } finally {
            stats.stop();
            if (ownsWorkDir && !workDir.delete()) log.debug("work directory {} not removed (not empty)", workDir);

            // clean up per-run resources and plugins
            close();
        }
    }

    private void prepareDirectories(SyncOptions options) {
        if (options.getDestination() != null) {
            destination = new File(options.getDestination());
            try {
                SyncUtil.ensureDir(destination);
            } catch (IOException e) {
                throw new ConfigurationException("cannot create destination " + destination + ": " + e.getMessage(), e);
            }
        }
        if (options.getWorkDir() != null) {
            workDir = new File(options.getWorkDir());
        } else {
            if (destination != null) workDir = new File(destination, WORK_DIR);
            else workDir = new File(System.getProperty("java.io.tmpdir"), "media-sync-" + runId);
            ownsWorkDir = true;
        }
        try {
            SyncUtil.ensureDir(workDir);
        } catch (IOException e) {
            throw new ConfigurationException("cannot create work directory " + workDir + ": " + e.getMessage(), e);
        }
    }

    /**
     * Opens (creating if needed) the manifest kept under a destination folder
     */
    public static ManifestService openManifest(File destination) {
        File manifestDir = new File(destination, MANIFEST_DIR);
        try {
            SyncUtil.ensureDir(manifestDir);
        } catch (IOException e) {
            throw new ConfigurationException("cannot create manifest directory " + manifestDir + ": " + e.getMessage(), e);
        }
        return new SqliteManifestService(new File(manifestDir, MANIFEST_FILE));
    }

    List<CandidateItem> filterItems(List<CandidateItem> items, SyncOptions options) {
        MediaFilter filter = options.getMediaFilter();
        Instant since = parseSince(options.getSince());

        List<CandidateItem> selected = items.stream()
                .filter(item -> filter != MediaFilter.images || item.getKind() == MediaKind.image)
                .filter(item -> filter != MediaFilter.videos || item.getKind() == MediaKind.video)
                .filter(item -> since == null || (item.getCreatedAt() != null && !item.getCreatedAt().isBefore(since)))
                .collect(Collectors.toList());

        // items without a creation date sort as the oldest
        Comparator<CandidateItem> byCreated = Comparator.comparing(
                item -> item.getCreatedAt() == null ? Instant.MIN : item.getCreatedAt());
        selected.sort(options.getSortOrder() == SortOrder.newestFirst ? byCreated.reversed() : byCreated);

        if (options.getLimit() > 0 && selected.size() > options.getLimit())
            selected = new ArrayList<>(selected.subList(0, options.getLimit()));
        return selected;
    }

    /**
     * Accepts either a local date (start of that day in the layout's zone) or an ISO-8601 instant
     */
    Instant parseSince(String since) {
        if (since == null || since.trim().isEmpty()) return null;
        try {
            return LocalDate.parse(since.trim()).atStartOfDay(layout.getZone()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(since.trim());
            } catch (DateTimeParseException e2) {
                throw new ConfigurationException("invalid since date: " + since + " (expected yyyy-MM-dd or an ISO-8601 instant)");
            }
        }
    }

    private RunSession acceptResumeSession(String fingerprint) {
        if (resumeSession == null) return null;
        if (!fingerprint.equals(resumeSession.getFingerprint())) {
            log.warn("saved session {} was created with a different configuration; starting a fresh run",
                    resumeSession.getSessionId());
            emit("Configuration changed since the run was paused; starting over");
            return null;
        }
        return resumeSession;
    }

    /**
     * Carries the manifest entries of items finished before the pause into this run, so the mirror sweep only sees
     * outputs whose items left the source.
     */
    private void touchProcessedItems(List<CandidateItem> items, Set<String> processedIds) {
        if (manifest == null) return;
        int touched = 0;
        for (CandidateItem item : items) {
            if (!processedIds.contains(item.getId())) continue;
            for (VariantType type : VariantType.values()) {
                touch(ManifestKeys.photoKey(item.getId(), type));
            }
            touched++;
        }
        log.debug("carried manifest entries of {} previously processed item(s) into run {}", touched, runId);
    }

    /**
     * Items created after the pause and not yet processed come first, then the remaining unprocessed items in their
     * original order.
     */
    List<CandidateItem> reorderForResume(List<CandidateItem> items, RunSession session, Set<String> processedIds) {
        Instant pausedAt = session.getPausedAt() == null ? null : Instant.ofEpochMilli(session.getPausedAt());
        List<CandidateItem> newer = new ArrayList<>(), remaining = new ArrayList<>();
        for (CandidateItem item : items) {
            if (processedIds.contains(item.getId())) continue;
            if (pausedAt != null && item.getCreatedAt() != null && item.getCreatedAt().isAfter(pausedAt)) newer.add(item);
            else remaining.add(item);
        }
        if (newer.isEmpty()) emit("Resuming: " + remaining.size() + " remaining item(s)");
        else emit("Resuming: " + newer.size() + " newer item(s), " + remaining.size() + " remaining");
        newer.addAll(remaining);
        return newer;
    }

    private void prepareAlbums(List<CandidateItem> items) {
        try {
            List<SourceAlbum> albums = source.listAlbums();
            Set<String> inScope = items.stream().map(CandidateItem::getId).collect(Collectors.toSet());
            albumCollector = new AlbumCollector(albums, inScope);
        } catch (ExportException e) {
            log.warn("could not list source albums", e);
            emit("ERROR listing albums: " + e.getMessage());
        }
    }

    private void startPipeline(SyncOptions options, UploadOptions upload, List<CandidateItem> items) {
        FailureArchive archive = options.getFailureArchiveDir() == null ? null
                : new FailureArchive(new File(options.getFailureArchiveDir()));
        pipeline = new UploadPipeline(upload, remoteStore, listener, runControl::isCancelled, hasher, archive);

        try {
            ServerStats serverStats = remoteStore.getStatistics();
            emit("Server has " + serverStats.getTotal() + " assets (" + serverStats.getImages() + " images, "
                    + serverStats.getVideos() + " videos)");
        } catch (RuntimeException e) {
            log.warn("could not fetch server statistics", e);
            emit("ERROR fetching server statistics: " + SyncUtil.summarize(e));
        }

        List<List<String>> idsPerItem = new ArrayList<>();
        for (CandidateItem item : items) {
            idsPerItem.add(deviceAssetIds(item, options));
        }
        pipeline.sweepExisting(idsPerItem);
    }

    /**
     * Variants of an item in processing order. A paired video is always first because its remote id links the
     * still image.
     */
    List<Variant> planVariants(CandidateItem item, SyncOptions options) {
        List<Variant> plan = new ArrayList<>();
        ExportMode exportMode = options.getExportMode();
        if (exportMode.includesOriginals()) {
            Variant paired = item.getVariant(VariantType.pairedVideo);
            if (paired != null) plan.add(paired);
            Variant still = item.getVariant(VariantType.original);
            if (still != null) plan.add(still);
            if (options.isIncludeAdjustmentData()) {
                Variant adjustments = item.getVariant(VariantType.adjustments);
                if (adjustments != null) plan.add(adjustments);
            }
            Variant video = item.getVariant(VariantType.video);
            if (paired == null && video != null) plan.add(video);
        }
        if (exportMode.includesEdited() && item.getKind() == MediaKind.image) {
            Variant edited = item.getVariant(VariantType.edited);
            plan.add(edited != null ? edited : Variant.rendered());
        }
        return plan;
    }

    private List<String> deviceAssetIds(CandidateItem item, SyncOptions options) {
        return planVariants(item, options).stream()
                .map(variant -> variant.getType().remoteId(item.getId()))
                .collect(Collectors.toList());
    }

    private ItemTally processItem(CandidateItem item, int index, int total, SyncOptions options) {
        listener.onEvent(SyncEvent.exporting(index + 1, total, item.getId(),
                layout.baseName(item.getCreatedAt(), item.getId())));

        ItemTally tally = new ItemTally();
        List<Variant> plan = planVariants(item, options);
        if (plan.isEmpty()) return tally;
        if (pipeline != null) pipeline.submitExistChecks(deviceAssetIds(item, options));

        List<SourceAlbum> albums = albumCollector == null ? Collections.emptyList() : albumCollector.albumsFor(item.getId());

        String livePhotoVideoId = null;
        for (Variant variant : plan) {
            if (tally.stopped) break;
            boolean paired = variant.getType() == VariantType.pairedVideo;
            String remoteId = processVariant(item, variant, paired, paired ? null : livePhotoVideoId, albums, options,
                    tally);
            if (paired) livePhotoVideoId = remoteId;
        }
        return tally;
    }

    /**
     * @return the remote id for awaited uploads, otherwise null
     */
    private String processVariant(CandidateItem item, Variant variant, boolean awaitResult, String livePhotoVideoId,
                                  List<SourceAlbum> albums, SyncOptions options, ItemTally tally) {
        VariantType type = variant.getType();
        tally.hadWork = true;

        String fileName = layout.fileName(item, variant);
        String relPath = layout.relativePath(item, variant);
        File desired = destination == null ? null : new File(destination, relPath);
        String key = ManifestKeys.photoKey(item.getId(), type);
        String signature = ManifestKeys.photoSignature(item, type, variant.getResourceName());

        if (options.getBackupMode() != BackupMode.full && isUnchanged(key, signature, relPath, desired)) {
            log.debug("{} is unchanged, skipping", key);
            stats.incVariantsSkipped();
            if (!options.isDryRun()) touch(key);
            return null;
        }

        if (options.isDryRun()) {
            log.info("[dry run] would export {} to {}", key, relPath);
            tally.changed = true;
            return null;
        }

        File temp;
        try {
            temp = retryController.export(source, item, variant, workDir);
        } catch (ExportException e) {
            if (e.getType() == ExportException.Type.Cancelled && runControl.isCancelled()) {
                tally.stopped = true;
                return null;
            }
            variantError(item, type, "ERROR processing " + type + " (" + item.getId() + "): " + e.getMessage(), e, tally);
            return null;
        }

        File uploadFile = temp;
        File deleteAfterUpload = temp;
        try {
            if (desired != null) {
                PlacementResult placement = placer.place(temp, desired);
                uploadFile = placement.getFile();
                deleteAfterUpload = null;
                if (placement.isExported()) {
                    tally.changed = true;
                    stats.incVariantsExported(uploadFile.length());
                } else {
                    stats.incVariantsSkipped();
                }
            }

            String remoteId = null;
            if (pipeline != null) {
                UploadWorkItem work = new UploadWorkItem(uploadFile, type.remoteId(item.getId()))
                        .withDeleteAfterUpload(deleteAfterUpload)
                        .withFilename(fileName)
                        .withFileCreatedAt(item.getCreatedAt())
                        .withFileModifiedAt(item.getModifiedAt())
                        .withDurationSeconds(item.getKind() == MediaKind.video ? item.getDurationSeconds() : null)
                        .withFavorite(item.isFavorite())
                        .withLivePhotoVideoId(livePhotoVideoId)
                        .withMetadata(uploadMetadata(item, variant))
                        .withAwaitResult(awaitResult)
                        .withCallback(new ItemUploadCallback(item, type, albums, awaitResult));
                deleteAfterUpload = null;
                remoteId = pipeline.enqueue(work);
                if (!work.isSkippedExisting()) tally.changed = true;
            } else if (deleteAfterUpload != null) {
                SyncUtil.deleteQuietly(deleteAfterUpload);
            }

            if (desired != null && manifest != null) {
                manifest.upsert(new ManifestEntry(key, relPath, signature, uploadFile.length(),
                        uploadFile.lastModified() / 1000.0, runId));
            }
            return remoteId;
        } catch (UploadException e) {
            if (e.isCancelled()) {
                tally.stopped = true;
                return null;
            }
            variantError(item, type, "ERROR uploading " + type + " (" + item.getId() + "): " + e.getMessage(), e, tally);
        } catch (IOException | RuntimeException e) {
            SyncUtil.deleteQuietly(deleteAfterUpload);
            variantError(item, type, "ERROR processing " + type + " (" + item.getId() + "): " + SyncUtil.summarize(e),
                    e, tally);
        }
        return null;
    }

    private boolean isUnchanged(String key, String signature, String relPath, File desired) {
        if (manifest == null || desired == null) return false;
        ManifestEntry entry;
        try {
            entry = manifest.get(key);
        } catch (RuntimeException e) {
            log.warn("manifest lookup failed for {}; treating as changed", key, e);
            return false;
        }
        return entry != null && !entry.isDeleted() && signature.equals(entry.getSignature())
                && relPath.equals(entry.getRelPath()) && desired.exists();
    }

    private void touch(String key) {
        if (manifest == null) return;
        try {
            ManifestEntry entry = manifest.get(key);
            if (entry != null) manifest.upsert(entry.touch(runId));
        } catch (RuntimeException e) {
            log.warn("could not update manifest entry {}", key, e);
        }
    }

    private void variantError(CandidateItem item, VariantType type, String message, Throwable t, ItemTally tally) {
        tally.errors++;
        log.warn(message, t);
        stats.addFailedItem(new FailedItem(item.getId(), type.name(), message));
        listener.onEvent(SyncEvent.message(message));
    }

    private List<Map<String, Object>> uploadMetadata(CandidateItem item, Variant variant) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("source", source.getName());
        value.put("sourceItemId", item.getId());
        value.put("variant", variant.getType().name());
        value.put("originalFilename", variant.getResourceName());
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("key", METADATA_KEY);
        entry.put("value", value);
        return Collections.singletonList(entry);
    }

    private SyncResult buildResult(Set<String> processedIds, boolean paused, boolean cancelled, Integer pauseIndex,
                                   int mirrorDeleted, int albumsSynced) {
        SyncResult result = new SyncResult();
        result.setAttempted((int) stats.getItemsAttempted());
        result.setCompleted((int) stats.getItemsCompleted());
        result.setSkipped((int) stats.getItemsSkipped());
        result.setErrors((int) stats.getErrors());
        result.setPaused(paused);
        result.setCancelled(cancelled);
        result.setPauseIndex(pauseIndex);
        result.setProcessedIds(processedIds);
        result.setErrorIds(errorIds);
        result.setFailedItems(stats.getFailedItems());
        result.setMirrorDeleted(mirrorDeleted);
        result.setAlbumsSynced(albumsSynced);
        if (pipeline != null) {
            result.setUploaded(pipeline.getUploadedCount());
            result.setDuplicates(pipeline.getDuplicateCount());
            result.setSkippedExisting(pipeline.getSkippedExistingCount());
            result.setReplaced(pipeline.getReplacedCount());
        }
        return result;
    }

    private RunSession buildSession(RunSession previous, String fingerprint, Set<String> processedIds, int pauseIndex) {
        RunSession session = new RunSession();
        session.setStartedAt(stats.getStartTime());
        if (previous != null) {
            session.setSessionId(previous.getSessionId());
            session.setStartedAt(previous.getStartedAt());
            session.setAttempted(previous.getAttempted());
            session.setCompleted(previous.getCompleted());
            session.setSkipped(previous.getSkipped());
            session.setErrors(previous.getErrors());
        }
        session.setPausedAt(System.currentTimeMillis());
        session.setFingerprint(fingerprint);
        session.setProcessedIds(new LinkedHashSet<>(processedIds));
        session.setErrorIds(new LinkedHashSet<>(errorIds));
        session.setPauseIndex(pauseIndex);
        session.setAttempted(session.getAttempted() + result.getAttempted());
        session.setCompleted(session.getCompleted() + result.getCompleted());
        session.setSkipped(session.getSkipped() + result.getSkipped());
        session.setErrors(session.getErrors() + result.getErrors());
        return session;
    }

    private void emit(String message) {
        if (message.startsWith("ERROR")) log.warn(message);
        else log.info(message);
        listener.onEvent(SyncEvent.message(message));
    }

    @Override
    public void close() {
        // make sure this instance cannot be run again
        closed = true;
        safeClose(pipeline);
        safeClose(retryController);
        if (ownsManifest) safeClose(manifest);
        safeClose(source);
        safeClose(remoteStore);
    }

    private void safeClose(AutoCloseable closeable) {
        try {
            if (closeable != null) closeable.close();
        } catch (Throwable t) {
            log.warn("could not close " + closeable.getClass().getSimpleName(), t);
        }
    }

    /**
     * Registers remote ids for album membership and records fire-and-forget upload failures against their item.
     * Awaited failures surface from enqueue and are counted there.
     */
    private class ItemUploadCallback implements UploadCallback {
        private final CandidateItem item;
        private final VariantType type;
        private final List<SourceAlbum> albums;
        private final boolean awaited;

        ItemUploadCallback(CandidateItem item, VariantType type, List<SourceAlbum> albums, boolean awaited) {
            this.item = item;
            this.type = type;
            this.albums = albums;
            this.awaited = awaited;
        }

        @Override
        public void onSuccess(UploadWorkItem work, String remoteId) {
            if (remoteId != null && albumCollector != null && !albums.isEmpty()) albumCollector.add(remoteId, albums);
        }

        @Override
        public void onFailure(UploadWorkItem work, Throwable error) {
            if (awaited || (error instanceof UploadException && ((UploadException) error).isCancelled())) return;
            errorIds.add(item.getId());
            stats.addFailedItem(new FailedItem(item.getId(), type.name(), "upload failed: " + SyncUtil.summarize(error)));
        }
    }

    private static class ItemTally {
        boolean hadWork;
        boolean changed;
        boolean stopped;
        int errors;
    }

    public SyncConfig getSyncConfig() {
        return syncConfig;
    }

    public void setSyncConfig(SyncConfig syncConfig) {
        this.syncConfig = syncConfig;
    }

    public AssetSource getSource() {
        return source;
    }

    public void setSource(AssetSource source) {
        this.source = source;
    }

    public RemoteStore getRemoteStore() {
        return remoteStore;
    }

    public void setRemoteStore(RemoteStore remoteStore) {
        this.remoteStore = remoteStore;
    }

    public ManifestService getManifest() {
        return manifest;
    }

    /**
     * Supplies an open manifest. The caller keeps ownership; by default one is opened under the destination.
     */
    public void setManifest(ManifestService manifest) {
        this.manifest = manifest;
    }

    public SyncListener getListener() {
        return listener;
    }

    public void setListener(SyncListener listener) {
        this.listener = listener;
    }

    public RunControl getRunControl() {
        return runControl;
    }

    public void setRunControl(RunControl runControl) {
        this.runControl = runControl;
    }

    public RunSession getResumeSession() {
        return resumeSession;
    }

    public void setResumeSession(RunSession resumeSession) {
        this.resumeSession = resumeSession;
    }

    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public void setHasher(ContentHasher hasher) {
        this.hasher = hasher;
    }

    public OutputLayout getLayout() {
        return layout;
    }

    public void setLayout(OutputLayout layout) {
        this.layout = layout;
    }

    /**
     * Overrides the policy derived from the options
     */
    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public String getRunId() {
        return runId;
    }

    public SyncResult getResult() {
        return result;
    }

    public SyncStats getStats() {
        return stats;
    }

    public Throwable getRunError() {
        return runError;
    }
}
