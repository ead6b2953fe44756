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

import com.mediabridge.sync.config.BackupMode;
import com.mediabridge.sync.config.ConfigurationException;
import com.mediabridge.sync.config.ExportMode;
import com.mediabridge.sync.config.MediaFilter;
import com.mediabridge.sync.config.SortOrder;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.config.UploadOptions;
import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.MediaKind;
import com.mediabridge.sync.model.SourceAlbum;
import com.mediabridge.sync.model.Variant;
import com.mediabridge.sync.model.VariantType;
import com.mediabridge.sync.placement.OutputLayout;
import com.mediabridge.sync.remote.RemoteStore;
import com.mediabridge.sync.remote.UploadRequest;
import com.mediabridge.sync.retry.RetryPolicy;
import com.mediabridge.sync.session.RunSession;
import com.mediabridge.sync.source.ExportException;
import com.mediabridge.sync.test.EventCollector;
import com.mediabridge.sync.test.TestAssetSource;
import com.mediabridge.sync.test.TestRemoteStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class MediaSyncTest {
    @TempDir
    File destination;

    private final OutputLayout layout = new OutputLayout(ZoneOffset.UTC);

    private SyncConfig localConfig(BackupMode mode) {
        return new SyncConfig().withOptions(new SyncOptions()
                .withDestination(destination.getPath()).withBackupMode(mode));
    }

    private SyncResult run(SyncConfig config, TestAssetSource source, RemoteStore store, EventCollector events,
                           RunSession resume) {
        MediaSync sync = newSync(config, source, store, events);
        sync.setResumeSession(resume);
        sync.run();
        return sync.getResult();
    }

    private MediaSync newSync(SyncConfig config, TestAssetSource source, RemoteStore store, EventCollector events) {
        MediaSync sync = new MediaSync();
        sync.setSyncConfig(config);
        sync.setSource(source);
        sync.setRemoteStore(store);
        sync.setListener(events);
        sync.setLayout(layout);
        sync.setSleeper(ms -> {
        });
        sync.setRetryPolicy(new RetryPolicy(2, 1, 10, 30000, 3, 10));
        return sync;
    }

    private File outputFor(CandidateItem item, VariantType type) {
        return new File(destination, layout.relativePath(item, item.getVariant(type)));
    }

    @Test
    public void testInitialThenIncrementalRun() throws Exception {
        TestAssetSource source = new TestAssetSource().withImages(500);

        SyncResult result = run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);
        Assertions.assertEquals(500, result.getAttempted());
        Assertions.assertEquals(500, result.getCompleted());
        Assertions.assertEquals(0, result.getSkipped());
        Assertions.assertEquals(0, result.getErrors());
        Assertions.assertFalse(result.isPaused());
        Assertions.assertEquals(500, result.getProcessedIds().size());

        CandidateItem first = source.listItems().get(0);
        File output = outputFor(first, VariantType.original);
        Assertions.assertTrue(output.exists());
        Assertions.assertEquals("2023/06/01/2023-06-01_12-00-00_ITEM0000.heic",
                layout.relativePath(first, first.getVariant(VariantType.original)));
        Assertions.assertArrayEquals(TestAssetSource.content(first.getId(), VariantType.original, 0),
                Files.readAllBytes(output.toPath()));
        // temp files are gone
        Assertions.assertFalse(new File(destination, MediaSync.WORK_DIR).exists());
        Assertions.assertTrue(new File(destination, MediaSync.MANIFEST_DIR + "/" + MediaSync.MANIFEST_FILE).exists());

        TestAssetSource again = new TestAssetSource().withImages(500);
        result = run(localConfig(BackupMode.smartIncremental), again, null, new EventCollector(), null);
        Assertions.assertEquals(500, result.getAttempted());
        Assertions.assertEquals(0, result.getCompleted());
        Assertions.assertEquals(500, result.getSkipped());
        Assertions.assertEquals(0, result.getErrors());
        Assertions.assertTrue(again.getExports().isEmpty());
    }

    @Test
    public void testChangedItemIsExportedWithoutOverwriting() throws Exception {
        TestAssetSource source = new TestAssetSource().withImages(3);
        run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);

        CandidateItem original = source.listItems().get(1);
        CandidateItem modified = new CandidateItem(original.getId(), MediaKind.image, original.getCreatedAt(),
                original.getModifiedAt().plusSeconds(60), false, false, null, original.getVariants());
        source.removeItem(original.getId());
        source.withItem(modified);
        source.bumpRevision(original.getId());
        source.getExports().clear();

        SyncResult result = run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);
        Assertions.assertEquals(1, result.getCompleted());
        Assertions.assertEquals(2, result.getSkipped());
        Assertions.assertEquals(Collections.singletonList(original.getId()), source.getExports());

        File desired = outputFor(original, VariantType.original);
        File renamed = new File(desired.getParentFile(), desired.getName().replace(".heic", "_2.heic"));
        Assertions.assertArrayEquals(TestAssetSource.content(original.getId(), VariantType.original, 0),
                Files.readAllBytes(desired.toPath()));
        Assertions.assertArrayEquals(TestAssetSource.content(original.getId(), VariantType.original, 1),
                Files.readAllBytes(renamed.toPath()));
    }

    @Test
    public void testMissingOutputIsExportedAgain() throws Exception {
        TestAssetSource source = new TestAssetSource().withImages(2);
        run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);

        CandidateItem item = source.listItems().get(0);
        Files.delete(outputFor(item, VariantType.original).toPath());

        SyncResult result = run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);
        Assertions.assertEquals(1, result.getCompleted());
        Assertions.assertEquals(1, result.getSkipped());
        Assertions.assertTrue(outputFor(item, VariantType.original).exists());
    }

    @Test
    public void testFullModeIgnoresManifest() {
        TestAssetSource source = new TestAssetSource().withImages(3);
        run(localConfig(BackupMode.full), source, null, new EventCollector(), null);
        SyncResult result = run(localConfig(BackupMode.full), source, null, new EventCollector(), null);

        // exported again, but identical content is not rewritten
        Assertions.assertEquals(6, source.getExports().size());
        Assertions.assertEquals(3, result.getSkipped());
        Assertions.assertEquals(0, result.getCompleted());
    }

    @Test
    public void testMirrorDeletesRemovedItems() {
        TestAssetSource source = new TestAssetSource().withImages(3);
        run(localConfig(BackupMode.mirror), source, null, new EventCollector(), null);

        CandidateItem removed = source.listItems().get(2);
        File removedOutput = outputFor(removed, VariantType.original);
        Assertions.assertTrue(removedOutput.exists());
        source.removeItem(removed.getId());

        SyncResult result = run(localConfig(BackupMode.mirror), source, null, new EventCollector(), null);
        Assertions.assertEquals(1, result.getMirrorDeleted());
        Assertions.assertEquals(2, result.getSkipped());
        Assertions.assertFalse(removedOutput.exists());
        Assertions.assertTrue(outputFor(source.listItems().get(0), VariantType.original).exists());

        // nothing left to delete
        result = run(localConfig(BackupMode.mirror), source, null, new EventCollector(), null);
        Assertions.assertEquals(0, result.getMirrorDeleted());
    }

    @Test
    public void testIncrementalNeverDeletes() {
        TestAssetSource source = new TestAssetSource().withImages(2);
        run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);
        CandidateItem removed = source.listItems().get(1);
        source.removeItem(removed.getId());

        SyncResult result = run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);
        Assertions.assertEquals(0, result.getMirrorDeleted());
        Assertions.assertTrue(outputFor(removed, VariantType.original).exists());
    }

    @Test
    public void testDryRunWritesNothing() {
        TestAssetSource source = new TestAssetSource().withImages(4);
        SyncConfig config = localConfig(BackupMode.mirror);
        config.getOptions().setDryRun(true);

        SyncResult result = run(config, source, null, new EventCollector(), null);
        Assertions.assertEquals(4, result.getCompleted());
        Assertions.assertTrue(source.getExports().isEmpty());
        Assertions.assertFalse(new File(destination, "2023").exists());
    }

    @Test
    public void testRetryAndErrorAccounting() {
        TestAssetSource source = new TestAssetSource().withImages(3);
        List<CandidateItem> items = source.listItems();
        source.failExports(items.get(0).getId(), 2, ExportException.Type.SlowFetchFailed);
        source.failExports(items.get(1).getId(), 1, ExportException.Type.Unavailable);
        EventCollector events = new EventCollector();

        SyncResult result = run(localConfig(BackupMode.smartIncremental), source, null, events, null);
        Assertions.assertEquals(3, result.getAttempted());
        // an item with an error still counts as completed
        Assertions.assertEquals(3, result.getCompleted());
        Assertions.assertEquals(1, result.getErrors());
        Assertions.assertEquals(Collections.singleton(items.get(1).getId()), result.getErrorIds());
        Assertions.assertEquals(1, result.getFailedItems().size());

        List<SyncEvent> retries = events.ofType(SyncEvent.Type.Retrying);
        Assertions.assertEquals(2, retries.size());
        Assertions.assertEquals(items.get(0).getId(), retries.get(0).getSubject());
        Assertions.assertTrue(events.hasMessageStartingWith("ERROR processing original"));
        Assertions.assertTrue(outputFor(items.get(0), VariantType.original).exists());
        Assertions.assertFalse(outputFor(items.get(1), VariantType.original).exists());

        // the failed item is retried on the next run
        source.getExports().clear();
        result = run(localConfig(BackupMode.smartIncremental), source, null, new EventCollector(), null);
        Assertions.assertEquals(1, result.getCompleted());
        Assertions.assertEquals(Collections.singletonList(items.get(1).getId()), source.getExports());
    }

    @Test
    public void testPauseAndResume() {
        TestAssetSource source = new TestAssetSource().withImages(10);
        EventCollector events = new EventCollector();
        MediaSync sync = newSync(localConfig(BackupMode.smartIncremental), source, null, events);
        AtomicInteger exports = new AtomicInteger();
        source.setOnExport(() -> {
            if (exports.incrementAndGet() == 4) sync.getRunControl().pause();
        });
        sync.run();

        SyncResult result = sync.getResult();
        Assertions.assertTrue(result.isPaused());
        Assertions.assertEquals(Integer.valueOf(4), result.getPauseIndex());
        Assertions.assertEquals(4, result.getProcessedIds().size());
        List<SyncEvent> paused = events.ofType(SyncEvent.Type.Paused);
        Assertions.assertEquals(1, paused.size());
        Assertions.assertEquals(4, paused.get(0).getIndex());
        Assertions.assertEquals(10, paused.get(0).getTotal());

        RunSession session = result.getSession();
        Assertions.assertNotNull(session);
        Assertions.assertNotNull(session.getPausedAt());
        Assertions.assertEquals(4, session.getProcessedIds().size());

        // an item newer than the pause jumps the queue
        CandidateItem newer = TestAssetSource.image("NEWER/L0/001", Instant.now().plus(1, ChronoUnit.HOURS));
        source.withItem(newer);
        source.setOnExport(null);
        source.getExports().clear();
        EventCollector resumeEvents = new EventCollector();

        result = run(localConfig(BackupMode.smartIncremental), source, null, resumeEvents, session);
        Assertions.assertFalse(result.isPaused());
        Assertions.assertEquals(7, result.getAttempted());
        Assertions.assertEquals(7, result.getCompleted());
        Assertions.assertEquals(11, result.getProcessedIds().size());
        Assertions.assertTrue(resumeEvents.messages().contains("Resuming: 1 newer item(s), 6 remaining"));
        Assertions.assertEquals(newer.getId(), source.getExports().get(0));
        Assertions.assertEquals(7, resumeEvents.ofType(SyncEvent.Type.WillExport).get(0).getTotal());
    }

    @Test
    public void testMirrorAfterResumeKeepsEarlierOutputs() throws Exception {
        TestAssetSource source = new TestAssetSource().withImages(10);
        MediaSync sync = newSync(localConfig(BackupMode.mirror), source, null, new EventCollector());
        AtomicInteger exports = new AtomicInteger();
        source.setOnExport(() -> {
            if (exports.incrementAndGet() == 4) sync.getRunControl().pause();
        });
        sync.run();

        SyncResult result = sync.getResult();
        Assertions.assertTrue(result.isPaused());
        Assertions.assertEquals(0, result.getMirrorDeleted());
        RunSession session = result.getSession();
        Assertions.assertEquals(4, session.getProcessedIds().size());

        // one item finished before the pause leaves the source while the run is paused
        String removedId = session.getProcessedIds().iterator().next();
        CandidateItem removed = source.listItems().stream()
                .filter(item -> item.getId().equals(removedId)).findFirst().get();
        File removedOutput = outputFor(removed, VariantType.original);
        Assertions.assertTrue(removedOutput.exists());
        source.removeItem(removedId);
        source.setOnExport(null);
        source.getExports().clear();

        result = run(localConfig(BackupMode.mirror), source, null, new EventCollector(), session);
        Assertions.assertFalse(result.isPaused());
        Assertions.assertEquals(6, result.getAttempted());
        Assertions.assertEquals(6, source.getExports().size());
        Assertions.assertEquals(1, result.getMirrorDeleted());
        Assertions.assertFalse(removedOutput.exists());
        for (CandidateItem item : source.listItems()) {
            Assertions.assertTrue(outputFor(item, VariantType.original).exists(), item.getId());
        }

        // a normal mirror run afterwards finds nothing to delete or export
        source.getExports().clear();
        result = run(localConfig(BackupMode.mirror), source, null, new EventCollector(), null);
        Assertions.assertEquals(0, result.getMirrorDeleted());
        Assertions.assertEquals(9, result.getSkipped());
        Assertions.assertTrue(source.getExports().isEmpty());
    }

    @Test
    public void testResumeWithChangedConfigStartsOver() {
        TestAssetSource source = new TestAssetSource().withImages(3);
        RunSession stale = new RunSession();
        stale.setFingerprint("something-else");
        stale.getProcessedIds().add(source.listItems().get(0).getId());
        EventCollector events = new EventCollector();

        SyncResult result = run(localConfig(BackupMode.smartIncremental), source, null, events, stale);
        Assertions.assertEquals(3, result.getAttempted());
        Assertions.assertTrue(events.hasMessageStartingWith("Configuration changed"));
    }

    @Test
    public void testCancel() {
        TestAssetSource source = new TestAssetSource().withImages(10);
        MediaSync sync = newSync(localConfig(BackupMode.mirror), source, null, new EventCollector());
        AtomicInteger exports = new AtomicInteger();
        source.setOnExport(() -> {
            if (exports.incrementAndGet() == 3) sync.getRunControl().cancel();
        });
        sync.run();

        SyncResult result = sync.getResult();
        Assertions.assertTrue(result.isCancelled());
        Assertions.assertFalse(result.isPaused());
        Assertions.assertNull(result.getSession());
        Assertions.assertTrue(result.getAttempted() <= 3);
        Assertions.assertEquals(0, result.getMirrorDeleted());
    }

    @Test
    public void testUploadLivePhoto() {
        TestRemoteStore store = new TestRemoteStore();
        CandidateItem live = TestAssetSource.livePhoto("LIVE1/L0/001", TestAssetSource.BASE_TIME);
        TestAssetSource source = new TestAssetSource().withItem(live)
                .withItem(TestAssetSource.video("VID1/L0/001", TestAssetSource.BASE_TIME.plusSeconds(5)));
        SyncConfig config = new SyncConfig().withUpload(new UploadOptions().withServerUrl("http://localhost")
                .withDeviceId("test-device").withUploadConcurrency(2).withHashConcurrency(2));
        EventCollector events = new EventCollector();

        SyncResult result = run(config, source, store, events, null);
        Assertions.assertEquals(2, result.getCompleted());
        Assertions.assertEquals(0, result.getErrors());
        Assertions.assertEquals(3, result.getUploaded());

        Map<String, UploadRequest> uploads = store.getUploads();
        UploadRequest paired = uploads.get("LIVE1/L0/001:pairedVideo");
        UploadRequest still = uploads.get("LIVE1/L0/001");
        UploadRequest video = uploads.get("VID1/L0/001:video");
        Assertions.assertNotNull(paired);
        Assertions.assertNotNull(still);
        Assertions.assertNotNull(video);
        Assertions.assertEquals(store.getAssetId("LIVE1/L0/001:pairedVideo"), still.getLivePhotoVideoId());
        Assertions.assertNull(paired.getLivePhotoVideoId());
        Assertions.assertEquals("2023-06-01_12-00-00_LIVE1_live.mov", paired.getFilename());
        Assertions.assertEquals(Boolean.TRUE, still.getFavorite());
        Assertions.assertEquals(Double.valueOf(12.5), video.getDurationSeconds());
        Assertions.assertNull(still.getDurationSeconds());
        Assertions.assertEquals(MediaSync.METADATA_KEY, still.getMetadata().get(0).get("key"));
        Assertions.assertTrue(events.hasMessageStartingWith("Server has 0 assets"));

        // content is already on the server, so nothing is uploaded again
        int uploadCalls = store.getUploadCalls();
        result = run(config, new TestAssetSource().withItem(live)
                .withItem(TestAssetSource.video("VID1/L0/001", TestAssetSource.BASE_TIME.plusSeconds(5))),
                store, new EventCollector(), null);
        Assertions.assertEquals(uploadCalls, store.getUploadCalls());
        Assertions.assertEquals(3, result.getDuplicates());
    }

    @Test
    public void testUploadOnlyRerunSkipsExistingItems() {
        TestRemoteStore store = new TestRemoteStore();
        SyncConfig config = new SyncConfig().withUpload(new UploadOptions().withServerUrl("http://localhost")
                .withDeviceId("test-device").withChecksumPrecheck(false)
                .withUploadConcurrency(2).withHashConcurrency(2));

        SyncResult result = run(config, new TestAssetSource().withImages(3), store, new EventCollector(), null);
        Assertions.assertEquals(3, result.getCompleted());
        Assertions.assertEquals(3, result.getUploaded());

        result = run(config, new TestAssetSource().withImages(3), store, new EventCollector(), null);
        Assertions.assertEquals(3, result.getAttempted());
        Assertions.assertEquals(0, result.getCompleted());
        Assertions.assertEquals(3, result.getSkipped());
        Assertions.assertEquals(3, result.getSkippedExisting());
        Assertions.assertEquals(0, result.getUploaded());
        Assertions.assertEquals(3, store.getUploadCalls());
    }

    @Test
    public void testEditedExport() {
        TestAssetSource source = new TestAssetSource().withImages(1)
                .withItem(TestAssetSource.video("VID1/L0/001", TestAssetSource.BASE_TIME.plusSeconds(5)));
        SyncConfig config = localConfig(BackupMode.smartIncremental);
        config.getOptions().setExportMode(ExportMode.both);

        SyncResult result = run(config, source, null, new EventCollector(), null);
        Assertions.assertEquals(2, result.getCompleted());
        CandidateItem image = source.listItems().get(0);
        Assertions.assertTrue(new File(destination, layout.relativePath(image, Variant.rendered())).exists());
        Assertions.assertTrue(layout.relativePath(image, Variant.rendered()).endsWith("_edited.jpg"));
        // videos have no edited rendition
        Assertions.assertEquals(3, source.getExports().size());
    }

    @Test
    public void testFireAndForgetUploadFailure() {
        TestRemoteStore store = new TestRemoteStore();
        TestAssetSource source = new TestAssetSource().withImages(3);
        String failing = source.listItems().get(1).getId();
        store.failUploadsFor(failing);
        SyncConfig config = localConfig(BackupMode.smartIncremental).withUpload(new UploadOptions()
                .withServerUrl("http://localhost").withUploadConcurrency(2).withHashConcurrency(2));

        SyncResult result = run(config, source, store, new EventCollector(), null);
        Assertions.assertEquals(1, result.getErrors());
        Assertions.assertTrue(result.getErrorIds().contains(failing));
        Assertions.assertEquals(2, result.getUploaded());
    }

    @Test
    public void testAlbumSync() {
        TestRemoteStore store = new TestRemoteStore();
        TestAssetSource source = new TestAssetSource().withImages(3);
        List<String> ids = source.listItems().stream().map(CandidateItem::getId).collect(Collectors.toList());
        source.withAlbum(new SourceAlbum("ALBUM1", "Holiday", new HashSet<>(Arrays.asList(ids.get(0), ids.get(2),
                "NOT-IN-SCOPE"))));
        SyncConfig config = new SyncConfig().withUpload(new UploadOptions().withServerUrl("http://localhost")
                .withSyncAlbums(true).withUploadConcurrency(2).withHashConcurrency(2));

        SyncResult result = run(config, source, store, new EventCollector(), null);
        Assertions.assertEquals(1, result.getAlbumsSynced());
        Assertions.assertEquals(new HashSet<>(Arrays.asList(store.getAssetId(ids.get(0)), store.getAssetId(ids.get(2)))),
                store.getAlbumAssets("Holiday"));
    }

    @Test
    public void testFilters() {
        MediaSync sync = new MediaSync();
        sync.setLayout(layout);
        List<CandidateItem> items = Arrays.asList(
                TestAssetSource.image("A", Instant.parse("2022-01-01T00:00:00Z")),
                TestAssetSource.video("B", Instant.parse("2023-01-01T00:00:00Z")),
                TestAssetSource.image("C", Instant.parse("2024-01-01T00:00:00Z")),
                TestAssetSource.image("D", null));

        Assertions.assertEquals(Arrays.asList("D", "A", "B", "C"), ids(sync.filterItems(items, new SyncOptions())));
        Assertions.assertEquals(Arrays.asList("C", "B", "A", "D"),
                ids(sync.filterItems(items, new SyncOptions().withSortOrder(SortOrder.newestFirst))));
        Assertions.assertEquals(Arrays.asList("D", "A", "C"),
                ids(sync.filterItems(items, new SyncOptions().withMediaFilter(MediaFilter.images))));
        Assertions.assertEquals(Collections.singletonList("B"),
                ids(sync.filterItems(items, new SyncOptions().withMediaFilter(MediaFilter.videos))));
        Assertions.assertEquals(Arrays.asList("B", "C"),
                ids(sync.filterItems(items, new SyncOptions().withSince("2022-06-01"))));
        Assertions.assertEquals(Collections.singletonList("C"),
                ids(sync.filterItems(items, new SyncOptions().withSince("2023-01-01T00:00:01Z"))));
        Assertions.assertEquals(Arrays.asList("C", "B"),
                ids(sync.filterItems(items, new SyncOptions().withSortOrder(SortOrder.newestFirst).withLimit(2))));

        Assertions.assertThrows(ConfigurationException.class,
                () -> sync.filterItems(items, new SyncOptions().withSince("yesterday")));
    }

    @Test
    public void testNoSinkIsConfigurationError() {
        MediaSync sync = newSync(new SyncConfig(), new TestAssetSource(), null, new EventCollector());
        Assertions.assertThrows(ConfigurationException.class, sync::run);
        Assertions.assertTrue(sync.getRunError() instanceof ConfigurationException);
    }

    private List<String> ids(List<CandidateItem> items) {
        return items.stream().map(CandidateItem::getId).collect(Collectors.toList());
    }
}
