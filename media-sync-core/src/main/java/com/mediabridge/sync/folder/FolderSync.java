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
package com.mediabridge.sync.folder;

import com.mediabridge.sync.MediaSync;
import com.mediabridge.sync.MirrorCleaner;
import com.mediabridge.sync.RunControl;
import com.mediabridge.sync.RunState;
import com.mediabridge.sync.config.BackupMode;
import com.mediabridge.sync.config.ConfigurationException;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.placement.FilePlacer;
import com.mediabridge.sync.retry.RetryController;
import com.mediabridge.sync.service.ManifestEntry;
import com.mediabridge.sync.service.ManifestKeys;
import com.mediabridge.sync.service.ManifestService;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Copies plain files from one or more source folders into the destination by relative path, skipping files whose
 * size and modification time are unchanged since the last run. Mirror mode deletes destination files whose source
 * disappeared.
 */
public class FolderSync implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(FolderSync.class);

    private SyncConfig syncConfig;
    private ManifestService manifest;
    private boolean ownsManifest;
    private SyncListener listener;
    private RunControl runControl = new RunControl();
    private final FilePlacer placer = new FilePlacer();

    private String runId;
    private FolderSyncResult result;

    @Override
    public synchronized void run() {
        assert syncConfig != null : "syncConfig is null";
        SyncOptions options = syncConfig.getOptions();
        if (listener == null) listener = event -> {
        };
        if (options.getDestination() == null)
            throw new ConfigurationException("folder backup requires a destination folder");
        if (syncConfig.getSources().isEmpty())
            throw new ConfigurationException("folder backup requires at least one source folder");

        File destination = new File(options.getDestination());
        File workDir = new File(destination, MediaSync.WORK_DIR);
        try {
            SyncUtil.ensureDir(destination);
            SyncUtil.ensureDir(workDir);
        } catch (IOException e) {
            throw new ConfigurationException("cannot create destination " + destination + ": " + e.getMessage(), e);
        }

        runId = UUID.randomUUID().toString();
        result = new FolderSyncResult();
        try {
            if (manifest == null) {
                manifest = MediaSync.openManifest(destination);
                ownsManifest = true;
            }

            listener.onEvent(SyncEvent.fileScanning());
            List<SourceFile> files = scan(options);
            if (runControl.getState() == RunState.paused) {
                result.setPaused(true);
                emit("pause requested; stopping after scan");
            }
            int total = files.size();
            listener.onEvent(SyncEvent.fileWillCopy(total));

            if (!result.isPaused()) {
                for (int i = 0; i < total; i++) {
                    RunState state = runControl.getState();
                    if (state == RunState.cancelled) {
                        result.setCancelled(true);
                        break;
                    }
                    if (state == RunState.paused) {
                        result.setPaused(true);
                        listener.onEvent(SyncEvent.paused(i, total));
                        break;
                    }
                    SourceFile file = files.get(i);
                    result.setScanned(result.getScanned() + 1);
                    listener.onEvent(SyncEvent.fileCopying(i + 1, total, file.relPath));
                    copyFile(file, destination, workDir, options);
                }
            }

            if (options.getBackupMode() == BackupMode.mirror && !options.isDryRun() && !result.isPaused()
                    && !result.isCancelled()) {
                MirrorCleaner cleaner = new MirrorCleaner(manifest, destination, listener, runControl::isCancelled);
                cleaner.clean(runId, ManifestKeys.FILE_PREFIX);
                result.setDeleted(cleaner.getDeletedFiles());
                result.setErrors(result.getErrors() + cleaner.getErrors());
            }

            log.info("folder backup {} finished: {}", runId, result);
        } finally {
            if (!workDir.delete()) log.debug("work directory {} not removed (not empty)", workDir);
            if (ownsManifest) manifest.close();
        }
    }

    private List<SourceFile> scan(SyncOptions options) {
        List<SourceFile> files = new ArrayList<>();
        EnumSet<FileVisitOption> visitOptions = options.isFollowSymlinks()
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS) : EnumSet.noneOf(FileVisitOption.class);

        for (String sourcePath : syncConfig.getSources()) {
            if (runControl.getState() != RunState.running) break;
            File root = new File(sourcePath);
            if (!root.isDirectory()) {
                emit("ERROR source folder not found: " + root);
                result.setErrors(result.getErrors() + 1);
                continue;
            }
            try {
                Files.walkFileTree(root.toPath(), visitOptions, Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        if (runControl.getState() != RunState.running) return FileVisitResult.TERMINATE;
                        if (!dir.equals(root.toPath()) && isExcluded(dir, options)) return FileVisitResult.SKIP_SUBTREE;
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && !isExcluded(file, options)) {
                            String relPath = SyncUtil.relativePath(root, file.toFile());
                            files.add(new SourceFile(file.toFile(), relPath));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) {
                        log.warn("cannot read {}: {}", file, e.toString());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                emit("ERROR scanning " + root + ": " + SyncUtil.summarize(e));
                result.setErrors(result.getErrors() + 1);
            }
        }
        return files;
    }

    private boolean isExcluded(Path path, SyncOptions options) {
        if (!options.isFollowSymlinks() && Files.isSymbolicLink(path)) return true;
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        if (name.equals(MediaSync.MANIFEST_DIR) || name.equals(MediaSync.WORK_DIR)) return true;
        return !options.isIncludeHiddenFiles() && name.startsWith(".");
    }

    private void copyFile(SourceFile file, File destination, File workDir, SyncOptions options) {
        File desired = new File(destination, file.relPath);
        try {
            long size = Files.size(file.file.toPath());
            long mtimeMillis = Files.getLastModifiedTime(file.file.toPath(), LinkOption.NOFOLLOW_LINKS).toMillis();
            String signature = ManifestKeys.fileSignature(size, mtimeMillis);
            String key = ManifestKeys.fileKey(file.relPath);

            if (options.getBackupMode() != BackupMode.full) {
                ManifestEntry entry = manifest.get(key);
                if (entry != null && !entry.isDeleted() && signature.equals(entry.getSignature()) && desired.exists()) {
                    result.setSkipped(result.getSkipped() + 1);
                    if (!options.isDryRun()) manifest.upsert(entry.touch(runId));
                    return;
                }
            }

            if (options.isDryRun()) {
                log.info("[dry run] would copy {}", file.relPath);
                result.setCopied(result.getCopied() + 1);
                return;
            }

            File temp = new File(workDir, RetryController.TEMP_PREFIX + UUID.randomUUID());
            try {
                Files.copy(file.file.toPath(), temp.toPath(), StandardCopyOption.COPY_ATTRIBUTES);
                placer.place(temp, desired);
            } catch (IOException e) {
                SyncUtil.deleteQuietly(temp);
                throw e;
            }
            result.setCopied(result.getCopied() + 1);
            manifest.upsert(new ManifestEntry(key, file.relPath, signature, size, mtimeMillis / 1000.0, runId));
        } catch (IOException | RuntimeException e) {
            result.setErrors(result.getErrors() + 1);
            log.warn("failed to copy {}", file.relPath, e);
            listener.onEvent(SyncEvent.message("ERROR copying " + file.relPath + ": " + SyncUtil.summarize(e)));
        }
    }

    private void emit(String message) {
        if (message.startsWith("ERROR")) log.warn(message);
        else log.info(message);
        listener.onEvent(SyncEvent.message(message));
    }

    private static class SourceFile {
        final File file;
        final String relPath;

        SourceFile(File file, String relPath) {
            this.file = file;
            this.relPath = relPath;
        }
    }

    public SyncConfig getSyncConfig() {
        return syncConfig;
    }

    public void setSyncConfig(SyncConfig syncConfig) {
        this.syncConfig = syncConfig;
    }

    /**
     * Supplies an open manifest. The caller keeps ownership; by default one is opened under the destination.
     */
    public void setManifest(ManifestService manifest) {
        this.manifest = manifest;
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

    public String getRunId() {
        return runId;
    }

    public FolderSyncResult getResult() {
        return result;
    }
}
