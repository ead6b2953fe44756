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
import com.mediabridge.sync.config.BackupMode;
import com.mediabridge.sync.config.ConfigurationException;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.test.EventCollector;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.attribute.FileTime;
import java.util.Collections;

public class FolderSyncTest {
    @TempDir
    File temp;

    private File source;
    private File destination;

    @BeforeEach
    public void setup() throws Exception {
        source = new File(temp, "source");
        destination = new File(temp, "destination");
        write(new File(source, "a.txt"), "alpha");
        write(new File(source, "docs/b.txt"), "bravo");
        write(new File(source, "docs/deep/c.txt"), "charlie");
        write(new File(source, ".hidden"), "secret");
        write(new File(source, ".git/config"), "[core]");
    }

    private void write(File file, String content) throws Exception {
        file.getParentFile().mkdirs();
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    }

    private String read(File file) throws Exception {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }

    private FolderSyncResult run(SyncOptions options, EventCollector events) {
        SyncConfig config = new SyncConfig().withFolderBackup(true)
                .withSources(Collections.singletonList(source.getPath()))
                .withOptions(options.withDestination(destination.getPath()));
        FolderSync sync = new FolderSync();
        sync.setSyncConfig(config);
        sync.setListener(events);
        sync.run();
        return sync.getResult();
    }

    @Test
    public void testCopyThenSkip() throws Exception {
        EventCollector events = new EventCollector();
        FolderSyncResult result = run(new SyncOptions(), events);
        Assertions.assertEquals(3, result.getScanned());
        Assertions.assertEquals(3, result.getCopied());
        Assertions.assertEquals(0, result.getErrors());
        Assertions.assertEquals("alpha", read(new File(destination, "a.txt")));
        Assertions.assertEquals("charlie", read(new File(destination, "docs/deep/c.txt")));
        Assertions.assertFalse(new File(destination, ".hidden").exists());
        Assertions.assertFalse(new File(destination, ".git").exists());
        Assertions.assertFalse(new File(destination, MediaSync.WORK_DIR).exists());

        Assertions.assertEquals(1, events.ofType(SyncEvent.Type.FileScanning).size());
        Assertions.assertEquals(3, events.ofType(SyncEvent.Type.FileWillCopy).get(0).getTotal());
        Assertions.assertEquals(3, events.ofType(SyncEvent.Type.FileCopying).size());

        result = run(new SyncOptions(), new EventCollector());
        Assertions.assertEquals(0, result.getCopied());
        Assertions.assertEquals(3, result.getSkipped());
    }

    @Test
    public void testChangedFileIsCopiedAgain() throws Exception {
        run(new SyncOptions(), new EventCollector());

        File changed = new File(source, "docs/b.txt");
        write(changed, "bravo two");
        Files.setLastModifiedTime(changed.toPath(), FileTime.fromMillis(System.currentTimeMillis() + 60000));

        FolderSyncResult result = run(new SyncOptions(), new EventCollector());
        Assertions.assertEquals(1, result.getCopied());
        Assertions.assertEquals(2, result.getSkipped());
    }

    @Test
    public void testHiddenFiles() throws Exception {
        FolderSyncResult result = run(new SyncOptions().withIncludeHiddenFiles(true), new EventCollector());
        Assertions.assertEquals(5, result.getCopied());
        Assertions.assertEquals("secret", read(new File(destination, ".hidden")));
        Assertions.assertEquals("[core]", read(new File(destination, ".git/config")));
    }

    @Test
    public void testMirrorDeletesRemovedFiles() throws Exception {
        run(new SyncOptions().withBackupMode(BackupMode.mirror), new EventCollector());
        Files.delete(new File(source, "docs/deep/c.txt").toPath());

        FolderSyncResult result = run(new SyncOptions().withBackupMode(BackupMode.mirror), new EventCollector());
        Assertions.assertEquals(1, result.getDeleted());
        Assertions.assertEquals(2, result.getSkipped());
        Assertions.assertFalse(new File(destination, "docs/deep/c.txt").exists());
        Assertions.assertTrue(new File(destination, "docs/b.txt").exists());
    }

    @Test
    public void testIncrementalKeepsRemovedFiles() throws Exception {
        run(new SyncOptions(), new EventCollector());
        Files.delete(new File(source, "a.txt").toPath());

        FolderSyncResult result = run(new SyncOptions(), new EventCollector());
        Assertions.assertEquals(0, result.getDeleted());
        Assertions.assertTrue(new File(destination, "a.txt").exists());
    }

    @Test
    public void testDryRun() throws Exception {
        FolderSyncResult result = run(new SyncOptions().withDryRun(true).withBackupMode(BackupMode.mirror),
                new EventCollector());
        Assertions.assertEquals(3, result.getCopied());
        Assertions.assertFalse(new File(destination, "a.txt").exists());
        Assertions.assertFalse(new File(destination, "docs").exists());
    }

    @Test
    public void testMissingSourceFolder() throws Exception {
        source = new File(temp, "does-not-exist");
        EventCollector events = new EventCollector();
        FolderSyncResult result = run(new SyncOptions(), events);
        Assertions.assertEquals(1, result.getErrors());
        Assertions.assertEquals(0, result.getScanned());
        Assertions.assertTrue(events.hasMessageStartingWith("ERROR source folder not found"));
    }

    @Test
    public void testCancelBeforeCopy() throws Exception {
        SyncConfig config = new SyncConfig().withFolderBackup(true)
                .withSources(Collections.singletonList(source.getPath()))
                .withOptions(new SyncOptions().withDestination(destination.getPath()));
        FolderSync sync = new FolderSync();
        sync.setSyncConfig(config);
        sync.setListener(event -> {
            if (event.getType() == SyncEvent.Type.FileWillCopy) sync.getRunControl().cancel();
        });
        sync.run();
        Assertions.assertTrue(sync.getResult().isCancelled());
        Assertions.assertEquals(0, sync.getResult().getCopied());
    }

    @Test
    public void testDestinationRequired() {
        FolderSync sync = new FolderSync();
        sync.setSyncConfig(new SyncConfig().withFolderBackup(true)
                .withSources(Collections.singletonList(source.getPath())));
        Assertions.assertThrows(ConfigurationException.class, sync::run);
    }
}
