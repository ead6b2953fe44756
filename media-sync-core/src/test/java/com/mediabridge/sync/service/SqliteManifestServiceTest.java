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
package com.mediabridge.sync.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class SqliteManifestServiceTest {
    protected ManifestService manifest;

    @BeforeEach
    public void setup() {
        manifest = SqliteManifestService.inMemory();
    }

    @AfterEach
    public void teardown() {
        if (manifest != null) manifest.close();
    }

    @Test
    public void testUpsertAndGet() {
        Assertions.assertNull(manifest.get("photo:A:original"));

        manifest.upsert(new ManifestEntry("photo:A:original", "2023/06/01/a.heic", "sig1", 100, 1685620800.5, "run1"));
        ManifestEntry entry = manifest.get("photo:A:original");
        Assertions.assertNotNull(entry);
        Assertions.assertEquals("2023/06/01/a.heic", entry.getRelPath());
        Assertions.assertEquals("sig1", entry.getSignature());
        Assertions.assertEquals(100, entry.getSize());
        Assertions.assertEquals(1685620800.5, entry.getMtime(), 0.0001);
        Assertions.assertEquals("run1", entry.getLastSeenRunId());
        Assertions.assertFalse(entry.isDeleted());
        Assertions.assertNull(entry.getDeletedAt());

        // full replace
        manifest.upsert(new ManifestEntry("photo:A:original", "2023/06/01/a_2.heic", "sig2", 200, 1, "run2"));
        entry = manifest.get("photo:A:original");
        Assertions.assertEquals("2023/06/01/a_2.heic", entry.getRelPath());
        Assertions.assertEquals("sig2", entry.getSignature());
        Assertions.assertEquals(200, entry.getSize());
        Assertions.assertEquals(1, manifest.countActive());
    }

    @Test
    public void testSoftDelete() {
        manifest.upsert(new ManifestEntry("file:a.txt", "a.txt", "size:1;mtime:1", 1, 1, "run1"));
        manifest.markDeleted("file:a.txt");

        ManifestEntry entry = manifest.get("file:a.txt");
        Assertions.assertNotNull(entry);
        Assertions.assertTrue(entry.isDeleted());
        Assertions.assertTrue(entry.getDeletedAt() > 0);
        Assertions.assertEquals("run1", entry.getLastSeenRunId());
        Assertions.assertEquals(0, manifest.countActive());
        Assertions.assertTrue(manifest.keysNotTouchedByRun("run2").isEmpty());

        // upsert revives
        manifest.upsert(new ManifestEntry("file:a.txt", "a.txt", "size:1;mtime:1", 1, 1, "run2"));
        Assertions.assertFalse(manifest.get("file:a.txt").isDeleted());

        // marking an unknown key is harmless
        manifest.markDeleted("file:nope");
    }

    @Test
    public void testActiveEntriesStayActiveAcrossReads() {
        manifest.upsert(new ManifestEntry("photo:A:original", "a", "s", 1, 1, "run1"));
        manifest.upsert(new ManifestEntry("photo:B:original", "b", "s", 1, 1, "run1"));
        manifest.markDeleted("photo:A:original");

        Assertions.assertTrue(manifest.get("photo:A:original").isDeleted());
        ManifestEntry active = manifest.get("photo:B:original");
        Assertions.assertFalse(active.isDeleted());
        Assertions.assertNull(active.getDeletedAt());
        Assertions.assertEquals("run1", active.getLastSeenRunId());

        // a deleted row is never reported as an orphan again
        Assertions.assertEquals(Collections.singletonList("photo:B:original"),
                manifest.keysNotTouchedByRun("run2"));
    }

    @Test
    public void testKeysNotTouchedByRun() {
        manifest.upsert(new ManifestEntry("photo:A:original", "a", "s", 1, 1, "run1"));
        manifest.upsert(new ManifestEntry("photo:B:original", "b", "s", 1, 1, "run1"));
        manifest.upsert(new ManifestEntry("file:c", "c", "s", 1, 1, "run1"));

        ManifestEntry touched = manifest.get("photo:B:original").touch("run2");
        manifest.upsert(touched);

        List<String> stale = manifest.keysNotTouchedByRun("run2");
        Assertions.assertEquals(2, stale.size());
        Assertions.assertTrue(stale.contains("photo:A:original"));
        Assertions.assertTrue(stale.contains("file:c"));
        Assertions.assertEquals("b", manifest.get("photo:B:original").getRelPath());
    }

    @Test
    public void testPersistence(@TempDir File tempDir) {
        File dbFile = new File(tempDir, "manifest.sqlite");
        ManifestService fileManifest = new SqliteManifestService(dbFile);
        try {
            fileManifest.upsert(new ManifestEntry("photo:A:original", "a", "s", 1, 1, "run1"));
        } finally {
            fileManifest.close();
        }
        Assertions.assertTrue(dbFile.exists());

        fileManifest = new SqliteManifestService(dbFile);
        try {
            Assertions.assertEquals("a", fileManifest.get("photo:A:original").getRelPath());
        } finally {
            fileManifest.close();
        }
    }

    @Test
    public void testConcurrentWriters() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                final int n = i;
                futures.add(executor.submit(() ->
                        manifest.upsert(new ManifestEntry("file:" + n, String.valueOf(n), "s", n, n, "run1"))));
            }
            for (Future<?> future : futures) future.get();
        } finally {
            executor.shutdown();
        }
        Assertions.assertEquals(200, manifest.countActive());
    }
}
