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

import com.mediabridge.sync.config.BackupMode;
import com.mediabridge.sync.config.SyncConfig;
import com.mediabridge.sync.config.SyncOptions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.LinkedHashSet;

public class SessionStoreTest {
    @TempDir
    File tempDir;

    @Test
    public void testSaveAndLoad() throws Exception {
        RunSession session = new RunSession();
        session.setStartedAt(1000);
        session.setPausedAt(2000L);
        session.setFingerprint("abc");
        session.setProcessedIds(new LinkedHashSet<>(Arrays.asList("a", "b")));
        session.setErrorIds(new LinkedHashSet<>(Arrays.asList("b")));
        session.setPauseIndex(2);
        session.setCompleted(1);
        session.setSkipped(1);

        SessionStore store = new SessionStore(new File(tempDir, "state/session.json"));
        Assertions.assertNull(store.load());
        store.save(session);

        RunSession loaded = store.load();
        Assertions.assertNotNull(loaded);
        Assertions.assertEquals(session.getSessionId(), loaded.getSessionId());
        Assertions.assertEquals(Long.valueOf(2000), loaded.getPausedAt());
        Assertions.assertEquals("abc", loaded.getFingerprint());
        Assertions.assertEquals(Arrays.asList("a", "b"), Arrays.asList(loaded.getProcessedIds().toArray()));
        Assertions.assertTrue(loaded.getErrorIds().contains("b"));
        Assertions.assertEquals(2, loaded.getPauseIndex());
        Assertions.assertEquals(1, loaded.getCompleted());

        store.clear();
        Assertions.assertFalse(store.getFile().exists());
        Assertions.assertNull(store.load());
    }

    @Test
    public void testCorruptFileIgnored() throws Exception {
        File file = new File(tempDir, "session.json");
        Files.write(file.toPath(), "{not json".getBytes(StandardCharsets.UTF_8));
        Assertions.assertNull(new SessionStore(file).load());
    }

    @Test
    public void testFingerprint() {
        SyncConfig config = new SyncConfig().withOptions(new SyncOptions().withDestination("/backup"));
        String fingerprint = ConfigFingerprint.of(config);
        Assertions.assertEquals(fingerprint,
                ConfigFingerprint.of(new SyncConfig().withOptions(new SyncOptions().withDestination("/backup"))));

        // settings that do not change what is visited keep the fingerprint
        config.getOptions().setRetryAttempts(9);
        Assertions.assertEquals(fingerprint, ConfigFingerprint.of(config));

        config.getOptions().setBackupMode(BackupMode.mirror);
        Assertions.assertNotEquals(fingerprint, ConfigFingerprint.of(config));
    }
}
