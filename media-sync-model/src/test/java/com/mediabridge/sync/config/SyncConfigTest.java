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
package com.mediabridge.sync.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.xml.bind.JAXBContext;
import java.io.StringReader;
import java.util.Arrays;

public class SyncConfigTest {
    @Test
    public void testXmlJobFile() throws Exception {
        String xml = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
                "<syncConfig>\n" +
                "    <jobName>nightly</jobName>\n" +
                "    <folderBackup>false</folderBackup>\n" +
                "    <sources>\n" +
                "        <source>/photos/library</source>\n" +
                "        <source>/photos/inbox</source>\n" +
                "    </sources>\n" +
                "    <options>\n" +
                "        <backupMode>mirror</backupMode>\n" +
                "        <sortOrder>newestFirst</sortOrder>\n" +
                "        <destination>/backup/photos</destination>\n" +
                "        <retryAttempts>5</retryAttempts>\n" +
                "    </options>\n" +
                "    <upload>\n" +
                "        <serverUrl>http://nas:2283</serverUrl>\n" +
                "        <apiKey>abc</apiKey>\n" +
                "        <uploadConcurrency>2</uploadConcurrency>\n" +
                "        <checksumPrecheck>false</checksumPrecheck>\n" +
                "    </upload>\n" +
                "</syncConfig>";

        SyncConfig config = (SyncConfig) JAXBContext.newInstance(SyncConfig.class)
                .createUnmarshaller().unmarshal(new StringReader(xml));

        Assertions.assertEquals("nightly", config.getJobName());
        Assertions.assertFalse(config.isFolderBackup());
        Assertions.assertEquals(Arrays.asList("/photos/library", "/photos/inbox"), config.getSources());
        Assertions.assertEquals(BackupMode.mirror, config.getOptions().getBackupMode());
        Assertions.assertEquals(SortOrder.newestFirst, config.getOptions().getSortOrder());
        Assertions.assertEquals("/backup/photos", config.getOptions().getDestination());
        Assertions.assertEquals(5, config.getOptions().getRetryAttempts());
        // defaults survive unmarshalling
        Assertions.assertEquals(MediaFilter.all, config.getOptions().getMediaFilter());
        Assertions.assertEquals(SyncOptions.DEFAULT_REQUEST_TIMEOUT_SECONDS, config.getOptions().getRequestTimeoutSeconds());

        Assertions.assertNotNull(config.getUpload());
        Assertions.assertEquals("http://nas:2283", config.getUpload().getServerUrl());
        Assertions.assertEquals(2, config.getUpload().getUploadConcurrency());
        Assertions.assertFalse(config.getUpload().isChecksumPrecheck());
        Assertions.assertEquals(UploadOptions.DEFAULT_DEVICE_ID, config.getUpload().getDeviceId());
    }

    @Test
    public void testNoUploadSection() throws Exception {
        String xml = "<syncConfig><options><destination>/backup</destination></options></syncConfig>";

        SyncConfig config = (SyncConfig) JAXBContext.newInstance(SyncConfig.class)
                .createUnmarshaller().unmarshal(new StringReader(xml));

        Assertions.assertNull(config.getUpload());
        Assertions.assertTrue(config.getSources().isEmpty());
        Assertions.assertEquals(BackupMode.smartIncremental, config.getOptions().getBackupMode());
    }
}
