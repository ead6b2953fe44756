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
package com.mediabridge.sync.placement;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class FilePlacerTest {
    @TempDir
    File tempDir;

    private final FilePlacer placer = new FilePlacer();

    @Test
    public void testFreePath() throws Exception {
        File temp = write(new File(tempDir, ".tmp-1"), "hello");
        File desired = new File(tempDir, "2023/06/01/a.jpg");

        PlacementResult result = placer.place(temp, desired);
        Assertions.assertEquals(PlacementResult.Type.Exported, result.getType());
        Assertions.assertEquals(desired, result.getFile());
        Assertions.assertFalse(temp.exists());
        Assertions.assertEquals("hello", read(desired));
    }

    @Test
    public void testIdenticalContent() throws Exception {
        File desired = write(new File(tempDir, "a.jpg"), "hello");
        File temp = write(new File(tempDir, ".tmp-1"), "hello");

        PlacementResult result = placer.place(temp, desired);
        Assertions.assertEquals(PlacementResult.Type.SkippedIdentical, result.getType());
        Assertions.assertFalse(result.isExported());
        Assertions.assertEquals(desired, result.getFile());
        Assertions.assertFalse(temp.exists());
        Assertions.assertFalse(new File(tempDir, "a_2.jpg").exists());
    }

    @Test
    public void testDifferentContentNeverOverwrites() throws Exception {
        File desired = write(new File(tempDir, "a.jpg"), "original");
        write(new File(tempDir, "a_2.jpg"), "taken");

        PlacementResult result = placer.place(write(new File(tempDir, ".tmp-1"), "changed"), desired);
        Assertions.assertTrue(result.isExported());
        Assertions.assertEquals(new File(tempDir, "a_3.jpg"), result.getFile());
        Assertions.assertEquals("original", read(desired));
        Assertions.assertEquals("taken", read(new File(tempDir, "a_2.jpg")));
        Assertions.assertEquals("changed", read(result.getFile()));
    }

    @Test
    public void testUniqueFileWithoutExtension() {
        Assertions.assertEquals(new File(tempDir, "README_2"), FilePlacer.uniqueFile(new File(tempDir, "README")));
    }

    private File write(File file, String content) throws Exception {
        file.getParentFile().mkdirs();
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private String read(File file) throws Exception {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }
}
