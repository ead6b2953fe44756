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

import com.mediabridge.sync.util.Checksum;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * Moves finished temp files into place without ever overwriting: free paths get an atomic move, identical content
 * is discarded and different content is renamed with a numeric suffix.
 */
public class FilePlacer {
    private static final Logger log = LoggerFactory.getLogger(FilePlacer.class);

    public PlacementResult place(File temp, File desired) throws IOException {
        SyncUtil.ensureDir(desired.getAbsoluteFile().getParentFile());

        if (!desired.exists()) {
            atomicMove(temp, desired);
            return PlacementResult.exported(desired);
        }

        Checksum tempSum = Checksum.sha256(temp);
        Checksum existingSum;
        try {
            existingSum = Checksum.sha256(desired);
        } catch (IOException e) {
            log.warn("could not hash existing file {} ({}), keeping both", desired, e.toString());
            File alt = uniqueFile(desired);
            atomicMove(temp, alt);
            return PlacementResult.exported(alt);
        }

        if (tempSum.equals(existingSum)) {
            SyncUtil.deleteQuietly(temp);
            return PlacementResult.skippedIdentical(desired);
        }

        File alt = uniqueFile(desired);
        log.info("{} exists with different content, writing {}", desired, alt.getName());
        atomicMove(temp, alt);
        return PlacementResult.exported(alt);
    }

    /**
     * First free sibling of the form {@code base_2.ext}, {@code base_3.ext}, ...
     */
    public static File uniqueFile(File desired) {
        String name = desired.getName();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int i = 2; ; i++) {
            File candidate = new File(desired.getParentFile(), base + "_" + i + ext);
            if (!candidate.exists()) return candidate;
        }
    }

    static void atomicMove(File from, File to) throws IOException {
        try {
            Files.move(from.toPath(), to.toPath(), StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // different file stores
            Files.move(from.toPath(), to.toPath());
        }
    }
}
