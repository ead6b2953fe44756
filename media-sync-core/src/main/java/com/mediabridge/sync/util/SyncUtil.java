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
package com.mediabridge.sync.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongConsumer;

public final class SyncUtil {
    private static final Logger log = LoggerFactory.getLogger(SyncUtil.class);

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    /**
     * Copies the whole stream, reporting the running byte count after every buffer. Streams are closed when done.
     */
    public static long copy(InputStream is, OutputStream os, LongConsumer progress) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long count = 0L;

        try {
            int read;
            while ((read = is.read(buffer)) != -1) {
                os.write(buffer, 0, read);
                count += read;
                if (progress != null) progress.accept(count);
            }
        } finally {
            try {
                is.close();
            } catch (Throwable t) {
                log.warn("could not close stream", t);
            }

            try {
                os.close();
            } catch (Throwable t) {
                log.warn("could not close stream", t);
            }
        }

        return count;
    }

    public static String summarize(Throwable t) {
        Throwable cause = getCause(t);
        if (cause == t) return String.valueOf(t);
        return MessageFormat.format("[{0}] {1}", t, cause);
    }

    public static Throwable getCause(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) cause = cause.getCause();
        return cause;
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) return value;
        return value.substring(0, maxLength);
    }

    public static <T> List<List<T>> chunk(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        if (size <= 0) {
            chunks.add(new ArrayList<>(items));
            return chunks;
        }
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(new ArrayList<>(items.subList(i, Math.min(items.size(), i + size))));
        }
        return chunks;
    }

    /**
     * Path of {@code file} relative to {@code root}, always with forward slashes. Falls back to the file name when
     * the file is not under the root.
     */
    public static String relativePath(File root, File file) {
        String rootPath = root.getAbsoluteFile().toPath().normalize().toString();
        String filePath = file.getAbsoluteFile().toPath().normalize().toString();
        if (!rootPath.endsWith(File.separator)) rootPath += File.separator;
        if (filePath.startsWith(rootPath)) return filePath.substring(rootPath.length()).replace('\\', '/');
        return file.getName();
    }

    public static void ensureDir(File dir) throws IOException {
        Files.createDirectories(dir.toPath());
    }

    /**
     * Deletes a temp file whose loss is harmless; failures are only logged
     */
    public static void deleteQuietly(File file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file.toPath());
        } catch (IOException e) {
            log.warn("could not delete temp file {}: {}", file, e.toString());
        }
    }

    private SyncUtil() {
    }
}
