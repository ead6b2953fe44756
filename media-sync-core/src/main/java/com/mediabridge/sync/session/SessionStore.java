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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * Persists a {@link RunSession} as a JSON file.
 */
public class SessionStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private final File file;

    public SessionStore(File file) {
        this.file = file;
    }

    public void save(RunSession session) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) Files.createDirectories(parent.toPath());
        File temp = new File(parent, file.getName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(session, writer);
        }
        Files.move(temp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        log.info("saved session {} to {}", session.getSessionId(), file);
    }

    /**
     * @return the saved session, or null if there is none or it cannot be read
     */
    public RunSession load() {
        if (!file.exists()) return null;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, RunSession.class);
        } catch (IOException | JsonParseException e) {
            log.warn("could not read session file {}, ignoring it: {}", file, e.toString());
            return null;
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(file.toPath());
        } catch (IOException e) {
            log.warn("could not delete session file {}", file, e);
        }
    }

    public File getFile() {
        return file;
    }
}
