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

import java.util.List;

/**
 * Durable key to entry table of exported variants. Implementations must be safe for concurrent callers.
 */
public interface ManifestService extends AutoCloseable {
    ManifestEntry get(String key);

    /**
     * Inserts or fully replaces the entry for its key, clearing any soft-delete mark the stored row had.
     */
    void upsert(ManifestEntry entry);

    void markDeleted(String key);

    /**
     * Keys of every active (not soft-deleted) entry whose last-seen run differs from {@code runId}
     */
    List<String> keysNotTouchedByRun(String runId);

    long countActive();

    @Override
    void close();
}
