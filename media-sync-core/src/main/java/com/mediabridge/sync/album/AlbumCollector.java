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
package com.mediabridge.sync.album;

import com.mediabridge.sync.model.SourceAlbum;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the remote ids resolved for members of source albums while a run uploads. Thread-safe.
 */
public class AlbumCollector {
    private final Map<String, List<SourceAlbum>> albumsByItemId = new HashMap<>();
    private final Map<String, SourceAlbum> albumsById = new LinkedHashMap<>();
    private final Map<String, Set<String>> remoteIdsByAlbumId = new LinkedHashMap<>();

    /**
     * @param albums       all source albums
     * @param itemIdsInScope only members in this set are tracked
     */
    public AlbumCollector(Collection<SourceAlbum> albums, Set<String> itemIdsInScope) {
        for (SourceAlbum album : albums) {
            albumsById.put(album.getId(), album);
            for (String itemId : album.getItemIds()) {
                if (!itemIdsInScope.contains(itemId)) continue;
                albumsByItemId.computeIfAbsent(itemId, k -> new ArrayList<>()).add(album);
            }
        }
    }

    public List<SourceAlbum> albumsFor(String itemId) {
        List<SourceAlbum> albums = albumsByItemId.get(itemId);
        return albums == null ? Collections.emptyList() : albums;
    }

    public synchronized void add(String remoteId, Collection<SourceAlbum> albums) {
        if (remoteId == null) return;
        for (SourceAlbum album : albums) {
            remoteIdsByAlbumId.computeIfAbsent(album.getId(), k -> new LinkedHashSet<>()).add(remoteId);
        }
    }

    /**
     * Albums that received at least one remote id, with those ids
     */
    public synchronized Map<SourceAlbum, List<String>> snapshot() {
        Map<SourceAlbum, List<String>> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : remoteIdsByAlbumId.entrySet()) {
            SourceAlbum album = albumsById.get(entry.getKey());
            if (album == null || entry.getValue().isEmpty()) continue;
            snapshot.put(album, new ArrayList<>(entry.getValue()));
        }
        return snapshot;
    }

    public Collection<SourceAlbum> getAlbums() {
        return albumsById.values();
    }
}
