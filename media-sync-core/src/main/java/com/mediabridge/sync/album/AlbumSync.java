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

import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;
import com.mediabridge.sync.model.SourceAlbum;
import com.mediabridge.sync.placement.OutputLayout;
import com.mediabridge.sync.remote.RemoteAlbum;
import com.mediabridge.sync.remote.RemoteStore;
import com.mediabridge.sync.remote.RemoteStoreException;
import com.mediabridge.sync.util.SyncUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Mirrors collected source album membership into remote albums, creating albums that do not exist yet.
 */
public class AlbumSync {
    private static final Logger log = LoggerFactory.getLogger(AlbumSync.class);

    public static final int ADD_CHUNK_SIZE = 500;
    public static final String UNTITLED = "Untitled Album";

    private final RemoteStore store;
    private final SyncListener listener;
    private final BooleanSupplier cancelCheck;

    public AlbumSync(RemoteStore store, SyncListener listener, BooleanSupplier cancelCheck) {
        this.store = store;
        this.listener = listener;
        this.cancelCheck = cancelCheck;
    }

    /**
     * @return the number of albums that were fully updated
     */
    public int sync(AlbumCollector collector) {
        Map<SourceAlbum, List<String>> entries = collector.snapshot();
        if (entries.isEmpty()) return 0;
        emit("Syncing albums...");

        Map<String, Integer> titleCounts = countTitles(entries.keySet());

        Map<String, String> remoteIdByName = new HashMap<>();
        try {
            for (RemoteAlbum album : store.listAlbums()) {
                if (album.getAlbumName() != null) remoteIdByName.put(album.getAlbumName(), album.getId());
            }
        } catch (RemoteStoreException e) {
            emit("ERROR could not list albums: " + SyncUtil.summarize(e));
        }

        int synced = 0;
        for (Map.Entry<SourceAlbum, List<String>> entry : entries.entrySet()) {
            if (cancelCheck.getAsBoolean()) break;
            String name = remoteAlbumName(entry.getKey(), titleCounts);

            String albumId = remoteIdByName.get(name);
            if (albumId == null) {
                try {
                    albumId = store.createAlbum(name).getId();
                    remoteIdByName.put(name, albumId);
                    emit("Created album \"" + name + "\"");
                } catch (RemoteStoreException e) {
                    emit("ERROR could not create album \"" + name + "\": " + SyncUtil.summarize(e));
                    continue;
                }
            }

            if (addAll(albumId, name, entry.getValue())) synced++;
        }

        emit("Album sync complete");
        return synced;
    }

    private boolean addAll(String albumId, String name, List<String> remoteIds) {
        for (List<String> chunk : SyncUtil.chunk(remoteIds, ADD_CHUNK_SIZE)) {
            if (cancelCheck.getAsBoolean()) return false;
            try {
                try {
                    store.putAlbumAssets(albumId, chunk);
                } catch (RemoteStoreException e) {
                    log.debug("PUT to album {} failed ({}), trying POST", albumId, e.getMessage());
                    store.postAlbumAssets(albumId, chunk);
                }
            } catch (RemoteStoreException e) {
                emit("ERROR could not add assets to album \"" + name + "\": " + SyncUtil.summarize(e));
                return false;
            }
        }
        return true;
    }

    static String remoteAlbumName(SourceAlbum album, Map<String, Integer> titleCounts) {
        String title = titleOf(album);
        if (titleCounts.getOrDefault(title, 0) <= 1) return title;
        return title + " (Album " + OutputLayout.shortId(album.getId()) + ")";
    }

    static String titleOf(SourceAlbum album) {
        String title = album.getTitle() == null ? "" : album.getTitle().trim();
        return title.isEmpty() ? UNTITLED : title;
    }

    static Map<String, Integer> countTitles(Collection<SourceAlbum> albums) {
        Map<String, Integer> counts = new HashMap<>();
        for (SourceAlbum album : albums) {
            counts.merge(titleOf(album), 1, Integer::sum);
        }
        return counts;
    }

    private void emit(String message) {
        if (message.startsWith("ERROR")) log.warn(message);
        else log.info(message);
        listener.onEvent(SyncEvent.message(message));
    }
}
