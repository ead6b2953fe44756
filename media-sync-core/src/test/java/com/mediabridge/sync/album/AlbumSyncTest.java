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
import com.mediabridge.sync.test.EventCollector;
import com.mediabridge.sync.test.TestRemoteStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class AlbumSyncTest {
    private final TestRemoteStore store = new TestRemoteStore();
    private final EventCollector events = new EventCollector();

    @Test
    public void testCreateAndAdd() {
        SourceAlbum trip = new SourceAlbum("ALB1", "Trip", new HashSet<>(Arrays.asList("a", "b", "outside")));
        SourceAlbum empty = new SourceAlbum("ALB2", "Empty", new HashSet<>(Collections.singletonList("c")));
        AlbumCollector collector = new AlbumCollector(Arrays.asList(trip, empty), new HashSet<>(Arrays.asList("a", "b", "c")));

        Assertions.assertEquals(Collections.singletonList(trip), collector.albumsFor("a"));
        Assertions.assertTrue(collector.albumsFor("outside").isEmpty());

        collector.add("remote-a", collector.albumsFor("a"));
        collector.add("remote-b", collector.albumsFor("b"));
        collector.add(null, collector.albumsFor("c"));

        int synced = new AlbumSync(store, events, () -> false).sync(collector);
        Assertions.assertEquals(1, synced);
        Assertions.assertEquals(Collections.singleton("Trip"), store.getAlbumNames());
        Assertions.assertEquals(new HashSet<>(Arrays.asList("remote-a", "remote-b")), store.getAlbumAssets("Trip"));
        Assertions.assertTrue(events.messages().contains("Created album \"Trip\""));
    }

    @Test
    public void testExistingAlbumAndPostFallback() {
        store.createAlbum("Trip");
        store.setFailPutAlbumAssets(true);

        SourceAlbum trip = new SourceAlbum("ALB1", "Trip", Collections.singleton("a"));
        AlbumCollector collector = new AlbumCollector(Collections.singletonList(trip), Collections.singleton("a"));
        collector.add("remote-a", collector.albumsFor("a"));

        Assertions.assertEquals(1, new AlbumSync(store, events, () -> false).sync(collector));
        Assertions.assertEquals(1, store.getAlbumNames().size());
        Assertions.assertEquals(Collections.singleton("remote-a"), store.getAlbumAssets("Trip"));
    }

    @Test
    public void testChunking() {
        Set<String> members = new HashSet<>();
        for (int i = 0; i < 1200; i++) members.add("i" + i);
        SourceAlbum big = new SourceAlbum("BIG", "Big", members);
        AlbumCollector collector = new AlbumCollector(Collections.singletonList(big), members);
        for (String id : members) collector.add("r" + id, collector.albumsFor(id));

        List<Integer> chunkSizes = new ArrayList<>();
        TestRemoteStore recording = new TestRemoteStore() {
            @Override
            public void putAlbumAssets(String albumId, List<String> assetIds) {
                chunkSizes.add(assetIds.size());
                super.putAlbumAssets(albumId, assetIds);
            }
        };
        Assertions.assertEquals(1, new AlbumSync(recording, events, () -> false).sync(collector));
        Assertions.assertEquals(Arrays.asList(500, 500, 200), chunkSizes);
        Assertions.assertEquals(1200, recording.getAlbumAssets("Big").size());
    }

    @Test
    public void testDuplicateAndBlankTitles() {
        SourceAlbum first = new SourceAlbum("AAA-1", "Summer", Collections.singleton("a"));
        SourceAlbum second = new SourceAlbum("BBB-2", "Summer", Collections.singleton("b"));
        SourceAlbum blank = new SourceAlbum("CCC", "  ", Collections.singleton("c"));
        AlbumCollector collector = new AlbumCollector(Arrays.asList(first, second, blank),
                new HashSet<>(Arrays.asList("a", "b", "c")));
        collector.add("ra", collector.albumsFor("a"));
        collector.add("rb", collector.albumsFor("b"));
        collector.add("rc", collector.albumsFor("c"));

        Assertions.assertEquals(3, new AlbumSync(store, events, () -> false).sync(collector));
        Assertions.assertEquals(new HashSet<>(Arrays.asList("Summer (Album AAA1)", "Summer (Album BBB2)",
                AlbumSync.UNTITLED)), store.getAlbumNames());
    }

    @Test
    public void testNothingToSync() {
        AlbumCollector collector = new AlbumCollector(Collections.emptyList(), Collections.emptySet());
        Assertions.assertEquals(0, new AlbumSync(store, events, () -> false).sync(collector));
        Assertions.assertTrue(events.getEvents().isEmpty());
    }
}
