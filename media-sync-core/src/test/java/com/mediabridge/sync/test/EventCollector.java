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
package com.mediabridge.sync.test;

import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class EventCollector implements SyncListener {
    private final List<SyncEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(SyncEvent event) {
        events.add(event);
    }

    public List<SyncEvent> getEvents() {
        return events;
    }

    public List<SyncEvent> ofType(SyncEvent.Type type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    public List<String> messages() {
        return ofType(SyncEvent.Type.Message).stream().map(SyncEvent::getText).collect(Collectors.toList());
    }

    public boolean hasMessageStartingWith(String prefix) {
        return messages().stream().anyMatch(m -> m.startsWith(prefix));
    }
}
