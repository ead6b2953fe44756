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
package com.mediabridge.sync.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class SourceAlbum {
    private final String id;
    private final String title;
    private final Set<String> itemIds;

    public SourceAlbum(String id, String title, Set<String> itemIds) {
        this.id = id;
        this.title = title;
        this.itemIds = itemIds == null ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(itemIds));
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public Set<String> getItemIds() {
        return itemIds;
    }

    @Override
    public String toString() {
        return "SourceAlbum{" + id + ", " + title + ", " + itemIds.size() + " item(s)}";
    }
}
