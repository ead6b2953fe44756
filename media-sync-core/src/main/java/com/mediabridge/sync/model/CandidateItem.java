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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One source media item. Immutable for the duration of a run.
 */
public class CandidateItem {
    private final String id;
    private final MediaKind kind;
    private final Instant createdAt;
    private final Instant modifiedAt;
    private final boolean live;
    private final boolean favorite;
    private final Double durationSeconds;
    private final List<Variant> variants;

    public CandidateItem(String id, MediaKind kind, Instant createdAt, Instant modifiedAt, boolean live,
                         boolean favorite, Double durationSeconds, List<Variant> variants) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = kind == null ? MediaKind.other : kind;
        this.createdAt = createdAt;
        this.modifiedAt = modifiedAt;
        this.live = live;
        this.favorite = favorite;
        this.durationSeconds = durationSeconds;
        this.variants = variants == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(variants));
    }

    public String getId() {
        return id;
    }

    public MediaKind getKind() {
        return kind;
    }

    /**
     * capture time; may be null or implausible
     */
    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public boolean isLive() {
        return live;
    }

    public boolean isFavorite() {
        return favorite;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    /**
     * First variant of the given type, or null
     */
    public Variant getVariant(VariantType type) {
        for (Variant variant : variants) {
            if (variant.getType() == type) return variant;
        }
        return null;
    }

    @Override
    public String toString() {
        return "CandidateItem{" + id + ", " + kind + ", " + createdAt + "}";
    }
}
