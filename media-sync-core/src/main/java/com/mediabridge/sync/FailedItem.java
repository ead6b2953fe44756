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
package com.mediabridge.sync;

import java.util.Objects;

/**
 * An item that finished with at least one error, with the last error seen for it.
 */
public class FailedItem implements Comparable<FailedItem> {
    private final String itemId;
    private final String variant;
    private final String message;
    private final long failedAt = System.currentTimeMillis();

    public FailedItem(String itemId, String variant, String message) {
        this.itemId = itemId;
        this.variant = variant;
        this.message = message;
    }

    public String getItemId() {
        return itemId;
    }

    /**
     * variant that failed, or null if the failure was not specific to one
     */
    public String getVariant() {
        return variant;
    }

    public String getMessage() {
        return message;
    }

    public long getFailedAt() {
        return failedAt;
    }

    @Override
    public int compareTo(FailedItem o) {
        int result = itemId.compareTo(o.itemId);
        if (result == 0) result = String.valueOf(variant).compareTo(String.valueOf(o.variant));
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FailedItem)) return false;
        FailedItem that = (FailedItem) o;
        return itemId.equals(that.itemId) && Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId, variant);
    }

    @Override
    public String toString() {
        return variant == null ? itemId : itemId + " (" + variant + ")";
    }
}
