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

/**
 * The exportable facets of a source item. The enum name is used verbatim in manifest keys and signatures.
 */
public enum VariantType {
    original(""),
    pairedVideo(":pairedVideo"),
    video(":video"),
    adjustments(":adjustments"),
    edited(":edited");

    private final String remoteIdSuffix;

    VariantType(String remoteIdSuffix) {
        this.remoteIdSuffix = remoteIdSuffix;
    }

    /**
     * Appended to the item id to form the stable remote (device asset) id of this variant
     */
    public String getRemoteIdSuffix() {
        return remoteIdSuffix;
    }

    public String remoteId(String itemId) {
        return itemId + remoteIdSuffix;
    }
}
