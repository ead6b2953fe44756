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
package com.mediabridge.sync.remote;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless request/response access to the remote photo server. Implementations hold no mutable state beyond
 * their connection settings and are shared by every worker pool; retry and batching live in the caller.
 * All methods throw {@link RemoteStoreException} on failure.
 */
public interface RemoteStore extends AutoCloseable {
    void ping();

    ServerStats getStatistics();

    /**
     * @return the subset of {@code deviceAssetIds} already known to the server for this device
     */
    Set<String> checkExisting(String deviceId, List<String> deviceAssetIds);

    List<BulkCheckResult> bulkUploadCheck(List<BulkCheckItem> items);

    UploadResult upload(UploadRequest request);

    List<RemoteAlbum> listAlbums();

    RemoteAlbum createAlbum(String albumName);

    void putAlbumAssets(String albumId, List<String> assetIds);

    void postAlbumAssets(String albumId, List<String> assetIds);

    /**
     * @return the server asset registered under the device asset id, or null if there is none
     */
    RemoteAsset findByDeviceAssetId(String deviceId, String deviceAssetId);

    void deleteAssets(List<String> assetIds);

    RemoteAsset getAsset(String assetId);

    /**
     * Partial metadata update; only the given fields (e.g. {@code isFavorite}, {@code description}) change.
     */
    RemoteAsset updateAsset(String assetId, Map<String, Object> fields);

    @Override
    default void close() {
    }
}
