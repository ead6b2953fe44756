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
package com.mediabridge.sync.source;

import com.mediabridge.sync.model.CandidateItem;
import com.mediabridge.sync.model.SourceAlbum;
import com.mediabridge.sync.model.Variant;

import java.io.File;
import java.util.List;

/**
 * Where media items come from. Filtering, sorting and limiting are applied by the engine, so a source only needs to
 * enumerate what it has.
 */
public interface AssetSource extends AutoCloseable {
    /**
     * short identifier of this source, recorded in upload metadata
     */
    String getName();

    List<CandidateItem> listItems() throws ExportException;

    /**
     * Writes the bytes of one variant to {@code target}, which does not exist yet. May block for a long time; must
     * honor thread interruption where it can. Progress is optional.
     */
    void export(CandidateItem item, Variant variant, File target, ExportProgress progress) throws ExportException;

    /**
     * Album-like groupings with their member item ids. Sources without albums return an empty list.
     */
    List<SourceAlbum> listAlbums() throws ExportException;

    @Override
    default void close() {
    }
}
