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
package com.mediabridge.sync.placement;

import java.io.File;

public class PlacementResult {
    public enum Type {
        Exported, SkippedIdentical
    }

    public static PlacementResult exported(File file) {
        return new PlacementResult(Type.Exported, file);
    }

    public static PlacementResult skippedIdentical(File existing) {
        return new PlacementResult(Type.SkippedIdentical, existing);
    }

    private final Type type;
    private final File file;

    private PlacementResult(Type type, File file) {
        this.type = type;
        this.file = file;
    }

    public Type getType() {
        return type;
    }

    public boolean isExported() {
        return type == Type.Exported;
    }

    /**
     * where the content now lives; for a skip this is the pre-existing identical file
     */
    public File getFile() {
        return file;
    }

    @Override
    public String toString() {
        return type + ": " + file;
    }
}
