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

import java.util.Objects;

public class Variant {
    public static final String RENDERED_RESOURCE_NAME = "rendered";

    public static Variant rendered() {
        return new Variant(VariantType.edited, RENDERED_RESOURCE_NAME);
    }

    private final VariantType type;
    private final String resourceName;

    public Variant(VariantType type, String resourceName) {
        this.type = Objects.requireNonNull(type, "type");
        this.resourceName = resourceName;
    }

    public VariantType getType() {
        return type;
    }

    /**
     * Original file name of the underlying resource, may be null
     */
    public String getResourceName() {
        return resourceName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Variant variant = (Variant) o;
        return type == variant.type && Objects.equals(resourceName, variant.resourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, resourceName);
    }

    @Override
    public String toString() {
        return type + "(" + resourceName + ")";
    }
}
