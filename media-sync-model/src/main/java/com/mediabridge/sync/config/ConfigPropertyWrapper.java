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
package com.mediabridge.sync.config;

import com.mediabridge.sync.config.annotation.Option;

import java.beans.PropertyDescriptor;
import java.util.HashMap;
import java.util.Map;

public class ConfigPropertyWrapper {
    private final PropertyDescriptor descriptor;
    private final Option option;
    private final org.apache.commons.cli.Option cliOption;
    private final Map<String, org.apache.commons.cli.Option> prefixOptions = new HashMap<>();

    public ConfigPropertyWrapper(PropertyDescriptor descriptor) {
        if (!descriptor.getReadMethod().isAnnotationPresent(Option.class))
            throw new IllegalArgumentException(descriptor.getName() + " is not an @Option");
        this.descriptor = descriptor;
        this.option = descriptor.getReadMethod().getAnnotation(Option.class);
        this.cliOption = ConfigUtil.cliOptionFromAnnotation(descriptor, option, null);
    }

    public boolean isCliOption() {
        return option.cli();
    }

    public PropertyDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.getName();
    }

    public Option getAnnotation() {
        return option;
    }

    public boolean isRequired() {
        return option.required();
    }

    public boolean isBoolean() {
        return ConfigUtil.isBoolean(descriptor);
    }

    public String getLabel() {
        return (option.label().trim().isEmpty()) ? ConfigUtil.labelize(getName()) : option.label();
    }

    public String getCliName() {
        return cliOption.getLongOpt();
    }

    public boolean isCliInverted() {
        return option.cliInverted();
    }

    public String getDescription() {
        return option.description();
    }

    public String[] getValueList() {
        return option.valueList();
    }

    public int getOrderIndex() {
        return option.orderIndex();
    }

    public boolean isAdvanced() {
        return option.advanced();
    }

    public boolean isSensitive() {
        return option.sensitive();
    }

    public org.apache.commons.cli.Option getCliOption() {
        return cliOption;
    }

    public synchronized org.apache.commons.cli.Option getCliOption(String prefix) {
        if (prefix == null) return cliOption;
        org.apache.commons.cli.Option prefixed = prefixOptions.get(prefix);
        if (prefixed == null) {
            prefixed = ConfigUtil.cliOptionFromAnnotation(descriptor, option, prefix);
            prefixOptions.put(prefix, prefixed);
        }
        return prefixed;
    }
}
