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
import java.lang.reflect.InvocationTargetException;
import java.util.HashMap;
import java.util.Map;

public final class ConfigUtil {

    private static final Map<Class<?>, ConfigWrapper<?>> wrapperCache = new HashMap<>();

    @SuppressWarnings("unchecked")
    public static synchronized <C> ConfigWrapper<C> wrapperFor(Class<C> targetClass) {
        ConfigWrapper<C> configWrapper = (ConfigWrapper<C>) wrapperCache.get(targetClass);
        if (configWrapper == null) {
            configWrapper = new ConfigWrapper<>(targetClass);
            wrapperCache.put(targetClass, configWrapper);
        }
        return configWrapper;
    }

    public static String hyphenate(String name) {
        StringBuilder hyphenated = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c) && hyphenated.length() > 0)
                hyphenated.append('-');
            hyphenated.append(Character.toLowerCase(c));
        }
        return hyphenated.toString();
    }

    public static String labelize(String name) {
        StringBuilder label = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c) && label.length() > 0)
                label.append(' ');
            label.append(label.length() == 0 ? Character.toUpperCase(c) : c);
        }
        return label.toString();
    }

    @SuppressWarnings("unchecked")
    public static <C> String summarize(C configObject) {
        return wrapperFor((Class<C>) configObject.getClass()).summarize(configObject);
    }

    public static void validate(Object configObject) {
        try {
            ConfigWrapper<?> wrapper = wrapperFor(configObject.getClass());
            for (String property : wrapper.propertyNames()) {
                ConfigPropertyWrapper propertyWrapper = wrapper.getPropertyWrapper(property);
                Object value = propertyWrapper.getDescriptor().getReadMethod().invoke(configObject);
                // check required
                if (propertyWrapper.isRequired() && (value == null || value.toString().trim().isEmpty()))
                    throw new ConfigurationException(wrapper.getTargetClass().getSimpleName() + "." + property + " is required");
                // check value list
                if (value != null && propertyWrapper.getValueList().length > 0) {
                    boolean found = false;
                    for (String allowed : propertyWrapper.getValueList()) {
                        if (allowed.equals(value.toString())) found = true;
                    }
                    if (!found)
                        throw new ConfigurationException(wrapper.getTargetClass().getSimpleName() + "." + property
                                + " must be one of " + join(propertyWrapper.getValueList()));
                }
            }
        } catch (InvocationTargetException | IllegalAccessException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * convert an annotated getter into a commons-cli Option
     */
    public static org.apache.commons.cli.Option cliOptionFromAnnotation(PropertyDescriptor descriptor,
                                                                        Option _option,
                                                                        String prefix) {
        String description = _option.description();
        if (_option.valueList().length > 0) description += " (one of " + join(_option.valueList()) + ")";
        org.apache.commons.cli.Option option = new org.apache.commons.cli.Option(null, description);

        // long name
        String longName;
        if (_option.cliName().length() > 0) {
            longName = _option.cliName();
        } else {
            longName = hyphenate(descriptor.getName());
            if (isBoolean(descriptor) && _option.cliInverted()) longName = "no-" + longName;
        }
        if (prefix != null) longName = prefix + longName;
        option.setLongOpt(longName);

        // parameter[s]
        if (descriptor.getPropertyType().isArray()) {
            option.setArgs(org.apache.commons.cli.Option.UNLIMITED_VALUES);
        } else if (!isBoolean(descriptor)) {
            // non-booleans *must* have an argument
            option.setArgs(1);
        }
        if (option.hasArg()) {
            if (_option.valueHint().length() > 0) option.setArgName(_option.valueHint());
            else option.setArgName(option.getLongOpt());
        }

        return option;
    }

    static boolean isBoolean(PropertyDescriptor descriptor) {
        return Boolean.class == descriptor.getPropertyType() || "boolean".equals(descriptor.getPropertyType().getName());
    }

    public static String join(String[] parts) {
        if (parts == null || parts.length == 0) return null;
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            joined.append(parts[i]);
            if (i < parts.length - 1) joined.append(",");
        }
        return joined.toString();
    }

    private ConfigUtil() {
    }
}
