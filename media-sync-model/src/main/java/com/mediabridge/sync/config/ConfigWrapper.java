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
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeansException;
import org.springframework.beans.PropertyAccessorFactory;

import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reflective view of a configuration bean. Every getter annotated with {@link Option} becomes a property that can be
 * rendered as a commons-cli option, parsed from a command line and summarized.
 */
public class ConfigWrapper<C> {
    private static final Logger log = LoggerFactory.getLogger(ConfigWrapper.class);

    public static final String MASKED_VALUE = "********";

    public static String toString(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Object[]) {
            return Arrays.toString((Object[]) value);
        } else {
            return value.toString();
        }
    }

    private final Class<C> targetClass;
    private final Map<String, ConfigPropertyWrapper> propertyMap = new LinkedHashMap<>();

    public ConfigWrapper(Class<C> targetClass) {
        try {
            this.targetClass = targetClass;
            BeanInfo beanInfo = Introspector.getBeanInfo(targetClass);
            List<ConfigPropertyWrapper> properties = new ArrayList<>();
            for (PropertyDescriptor descriptor : beanInfo.getPropertyDescriptors()) {
                if (descriptor.getReadMethod() != null && descriptor.getReadMethod().isAnnotationPresent(Option.class)) {
                    properties.add(new ConfigPropertyWrapper(descriptor));
                }
            }
            properties.sort(Comparator.comparingInt(ConfigPropertyWrapper::getOrderIndex));
            for (ConfigPropertyWrapper property : properties) {
                propertyMap.put(property.getName(), property);
            }
            if (propertyMap.isEmpty()) log.info("no @Option annotations found in {}", targetClass.getSimpleName());
        } catch (IntrospectionException e) {
            throw new RuntimeException(e);
        }
    }

    public Options getOptions() {
        return getOptions(null, true);
    }

    public Options getOptions(String prefix, boolean includeAdvanced) {
        Options options = new Options();
        for (String name : propertyNames()) {
            ConfigPropertyWrapper propertyWrapper = getPropertyWrapper(name);
            if (!propertyWrapper.isCliOption()) continue;
            if (propertyWrapper.isAdvanced() && !includeAdvanced) continue;
            options.addOption(propertyWrapper.getCliOption(prefix));
        }
        return options;
    }

    public C parse(CommandLine commandLine) {
        return parse(commandLine, null);
    }

    public C parse(CommandLine commandLine, String prefix) {
        try {
            C object = getTargetClass().getDeclaredConstructor().newInstance();
            BeanWrapper beanWrapper = PropertyAccessorFactory.forBeanPropertyAccess(object);

            for (String name : propertyNames()) {
                ConfigPropertyWrapper propertyWrapper = getPropertyWrapper(name);
                if (!propertyWrapper.isCliOption()) continue;

                org.apache.commons.cli.Option option = propertyWrapper.getCliOption(prefix);

                if (commandLine.hasOption(option.getLongOpt())) {

                    Object value = commandLine.getOptionValue(option.getLongOpt());
                    if (propertyWrapper.getDescriptor().getPropertyType().isArray())
                        value = commandLine.getOptionValues(option.getLongOpt());

                    if (propertyWrapper.isBoolean())
                        value = Boolean.toString(!propertyWrapper.isCliInverted());

                    try {
                        beanWrapper.setPropertyValue(name, value);
                    } catch (BeansException e) {
                        throw new ConfigurationException("invalid value for --" + option.getLongOpt() + ": " + value, e);
                    }
                }
            }

            return object;
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    public String summarize(C object) {
        BeanWrapper beanWrapper = PropertyAccessorFactory.forBeanPropertyAccess(object);

        StringBuilder summary = new StringBuilder();
        summary.append(object.getClass().getSimpleName()).append("\n");
        for (String name : propertyNames()) {
            Object value = beanWrapper.getPropertyValue(name);
            String displayValue = getPropertyWrapper(name).isSensitive() && value != null ? MASKED_VALUE : toString(value);
            summary.append(" - ").append(name).append(": ").append(displayValue).append("\n");
        }

        return summary.toString();
    }

    public Class<C> getTargetClass() {
        return targetClass;
    }

    public Iterable<String> propertyNames() {
        return new ArrayList<>(propertyMap.keySet());
    }

    public ConfigPropertyWrapper getPropertyWrapper(String name) {
        return propertyMap.get(name);
    }
}
