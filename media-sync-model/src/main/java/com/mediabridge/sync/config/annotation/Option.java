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
package com.mediabridge.sync.config.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Option {
    boolean required() default false;

    String label() default "";

    /**
     * Set to false to keep a property out of the command line (it can still be set in an XML job file)
     */
    boolean cli() default true;

    String cliName() default "";

    /**
     * Use for booleans whose default is true. The CLI option will be inverted to disable the property
     */
    boolean cliInverted() default false;

    String description() default "";

    /**
     * Use to constrain the values to a specific list
     */
    String[] valueList() default {};

    String valueHint() default "";

    /**
     * Used to manipulate the order the options appear in help output and summaries
     */
    int orderIndex() default 1000;

    /**
     * Use to denote an "advanced" option that is only listed in the long help
     */
    boolean advanced() default false;

    /**
     * Specifies that this option holds a secret and must never be printed in a summary
     */
    boolean sensitive() default false;
}
