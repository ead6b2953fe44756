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
package com.mediabridge.sync.cli;

import com.mediabridge.sync.config.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingUtil {
    private static final Logger log = LoggerFactory.getLogger(LoggingUtil.class);

    public static LogLevel getRootLogLevel() {
        org.apache.logging.log4j.Level level = org.apache.logging.log4j.LogManager.getRootLogger().getLevel();
        if (org.apache.logging.log4j.Level.TRACE.equals(level) || org.apache.logging.log4j.Level.ALL.equals(level)) {
            return LogLevel.trace;
        } else if (org.apache.logging.log4j.Level.DEBUG.equals(level)) {
            return LogLevel.debug;
        } else if (org.apache.logging.log4j.Level.INFO.equals(level)) {
            return LogLevel.verbose;
        } else if (org.apache.logging.log4j.Level.WARN.equals(level)) {
            return LogLevel.quiet;
        }
        return LogLevel.silent;
    }

    // only takes effect when SLF4J is bound to log4j2
    public static void setRootLogLevel(LogLevel logLevel) {
        try {
            org.apache.logging.log4j.Level level;
            java.util.logging.Level julLevel;
            switch (logLevel) {
                case trace:
                    level = org.apache.logging.log4j.Level.TRACE;
                    julLevel = java.util.logging.Level.FINEST;
                    break;
                case debug:
                    level = org.apache.logging.log4j.Level.DEBUG;
                    julLevel = java.util.logging.Level.FINE;
                    break;
                case verbose:
                    level = org.apache.logging.log4j.Level.INFO;
                    julLevel = java.util.logging.Level.INFO;
                    break;
                case quiet:
                    level = org.apache.logging.log4j.Level.WARN;
                    julLevel = java.util.logging.Level.WARNING;
                    break;
                default:
                    level = org.apache.logging.log4j.Level.ERROR;
                    julLevel = java.util.logging.Level.SEVERE;
            }
            org.apache.logging.log4j.core.config.Configurator.setRootLevel(level);
            java.util.logging.LogManager.getLogManager().getLogger("").setLevel(julLevel);
        } catch (Throwable t) {
            log.warn("could not configure log4j (perhaps you're using a different logger, which is fine)", t);
        }
    }

    private LoggingUtil() {
    }
}
