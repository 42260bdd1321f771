////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovystyle.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Runtime control of the Logback root logger level.
 */
public final class LogLevels {

    private static final Logger logger = LoggerFactory.getLogger(LogLevels.class);

    private LogLevels() {
    }

    /**
     * Sets the root logger level. Accepted values (case-insensitive): ERROR,
     * WARN, INFO, DEBUG, TRACE. Unknown names are logged and ignored.
     *
     * @return whether the level was applied
     */
    public static boolean applyLogLevel(String levelName) {
        if (levelName == null || levelName.isBlank()) {
            return false;
        }
        Level level = Level.toLevel(levelName.trim(), null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return false;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Root logger is not a Logback logger, cannot set level to {}", level);
            return false;
        }
        ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
        Level previous = logbackRoot.getLevel();
        logbackRoot.setLevel(level);
        if (!level.equals(previous)) {
            logger.info("Log level changed from {} to {}", previous, level);
        }
        return true;
    }
}
