/*
 Licensed to Diennea S.r.l. under one
 or more contributor license agreements. See the NOTICE file
 distributed with this work for additional information
 regarding copyright ownership. Diennea S.r.l. licenses this file
 to you under the Apache License, Version 2.0 (the
 "License"); you may not use this file except in compliance
 with the License.  You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing,
 software distributed under the License is distributed on an
 "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 KIND, either express or implied.  See the License for the
 specific language governing permissions and limitations
 under the License.

 */
package org.certkeeper.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Messages about cleanup work that may fail without consequences, like removing leftover legacy keys or empty
 * site folders.
 * <p>
 * They are logged at DEBUG under the {@value #LOGGER_NAME} logger. The {@value #VERBOSE_PROPERTY} system property,
 * or {@link #setVerbose(boolean)}, promotes them to INFO, to trace a migration without enabling DEBUG everywhere.
 */
public final class CertkeeperLogger {

    public static final String LOGGER_NAME = "org.certkeeper.cleanup";
    public static final String VERBOSE_PROPERTY = "certkeeper.logging.verbose";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private static volatile boolean verbose = Boolean.getBoolean(VERBOSE_PROPERTY);

    private CertkeeperLogger() {
    }

    public static boolean isVerbose() {
        return verbose;
    }

    public static void setVerbose(boolean verbose) {
        CertkeeperLogger.verbose = verbose;
    }

    public static void debug(String format, Object... args) {
        LOG.atLevel(verbose ? Level.INFO : Level.DEBUG).log(format, args);
    }
}
