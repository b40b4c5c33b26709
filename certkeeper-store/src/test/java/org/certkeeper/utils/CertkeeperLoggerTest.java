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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class CertkeeperLoggerTest {

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    private Logger logger;
    private Level previousLevel;

    @Before
    public void attachHandler() {
        logger = Logger.getLogger(CertkeeperLogger.LOGGER_NAME);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
    }

    @After
    public void detachHandler() {
        logger.removeHandler(handler);
        logger.setLevel(previousLevel);
        CertkeeperLogger.setVerbose(false);
    }

    @Test
    public void testVerbose() {
        CertkeeperLogger.setVerbose(false);
        CertkeeperLogger.debug("deleted legacy key {}", "certificates/issuer/example.com/example.com.key");
        CertkeeperLogger.setVerbose(true);
        assertThat(CertkeeperLogger.isVerbose(), is(true));
        CertkeeperLogger.debug("could not delete site folder {}: {}", "certificates/issuer/example.com", "not empty");

        assertThat(records.size(), is(2));
        assertThat(records.get(0).getLevel(), is(Level.FINE));
        assertThat(records.get(0).getMessage(), is("deleted legacy key certificates/issuer/example.com/example.com.key"));
        assertThat(records.get(1).getLevel(), is(Level.INFO));
        assertThat(records.get(1).getMessage(), is("could not delete site folder certificates/issuer/example.com: not empty"));
    }
}
