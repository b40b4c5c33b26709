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
package org.certkeeper.certificates;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import java.util.Properties;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.certkeeper.configstore.PropertiesConfigurationStore;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class StorageModeTest {

    @Test
    @Parameters({
        "legacy, LEGACY",
        "transition, TRANSITION",
        "bundle, BUNDLE",
        "BUNDLE, BUNDLE",
        "Transition, TRANSITION",
        "  bundle  , BUNDLE",
        "invalid, LEGACY",
        "bundles, LEGACY"
    })
    public void testParse(String value, StorageMode expected) {
        assertThat(StorageMode.parse(value), is(expected));
    }

    @Test
    public void testParseMissing() {
        assertThat(StorageMode.parse(null), is(StorageMode.LEGACY));
        assertThat(StorageMode.parse(""), is(StorageMode.LEGACY));
        assertThat(StorageMode.BUNDLE.toString(), is("bundle"));
    }

    @Test
    public void testConfigurationFromProperties() {
        Properties props = new Properties();
        props.setProperty(StorageModeConfiguration.STORAGE_MODE_PROPERTY, "Transition");
        props.setProperty(StorageModeConfiguration.ROLLOUT_PERCENT_PROPERTY, " 25 ");
        StorageModeConfiguration conf = StorageModeConfiguration.fromConfiguration(new PropertiesConfigurationStore(props));
        assertThat(conf.getMode(), is(StorageMode.TRANSITION));
        assertThat(conf.getRolloutPercent(), is(25));
    }

    @Test
    public void testConfigurationFromEnvironmentNames() {
        Properties env = new Properties();
        env.setProperty(StorageModeConfiguration.STORAGE_MODE_ENV, "bundle");
        env.setProperty(StorageModeConfiguration.ROLLOUT_PERCENT_ENV, "40");
        StorageModeConfiguration conf = StorageModeConfiguration.fromConfiguration(new PropertiesConfigurationStore(env));
        assertThat(conf, is(StorageModeConfiguration.of(StorageMode.BUNDLE, 40)));

        // property names win
        env.setProperty(StorageModeConfiguration.STORAGE_MODE_PROPERTY, "legacy");
        conf = StorageModeConfiguration.fromConfiguration(new PropertiesConfigurationStore(env));
        assertThat(conf.getMode(), is(StorageMode.LEGACY));
        assertThat(conf.getRolloutPercent(), is(40));
    }

    @Test
    public void testConfigurationFromProcessEnvironment() {
        StorageModeConfiguration conf = StorageModeConfiguration.fromEnvironment();
        assertThat(conf.getMode(), is(StorageMode.parse(System.getenv(StorageModeConfiguration.STORAGE_MODE_ENV))));
        if (System.getenv(StorageModeConfiguration.ROLLOUT_PERCENT_ENV) == null) {
            assertThat(conf.getRolloutPercent(), is(0));
        }
    }

    @Test
    @Parameters({"abc", "", "  ", "12.5"})
    public void testMalformedRolloutPercent(String value) {
        Properties props = new Properties();
        props.setProperty(StorageModeConfiguration.STORAGE_MODE_PROPERTY, "transition");
        props.setProperty(StorageModeConfiguration.ROLLOUT_PERCENT_PROPERTY, value);
        StorageModeConfiguration conf = StorageModeConfiguration.fromConfiguration(new PropertiesConfigurationStore(props));
        assertThat(conf.getMode(), is(StorageMode.TRANSITION));
        assertThat(conf.getRolloutPercent(), is(0));
    }

    @Test
    public void testDefaults() {
        StorageModeConfiguration conf = StorageModeConfiguration.fromConfiguration(
                new PropertiesConfigurationStore(new Properties()));
        assertThat(conf, is(StorageModeConfiguration.DEFAULT));
        assertThat(conf.getMode(), is(StorageMode.LEGACY));
        assertThat(conf.getRolloutPercent(), is(0));
    }
}
