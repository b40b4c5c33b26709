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

import lombok.Value;
import org.certkeeper.configstore.ConfigurationStore;

/**
 * Global storage mode and rollout percentage. Resolved once at startup and shared by reference; being immutable
 * a reader always sees both values of the same configuration.
 * <p>
 * The rollout percentage narrows the {@link StorageMode#TRANSITION transition} mode to a deterministic subset of
 * domains, see {@link RolloutResolver}. It has no effect with other modes.
 */
@Value
public class StorageModeConfiguration {

    public static final String STORAGE_MODE_ENV = "CERTKEEPER_STORAGE_MODE";
    public static final String ROLLOUT_PERCENT_ENV = "CERTKEEPER_STORAGE_MODE_ROLLOUT_PERCENT";
    public static final String STORAGE_MODE_PROPERTY = "storage.mode";
    public static final String ROLLOUT_PERCENT_PROPERTY = "storage.mode.rollout.percent";

    public static final StorageModeConfiguration DEFAULT = new StorageModeConfiguration(StorageMode.LEGACY, 0);

    StorageMode mode;
    int rolloutPercent;

    public static StorageModeConfiguration of(StorageMode mode, int rolloutPercent) {
        return new StorageModeConfiguration(mode, rolloutPercent);
    }

    /**
     * Read {@value #STORAGE_MODE_ENV} and {@value #ROLLOUT_PERCENT_ENV} from the process environment.
     */
    public static StorageModeConfiguration fromEnvironment() {
        return fromConfiguration(ConfigurationStore.fromEnvironment());
    }

    /**
     * Read {@value #STORAGE_MODE_PROPERTY} and {@value #ROLLOUT_PERCENT_PROPERTY}, falling back to the
     * environment-style names. Malformed values never fail: the mode defaults to legacy and the percentage to 0.
     *
     * @param properties the configuration source
     * @return the configuration
     */
    public static StorageModeConfiguration fromConfiguration(ConfigurationStore properties) {
        String mode = properties.getString(STORAGE_MODE_PROPERTY, properties.getString(STORAGE_MODE_ENV, ""));
        int rolloutPercent = properties.getIntOrDefault(ROLLOUT_PERCENT_PROPERTY,
                properties.getIntOrDefault(ROLLOUT_PERCENT_ENV, 0));
        return new StorageModeConfiguration(StorageMode.parse(mode), rolloutPercent);
    }
}
