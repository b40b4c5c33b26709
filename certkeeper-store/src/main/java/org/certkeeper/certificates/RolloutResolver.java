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

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Resolves the storage mode of each domain.
 * <p>
 * Under the {@link StorageMode#TRANSITION transition} mode a domain transitions only if its rollout bucket
 * (32 bit FNV-1a hash of the name, modulo 100) is lower than the rollout percentage; other domains stay
 * {@link StorageMode#LEGACY legacy}. The bucket depends only on the name, so independent processes agree on the
 * mode of a domain without any coordination.
 */
public class RolloutResolver {

    private static final int FNV_32_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_32_PRIME = 0x01000193;

    private final StorageModeConfiguration configuration;

    public RolloutResolver(StorageModeConfiguration configuration) {
        this.configuration = configuration;
    }

    public StorageMode storageModeForDomain(String domain) {
        switch (configuration.getMode()) {
            case BUNDLE:
                return StorageMode.BUNDLE;
            case TRANSITION:
                return rolloutBucketForDomain(domain) < configuration.getRolloutPercent()
                        ? StorageMode.TRANSITION
                        : StorageMode.LEGACY;
            case LEGACY:
            default:
                return StorageMode.LEGACY;
        }
    }

    /**
     * @param domain a domain name
     * @return the rollout bucket of the domain, in [0, 100)
     */
    public static int rolloutBucketForDomain(String domain) {
        int hash = FNV_32_OFFSET_BASIS;
        for (byte b : domain.getBytes(UTF_8)) {
            hash ^= b & 0xff;
            hash *= FNV_32_PRIME;
        }
        return (int) (Integer.toUnsignedLong(hash) % 100);
    }
}
