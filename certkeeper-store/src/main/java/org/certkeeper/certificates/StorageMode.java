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

import java.util.Locale;

/**
 * Format in which certificates are written and read.
 */
public enum StorageMode {

    /**
     * Only the three keys format (private key, certificate, metadata).
     */
    LEGACY("legacy"),
    /**
     * Write both formats (bundle first), read the bundle with fallback to the legacy format.
     */
    TRANSITION("transition"),
    /**
     * Write the bundle only and clean up the legacy keys, read the bundle with fallback to the legacy format.
     */
    BUNDLE("bundle");

    private final String value;

    StorageMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Case insensitive, unknown or missing values resolve to {@link #LEGACY}.
     *
     * @param value textual mode
     * @return the storage mode
     */
    public static StorageMode parse(String value) {
        if (value == null) {
            return LEGACY;
        }
        String mode = value.trim().toLowerCase(Locale.ROOT);
        for (StorageMode m : values()) {
            if (m.value.equals(mode)) {
                return m;
            }
        }
        return LEGACY;
    }

    @Override
    public String toString() {
        return value;
    }
}
