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
package org.certkeeper.storage;

import java.io.IOException;
import java.util.List;

/**
 * One of several keys that had to be written together could not be stored.
 * <p>
 * The storage offers no multi-key atomicity, so some keys may have been written (and possibly rolled back)
 * before the failure. Callers are expected to retry the whole write.
 */
public class PartialWriteException extends IOException {

    private final String failedKey;
    private final List<String> writtenKeys;

    public PartialWriteException(String failedKey, List<String> writtenKeys, Throwable cause) {
        super("storing " + failedKey + " failed after writing " + writtenKeys, cause);
        this.failedKey = failedKey;
        this.writtenKeys = List.copyOf(writtenKeys);
    }

    public String getFailedKey() {
        return failedKey;
    }

    /**
     * @return keys written before the failure, in write order.
     */
    public List<String> getWrittenKeys() {
        return writtenKeys;
    }
}
