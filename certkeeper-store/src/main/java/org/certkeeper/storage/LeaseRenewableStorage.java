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
import java.time.Duration;

/**
 * A {@link Storage} whose locks expire unless their lease is renewed.
 */
public interface LeaseRenewableStorage extends Storage {

    /**
     * Extend the lease of a lock currently held.
     *
     * @param lockKey name of the lock
     * @param leaseDuration how long the lock stays valid from now
     * @throws IOException if the lease cannot be renewed
     */
    void renewLockLease(String lockKey, Duration leaseDuration) throws IOException;
}
