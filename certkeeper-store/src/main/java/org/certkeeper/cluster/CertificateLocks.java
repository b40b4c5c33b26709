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
package org.certkeeper.cluster;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import org.certkeeper.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive sections guarding the certificates of a domain across processes.
 */
public final class CertificateLocks {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateLocks.class);

    private CertificateLocks() {
    }

    /**
     * Name of the lock guarding the issuance of a certificate.
     */
    public static String issueLockKey(String domain) {
        return "issue_cert_" + domain;
    }

    /**
     * Run a task holding a storage lock, keeping its lease alive meanwhile.
     *
     * @param storage the backend providing the lock
     * @param renewer renews the lease while the task runs
     * @param lockKey name of the lock
     * @param timeout maximum time to wait for the lock
     * @param task the guarded task
     * @return the result of the task
     * @throws IOException if the lock cannot be acquired in time, or the backend fails
     * @throws InterruptedException if interrupted while waiting for the lock
     * @throws Exception whatever the task throws
     */
    public static <T> T executeInLock(Storage storage, LockLeaseRenewer renewer, String lockKey, Duration timeout,
                                      Callable<T> task) throws Exception {
        if (!storage.lock(lockKey, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new IOException("cannot acquire lock " + lockKey + " within " + timeout);
        }
        LOG.debug("acquired lock {}", lockKey);
        try {
            try (LeaseHandle lease = renewer.keepAlive(storage, lockKey)) {
                return task.call();
            }
        } finally {
            try {
                storage.unlock(lockKey);
                LOG.debug("released lock {}", lockKey);
            } catch (IOException err) {
                LOG.error("cannot release lock {}", lockKey, err);
            }
        }
    }
}
