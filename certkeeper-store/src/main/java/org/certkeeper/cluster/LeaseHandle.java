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

import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * A renewal loop started by {@link LockLeaseRenewer#keepAlive}. Closing the handle stops the loop, waiting for a
 * renewal in progress; it does not release the lock.
 */
public final class LeaseHandle implements AutoCloseable {

    private final String lockKey;
    private final Consumer<LeaseHandle> onClose;
    private volatile boolean active = true;
    private volatile int renewals;
    private volatile Exception lastError;
    private ScheduledFuture<?> nextRenewal;

    LeaseHandle(String lockKey, Consumer<LeaseHandle> onClose) {
        this.lockKey = lockKey;
        this.onClose = onClose;
    }

    public String getLockKey() {
        return lockKey;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @return number of successful renewals
     */
    public int getRenewals() {
        return renewals;
    }

    /**
     * @return the error of the last renewal, null if it succeeded or none ran yet
     */
    public Exception getLastError() {
        return lastError;
    }

    synchronized void setNextRenewal(ScheduledFuture<?> nextRenewal) {
        if (!active) {
            nextRenewal.cancel(false);
            return;
        }
        this.nextRenewal = nextRenewal;
    }

    void renewed() {
        renewals++; // single renewal thread
        lastError = null;
    }

    void failed(Exception err) {
        lastError = err;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (!active) {
                return;
            }
            active = false;
            if (nextRenewal != null) {
                nextRenewal.cancel(false);
            }
        }
        onClose.accept(this);
    }
}
