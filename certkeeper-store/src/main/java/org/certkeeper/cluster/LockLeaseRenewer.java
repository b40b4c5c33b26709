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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.certkeeper.storage.LeaseRenewableStorage;
import org.certkeeper.storage.Storage;
import org.certkeeper.utils.PrometheusUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the lease of storage locks alive while a long running certificate operation holds them.
 * <p>
 * The n-th renewal requests a lease of {@code RETRY_INTERVALS[n] + certObtainTimeout} and the next renewal runs
 * after {@code RETRY_INTERVALS[n]}: the lease always outlives the wait for the next renewal. Past the end of the
 * table the interval is {@link #MAX_RETRY_DURATION}.
 * <p>
 * Backends which are not {@link LeaseRenewableStorage} have nothing to renew: renewals succeed without doing
 * anything.
 */
public class LockLeaseRenewer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LockLeaseRenewer.class);

    public static final List<Duration> RETRY_INTERVALS = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(2),
            Duration.ofMinutes(2),
            Duration.ofMinutes(5), // elapsed: 10 min
            Duration.ofMinutes(10),
            Duration.ofMinutes(10),
            Duration.ofMinutes(10),
            Duration.ofMinutes(20), // elapsed: 1 hr
            Duration.ofMinutes(20),
            Duration.ofMinutes(20),
            Duration.ofMinutes(20), // elapsed: 2 hr
            Duration.ofMinutes(30),
            Duration.ofMinutes(30), // elapsed: 3 hr
            Duration.ofMinutes(30),
            Duration.ofMinutes(30), // elapsed: 4 hr
            Duration.ofMinutes(30),
            Duration.ofMinutes(30), // elapsed: 5 hr
            Duration.ofHours(1), // elapsed: 6 hr
            Duration.ofHours(1),
            Duration.ofHours(1), // elapsed: 8 hr
            Duration.ofHours(2),
            Duration.ofHours(2), // elapsed: 12 hr
            Duration.ofHours(3),
            Duration.ofHours(3), // elapsed: 18 hr
            Duration.ofHours(6) // repeat for up to maxRetryDuration
    );
    public static final Duration MAX_RETRY_DURATION = Duration.ofDays(30);
    public static final Duration DEFAULT_CERT_OBTAIN_TIMEOUT = Duration.ofSeconds(90);
    public static final String CERT_OBTAIN_TIMEOUT_PROPERTY = "lock.obtain.timeout";

    private static final Counter RENEWALS_COUNTER = PrometheusUtils.registerCounter("locks",
            "lease_renewals_total", "lock lease renewals", "outcome");
    private static final Gauge ACTIVE_LEASES_GAUGE = PrometheusUtils.registerGauge("locks",
            "active_leases", "locks whose lease is being kept alive");

    private final List<Duration> retryIntervals;
    private final Duration maxRetryDuration;
    private final Duration certObtainTimeout;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentHashMap<String, LeaseHandle> activeLeases = new ConcurrentHashMap<>();

    public LockLeaseRenewer() {
        this(DEFAULT_CERT_OBTAIN_TIMEOUT);
    }

    public LockLeaseRenewer(Duration certObtainTimeout) {
        this(RETRY_INTERVALS, MAX_RETRY_DURATION, certObtainTimeout);
    }

    @VisibleForTesting
    LockLeaseRenewer(List<Duration> retryIntervals, Duration maxRetryDuration, Duration certObtainTimeout) {
        this.retryIntervals = List.copyOf(retryIntervals);
        this.maxRetryDuration = maxRetryDuration;
        this.certObtainTimeout = certObtainTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("lock-lease-renewer-%d")
                .setDaemon(true)
                .build());
    }

    public Duration getCertObtainTimeout() {
        return certObtainTimeout;
    }

    /**
     * @param attempt number of renewals already performed
     * @return the wait before the next renewal
     */
    public Duration retryInterval(int attempt) {
        if (attempt >= 0 && attempt < retryIntervals.size()) {
            return retryIntervals.get(attempt);
        }
        return maxRetryDuration;
    }

    /**
     * @param attempt number of renewals already performed
     * @return the lease requested by the renewal
     */
    public Duration leaseDuration(int attempt) {
        return retryInterval(attempt).plus(certObtainTimeout);
    }

    /**
     * Extend the lease of a held lock once.
     *
     * @param storage the backend holding the lock
     * @param lockKey name of the lock
     * @param attempt number of renewals already performed
     * @throws IOException if the backend fails to renew the lease
     */
    public void renewLockLease(Storage storage, String lockKey, int attempt) throws IOException {
        if (!(storage instanceof LeaseRenewableStorage)) {
            LOG.debug("{} does not support lease renewal, nothing to do for lock {}", storage, lockKey);
            return;
        }
        Duration leaseDuration = leaseDuration(attempt);
        try {
            ((LeaseRenewableStorage) storage).renewLockLease(lockKey, leaseDuration);
        } catch (IOException err) {
            RENEWALS_COUNTER.labels("failed").inc();
            throw err;
        }
        RENEWALS_COUNTER.labels("renewed").inc();
        LOG.debug("renewed lease of lock {} for {} (attempt {})", lockKey, leaseDuration, attempt);
    }

    /**
     * Renew the lease of a held lock until the returned handle is closed. The first renewal runs immediately.
     * <p>
     * A failed renewal does not stop the loop: the error is recorded on the handle, the caller decides whether to
     * abort the guarded operation.
     *
     * @param storage the backend holding the lock
     * @param lockKey name of the lock
     * @return handle stopping the renewals once closed
     * @throws IllegalStateException if the lease of this lock is already being renewed
     */
    public LeaseHandle keepAlive(Storage storage, String lockKey) {
        LeaseHandle handle = new LeaseHandle(lockKey, this::release);
        if (activeLeases.putIfAbsent(lockKey, handle) != null) {
            throw new IllegalStateException("lease of lock " + lockKey + " is already being renewed");
        }
        ACTIVE_LEASES_GAUGE.inc();
        try {
            schedule(storage, handle, 0, Duration.ZERO);
        } catch (RejectedExecutionException err) {
            handle.close();
            throw new IllegalStateException("lease renewer is closed", err);
        }
        return handle;
    }

    private void schedule(Storage storage, LeaseHandle handle, int attempt, Duration delay) {
        if (!handle.isActive()) {
            return;
        }
        handle.setNextRenewal(scheduler.schedule(() -> renew(storage, handle, attempt),
                delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    private void renew(Storage storage, LeaseHandle handle, int attempt) {
        // LeaseHandle.close() waits on the same monitor: once it returns no renewal is running or will run
        synchronized (handle) {
            if (!handle.isActive()) {
                return;
            }
            try {
                renewLockLease(storage, handle.getLockKey(), attempt);
                handle.renewed();
            } catch (IOException | RuntimeException err) {
                LOG.error("failed to renew lease of lock {} (attempt {})", handle.getLockKey(), attempt, err);
                handle.failed(err);
            }
        }
        try {
            schedule(storage, handle, attempt + 1, retryInterval(attempt));
        } catch (RejectedExecutionException err) {
            LOG.info("lease renewer closed, stop renewing lock {}", handle.getLockKey());
        }
    }

    private void release(LeaseHandle handle) {
        if (activeLeases.remove(handle.getLockKey(), handle)) {
            ACTIVE_LEASES_GAUGE.dec();
        }
    }

    @VisibleForTesting
    boolean isKeepingAlive(String lockKey) {
        return activeLeases.containsKey(lockKey);
    }

    /**
     * Stop every renewal loop.
     */
    @Override
    public void close() {
        for (LeaseHandle handle : activeLeases.values()) {
            handle.close();
        }
        scheduler.shutdownNow();
    }
}
