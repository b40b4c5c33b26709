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

import io.prometheus.client.Counter;
import org.certkeeper.utils.PrometheusUtils;

/**
 * Metrics of the certificate store.
 */
final class CertificateStoreStats {

    private static final Counter LEGACY_FALLBACKS_COUNTER = PrometheusUtils.registerCounter("certificates",
            "legacy_fallbacks_total", "reads served by the legacy format because no usable bundle was found", "mode");
    private static final Counter MIGRATIONS_COUNTER = PrometheusUtils.registerCounter("certificates",
            "migrations_total", "certificates processed by migrations to the bundle format", "outcome");

    private CertificateStoreStats() {
    }

    static void legacyFallback(StorageMode mode) {
        LEGACY_FALLBACKS_COUNTER.labels(mode.getValue()).inc();
    }

    static void migrated() {
        MIGRATIONS_COUNTER.labels("migrated").inc();
    }

    static void skipped() {
        MIGRATIONS_COUNTER.labels("skipped").inc();
    }

    static void failed() {
        MIGRATIONS_COUNTER.labels("failed").inc();
    }
}
