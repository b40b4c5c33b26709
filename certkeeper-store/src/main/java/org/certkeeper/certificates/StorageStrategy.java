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

import java.io.IOException;
import org.certkeeper.storage.KeyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * How a {@link StorageMode} maps operations on the two formats.
 */
abstract class StorageStrategy {

    protected final LegacyFormat legacy;
    protected final BundleFormat bundle;

    protected StorageStrategy(LegacyFormat legacy, BundleFormat bundle) {
        this.legacy = legacy;
        this.bundle = bundle;
    }

    static StorageStrategy forMode(StorageMode mode, LegacyFormat legacy, BundleFormat bundle) {
        switch (mode) {
            case LEGACY:
                return new LegacyStrategy(legacy, bundle);
            case TRANSITION:
                return new TransitionStrategy(legacy, bundle);
            case BUNDLE:
                return new BundleStrategy(legacy, bundle);
            default:
                throw new IllegalArgumentException("unsupported storage mode " + mode);
        }
    }

    abstract StorageMode getMode();

    abstract void save(String issuerKey, String certKey, CertificateResource res) throws IOException;

    abstract CertificateResource load(String issuerKey, String name) throws IOException;

    abstract byte[] loadPrivateKey(String issuerKey, String name) throws IOException;

    abstract boolean exists(String issuerKey, String name);

    /**
     * @return where a compromised private key is parked before the certificate is deleted.
     */
    abstract String compromisedKeyLocation(String issuerKey, String name);

    static final class LegacyStrategy extends StorageStrategy {

        LegacyStrategy(LegacyFormat legacy, BundleFormat bundle) {
            super(legacy, bundle);
        }

        @Override
        StorageMode getMode() {
            return StorageMode.LEGACY;
        }

        @Override
        void save(String issuerKey, String certKey, CertificateResource res) throws IOException {
            legacy.save(issuerKey, certKey, res);
        }

        @Override
        CertificateResource load(String issuerKey, String name) throws IOException {
            return legacy.load(issuerKey, name);
        }

        @Override
        byte[] loadPrivateKey(String issuerKey, String name) throws IOException {
            return legacy.loadPrivateKey(issuerKey, name);
        }

        @Override
        boolean exists(String issuerKey, String name) {
            return legacy.exists(issuerKey, name);
        }

        @Override
        String compromisedKeyLocation(String issuerKey, String name) {
            return StorageKeys.sitePrivateKey(issuerKey, name) + StorageKeys.COMPROMISED_SUFFIX;
        }
    }

    /**
     * Reads the bundle first. Only a missing or malformed bundle falls back to the legacy keys; any other
     * failure of the backend is propagated, so that an outage is not mistaken for a missing bundle.
     */
    abstract static class BundleFirstStrategy extends StorageStrategy {

        private static final Logger LOG = LoggerFactory.getLogger(BundleFirstStrategy.class);

        BundleFirstStrategy(LegacyFormat legacy, BundleFormat bundle) {
            super(legacy, bundle);
        }

        @Override
        CertificateResource load(String issuerKey, String name) throws IOException {
            try {
                return bundle.load(issuerKey, name);
            } catch (KeyNotFoundException | BundleDecodingException err) {
                fallingBack(name, err);
                return legacy.load(issuerKey, name);
            }
        }

        @Override
        byte[] loadPrivateKey(String issuerKey, String name) throws IOException {
            try {
                return bundle.loadPrivateKey(issuerKey, name);
            } catch (KeyNotFoundException | BundleDecodingException err) {
                fallingBack(name, err);
                return legacy.loadPrivateKey(issuerKey, name);
            }
        }

        private void fallingBack(String name, IOException err) {
            CertificateStoreStats.legacyFallback(getMode());
            if (err instanceof BundleDecodingException) {
                LOG.warn("unreadable certificate bundle for {}, reading legacy format: {}", name, err.getMessage());
            } else {
                LOG.debug("no certificate bundle for {}, reading legacy format", name);
            }
        }

        @Override
        boolean exists(String issuerKey, String name) {
            return bundle.exists(issuerKey, name) || legacy.exists(issuerKey, name);
        }

        @Override
        String compromisedKeyLocation(String issuerKey, String name) {
            return StorageKeys.siteBundle(issuerKey, name) + StorageKeys.COMPROMISED_SUFFIX;
        }
    }

    /**
     * Bundle first, then legacy. A failed bundle write aborts the save; a failed legacy write is reported, but the
     * bundle stays in place and serves reads.
     */
    static final class TransitionStrategy extends BundleFirstStrategy {

        TransitionStrategy(LegacyFormat legacy, BundleFormat bundle) {
            super(legacy, bundle);
        }

        @Override
        StorageMode getMode() {
            return StorageMode.TRANSITION;
        }

        @Override
        void save(String issuerKey, String certKey, CertificateResource res) throws IOException {
            bundle.save(issuerKey, certKey, res);
            legacy.save(issuerKey, certKey, res);
        }
    }

    /**
     * Bundle only. Leftover legacy keys are removed; as reads prefer the bundle, a failed removal is harmless.
     */
    static final class BundleStrategy extends BundleFirstStrategy {

        BundleStrategy(LegacyFormat legacy, BundleFormat bundle) {
            super(legacy, bundle);
        }

        @Override
        StorageMode getMode() {
            return StorageMode.BUNDLE;
        }

        @Override
        void save(String issuerKey, String certKey, CertificateResource res) throws IOException {
            bundle.save(issuerKey, certKey, res);
            legacy.deleteQuietly(issuerKey, certKey);
        }
    }
}
