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
import java.time.Clock;
import java.time.Instant;
import org.certkeeper.storage.KeyNotFoundException;
import org.certkeeper.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The bundle format: the whole resource in a single key, written atomically.
 */
class BundleFormat {

    private static final Logger LOG = LoggerFactory.getLogger(BundleFormat.class);

    private final Storage storage;
    private final Clock clock;

    BundleFormat(Storage storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    /**
     * Write the bundle. The creation time of a bundle already stored under the same key is kept.
     */
    void save(String issuerKey, String certKey, CertificateResource res) throws IOException {
        String bundleKey = StorageKeys.siteBundle(issuerKey, certKey);
        Instant updatedAt = clock.instant();
        Instant createdAt = previousCreatedAt(bundleKey);
        if (createdAt == null) {
            createdAt = updatedAt;
        }
        byte[] data = BundleCodec.encode(BundleCodec.toBundle(res, createdAt, updatedAt));
        try {
            storage.store(bundleKey, data);
        } catch (IOException err) {
            throw new IOException("storing certificate bundle " + bundleKey + ": " + err.getMessage(), err);
        }
    }

    private Instant previousCreatedAt(String bundleKey) throws IOException {
        try {
            return BundleCodec.decode(storage.load(bundleKey)).getCreatedAt();
        } catch (KeyNotFoundException err) {
            return null;
        } catch (BundleDecodingException err) {
            LOG.warn("overwriting unreadable certificate bundle {}", bundleKey, err);
            return null;
        }
    }

    /**
     * @throws KeyNotFoundException if there is no bundle
     * @throws BundleDecodingException if the bundle is malformed
     */
    CertificateResource load(String issuerKey, String name) throws IOException {
        CertificateBundle bundle = BundleCodec.decode(storage.load(StorageKeys.siteBundle(issuerKey, name)));
        return BundleCodec.toResource(bundle, issuerKey);
    }

    /**
     * @throws KeyNotFoundException if there is no bundle
     * @throws BundleDecodingException if the bundle is malformed
     */
    byte[] loadPrivateKey(String issuerKey, String name) throws IOException {
        return BundleCodec.decodePrivateKey(storage.load(StorageKeys.siteBundle(issuerKey, name)));
    }

    boolean exists(String issuerKey, String name) {
        return storage.exists(StorageKeys.siteBundle(issuerKey, name));
    }

    void delete(String issuerKey, String name) throws IOException {
        String bundleKey = StorageKeys.siteBundle(issuerKey, name);
        if (!storage.exists(bundleKey)) {
            return;
        }
        try {
            storage.delete(bundleKey);
        } catch (IOException err) {
            throw new IOException("deleting certificate bundle " + bundleKey + ": " + err.getMessage(), err);
        }
    }
}
