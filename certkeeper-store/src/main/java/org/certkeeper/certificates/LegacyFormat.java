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
import java.util.ArrayList;
import java.util.List;
import org.certkeeper.storage.PartialWriteException;
import org.certkeeper.storage.Storage;
import org.certkeeper.utils.CertkeeperLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The legacy format: private key, certificate and metadata under three independent keys.
 * <p>
 * Writes are NOT atomic: keys are written one by one and, on failure, the keys already written are deleted on a
 * best effort basis. A failed save must be retried as a whole by the caller; a reader may meanwhile find only a
 * part of the keys, which it reports as a missing certificate.
 */
class LegacyFormat {

    private static final Logger LOG = LoggerFactory.getLogger(LegacyFormat.class);

    private final Storage storage;

    LegacyFormat(Storage storage) {
        this.storage = storage;
    }

    void save(String issuerKey, String certKey, CertificateResource res) throws IOException {
        byte[] metadata = BundleCodec.encodeMetadata(res);
        List<String> keys = StorageKeys.legacyKeys(issuerKey, certKey);
        byte[][] values = {res.getPrivateKeyPEM(), res.getCertificatePEM(), metadata};

        List<String> written = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            try {
                storage.store(keys.get(i), values[i]);
                written.add(keys.get(i));
            } catch (IOException err) {
                rollback(written);
                throw new PartialWriteException(keys.get(i), written, err);
            }
        }
    }

    private void rollback(List<String> written) {
        for (String key : written) {
            try {
                storage.delete(key);
            } catch (IOException err) {
                LOG.error("cannot roll back partially written key {}", key, err);
            }
        }
    }

    CertificateResource load(String issuerKey, String name) throws IOException {
        byte[] privateKey = storage.load(StorageKeys.sitePrivateKey(issuerKey, name));
        byte[] certificate = storage.load(StorageKeys.siteCert(issuerKey, name));
        LegacyMetadata metadata = BundleCodec.decodeMetadata(storage.load(StorageKeys.siteMeta(issuerKey, name)));
        return new CertificateResource(
                metadata.getSans(),
                certificate,
                privateKey,
                BundleCodec.fromRawIssuerData(metadata.getIssuerData()),
                issuerKey);
    }

    byte[] loadPrivateKey(String issuerKey, String name) throws IOException {
        return storage.load(StorageKeys.sitePrivateKey(issuerKey, name));
    }

    /**
     * @return true only if all the three keys are present.
     */
    boolean exists(String issuerKey, String name) {
        for (String key : StorageKeys.legacyKeys(issuerKey, name)) {
            if (!storage.exists(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Delete every legacy key present, even if some deletion fails.
     *
     * @throws IOException the first failure, with the others as suppressed exceptions
     */
    void delete(String issuerKey, String name) throws IOException {
        IOException failure = null;
        for (String key : StorageKeys.legacyKeys(issuerKey, name)) {
            if (!storage.exists(key)) {
                continue;
            }
            try {
                storage.delete(key);
                CertkeeperLogger.debug("deleted legacy key {}", key);
            } catch (IOException err) {
                IOException wrapped = new IOException("deleting legacy key " + key + ": " + err.getMessage(), err);
                if (failure == null) {
                    failure = wrapped;
                } else {
                    failure.addSuppressed(wrapped);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Cleanup variant of {@link #delete(String, String)}: failures are only logged.
     */
    void deleteQuietly(String issuerKey, String name) {
        try {
            delete(issuerKey, name);
        } catch (IOException err) {
            CertkeeperLogger.debug("could not delete legacy keys of {}: {}", name, err.getMessage());
        }
    }
}
