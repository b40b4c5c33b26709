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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.certkeeper.storage.KeyNotFoundException;
import org.certkeeper.storage.Storage;
import org.certkeeper.utils.CertkeeperLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for saving, loading, deleting and migrating certificate resources.
 * <p>
 * Two encodings are supported, the legacy one (three keys per certificate) and the bundle (one key), see
 * {@link StorageMode}. The mode of each operation is either fixed for the store, or resolved per domain from a
 * {@link StorageModeConfiguration} through the {@link RolloutResolver}, so that a migration can be staged over a
 * growing share of the domains.
 * <p>
 * Certificates are addressed by issuer key and by names key ({@link CertificateResource#namesKey()}), usually the
 * domain name. Names are converted to their ASCII compatible form before deriving the storage keys.
 * <p>
 * The store holds no lock: exclusive access across processes is up to the caller, see
 * {@link org.certkeeper.cluster.CertificateLocks}.
 */
public class CertificateStore {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateStore.class);

    private final Storage storage;
    private final RolloutResolver rolloutResolver;
    private final StorageMode fixedMode;
    private final LegacyFormat legacy;
    private final BundleFormat bundle;
    private final Map<StorageMode, StorageStrategy> strategies = new EnumMap<>(StorageMode.class);

    /**
     * Store resolving the mode of each domain from the given configuration.
     *
     * @param storage the backend
     * @param configuration global mode and rollout percentage
     */
    public CertificateStore(Storage storage, StorageModeConfiguration configuration) {
        this(storage, new RolloutResolver(configuration), null, Clock.systemUTC());
    }

    /**
     * Store using the same mode for every domain.
     *
     * @param storage the backend
     * @param mode the storage mode
     * @return the store
     */
    public static CertificateStore withMode(Storage storage, StorageMode mode) {
        return new CertificateStore(storage, new RolloutResolver(StorageModeConfiguration.of(mode, 100)), mode, Clock.systemUTC());
    }

    @VisibleForTesting
    CertificateStore(Storage storage, RolloutResolver rolloutResolver, StorageMode fixedMode, Clock clock) {
        this.storage = storage;
        this.rolloutResolver = rolloutResolver;
        this.fixedMode = fixedMode;
        this.legacy = new LegacyFormat(storage);
        this.bundle = new BundleFormat(storage, clock);
        for (StorageMode mode : StorageMode.values()) {
            strategies.put(mode, StorageStrategy.forMode(mode, legacy, bundle));
        }
    }

    public Storage getStorage() {
        return storage;
    }

    /**
     * @param name the normalized names key
     * @return the mode operations on that certificate run with
     */
    public StorageMode storageModeFor(String name) {
        return fixedMode != null ? fixedMode : rolloutResolver.storageModeForDomain(name);
    }

    private StorageStrategy strategyFor(String name) {
        return strategies.get(storageModeFor(name));
    }

    /**
     * Write a certificate resource:
     * <ul>
     * <li>legacy: the three legacy keys only
     * <li>transition: the bundle, then the legacy keys; nothing is written if the bundle cannot be stored
     * <li>bundle: the bundle only; leftover legacy keys are removed
     * </ul>
     * Writes are not atomic across keys: on failure the caller must retry the save.
     *
     * @param issuerKey the issuer owning the certificate
     * @param res the resource, with at least one SAN
     * @throws IOException if the resource is not fully written
     */
    public void save(String issuerKey, CertificateResource res) throws IOException {
        Preconditions.checkArgument(!res.getSans().isEmpty(), "certificate resource has no SANs");
        String certKey = DomainNames.toAscii(res.namesKey());
        strategyFor(certKey).save(issuerKey, certKey, res);
    }

    /**
     * Read a certificate resource. In transition and bundle modes a missing or malformed bundle is silently
     * replaced by a read of the legacy keys.
     *
     * @param issuerKey the issuer owning the certificate
     * @param domain the names key of the certificate
     * @return the resource
     * @throws KeyNotFoundException if the certificate does not exist (or is not complete)
     * @throws IOException on any other failure
     */
    public CertificateResource load(String issuerKey, String domain) throws IOException {
        String name = DomainNames.toAscii(domain);
        return strategyFor(name).load(issuerKey, name);
    }

    /**
     * Read only the private key, e.g. to reuse it on renewal. Same precedence as {@link #load(String, String)}.
     */
    public byte[] loadPrivateKey(String issuerKey, String domain) throws IOException {
        String name = DomainNames.toAscii(domain);
        return strategyFor(name).loadPrivateKey(issuerKey, name);
    }

    /**
     * A legacy certificate exists only if all its three keys exist. Never fails: an invalid name does not exist.
     */
    public boolean exists(String issuerKey, String domain) {
        String name;
        try {
            name = DomainNames.toAscii(domain);
        } catch (DomainNormalizationException err) {
            LOG.debug("{}", err.getMessage());
            return false;
        }
        return strategyFor(name).exists(issuerKey, name);
    }

    /**
     * Delete both the bundle and the legacy keys, whatever the mode: the certificate may have been written under
     * another mode. Then the site folder is removed, if empty.
     *
     * @throws IOException the first deletion failure, with the others as suppressed exceptions
     */
    public void delete(String issuerKey, String domain) throws IOException {
        String name = DomainNames.toAscii(domain);
        IOException failure = null;
        try {
            bundle.delete(issuerKey, name);
        } catch (IOException err) {
            failure = err;
        }
        try {
            legacy.delete(issuerKey, name);
        } catch (IOException err) {
            if (failure == null) {
                failure = err;
            } else {
                failure.addSuppressed(err);
            }
        }

        String sitePrefix = StorageKeys.certsSitePrefix(issuerKey, name);
        if (storage.exists(sitePrefix)) {
            try {
                storage.delete(sitePrefix);
            } catch (IOException err) {
                CertkeeperLogger.debug("could not delete site folder {}: {}", sitePrefix, err.getMessage());
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Replace the issuer data of a stored certificate, leaving certificate and private key untouched. Nothing is
     * written if the updater fails.
     *
     * @param issuerKey the issuer owning the certificate
     * @param domain the names key of the certificate
     * @param updater computes the new issuer data from the current one
     * @throws IOException if the certificate cannot be loaded or saved, or the updater fails
     */
    public void updateMetadata(String issuerKey, String domain, IssuerDataUpdater updater) throws IOException {
        String name = DomainNames.toAscii(domain);
        CertificateResource current;
        try {
            current = load(issuerKey, name);
        } catch (IOException err) {
            throw wrap("loading certificate for metadata update", err);
        }
        byte[] issuerData;
        try {
            issuerData = updater.update(current.getIssuerData());
        } catch (IOException err) {
            throw new IOException("updating metadata of " + name + ": " + err.getMessage(), err);
        }
        save(issuerKey, current.withIssuerData(issuerData));
    }

    /**
     * Park the private key of a certificate aside and delete the certificate, forcing the next issuance to use a
     * new key. Irreversible.
     */
    public void moveCompromisedKey(String issuerKey, String domain) throws IOException {
        String name = DomainNames.toAscii(domain);
        StorageStrategy strategy = strategyFor(name);

        byte[] privateKey;
        try {
            privateKey = strategy.loadPrivateKey(issuerKey, name);
        } catch (IOException err) {
            throw wrap("loading private key", err);
        }

        String compromisedKey = strategy.compromisedKeyLocation(issuerKey, name);
        try {
            storage.store(compromisedKey, privateKey);
        } catch (IOException err) {
            throw new IOException("storing compromised key " + compromisedKey + ": " + err.getMessage(), err);
        }

        try {
            delete(issuerKey, name);
        } catch (IOException err) {
            throw new IOException("deleting certificate with compromised key: " + err.getMessage(), err);
        }
        LOG.info("moved compromised private key of {} (issuer {}) to {}", domain, issuerKey, compromisedKey);
    }

    /**
     * Convert a certificate to the bundle format, whatever the mode of the store. The legacy keys are removed only
     * once the bundle is written.
     *
     * @return true if the certificate was converted, false if it already was a bundle
     * @throws KeyNotFoundException if there is no certificate to migrate
     * @throws IOException on any other failure, a certificate missing its private key or metadata included
     */
    public boolean migrate(String issuerKey, String domain) throws IOException {
        String name = DomainNames.toAscii(domain);
        if (bundle.exists(issuerKey, name)) {
            LOG.debug("{} already migrated", name);
            return false;
        }
        String certKey = StorageKeys.siteCert(issuerKey, name);
        if (!storage.exists(certKey)) {
            throw new KeyNotFoundException(certKey);
        }

        CertificateResource res;
        try {
            res = legacy.load(issuerKey, name);
        } catch (IOException err) {
            // the certificate is there: a missing key or metadata is a torn write, not "nothing to migrate"
            throw new IOException("loading legacy certificate: " + err.getMessage(), err);
        }
        try {
            bundle.save(issuerKey, name, res);
        } catch (IOException err) {
            throw new IOException("saving as bundle: " + err.getMessage(), err);
        }
        legacy.deleteQuietly(issuerKey, name);

        LOG.info("migrated certificate {} (issuer {}) to bundle format", domain, issuerKey);
        return true;
    }

    /**
     * {@link #migrate(String, String) Migrate} every certificate of an issuer. A failure on a certificate does not
     * stop the others.
     *
     * @param issuerKey the issuer
     * @return counts of migrated, skipped and failed certificates
     * @throws IOException if the certificates cannot be listed
     */
    public MigrationReport migrateAll(String issuerKey) throws IOException {
        MigrationReport report = new MigrationReport(issuerKey);
        String certsPrefix = StorageKeys.certsPrefix(issuerKey);
        List<String> items;
        try {
            items = storage.list(certsPrefix, false);
        } catch (KeyNotFoundException err) {
            LOG.info("no certificates to migrate for issuer {}", issuerKey);
            return report;
        } catch (IOException err) {
            throw new IOException("listing certificates: " + err.getMessage(), err);
        }

        for (String item : items) {
            if (item.endsWith(StorageKeys.BUNDLE_SUFFIX) || item.endsWith(StorageKeys.COMPROMISED_SUFFIX)) {
                report.skipped();
                continue;
            }
            String domain = item.substring(certsPrefix.length() + 1);
            try {
                if (migrate(issuerKey, domain)) {
                    report.migrated();
                } else {
                    report.skipped();
                }
            } catch (KeyNotFoundException err) {
                report.skipped();
            } catch (IOException err) {
                LOG.error("failed to migrate certificate {}", domain, err);
                report.failed(domain);
            }
        }

        LOG.info("migration complete for issuer {}: migrated={}, skipped={}, failed={}",
                issuerKey, report.getMigrated(), report.getSkipped(), report.getFailed());
        return report;
    }

    private static IOException wrap(String operation, IOException err) {
        if (err instanceof KeyNotFoundException) {
            return err; // keep it recognizable by callers
        }
        return new IOException(operation + ": " + err.getMessage(), err);
    }
}
