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
package org.certkeeper.launcher;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;
import java.util.logging.LogManager;
import org.certkeeper.certificates.CertificateStore;
import org.certkeeper.certificates.MigrationReport;
import org.certkeeper.certificates.StorageKeys;
import org.certkeeper.certificates.StorageModeConfiguration;
import org.certkeeper.cluster.CertificateLocks;
import org.certkeeper.cluster.LockLeaseRenewer;
import org.certkeeper.configstore.ConfigurationNotValidException;
import org.certkeeper.configstore.ConfigurationStore;
import org.certkeeper.configstore.PropertiesConfigurationStore;
import org.certkeeper.storage.FileStorage;
import org.certkeeper.storage.Storage;
import org.certkeeper.storage.ZooKeeperStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Migrates the certificates of some issuers to the bundle format.
 * <p>
 * Usage: {@code MigrationMain [config.properties] [issuer...]}. The configuration defaults to
 * {@code conf/certkeeper.properties}; without issuers on the command line the {@value #ISSUERS_PROPERTY} property
 * is used. Each issuer is migrated holding a storage lock, so that concurrent runs do not overlap.
 */
public class MigrationMain implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationMain.class);

    public static final String DEFAULT_CONFIG_FILE = "conf/certkeeper.properties";
    public static final String STORAGE_TYPE_PROPERTY = "storage.type";
    public static final String STORAGE_FILE_PATH_PROPERTY = "storage.file.path";
    public static final String ZOOKEEPER_BASE_PATH_PROPERTY = "storage.zookeeper.basepath";
    public static final String ISSUERS_PROPERTY = "migration.issuers";
    public static final String LOCK_TIMEOUT_PROPERTY = "migration.lock.timeout";

    private final ConfigurationStore configuration;
    private final Path basePath;
    private Storage storage;
    private LockLeaseRenewer leaseRenewer;

    public MigrationMain(ConfigurationStore configuration, Path basePath) {
        this.configuration = configuration;
        this.basePath = basePath;
    }

    public static void main(String... args) {
        List<String> issuers = new ArrayList<>(Arrays.asList(args));
        Path configFile = Paths.get(DEFAULT_CONFIG_FILE).toAbsolutePath();
        if (!issuers.isEmpty() && issuers.get(0).endsWith(".properties")) {
            configFile = Paths.get(issuers.remove(0)).toAbsolutePath();
        }

        int exitCode;
        try {
            LogManager.getLogManager().readConfiguration();

            Properties properties = new Properties();
            Path basePath = Paths.get(System.getProperty("user.dir", ".")).toAbsolutePath();
            if (Files.isRegularFile(configFile)) {
                LOG.info("Reading configuration from {}", configFile);
                try (Reader reader = new InputStreamReader(Files.newInputStream(configFile), StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
                if (configFile.getParent() != null && configFile.getParent().getParent() != null) {
                    basePath = configFile.getParent().getParent();
                }
            } else {
                LOG.info("No configuration file {}, using defaults", configFile);
            }

            Thread.setDefaultUncaughtExceptionHandler((Thread thread, Throwable err) -> {
                LOG.error("Uncaught error, thread {}", thread, err);
            });

            try (MigrationMain migration = new MigrationMain(new PropertiesConfigurationStore(properties), basePath)) {
                migration.start();
                exitCode = migration.migrate(issuers) ? 0 : 2;
            }
        } catch (Exception err) {
            LOG.error("Migration failed", err);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Build the configured storage.
     *
     * @throws ConfigurationNotValidException if the storage configuration is not valid
     * @throws IOException if the storage cannot be reached
     */
    public void start() throws ConfigurationNotValidException, IOException {
        storage = buildStorage(configuration, basePath);
        long obtainTimeout = configuration.getLong(LockLeaseRenewer.CERT_OBTAIN_TIMEOUT_PROPERTY,
                LockLeaseRenewer.DEFAULT_CERT_OBTAIN_TIMEOUT.getSeconds());
        leaseRenewer = new LockLeaseRenewer(Duration.ofSeconds(obtainTimeout));
    }

    static Storage buildStorage(ConfigurationStore configuration, Path basePath)
            throws ConfigurationNotValidException, IOException {
        String type = configuration.getString(STORAGE_TYPE_PROPERTY, "file");
        switch (type) {
            case "file": {
                Path path = Paths.get(configuration.getString(STORAGE_FILE_PATH_PROPERTY, "certificates-storage"));
                if (!path.isAbsolute()) {
                    path = basePath.resolve(path);
                }
                LOG.info("storage.type=file, path={}", path);
                return new FileStorage(path);
            }
            case "zookeeper": {
                String zkAddress = configuration.getString("zkAddress", "localhost:2181");
                int zkTimeout = configuration.getInt("zkTimeout", 40_000);
                boolean zkAcl = configuration.getBoolean("zkAcl", false);
                String zkBasePath = configuration.getString(ZOOKEEPER_BASE_PATH_PROPERTY, ZooKeeperStorage.DEFAULT_BASE_PATH);
                Properties zkProperties = new Properties(configuration.asProperties("zookeeper"));
                LOG.info("storage.type=zookeeper, zkAddress='{}', zkTimeout={}, zkAcl={}, basePath='{}'",
                        zkAddress, zkTimeout, zkAcl, zkBasePath);
                ZooKeeperStorage zkStorage = new ZooKeeperStorage(zkAddress, zkTimeout, zkAcl, zkBasePath, zkProperties);
                zkStorage.start();
                return zkStorage;
            }
            default:
                throw new ConfigurationNotValidException("Invalid " + STORAGE_TYPE_PROPERTY + " '" + type
                        + "', only 'file' and 'zookeeper' are supported");
        }
    }

    /**
     * Migrate every certificate of the given issuers, or of the configured ones if none is given.
     *
     * @return true if every certificate was migrated or skipped
     * @throws Exception if an issuer cannot be processed at all
     */
    public boolean migrate(List<String> issuers) throws Exception {
        List<String> targets = issuers;
        if (targets.isEmpty()) {
            targets = new ArrayList<>(new TreeSet<>(configuration.getValues(ISSUERS_PROPERTY)));
        }
        if (targets.isEmpty()) {
            throw new ConfigurationNotValidException("No issuers to migrate, pass them as arguments or set "
                    + ISSUERS_PROPERTY);
        }

        CertificateStore store = new CertificateStore(storage, StorageModeConfiguration.fromConfiguration(configuration));
        Duration lockTimeout = Duration.ofSeconds(configuration.getLong(LOCK_TIMEOUT_PROPERTY, 60));
        boolean successful = true;
        for (String issuer : targets) {
            MigrationReport report = CertificateLocks.executeInLock(storage, leaseRenewer,
                    migrationLockKey(issuer), lockTimeout, () -> store.migrateAll(issuer));
            LOG.info("{}", report);
            if (!report.isSuccessful()) {
                LOG.error("Failed to migrate {} certificates of issuer {}: {}",
                        report.getFailed(), issuer, report.getFailedDomains());
                successful = false;
            }
        }
        return successful;
    }

    static String migrationLockKey(String issuer) {
        return "migrate_" + StorageKeys.safe(issuer);
    }

    public Storage getStorage() {
        return storage;
    }

    @Override
    public void close() {
        if (leaseRenewer != null) {
            leaseRenewer.close();
            leaseRenewer = null;
        }
        if (storage instanceof ZooKeeperStorage) {
            ((ZooKeeperStorage) storage).close();
        }
        storage = null;
    }
}
